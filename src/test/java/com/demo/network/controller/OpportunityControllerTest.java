package com.demo.network.controller;

import com.demo.network.config.GlobalExceptionHandler;
import com.demo.network.exception.ConflictException;
import com.demo.network.exception.NotFoundException;
import com.demo.network.exception.ValidationException;
import com.demo.network.model.ActualOutcome;
import com.demo.network.model.LearningSignal;
import com.demo.network.model.OpportunityCategory;
import com.demo.network.model.OpportunityStatus;
import com.demo.network.model.OpportunityType;
import com.demo.network.service.opportunity.OpportunityGenerationService;
import com.demo.network.service.opportunity.OpportunityLifecycleService;
import com.demo.network.service.tracking.FeedbackCommand;
import com.demo.network.service.tracking.RecalibrationService;
import com.demo.network.service.tracking.SuccessTrackingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.demo.network.support.Fixtures.suggestion;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpportunityController")
class OpportunityControllerTest {

    @Mock OpportunityGenerationService generationService;
    @Mock OpportunityLifecycleService lifecycleService;
    @Mock SuccessTrackingService trackingService;
    @Mock RecalibrationService recalibrationService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        OpportunityController controller = new OpportunityController(
                generationService, lifecycleService, trackingService, recalibrationService);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET returns the suggestion")
    void getOne() throws Exception {
        when(lifecycleService.get("s1")).thenReturn(suggestion("s1").build());

        mvc.perform(get("/api/opportunities/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("s1"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("unknown suggestion maps to 404")
    void notFound() throws Exception {
        when(lifecycleService.get("nope")).thenThrow(NotFoundException.of("Opportunity", "nope"));

        mvc.perform(get("/api/opportunities/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.path").value("/api/opportunities/nope"));
    }

    @Test
    @DisplayName("illegal transition maps to 409")
    void illegalTransition() throws Exception {
        when(lifecycleService.updateStatus("s1", OpportunityStatus.PENDING))
                .thenThrow(new ConflictException("Invalid status transition COMPLETED -> PENDING for opportunity s1"));

        mvc.perform(put("/api/opportunities/s1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"PENDING\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Invalid status transition COMPLETED -> PENDING for opportunity s1"));
    }

    @Test
    @DisplayName("missing status is rejected before reaching the service")
    void missingStatus() throws Exception {
        mvc.perform(put("/api/opportunities/s1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("dismiss moves the suggestion to REJECTED")
    void dismiss() throws Exception {
        when(lifecycleService.updateStatus("s1", OpportunityStatus.REJECTED))
                .thenReturn(suggestion("s1").status(OpportunityStatus.REJECTED).build());

        mvc.perform(post("/api/opportunities/s1/dismiss"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    @DisplayName("feedback returns the learning signal")
    void feedback() throws Exception {
        when(trackingService.recordFeedback(any())).thenReturn(new LearningSignal(
                OpportunityCategory.RECONNECTION, OpportunityType.DORMANT_RECONNECTION,
                0.8, 80, ActualOutcome.SUCCESS, 90, 5, true));

        mvc.perform(post("/api/opportunities/s1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"u1","rating":5,"actualOutcome":"SUCCESS",
                                 "actualImpact":90,"timeInvestedHours":2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<FeedbackCommand> captor = ArgumentCaptor.forClass(FeedbackCommand.class);
        verify(trackingService).recordFeedback(captor.capture());
        assertEquals("s1", captor.getValue().opportunityId());
        assertEquals(5, captor.getValue().rating());
    }

    @Test
    @DisplayName("rating outside 1..5 is a 400")
    void badRating() throws Exception {
        mvc.perform(post("/api/opportunities/s1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"rating\":9,\"actualOutcome\":\"SUCCESS\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(trackingService);
    }

    @Test
    @DisplayName("second feedback maps to 409")
    void duplicateFeedback() throws Exception {
        when(trackingService.recordFeedback(any()))
                .thenThrow(new ConflictException("Feedback already recorded for opportunity s1"));

        mvc.perform(post("/api/opportunities/s1/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u1\",\"rating\":3,\"actualOutcome\":\"NO_RESULT\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("service validation errors map to 400")
    void nonPositiveWindow() throws Exception {
        when(trackingService.computeMetrics("acct-1", 0))
                .thenThrow(new ValidationException("windowDays must be positive"));

        mvc.perform(get("/api/accounts/acct-1/metrics").param("windowDays", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("windowDays must be positive"));
    }

    @Test
    @DisplayName("non-numeric window is a 400")
    void badWindow() throws Exception {
        mvc.perform(get("/api/accounts/acct-1/metrics").param("windowDays", "month"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(trackingService);
    }
}
