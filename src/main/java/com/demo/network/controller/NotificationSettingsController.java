package com.demo.network.controller;

import com.demo.network.controller.dto.NotificationSettingsRequest;
import com.demo.network.model.NotificationSettings;
import com.demo.network.service.notification.NotificationSettingsService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "notifications")
@RestController
@RequestMapping("/api/accounts/{accountId}/users/{userId}/notification-settings")
@RequiredArgsConstructor
public class NotificationSettingsController {

    private final NotificationSettingsService settingsService;

    // Falls back to defaults when nothing was saved
    @GetMapping
    public NotificationSettings get(@PathVariable String accountId, @PathVariable String userId) {
        return settingsService.get(userId, accountId);
    }

    @PutMapping
    public NotificationSettings save(@PathVariable String accountId,
                                     @PathVariable String userId,
                                     @RequestBody NotificationSettingsRequest body) {
        return settingsService.save(body.toSettings(userId, accountId));
    }
}
