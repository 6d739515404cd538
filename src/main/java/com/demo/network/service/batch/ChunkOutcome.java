package com.demo.network.service.batch;

import java.util.ArrayList;
import java.util.List;

/** Mutable tally handed to each chunk; only committed chunks are folded into the result. */
public final class ChunkOutcome {

    private int created;
    private boolean incomplete;
    private final List<String> notes = new ArrayList<>();

    public void created(int n) {
        created += n;
    }

    public void note(String message) {
        notes.add(message);
    }

    /** Marks the chunk as having skipped work; the batch then reports PARTIAL. */
    public void incomplete(String message) {
        incomplete = true;
        notes.add(message);
    }

    int created() {
        return created;
    }

    List<String> notes() {
        return notes;
    }

    boolean isIncomplete() {
        return incomplete;
    }
}
