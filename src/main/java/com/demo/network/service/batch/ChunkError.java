package com.demo.network.service.batch;

import java.util.List;

/** One failed unit of work; its items can be re-run on their own. */
public record ChunkError(int chunkIndex, List<String> itemIds, String message) {

    public ChunkError {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }
}
