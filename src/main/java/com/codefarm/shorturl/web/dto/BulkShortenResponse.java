package com.codefarm.shorturl.web.dto;

import java.util.List;

public record BulkShortenResponse(
        List<Item> results,
        long succeeded,
        long failed
) {
    /**
     * One entry per submitted URL; {@code error} is set only when it was not created.
     */
    public record Item(
            int index,
            String shortCode,
            String shortUrl,
            String originalUrl,
            String error
    ) {
    }
}
