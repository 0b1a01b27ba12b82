package com.codefarm.shorturl.core;

/**
 * Outcome of one item of a bulk create: either {@code created} or {@code error} is set.
 */
public record BulkCreateResult(
        int index,
        CreatedShortUrl created,
        String error
) {
    static BulkCreateResult success(int index, CreatedShortUrl created) {
        return new BulkCreateResult(index, created, null);
    }

    static BulkCreateResult failure(int index, String error) {
        return new BulkCreateResult(index, null, error);
    }

    public boolean succeeded() {
        return created != null;
    }
}
