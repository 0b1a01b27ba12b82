package com.codefarm.shorturl.web.dto;

import java.util.List;

public record BulkShortenRequest(
        List<ShortenRequest> urls
) {
}
