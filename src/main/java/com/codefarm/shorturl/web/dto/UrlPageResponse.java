package com.codefarm.shorturl.web.dto;

import com.codefarm.shorturl.core.UrlStatistics;
import org.springframework.data.domain.Page;

import java.util.List;

public record UrlPageResponse(
        List<UrlStatistics> items,
        int page,
        int size,
        long totalItems,
        int totalPages
) {
    public static UrlPageResponse from(Page<UrlStatistics> page) {
        return new UrlPageResponse(page.getContent(), page.getNumber(), page.getSize(),
                page.getTotalElements(), page.getTotalPages());
    }
}
