package com.codefarm.shorturl.web.dto;

import com.codefarm.shorturl.domain.DisableReason;

public record DisableRequest(DisableReason reason, String adminNotes) {
}
