package com.abba.agenda.application.dto;

public record CancellationRequest(String reason) {

    public static final String DEFAULT_REASON = "Patient cancelled";

    public String reasonOrDefault() {
        return reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
    }
}
