package com.abba.agenda.application.dto;

public record NotificationResult(
        boolean patientEmail,
        boolean doctorEmail,
        boolean patientSms,
        boolean doctorSms
) {

    public boolean emailSent() {
        return patientEmail || doctorEmail;
    }

    public boolean smsSent() {
        return patientSms || doctorSms;
    }
}
