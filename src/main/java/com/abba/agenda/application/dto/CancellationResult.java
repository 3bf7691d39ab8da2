package com.abba.agenda.application.dto;

import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.RefundStatus;

import java.math.BigDecimal;
import java.util.List;

public record CancellationResult(
        Appointment appointment,
        BigDecimal refundAmount,
        RefundStatus refundStatus,
        boolean refundProcessed,
        List<NonFatalError> warnings
) {
}
