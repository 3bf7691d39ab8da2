package com.abba.agenda.application.service;

import com.abba.agenda.infrastructure.config.CancellationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Refund tiers by notice given: full refund from {@code fullRefundHours} out, the partial percentage
 * from the cancellation cutoff, nothing below it.
 */
@Component
@RequiredArgsConstructor
public class RefundPolicy {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final CancellationProperties cancellationProperties;

    public BigDecimal refundAmount(BigDecimal paid, Duration timeUntilAppointment) {
        if (paid == null || paid.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        long minutes = timeUntilAppointment.toMinutes();
        if (minutes >= cancellationProperties.getFullRefundHours() * 60L) {
            return paid;
        }
        if (minutes >= cancellationProperties.getCutoffHours() * 60L) {
            return paid.multiply(BigDecimal.valueOf(cancellationProperties.getPartialRefundPercent()))
                    .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        }
        return BigDecimal.ZERO;
    }
}
