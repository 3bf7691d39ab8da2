package com.abba.agenda.domain.model;

import com.abba.agenda.domain.exception.SchedulingException;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
public class PaymentInfo {

    private BigDecimal amount = BigDecimal.ZERO;
    private String currency = "USD";
    private PaymentStatus status = PaymentStatus.PENDING;
    private String transactionId;
    private PaymentMethod paymentMethod;
    private String paymentUrl;
    private OffsetDateTime paidAt;

    public boolean isPaid() {
        return status == PaymentStatus.PAID;
    }

    public void advanceTo(PaymentStatus target) {
        if (status == target) {
            return;
        }
        if (!status.canAdvanceTo(target)) {
            throw SchedulingException.invalidState("Payment cannot move from " + status + " to " + target);
        }
        this.status = target;
    }
}
