package com.abba.agenda.domain.model;

/**
 * Payment progress of an appointment. Moves forward only: {@code PENDING -> PAID -> REFUNDED}.
 * A declined initiation or confirmation leaves the payment {@code PENDING}.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    REFUNDED;

    public boolean canAdvanceTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PAID;
            case PAID -> target == REFUNDED;
            case REFUNDED -> false;
        };
    }
}
