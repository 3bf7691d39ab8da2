package com.abba.agenda.domain.model;

import com.abba.agenda.domain.exception.SchedulingException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

import static com.abba.agenda.support.TestFixtures.CLOCK;
import static com.abba.agenda.support.TestFixtures.slot;
import static org.junit.jupiter.api.Assertions.*;

class AppointmentTest {

    private static final OffsetDateTime AT = OffsetDateTime.now(CLOCK);

    private final Appointment appointment = Appointment.forSlot(
            slot("s1", "doc-1", LocalDate.of(2024, 6, 10), "09:00", "09:30"), "APT-1", "p1");

    @Test
    void paymentConfirmsPendingAppointment() {
        appointment.markAsPaid("TXN-1", PaymentMethod.CARD, AT);

        assertEquals(AppointmentStatus.CONFIRMED, appointment.getStatus());
        assertEquals(PaymentStatus.PAID, appointment.getPayment().getStatus());
    }

    @Test
    void unpaidCancellationRecordsNoRefund() {
        appointment.cancel("p1", "changed plans", AT, new BigDecimal("100"));

        assertEquals(AppointmentStatus.CANCELLED, appointment.getStatus());
        assertNull(appointment.getCancellation().getRefundAmount());
        assertEquals(RefundStatus.NONE, appointment.getCancellation().getRefundStatus());
    }

    @Test
    void paidCancellationLeavesRefundPending() {
        appointment.markAsPaid("TXN-1", PaymentMethod.CARD, AT);

        appointment.cancel("p1", "changed plans", AT, new BigDecimal("50.00"));
        appointment.markRefunded(true);

        assertEquals(RefundStatus.PROCESSED, appointment.getCancellation().getRefundStatus());
        assertEquals(PaymentStatus.REFUNDED, appointment.getPayment().getStatus());
    }

    @Test
    void cancelledAppointmentCannotBeCancelledOrCompleted() {
        appointment.cancel("p1", "x", AT, BigDecimal.ZERO);

        assertThrows(SchedulingException.class, () -> appointment.cancel("p1", "y", AT, BigDecimal.ZERO));
        assertThrows(SchedulingException.class, appointment::complete);
    }

    @Test
    void paymentCannotMoveBackwards() {
        appointment.markAsPaid("TXN-1", PaymentMethod.CARD, AT);

        assertThrows(SchedulingException.class, () -> appointment.markPaymentInitiated("TXN-2", "url"));
    }

    @Test
    void cancellationStampsTheCancellationTime() {
        OffsetDateTime cancelledAt = AT.plusHours(1);

        appointment.cancel("p1", "changed plans", cancelledAt, BigDecimal.ZERO);

        assertEquals(cancelledAt, appointment.getUpdatedAt());
        assertEquals(cancelledAt, appointment.getCancellation().getCancelledAt());
    }
}
