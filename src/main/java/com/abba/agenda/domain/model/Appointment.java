package com.abba.agenda.domain.model;

import com.abba.agenda.domain.exception.SchedulingException;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A patient's reservation of one slot. Date and times are copied from the slot at booking time
 * so the history stays readable after the slot is released or regenerated.
 * <p>
 * Transitions do not read the wall clock; {@code updatedAt} is stamped by the service that
 * persists the change.
 */
@Document(collection = "appointments")
@CompoundIndexes({
        @CompoundIndex(name = "patient_date_idx", def = "{'patientId': 1, 'date': -1}"),
        @CompoundIndex(name = "doctor_date_idx", def = "{'doctorId': 1, 'date': -1}"),
        @CompoundIndex(name = "status_date_idx", def = "{'status': 1, 'date': 1}"),
        @CompoundIndex(name = "patient_idempotency_idx", def = "{'patientId': 1, 'idempotencyKey': 1}")
})
@Data
public class Appointment {

    @Id
    private String id;

    @Indexed(unique = true)
    private String appointmentId;
    private String slotId;
    private String patientId;
    private String doctorId;

    private LocalDate date;
    private String startTime;
    private String endTime;

    private AppointmentStatus status = AppointmentStatus.PENDING;
    private BookingType bookingType = BookingType.ONLINE;
    private String reason;
    private List<String> symptoms = new ArrayList<>();
    private String notes;

    private PaymentInfo payment = new PaymentInfo();
    private CancellationInfo cancellation = new CancellationInfo();
    private NotificationFlags notifications = new NotificationFlags();

    private String idempotencyKey;
    private String source = "api";

    @Version
    private Long version;

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static Appointment forSlot(AvailabilitySlot slot, String appointmentId, String patientId) {
        Appointment appointment = new Appointment();
        appointment.setAppointmentId(appointmentId);
        appointment.setSlotId(slot.getId());
        appointment.setPatientId(patientId);
        appointment.setDoctorId(slot.getDoctorId());
        appointment.setDate(slot.getDate());
        appointment.setStartTime(slot.getStartTime());
        appointment.setEndTime(slot.getEndTime());
        return appointment;
    }

    public LocalDateTime startDateTime() {
        return date.atTime(WallClock.toLocalTime(startTime));
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public void markPaymentInitiated(String transactionId, String paymentUrl) {
        payment.advanceTo(PaymentStatus.PENDING);
        payment.setTransactionId(transactionId);
        payment.setPaymentUrl(paymentUrl);
    }

    public void markAsPaid(String transactionId, PaymentMethod method, OffsetDateTime paidAt) {
        payment.advanceTo(PaymentStatus.PAID);
        payment.setTransactionId(transactionId);
        if (method != null) {
            payment.setPaymentMethod(method);
        }
        payment.setPaidAt(paidAt);
        if (status == AppointmentStatus.PENDING) {
            status = AppointmentStatus.CONFIRMED;
        }
    }

    /**
     * Cancels the appointment. A refund is only recorded when the payment was captured and
     * the amount is positive.
     */
    public void cancel(String actorId, String reason, OffsetDateTime cancelledAt, BigDecimal refundAmount) {
        if (!isActive()) {
            throw SchedulingException.invalidState("Appointment cannot be cancelled in status " + status);
        }
        status = AppointmentStatus.CANCELLED;
        cancellation.setCancelledBy(actorId);
        cancellation.setReason(reason);
        cancellation.setCancelledAt(cancelledAt);
        if (payment.isPaid() && refundAmount != null && refundAmount.signum() > 0) {
            cancellation.setRefundAmount(refundAmount);
            cancellation.setRefundStatus(RefundStatus.PENDING);
        }
        touch(cancelledAt);
    }

    public void markRefunded(boolean processed) {
        if (processed) {
            cancellation.setRefundStatus(RefundStatus.PROCESSED);
            payment.advanceTo(PaymentStatus.REFUNDED);
        } else {
            cancellation.setRefundStatus(RefundStatus.FAILED);
        }
    }

    public void complete() {
        if (status != AppointmentStatus.CONFIRMED) {
            throw SchedulingException.invalidState("Only confirmed appointments can be completed");
        }
        status = AppointmentStatus.COMPLETED;
    }

    public void touch(OffsetDateTime at) {
        this.updatedAt = at;
    }
}
