package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.application.dto.PaymentConfirmationResult;
import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.ErrorKind;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.PaymentStatus;
import com.abba.agenda.domain.model.UserRole;
import com.abba.agenda.domain.repository.AppointmentRepository;
import com.abba.agenda.domain.service.NotificationService;
import com.abba.agenda.domain.service.PaymentGateway;
import com.abba.agenda.infrastructure.config.NotificationProperties;
import com.abba.agenda.infrastructure.lock.DistributedLockService;
import com.abba.agenda.support.InMemoryCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static com.abba.agenda.support.TestFixtures.CLOCK;
import static com.abba.agenda.support.TestFixtures.NO_SLEEP;
import static com.abba.agenda.support.TestFixtures.TODAY;
import static com.abba.agenda.support.TestFixtures.doctor;
import static com.abba.agenda.support.TestFixtures.lockProperties;
import static com.abba.agenda.support.TestFixtures.patient;
import static com.abba.agenda.support.TestFixtures.retryExecutor;
import static com.abba.agenda.support.TestFixtures.retryPolicies;
import static com.abba.agenda.support.TestFixtures.withRole;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AppointmentServiceImplTest {

    private final AppointmentRepository appointmentRepository = mock(AppointmentRepository.class);
    private final PaymentGateway paymentGateway = mock(PaymentGateway.class);
    private final NotificationService notificationService = mock(NotificationService.class);
    private final DistributedLockService lockService =
            new DistributedLockService(new InMemoryCacheStore(CLOCK), lockProperties(), NO_SLEEP, CLOCK);
    private final AppointmentServiceImpl appointmentService = new AppointmentServiceImpl(
            appointmentRepository, new AppointmentUpdater(appointmentRepository, lockService, lockProperties(), CLOCK),
            paymentGateway, notificationService, new NotificationProperties(),
            retryExecutor(), retryPolicies(), new AccessPolicy(), CLOCK);

    private Appointment appointment;

    @BeforeEach
    void setUp() {
        appointment = new Appointment();
        appointment.setAppointmentId("APT-1");
        appointment.setSlotId("slot-1");
        appointment.setPatientId("p1");
        appointment.setDoctorId("doc-1");
        appointment.setDate(TODAY.plusDays(1));
        appointment.setStartTime("10:00");
        appointment.setEndTime("10:30");
        appointment.getPayment().setTransactionId("TXN-1");
        when(appointmentRepository.findByAppointmentIdAndPatientIdAndStatusIn(eq("APT-1"), eq("p1"), anyCollection()))
                .thenAnswer(inv -> Optional.of(appointment).filter(Appointment::isActive));
        when(appointmentRepository.findByAppointmentId("APT-1")).thenReturn(Optional.of(appointment));
        when(appointmentRepository.save(any(Appointment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void confirmingPaymentConfirmsTheAppointment() {
        OffsetDateTime paidAt = OffsetDateTime.parse("2024-06-03T08:05:00Z");
        when(paymentGateway.confirmPayment(appointment, "TXN-1"))
                .thenReturn(new PaymentGateway.PaymentConfirmation(true, "TXN-1", paidAt));

        PaymentConfirmationResult result = appointmentService.confirmPayment(patient("p1"), "APT-1", null, PaymentMethod.INSURANCE);

        assertFalse(result.alreadyConfirmed());
        assertEquals(AppointmentStatus.CONFIRMED, result.appointment().getStatus());
        assertEquals(PaymentStatus.PAID, result.appointment().getPayment().getStatus());
        assertEquals(PaymentMethod.INSURANCE, result.appointment().getPayment().getPaymentMethod());
        assertEquals(paidAt, result.appointment().getPayment().getPaidAt());
    }

    @Test
    void cancellationWhileProviderConfirmsIsKept() {
        when(paymentGateway.confirmPayment(any(), anyString())).thenAnswer(inv -> {
            appointment.cancel("p1", "changed plans", OffsetDateTime.now(CLOCK), null);
            return new PaymentGateway.PaymentConfirmation(true, "TXN-1", null);
        });

        SchedulingException error = assertThrows(SchedulingException.class,
                () -> appointmentService.confirmPayment(patient("p1"), "APT-1", null, PaymentMethod.CARD));

        assertEquals(ErrorKind.INVALID_STATE, error.getKind());
        assertEquals(AppointmentStatus.CANCELLED, appointment.getStatus());
        assertEquals(PaymentStatus.PENDING, appointment.getPayment().getStatus());
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void paymentRecordedByAnotherRequestIsReportedAsAlreadyConfirmed() {
        OffsetDateTime earlier = OffsetDateTime.parse("2024-06-03T07:59:00Z");
        when(paymentGateway.confirmPayment(any(), anyString())).thenAnswer(inv -> {
            appointment.markAsPaid("TXN-1", PaymentMethod.CARD, earlier);
            return new PaymentGateway.PaymentConfirmation(true, "TXN-1", null);
        });

        PaymentConfirmationResult result = appointmentService.confirmPayment(patient("p1"), "APT-1", null, PaymentMethod.INSURANCE);

        assertTrue(result.alreadyConfirmed());
        assertEquals(earlier, result.appointment().getPayment().getPaidAt());
        assertEquals(PaymentMethod.CARD, result.appointment().getPayment().getPaymentMethod());
    }

    @Test
    void confirmingTwiceIsANoOp() {
        when(paymentGateway.confirmPayment(any(), anyString()))
                .thenReturn(new PaymentGateway.PaymentConfirmation(true, "TXN-1", null));
        appointmentService.confirmPayment(patient("p1"), "APT-1", "TXN-1", null);

        PaymentConfirmationResult again = appointmentService.confirmPayment(patient("p1"), "APT-1", "TXN-1", null);

        assertTrue(again.alreadyConfirmed());
        verify(paymentGateway, times(1)).confirmPayment(any(), anyString());
        verify(appointmentRepository, times(1)).save(any());
    }

    @Test
    void unpaidOrUnreachableGatewayIsUpstreamFailure() {
        when(paymentGateway.confirmPayment(any(), anyString()))
                .thenReturn(new PaymentGateway.PaymentConfirmation(false, "TXN-1", null));
        assertEquals(ErrorKind.UPSTREAM_FAILURE, assertThrows(SchedulingException.class,
                () -> appointmentService.confirmPayment(patient("p1"), "APT-1", null, null)).getKind());

        when(paymentGateway.confirmPayment(any(), anyString()))
                .thenThrow(new CollaboratorException(FailureKind.TIMEOUT, "read timed out"));
        SchedulingException error = assertThrows(SchedulingException.class,
                () -> appointmentService.confirmPayment(patient("p1"), "APT-1", null, null));
        assertEquals(ErrorKind.UPSTREAM_FAILURE, error.getKind());
        assertInstanceOf(CollaboratorException.class, error.getCause());
        assertEquals(PaymentStatus.PENDING, appointment.getPayment().getStatus());
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void missingTransactionIdIsRejected() {
        appointment.getPayment().setTransactionId(null);

        assertEquals(ErrorKind.INVALID_RANGE, assertThrows(SchedulingException.class,
                () -> appointmentService.confirmPayment(patient("p1"), "APT-1", " ", null)).getKind());
        verifyNoInteractions(paymentGateway);
    }

    @Test
    void cancelledAppointmentCannotBeConfirmed() {
        appointment.setStatus(AppointmentStatus.CANCELLED);

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(SchedulingException.class,
                () -> appointmentService.confirmPayment(patient("p1"), "APT-1", "TXN-1", null)).getKind());
    }

    @Test
    void onlyTheTreatingDoctorCompletesConfirmedAppointments() {
        assertEquals(ErrorKind.INVALID_STATE, assertThrows(SchedulingException.class,
                () -> appointmentService.completeAppointment(doctor("doc-1", "cardiology", 3), "APT-1")).getKind());

        appointment.setStatus(AppointmentStatus.CONFIRMED);
        assertEquals(ErrorKind.FORBIDDEN, assertThrows(SchedulingException.class,
                () -> appointmentService.completeAppointment(doctor("doc-2", "cardiology", 3), "APT-1")).getKind());
        assertEquals(ErrorKind.FORBIDDEN, assertThrows(SchedulingException.class,
                () -> appointmentService.completeAppointment(withRole("staff-1", UserRole.STAFF), "APT-1")).getKind());

        Appointment completed = appointmentService.completeAppointment(doctor("doc-1", "cardiology", 3), "APT-1");
        assertEquals(AppointmentStatus.COMPLETED, completed.getStatus());
        assertEquals(OffsetDateTime.now(CLOCK), completed.getUpdatedAt());
    }

    @Test
    void remindersFlagOnlyDeliveredAppointments() {
        Appointment other = new Appointment();
        other.setAppointmentId("APT-2");
        other.setPatientId("p2");
        when(appointmentRepository.findByDateAndStatusInAndNotificationsReminderSentFalse(eq(TODAY.plusDays(1)), anyCollection()))
                .thenReturn(List.of(appointment, other));
        when(notificationService.sendAppointmentReminder(appointment))
                .thenReturn(new NotificationResult(true, false, false, false));
        when(notificationService.sendAppointmentReminder(other))
                .thenThrow(new CollaboratorException(FailureKind.BUSINESS_REJECTION, "mailbox rejected"));

        int sent = appointmentService.sendDueReminders();

        assertEquals(1, sent);
        assertTrue(appointment.getNotifications().isReminderSent());
        assertFalse(other.getNotifications().isReminderSent());
        verify(appointmentRepository, times(1)).save(appointment);
        verify(appointmentRepository, never()).save(other);
    }

    @Test
    void foreignAppointmentIsNotVisible() {
        when(appointmentRepository.findByAppointmentIdAndPatientId("APT-1", "p2")).thenReturn(Optional.empty());

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(SchedulingException.class,
                () -> appointmentService.getAppointment(patient("p2"), "APT-1")).getKind());
    }
}
