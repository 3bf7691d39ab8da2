package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.domain.exception.CollaboratorException;
import com.abba.agenda.domain.exception.FailureKind;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.repository.UserRepository;
import com.abba.agenda.infrastructure.config.NotificationProperties;
import com.abba.agenda.infrastructure.notification.MailNotificationSender;
import com.abba.agenda.infrastructure.notification.SmsGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.Optional;

import static com.abba.agenda.support.TestFixtures.TODAY;
import static com.abba.agenda.support.TestFixtures.doctor;
import static com.abba.agenda.support.TestFixtures.patient;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NotificationServiceImplTest {

    private final UserRepository userRepository = mock(UserRepository.class);
    private final MailNotificationSender mailSender = mock(MailNotificationSender.class);
    private final SmsGateway smsGateway = mock(SmsGateway.class);
    private final NotificationProperties properties = new NotificationProperties();
    private final NotificationServiceImpl notificationService =
            new NotificationServiceImpl(userRepository, mailSender, smsGateway, properties);
    private final Appointment appointment = new Appointment();

    @BeforeEach
    void setUp() {
        appointment.setAppointmentId("APT-1");
        appointment.setPatientId("p1");
        appointment.setDoctorId("doc-1");
        appointment.setDate(TODAY);
        appointment.setStartTime("09:00");
        appointment.setEndTime("09:30");
        when(userRepository.findById("p1")).thenReturn(Optional.of(patient("p1")));
        when(userRepository.findById("doc-1")).thenReturn(Optional.of(doctor("doc-1", "cardiology", 8)));
    }

    @Test
    void mailsBothPartiesWithAppointmentDetails() {
        NotificationResult result = notificationService.sendBookingConfirmation(appointment);

        assertTrue(result.patientEmail());
        assertTrue(result.doctorEmail());
        assertFalse(result.smsSent());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> details = ArgumentCaptor.forClass(Map.class);
        verify(mailSender).send(eq("p1@example.com"), eq("Appointment booked"), eq("Patient p1"), details.capture());
        assertEquals("APT-1", details.getValue().get("Appointment No"));
        assertEquals("09:00 - 09:30", details.getValue().get("Time"));
        verify(mailSender).send(eq("doc-1@clinic.example.com"), anyString(), eq("Dr doc-1"), anyMap());
        verifyNoInteractions(smsGateway);
    }

    @Test
    void textsWhenSmsIsEnabled() {
        properties.setSmsEnabled(true);

        NotificationResult result = notificationService.sendCancellationNotification(appointment);

        assertTrue(result.patientSms());
        assertFalse(result.doctorSms());
        verify(smsGateway).send(eq(patient("p1").getPhone()), eq("Appointment APT-1 on 2024-06-03 at 09:00 was cancelled."));
    }

    @Test
    void oneFailedRecipientDoesNotFailTheCall() {
        doThrow(new CollaboratorException(FailureKind.BUSINESS_REJECTION, "bad address"))
                .when(mailSender).send(eq("p1@example.com"), anyString(), anyString(), anyMap());

        NotificationResult result = notificationService.sendAppointmentReminder(appointment);

        assertFalse(result.patientEmail());
        assertTrue(result.doctorEmail());
        assertTrue(result.emailSent());
    }

    @Test
    void failsWhenEveryDeliveryFails() {
        doThrow(new CollaboratorException(FailureKind.NETWORK, "smtp down"))
                .when(mailSender).send(anyString(), anyString(), anyString(), anyMap());

        CollaboratorException error = assertThrows(CollaboratorException.class,
                () -> notificationService.sendBookingConfirmation(appointment));

        assertEquals(FailureKind.NETWORK, error.getKind());
    }

    @Test
    void missingUsersAreSkipped() {
        when(userRepository.findById(any())).thenReturn(Optional.empty());

        NotificationResult result = notificationService.sendBookingConfirmation(appointment);

        assertFalse(result.emailSent());
        verifyNoInteractions(mailSender);
    }
}
