package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.NotificationResult;
import com.abba.agenda.domain.model.Appointment;

public interface NotificationService {

    NotificationResult sendBookingConfirmation(Appointment appointment);

    NotificationResult sendCancellationNotification(Appointment appointment);

    NotificationResult sendAppointmentReminder(Appointment appointment);
}
