package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.PaymentConfirmationResult;
import com.abba.agenda.domain.model.Appointment;
import com.abba.agenda.domain.model.AppointmentStatus;
import com.abba.agenda.domain.model.PaymentMethod;
import com.abba.agenda.domain.model.User;

import java.util.List;

public interface AppointmentService {

    Appointment getAppointment(User patient, String appointmentId);

    List<Appointment> listAppointments(User patient, AppointmentStatus status);

    PaymentConfirmationResult confirmPayment(User patient, String appointmentId, String transactionId, PaymentMethod method);

    Appointment completeAppointment(User actor, String appointmentId);

    int sendDueReminders();
}
