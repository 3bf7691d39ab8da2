package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.BookingRequest;
import com.abba.agenda.application.dto.RescheduleResult;
import com.abba.agenda.domain.model.User;

public interface RescheduleService {

    RescheduleResult reschedule(User patient, String appointmentId, String newSlotId, BookingRequest request);
}
