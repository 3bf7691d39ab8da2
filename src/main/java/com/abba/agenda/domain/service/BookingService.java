package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.BookingRequest;
import com.abba.agenda.application.dto.BookingResult;
import com.abba.agenda.domain.model.User;

public interface BookingService {

    BookingResult book(User patient, String slotId, BookingRequest request);
}
