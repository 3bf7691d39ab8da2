package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.CancellationRequest;
import com.abba.agenda.application.dto.CancellationResult;
import com.abba.agenda.domain.model.User;

public interface CancellationService {

    CancellationResult cancel(User patient, String appointmentId, CancellationRequest request);
}
