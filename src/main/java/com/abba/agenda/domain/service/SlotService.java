package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.BulkSlotUpdateResult;
import com.abba.agenda.application.dto.SlotGenerationRequest;
import com.abba.agenda.application.dto.SlotGenerationResult;
import com.abba.agenda.application.dto.SlotStatistics;
import com.abba.agenda.application.dto.SlotStatusUpdate;
import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.SlotStatus;
import com.abba.agenda.domain.model.User;

import java.time.LocalDate;
import java.util.List;

public interface SlotService {

    SlotGenerationResult generateSlots(User actor, String doctorId, SlotGenerationRequest request);

    int generateRange(DoctorSchedule schedule, LocalDate startDate, LocalDate endDate, boolean overrideExisting);

    List<AvailabilitySlot> listSlots(String doctorId, LocalDate date, SlotStatus status);

    List<AvailabilitySlot> availableSlots(String doctorId, LocalDate date);

    List<AvailabilitySlot> upcomingAvailableSlots(String doctorId);

    AvailabilitySlot blockSlot(User actor, String slotId, String reason);

    AvailabilitySlot unblockSlot(User actor, String slotId);

    BulkSlotUpdateResult bulkUpdate(User actor, List<SlotStatusUpdate> updates);

    SlotStatistics statistics(String doctorId, LocalDate date);
}
