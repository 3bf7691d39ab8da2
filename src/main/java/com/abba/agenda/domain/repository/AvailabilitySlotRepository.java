package com.abba.agenda.domain.repository;

import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.SlotStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface AvailabilitySlotRepository extends MongoRepository<AvailabilitySlot, String> {

    boolean existsByDoctorIdAndScheduleIdAndDate(String doctorId, String scheduleId, LocalDate date);

    List<AvailabilitySlot> findByDoctorIdAndScheduleIdAndDate(String doctorId, String scheduleId, LocalDate date);

    long deleteByDoctorIdAndScheduleIdAndDateAndStatus(String doctorId, String scheduleId, LocalDate date, SlotStatus status);

    long countByScheduleIdAndDateGreaterThanEqualAndStatusIn(String scheduleId, LocalDate date, Collection<SlotStatus> statuses);

    long countByDoctorIdAndDateAndStatus(String doctorId, LocalDate date, SlotStatus status);

    List<AvailabilitySlot> findByDoctorIdAndDateOrderByStartTimeAsc(String doctorId, LocalDate date);

    List<AvailabilitySlot> findByDoctorIdAndDateAndStatusOrderByStartTimeAsc(String doctorId, LocalDate date, SlotStatus status);

    List<AvailabilitySlot> findByDoctorIdAndStatusOrderByDateAscStartTimeAsc(String doctorId, SlotStatus status);

    List<AvailabilitySlot> findByDoctorIdAndDateBetweenAndStatusOrderByDateAscStartTimeAsc(
            String doctorId, LocalDate from, LocalDate to, SlotStatus status
    );
}
