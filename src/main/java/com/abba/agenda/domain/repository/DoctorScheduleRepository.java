package com.abba.agenda.domain.repository;

import com.abba.agenda.domain.model.DoctorSchedule;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

public interface DoctorScheduleRepository extends MongoRepository<DoctorSchedule, String> {

    boolean existsByDoctorIdAndDayOfWeek(String doctorId, DayOfWeek dayOfWeek);

    Optional<DoctorSchedule> findByIdAndDoctorId(String id, String doctorId);

    Optional<DoctorSchedule> findByIdAndDoctorIdAndActiveTrue(String id, String doctorId);

    List<DoctorSchedule> findByDoctorIdAndActiveTrueOrderByDayOfWeekAsc(String doctorId);
}
