package com.abba.agenda.domain.service;

import com.abba.agenda.application.dto.ScheduleRequest;
import com.abba.agenda.application.dto.ScheduleUpdate;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.User;

import java.util.List;

public interface ScheduleService {

    DoctorSchedule createSchedule(User actor, String doctorId, ScheduleRequest request);

    List<DoctorSchedule> listActiveSchedules(String doctorId);

    DoctorSchedule getSchedule(String doctorId, String scheduleId);

    DoctorSchedule updateSchedule(User actor, String doctorId, String scheduleId, ScheduleUpdate update);

    void deleteSchedule(User actor, String doctorId, String scheduleId);
}
