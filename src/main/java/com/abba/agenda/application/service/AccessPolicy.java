package com.abba.agenda.application.service;

import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.User;
import org.springframework.stereotype.Component;

/**
 * Ownership rules applied after the caller is authenticated.
 */
@Component
public class AccessPolicy {

    public void requireScheduleOwner(User actor, String doctorId) {
        if (actor == null || !(actor.isAdmin() || isSameDoctor(actor, doctorId))) {
            throw SchedulingException.forbidden("Not allowed to manage schedules of doctor " + doctorId);
        }
    }

    public void requireSlotManager(User actor, String doctorId) {
        if (actor == null || !(actor.isStaffOrAdmin() || isSameDoctor(actor, doctorId))) {
            throw SchedulingException.forbidden("Not allowed to manage slots of doctor " + doctorId);
        }
    }

    public void requireClinician(User actor, String doctorId) {
        if (actor == null || !(actor.isAdmin() || isSameDoctor(actor, doctorId))) {
            throw SchedulingException.forbidden("Not allowed to update appointments of doctor " + doctorId);
        }
    }

    private boolean isSameDoctor(User actor, String doctorId) {
        return actor.isDoctor() && actor.getId() != null && actor.getId().equals(doctorId);
    }
}
