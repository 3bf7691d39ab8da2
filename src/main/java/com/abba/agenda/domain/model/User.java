package com.abba.agenda.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.OffsetDateTime;

@Document(collection = "users")
@CompoundIndex(name = "email_idx", def = "{'email': 1}", unique = true)
@Data
public class User {

    @Id
    private String id;
    private String name;
    private String email;
    private String phone;
    @Indexed
    private UserRole role = UserRole.PATIENT;
    private boolean active = true;
    private DoctorProfile doctorProfile;
    private OffsetDateTime createdAt;

    public boolean isDoctor() {
        return role == UserRole.DOCTOR;
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public boolean isStaffOrAdmin() {
        return role == UserRole.STAFF || role == UserRole.ADMIN;
    }

    public int yearsOfExperience() {
        return doctorProfile == null ? 0 : doctorProfile.getExperience();
    }

    public String specialization() {
        return doctorProfile == null ? null : doctorProfile.getSpecialization();
    }
}
