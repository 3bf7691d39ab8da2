package com.abba.agenda.domain.model;

import lombok.Data;

@Data
public class DoctorProfile {

    private String specialization;
    private String hospital;
    private int experience;
}
