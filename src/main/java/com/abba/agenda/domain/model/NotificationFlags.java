package com.abba.agenda.domain.model;

import lombok.Data;

@Data
public class NotificationFlags {

    private boolean emailSent;
    private boolean smsSent;
    private boolean reminderSent;
}
