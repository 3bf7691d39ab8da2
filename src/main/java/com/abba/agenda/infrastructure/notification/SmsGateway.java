package com.abba.agenda.infrastructure.notification;

public interface SmsGateway {

    void send(String phone, String text);
}
