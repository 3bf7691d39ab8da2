package com.abba.agenda.domain.service;

import com.abba.agenda.domain.model.SlotChangeEvent;

public interface SlotEventPublisher {

    void publish(SlotChangeEvent event);
}
