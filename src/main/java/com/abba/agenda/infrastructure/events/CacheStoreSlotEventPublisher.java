package com.abba.agenda.infrastructure.events;

import com.abba.agenda.domain.model.SlotChangeEvent;
import com.abba.agenda.domain.service.CacheStore;
import com.abba.agenda.domain.service.SlotEventPublisher;
import com.abba.agenda.infrastructure.config.EventProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes slot changes as JSON on the configured channel. Events feed live UIs only, so a
 * failed publish is logged and dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheStoreSlotEventPublisher implements SlotEventPublisher {

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final EventProperties eventProperties;

    @Override
    public void publish(SlotChangeEvent event) {
        if (!cacheStore.isConnected()) {
            log.debug("Skipping slot event, store disconnected slotId={} action={}", event.slotId(), event.action());
            return;
        }
        try {
            cacheStore.publish(eventProperties.getSlotChannel(), objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to publish slot event slotId={} action={} error={}", event.slotId(), event.action(), e.getMessage());
        }
    }
}
