package com.abba.agenda.infrastructure.cache;

import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.service.CacheStore;
import com.abba.agenda.infrastructure.config.SlotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-through cache of a doctor's upcoming available slots and active schedules, stored as JSON.
 * The cache is never the source of truth: every failure is logged and treated as a miss.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingCache {

    private static final TypeReference<List<AvailabilitySlot>> SLOT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<DoctorSchedule>> SCHEDULE_LIST = new TypeReference<>() {
    };

    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final SlotProperties slotProperties;

    public static String slotsKey(String doctorId) {
        return "doctor_slots_" + doctorId;
    }

    public static String schedulesKey(String doctorId) {
        return "doctor_schedules_" + doctorId;
    }

    public Optional<List<AvailabilitySlot>> getUpcomingSlots(String doctorId) {
        return read(slotsKey(doctorId), SLOT_LIST);
    }

    public void putUpcomingSlots(String doctorId, List<AvailabilitySlot> slots) {
        write(slotsKey(doctorId), slots, slotProperties.getListingCacheTtl());
    }

    public Optional<List<DoctorSchedule>> getSchedules(String doctorId) {
        return read(schedulesKey(doctorId), SCHEDULE_LIST);
    }

    public void putSchedules(String doctorId, List<DoctorSchedule> schedules) {
        write(schedulesKey(doctorId), schedules, slotProperties.getScheduleCacheTtl());
    }

    public void invalidateSlots(String doctorId) {
        delete(slotsKey(doctorId));
    }

    public void invalidateSchedules(String doctorId) {
        delete(schedulesKey(doctorId));
    }

    private <T> Optional<T> read(String key, TypeReference<T> type) {
        if (!cacheStore.isConnected()) {
            return Optional.empty();
        }
        try {
            Optional<String> cached = cacheStore.get(key);
            if (cached.isEmpty()) {
                return Optional.empty();
            }
            log.debug("Cache hit key={}", key);
            return Optional.of(objectMapper.readValue(cached.get(), type));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cache read failed key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        if (!cacheStore.isConnected()) {
            return;
        }
        try {
            cacheStore.set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cache write failed key={} error={}", key, e.getMessage());
        }
    }

    private void delete(String key) {
        if (!cacheStore.isConnected()) {
            return;
        }
        try {
            cacheStore.delete(key);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed key={} error={}", key, e.getMessage());
        }
    }
}
