package com.abba.agenda.application.service;

import com.abba.agenda.application.dto.BulkSlotUpdateResult;
import com.abba.agenda.application.dto.SlotGenerationRequest;
import com.abba.agenda.application.dto.SlotGenerationResult;
import com.abba.agenda.application.dto.SlotStatistics;
import com.abba.agenda.application.dto.SlotStatusUpdate;
import com.abba.agenda.domain.exception.SchedulingException;
import com.abba.agenda.domain.model.AvailabilitySlot;
import com.abba.agenda.domain.model.DoctorSchedule;
import com.abba.agenda.domain.model.SlotAction;
import com.abba.agenda.domain.model.SlotChangeEvent;
import com.abba.agenda.domain.model.SlotStatus;
import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.repository.AvailabilitySlotRepository;
import com.abba.agenda.domain.repository.DoctorScheduleRepository;
import com.abba.agenda.domain.service.LockService;
import com.abba.agenda.domain.service.SlotEventPublisher;
import com.abba.agenda.domain.service.SlotService;
import com.abba.agenda.infrastructure.cache.ListingCache;
import com.abba.agenda.infrastructure.config.LockProperties;
import com.abba.agenda.infrastructure.config.SlotProperties;
import com.abba.agenda.infrastructure.retry.RetryExecutor;
import com.abba.agenda.infrastructure.retry.RetryPolicies;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class SlotServiceImpl implements SlotService {

    private final AvailabilitySlotRepository slotRepository;
    private final DoctorScheduleRepository scheduleRepository;
    private final SlotGenerator slotGenerator;
    private final LockService lockService;
    private final LockProperties lockProperties;
    private final RetryExecutor retryExecutor;
    private final RetryPolicies retryPolicies;
    private final SlotEventPublisher eventPublisher;
    private final ListingCache listingCache;
    private final AccessPolicy accessPolicy;
    private final SlotProperties slotProperties;
    private final Clock clock;

    @Override
    public SlotGenerationResult generateSlots(User actor, String doctorId, SlotGenerationRequest request) {
        accessPolicy.requireScheduleOwner(actor, doctorId);
        validateRange(request.startDate(), request.endDate());
        DoctorSchedule schedule = scheduleRepository.findByIdAndDoctorIdAndActiveTrue(request.scheduleId(), doctorId)
                .orElseThrow(() -> SchedulingException.notFound("Schedule not found: " + request.scheduleId()));
        int created = generateRange(schedule, request.startDate(), request.endDate(), request.overrideExisting());
        return SlotGenerationResult.of(created);
    }

    /**
     * Materializes slots for every date in {@code [startDate, endDate]} on the schedule's weekday.
     * Without {@code overrideExisting}, dates that already have slots are left alone, so re-running is
     * a no-op. With it, available slots are replaced while booked and blocked ones are kept.
     */
    @Override
    public int generateRange(DoctorSchedule schedule, LocalDate startDate, LocalDate endDate, boolean overrideExisting) {
        validateRange(startDate, endDate);
        int created = 0;
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            if (date.getDayOfWeek() != schedule.getDayOfWeek()) {
                continue;
            }
            LocalDate day = date;
            created += retryExecutor.withRetry(retryPolicies.getStorage(),
                    () -> generateDate(schedule, day, overrideExisting));
        }
        listingCache.invalidateSlots(schedule.getDoctorId());
        log.info("Generated slots doctorId={} scheduleId={} from={} to={} count={}",
                schedule.getDoctorId(), schedule.getId(), startDate, endDate, created);
        return created;
    }

    private int generateDate(DoctorSchedule schedule, LocalDate date, boolean overrideExisting) {
        if (!overrideExisting) {
            if (slotRepository.existsByDoctorIdAndScheduleIdAndDate(schedule.getDoctorId(), schedule.getId(), date)) {
                return 0;
            }
        } else {
            long removed = slotRepository.deleteByDoctorIdAndScheduleIdAndDateAndStatus(
                    schedule.getDoctorId(), schedule.getId(), date, SlotStatus.AVAILABLE);
            log.debug("Removed available slots doctorId={} date={} count={}", schedule.getDoctorId(), date, removed);
        }
        Set<String> kept = slotRepository.findByDoctorIdAndScheduleIdAndDate(schedule.getDoctorId(), schedule.getId(), date)
                .stream()
                .map(AvailabilitySlot::getStartTime)
                .collect(Collectors.toSet());
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<AvailabilitySlot> candidates = slotGenerator.generate(schedule, date).stream()
                .filter(slot -> !kept.contains(slot.getStartTime()))
                .toList();
        if (candidates.isEmpty()) {
            return 0;
        }
        for (AvailabilitySlot candidate : candidates) {
            candidate.setId(new ObjectId().toHexString());
            candidate.setCreatedAt(now);
            candidate.setUpdatedAt(now);
        }
        try {
            return slotRepository.insert(candidates).size();
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent generation detected doctorId={} date={}, inserting remaining slots individually",
                    schedule.getDoctorId(), date);
            return insertRemaining(schedule, date, candidates);
        }
    }

    /**
     * An ordered batch insert stops at the first duplicate with the earlier documents already
     * written. Those are recognised by the ids assigned before the batch; the remaining start times
     * that no concurrent run took are inserted one by one.
     */
    private int insertRemaining(DoctorSchedule schedule, LocalDate date, List<AvailabilitySlot> candidates) {
        Map<String, String> stored = slotRepository.findByDoctorIdAndScheduleIdAndDate(
                        schedule.getDoctorId(), schedule.getId(), date)
                .stream()
                .collect(Collectors.toMap(AvailabilitySlot::getStartTime, AvailabilitySlot::getId, (first, second) -> first));
        int inserted = 0;
        for (AvailabilitySlot candidate : candidates) {
            String storedId = stored.get(candidate.getStartTime());
            if (storedId != null) {
                if (storedId.equals(candidate.getId())) {
                    inserted++;
                }
                continue;
            }
            try {
                slotRepository.insert(candidate);
                inserted++;
            } catch (DuplicateKeyException e) {
                log.debug("Slot already exists date={} startTime={}", candidate.getDate(), candidate.getStartTime());
            }
        }
        return inserted;
    }

    private void validateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw SchedulingException.invalidRange("Start date and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw SchedulingException.invalidRange("Start date must be before end date");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) > slotProperties.getMaxRangeDays()) {
            throw SchedulingException.invalidRange("Date range cannot exceed " + slotProperties.getMaxRangeDays() + " days");
        }
    }

    @Override
    public List<AvailabilitySlot> listSlots(String doctorId, LocalDate date, SlotStatus status) {
        if (date == null && status != null) {
            return slotRepository.findByDoctorIdAndStatusOrderByDateAscStartTimeAsc(doctorId, status);
        }
        LocalDate day = date == null ? LocalDate.now(clock) : date;
        return status == null
                ? slotRepository.findByDoctorIdAndDateOrderByStartTimeAsc(doctorId, day)
                : slotRepository.findByDoctorIdAndDateAndStatusOrderByStartTimeAsc(doctorId, day, status);
    }

    @Override
    public List<AvailabilitySlot> availableSlots(String doctorId, LocalDate date) {
        return slotRepository.findByDoctorIdAndDateAndStatusOrderByStartTimeAsc(doctorId, date, SlotStatus.AVAILABLE);
    }

    @Override
    public List<AvailabilitySlot> upcomingAvailableSlots(String doctorId) {
        return listingCache.getUpcomingSlots(doctorId).orElseGet(() -> {
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDate today = now.toLocalDate();
            List<AvailabilitySlot> slots = slotRepository.findByDoctorIdAndDateBetweenAndStatusOrderByDateAscStartTimeAsc(
                            doctorId, today, today.plusDays(slotProperties.getListingDaysAhead()), SlotStatus.AVAILABLE)
                    .stream()
                    .filter(slot -> slot.startDateTime().isAfter(now))
                    .toList();
            listingCache.putUpcomingSlots(doctorId, slots);
            return slots;
        });
    }

    @Override
    public AvailabilitySlot blockSlot(User actor, String slotId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw SchedulingException.invalidRange("Block reason is required");
        }
        return changeUnderLock(actor, slotId, SlotAction.BLOCKED, slot -> {
            slot.block(actor.getId(), reason, OffsetDateTime.now(clock));
            return slot;
        });
    }

    @Override
    public AvailabilitySlot unblockSlot(User actor, String slotId) {
        return changeUnderLock(actor, slotId, SlotAction.UNBLOCKED, slot -> {
            slot.unblock(OffsetDateTime.now(clock));
            return slot;
        });
    }

    private AvailabilitySlot changeUnderLock(User actor, String slotId, SlotAction action,
                                             UnaryOperator<AvailabilitySlot> change) {
        AvailabilitySlot current = findSlot(slotId);
        accessPolicy.requireSlotManager(actor, current.getDoctorId());
        AvailabilitySlot saved = lockService.withLock(lockService.bookingLockKey(slotId),
                lockProperties.getDefaultTtlSeconds(),
                () -> retryExecutor.withRetry(retryPolicies.getStorage(),
                        () -> slotRepository.save(change.apply(findSlot(slotId)))),
                lockProperties.getMaxRetries());
        eventPublisher.publish(SlotChangeEvent.of(saved, action, null, null, OffsetDateTime.now(clock)));
        listingCache.invalidateSlots(saved.getDoctorId());
        log.info("Slot {} slotId={} actorId={}", action.code(), slotId, actor.getId());
        return saved;
    }

    private AvailabilitySlot findSlot(String slotId) {
        return slotRepository.findById(slotId)
                .orElseThrow(() -> SchedulingException.notFound("Slot not found: " + slotId));
    }

    @Override
    public BulkSlotUpdateResult bulkUpdate(User actor, List<SlotStatusUpdate> updates) {
        List<AvailabilitySlot> results = new ArrayList<>();
        List<BulkSlotUpdateResult.SlotUpdateError> errors = new ArrayList<>();
        for (SlotStatusUpdate update : updates) {
            try {
                AvailabilitySlot slot = update.action() == SlotStatusUpdate.Action.BLOCK
                        ? blockSlot(actor, update.slotId(), update.reason())
                        : unblockSlot(actor, update.slotId());
                results.add(slot);
            } catch (RuntimeException e) {
                log.warn("Bulk slot update failed slotId={} action={} error={}", update.slotId(), update.action(), e.getMessage());
                errors.add(new BulkSlotUpdateResult.SlotUpdateError(update.slotId(), e.getMessage()));
            }
        }
        return new BulkSlotUpdateResult(results.size(), errors.size(), results, errors);
    }

    @Override
    public SlotStatistics statistics(String doctorId, LocalDate date) {
        Map<SlotStatus, Long> counts = new EnumMap<>(SlotStatus.class);
        long total = 0;
        for (SlotStatus status : SlotStatus.values()) {
            long count = slotRepository.countByDoctorIdAndDateAndStatus(doctorId, date, status);
            counts.put(status, count);
            total += count;
        }
        return new SlotStatistics(counts, total);
    }
}
