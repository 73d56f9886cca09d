package com.ai.booking.service;

import com.ai.booking.entity.ScheduleDay;
import com.ai.booking.exception.StoreUnavailableException;
import com.ai.booking.repository.ScheduleDayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Serializes writers of one specialist's day. Several days are locked in a
 * stable order so a change moving a booking between days cannot deadlock
 * with another change moving the opposite way.
 */
@Component
public class ScheduleLockScope {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLockScope.class);

    private final ScheduleDayRepository scheduleDayRepository;
    private final TransactionTemplate lockTemplate;
    private final TransactionTemplate anchorTemplate;

    public ScheduleLockScope(ScheduleDayRepository scheduleDayRepository,
                             PlatformTransactionManager transactionManager) {
        this.scheduleDayRepository = scheduleDayRepository;
        this.lockTemplate = new TransactionTemplate(transactionManager);
        this.anchorTemplate = new TransactionTemplate(transactionManager);
        this.anchorTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T withDayLock(String projectId, Collection<DayKey> days, Supplier<T> work) {
        List<DayKey> ordered = days.stream().distinct().sorted().toList();
        try {
            ordered.forEach(day -> ensureAnchor(projectId, day));
            return lockTemplate.execute(status -> {
                for (DayKey day : ordered) {
                    scheduleDayRepository.findForUpdate(projectId, day.specialist(), day.date())
                            .orElseThrow(() -> new IllegalStateException("Missing schedule_day row for " + projectId + "/" + day));
                }
                return work.get();
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Schedule lock transaction failed for " + projectId + " " + ordered, e);
        }
    }

    private void ensureAnchor(String projectId, DayKey day) {
        if (scheduleDayRepository.findByProjectIdAndSpecialistAndScheduleDate(projectId, day.specialist(), day.date()).isPresent()) {
            return;
        }
        try {
            anchorTemplate.executeWithoutResult(status -> scheduleDayRepository.saveAndFlush(ScheduleDay.builder()
                    .projectId(projectId)
                    .specialist(day.specialist())
                    .scheduleDate(day.date())
                    .build()));
        } catch (DataIntegrityViolationException e) {
            log.debug("schedule_day anchor for {} {} created concurrently", projectId, day);
        }
    }

    public record DayKey(String specialist, LocalDate date) implements Comparable<DayKey> {

        private static final Comparator<DayKey> ORDER = Comparator
                .comparing(DayKey::specialist)
                .thenComparing(DayKey::date);

        @Override
        public int compareTo(DayKey other) {
            return ORDER.compare(this, other);
        }

        @Override
        public String toString() {
            return specialist + "@" + date;
        }
    }
}
