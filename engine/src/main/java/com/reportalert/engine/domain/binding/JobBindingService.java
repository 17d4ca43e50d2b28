package com.reportalert.engine.domain.binding;

import com.reportalert.common.id.UlidGenerator;
import com.reportalert.engine.domain.artifact.ArtifactRepository;
import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import com.reportalert.engine.domain.delivery.DeliveryOutcome;
import com.reportalert.engine.domain.delivery.DeliveryStatus;
import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import com.reportalert.engine.domain.exceptions.JobBindingNotFoundException;
import com.reportalert.engine.domain.exceptions.ReportNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobBindingService {

    static final String ID_PREFIX = "job";

    private final ArtifactRepository artifactRepository;
    private final JobBindingRepository bindingRepository;
    private final CronCalculator cronCalculator;
    private final Clock clock;
    private final ZoneId defaultScheduleZone;

    /**
     * Marks the report scheduled and creates or replaces its binding. Frequencies without
     * a cron form (realtime, on demand) leave the report scheduled with no binding.
     */
    public Optional<JobBinding> schedule(String artifactId, Frequency frequency, ScheduleConfig config) {
        artifactRepository.findById(artifactId)
                .orElseThrow(() -> ReportNotFoundException.of(artifactId));
        var schedule = config != null ? config : ScheduleConfig.EMPTY;
        var zone = schedule.timezoneOr(defaultScheduleZone);
        var now = clock.instant();

        var cron = CronExpressions.forSchedule(frequency, schedule);
        if (cron.isEmpty()) {
            artifactRepository.updateSchedule(artifactId, frequency, schedule, true, null);
            bindingRepository.deleteByArtifactId(artifactId);
            log.info("Report {} scheduled {} without a cron job", artifactId, frequency.wireValue());
            return Optional.empty();
        }

        var nextRunAt = cronCalculator.nextRunAfter(cron.get(), zone, now).orElse(null);
        artifactRepository.updateSchedule(artifactId, frequency, schedule, true, nextRunAt);

        var binding = bindingRepository.findByArtifactId(artifactId)
                .map(existing -> existing.toBuilder())
                .orElseGet(() -> JobBinding.builder()
                        .id(UlidGenerator.prefixed(ID_PREFIX))
                        .artifactId(artifactId)
                        .createdAt(now))
                .cronExpression(cron.get())
                .timezone(zone.getId())
                .active(true)
                .nextRunAt(nextRunAt)
                .updatedAt(now)
                .build();
        var saved = bindingRepository.save(binding);
        log.info("Scheduled report {} with cron '{}' ({}), next run at {}",
                artifactId, saved.cronExpression(), saved.timezone(), nextRunAt);
        return Optional.of(saved);
    }

    public void unschedule(String artifactId) {
        var artifact = artifactRepository.findById(artifactId)
                .orElseThrow(() -> ReportNotFoundException.of(artifactId));
        artifactRepository.updateSchedule(artifactId, artifact.frequency(), artifact.scheduleConfig(), false, null);
        bindingRepository.deleteByArtifactId(artifactId);
        log.info("Unscheduled report {}", artifactId);
    }

    public JobBinding pause(String artifactId) {
        var binding = requireBinding(artifactId);
        var paused = bindingRepository.save(binding.toBuilder()
                .active(false)
                .updatedAt(clock.instant())
                .build());
        log.info("Paused job for report {}", artifactId);
        return paused;
    }

    public JobBinding resume(String artifactId) {
        var binding = requireBinding(artifactId);
        var now = clock.instant();
        var nextRunAt = nextRun(binding, now);
        var resumed = bindingRepository.save(binding.toBuilder()
                .active(true)
                .nextRunAt(nextRunAt)
                .updatedAt(now)
                .build());
        artifactRepository.updateNextRunAt(artifactId, nextRunAt);
        log.info("Resumed job for report {}, next run at {}", artifactId, nextRunAt);
        return resumed;
    }

    public List<JobBinding> listBindings() {
        return bindingRepository.findAll();
    }

    /**
     * Records a run of the report's binding, if it has one, and moves {@code nextRunAt}
     * to the next cron fire time after now. A skipped delivery keeps the previous result.
     */
    public Optional<JobBinding> advanceAfterRun(String artifactId, Instant ranAt, DeliveryOutcome outcome) {
        var found = bindingRepository.findByArtifactId(artifactId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        var binding = found.get();
        var nextRunAt = nextRun(binding, clock.instant());
        var lastStatus = binding.lastStatus();
        var lastError = binding.lastError();
        switch (outcome.result()) {
            case DELIVERED -> {
                lastStatus = DeliveryStatus.SUCCESS;
                lastError = null;
            }
            case FAILED -> {
                lastStatus = DeliveryStatus.FAILED;
                lastError = outcome.message();
            }
            case SKIPPED -> {
            }
        }
        bindingRepository.recordRun(binding.id(), ranAt, nextRunAt, lastStatus, lastError);
        artifactRepository.updateNextRunAt(artifactId, nextRunAt);
        return Optional.of(binding.toBuilder()
                .lastRunAt(ranAt)
                .nextRunAt(nextRunAt)
                .lastStatus(lastStatus)
                .lastError(lastError)
                .build());
    }

    private JobBinding requireBinding(String artifactId) {
        return bindingRepository.findByArtifactId(artifactId)
                .orElseThrow(() -> JobBindingNotFoundException.forReport(artifactId));
    }

    private Instant nextRun(JobBinding binding, Instant after) {
        try {
            var zone = binding.timezone() != null ? ZoneId.of(binding.timezone()) : defaultScheduleZone;
            return cronCalculator.nextRunAfter(binding.cronExpression(), zone, after).orElse(null);
        } catch (InvalidScheduleException | DateTimeException e) {
            log.warn("Cannot compute next run for report {}: {}", binding.artifactId(), e.getMessage());
            return null;
        }
    }
}
