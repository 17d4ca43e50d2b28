package com.reportalert.engine.infrastructure.db.report;

import com.reportalert.engine.domain.artifact.ArtifactRepository;
import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import com.reportalert.engine.domain.exceptions.ReportNotFoundException;
import com.reportalert.engine.infrastructure.db.report.mapper.ReportEntityMapper;
import com.reportalert.engine.infrastructure.json.ScheduleConfigCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ReportRepositoryAdapter implements ArtifactRepository {

    private final ReportJpaRepository jpaRepository;
    private final ReportEntityMapper mapper;
    private final ScheduleConfigCodec scheduleConfigCodec;

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledArtifact> findById(String id) {
        return jpaRepository.findById(id).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledArtifact> findScheduled() {
        return jpaRepository.findByScheduledTrueOrderByIdAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public void markSent(String id, Instant sentAt) {
        jpaRepository.markSent(id, sentAt);
    }

    @Override
    @Transactional
    public void updateSchedule(String id, Frequency frequency, ScheduleConfig scheduleConfig,
                               boolean scheduled, Instant nextRunAt) {
        var entity = jpaRepository.findById(id)
                .orElseThrow(() -> ReportNotFoundException.of(id));
        entity.setFrequency(frequency);
        entity.setScheduleConfig(scheduleConfigCodec.toJson(frequency, scheduleConfig));
        entity.setScheduled(scheduled);
        entity.setNextRunAt(nextRunAt);
    }

    @Override
    @Transactional
    public void updateNextRunAt(String id, Instant nextRunAt) {
        jpaRepository.updateNextRunAt(id, nextRunAt);
    }
}
