package com.reportalert.engine.infrastructure.db.report.mapper;

import com.reportalert.engine.domain.artifact.ScheduledArtifact;
import com.reportalert.engine.infrastructure.db.report.ReportEntity;
import com.reportalert.engine.infrastructure.json.ScheduleConfigCodec;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring", uses = ScheduleConfigCodec.class)
public interface ReportEntityMapper {

    ScheduledArtifact toDomain(ReportEntity entity);
}
