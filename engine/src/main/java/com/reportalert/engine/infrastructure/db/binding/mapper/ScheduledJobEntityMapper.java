package com.reportalert.engine.infrastructure.db.binding.mapper;

import com.reportalert.engine.domain.binding.JobBinding;
import com.reportalert.engine.infrastructure.db.binding.ScheduledJobEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface ScheduledJobEntityMapper {

    ScheduledJobEntity toEntity(JobBinding binding);

    JobBinding toDomain(ScheduledJobEntity entity);
}
