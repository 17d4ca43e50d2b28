package com.reportalert.engine.infrastructure.db.trigger.mapper;

import com.reportalert.engine.domain.trigger.AlertTrigger;
import com.reportalert.engine.infrastructure.db.trigger.AlertHistoryEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface AlertHistoryEntityMapper {

    AlertHistoryEntity toEntity(AlertTrigger trigger);

    AlertTrigger toDomain(AlertHistoryEntity entity);
}
