package com.reportalert.engine.infrastructure.db.rule.mapper;

import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.infrastructure.db.rule.KpiAlertEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface KpiAlertEntityMapper {

    KpiAlertEntity toEntity(ThresholdRule rule);

    ThresholdRule toDomain(KpiAlertEntity entity);
}
