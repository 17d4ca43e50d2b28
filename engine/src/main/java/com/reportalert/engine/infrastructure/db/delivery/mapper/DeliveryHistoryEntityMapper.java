package com.reportalert.engine.infrastructure.db.delivery.mapper;

import com.reportalert.engine.domain.delivery.DeliveryAttempt;
import com.reportalert.engine.infrastructure.db.delivery.DeliveryHistoryEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface DeliveryHistoryEntityMapper {

    DeliveryHistoryEntity toEntity(DeliveryAttempt attempt);

    DeliveryAttempt toDomain(DeliveryHistoryEntity entity);
}
