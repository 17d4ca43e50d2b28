package com.reportalert.engine.application.controller.report.mapper;

import com.reportalert.engine.application.controller.report.DeliveryAttemptResponse;
import com.reportalert.engine.domain.delivery.DeliveryAttempt;
import com.reportalert.engine.domain.delivery.DeliveryStatus;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface DeliveryAttemptResponseMapper {

    @Mapping(target = "reportId", source = "artifactId")
    DeliveryAttemptResponse toResponse(DeliveryAttempt attempt);

    default String toWireValue(DeliveryStatus status) {
        return status == null ? null : status.wireValue();
    }
}
