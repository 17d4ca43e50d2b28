package com.reportalert.engine.application.controller.job.mapper;

import com.reportalert.engine.application.controller.job.JobBindingResponse;
import com.reportalert.engine.domain.binding.JobBinding;
import com.reportalert.engine.domain.delivery.DeliveryStatus;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface JobBindingResponseMapper {

    @Mapping(target = "reportId", source = "artifactId")
    JobBindingResponse toResponse(JobBinding binding);

    default String toWireValue(DeliveryStatus status) {
        return status == null ? null : status.wireValue();
    }
}
