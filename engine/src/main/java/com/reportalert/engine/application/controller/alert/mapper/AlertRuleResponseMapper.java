package com.reportalert.engine.application.controller.alert.mapper;

import com.reportalert.engine.application.controller.alert.AlertHistoryResponse;
import com.reportalert.engine.application.controller.alert.AlertRuleResponse;
import com.reportalert.engine.domain.rule.ThresholdRule;
import com.reportalert.engine.domain.trigger.AlertTrigger;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface AlertRuleResponseMapper {

    @Mapping(target = "kpiId", source = "metricId")
    AlertRuleResponse toResponse(ThresholdRule rule);

    @Mapping(target = "alertId", source = "ruleId")
    @Mapping(target = "kpiId", source = "metricId")
    AlertHistoryResponse toResponse(AlertTrigger trigger);
}
