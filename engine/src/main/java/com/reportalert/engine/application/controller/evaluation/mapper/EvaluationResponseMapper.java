package com.reportalert.engine.application.controller.evaluation.mapper;

import com.reportalert.engine.application.controller.evaluation.EvaluationResponse;
import com.reportalert.engine.domain.evaluation.EvaluationResult;
import com.reportalert.engine.domain.evaluation.TriggeredAlert;
import com.reportalert.engine.domain.rule.ThresholdCondition;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface EvaluationResponseMapper {

    @Mapping(target = "alertId", source = "ruleId")
    EvaluationResponse.TriggeredAlertResponse toResponse(TriggeredAlert alert);

    List<EvaluationResponse.TriggeredAlertResponse> toResponses(List<TriggeredAlert> alerts);

    /**
     * Failed batch entries carry only the KPI id and the error.
     */
    default EvaluationResponse toResponse(EvaluationResult result) {
        if (result.isFailed()) {
            return new EvaluationResponse(result.metricId(), null, null, null, null, null, result.error());
        }
        return new EvaluationResponse(
                result.metricId(),
                result.metricName(),
                result.currentValue(),
                result.alertsChecked(),
                result.triggeredCount(),
                toResponses(result.triggeredAlerts()),
                null);
    }

    default String toWireValue(ThresholdCondition condition) {
        return condition == null ? null : condition.wireValue();
    }
}
