package com.reportalert.engine.application.controller.evaluation;

import com.reportalert.engine.application.controller.evaluation.mapper.EvaluationResponseMapper;
import com.reportalert.engine.application.service.AlertEvaluationHandler;
import com.reportalert.engine.domain.evaluation.MetricReading;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AlertEvaluationController {

    private final AlertEvaluationHandler evaluationHandler;
    private final EvaluationResponseMapper mapper;

    @PostMapping("/kpis/{kpiId}/evaluate")
    public EvaluationResponse evaluate(@PathVariable String kpiId, @Valid @RequestBody EvaluateKpiRequest request) {
        return mapper.toResponse(evaluationHandler.evaluate(kpiId, request.value(), request.baseline()));
    }

    @PostMapping("/alerts/evaluate")
    public List<EvaluationResponse> evaluateBatch(@Valid @RequestBody BatchEvaluateRequest request) {
        var readings = request.readings().stream()
                .map(r -> new MetricReading(r.kpiId(), r.value(), r.baseline()))
                .toList();
        return evaluationHandler.evaluateMany(readings).stream()
                .map(mapper::toResponse)
                .toList();
    }
}
