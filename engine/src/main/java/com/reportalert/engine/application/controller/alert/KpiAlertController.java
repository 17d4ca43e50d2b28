package com.reportalert.engine.application.controller.alert;

import com.reportalert.engine.application.controller.alert.mapper.AlertRuleResponseMapper;
import com.reportalert.engine.application.service.AlertEvaluationHandler;
import com.reportalert.engine.application.service.AlertRuleCommandHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class KpiAlertController {

    private final AlertRuleCommandHandler commandHandler;
    private final AlertEvaluationHandler evaluationHandler;
    private final AlertRuleResponseMapper mapper;

    @GetMapping("/kpis/{kpiId}/alerts")
    public List<AlertRuleResponse> listRules(@PathVariable String kpiId) {
        return commandHandler.listRules(kpiId).stream()
                .map(mapper::toResponse)
                .toList();
    }

    @PostMapping("/kpis/{kpiId}/alerts")
    public ResponseEntity<AlertRuleResponse> createRule(@PathVariable String kpiId,
                                                        @Valid @RequestBody CreateAlertRuleRequest request) {
        var rule = commandHandler.createRule(
                kpiId,
                AlertRuleConditions.parse(request.condition()),
                request.threshold(),
                request.channels(),
                request.recipients());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapper.toResponse(rule));
    }

    @PatchMapping("/alerts/{alertId}")
    public AlertRuleResponse updateRule(@PathVariable String alertId,
                                        @Valid @RequestBody UpdateAlertRuleRequest request) {
        return mapper.toResponse(commandHandler.updateRule(
                alertId,
                AlertRuleConditions.parse(request.condition()),
                request.threshold(),
                request.channels(),
                request.recipients(),
                request.active()));
    }

    @DeleteMapping("/alerts/{alertId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteRule(@PathVariable String alertId) {
        commandHandler.deleteRule(alertId);
    }

    @GetMapping("/kpis/{kpiId}/alert-history")
    public List<AlertHistoryResponse> alertHistory(@PathVariable String kpiId) {
        return evaluationHandler.triggerHistory(kpiId).stream()
                .map(mapper::toResponse)
                .toList();
    }
}
