package com.reportalert.engine.application.controller.report;

import com.reportalert.engine.application.controller.report.mapper.DeliveryAttemptResponseMapper;
import com.reportalert.engine.application.service.ReportScheduleCommandHandler;
import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.domain.artifact.ScheduleConfig;
import com.reportalert.engine.domain.delivery.DeliveryOutcome;
import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
public class ReportScheduleController {

    private final ReportScheduleCommandHandler commandHandler;
    private final DeliveryAttemptResponseMapper mapper;

    @PutMapping("/{reportId}/schedule")
    public ScheduleResponse schedule(@PathVariable String reportId,
                                     @Valid @RequestBody ScheduleReportRequest request) {
        var frequency = Frequency.fromWireValue(request.frequency())
                .orElseThrow(() -> InvalidScheduleException.unknownFrequency(request.frequency()));
        var config = ScheduleConfig.parse(
                request.time(), request.dayOfWeek(), request.dayOfMonth(), request.timezone());
        return commandHandler.schedule(reportId, frequency, config)
                .map(binding -> new ScheduleResponse(reportId, frequency.wireValue(), true,
                        binding.cronExpression(), binding.timezone(), binding.active(), binding.nextRunAt()))
                .orElseGet(() -> new ScheduleResponse(reportId, frequency.wireValue(), true,
                        null, null, false, null));
    }

    @DeleteMapping("/{reportId}/schedule")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unschedule(@PathVariable String reportId) {
        commandHandler.unschedule(reportId);
    }

    @PostMapping("/{reportId}/deliveries")
    public DeliveryOutcome deliverNow(@PathVariable String reportId) {
        return commandHandler.deliverNow(reportId);
    }

    @GetMapping("/{reportId}/deliveries")
    public List<DeliveryAttemptResponse> deliveryHistory(@PathVariable String reportId) {
        return commandHandler.deliveryHistory(reportId).stream()
                .map(mapper::toResponse)
                .toList();
    }
}
