package com.reportalert.engine.application.controller.job;

import com.reportalert.engine.application.controller.job.mapper.JobBindingResponseMapper;
import com.reportalert.engine.application.job.DeliveryScheduler;
import com.reportalert.engine.application.job.TickReport;
import com.reportalert.engine.application.service.ReportScheduleCommandHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class JobController {

    private final ReportScheduleCommandHandler commandHandler;
    private final DeliveryScheduler deliveryScheduler;
    private final JobBindingResponseMapper mapper;

    @GetMapping("/jobs")
    public List<JobBindingResponse> listJobs() {
        return commandHandler.listBindings().stream()
                .map(mapper::toResponse)
                .toList();
    }

    @PostMapping("/jobs/{reportId}/pause")
    public JobBindingResponse pause(@PathVariable String reportId) {
        return mapper.toResponse(commandHandler.pause(reportId));
    }

    @PostMapping("/jobs/{reportId}/resume")
    public JobBindingResponse resume(@PathVariable String reportId) {
        return mapper.toResponse(commandHandler.resume(reportId));
    }

    @PostMapping("/scheduler/tick")
    public TickReport tick() {
        return deliveryScheduler.tick();
    }
}
