package com.reportalert.engine.application.controller;

import com.reportalert.engine.domain.exceptions.InvalidScheduleException;
import com.reportalert.engine.domain.exceptions.JobBindingNotFoundException;
import com.reportalert.engine.domain.exceptions.MetricNotFoundException;
import com.reportalert.engine.domain.exceptions.ReportNotFoundException;
import com.reportalert.engine.domain.exceptions.ThresholdRuleNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ReportNotFoundException.class)
    public ProblemDetail handleReportNotFound(ReportNotFoundException ex) {
        return notFound("Report Not Found", ex.getMessage(), ErrorCodes.REPORT_NOT_FOUND);
    }

    @ExceptionHandler(MetricNotFoundException.class)
    public ProblemDetail handleMetricNotFound(MetricNotFoundException ex) {
        return notFound("KPI Not Found", ex.getMessage(), ErrorCodes.KPI_NOT_FOUND);
    }

    @ExceptionHandler(ThresholdRuleNotFoundException.class)
    public ProblemDetail handleRuleNotFound(ThresholdRuleNotFoundException ex) {
        return notFound("Alert Not Found", ex.getMessage(), ErrorCodes.ALERT_NOT_FOUND);
    }

    @ExceptionHandler(JobBindingNotFoundException.class)
    public ProblemDetail handleJobNotFound(JobBindingNotFoundException ex) {
        return notFound("Job Not Found", ex.getMessage(), ErrorCodes.JOB_NOT_FOUND);
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ProblemDetail handleInvalidSchedule(InvalidScheduleException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid Schedule");
        problem.setProperty("code", ErrorCodes.INVALID_SCHEDULE);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        var errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }

    private static ProblemDetail notFound(String title, String detail, String code) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, detail);
        problem.setTitle(title);
        problem.setProperty("code", code);
        return problem;
    }
}
