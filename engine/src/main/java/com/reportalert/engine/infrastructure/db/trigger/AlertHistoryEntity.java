package com.reportalert.engine.infrastructure.db.trigger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "alert_history")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistoryEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "alert_id", nullable = false, length = 40)
    private String ruleId;

    @Column(name = "kpi_id", nullable = false, length = 40)
    private String metricId;

    @Column(name = "actual_value", precision = 20, scale = 6)
    private BigDecimal actualValue;

    @Column(precision = 20, scale = 6)
    private BigDecimal threshold;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;
}
