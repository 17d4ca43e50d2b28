package com.reportalert.engine.infrastructure.db.rule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "kpi_alerts")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KpiAlertEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "kpi_id", nullable = false, length = 40)
    private String metricId;

    @Column(length = 50)
    private String condition;

    @Column(precision = 20, scale = 6)
    private BigDecimal threshold;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> channels;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> recipients;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
