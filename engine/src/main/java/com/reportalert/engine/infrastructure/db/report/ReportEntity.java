package com.reportalert.engine.infrastructure.db.report;

import com.reportalert.engine.domain.artifact.Frequency;
import com.reportalert.engine.infrastructure.db.converter.CommaSeparatedListConverter;
import com.reportalert.engine.infrastructure.db.converter.FrequencyConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
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

import java.time.Instant;
import java.util.List;

/**
 * Scheduling subset of the externally owned {@code reports} table.
 */
@Entity
@Table(name = "reports")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReportEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(nullable = false)
    private String name;

    @Convert(converter = FrequencyConverter.class)
    @Column(length = 50)
    private Frequency frequency;

    @Column(name = "is_scheduled")
    private boolean scheduled;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "schedule_config")
    private String scheduleConfig;

    @Column(name = "delivery_format", length = 20)
    private String deliveryFormat;

    @Convert(converter = CommaSeparatedListConverter.class)
    @Column(columnDefinition = "text")
    private List<String> recipients;

    @Column(name = "last_sent_at")
    private Instant lastSentAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "send_count")
    private Integer sendCount;
}
