package com.reportalert.engine.infrastructure.db.delivery;

import com.reportalert.engine.domain.delivery.DeliveryStatus;
import com.reportalert.engine.infrastructure.db.converter.DeliveryStatusConverter;
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

@Entity
@Table(name = "report_delivery_history")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryHistoryEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "report_id", nullable = false, length = 40)
    private String artifactId;

    @Column(name = "delivery_format", length = 20)
    private String deliveryFormat;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> recipients;

    @Convert(converter = DeliveryStatusConverter.class)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "delivered_at", nullable = false)
    private Instant deliveredAt;
}
