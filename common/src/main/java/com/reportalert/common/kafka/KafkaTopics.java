package com.reportalert.common.kafka;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KafkaTopics {

    public static final String KPI_ALERT_TRIGGERS = "kpi-alert-triggers";
}
