package com.reportalert.engine.application.config;

import com.reportalert.engine.domain.delivery.DeliveryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId defaultScheduleZone(EngineProperties properties) {
        return properties.scheduler().defaultTimezone();
    }

    @Bean
    public DeliveryPolicy deliveryPolicy(EngineProperties properties) {
        return new DeliveryPolicy(properties.delivery().attemptTimeout());
    }
}
