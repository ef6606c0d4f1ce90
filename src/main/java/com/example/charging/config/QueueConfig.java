package com.example.charging.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@Data
@PropertySource("classpath:application.properties")
public class QueueConfig {

    @Value("${queue.reservation.ttl-minutes:15}")
    int reservationTtlMinutes;

    @Value("${queue.reservation.warning-lead-minutes:5}")
    int warningLeadMinutes;

    @Value("${queue.reservation.max-extensions:1}")
    int maxExtensions;

    @Value("${queue.reservation.extension-minutes:10}")
    int extensionMinutes;

    /** walk-up buffer added to every wait estimate */
    @Value("${queue.wait.minimum-minutes:5}")
    int minimumWaitMinutes;

    @Value("${queue.defaults.max-queue-length:5}")
    int defaultMaxQueueLength;

    @Value("${queue.defaults.average-usage-minutes:45}")
    int defaultAverageUsageMinutes;

    @Value("${queue.timers.batch-size:100}")
    int timerBatchSize;

    @Value("${queue.timers.retry-base-seconds:5}")
    long timerRetryBaseSeconds;

    @Value("${queue.timers.retry-max-seconds:300}")
    long timerRetryMaxSeconds;
}
