package com.flagship.gold_ledger.observability;

import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges and counters for the audit-log outbox.
 *
 * Backlog is broken down by aggregate type (assets, ledger accounts, orders, members) so a
 * stalled topic shows up on its own. Gauges read cached values refreshed on a schedule.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);
    private final Map<String, AtomicLong> backlogByAggregate = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("aggregate", "all")
                .register(meterRegistry);

        for (String aggregateType : AggregateTypes.ALL) {
            AtomicLong counter = new AtomicLong(0);
            backlogByAggregate.put(aggregateType, counter);
            Gauge.builder("outbox.backlog.size", counter, AtomicLong::get)
                    .description("Number of unpublished events in the outbox")
                    .tag("aggregate", aggregateType)
                    .register(meterRegistry);
        }

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            backlogByAggregate.values().forEach(counter -> counter.set(0));
            List<Object[]> rows = outboxRepository.countUnpublishedByAggregateType();
            for (Object[] row : rows) {
                AtomicLong counter = backlogByAggregate.get((String) row[0]);
                if (counter != null) {
                    counter.set(((Number) row[1]).longValue());
                }
            }

            long ageSeconds = outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L);
            oldestEventAgeSeconds.set(ageSeconds);

            failedEventCount.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, byAggregate={}, oldestAge={}s, failed={}",
                    backlogSize.get(), backlogByAggregate, ageSeconds, failedEventCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public long getBacklogSize(String aggregateType) {
        AtomicLong counter = backlogByAggregate.get(aggregateType);
        return counter != null ? counter.get() : 0;
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
