package com.flagship.gold_ledger.outbox;

import com.flagship.gold_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background relay from the outbox table to Kafka.
 *
 * Events are sent synchronously, one at a time, keyed by aggregate id so that all events of
 * one token, account or order land on the same partition in commit order. A failed send
 * increments the retry count; events past {@code outbox.publisher.max-retries} are left in
 * place as dead letters for manual follow-up.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.assets:gold.assets}")
    private String assetsTopic;

    @Value("${kafka.topic.ledger:gold.ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.orders:gold.orders}")
    private String ordersTopic;

    @Value("${kafka.topic.members:gold.members}")
    private String membersTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return;
        }

        String topic = topicFor(event);

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }

    String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case AggregateTypes.ASSET -> assetsTopic;
            case AggregateTypes.ACCOUNT -> ledgerTopic;
            case AggregateTypes.ORDER -> ordersTopic;
            case AggregateTypes.MEMBER -> membersTopic;
            default -> throw new IllegalArgumentException("No topic for aggregate type " + event.getAggregateType());
        };
    }

    /**
     * Manually triggers publishing (used by tests and operators).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
