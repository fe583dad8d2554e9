package com.flagship.gold_ledger.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gold_ledger.IntegrationTestBase;
import com.flagship.gold_ledger.member.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the transactional outbox that doubles as the audit log.
 */
class OutboxServiceTest extends IntegrationTestBase {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    record TestPayload(String name, int value) {
    }

    @Test
    @DisplayName("Outbox event should be created with correct data")
    @Transactional
    void testSaveEvent_CreatesCorrectEvent() throws Exception {
        printTestHeader("Save Event - Creates Correct Event");

        String aggregateId = "TX-" + UUID.randomUUID();
        OutboxEvent event = outboxService.saveEvent(AggregateTypes.ORDER, aggregateId, "TestEvent",
            new TestPayload("test-value", 123));
        printOutput("Payload", event.getPayload());

        assertNotNull(event.getId(), "Event ID should be generated");
        assertEquals(AggregateTypes.ORDER, event.getAggregateType());
        assertEquals(aggregateId, event.getAggregateId());
        assertFalse(event.isPublished(), "Event should not be published yet");
        assertEquals(0, event.getRetryCount(), "Retry count should be 0");

        TestPayload payload = objectMapper.readValue(event.getPayload(), TestPayload.class);
        assertEquals(new TestPayload("test-value", 123), payload);
        printSuccess("Outbox event created with correct data");
    }

    @Test
    @DisplayName("Events cannot be written outside a business transaction")
    void testSaveEvent_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.saveEvent(AggregateTypes.ASSET, "1", "AssetMinted", new TestPayload("x", 1)));
    }

    @Test
    @DisplayName("Failed publish increments retry count, successful publish sets publishedAt")
    void testMarkFailedThenPublished() {
        printTestHeader("Retry Bookkeeping");

        String platform = addressWithRoles("platform", Role.PLATFORM);
        String accountId = openAccount(uniqueAddress("holder"));
        ledgerService.updateBalance(platform, accountId, 2, "DEPOSIT", "REF");

        OutboxEvent updated = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, accountId).stream()
            .filter(e -> e.getEventType().equals("BalanceUpdated"))
            .findFirst()
            .orElseThrow();

        outboxService.markFailed(updated.getId(), "broker down");
        OutboxEvent failed = reload(accountId, updated.getId());
        assertEquals(1, failed.getRetryCount());
        assertEquals("broker down", failed.getLastError());
        assertFalse(failed.isPublished());

        outboxService.markPublished(updated.getId());
        assertTrue(reload(accountId, updated.getId()).isPublished());
        printSuccess("Retry count and publish timestamp recorded");
    }

    @Test
    @DisplayName("Events for an unknown aggregate type are refused")
    @Transactional
    void testSaveEvent_UnknownAggregateType() {
        assertThrows(IllegalArgumentException.class,
            () -> outboxService.saveEvent("Vault", "V-1", "VaultOpened", new TestPayload("x", 1)));
    }

    @Test
    @DisplayName("Broker errors are truncated and a repeated acknowledgement keeps the first publish time")
    void testRelayBookkeeping() {
        String platform = addressWithRoles("platform", Role.PLATFORM);
        String accountId = openAccount(uniqueAddress("holder"));
        ledgerService.updateBalance(platform, accountId, 1, "DEPOSIT", "REF");
        UUID eventId = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, accountId).get(0).getId();

        outboxService.markFailed(eventId, "e".repeat(5000));
        assertEquals(OutboxEventEntity.MAX_ERROR_LENGTH, reload(accountId, eventId).getLastError().length());

        outboxService.markPublished(eventId);
        Instant first = reload(accountId, eventId).getPublishedAt();
        outboxService.markPublished(eventId);

        OutboxEvent published = reload(accountId, eventId);
        assertEquals(first, published.getPublishedAt());
        assertNull(published.getLastError());
    }

    @Test
    @DisplayName("Events of one aggregate come back in commit order")
    void testEventsForAggregate_Ordered() {
        String platform = addressWithRoles("platform", Role.PLATFORM);
        String accountId = openAccount(uniqueAddress("holder"));
        ledgerService.updateBalance(platform, accountId, 5, "DEPOSIT", "REF-1");
        ledgerService.updateBalance(platform, accountId, -2, "WITHDRAW", "REF-2");

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, accountId);

        assertEquals(List.of("AccountCreated", "BalanceUpdated", "BalanceUpdated"),
            events.stream().map(OutboxEvent::getEventType).toList());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).getSequenceNumber() > events.get(i - 1).getSequenceNumber());
        }
    }

    private OutboxEvent reload(String accountId, UUID eventId) {
        return outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, accountId).stream()
            .filter(e -> e.getId().equals(eventId))
            .findFirst()
            .orElseThrow();
    }
}
