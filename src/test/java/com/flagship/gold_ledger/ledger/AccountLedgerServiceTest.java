package com.flagship.gold_ledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gold_ledger.IntegrationTestBase;
import com.flagship.gold_ledger.exception.AuthorizationException;
import com.flagship.gold_ledger.exception.InsufficientBalanceException;
import com.flagship.gold_ledger.exception.MemberNotActiveException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxEvent;
import com.flagship.gold_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the account ledger: stored balances that can never go negative, written either by
 * operators or by the two services holding a ledger write capability.
 */
class AccountLedgerServiceTest extends IntegrationTestBase {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    @Qualifier("assetCustodyLedgerCapability")
    private LedgerWriteCapability assetCapability;

    private String platform;
    private String custodian;
    private String holder;
    private String accountId;

    @BeforeEach
    void setUp() {
        platform = addressWithRoles("platform", Role.PLATFORM);
        custodian = addressWithRoles("custodian", Role.CUSTODIAN);
        holder = uniqueAddress("holder");
        accountId = openAccount(holder);
    }

    @Nested
    @DisplayName("createAccount")
    class CreateAccount {

        @Test
        @DisplayName("Active member gets an IGAN account with zero balance")
        void testCreateAccount_ActiveMember() {
            printTestHeader("Create Account For Active Member");

            String memberId = activeMember();
            String address = uniqueAddress("owner");
            printInput("Member", memberId);

            String id = ledgerService.createAccount(platform, memberId, address);
            printOutput("Account ID", id);

            assertTrue(id.startsWith("IGAN-"), "Account id should carry the IGAN prefix");
            Account account = ledgerService.getAccount(id);
            assertEquals(0L, account.getBalance());
            assertEquals(memberId, account.getMemberId());
            assertEquals(address, account.getAddress());
            assertEquals(List.of(id), ledgerService.getAccountsByMember(memberId).stream()
                .map(Account::getAccountId).toList());

            List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, id);
            assertTrue(events.stream().anyMatch(e -> e.getEventType().equals("AccountCreated")),
                "AccountCreated should be written to the outbox");
            printSuccess("Account opened and audited");
        }

        @Test
        @DisplayName("Pending member cannot open an account")
        void testCreateAccount_PendingMember() {
            printTestHeader("Create Account For Pending Member");

            String memberId = "MBR-" + UUID.randomUUID().toString().substring(0, 8);
            registryService.registerMember(ADMIN, memberId, "Pending Member", "CH");

            MemberNotActiveException e = assertThrows(MemberNotActiveException.class,
                () -> ledgerService.createAccount(platform, memberId, uniqueAddress("pending")));
            printExpectedException("MemberNotActiveException", e.getMessage());
            assertTrue(ledgerService.getAccountsByMember(memberId).isEmpty());
        }

        @Test
        @DisplayName("Unknown member counts as not active")
        void testCreateAccount_UnknownMember() {
            String address = uniqueAddress("ghost");
            MemberNotActiveException e = assertThrows(MemberNotActiveException.class,
                () -> ledgerService.createAccount(platform, "MBR-missing", address));
            printExpectedException("MemberNotActiveException", e.getMessage());

            assertEquals(MemberNotActiveException.MEMBER_NOT_ACTIVE, e.getCode());
            assertTrue(ledgerService.getAccountsByAddress(address).isEmpty());
        }

        @Test
        @DisplayName("Caller without PLATFORM is rejected")
        void testCreateAccount_RequiresPlatform() {
            String memberId = activeMember();
            AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> ledgerService.createAccount(custodian, memberId, uniqueAddress("x")));
            assertEquals(AuthorizationException.UNAUTHORIZED_ROLE, e.getCode());
        }
    }

    @Nested
    @DisplayName("updateBalance")
    class UpdateBalance {

        @Test
        @DisplayName("Overdraft is rejected and leaves the balance unchanged")
        void testUpdateBalance_OverdraftRejected() {
            printTestHeader("Credit 10 Then Debit 15");

            long afterCredit = ledgerService.updateBalance(platform, accountId, 10, "DEPOSIT", "REF-1");
            printOutput("Balance after +10", afterCredit);
            assertEquals(10L, afterCredit);

            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> ledgerService.updateBalance(platform, accountId, -15, "WITHDRAW", "REF-2"));
            printExpectedException("InsufficientBalanceException", e.getMessage());

            Account account = ledgerService.getAccount(accountId);
            assertEquals(10L, account.getBalance(), "Failed debit must not change the balance");
            assertEquals("DEPOSIT", account.getLastReason());
            assertEquals("REF-1", account.getLastReference());
            printSuccess("Balance stays at 10");
        }

        @Test
        @DisplayName("Debit down to exactly zero is allowed")
        void testUpdateBalance_DebitToZero() {
            ledgerService.updateBalance(custodian, accountId, 3, "DEPOSIT", "REF-A");
            assertEquals(0L, ledgerService.updateBalance(custodian, accountId, -3, "WITHDRAW", "REF-B"));
        }

        @Test
        @DisplayName("Unknown account is rejected")
        void testUpdateBalance_UnknownAccount() {
            assertThrows(NotFoundException.class,
                () -> ledgerService.updateBalance(platform, "IGAN-0", 1, "DEPOSIT", "REF"));
        }

        @Test
        @DisplayName("Caller without PLATFORM or CUSTODIAN is rejected")
        void testUpdateBalance_RequiresOperator() {
            String auditor = addressWithRoles("auditor", Role.AUDITOR);
            assertThrows(AuthorizationException.class,
                () -> ledgerService.updateBalance(auditor, accountId, 1, "DEPOSIT", "REF"));
            assertEquals(0L, ledgerService.getAccountBalance(accountId));
        }

        @Test
        @DisplayName("Every successful update writes a BalanceUpdated event")
        void testUpdateBalance_EmitsEvent() throws Exception {
            ledgerService.updateBalance(platform, accountId, 7, "DEPOSIT", "REF-7");

            List<OutboxEvent> events = outboxService.getEventsForAggregate(AggregateTypes.ACCOUNT, accountId);
            OutboxEvent updated = events.stream()
                .filter(e -> e.getEventType().equals("BalanceUpdated"))
                .findFirst()
                .orElseThrow();
            JsonNode payload = objectMapper.readTree(updated.getPayload());
            assertEquals(7L, payload.get("newBalance").asLong());
            assertEquals("operator", payload.get("channel").asText());
            assertEquals(platform, payload.get("updatedBy").asText());
        }
    }

    @Nested
    @DisplayName("updateBalanceFromContract")
    class ContractUpdates {

        @Test
        @DisplayName("Issued capability can credit an account")
        void testContractUpdate_IssuedCapability() {
            long balance = ledgerService.updateBalanceFromContract(assetCapability, accountId, 1, "MINT", "42");
            assertEquals(1L, balance);
        }

        @Test
        @DisplayName("Disabled capability holder is rejected until re-enabled")
        void testContractUpdate_DisabledHolder() {
            printTestHeader("Disable Balance Updater");

            String holderName = assetCapability.getHolder();
            ledgerService.setBalanceUpdater(platform, holderName, false);
            try {
                assertFalse(ledgerService.isBalanceUpdaterEnabled(holderName));
                AuthorizationException e = assertThrows(AuthorizationException.class,
                    () -> ledgerService.updateBalanceFromContract(assetCapability, accountId, 1, "MINT", "1"));
                printExpectedException("AuthorizationException", e.getMessage());
            } finally {
                ledgerService.setBalanceUpdater(platform, holderName, true);
            }

            assertTrue(ledgerService.isBalanceUpdaterEnabled(holderName));
            assertEquals(1L, ledgerService.updateBalanceFromContract(assetCapability, accountId, 1, "MINT", "1"));
            printSuccess("Holder re-enabled");
        }

        @Test
        @DisplayName("A capability the ledger never issued is rejected")
        void testContractUpdate_ForeignCapability() {
            LedgerWriteCapability forged = new LedgerWriteCapability(LedgerWriteCapability.ASSET_CUSTODY);
            assertThrows(AuthorizationException.class,
                () -> ledgerService.updateBalanceFromContract(forged, accountId, 1, "MINT", "1"));
        }

        @Test
        @DisplayName("Only PLATFORM can toggle a balance updater")
        void testSetBalanceUpdater_RequiresPlatform() {
            assertThrows(AuthorizationException.class,
                () -> ledgerService.setBalanceUpdater(custodian, LedgerWriteCapability.ORDER_SETTLEMENT, false));
            assertTrue(ledgerService.isBalanceUpdaterEnabled(LedgerWriteCapability.ORDER_SETTLEMENT));
        }
    }
}
