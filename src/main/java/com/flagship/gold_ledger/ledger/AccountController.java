package com.flagship.gold_ledger.ledger;

import com.flagship.gold_ledger.ledger.dto.AccountResponse;
import com.flagship.gold_ledger.ledger.dto.BalanceUpdaterRequest;
import com.flagship.gold_ledger.ledger.dto.CreateAccountRequest;
import com.flagship.gold_ledger.ledger.dto.UpdateBalanceRequest;
import com.flagship.gold_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for the account ledger.
 *
 * Mutating calls identify the caller through the {@code X-Caller-Address} header; the
 * role checks themselves live in {@link AccountLedgerService}.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final AccountLedgerService ledgerService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        log.info("Received account creation request: memberId={}, address={}",
                request.getMemberId(), request.getAddress());
        String accountId = ledgerService.createAccount(caller, request.getMemberId(), request.getAddress());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountResponse.from(ledgerService.getAccount(accountId)));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(AccountResponse.from(ledgerService.getAccount(accountId)));
    }

    @GetMapping("/{accountId}/balance")
    public ResponseEntity<Map<String, Object>> getBalance(@PathVariable("accountId") String accountId) {
        long balance = ledgerService.getAccountBalance(accountId);
        return ResponseEntity.ok(Map.of("account_id", accountId, "balance", balance));
    }

    /**
     * Lists accounts by owning member or by linked address; exactly one filter is expected.
     */
    @GetMapping
    public ResponseEntity<List<AccountResponse>> findAccounts(
            @RequestParam(value = "member_id", required = false) String memberId,
            @RequestParam(value = "address", required = false) String address) {
        List<Account> accounts;
        if (memberId != null) {
            accounts = ledgerService.getAccountsByMember(memberId);
        } else if (address != null) {
            accounts = ledgerService.getAccountsByAddress(address);
        } else {
            throw new IllegalArgumentException("Either member_id or address is required");
        }
        return ResponseEntity.ok(accounts.stream().map(AccountResponse::from).toList());
    }

    @PostMapping("/{accountId}/balance")
    public ResponseEntity<AccountResponse> updateBalance(
            @PathVariable("accountId") String accountId,
            @Valid @RequestBody UpdateBalanceRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        ledgerService.updateBalance(caller, accountId, request.getDelta(),
            request.getReason(), request.getReferenceId());
        return ResponseEntity.ok(AccountResponse.from(ledgerService.getAccount(accountId)));
    }

    @PutMapping("/balance-updaters/{holder}")
    public ResponseEntity<Map<String, Object>> setBalanceUpdater(
            @PathVariable("holder") String holder,
            @RequestBody BalanceUpdaterRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        ledgerService.setBalanceUpdater(caller, holder, request.isEnabled());
        return ResponseEntity.ok(Map.of("holder", holder, "enabled", request.isEnabled()));
    }
}
