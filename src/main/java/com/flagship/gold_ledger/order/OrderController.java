package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.observability.CorrelationContext;
import com.flagship.gold_ledger.order.dto.CloseOrderRequest;
import com.flagship.gold_ledger.order.dto.ExecutionOptionsRequest;
import com.flagship.gold_ledger.order.dto.ExecutionOptionsResponse;
import com.flagship.gold_ledger.order.dto.OrderResponse;
import com.flagship.gold_ledger.order.dto.PrepareOrderRequest;
import com.flagship.gold_ledger.order.dto.SignOrderRequest;
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

import java.util.HexFormat;
import java.util.List;

/**
 * REST endpoints for the settlement protocol.
 *
 * The transaction reference doubles as the idempotency key: preparing the same reference
 * twice is rejected with 409 rather than creating a second order.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final OrderSettlementService settlementService;

    @PostMapping
    public ResponseEntity<OrderResponse> prepareOrder(
            @Valid @RequestBody PrepareOrderRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        log.info("Received order preparation request: txRef={}, type={}", request.getTxRef(), request.getType());

        CurrencyCode currency = null;
        if (request.getCurrency() != null && !request.getCurrency().isBlank()) {
            try {
                currency = CurrencyCode.valueOf(request.getCurrency().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid currency code: " + request.getCurrency());
            }
        }

        String txRef = settlementService.prepareOrder(
            caller,
            request.getExternalRef(),
            request.getTxRef(),
            request.getType(),
            request.getInitiatorId(),
            request.getCounterpartyId(),
            request.getSourceAccountId(),
            request.getDestAccountId(),
            request.getTokenIds(),
            request.getRequestedAssets(),
            request.getSettlementDate(),
            currency,
            request.getPrice(),
            request.getFee(),
            request.getMetadata()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(OrderResponse.from(settlementService.getOrder(txRef)));
    }

    @GetMapping("/{txRef}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("txRef") String txRef) {
        return ResponseEntity.ok(OrderResponse.from(settlementService.getOrder(txRef)));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrdersByStatus(@RequestParam("status") OrderStatus status) {
        return ResponseEntity.ok(settlementService.getOrdersByStatus(status).stream()
            .map(OrderResponse::from)
            .toList());
    }

    @PostMapping("/{txRef}/sign")
    public ResponseEntity<OrderResponse> signOrder(
            @PathVariable("txRef") String txRef,
            @Valid @RequestBody SignOrderRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        String hex = request.getSignature().startsWith("0x")
            ? request.getSignature().substring(2)
            : request.getSignature();
        SettlementOrder order = settlementService.signOrder(
            caller, txRef, HexFormat.of().parseHex(hex), request.getParty());
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @PostMapping("/{txRef}/execute")
    public ResponseEntity<OrderResponse> executeOrder(
            @PathVariable("txRef") String txRef,
            @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(OrderResponse.from(settlementService.executeOrder(caller, txRef)));
    }

    @PostMapping("/{txRef}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable("txRef") String txRef,
            @Valid @RequestBody CloseOrderRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(OrderResponse.from(
            settlementService.cancelOrder(caller, txRef, request.getReason())));
    }

    @PostMapping("/{txRef}/fail")
    public ResponseEntity<OrderResponse> failOrder(
            @PathVariable("txRef") String txRef,
            @Valid @RequestBody CloseOrderRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        return ResponseEntity.ok(OrderResponse.from(
            settlementService.failOrder(caller, txRef, request.getReason())));
    }

    @GetMapping("/execution-options")
    public ResponseEntity<ExecutionOptionsResponse> getExecutionOptions() {
        return ResponseEntity.ok(ExecutionOptionsResponse.from(settlementService.getExecutionOptions()));
    }

    @PutMapping("/execution-options")
    public ResponseEntity<ExecutionOptionsResponse> setExecutionOptions(
            @RequestBody ExecutionOptionsRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        ExecutionOptions options = settlementService.setExecutionOptions(
            caller, request.isOnChainTransfer(), request.isAutoLedgerUpdate());
        return ResponseEntity.ok(ExecutionOptionsResponse.from(options));
    }
}
