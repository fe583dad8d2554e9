package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.order.OrderStatus;
import com.flagship.gold_ledger.order.OrderType;
import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class OrderResponse {

    @JsonProperty("tx_ref")
    String txRef;

    @JsonProperty("external_ref")
    String externalRef;

    @JsonProperty("type")
    OrderType type;

    @JsonProperty("initiator_id")
    String initiatorId;

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("source_account_id")
    String sourceAccountId;

    @JsonProperty("dest_account_id")
    String destAccountId;

    @JsonProperty("token_ids")
    List<Long> tokenIds;

    @JsonProperty("requested_assets")
    List<String> requestedAssets;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("settlement_date")
    LocalDate settlementDate;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("metadata")
    String metadata;

    @JsonProperty("status")
    OrderStatus status;

    @JsonProperty("signer_address")
    String signerAddress;

    @JsonProperty("signer_party")
    String signerParty;

    @JsonProperty("signed_at")
    Instant signedAt;

    @JsonProperty("executed_at")
    Instant executedAt;

    @JsonProperty("closing_reason")
    String closingReason;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static OrderResponse from(SettlementOrder order) {
        return OrderResponse.builder()
            .txRef(order.getTxRef())
            .externalRef(order.getExternalRef())
            .type(order.getType())
            .initiatorId(order.getInitiatorId())
            .counterpartyId(order.getCounterpartyId())
            .sourceAccountId(order.getSourceAccountId())
            .destAccountId(order.getDestAccountId())
            .tokenIds(order.getTokenIds())
            .requestedAssets(order.getRequestedAssets())
            .quantity(order.getQuantity())
            .settlementDate(order.getSettlementDate())
            .currency(order.getCurrency() != null ? order.getCurrency().name() : null)
            .price(order.getPrice())
            .fee(order.getFee())
            .metadata(order.getMetadata())
            .status(order.getStatus())
            .signerAddress(order.getSignerAddress())
            .signerParty(order.getSignerParty())
            .signedAt(order.getSignedAt())
            .executedAt(order.getExecutedAt())
            .closingReason(order.getClosingReason())
            .createdAt(order.getCreatedAt())
            .updatedAt(order.getUpdatedAt())
            .build();
    }
}
