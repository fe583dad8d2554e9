package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.order.OrderType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class PrepareOrderRequest {

    @JsonProperty("external_ref")
    String externalRef;

    @NotBlank(message = "Transaction reference is required")
    @JsonProperty("tx_ref")
    String txRef;

    @NotNull(message = "Order type is required")
    @JsonProperty("type")
    OrderType type;

    @NotBlank(message = "Initiator ID is required")
    @JsonProperty("initiator_id")
    String initiatorId;

    @NotBlank(message = "Counterparty ID is required")
    @JsonProperty("counterparty_id")
    String counterpartyId;

    @NotBlank(message = "Source account ID is required")
    @JsonProperty("source_account_id")
    String sourceAccountId;

    @NotBlank(message = "Destination account ID is required")
    @JsonProperty("dest_account_id")
    String destAccountId;

    @JsonProperty("token_ids")
    List<Long> tokenIds;

    @JsonProperty("requested_assets")
    List<String> requestedAssets;

    @JsonProperty("settlement_date")
    LocalDate settlementDate;

    @JsonProperty("currency")
    String currency;

    @DecimalMin(value = "0", message = "Price cannot be negative")
    @JsonProperty("price")
    BigDecimal price;

    @DecimalMin(value = "0", message = "Fee cannot be negative")
    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("metadata")
    String metadata;
}
