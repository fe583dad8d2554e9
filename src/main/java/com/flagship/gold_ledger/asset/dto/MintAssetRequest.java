package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class MintAssetRequest {

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner")
    String owner;

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Serial number is required")
    @JsonProperty("serial_number")
    String serialNumber;

    @NotBlank(message = "Refiner is required")
    @JsonProperty("refiner")
    String refiner;

    @NotNull(message = "Weight is required")
    @Positive(message = "Weight must be greater than 0")
    @JsonProperty("weight_grams")
    Long weightGrams;

    @NotNull(message = "Fineness is required")
    @Min(value = 1, message = "Fineness must be at least 1")
    @Max(value = 10000, message = "Fineness must be at most 10000")
    @JsonProperty("fineness")
    Integer fineness;

    @JsonProperty("product_type")
    String productType;

    @NotBlank(message = "Certificate hash is required")
    @JsonProperty("certificate_hash")
    String certificateHash;

    @NotBlank(message = "Member ID is required")
    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("certified")
    boolean certified;

    @NotBlank(message = "Warrant ID is required")
    @JsonProperty("warrant_id")
    String warrantId;
}
