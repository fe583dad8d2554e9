package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.member.Member;
import com.flagship.gold_ledger.member.MemberStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class MemberResponse {

    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("name")
    String name;

    @JsonProperty("country")
    String country;

    @JsonProperty("status")
    MemberStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static MemberResponse from(Member member) {
        return MemberResponse.builder()
            .memberId(member.getMemberId())
            .name(member.getName())
            .country(member.getCountry())
            .status(member.getStatus())
            .createdAt(member.getCreatedAt())
            .updatedAt(member.getUpdatedAt())
            .build();
    }
}
