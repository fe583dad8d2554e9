package com.flagship.gold_ledger.member;

import com.flagship.gold_ledger.member.dto.BlacklistRequest;
import com.flagship.gold_ledger.member.dto.MemberResponse;
import com.flagship.gold_ledger.member.dto.RegisterMemberRequest;
import com.flagship.gold_ledger.member.dto.RoleChangeRequest;
import com.flagship.gold_ledger.member.dto.RolesResponse;
import com.flagship.gold_ledger.member.dto.UpdateMemberStatusRequest;
import com.flagship.gold_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

/**
 * Administrative endpoints for populating the authorization registry.
 */
@RestController
@RequestMapping("/api/members")
@RequiredArgsConstructor
public class MemberController {

    private static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final MemberRegistryService registryService;

    @PostMapping
    public ResponseEntity<MemberResponse> registerMember(
            @Valid @RequestBody RegisterMemberRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        Member member = registryService.registerMember(
            caller, request.getMemberId(), request.getName(), request.getCountry());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(member));
    }

    @GetMapping("/{memberId}")
    public ResponseEntity<MemberResponse> getMember(@PathVariable("memberId") String memberId) {
        return ResponseEntity.ok(MemberResponse.from(registryService.getMember(memberId)));
    }

    @PutMapping("/{memberId}/status")
    public ResponseEntity<MemberResponse> updateStatus(
            @PathVariable("memberId") String memberId,
            @Valid @RequestBody UpdateMemberStatusRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        Member member = registryService.updateMemberStatus(caller, memberId, request.getStatus());
        return ResponseEntity.ok(MemberResponse.from(member));
    }

    @PostMapping("/roles/grant")
    public ResponseEntity<RolesResponse> assignRoles(
            @Valid @RequestBody RoleChangeRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        RoleSet roles = registryService.assignRoles(
            caller, request.getAddress(), request.getMemberId(), RoleSet.of(request.getRoles()));
        return ResponseEntity.ok(RolesResponse.of(request.getAddress(), roles,
            registryService.isBlacklisted(request.getAddress())));
    }

    @PostMapping("/roles/revoke")
    public ResponseEntity<RolesResponse> revokeRoles(
            @Valid @RequestBody RoleChangeRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        RoleSet roles = registryService.revokeRoles(caller, request.getAddress(), RoleSet.of(request.getRoles()));
        return ResponseEntity.ok(RolesResponse.of(request.getAddress(), roles,
            registryService.isBlacklisted(request.getAddress())));
    }

    @PutMapping("/blacklist")
    public ResponseEntity<RolesResponse> setBlacklisted(
            @Valid @RequestBody BlacklistRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        registryService.setBlacklisted(caller, request.getAddress(), request.isBlacklisted(), request.getReason());
        return ResponseEntity.ok(RolesResponse.of(request.getAddress(),
            registryService.getRoles(request.getAddress()), request.isBlacklisted()));
    }

    @GetMapping("/roles")
    public ResponseEntity<RolesResponse> getRoles(@RequestParam("address") String address) {
        return ResponseEntity.ok(RolesResponse.of(address,
            registryService.getRoles(address), registryService.isBlacklisted(address)));
    }
}
