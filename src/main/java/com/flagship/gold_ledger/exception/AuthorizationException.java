package com.flagship.gold_ledger.exception;

import com.flagship.gold_ledger.member.Role;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Raised when the caller lacks the role, or the ownership, an operation requires.
 */
public class AuthorizationException extends GoldLedgerException {

    public static final String UNAUTHORIZED_ROLE = "UNAUTHORIZED_ROLE";
    public static final String NOT_ASSET_OWNER = "NOT_ASSET_OWNER";

    public AuthorizationException(String code, String message) {
        super(code, message);
    }

    public static AuthorizationException missingRole(String caller, Role... anyOf) {
        String roles = Arrays.stream(anyOf).map(Role::name).collect(Collectors.joining(" or "));
        return new AuthorizationException(UNAUTHORIZED_ROLE,
            String.format("Caller %s must hold %s", caller, roles));
    }

    public static AuthorizationException notOwner(String caller, long tokenId) {
        return new AuthorizationException(NOT_ASSET_OWNER,
            String.format("Caller %s is not the owner of asset %d and holds no asset operator role", caller, tokenId));
    }
}
