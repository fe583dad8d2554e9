package com.flagship.gold_ledger.member;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds GOVERNANCE and PLATFORM on the configured bootstrap address so the registry can be
 * populated through the normal, role-checked operations afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RegistryBootstrap implements ApplicationRunner {

    private final MemberRegistryService registryService;

    @Value("${gift.registry.bootstrap-admin:}")
    private String bootstrapAdmin;

    @Override
    public void run(ApplicationArguments args) {
        if (bootstrapAdmin == null || bootstrapAdmin.isBlank()) {
            log.info("No registry bootstrap admin configured");
            return;
        }
        RoleSet current = registryService.getRoles(bootstrapAdmin);
        if (current.contains(Role.GOVERNANCE) && current.contains(Role.PLATFORM)) {
            log.debug("Bootstrap admin {} already holds {}", bootstrapAdmin, current);
            return;
        }
        registryService.grantBootstrapRoles(bootstrapAdmin, RoleSet.of(Role.GOVERNANCE, Role.PLATFORM));
        log.info("Bootstrap admin granted: address={}", bootstrapAdmin);
    }
}
