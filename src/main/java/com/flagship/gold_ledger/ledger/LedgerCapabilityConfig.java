package com.flagship.gold_ledger.ledger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Issues the ledger write capabilities. These two beans are the only ones that exist.
 */
@Configuration
public class LedgerCapabilityConfig {

    @Bean
    public LedgerWriteCapability assetCustodyLedgerCapability(AccountLedgerService ledgerService) {
        return ledgerService.grantWriteCapability(LedgerWriteCapability.ASSET_CUSTODY);
    }

    @Bean
    public LedgerWriteCapability orderSettlementLedgerCapability(AccountLedgerService ledgerService) {
        return ledgerService.grantWriteCapability(LedgerWriteCapability.ORDER_SETTLEMENT);
    }
}
