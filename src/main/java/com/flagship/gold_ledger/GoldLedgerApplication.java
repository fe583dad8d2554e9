package com.flagship.gold_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GoldLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoldLedgerApplication.class, args);
    }
}
