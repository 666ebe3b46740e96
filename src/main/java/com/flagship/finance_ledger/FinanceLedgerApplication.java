package com.flagship.finance_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FinanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceLedgerApplication.class, args);
    }
}
