package com.flagship.revenue_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RevenueLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RevenueLedgerApplication.class, args);
    }
}
