package com.flagship.complaint_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplaintLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplaintLedgerApplication.class, args);
    }
}
