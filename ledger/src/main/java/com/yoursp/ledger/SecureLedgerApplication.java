package com.yoursp.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SecureLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SecureLedgerApplication.class, args);
    }
}
