package com.flagship.token_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TokenLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenLedgerApplication.class, args);
    }
}
