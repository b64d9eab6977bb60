package com.flagship.gift_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the gift ledger service.
 *
 * The lifecycle engine (catalog, inventory ledger, purchases, transfers and
 * redemptions) runs against a single PostgreSQL database whose connection pool
 * is opened when the context starts and closed when it shuts down.
 */
@SpringBootApplication
public class GiftLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GiftLedgerApplication.class, args);
    }
}
