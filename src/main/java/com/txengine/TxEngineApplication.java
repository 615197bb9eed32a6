package com.txengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the transaction engine.
 *
 * Reads a CSV file of deposits, withdrawals, disputes, resolves and
 * chargebacks, applies them to per-client accounts and prints the
 * resulting balances as CSV.
 */
@SpringBootApplication
public class TxEngineApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TxEngineApplication.class, args)));
    }
}
