package com.txengine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.txengine.accounts.AccountSnapshot;
import lombok.Value;

/**
 * One row of the account report: {@code client,available,held,total,locked}.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class CsvAccountRow {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static CsvAccountRow from(AccountSnapshot snapshot) {
        return new CsvAccountRow(
            snapshot.getClientId(),
            snapshot.getAvailable().toPlainString(),
            snapshot.getHeld().toPlainString(),
            snapshot.getTotal().toPlainString(),
            snapshot.isLocked()
        );
    }
}
