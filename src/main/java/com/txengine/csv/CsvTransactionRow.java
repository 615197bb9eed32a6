package com.txengine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.txengine.transactions.TransactionRecord;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of a transaction file, as bound from the CSV columns
 * {@code type,client,tx,amount}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class CsvTransactionRow {

    @NotBlank(message = "type is required")
    private String type;

    @NotNull(message = "client is required")
    @Min(value = 0, message = "client must not be negative")
    @Max(value = TransactionRecord.MAX_CLIENT_ID, message = "client must not exceed " + TransactionRecord.MAX_CLIENT_ID)
    private Integer client;

    @NotNull(message = "tx is required")
    @Min(value = 0, message = "tx must not be negative")
    @Max(value = TransactionRecord.MAX_TRANSACTION_ID, message = "tx must not exceed " + TransactionRecord.MAX_TRANSACTION_ID)
    private Long tx;

    /**
     * Absent for disputes, resolves and chargebacks.
     */
    @DecimalMin(value = "0", message = "amount must not be negative")
    private BigDecimal amount;
}
