package com.txengine.csv;

import com.txengine.accounts.AccountSnapshot;
import com.txengine.engine.ProcessingSummary;
import com.txengine.engine.TransactionEngine;
import com.txengine.engine.TransactionEngineFactory;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a CSV transaction file through a fresh engine and writes the account report.
 *
 * The report is only written once every record has been applied; a decode or
 * validity failure propagates to the caller and leaves the output untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionFileProcessor {

    private final TransactionEngineFactory engineFactory;
    private final Validator validator;

    private final CsvAccountWriter accountWriter = new CsvAccountWriter();

    public ProcessingSummary process(Path input, Writer output) {
        log.info("Processing transaction file {}", input);
        CsvTransactionReader records = CsvTransactionReader.open(input, validator);
        try {
            return process(records, output);
        } finally {
            close(records);
        }
    }

    public ProcessingSummary process(Reader input, Writer output) {
        CsvTransactionReader records = CsvTransactionReader.of(input, validator);
        try {
            return process(records, output);
        } finally {
            close(records);
        }
    }

    private ProcessingSummary process(CsvTransactionReader records, Writer output) {
        TransactionEngine engine = engineFactory.create();
        ProcessingSummary summary = engine.processRecords(records);

        List<AccountSnapshot> accounts = engine.accounts();
        accountWriter.write(accounts, output);
        return summary;
    }

    private void close(CsvTransactionReader records) {
        try {
            records.close();
        } catch (IOException e) {
            log.warn("Unable to close transaction input", e);
        }
    }
}
