package com.txengine.csv;

import com.txengine.common.Money;
import com.txengine.common.exception.RecordDecodeException;
import com.txengine.transactions.TransactionRecord;
import com.txengine.transactions.TransactionType;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for decoding transaction files.
 */
class CsvTransactionReaderTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    void testReadsAllTransactionTypes() {
        List<TransactionRecord> records = readAll(
            "type,client,tx,amount\n"
                + "deposit,1,1,1.0\n"
                + "withdrawal,2,2,2.5\n"
                + "dispute,1,1,\n"
                + "resolve,1,1,\n"
                + "chargeback,1,1,\n");

        assertEquals(5, records.size());

        TransactionRecord withdrawal = records.get(1);
        assertEquals(TransactionType.WITHDRAWAL, withdrawal.getType());
        assertEquals(2, withdrawal.getClientId());
        assertEquals(2L, withdrawal.getTransactionId());
        assertEquals(Optional.of(Money.of("2.5")), withdrawal.getAmount());

        assertEquals(TransactionType.DISPUTE, records.get(2).getType());
        assertTrue(records.get(2).getAmount().isEmpty());
        assertEquals(TransactionType.RESOLVE, records.get(3).getType());
        assertEquals(TransactionType.CHARGEBACK, records.get(4).getType());
    }

    @Test
    void testTrimsWhitespaceAndToleratesMissingAmountColumn() {
        List<TransactionRecord> records = readAll(
            "type,client,tx,amount\n"
                + "deposit,  1 , 7 ,  1.2345 \n"
                + "\n"
                + "dispute, 1, 7\n");

        assertEquals(2, records.size());
        assertEquals(Money.of("1.2345"), records.get(0).getAmount().orElseThrow());
        assertEquals(7L, records.get(1).getTransactionId());
        assertTrue(records.get(1).getAmount().isEmpty());
    }

    @Test
    void testAcceptsFullUnsignedRanges() {
        List<TransactionRecord> records = readAll(
            "type,client,tx,amount\n"
                + "deposit,65535,4294967295,0\n");

        assertEquals(65535, records.get(0).getClientId());
        assertEquals(4294967295L, records.get(0).getTransactionId());
        assertTrue(records.get(0).getAmount().orElseThrow().isZero());
    }

    @Test
    void testAmountPresenceIsNotCheckedHere() {
        // Shape errors are left to the engine
        List<TransactionRecord> records = readAll(
            "type,client,tx,amount\n"
                + "deposit,1,1,\n"
                + "dispute,1,1,5.0\n");

        assertFalse(records.get(0).isValid());
        assertFalse(records.get(1).isValid());
    }

    @Test
    void testUnknownTypeFails() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,1,1,1.0\n"
                + "transfer,1,2,1.0\n"));

        assertTrue(e.getMessage().contains("Unknown transaction type 'transfer'"), e.getMessage());
        assertTrue(e.getMessage().startsWith("Line "), e.getMessage());
    }

    @Test
    void testNegativeAmountFails() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,1,1,-1.0\n"));

        assertTrue(e.getMessage().contains("amount must not be negative"), e.getMessage());
    }

    @Test
    void testClientOutOfRangeFails() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,65536,1,1.0\n"));

        assertTrue(e.getMessage().contains("client must not exceed 65535"), e.getMessage());
    }

    @Test
    void testTransactionIdOutOfRangeFails() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,1,4294967296,1.0\n"));

        assertTrue(e.getMessage().contains("tx must not exceed 4294967295"), e.getMessage());
    }

    @Test
    void testNonNumericFieldFails() {
        assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,one,1,1.0\n"));
        assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,1,1,ten\n"));
    }

    @Test
    void testMissingClientFails() {
        RecordDecodeException e = assertThrows(RecordDecodeException.class, () -> readAll(
            "type,client,tx,amount\n"
                + "deposit,,1,1.0\n"));

        assertTrue(e.getMessage().contains("client is required"), e.getMessage());
    }

    @Test
    void testEmptyInputYieldsNoRecords() {
        assertTrue(readAll("type,client,tx,amount\n").isEmpty());
    }

    @Test
    void testMissingFileFails(@TempDir Path dir) {
        Path missing = dir.resolve("missing.csv");

        RecordDecodeException e = assertThrows(RecordDecodeException.class,
            () -> CsvTransactionReader.open(missing, validator));
        assertEquals(-1, e.getLineNumber());
    }

    @Test
    void testSkipsLeadingByteOrderMark(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("export.csv"),
            "\uFEFFtype,client,tx,amount\n"
                + "deposit,1,1,1.0\n");

        List<TransactionRecord> records = new ArrayList<>();
        try (CsvTransactionReader reader = CsvTransactionReader.open(file, validator)) {
            reader.forEachRemaining(records::add);
        }

        assertEquals(1, records.size());
        assertEquals(TransactionType.DEPOSIT, records.get(0).getType());
        assertEquals(Money.of("1.0"), records.get(0).getAmount().orElseThrow());
    }

    @Test
    void testSkipsByteOrderMarkOnReaderInput() {
        List<TransactionRecord> records = readAll("\uFEFFtype,client,tx,amount\ndispute,1,1,\n");

        assertEquals(1, records.size());
        assertEquals(TransactionType.DISPUTE, records.get(0).getType());
    }

    @Test
    void testReaderClosedWhenHeaderUnreadable() {
        AtomicBoolean closed = new AtomicBoolean();
        Reader broken = new Reader() {
            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("device not ready");
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };

        RecordDecodeException e = assertThrows(RecordDecodeException.class,
            () -> CsvTransactionReader.of(broken, validator));

        assertTrue(e.getMessage().contains("device not ready"), e.getMessage());
        assertTrue(closed.get());
    }

    private static List<TransactionRecord> readAll(String csv) {
        List<TransactionRecord> records = new ArrayList<>();
        CsvTransactionReader reader = CsvTransactionReader.of(new StringReader(csv), validator);
        reader.forEachRemaining(records::add);
        return records;
    }
}
