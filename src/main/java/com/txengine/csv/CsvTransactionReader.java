package com.txengine.csv;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.txengine.common.Money;
import com.txengine.common.exception.RecordDecodeException;
import com.txengine.transactions.TransactionRecord;
import com.txengine.transactions.TransactionType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Streams {@link TransactionRecord}s out of a CSV transaction file.
 *
 * The first line is the header {@code type,client,tx,amount}. Fields are
 * trimmed, blank lines are skipped, and the amount column may be empty or
 * missing altogether. Any row that cannot be turned into a record makes
 * {@link #hasNext()} or {@link #next()} throw a {@link RecordDecodeException}
 * carrying the offending line.
 *
 * Whether a record's amount fits its type is not checked here; that is the
 * engine's validity rule.
 */
@Slf4j
public class CsvTransactionReader implements Iterator<TransactionRecord>, Closeable {

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.TRIM_SPACES)
        .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
        .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
        .enable(CsvParser.Feature.ALLOW_TRAILING_COMMA)
        .build();

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

    private static final int BYTE_ORDER_MARK = '\uFEFF';

    private final MappingIterator<CsvTransactionRow> rows;
    private final Validator validator;

    CsvTransactionReader(MappingIterator<CsvTransactionRow> rows, Validator validator) {
        this.rows = rows;
        this.validator = validator;
    }

    public static CsvTransactionReader open(Path path, Validator validator) {
        Reader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RecordDecodeException("Unable to read transaction file " + path + ": " + e.getMessage(), -1, e);
        }
        return of(reader, validator);
    }

    /**
     * Read records from the given reader, which the returned instance takes
     * over. The reader is closed right away if the header cannot be read.
     */
    public static CsvTransactionReader of(Reader reader, Validator validator) {
        try {
            MappingIterator<CsvTransactionRow> rows = MAPPER
                .readerFor(CsvTransactionRow.class)
                .with(SCHEMA)
                .readValues(skipByteOrderMark(reader));
            return new CsvTransactionReader(rows, validator);
        } catch (IOException e) {
            RecordDecodeException failure =
                new RecordDecodeException("Unable to read transaction header: " + e.getMessage(), 1, e);
            try {
                reader.close();
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            }
            throw failure;
        }
    }

    // Otherwise a leading byte order mark ends up in the first header name
    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader in = new PushbackReader(reader, 1);
        int first = in.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            in.unread(first);
        }
        return in;
    }

    @Override
    public boolean hasNext() {
        try {
            return rows.hasNextValue();
        } catch (IOException e) {
            throw decodeFailure(e);
        }
    }

    @Override
    public TransactionRecord next() {
        CsvTransactionRow row;
        try {
            if (!rows.hasNextValue()) {
                throw new NoSuchElementException("No more transaction records");
            }
            row = rows.nextValue();
        } catch (IOException e) {
            throw decodeFailure(e);
        }
        return toRecord(row, currentLine());
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }

    private TransactionRecord toRecord(CsvTransactionRow row, long line) {
        Set<ConstraintViolation<CsvTransactionRow>> violations = validator.validate(row);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.joining(", "));
            throw new RecordDecodeException(message, line);
        }

        TransactionType type = TransactionType.fromCode(row.getType())
            .orElseThrow(() -> new RecordDecodeException("Unknown transaction type '" + row.getType() + "'", line));

        TransactionRecord record = TransactionRecord.builder()
            .type(type)
            .clientId(row.getClient())
            .transactionId(row.getTx())
            .amount(row.getAmount() == null ? null : Money.of(row.getAmount()))
            .build();

        log.trace("Line {}: {}", line, record);
        return record;
    }

    private RecordDecodeException decodeFailure(IOException e) {
        long line = currentLine();
        if (e instanceof JsonProcessingException) {
            JsonLocation location = ((JsonProcessingException) e).getLocation();
            if (location != null && location.getLineNr() > 0) {
                line = location.getLineNr();
            }
            return new RecordDecodeException(((JsonProcessingException) e).getOriginalMessage(), line, e);
        }
        return new RecordDecodeException("Unable to read transaction record: " + e.getMessage(), line, e);
    }

    private long currentLine() {
        JsonLocation location = rows.getParser().getTokenLocation();
        return location == null ? -1 : location.getLineNr();
    }
}
