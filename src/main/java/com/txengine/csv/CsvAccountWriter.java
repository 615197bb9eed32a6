package com.txengine.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.txengine.accounts.AccountSnapshot;
import com.txengine.common.exception.TxEngineException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Renders account snapshots as CSV with the header
 * {@code client,available,held,total,locked}, one row per account in the
 * order given. The target writer is flushed but left open.
 */
@Slf4j
public class CsvAccountWriter {

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .build();

    private static final CsvSchema SCHEMA = MAPPER.schemaFor(CsvAccountRow.class).withoutHeader();

    // Written by hand so that an empty report still gets its header
    private static final String HEADER = StreamSupport.stream(SCHEMA.spliterator(), false)
        .map(CsvSchema.Column::getName)
        .collect(Collectors.joining(String.valueOf(SCHEMA.getColumnSeparator()), "", new String(SCHEMA.getLineSeparator())));

    public void write(List<AccountSnapshot> accounts, Writer out) {
        try {
            out.write(HEADER);
            try (SequenceWriter rows = MAPPER.writer(SCHEMA).writeValues(out)) {
                for (AccountSnapshot account : accounts) {
                    rows.write(CsvAccountRow.from(account));
                }
            }
            out.flush();
        } catch (IOException e) {
            throw new TxEngineException("Unable to write account report", e);
        }
        log.debug("Wrote {} account rows", accounts.size());
    }
}
