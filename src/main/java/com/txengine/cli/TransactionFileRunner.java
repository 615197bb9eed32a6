package com.txengine.cli;

import com.txengine.common.exception.TxEngineException;
import com.txengine.csv.TransactionFileProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code tx-engine <transactions.csv>}.
 *
 * Writes the account report to standard output. Logging goes to standard
 * error, so the report can be redirected on its own. Any failure is logged
 * and turned into a non-zero exit code; no report is written in that case.
 */
@Component
@Profile("!test")
@Slf4j
public class TransactionFileRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    private final TransactionFileProcessor processor;
    private final OutputStream out;

    private int exitCode;

    @Autowired
    public TransactionFileRunner(TransactionFileProcessor processor) {
        this(processor, System.out);
    }

    TransactionFileRunner(TransactionFileProcessor processor, OutputStream out) {
        this.processor = processor;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            log.error("Usage: tx-engine <transactions.csv>");
            exitCode = EXIT_USAGE;
            return;
        }

        Path input = Path.of(files.get(0));
        if (!Files.isReadable(input)) {
            log.error("Transaction file {} does not exist or is not readable", input);
            exitCode = EXIT_FAILURE;
            return;
        }

        try {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            processor.process(input, writer);
            writer.flush();
        } catch (TxEngineException e) {
            log.error("Processing aborted: {}", e.getMessage());
            log.debug("Processing failure", e);
            exitCode = EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Unable to write account report", e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
