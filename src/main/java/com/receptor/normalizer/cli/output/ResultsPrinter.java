package com.receptor.normalizer.cli.output;

import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.model.JunctionResult;
import com.receptor.normalizer.model.StandardizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/**
 * Responsible only for CLI output. Results go to the command's output stream,
 * one tab separated line each; banners and summaries go to the log.
 */
public class ResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResultsPrinter.class);

    static final String FAILED = "FAILED";

    private final PrintWriter out;

    public ResultsPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printBanner(String title, Map<String, Object> settings) {
        log.info("=================================================");
        log.info(title);
        log.info("=================================================");
        settings.forEach((name, value) -> log.info("{}: {}", name, value == null ? "None" : value));
        log.info("=================================================");
    }

    public void printSymbolResults(List<StandardizationResult> results) {
        for (StandardizationResult result : results) {
            if (result.isSuccess()) {
                out.println(result.getOriginalInput() + "\t" + result.getHighestPrecision().orElse(""));
            } else {
                out.println(result.getOriginalInput() + "\t" + FAILED + "\t" + result.getError().orElse("")
                        + "\t" + result.getAttemptedFix().orElse(""));
            }
        }
        out.flush();
    }

    public void printJunctionResults(List<JunctionResult> results) {
        for (JunctionResult result : results) {
            if (result.isSuccess()) {
                out.println(result.getOriginalInput() + "\t" + result.getJunction().orElse(""));
            } else {
                out.println(result.getOriginalInput() + "\t" + FAILED + "\t" + result.getError().orElse("")
                        + "\t" + result.getAttemptedFix().orElse(""));
            }
        }
        out.flush();
    }

    public void printLines(Iterable<String> lines) {
        lines.forEach(out::println);
        out.flush();
    }

    public void printSummary(int total, int failed) {
        log.info("Processed: {}  Succeeded: {}  Failed: {}", total, total - failed, failed);
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        e.getErrors().forEach(error -> log.error("  - {}", error));
    }
}
