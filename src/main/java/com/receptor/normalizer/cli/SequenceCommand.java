package com.receptor.normalizer.cli;

import com.receptor.normalizer.catalog.CatalogLoadException;
import com.receptor.normalizer.catalog.CatalogLookupException;
import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.SequenceOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.cli.output.ResultsPrinter;
import com.receptor.normalizer.cli.validation.SequenceOptionsValidator;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.query.SequenceLookup;
import com.receptor.normalizer.report.BatchReportWriter;
import com.receptor.normalizer.report.ReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/** Prints the catalogued amino acid regions of one allele symbol. */
@Command(
        name = "sequence",
        mixinStandardHelpOptions = true,
        description = "Prints the catalogued amino acid regions of one allele."
)
public class SequenceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SequenceCommand.class);

    @Mixin
    private CommonOptions common;

    @Mixin
    private SequenceOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ResultsPrinter printer = new ResultsPrinter(spec.commandLine().getOut());
        try {
            ValidatedCommonOptions validated = new SequenceOptionsValidator().validate(common, options);
            printer.printBanner("Sequence lookup", Map.of(
                    "Symbol", options.getSymbol(),
                    "Family", options.getFamily(),
                    "Species", options.getSpecies()));

            SequenceLookup lookup = new SequenceLookup(NormalizerContext.create(validated.getConfig()));
            Map<String, String> regions = lookup.getAminoAcidSequence(options.getSymbol(), options.getFamily(),
                    options.getSpecies());
            List<String> lines = new ArrayList<>();
            regions.forEach((region, sequence) -> lines.add(region + "\t" + sequence));
            printer.printLines(lines);

            if (validated.getReportPath() != null) {
                BatchReportWriter writer = new BatchReportWriter();
                writer.write(validated.getReportPath(), writer.renderListing(options.getSymbol(), lines));
            }
            return NormalizeCommand.EXIT_OK;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return NormalizeCommand.EXIT_INVALID_OPTIONS;
        } catch (CatalogLookupException e) {
            log.error("{}", e.getMessage());
            return NormalizeCommand.EXIT_FAILURES;
        } catch (CatalogLoadException | ReportException e) {
            log.error("Sequence lookup failed", e);
            return NormalizeCommand.EXIT_FAILURES;
        }
    }
}
