package com.receptor.normalizer.cli;

import com.receptor.normalizer.catalog.CatalogLoadException;
import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.JunctionOptions;
import com.receptor.normalizer.cli.model.ValidatedJunctionOptions;
import com.receptor.normalizer.cli.output.ResultsPrinter;
import com.receptor.normalizer.cli.validation.JunctionOptionsValidator;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.junction.JunctionRequest;
import com.receptor.normalizer.junction.JunctionStandardizer;
import com.receptor.normalizer.model.JunctionResult;
import com.receptor.normalizer.report.BatchReportWriter;
import com.receptor.normalizer.report.ReportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/** Standardizes junction or CDR3 sequences against the germline V and J segments. */
@Command(
        name = "junction",
        mixinStandardHelpOptions = true,
        description = "Verifies, trims or reconstructs CDR3 junction boundaries."
)
public class JunctionCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(JunctionCommand.class);

    @Mixin
    private CommonOptions common;

    @Mixin
    private JunctionOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ResultsPrinter printer = new ResultsPrinter(spec.commandLine().getOut());
        try {
            ValidatedJunctionOptions validated = new JunctionOptionsValidator().validate(common, options);
            printer.printBanner("Junction standardization", banner(validated));

            JunctionStandardizer standardizer = new JunctionStandardizer(
                    NormalizerContext.create(validated.getCommon().getConfig()));
            List<JunctionResult> results = new ArrayList<>();
            for (String sequence : options.getSequences()) {
                results.add(standardizer.standardize(JunctionRequest.builder()
                        .sequence(sequence)
                        .locus(options.getLocus())
                        .vSymbol(options.getVSymbol())
                        .jSymbol(options.getJSymbol())
                        .species(options.getSpecies())
                        .settings(validated.getSettings())
                        .strict(options.isStrict())
                        .build()));
            }
            printer.printJunctionResults(results);

            int failed = (int) results.stream().filter(JunctionResult::isFailed).count();
            printer.printSummary(results.size(), failed);

            if (validated.getCommon().getReportPath() != null) {
                BatchReportWriter writer = new BatchReportWriter();
                String heading = "Junctions (" + (options.getLocus() == null ? "pattern only" : options.getLocus())
                        + ", " + options.getSpecies() + ")";
                writer.write(validated.getCommon().getReportPath(), writer.renderJunctionReport(heading, results));
            }
            return failed == 0 ? NormalizeCommand.EXIT_OK : NormalizeCommand.EXIT_FAILURES;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return NormalizeCommand.EXIT_INVALID_OPTIONS;
        } catch (IllegalArgumentException e) {
            log.error("Invalid V or J symbol: {}", e.getMessage());
            return NormalizeCommand.EXIT_INVALID_OPTIONS;
        } catch (CatalogLoadException | ReportException e) {
            log.error("Junction standardization failed", e);
            return NormalizeCommand.EXIT_FAILURES;
        }
    }

    private Map<String, Object> banner(ValidatedJunctionOptions validated) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("Locus", options.getLocus() == null ? "None (pattern check)" : options.getLocus());
        settings.put("Species", options.getSpecies());
        settings.put("V Symbol", options.getVSymbol());
        settings.put("J Symbol", options.getJSymbol());
        settings.put("Settings", validated.getSettings());
        settings.put("Catalog Directory", validated.getCommon().getConfig().getCatalogDir());
        settings.put("Report", validated.getCommon().getReportPath());
        return settings;
    }
}
