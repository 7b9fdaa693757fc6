package com.receptor.normalizer.cli;

import com.receptor.normalizer.catalog.CatalogLoadException;
import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.SymbolOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.cli.output.ResultsPrinter;
import com.receptor.normalizer.cli.validation.SymbolOptionsValidator;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.model.StandardizationResult;
import com.receptor.normalizer.report.BatchReportWriter;
import com.receptor.normalizer.report.ReportException;
import com.receptor.normalizer.symbol.SymbolRequest;
import com.receptor.normalizer.symbol.SymbolStandardizer;
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

/** Standardizes the gene symbols given as arguments, one result line each. */
@Command(
        name = "symbol",
        mixinStandardHelpOptions = true,
        description = "Standardizes TR, IG or MH gene symbols."
)
public class SymbolCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SymbolCommand.class);

    @Mixin
    private CommonOptions common;

    @Mixin
    private SymbolOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ResultsPrinter printer = new ResultsPrinter(spec.commandLine().getOut());
        try {
            ValidatedCommonOptions validated = new SymbolOptionsValidator().validate(common, options);
            printer.printBanner("Symbol standardization", banner(validated));

            SymbolStandardizer standardizer = new SymbolStandardizer(NormalizerContext.create(validated.getConfig()));
            List<StandardizationResult> results = new ArrayList<>();
            for (String symbol : options.getSymbols()) {
                results.add(standardizer.standardize(SymbolRequest.builder()
                        .symbol(symbol)
                        .family(options.getFamily())
                        .species(options.getSpecies())
                        .enforceFunctional(options.isEnforceFunctional())
                        .allowSubgroup(options.isAllowSubgroup())
                        .precision(options.getPrecision())
                        .build()));
            }
            printer.printSymbolResults(results);

            int failed = (int) results.stream().filter(StandardizationResult::isFailed).count();
            printer.printSummary(results.size(), failed);

            if (validated.getReportPath() != null) {
                BatchReportWriter writer = new BatchReportWriter();
                String heading = options.getFamily() + " symbols (" + options.getSpecies() + ")";
                writer.write(validated.getReportPath(), writer.renderSymbolReport(heading, results));
            }
            return failed == 0 ? NormalizeCommand.EXIT_OK : NormalizeCommand.EXIT_FAILURES;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return NormalizeCommand.EXIT_INVALID_OPTIONS;
        } catch (CatalogLoadException | ReportException e) {
            log.error("Symbol standardization failed", e);
            return NormalizeCommand.EXIT_FAILURES;
        }
    }

    private Map<String, Object> banner(ValidatedCommonOptions validated) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("Family", options.getFamily());
        settings.put("Species", options.getSpecies());
        settings.put("Enforce Functional", options.isEnforceFunctional());
        settings.put("Allow Subgroup", options.isAllowSubgroup());
        settings.put("Precision", options.getPrecision());
        settings.put("Catalog Directory", validated.getConfig().getCatalogDir());
        settings.put("Report", validated.getReportPath());
        return settings;
    }
}
