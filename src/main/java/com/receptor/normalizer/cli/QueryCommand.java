package com.receptor.normalizer.cli;

import com.receptor.normalizer.catalog.CatalogLoadException;
import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.QueryOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.cli.output.ResultsPrinter;
import com.receptor.normalizer.cli.validation.QueryOptionsValidator;
import com.receptor.normalizer.context.NormalizerContext;
import com.receptor.normalizer.query.CatalogQuery;
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
import java.util.Set;
import java.util.concurrent.Callable;

/** Lists catalog symbols at one precision, filtered by functionality and an optional pattern. */
@Command(
        name = "query",
        mixinStandardHelpOptions = true,
        description = "Lists catalog symbols at a precision, filtered by functionality and pattern."
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    @Mixin
    private CommonOptions common;

    @Mixin
    private QueryOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        ResultsPrinter printer = new ResultsPrinter(spec.commandLine().getOut());
        try {
            ValidatedCommonOptions validated = new QueryOptionsValidator().validate(common, options);
            printer.printBanner("Catalog query", Map.of(
                    "Family", options.getFamily(),
                    "Species", options.getSpecies(),
                    "Precision", options.getPrecision(),
                    "Functionality", options.getFunctionality()));

            CatalogQuery query = new CatalogQuery(NormalizerContext.create(validated.getConfig()));
            Set<String> symbols = query.query(options.getFamily(), options.getSpecies(), options.getPrecision(),
                    options.getFunctionality(), options.getContains());
            printer.printLines(symbols);
            log.info("{} symbols matched", symbols.size());

            if (validated.getReportPath() != null) {
                BatchReportWriter writer = new BatchReportWriter();
                String heading = options.getFamily() + " " + options.getPrecision() + " symbols ("
                        + options.getSpecies() + ", " + options.getFunctionality() + ")";
                List<String> lines = new ArrayList<>(symbols);
                writer.write(validated.getReportPath(), writer.renderListing(heading, lines));
            }
            return NormalizeCommand.EXIT_OK;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return NormalizeCommand.EXIT_INVALID_OPTIONS;
        } catch (CatalogLoadException | ReportException e) {
            log.error("Catalog query failed", e);
            return NormalizeCommand.EXIT_FAILURES;
        }
    }
}
