package com.receptor.normalizer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command line end to end against the bundled catalogs.
 */
class NormalizeCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new NormalizeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    @Test
    void testWithoutSubcommandPrintsUsage() {
        assertThat(run()).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
        assertThat(err.toString()).contains("symbol", "junction", "query", "sequence");
    }

    @ParameterizedTest
    @CsvSource({
            "symbol, 'Standardizes TR, IG or MH gene symbols.'",
            "junction, 'Verifies, trims or reconstructs CDR3 junction boundaries.'",
            "query, Lists catalog symbols at a precision",
            "sequence, Prints the catalogued amino acid regions of one allele."
    })
    void testSubcommandHelp(String subcommand, String description) {
        assertThat(run(subcommand, "--help")).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("Usage:", subcommand, description);
    }

    @Test
    void testSymbolSuccess() {
        int exitCode = run("symbol", "aj1", "TCRAV32S1", "-q");

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("aj1\tTRAJ1", "TCRAV32S1\tTRAV25");
    }

    @Test
    void testSymbolFailureSetsExitCode() {
        int exitCode = run("symbol", "aj1", "foobarbaz", "-q");

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_FAILURES);
        assertThat(out.toString()).contains("foobarbaz\tFAILED\tunrecognized gene name\tFOOBARBAZ");
    }

    @Test
    void testMhSymbolWithLowerCaseFamily() {
        int exitCode = run("symbol", "--family", "mh", "--enforce-functional", "HLA-B*5701");

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("HLA-B*5701\tHLA-B*57:01");
    }

    @Test
    void testSymbolRejectsUnknownSpecies() {
        assertThat(run("symbol", "TRBV2", "--species", "dog")).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testSymbolRejectsUnsupportedPrecision() {
        assertThat(run("symbol", "TRBV2", "--precision", "PROTEIN"))
                .isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testSymbolReport() throws IOException {
        Path report = tempDir.resolve("out/symbols.txt");

        int exitCode = run("symbol", "aj1", "--report", report.toString());

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(Files.readString(report)).contains("OK    aj1 -> TRAJ1");
    }

    @Test
    void testJunction() {
        int exitCode = run("junction", "--locus", "trb", "ASSLMPGQGSYEQY", "CASSLMPGQGSYEQYF");

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("ASSLMPGQGSYEQY\tCASSLMPGQGSYEQYF");
    }

    @Test
    void testJunctionPatternOnly() {
        assertThat(run("junction", "sadaf")).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("sadaf\tCSADAFF");
    }

    @Test
    void testJunctionFailure() {
        assertThat(run("junction", "-q", "123456")).isEqualTo(NormalizeCommand.EXIT_FAILURES);
        assertThat(out.toString()).contains("123456\tFAILED\tnot a valid amino acid sequence");
    }

    @Test
    void testJunctionSymbolsNeedLocus() {
        assertThat(run("junction", "--v-symbol", "TRBV2", "CASSF")).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testJunctionSymbolOfAnotherLocus() {
        assertThat(run("junction", "--locus", "TRB", "--v-symbol", "TRAV10", "CASSLMPGQGSYEQYF"))
                .isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testJunctionRejectsNegativePenalty() {
        assertThat(run("junction", "--locus", "TRB", "--mismatch-penalty=-1", "CASSF"))
                .isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testQuery() {
        int exitCode = run("query", "--functionality", "nf", "--contains", "TRBV");

        assertThat(exitCode).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString().lines()).containsExactly("TRBV1", "TRBV12-1", "TRBV20/OR9-2", "TRBV24/OR9-2");
    }

    @Test
    void testQueryRejectsSubgroupsAndBadPatterns() {
        assertThat(run("query", "--precision", "SUBGROUP")).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
        assertThat(run("query", "--contains", "TRBV(")).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testSequence() {
        assertThat(run("sequence", "TRBJ2-7*01")).isEqualTo(NormalizeCommand.EXIT_OK);
        assertThat(out.toString()).contains("J-REGION\tSYEQYFGPGTRLTVT");
    }

    @Test
    void testSequenceUnknownSymbol() {
        assertThat(run("sequence", "TRBJ2-7")).isEqualTo(NormalizeCommand.EXIT_FAILURES);
    }

    @Test
    void testSequenceRejectsMh() {
        assertThat(run("sequence", "HLA-A", "--family", "MH")).isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testMissingCatalogDirectory() {
        assertThat(run("symbol", "TRBV2", "--catalog-dir", tempDir.resolve("missing").toString()))
                .isEqualTo(NormalizeCommand.EXIT_INVALID_OPTIONS);
    }

    @Test
    void testUnknownOptionIsUsageError() {
        assertThat(run("symbol", "--bogus", "TRBV2")).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
