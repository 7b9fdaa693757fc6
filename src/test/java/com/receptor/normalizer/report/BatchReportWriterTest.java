package com.receptor.normalizer.report;

import com.receptor.normalizer.model.JunctionResult;
import com.receptor.normalizer.model.StandardizationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BatchReportWriterTest {

    @TempDir
    Path tempDir;

    private final BatchReportWriter writer = new BatchReportWriter();

    @Test
    void testSymbolReport() {
        List<StandardizationResult> results = List.of(
                StandardizationResult.builder().originalInput("aj1").gene("TRAJ1").highestPrecision("TRAJ1").build(),
                StandardizationResult.failure("foobarbaz", "unrecognized gene name", "FOOBARBAZ"));

        String report = writer.renderSymbolReport("TR symbols (homosapiens)", results);

        assertThat(report).startsWith("TR symbols (homosapiens)");
        assertThat(report).contains("Total: 2  Succeeded: 1  Failed: 1");
        assertThat(report).contains("OK    aj1 -> TRAJ1");
        assertThat(report).contains("FAIL  foobarbaz");
        assertThat(report).contains("error: unrecognized gene name");
        assertThat(report).contains("attempted fix: FOOBARBAZ");
    }

    @Test
    void testJunctionReport() {
        List<JunctionResult> results = List.of(
                JunctionResult.success("ASSLMPGQGSYEQY", "CASSLMPGQGSYEQYF"),
                JunctionResult.failure("123456", "not a valid amino acid sequence", "123456"));

        String report = writer.renderJunctionReport("TRB junctions", results);

        assertThat(report).contains("OK    ASSLMPGQGSYEQY -> CASSLMPGQGSYEQYF (CDR3 ASSLMPGQGSYEQY)");
        assertThat(report).contains("error: not a valid amino acid sequence");
        assertThat(report).contains("Failed: 1");
    }

    @Test
    void testListing() {
        assertThat(writer.renderListing("TR GENE symbols", List.of("TRBV1", "TRBV2")))
                .contains("TRBV1\nTRBV2");
        assertThat(writer.renderListing("TR GENE symbols", List.of())).contains("(none)");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports/nested/symbols.txt");

        writer.write(target, "content");

        assertThat(Files.readString(target)).isEqualTo("content");
    }

    @Test
    void testWriteFailure() throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("taken"));

        assertThatThrownBy(() -> writer.write(directory, "content"))
                .isInstanceOf(ReportException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
