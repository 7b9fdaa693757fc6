package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.catalog.ReferenceCatalog;
import com.receptor.normalizer.catalog.SynonymTable;
import com.receptor.normalizer.parser.ParsedSymbol;
import com.receptor.normalizer.symbol.HlaValidityOracle;
import com.receptor.normalizer.symbol.ReceptorValidityOracle;
import com.receptor.normalizer.symbol.ValidationOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResolutionCascadeTest {

    private static final ReferenceCatalog CATALOG = new ReferenceCatalog(Map.of(
            "TRBV2", Map.of("01", "F"),
            "TRBV6-1", Map.of("01", "F")));

    private static CorrectionStrategy rename(String from, String to, AtomicInteger calls) {
        return new CorrectionStrategy() {
            @Override
            public String name() {
                return from + "->" + to;
            }

            @Override
            public ParsedSymbol apply(ParsedSymbol symbol, CascadeContext context) {
                calls.incrementAndGet();
                return symbol.getGene().equals(from) ? symbol.withGene(to) : symbol;
            }
        };
    }

    private static CascadeContext contextFor(ResolutionCascade cascade) {
        return new CascadeContext(CATALOG, SynonymTable.empty(), new ReceptorValidityOracle(CATALOG),
                ValidationOptions.LENIENT, cascade, true);
    }

    @Test
    void testValidInputSkipsStrategies() {
        AtomicInteger calls = new AtomicInteger();
        ResolutionCascade cascade = new ResolutionCascade(List.of(rename("TRBV2", "FOO", calls)));

        ParsedSymbol result = cascade.resolve(ParsedSymbol.ofGene("TRBV2"), contextFor(cascade));

        assertThat(result.getGene()).isEqualTo("TRBV2");
        assertThat(calls).hasValue(0);
    }

    @Test
    void testRewritesAccumulate() {
        AtomicInteger calls = new AtomicInteger();
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                rename("FOO", "BAR", calls),
                rename("BAR", "TRBV2", calls),
                rename("TRBV2", "BAZ", calls)));

        ParsedSymbol result = cascade.resolve(new ParsedSymbol("FOO", List.of("01")), contextFor(cascade));

        assertThat(result).isEqualTo(new ParsedSymbol("TRBV2", List.of("01")));
        assertThat(calls).hasValue(2);
    }

    @Test
    void testRewritesToUnknownGenesAreDiscarded() {
        AtomicInteger calls = new AtomicInteger();
        ResolutionCascade cascade = new ResolutionCascade(List.of(rename("FOO", "BAR", calls)));

        ParsedSymbol result = cascade.resolve(ParsedSymbol.ofGene("FOO"), contextFor(cascade));

        assertThat(result.getGene()).isEqualTo("FOO");
    }

    @Test
    void testLastKnownGeneIsKeptWhenNothingIsAccepted() {
        ReferenceCatalog hla = new ReferenceCatalog(Map.of("HLA-DRB1", Map.of("15", Map.of("01", "F"))));
        AtomicInteger calls = new AtomicInteger();
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                rename("DRB1", "HLA-DRB1", calls),
                rename("HLA-DRB1", "HLA-DRBX", calls)));
        CascadeContext context = new CascadeContext(hla, SynonymTable.empty(), new HlaValidityOracle(hla),
                ValidationOptions.LENIENT, cascade, true);

        ParsedSymbol result = cascade.resolve(new ParsedSymbol("DRB1", List.of("04", "01")), context);

        assertThat(result).isEqualTo(new ParsedSymbol("HLA-DRB1", List.of("04", "01")));
        assertThat(calls).hasValue(2);
    }

    @Test
    void testSuffixToggleReentersCascade() {
        AtomicInteger calls = new AtomicInteger();
        ResolutionCascade cascade = new ResolutionCascade(List.of(
                rename("TRBV6-1X", "TRBV6-1", calls),
                new SuffixToggle()));

        ParsedSymbol result = cascade.resolve(ParsedSymbol.ofGene("TRBV6"), contextFor(cascade));

        assertThat(result.getGene()).isEqualTo("TRBV6-1");
    }

    @Test
    void testSuffixToggleDoesNothingWithoutRetry() {
        ResolutionCascade cascade = new ResolutionCascade(List.of(new SuffixToggle()));
        CascadeContext noRetry = new CascadeContext(CATALOG, SynonymTable.empty(), new ReceptorValidityOracle(CATALOG),
                ValidationOptions.LENIENT, cascade, false);

        assertThat(new SuffixToggle().apply(ParsedSymbol.ofGene("TRBV6"), noRetry).getGene()).isEqualTo("TRBV6");
    }

    @Test
    void testStrategyNames() {
        ResolutionCascade cascade = new ResolutionCascade(List.of(new SuffixToggle()));

        assertThat(cascade.strategyNames()).containsExactly("suffix-toggle");
    }
}
