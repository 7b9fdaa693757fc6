package com.receptor.normalizer.symbol.cascade;

import com.receptor.normalizer.parser.ParsedSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered fold over correction strategies that stops at the first candidate
 * the validity oracle accepts. Rewrites accumulate from one step to the next.
 * When no candidate is accepted, the last one naming a catalog gene is kept so
 * the caller can report what is wrong with its fields; otherwise the input is
 * returned unchanged.
 */
public class ResolutionCascade {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCascade.class);

    private final List<CorrectionStrategy> strategies;

    public ResolutionCascade(List<CorrectionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public ParsedSymbol resolve(ParsedSymbol start, CascadeContext context) {
        if (context.accepts(start)) {
            return start;
        }
        ParsedSymbol current = start;
        ParsedSymbol best = start;
        for (CorrectionStrategy strategy : strategies) {
            ParsedSymbol next = strategy.apply(current, context);
            if (!next.equals(current)) {
                log.debug("{}: {} -> {}", strategy.name(), current, next);
            }
            current = next;
            if (context.accepts(current)) {
                return current;
            }
            if (context.catalog().containsGene(current.getGene())) {
                best = current;
            }
        }
        log.debug("No correction accepted for {}, keeping {}", start, best);
        return best;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(CorrectionStrategy::name).toList();
    }
}
