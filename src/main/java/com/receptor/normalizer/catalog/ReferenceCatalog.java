package com.receptor.normalizer.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable gene to allele-designation tree. Inner nodes are maps keyed by a
 * designation field, leaves are functionality labels or MH group tags.
 */
public final class ReferenceCatalog {

    private final Map<String, Object> genes;
    private final Set<String> subgroups;

    public ReferenceCatalog(Map<String, ?> genes) {
        Objects.requireNonNull(genes, "genes");
        Map<String, Object> copy = new LinkedHashMap<>();
        genes.forEach((gene, node) -> copy.put(gene, freeze(node)));
        this.genes = Collections.unmodifiableMap(copy);

        Set<String> groups = new LinkedHashSet<>();
        for (String gene : this.genes.keySet()) {
            groups.add(subgroupOf(gene));
        }
        this.subgroups = Collections.unmodifiableSet(groups);
    }

    /**
     * Subgroup root of a gene name: everything before the first dash.
     */
    public static String subgroupOf(String gene) {
        int dash = gene.indexOf('-');
        return dash < 0 ? gene : gene.substring(0, dash);
    }

    public boolean containsGene(String gene) {
        return gene != null && genes.containsKey(gene);
    }

    public boolean isSubgroup(String name) {
        return name != null && subgroups.contains(name);
    }

    public Set<String> geneNames() {
        return genes.keySet();
    }

    /**
     * Walk the tree along the given designation fields.
     *
     * @return the node reached, or empty when any field is missing
     */
    public Optional<Object> lookup(String gene, List<String> fields) {
        Object node = genes.get(gene);
        if (node == null) {
            return Optional.empty();
        }
        for (String field : fields) {
            if (!(node instanceof Map<?, ?> children)) {
                return Optional.empty();
            }
            node = children.get(field);
            if (node == null) {
                return Optional.empty();
            }
        }
        return Optional.of(node);
    }

    /**
     * Direct children of a gene node, in catalog order. Empty for unknown genes
     * and for gene-only catalogs.
     */
    public Map<String, Object> alleles(String gene) {
        Object node = genes.get(gene);
        if (node instanceof Map<?, ?> children) {
            @SuppressWarnings("unchecked")
            Map<String, Object> typed = (Map<String, Object>) children;
            return typed;
        }
        return Map.of();
    }

    public Optional<Functionality> functionality(String gene, String allele) {
        return lookup(gene, List.of(allele)).flatMap(Functionality::fromLabel);
    }

    public boolean hasFunctionalAllele(String gene) {
        return alleles(gene).values().stream()
                .map(Functionality::fromLabel)
                .anyMatch(f -> f.filter(Functionality.FUNCTIONAL::equals).isPresent());
    }

    public int size() {
        return genes.size();
    }

    private static Object freeze(Object node) {
        if (node instanceof Map<?, ?> children) {
            Map<String, Object> copy = new LinkedHashMap<>();
            children.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        return node;
    }
}
