package com.receptor.normalizer.context;

import com.receptor.normalizer.catalog.CatalogBundle;
import com.receptor.normalizer.catalog.CatalogLoader;
import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.catalog.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, process-wide view over all loaded catalogs. Safe to share across
 * threads; nothing in it changes after construction.
 */
public final class NormalizerContext {

    private static final Logger log = LoggerFactory.getLogger(NormalizerContext.class);

    private final NormalizerConfig config;
    private final Map<GeneFamily, Map<Species, FamilyProfile>> profiles;

    private NormalizerContext(NormalizerConfig config, List<CatalogBundle> bundles) {
        this.config = config;
        Map<GeneFamily, Map<Species, FamilyProfile>> byFamily = new EnumMap<>(GeneFamily.class);
        for (CatalogBundle bundle : bundles) {
            byFamily.computeIfAbsent(bundle.getFamily(), f -> new EnumMap<>(Species.class))
                    .put(bundle.getSpecies(), FamilyProfiles.forBundle(bundle));
        }
        byFamily.replaceAll((family, bySpecies) -> Collections.unmodifiableMap(bySpecies));
        this.profiles = Collections.unmodifiableMap(byFamily);
    }

    /**
     * Context over the bundled catalogs, loaded on first use.
     */
    public static NormalizerContext defaultContext() {
        return DefaultHolder.INSTANCE;
    }

    public static NormalizerContext create(NormalizerConfig config) {
        log.info("Initializing normalizer context");
        CatalogLoader loader = new CatalogLoader(config.getCatalogDir());
        return new NormalizerContext(config, loader.loadAll());
    }

    public static NormalizerContext of(NormalizerConfig config, List<CatalogBundle> bundles) {
        return new NormalizerContext(config, bundles);
    }

    public NormalizerConfig getConfig() {
        return config;
    }

    public Optional<FamilyProfile> profile(Species species, GeneFamily family) {
        return Optional.ofNullable(profiles.getOrDefault(family, Map.of()).get(species));
    }

    public Optional<FamilyProfile> profile(String speciesKey, GeneFamily family) {
        return Species.fromKey(speciesKey).flatMap(species -> profile(species, family));
    }

    /**
     * Profiles of a family in species declaration order.
     */
    public List<FamilyProfile> profiles(GeneFamily family) {
        return List.copyOf(profiles.getOrDefault(family, Map.of()).values());
    }

    private static final class DefaultHolder {
        private static final NormalizerContext INSTANCE = create(NormalizerConfig.defaults());
    }
}
