package com.receptor.normalizer.catalog;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads persisted catalogs from the classpath ({@code /catalog}) or from an
 * external directory. File names follow {@code <species>_<family>.json} with
 * optional {@code _synonyms} and {@code _aa_sequences} companions.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private static final String CLASSPATH_ROOT = "/catalog/";

    private final Path catalogDir;

    public CatalogLoader() {
        this(null);
    }

    /**
     * @param catalogDir directory holding catalog files, or null for the bundled ones
     */
    public CatalogLoader(Path catalogDir) {
        this.catalogDir = catalogDir;
    }

    public List<CatalogBundle> loadAll() {
        List<CatalogBundle> bundles = new ArrayList<>();
        for (Species species : Species.values()) {
            for (GeneFamily family : GeneFamily.values()) {
                load(species, family).ifPresent(bundles::add);
            }
        }
        log.info("Loaded {} catalogs from {}", bundles.size(), describeSource());
        return bundles;
    }

    /**
     * Load one (species, family) bundle. Empty when the reference catalog file is absent.
     */
    public Optional<CatalogBundle> load(Species species, GeneFamily family) {
        String base = species.getKey() + "_" + family.fileKey();

        Optional<JsonObject> reference = readJson(base + ".json");
        if (reference.isEmpty()) {
            log.debug("No reference catalog for {} {}", species.getKey(), family);
            return Optional.empty();
        }

        ReferenceCatalog catalog = new ReferenceCatalog(toTree(reference.get(), base));
        SynonymTable synonyms = readJson(base + "_synonyms.json")
                .map(json -> toSynonyms(json, base, catalog))
                .orElse(SynonymTable.empty());
        AaSequenceCatalog sequences = readJson(base + "_aa_sequences.json")
                .map(json -> toSequences(json, base))
                .orElse(AaSequenceCatalog.empty());

        log.debug("Catalog {}: {} genes, {} synonyms, {} sequences", base, catalog.size(), synonyms.size(),
                sequences.symbols().size());

        return Optional.of(CatalogBundle.builder()
                .species(species)
                .family(family)
                .reference(catalog)
                .synonyms(synonyms)
                .sequences(sequences)
                .build());
    }

    private Optional<JsonObject> readJson(String fileName) {
        try (InputStream in = open(fileName)) {
            if (in == null) {
                return Optional.empty();
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                JsonElement root = JsonParser.parseReader(reader);
                if (!root.isJsonObject()) {
                    throw new CatalogLoadException("Catalog " + fileName + " is not a JSON object");
                }
                return Optional.of(root.getAsJsonObject());
            }
        } catch (IOException | JsonParseException e) {
            throw new CatalogLoadException("Failed to read catalog " + fileName + ": " + e.getMessage(), e);
        }
    }

    private InputStream open(String fileName) throws IOException {
        if (catalogDir == null) {
            return CatalogLoader.class.getResourceAsStream(CLASSPATH_ROOT + fileName);
        }
        Path file = catalogDir.resolve(fileName);
        return Files.isRegularFile(file) ? Files.newInputStream(file) : null;
    }

    private String describeSource() {
        return catalogDir == null ? "classpath:" + CLASSPATH_ROOT : catalogDir.toAbsolutePath().toString();
    }

    private static Map<String, Object> toTree(JsonObject json, String source) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            tree.put(entry.getKey(), toNode(entry.getValue(), source, entry.getKey()));
        }
        return tree;
    }

    private static Object toNode(JsonElement element, String source, String key) {
        if (element.isJsonObject()) {
            return toTree(element.getAsJsonObject(), source);
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        throw new CatalogLoadException("Unexpected value under '" + key + "' in " + source);
    }

    private static SynonymTable toSynonyms(JsonObject json, String source, ReferenceCatalog catalog) {
        Map<String, String> entries = new LinkedHashMap<>();
        List<String> violations = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            String alias = entry.getKey();
            String target = entry.getValue().getAsString();
            if (alias.equals(target)) {
                violations.add(alias + " maps to itself");
            } else if (catalog.containsGene(alias)) {
                violations.add(alias + " is a valid gene name");
            }
            entries.put(alias, target);
        }
        if (!violations.isEmpty()) {
            throw new CatalogLoadException("Invalid synonym table " + source + ": " + String.join(", ", violations));
        }
        return new SynonymTable(entries);
    }

    private static AaSequenceCatalog toSequences(JsonObject json, String source) {
        Map<String, Map<String, String>> sequences = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (!entry.getValue().isJsonObject()) {
                throw new CatalogLoadException("Sequence entry " + entry.getKey() + " in " + source + " is not an object");
            }
            Map<String, String> regions = new LinkedHashMap<>();
            entry.getValue().getAsJsonObject().entrySet()
                    .forEach(region -> regions.put(region.getKey(), region.getValue().getAsString()));
            sequences.put(entry.getKey(), regions);
        }
        return new AaSequenceCatalog(sequences);
    }
}
