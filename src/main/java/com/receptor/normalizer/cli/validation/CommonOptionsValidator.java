package com.receptor.normalizer.cli.validation;

import com.receptor.normalizer.catalog.Species;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.context.NormalizerConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks the options every command shares. Problems are appended to the
 * caller's error list; the caller decides when to throw.
 */
public class CommonOptionsValidator {

	public ValidatedCommonOptions validate(CommonOptions o, List<String> errors) {
		Path catalogDir = o.getCatalogDir();
		if (catalogDir != null && !existsDirectory(catalogDir)) {
			errors.add("Catalog directory does not exist or is not a directory: " + catalogDir);
		}

		Path reportPath = null;
		if (o.getReport() != null) {
			reportPath = o.getReport().toAbsolutePath().normalize();
			if (Files.isDirectory(reportPath)) {
				errors.add("Report path is a directory: " + reportPath);
			}
		}

		NormalizerConfig config = NormalizerConfig.builder()
				.catalogDir(catalogDir == null ? null : catalogDir.toAbsolutePath().normalize())
				.logFailures(!o.isQuiet())
				.build();
		return new ValidatedCommonOptions(config, reportPath);
	}

	static void checkSpecies(String species, boolean allowAny, List<String> errors) {
		if (isBlank(species)) {
			errors.add("Species is required (--species / -s).");
			return;
		}
		if (allowAny && Species.ANY.equals(Species.normalizeKey(species))) {
			return;
		}
		if (Species.fromKey(species).isEmpty()) {
			errors.add("Unknown species: " + species + ". Expected one of " + knownSpecies(allowAny) + ".");
		}
	}

	static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static String knownSpecies(boolean allowAny) {
		StringBuilder sb = new StringBuilder();
		for (Species species : Species.values()) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append(species.getKey());
		}
		if (allowAny) {
			sb.append(", ").append(Species.ANY);
		}
		return sb.toString();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}
}
