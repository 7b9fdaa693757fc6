package com.receptor.normalizer.cli.validation;

import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.JunctionOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.cli.model.ValidatedJunctionOptions;
import com.receptor.normalizer.junction.JunctionSettings;

import java.util.ArrayList;
import java.util.List;

public class JunctionOptionsValidator {

	private final CommonOptionsValidator commonValidator = new CommonOptionsValidator();

	public ValidatedJunctionOptions validate(CommonOptions common, JunctionOptions o) {
		List<String> errors = new ArrayList<>();

		ValidatedCommonOptions validated = commonValidator.validate(common, errors);

		if (o.getSequences() == null || o.getSequences().isEmpty()) {
			errors.add("At least one sequence is required.");
		}

		if (o.getLocus() == null) {
			// pattern-only mode, none of the alignment options apply
			if (o.getVSymbol() != null || o.getJSymbol() != null) {
				errors.add("--v-symbol and --j-symbol require --locus.");
			}
		} else if (o.isStrict()) {
			errors.add("--strict only applies without --locus.");
		}

		CommonOptionsValidator.checkSpecies(o.getSpecies(), false, errors);

		if (o.getMismatchPenalty() < 0) {
			errors.add("Mismatch penalty must be >= 0. Got: " + o.getMismatchPenalty());
		}
		if (o.getMaxJMismatches() < 0 || o.getMaxVMismatches() < 0) {
			errors.add("Mismatch limits must be >= 0. Got: J " + o.getMaxJMismatches() + ", V "
					+ o.getMaxVMismatches());
		}
		if (o.getMinJScore() < 0 || o.getMinVScore() < 0) {
			errors.add("Minimum scores must be >= 0. Got: J " + o.getMinJScore() + ", V " + o.getMinVScore());
		}
		if (o.getMinLength() < 1) {
			errors.add("Minimum junction length must be >= 1. Got: " + o.getMinLength());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		JunctionSettings settings = JunctionSettings.builder()
				.enforceFunctionalV(!o.isAnyVFunctionality())
				.enforceFunctionalJ(o.isFunctionalJOnly())
				.allowCCorrection(o.isAllowCCorrection())
				.allowFwCorrection(o.isAllowFwCorrection())
				.allowVReconstruction(o.isAllowVReconstruction())
				.allowJReconstruction(o.isAllowJReconstruction())
				.mismatchPenalty(o.getMismatchPenalty())
				.maxJMismatches(o.getMaxJMismatches())
				.maxVMismatches(o.getMaxVMismatches())
				.minJScore(o.getMinJScore())
				.minVScore(o.getMinVScore())
				.minJunctionLength(o.getMinLength())
				.logFailures(validated.getConfig().isLogFailures())
				.build();
		return new ValidatedJunctionOptions(validated, settings);
	}
}
