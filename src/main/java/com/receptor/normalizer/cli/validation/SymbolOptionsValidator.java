package com.receptor.normalizer.cli.validation;

import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.SymbolOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.symbol.PrecisionCompiler;

import java.util.ArrayList;
import java.util.List;

public class SymbolOptionsValidator {

	private final CommonOptionsValidator commonValidator = new CommonOptionsValidator();

	public ValidatedCommonOptions validate(CommonOptions common, SymbolOptions o) {
		List<String> errors = new ArrayList<>();

		ValidatedCommonOptions validated = commonValidator.validate(common, errors);

		if (o.getSymbols() == null || o.getSymbols().isEmpty()) {
			errors.add("At least one symbol is required.");
		} else if (o.getSymbols().stream().anyMatch(CommonOptionsValidator::isBlank)) {
			errors.add("Symbols must not be blank.");
		}

		CommonOptionsValidator.checkSpecies(o.getSpecies(), true, errors);

		PrecisionCompiler compiler = PrecisionCompiler.forFamily(o.getFamily());
		if (o.getPrecision() != null && !compiler.supports(o.getPrecision())) {
			errors.add("Precision " + o.getPrecision() + " is not defined for " + o.getFamily()
					+ ". Expected one of " + compiler.supportedPrecisions() + ".");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return validated;
	}
}
