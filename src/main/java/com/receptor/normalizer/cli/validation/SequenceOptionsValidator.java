package com.receptor.normalizer.cli.validation;

import com.receptor.normalizer.catalog.GeneFamily;
import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.SequenceOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;

import java.util.ArrayList;
import java.util.List;

public class SequenceOptionsValidator {

	private final CommonOptionsValidator commonValidator = new CommonOptionsValidator();

	public ValidatedCommonOptions validate(CommonOptions common, SequenceOptions o) {
		List<String> errors = new ArrayList<>();

		ValidatedCommonOptions validated = commonValidator.validate(common, errors);

		if (CommonOptionsValidator.isBlank(o.getSymbol())) {
			errors.add("A symbol is required.");
		}
		if (o.getFamily() == GeneFamily.MH) {
			errors.add("No amino acid sequences are catalogued for MH.");
		}
		CommonOptionsValidator.checkSpecies(o.getSpecies(), false, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return validated;
	}
}
