package com.receptor.normalizer.cli.validation;

import com.receptor.normalizer.cli.exception.OptionsValidationException;
import com.receptor.normalizer.cli.model.CommonOptions;
import com.receptor.normalizer.cli.model.QueryOptions;
import com.receptor.normalizer.cli.model.ValidatedCommonOptions;
import com.receptor.normalizer.symbol.Precision;
import com.receptor.normalizer.symbol.PrecisionCompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class QueryOptionsValidator {

	private final CommonOptionsValidator commonValidator = new CommonOptionsValidator();

	public ValidatedCommonOptions validate(CommonOptions common, QueryOptions o) {
		List<String> errors = new ArrayList<>();

		ValidatedCommonOptions validated = commonValidator.validate(common, errors);

		CommonOptionsValidator.checkSpecies(o.getSpecies(), false, errors);

		PrecisionCompiler compiler = PrecisionCompiler.forFamily(o.getFamily());
		if (!compiler.supports(o.getPrecision())) {
			errors.add("Precision " + o.getPrecision() + " is not defined for " + o.getFamily()
					+ ". Expected one of " + compiler.supportedPrecisions() + ".");
		} else if (o.getPrecision() == Precision.SUBGROUP) {
			errors.add("Catalog queries list genes or alleles, not subgroups.");
		}

		if (o.getContains() != null) {
			try {
				Pattern.compile(o.getContains());
			} catch (PatternSyntaxException e) {
				errors.add("Invalid --contains pattern: " + e.getDescription() + " in " + o.getContains());
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return validated;
	}
}
