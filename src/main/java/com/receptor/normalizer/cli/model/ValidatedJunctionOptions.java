package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.junction.JunctionSettings;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Junction command options turned into aligner settings.
 */
@Data
@AllArgsConstructor
public class ValidatedJunctionOptions {
    ValidatedCommonOptions common;
    JunctionSettings settings;
}
