package com.receptor.normalizer.cli.model;

import com.receptor.normalizer.context.NormalizerConfig;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

/**
 * Derived values shared by every command.
 */
@Data
@AllArgsConstructor
public class ValidatedCommonOptions {
    NormalizerConfig config;
    /** Absolute report path, or null when no report was requested. */
    Path reportPath;
}
