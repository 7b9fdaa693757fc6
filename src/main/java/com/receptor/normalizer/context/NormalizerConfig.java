package com.receptor.normalizer.context;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Configuration for building a {@link NormalizerContext}.
 */
@Data
@Builder
public class NormalizerConfig {

    /** Directory with catalog JSON files; null loads the bundled catalogs. */
    private Path catalogDir;

    /** Log failed standardizations at warn level. */
    @Builder.Default
    private boolean logFailures = true;

    public static NormalizerConfig defaults() {
        return NormalizerConfig.builder().build();
    }
}
