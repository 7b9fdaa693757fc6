package com.receptor.normalizer.catalog;

import java.util.Locale;

/**
 * Gene families with a reference catalog. The file key is the suffix used by
 * the persisted catalog files ({@code homosapiens_tr.json}).
 */
public enum GeneFamily {
    TR,
    IG,
    MH;

    public String fileKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
