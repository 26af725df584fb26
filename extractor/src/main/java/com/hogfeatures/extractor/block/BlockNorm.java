package com.hogfeatures.extractor.block;

import com.hogfeatures.extractor.InvalidArgumentException;

import java.util.Locale;

/**
 * Block normalization schemes, identified externally by their conventional
 * names: L1, L2, L1-sqrt and L2-Hys.
 */
public enum BlockNorm {
    L1("L1"),
    L2("L2"),
    L1_SQRT("L1-sqrt"),
    L2_HYS("L2-Hys");

    private final String displayName;

    BlockNorm(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a scheme by name. Matching ignores case and treats '-' and '_'
     * alike, so "l2-hys" and "L2_HYS" both resolve to {@link #L2_HYS}.
     */
    public static BlockNorm fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidArgumentException("block norm must be one of L1, L2, L1-sqrt, L2-Hys, got none");
        }
        String key = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (key) {
            case "L1":
                return L1;
            case "L2":
                return L2;
            case "L1_SQRT":
                return L1_SQRT;
            case "L2_HYS":
                return L2_HYS;
            default:
                throw new InvalidArgumentException(
                        "block norm must be one of L1, L2, L1-sqrt, L2-Hys, got '" + name + "'");
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
