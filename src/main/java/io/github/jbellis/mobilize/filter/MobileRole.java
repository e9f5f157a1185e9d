package io.github.jbellis.mobilize.filter;

import org.jetbrains.annotations.Nullable;

/**
 * How the mobilizer treats a labeled element.
 */
public enum MobileRole {
    /** Preserved verbatim regardless of layout; scripts, styles and explicitly tagged blocks. */
    KEEPER("keeper"),
    HEADER("header"),
    NAVIGATIONAL("navigational"),
    CONTENT("content"),
    MARGINAL("marginal"),
    /** The element carried a role value this mobilizer does not recognize. */
    INVALID(null);

    private final @Nullable String attributeValue;

    MobileRole(@Nullable String attributeValue) {
        this.attributeValue = attributeValue;
    }

    /**
     * The literal {@code data-mobile-role} value for this role, or {@code null}
     * for {@link #INVALID}, which has no spelling of its own.
     */
    public @Nullable String attributeValue() {
        return attributeValue;
    }

    /**
     * Maps an attribute value to a role. Matching is exact and case-sensitive;
     * anything unrecognized is {@link #INVALID}.
     */
    public static MobileRole fromAttributeValue(String value) {
        for (var role : values()) {
            if (value.equals(role.attributeValue)) {
                return role;
            }
        }
        return INVALID;
    }
}
