package com.qaplatform.formula.template;

import java.util.Locale;

public enum TemplateCategory {
    DIMENSION_SCORING,
    ERROR_PENALTY,
    OVERALL_SCORING,
    QUALITY_LEVEL,
    CONDITIONAL_LOGIC,
    STATISTICAL,
    CUSTOM;

    /**
     * Accepts both {@code "error_penalty"} and {@code "ERROR_PENALTY"}.
     */
    public static TemplateCategory fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
