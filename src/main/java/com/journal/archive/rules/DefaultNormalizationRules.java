package com.journal.archive.rules;

import com.journal.archive.core.model.EntityKind;

import java.util.List;

/**
 * Built-in natural key rules.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getCommonRules());
        engine.addRules(getDateRules());
        return engine;
    }

    /**
     * Rules applied to every name: apostrophes dropped, hyphens and dashes read as spaces.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("apostrophes")
                        .pattern("['’ʼ`´]")
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("hyphens")
                        .pattern("[\\-‐‑–—_]")
                        .replacement(" ")
                        .priority(20)
                        .build()
        );
    }

    /**
     * Narrated dates lose all inner spacing once hyphens are read as spaces, so
     * {@code "~2021-11"} and {@code "~ 2021 - 11"} share the key {@code "~202111"}.
     */
    public static List<NormalizationRule> getDateRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("date-spacing")
                        .pattern("\\s+")
                        .replacement("")
                        .applicableKinds(EntityKind.NARRATED_DATE)
                        .priority(30)
                        .build()
        );
    }
}
