package com.journal.archive.rules;

import com.journal.archive.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds case- and diacritic-insensitive natural keys from display names.
 *
 * <p>Diacritics are stripped first (NFD decomposition, combining marks removed),
 * then the rules run in priority order, then the result is lower-cased, trimmed
 * and whitespace-collapsed. {@code "José-María O'Brien"} becomes
 * {@code "jose maria obrien"}.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes {@code name} for {@code kind}; a {@code null} kind applies only kind-agnostic rules.
     * Blank input yields the empty key.
     */
    public String normalize(String name, EntityKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = COMBINING_MARKS.matcher(Normalizer.normalize(name, Normalizer.Form.NFD)).replaceAll("");

        for (NormalizationRule rule : rules) {
            boolean applies = kind == null ? rule.getApplicableKinds().isEmpty() : rule.appliesTo(kind);
            if (applies) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    public boolean areEquivalent(String first, String second, EntityKind kind) {
        return normalize(first, kind).equals(normalize(second, kind));
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
