package com.dataset.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies {@link NormalizationRule}s to organization names.
 *
 * <p>Every stage starts from lower-cased, diacritic-free text and ends with whitespace
 * collapsed. The engine never throws on malformed input; null or blank yields "".</p>
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

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Runs the cleanup stage: case folding, diacritic stripping and all {@code CLEANUP} rules.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String folded = Normalizer.normalize(text, Normalizer.Form.NFD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = folded.toLowerCase(Locale.ROOT);
        return collapse(applyStage(folded, NormalizationStage.CLEANUP));
    }

    /**
     * Runs the {@code CORE} rules over the normalized form of {@code text}.
     */
    public String core(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return "";
        }
        return collapse(applyStage(normalized, NormalizationStage.CORE));
    }

    private String applyStage(String input, NormalizationStage stage) {
        String result = input;
        for (NormalizationRule rule : rules) {
            if (rule.getStage() != stage) {
                continue;
            }
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result;
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
