package com.dataset.matching.rules;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-text organization names into comparable forms.
 *
 * <p>All methods are pure and deterministic and never throw on odd input: null, blank or
 * punctuation-only text simply yields empty results.</p>
 */
public class NameNormalizer {

    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("^(.*?\\S)\\s*\\(([^()]+)\\)\\s*$");
    private static final Pattern ANY_PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final Set<String> STOP_WORDS = Set.of(
            "the", "of", "and", "or", "but", "in", "on", "at", "to", "for", "with", "by",
            "a", "an", "is", "are", "was", "were", "be", "been", "being", "have", "has", "had");

    static final Set<String> GENERIC_TERMS = Set.of(
            "company", "corporation", "corp", "inc", "ltd", "llc", "group", "international",
            "global", "development", "management", "systems", "services", "name", "co",
            "china", "chinese", "america", "american", "usa", "us", "canada", "canadian",
            "japan", "japanese", "europe", "european", "asia", "asian",
            "africa", "african", "india", "indian", "germany", "german",
            "france", "french", "uk", "britain", "british", "italy", "italian",
            "spain", "spanish", "russia", "russian", "iran", "korea", "korean",
            "australia", "australian", "brazil", "brazilian", "mexico", "mexican",
            "university", "college", "institute", "research", "center", "centre",
            "technology", "science", "engineering", "medical", "hospital",
            "school", "academy", "laboratory", "lab", "faculty", "department",
            "military", "government", "agency", "organization", "organisation", "association",
            "limited", "public", "private", "holdings", "enterprises");

    private final NormalizationEngine engine;

    public NameNormalizer() {
        this(DefaultNormalizationRules.createDefaultEngine());
    }

    public NameNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    public String normalize(String text) {
        return engine.normalize(text);
    }

    public String core(String text) {
        return engine.core(text);
    }

    /**
     * Splits "Base Name (ACRONYM)" into its halves. Returns empty when the text does not end
     * in a single bracketed qualifier or either half is blank.
     */
    public Optional<ParentheticalName> extractParenthetical(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = TRAILING_PARENTHETICAL.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String base = collapse(matcher.group(1));
        String acronym = collapse(matcher.group(2));
        if (base.isEmpty() || acronym.isEmpty() || base.contains("(")) {
            return Optional.empty();
        }
        return Optional.of(new ParentheticalName(base, acronym));
    }

    /**
     * Builds the independent search variants for a query: the entity (or, when it carries a
     * trailing bracket, its base name and bracketed acronym separately) followed by any
     * caller-supplied aliases. Variants with an identical normalized form collapse to the first.
     */
    public List<SearchVariant> searchVariants(String entity, List<String> aliases) {
        Map<String, SearchVariant> byNormalized = new LinkedHashMap<>();
        Optional<ParentheticalName> parenthetical = extractParenthetical(entity);
        if (parenthetical.isPresent()) {
            addVariant(byNormalized, parenthetical.get().baseName(), SearchVariant.Kind.BASE_NAME);
            addVariant(byNormalized, parenthetical.get().acronym(), SearchVariant.Kind.ACRONYM);
        } else if (entity != null) {
            addVariant(byNormalized, collapse(ANY_PARENTHETICAL.matcher(entity).replaceAll(" ")),
                    SearchVariant.Kind.ORIGINAL);
        }
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null) {
                    addVariant(byNormalized, collapse(ANY_PARENTHETICAL.matcher(alias).replaceAll(" ")),
                            SearchVariant.Kind.ALIAS);
                }
            }
        }
        return List.copyOf(byNormalized.values());
    }

    /**
     * Jaccard overlap of the meaningful words (longer than two characters, not stop words)
     * of the two normalized names.
     */
    public double wordOverlap(String a, String b) {
        Set<String> words1 = meaningfulWords(normalize(a));
        Set<String> words2 = meaningfulWords(normalize(b));
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(words1);
        intersection.retainAll(words2);
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        return (double) intersection.size() / union.size();
    }

    /**
     * How specific a name is, from 0 (generic) to 1. More words, longer text and digits raise
     * the score; generic terms and very short text lower it.
     */
    public double specificity(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String lowered = collapse(text.toLowerCase(Locale.ROOT));
        String[] words = lowered.split(" ");

        double score = Math.min(words.length * 0.2, 1.0);
        long genericCount = Arrays.stream(words).filter(GENERIC_TERMS::contains).count();
        score -= ((double) genericCount / words.length) * 0.7;
        score += Math.min(lowered.length() / 50.0, 0.3);
        if (lowered.chars().anyMatch(Character::isDigit) || lowered.contains(".") || lowered.contains("-")) {
            score += 0.1;
        }
        if (lowered.length() < 5) {
            score *= 0.5;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * True for queries not worth a store round-trip: shorter than two characters, or made
     * only of generic terms and stop words.
     */
    public boolean shouldSkip(String text) {
        if (text == null) {
            return true;
        }
        String lowered = collapse(text.toLowerCase(Locale.ROOT));
        if (lowered.length() < 2) {
            return true;
        }
        return Arrays.stream(normalize(lowered).split(" "))
                .noneMatch(word -> word.length() > 1 && !GENERIC_TERMS.contains(word) && !STOP_WORDS.contains(word));
    }

    private void addVariant(Map<String, SearchVariant> variants, String text, SearchVariant.Kind kind) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return;
        }
        variants.putIfAbsent(normalized, new SearchVariant(text, normalized, core(text), kind));
    }

    private static Set<String> meaningfulWords(String normalized) {
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" "))
                .filter(word -> word.length() > 2 && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }
}
