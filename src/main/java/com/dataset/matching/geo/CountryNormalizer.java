package com.dataset.matching.geo;

import com.dataset.matching.similarity.LevenshteinSimilarity;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves free-text country names to canonical names and relates them through regional groups.
 * <p>
 * Resolution tries, in order, the canonical name (1.0), an ISO code (0.95), a known alias (0.9)
 * and finally the closest canonical name by Levenshtein similarity, accepted above 0.8 and
 * scored at {@code similarity * 0.8}. Results are memoized per normalized input.
 * <p>
 * Instances are immutable after construction and safe to share.
 */
public class CountryNormalizer {
    private static final Logger log = LoggerFactory.getLogger(CountryNormalizer.class);

    public static final String DEFAULT_RESOURCE = "geo/countries.json";

    static final double ISO_CODE_CONFIDENCE = 0.95;
    static final double ALIAS_CONFIDENCE = 0.9;
    static final double FUZZY_THRESHOLD = 0.8;
    static final double FUZZY_WEIGHT = 0.8;
    private static final int FUZZY_MIN_LENGTH = 4;

    private final Map<String, String> canonicalByName = new HashMap<>();
    private final Map<String, String> canonicalByIsoCode = new HashMap<>();
    private final Map<String, String> canonicalByAlias = new HashMap<>();
    private final Map<String, Set<String>> regionsByCountry = new HashMap<>();
    private final Map<String, Set<String>> countriesByRegion = new HashMap<>();
    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();
    private final Map<String, Optional<CountryMatch>> resolved = new ConcurrentHashMap<>();

    CountryNormalizer(CountryTable table) {
        if (table.countries() != null) {
            for (CountryEntry entry : table.countries()) {
                if (entry.canonical() == null || entry.canonical().isBlank()) {
                    throw new IllegalArgumentException("Country entry without canonical name");
                }
                String canonical = entry.canonical().trim();
                canonicalByName.put(key(canonical), canonical);
                for (String code : nullToEmpty(entry.isoCodes())) {
                    canonicalByIsoCode.put(key(code), canonical);
                }
                for (String alias : nullToEmpty(entry.aliases())) {
                    canonicalByAlias.put(key(alias), canonical);
                }
            }
        }
        if (table.regionalGroups() != null) {
            table.regionalGroups().forEach((region, members) -> {
                Set<String> canonicalMembers = new HashSet<>();
                for (String member : nullToEmpty(members)) {
                    String canonical = canonicalByName.get(key(member));
                    if (canonical == null) {
                        throw new IllegalArgumentException(
                                "Region '" + region + "' lists unknown country '" + member + "'");
                    }
                    canonicalMembers.add(canonical);
                    regionsByCountry.computeIfAbsent(canonical, c -> new HashSet<>()).add(region);
                }
                countriesByRegion.put(region, Set.copyOf(canonicalMembers));
            });
        }
    }

    /**
     * Loads the bundled country table.
     */
    public static CountryNormalizer loadDefault() {
        return loadResource(DEFAULT_RESOURCE, new ObjectMapper());
    }

    public static CountryNormalizer loadResource(String resource, ObjectMapper objectMapper) {
        try (InputStream input = CountryNormalizer.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return load(input, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resource " + resource, e);
        }
    }

    public static CountryNormalizer load(InputStream input, ObjectMapper objectMapper) {
        CountryTable table;
        try {
            table = objectMapper.readValue(input, CountryTable.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse country table JSON", e);
        }
        CountryNormalizer normalizer = new CountryNormalizer(table);
        log.debug("Loaded {} countries in {} regional groups",
                normalizer.canonicalByName.size(), normalizer.countriesByRegion.size());
        return normalizer;
    }

    /**
     * Resolves {@code input} to a canonical country, or empty when nothing is close enough.
     */
    public Optional<CountryMatch> normalize(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        return resolved.computeIfAbsent(key(input), this::resolve);
    }

    private Optional<CountryMatch> resolve(String key) {
        String canonical = canonicalByName.get(key);
        if (canonical != null) {
            return Optional.of(new CountryMatch(canonical, 1.0, CountryMatch.Kind.EXACT));
        }
        canonical = canonicalByIsoCode.get(key);
        if (canonical != null) {
            return Optional.of(new CountryMatch(canonical, ISO_CODE_CONFIDENCE, CountryMatch.Kind.ISO_CODE));
        }
        canonical = canonicalByAlias.get(key);
        if (canonical != null) {
            return Optional.of(new CountryMatch(canonical, ALIAS_CONFIDENCE, CountryMatch.Kind.ALIAS));
        }
        if (key.length() < FUZZY_MIN_LENGTH) {
            return Optional.empty();
        }

        String best = null;
        double bestScore = 0.0;
        for (Map.Entry<String, String> entry : canonicalByName.entrySet()) {
            double score = similarity.compute(key, entry.getKey());
            if (score > bestScore) {
                bestScore = score;
                best = entry.getValue();
            }
        }
        if (best != null && bestScore > FUZZY_THRESHOLD) {
            return Optional.of(new CountryMatch(best, bestScore * FUZZY_WEIGHT, CountryMatch.Kind.FUZZY));
        }
        return Optional.empty();
    }

    /**
     * Other countries sharing at least one regional group with {@code canonical}.
     */
    public Set<String> regionalCountries(String canonical) {
        Set<String> regions = regionsByCountry.getOrDefault(canonical, Set.of());
        Set<String> neighbours = new HashSet<>();
        for (String region : regions) {
            neighbours.addAll(countriesByRegion.get(region));
        }
        neighbours.remove(canonical);
        return Set.copyOf(neighbours);
    }

    /**
     * Closest relation between a resolved search location and any of the entity's countries.
     * Entity countries are free text and resolved the same way as the location.
     */
    public GeographicRelationship relationship(String locationCanonical, Collection<String> entityCountries) {
        if (locationCanonical == null || entityCountries == null || entityCountries.isEmpty()) {
            return GeographicRelationship.UNKNOWN;
        }
        Set<String> neighbours = regionalCountries(locationCanonical);
        GeographicRelationship best = GeographicRelationship.UNKNOWN;
        for (String country : entityCountries) {
            Optional<CountryMatch> match = normalize(country);
            if (match.isEmpty()) {
                continue;
            }
            String canonical = match.get().canonical();
            if (canonical.equals(locationCanonical)) {
                return GeographicRelationship.SAME_COUNTRY;
            }
            if (neighbours.contains(canonical)) {
                best = GeographicRelationship.SAME_REGION;
            } else if (best == GeographicRelationship.UNKNOWN) {
                best = GeographicRelationship.DIFFERENT_REGION;
            }
        }
        return best;
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values != null ? values : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CountryTable(@JsonProperty("countries") List<CountryEntry> countries,
                        @JsonProperty("regional_groups") Map<String, List<String>> regionalGroups) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CountryEntry(@JsonProperty("canonical") String canonical,
                        @JsonProperty("iso_codes") List<String> isoCodes,
                        @JsonProperty("aliases") List<String> aliases) {
    }
}
