package com.dataset.matching.api;

import java.util.List;

/**
 * A single search term to match against the reference datasets.
 *
 * @param entity  the name to search, validated by {@link InputSanitizer}
 * @param aliases extra names the caller knows the entity by
 * @param context optional free-text context
 * @param options matching options, defaults when null
 */
public record MatchQuery(String entity, List<String> aliases, MatchContext context, MatchOptions options) {

    public MatchQuery {
        aliases = aliases != null ? aliases.stream().filter(a -> a != null && !a.isBlank()).toList() : List.of();
        options = options != null ? options : MatchOptions.defaults();
    }

    public static MatchQuery of(String entity) {
        return new MatchQuery(entity, List.of(), null, MatchOptions.defaults());
    }

    public static MatchQuery of(String entity, MatchOptions options) {
        return new MatchQuery(entity, List.of(), null, options);
    }

    public MatchQuery withOptions(MatchOptions newOptions) {
        return new MatchQuery(entity, aliases, context, newOptions);
    }
}
