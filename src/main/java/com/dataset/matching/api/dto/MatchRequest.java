package com.dataset.matching.api.dto;

import com.dataset.matching.api.MatchContext;
import com.dataset.matching.api.MatchOptions;
import com.dataset.matching.api.MatchQuery;
import com.dataset.matching.core.model.MatchType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for matching one entity and, optionally, its affiliated companies.
 * Validation happens when the request is matched, not on construction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MatchRequest(
        @JsonProperty("entity") String entity,
        @JsonProperty("aliases") List<String> aliases,
        @JsonProperty("context") MatchContext context,
        @JsonProperty("options") Options options,
        @JsonProperty("affiliated_companies") List<AffiliatedCompany> affiliatedCompanies
) {
    public MatchRequest {
        aliases = aliases != null ? aliases.stream().filter(a -> a != null).toList() : List.of();
        affiliatedCompanies = affiliatedCompanies != null
                ? affiliatedCompanies.stream().filter(c -> c != null).toList()
                : List.of();
    }

    public static MatchRequest of(String entity) {
        return new MatchRequest(entity, null, null, null, null);
    }

    public MatchOptions toMatchOptions() {
        return options != null ? options.toMatchOptions() : MatchOptions.defaults();
    }

    public MatchQuery toMatchQuery() {
        return new MatchQuery(entity, aliases, context, toMatchOptions());
    }

    /**
     * Request options; absent values take the defaults of {@link MatchOptions}.
     * Unknown match type names are ignored.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Options(
            @JsonProperty("minConfidence") Double minConfidence,
            @JsonProperty("maxResults") Integer maxResults,
            @JsonProperty("forceRefresh") Boolean forceRefresh,
            @JsonProperty("affiliatedBoost") Double affiliatedBoost,
            @JsonProperty("matchTypes") List<String> matchTypes
    ) {
        public MatchOptions toMatchOptions() {
            MatchOptions.Builder builder = MatchOptions.builder();
            if (minConfidence != null) builder.minConfidence(minConfidence);
            if (maxResults != null) builder.maxResults(maxResults);
            if (forceRefresh != null) builder.forceRefresh(forceRefresh);
            if (affiliatedBoost != null) builder.affiliatedBoost(affiliatedBoost);
            if (matchTypes != null) builder.matchTypes(parseTypes(matchTypes));
            return builder.build();
        }

        private static Set<MatchType> parseTypes(List<String> names) {
            Set<MatchType> types = EnumSet.noneOf(MatchType.class);
            names.forEach(name -> MatchType.findByWireName(name).ifPresent(types::add));
            return types;
        }
    }
}
