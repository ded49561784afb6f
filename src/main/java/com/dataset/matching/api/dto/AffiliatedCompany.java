package com.dataset.matching.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A company linked to the queried entity by upstream discovery.
 *
 * @param companyName      name to match; blank entries are ignored
 * @param riskKeyword      keyword that surfaced the company
 * @param relationshipType how the company relates to the entity, e.g. "subsidiary"
 * @param confidenceScore  upstream confidence in the relationship, informational only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AffiliatedCompany(
        @JsonProperty("company_name") String companyName,
        @JsonProperty("risk_keyword") String riskKeyword,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("confidence_score") Double confidenceScore
) {
    public static AffiliatedCompany of(String companyName, String riskKeyword) {
        return new AffiliatedCompany(companyName, riskKeyword, null, null);
    }
}
