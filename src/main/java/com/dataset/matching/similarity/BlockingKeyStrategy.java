package com.dataset.matching.similarity;

import java.util.Set;

/**
 * Generates blocking keys from a normalized organization name.
 *
 * <p>The reference store indexes every entity under its keys; the candidate window for
 * fuzzy scoring is the set of entities sharing at least one key with a query variant.
 * Store and query side must use the same strategy.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * @param normalizedName a normalized name
     * @return blocking keys, never null, possibly empty
     */
    Set<String> generateKeys(String normalizedName);
}
