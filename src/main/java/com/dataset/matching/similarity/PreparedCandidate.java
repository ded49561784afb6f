package com.dataset.matching.similarity;

import com.dataset.matching.core.model.ReferenceEntity;
import com.dataset.matching.rules.NameNormalizer;

import java.util.List;

/**
 * A reference entity with its comparable forms computed once, so that classifying it
 * against several query variants does not normalize it repeatedly.
 */
public record PreparedCandidate(ReferenceEntity entity,
                                String normalizedName,
                                String coreName,
                                List<String> normalizedAliases) {

    public static PreparedCandidate of(ReferenceEntity entity, NameNormalizer normalizer) {
        List<String> aliases = entity.aliases().stream()
                .map(normalizer::normalize)
                .filter(alias -> !alias.isEmpty())
                .distinct()
                .toList();
        return new PreparedCandidate(entity,
                normalizer.normalize(entity.organizationName()),
                normalizer.core(entity.organizationName()),
                aliases);
    }
}
