package com.dataset.matching.api;

/**
 * Structural validation of incoming queries.
 */
public final class InputSanitizer {

    /** Maximum entity length after trimming. */
    public static final int MAX_ENTITY_LENGTH = 300;

    /** Maximum number of caller-supplied aliases considered per query. */
    public static final int MAX_ALIASES = 50;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Rejects a null, blank, over-long or control-character-bearing entity.
     *
     * @return the trimmed entity
     * @throws InputValidationException if the entity is invalid
     */
    public static String validateEntity(String entity) {
        if (entity == null || entity.isBlank()) {
            throw new InputValidationException("entity must not be null or blank");
        }
        String trimmed = entity.trim();
        if (trimmed.length() > MAX_ENTITY_LENGTH) {
            throw new InputValidationException("entity exceeds maximum length of " + MAX_ENTITY_LENGTH
                    + " characters (was " + trimmed.length() + ")");
        }
        if (containsControlCharacters(trimmed)) {
            throw new InputValidationException("entity must not contain control characters");
        }
        return trimmed;
    }

    /**
     * Validates a whole query, including its aliases.
     */
    public static void validate(MatchQuery query) {
        if (query == null) {
            throw new InputValidationException("query must not be null");
        }
        validateEntity(query.entity());
        if (query.aliases().size() > MAX_ALIASES) {
            throw new InputValidationException("at most " + MAX_ALIASES + " aliases are allowed (was "
                    + query.aliases().size() + ")");
        }
        for (String alias : query.aliases()) {
            if (alias.length() > MAX_ENTITY_LENGTH || containsControlCharacters(alias)) {
                throw new InputValidationException("alias is too long or contains control characters");
            }
        }
    }

    /**
     * ASCII control characters other than tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
