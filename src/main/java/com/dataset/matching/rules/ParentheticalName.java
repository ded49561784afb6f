package com.dataset.matching.rules;

/**
 * The two halves of a "Base Name (ACRONYM)" query. Each half is searched on its own.
 */
public record ParentheticalName(String baseName, String acronym) {
}
