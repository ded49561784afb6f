package com.dataset.matching.store;

import com.dataset.matching.core.model.Dataset;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads reference datasets from JSON into an {@link InMemoryReferenceStore}.
 *
 * <pre>
 * {
 *   "datasets": [
 *     { "id": "...", "name": "...", "is_active": true,
 *       "entries": [ { "organization_name": "...", "aliases": ["..."],
 *                      "category": "...", "countries": ["..."] } ] }
 *   ]
 * }
 * </pre>
 * Entries are loaded verbatim; malformed entries are rejected later, at match time.
 */
public class JsonReferenceDatasetLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonReferenceDatasetLoader.class);

    private final ObjectMapper objectMapper;

    public JsonReferenceDatasetLoader() {
        this(new ObjectMapper());
    }

    public JsonReferenceDatasetLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the datasets from {@code input} into {@code store}.
     *
     * @return number of datasets loaded
     */
    public int load(InputStream input, InMemoryReferenceStore store) {
        DatasetFile file;
        try {
            file = objectMapper.readValue(input, DatasetFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse reference dataset JSON", e);
        }
        if (file.datasets() == null) {
            return 0;
        }
        for (DatasetSection section : file.datasets()) {
            if (section.id() == null || section.id().isBlank()) {
                throw new IllegalArgumentException("Dataset without id in reference dataset JSON");
            }
            List<Map<String, Object>> entries = section.entries() != null ? section.entries() : List.of();
            boolean active = section.active() == null || section.active();
            store.addDataset(new Dataset(section.id(), section.name(), active, entries.size()), entries);
        }
        log.info("Loaded {} reference datasets from JSON", file.datasets().size());
        return file.datasets().size();
    }

    public int load(Path path, InMemoryReferenceStore store) {
        try (InputStream input = Files.newInputStream(path)) {
            return load(input, store);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * Loads a classpath resource.
     */
    public int loadResource(String resource, InMemoryReferenceStore store) {
        try (InputStream input = JsonReferenceDatasetLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return load(input, store);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resource " + resource, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DatasetFile(@JsonProperty("datasets") List<DatasetSection> datasets) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DatasetSection(@JsonProperty("id") String id,
                          @JsonProperty("name") String name,
                          @JsonProperty("is_active") Boolean active,
                          @JsonProperty("entries") List<Map<String, Object>> entries) {
    }
}
