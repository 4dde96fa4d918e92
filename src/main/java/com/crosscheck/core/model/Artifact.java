package com.crosscheck.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Work product of a producing agent. Crosscheck never looks inside {@code content}.
 *
 * @param id         producer-assigned identifier
 * @param producerId agent that produced the artifact
 * @param kind       free-form type label (e.g. "source", "manifest")
 * @param content    the artifact body
 * @param metadata   additional producer data
 */
public record Artifact(
    String id,
    String producerId,
    String kind,
    String content,
    Map<String, Object> metadata
) {

    public Artifact {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
