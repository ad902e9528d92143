package org.aid.io.json;

/**
 * Describes how ids and feature vectors are stored in the JSON objects.
 * Example object:
 * { "country": "Chad", "features": [1.9, -0.4, ...] }
 */
public record JsonFormat(String idField, String vectorField) {

    public JsonFormat {
        if (idField == null || idField.isBlank()) {
            throw new IllegalArgumentException("idField must be non-empty");
        }
        if (vectorField == null || vectorField.isBlank()) {
            throw new IllegalArgumentException("vectorField must be non-empty");
        }
    }
}
