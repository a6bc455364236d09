package org.carball.recon.model.field;

import java.util.List;
import java.util.Map;

/**
 * Canonical field name to the normalized headers judged equivalent to it.
 *
 * @param mappings           per canonical field, in registry order; fields with no match map to an empty list
 * @param unmappedHeaders    headers that matched no canonical field, sorted
 * @param multiMappedHeaders headers that matched more than one canonical field, with those fields in registry order
 */
public record FieldMapping(
        Map<String, List<String>> mappings,
        List<String> unmappedHeaders,
        Map<String, List<String>> multiMappedHeaders
) {

    public List<String> headersFor(String canonicalField) {
        return mappings.getOrDefault(canonicalField, List.of());
    }

    public boolean isAmbiguous(String normalizedHeader) {
        return multiMappedHeaders.containsKey(normalizedHeader);
    }

    public long mappedFieldCount() {
        return mappings.values().stream().filter(headers -> !headers.isEmpty()).count();
    }
}
