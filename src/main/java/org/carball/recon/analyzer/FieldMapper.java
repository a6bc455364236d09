package org.carball.recon.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.recon.model.field.CanonicalField;
import org.carball.recon.model.field.CanonicalFieldRegistry;
import org.carball.recon.model.field.FieldMapping;
import org.carball.recon.parser.HeaderNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps the normalized headers seen across all files onto the canonical field registry.
 * <p>
 * Canonical fields are independent targets: one header may match several of them, and every such
 * association is kept and reported as ambiguous. Within one field, aliases are tried in registry
 * order and the first satisfying alias decides the match. The canonical name itself is tried after
 * the listed aliases.
 */
@Slf4j
public class FieldMapper {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;

    private final double similarityThreshold;

    public FieldMapper() {
        this(DEFAULT_SIMILARITY_THRESHOLD);
    }

    public FieldMapper(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public FieldMapping buildMapping(Set<String> normalizedHeaders, CanonicalFieldRegistry registry) {
        Set<String> headers = new TreeSet<>();
        for (String header : normalizedHeaders) {
            if (header != null && !header.isEmpty()) {
                headers.add(header);
            }
        }

        log.info("Mapping {} normalized headers onto {} canonical fields", headers.size(), registry.size());

        Map<String, List<String>> mappings = new LinkedHashMap<>();
        Map<String, List<String>> fieldsByHeader = new TreeMap<>();

        for (CanonicalField field : registry.fields()) {
            List<String> aliases = normalizedAliases(field);
            Set<String> matched = new LinkedHashSet<>();

            for (String header : headers) {
                if (aliases.contains(header)) {
                    matched.add(header);
                }
            }

            for (String header : headers) {
                if (matched.contains(header)) {
                    continue;
                }
                for (String alias : aliases) {
                    if (isFuzzyMatch(header, alias)) {
                        log.debug("Fuzzy match: '{}' -> {} via alias '{}'", header, field.name(), alias);
                        matched.add(header);
                        break;
                    }
                }
            }

            mappings.put(field.name(), List.copyOf(matched));
            for (String header : matched) {
                fieldsByHeader.computeIfAbsent(header, h -> new ArrayList<>()).add(field.name());
            }
        }

        List<String> unmapped = new ArrayList<>();
        Map<String, List<String>> multiMapped = new TreeMap<>();
        for (String header : headers) {
            List<String> fields = fieldsByHeader.get(header);
            if (fields == null) {
                unmapped.add(header);
            } else if (fields.size() > 1) {
                multiMapped.put(header, List.copyOf(fields));
                log.warn("Header '{}' matches {} canonical fields: {}", header, fields.size(), fields);
            }
        }

        log.info("Mapped {} headers, {} unmapped, {} ambiguous",
                headers.size() - unmapped.size(), unmapped.size(), multiMapped.size());

        return new FieldMapping(
                Collections.unmodifiableMap(mappings),
                List.copyOf(unmapped),
                Collections.unmodifiableMap(multiMapped));
    }

    boolean isFuzzyMatch(String header, String alias) {
        if (header.isEmpty() || alias.isEmpty()) {
            return false;
        }
        return header.contains(alias)
                || alias.contains(header)
                || TokenSimilarity.similarity(header, alias) >= similarityThreshold;
    }

    private static List<String> normalizedAliases(CanonicalField field) {
        Set<String> aliases = new LinkedHashSet<>();
        for (String alias : field.aliases()) {
            String normalized = HeaderNormalizer.normalize(alias);
            if (!normalized.isEmpty()) {
                aliases.add(normalized);
            }
        }
        String name = HeaderNormalizer.normalize(field.name());
        if (!name.isEmpty()) {
            aliases.add(name);
        }
        return new ArrayList<>(aliases);
    }
}
