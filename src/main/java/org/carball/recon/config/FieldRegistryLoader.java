package org.carball.recon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.recon.model.field.CanonicalField;
import org.carball.recon.model.field.CanonicalFieldRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the canonical field registry from YAML:
 * <pre>
 * fields:
 *   - name: folio_no
 *     aliases: [folio no, folio, folio number]
 * </pre>
 * Field and alias order in the file is kept.
 */
@Slf4j
public class FieldRegistryLoader {

    static final String DEFAULT_REGISTRY_RESOURCE = "/default-field-registry.yml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public CanonicalFieldRegistry load(Path registryFile) throws IOException {
        if (!Files.exists(registryFile)) {
            throw new IllegalArgumentException("Field registry file not found: " + registryFile);
        }
        try (InputStream in = Files.newInputStream(registryFile)) {
            CanonicalFieldRegistry registry = read(in);
            log.info("Loaded {} canonical fields from {}", registry.size(), registryFile);
            return registry;
        }
    }

    public CanonicalFieldRegistry loadDefault() throws IOException {
        try (InputStream in = FieldRegistryLoader.class.getResourceAsStream(DEFAULT_REGISTRY_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default field registry not found on classpath: " + DEFAULT_REGISTRY_RESOURCE);
            }
            CanonicalFieldRegistry registry = read(in);
            log.info("Using built-in field registry with {} canonical fields", registry.size());
            return registry;
        }
    }

    private CanonicalFieldRegistry read(InputStream in) throws IOException {
        RegistryDocument document = mapper.readValue(in, RegistryDocument.class);
        if (document == null || document.getFields() == null || document.getFields().isEmpty()) {
            throw new IllegalArgumentException("Field registry defines no fields");
        }

        List<CanonicalField> fields = new ArrayList<>();
        for (FieldEntry entry : document.getFields()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new IllegalArgumentException("Field registry entry without a name");
            }
            fields.add(new CanonicalField(entry.getName().trim(), entry.getAliases()));
        }
        return new CanonicalFieldRegistry(fields);
    }

    @Data
    private static class RegistryDocument {
        private List<FieldEntry> fields;
    }

    @Data
    private static class FieldEntry {
        private String name;
        private List<String> aliases;
    }
}
