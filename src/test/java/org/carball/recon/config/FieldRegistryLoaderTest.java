package org.carball.recon.config;

import org.carball.recon.model.field.CanonicalField;
import org.carball.recon.model.field.CanonicalFieldRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FieldRegistryLoaderTest {

    private final FieldRegistryLoader loader = new FieldRegistryLoader();

    @Test
    public void shouldLoadBuiltInRegistry() throws Exception {
        CanonicalFieldRegistry registry = loader.loadDefault();

        assertThat(registry.size()).isEqualTo(18);
        assertThat(registry.fields().get(0).name()).isEqualTo("pt_cause_no");
        assertThat(registry.fields().get(17).name()).isEqualTo("serial_number");
        assertThat(registry.fields().get(17).aliases()).contains("no", "s/no");
        assertThat(registry.fields().get(10).name()).isEqualTo("beneficiaries");
        assertThat(registry.fields().get(10).aliases()).contains("beneficiaries/ date of birth/ id no.");
    }

    @Test
    public void shouldKeepFieldAndAliasOrder(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("cases.yml");
        Files.writeString(file, """
            fields:
              - name: case_number
                aliases: [case no, case number]
              - name: filing_date
                aliases:
                  - date filed
                  - filed on
              - name: judge
            """);

        CanonicalFieldRegistry registry = loader.load(file);

        assertThat(registry.fields()).extracting(CanonicalField::name)
                .containsExactly("case_number", "filing_date", "judge");
        assertThat(registry.fields().get(1).aliases()).containsExactly("date filed", "filed on");
        assertThat(registry.fields().get(2).aliases()).isEmpty();
    }

    @Test
    public void shouldRejectMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    public void shouldRejectRegistryWithoutFields(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "fields: []\n");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no fields");
    }

    @Test
    public void shouldRejectUnnamedOrDuplicateFields(@TempDir Path tempDir) throws Exception {
        Path unnamed = tempDir.resolve("unnamed.yml");
        Files.writeString(unnamed, "fields:\n  - aliases: [x]\n");
        Path duplicate = tempDir.resolve("duplicate.yml");
        Files.writeString(duplicate, "fields:\n  - name: county\n  - name: county\n");

        assertThatThrownBy(() -> loader.load(unnamed))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without a name");
        assertThatThrownBy(() -> loader.load(duplicate))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate canonical field");
    }
}
