package org.carball.recon.analyzer;

import org.carball.recon.config.AnalysisSettings;
import org.carball.recon.model.analysis.AnalysisReport;
import org.carball.recon.model.analysis.FileFailure;
import org.carball.recon.model.date.FormatTag;
import org.carball.recon.model.field.CanonicalField;
import org.carball.recon.model.field.CanonicalFieldRegistry;
import org.carball.recon.model.quality.FieldCompletenessRecord;
import org.carball.recon.model.table.RawTable;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.model.table.TableLoadException;
import org.carball.recon.parser.CsvTableReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReconciliationOrchestratorTest {

    private CanonicalFieldRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CanonicalFieldRegistry(List.of(
                new CanonicalField("pt_cause_no", List.of("pt cause no", "cause no")),
                new CanonicalField("deceased_name", List.of("name of the deceased", "deceased name")),
                new CanonicalField("date_of_death", List.of("date of death", "died")),
                new CanonicalField("county", List.of("county", "location"))));
    }

    @Test
    public void shouldContinuePastCorruptFile() {
        List<SourceTable> sources = List.of(
                SourceTable.of("2018.csv", new RawTable(
                        List.of("PT Cause No", "Name of the Deceased", "Date of Death"),
                        List.of(List.of("1/2018", "John Doe", "2001-02-28")))),
                new SourceTable("2019.csv", () -> {
                    throw new TableLoadException("Malformed delimited text");
                }),
                SourceTable.of("2020.csv", new RawTable(
                        List.of("Cause No", "Deceased Name", "Died", "Location"),
                        List.of(List.of("7/2020", "Jane Roe", "1954-20-20", "Nairobi")))));

        AnalysisReport report = new ReconciliationOrchestrator(registry).reconcile(sources);

        assertThat(report.fileFailures()).hasSize(1);
        assertThat(report.fileFailures().get(0).fileId()).isEqualTo("2019.csv");
        assertThat(report.fileFailures().get(0).reason()).isEqualTo("Malformed delimited text");
        assertThat(report.summary().filesAnalyzed()).isEqualTo(2);
        assertThat(report.completeness().values().stream().flatMap(List::stream))
                .extracting(FieldCompletenessRecord::fileId)
                .doesNotContain("2019.csv")
                .contains("2018.csv", "2020.csv");

        assertThat(report.fieldMapping().headersFor("pt_cause_no")).containsExactly("cause no", "pt cause no");
        assertThat(report.fieldMapping().headersFor("date_of_death")).containsExactly("date of death", "died");
        assertThat(report.fieldMapping().headersFor("county")).containsExactly("location");
        assertThat(report.filesContaining("pt_cause_no")).isEqualTo(2);
        assertThat(report.dateFormatHistogram())
                .containsEntry(FormatTag.ISO_DATE, 1)
                .containsEntry(FormatTag.ISO_DATE_INVALID_RANGE, 1);
        assertThat(report.invalidDateSamples()).hasSize(1);
        assertThat(report.invalidDateSamples().get(0).fileId()).isEqualTo("2020.csv");
    }

    @Test
    public void shouldContinuePastCorruptFileOnDisk(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("a.csv"), "County,Died\nNairobi,4/4/2024\n");
        Files.writeString(tempDir.resolve("b.csv"), "");
        Files.writeString(tempDir.resolve("c.csv"), "County;Died\nKisumu;06.11.2000\n");

        AnalysisReport report = new ReconciliationOrchestrator(registry)
                .reconcile(new CsvTableReader().sourcesIn(tempDir));

        assertThat(report.fileFailures()).extracting(FileFailure::fileId).containsExactly("b.csv");
        assertThat(report.fieldVariations().get("county")).containsExactly("a.csv", "c.csv");
        assertThat(report.dateFormatHistogram())
                .containsEntry(FormatTag.SLASH_NUMERIC, 1)
                .containsEntry(FormatTag.DOT_NUMERIC, 1);
    }

    @Test
    public void shouldProduceSameResultInParallel() {
        List<SourceTable> sources = new ArrayList<>();
        String[][] headerSets = {
                {"PT Cause No", "Date of Death", "County"},
                {"Cause No", "Died", "Location"},
                {"pt   cause no", "DATE OF DEATH", "Status"},
                {"Deceased Name", "Died", "County"}
        };
        String[] dates = {"2001-02-28", "1954-20-20", "4/4/2024", "Mon Nov 06 2000", "25/6/", "4/4/24/23"};
        for (int file = 0; file < 12; file++) {
            List<List<String>> rows = new ArrayList<>();
            for (int row = 0; row < 15; row++) {
                rows.add(List.of("C" + row, dates[(file + row) % dates.length], row % 3 == 0 ? "" : "x"));
            }
            sources.add(SourceTable.of(String.format("%02d.csv", file),
                    new RawTable(List.of(headerSets[file % headerSets.length]), rows)));
        }
        sources.add(new SourceTable("99.csv", () -> {
            throw new TableLoadException("unreadable");
        }));

        ReconciliationOrchestrator orchestrator = new ReconciliationOrchestrator(registry);
        AnalysisReport sequential = orchestrator.reconcileSequential(sources);
        List<SourceTable> reversed = new ArrayList<>(sources);
        Collections.reverse(reversed);
        AnalysisReport parallel = orchestrator.reconcileParallel(reversed, 4);

        assertThat(parallel.fieldMapping()).isEqualTo(sequential.fieldMapping());
        assertThat(parallel.dateFormatHistogram()).isEqualTo(sequential.dateFormatHistogram());
        assertThat(parallel.completeness()).isEqualTo(sequential.completeness());
        assertThat(parallel.invalidDateSamples()).isEqualTo(sequential.invalidDateSamples());
        assertThat(parallel.columnProfiles()).isEqualTo(sequential.columnProfiles());
        assertThat(parallel.fileFailures()).isEqualTo(sequential.fileFailures());
        assertThat(parallel.summary()).isEqualTo(sequential.summary());
    }

    @Test
    public void shouldRunInParallelWhenConfigured() {
        AnalysisSettings settings = AnalysisSettings.builder().parallelism(3).build();
        List<String> threads = new CopyOnWriteArrayList<>();
        List<SourceTable> sources = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            sources.add(new SourceTable("f" + i + ".csv", () -> {
                threads.add(Thread.currentThread().getName());
                return new RawTable(List.of("county"), List.of(List.of("Nairobi")));
            }));
        }

        AnalysisReport report = new ReconciliationOrchestrator(registry, settings).reconcile(sources);

        assertThat(report.summary().filesAnalyzed()).isEqualTo(3);
        assertThat(threads).allMatch(name -> name.startsWith("recon-worker-"));
    }

    @Test
    public void shouldReturnEmptyReportForNoFiles() {
        AnalysisReport report = new ReconciliationOrchestrator(registry).reconcile(List.of());

        assertThat(report.summary().filesAnalyzed()).isZero();
        assertThat(report.fieldMapping().mappings()).containsOnlyKeys(
                "pt_cause_no", "deceased_name", "date_of_death", "county");
        assertThat(report.fieldMapping().mappedFieldCount()).isZero();
        assertThat(report.dateFormatHistogram()).isEmpty();
    }

    @Test
    public void shouldRejectMissingSourceList() {
        ReconciliationOrchestrator orchestrator = new ReconciliationOrchestrator(registry);

        assertThatThrownBy(() -> orchestrator.reconcile(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.reconcileParallel(List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldStopWhenInterrupted() {
        ReconciliationOrchestrator orchestrator = new ReconciliationOrchestrator(registry);
        List<SourceTable> sources = List.of(
                SourceTable.of("a.csv", new RawTable(List.of("county"), List.of())));

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> orchestrator.reconcileSequential(sources))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
