package org.carball.recon.parser;

import org.carball.recon.model.table.RawTable;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.model.table.TableLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CsvTableReaderTest {

    private CsvTableReader reader;

    @BeforeEach
    void setUp() {
        reader = new CsvTableReader();
    }

    @Test
    public void shouldParseHeaderAndRows() throws Exception {
        RawTable table = reader.parse("""
            Name of Deceased,Date of Death,County
            John Doe,2001-02-28,Nairobi
            "Smith, Jane",06/11/00,Mombasa
            """);

        assertThat(table.headers()).containsExactly("Name of Deceased", "Date of Death", "County");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.cell(1, 0)).isEqualTo("Smith, Jane");
        assertThat(table.cell(1, 1)).isEqualTo("06/11/00");
    }

    @Test
    public void shouldKeepShortRows() throws Exception {
        RawTable table = reader.parse("""
            a,b,c
            1,2,3
            4
            """);

        assertThat(table.rows().get(1)).containsExactly("4");
        assertThat(table.cell(1, 2)).isEmpty();
    }

    @Test
    public void shouldSniffSemicolonDelimiter() throws Exception {
        RawTable table = reader.parse("folio no;gender\n12;F\n");

        assertThat(table.headers()).containsExactly("folio no", "gender");
        assertThat(table.cell(0, 1)).isEqualTo("F");
    }

    @Test
    public void shouldStripByteOrderMark() throws Exception {
        RawTable table = reader.parse("\uFEFFfolio no,gender\n12,F\n");

        assertThat(table.headers().get(0)).isEqualTo("folio no");
    }

    @Test
    public void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> reader.parse(""))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("no header row");
    }

    @Test
    public void shouldRejectUnterminatedQuote() {
        assertThatThrownBy(() -> reader.parse("a,b\n\"never closed,2\n"))
                .isInstanceOf(TableLoadException.class);
    }

    @Test
    public void shouldFallBackToWindows1252(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("legacy.csv");
        Files.write(file, "name,county\nJosé,Nyeri\n".getBytes(Charset.forName("windows-1252")));

        RawTable table = reader.read(file);

        assertThat(table.cell(0, 0)).isEqualTo("José");
    }

    @Test
    public void shouldListCsvFilesSortedByName(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("b_2019.csv"), "name\nx\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("a_2018.CSV"), "name\ny\n", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("notes.txt"), "ignore me", StandardCharsets.UTF_8);

        List<SourceTable> sources = reader.sourcesIn(tempDir);

        assertThat(sources).extracting(SourceTable::fileId).containsExactly("a_2018.CSV", "b_2019.csv");
        assertThat(sources.get(1).source().load().cell(0, 0)).isEqualTo("x");
    }

    @Test
    public void shouldDeferReadingUntilLoad(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("late.csv");
        Files.writeString(file, "name\nearly\n", StandardCharsets.UTF_8);
        SourceTable source = reader.sourcesIn(tempDir).get(0);

        Files.writeString(file, "name\nlate\n", StandardCharsets.UTF_8);

        assertThat(source.source().load().cell(0, 0)).isEqualTo("late");
    }

    @Test
    public void shouldRejectMissingDirectory(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.sourcesIn(tempDir.resolve("missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Input directory not found");
    }

    @Test
    public void shouldReportUnreadableFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("gone.csv")))
                .isInstanceOf(TableLoadException.class)
                .hasMessageContaining("Could not read file");
    }
}
