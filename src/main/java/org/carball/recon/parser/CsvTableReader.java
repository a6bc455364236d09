package org.carball.recon.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.carball.recon.model.table.RawTable;
import org.carball.recon.model.table.SourceTable;
import org.carball.recon.model.table.TableLoadException;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads delimited text files into {@link RawTable}s.
 * <p>
 * Decoding falls back through UTF-8, windows-1252 and ISO-8859-1; the delimiter is sniffed from the
 * header line. The first record is the header row.
 */
@Slf4j
public class CsvTableReader {

    private static final List<Charset> ENCODINGS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1
    );

    private static final char BOM = '\uFEFF';

    /**
     * Lists the {@code .csv} files of a directory as deferred sources, sorted by file name.
     * Each file is only read when its source is loaded.
     */
    public List<SourceTable> sourcesIn(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Input directory not found: " + directory);
        }
        try (Stream<Path> paths = Files.list(directory)) {
            List<SourceTable> sources = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .map(path -> new SourceTable(path.getFileName().toString(), () -> read(path)))
                    .collect(Collectors.toList());
            log.info("Found {} CSV files in {}", sources.size(), directory);
            return sources;
        }
    }

    public RawTable read(Path file) throws TableLoadException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new TableLoadException("Could not read file: " + e.getMessage(), e);
        }
        return parse(decode(content, file.getFileName().toString()));
    }

    public RawTable parse(String text) throws TableLoadException {
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        char delimiter = DelimiterDetector.detect(firstLine(text));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreSurroundingSpaces(false)
                .build();

        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(text))) {
            for (CSVRecord record : parser) {
                records.add(record.toList());
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TableLoadException("Malformed delimited text: " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            throw new TableLoadException("File has no header row");
        }
        return new RawTable(records.get(0), records.subList(1, records.size()));
    }

    private String decode(byte[] content, String fileName) throws TableLoadException {
        for (Charset charset : ENCODINGS) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString();
                log.debug("Decoded {} as {}", fileName, charset.name());
                return text;
            } catch (CharacterCodingException e) {
                log.debug("Could not decode {} as {}: {}", fileName, charset.name(), e.getMessage());
            }
        }
        throw new TableLoadException("Could not decode file with any supported encoding");
    }

    private static String firstLine(String text) {
        int end = text.indexOf('\n');
        return end < 0 ? text : text.substring(0, end);
    }
}
