package com.eainde.insight.ingestion;

import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.schema.SourceKind;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads CSV exports. The first non-empty line is the header; fields are addressed by exact
 * column name.
 */
@Slf4j
public class TabularSourceLoader extends AbstractSourceLoader<TabularSourceLoader.Table, Map<String, String>> {

    private static final Set<SourceKind> MAPPABLE = EnumSet.of(
            SourceKind.CONTENT, SourceKind.FOLLOWERS, SourceKind.VISITORS, SourceKind.TRAFFIC);

    /** Parsed CSV: header plus rows keyed by header, in file order. */
    public record Table(List<String> headers, List<Map<String, String>> rows) {
    }

    public TabularSourceLoader(FilenameHeuristics heuristics) {
        super(heuristics);
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.TABULAR;
    }

    @Override
    public Table parse(SourceFile file) throws FileLoadException {
        CsvParser parser = new CsvParser(newSettings());
        try (Reader reader = file.openReader()) {
            parser.beginParsing(reader);
            String[] header = parser.parseNext();
            if (header == null) {
                return new Table(List.of(), List.of());
            }
            List<String> headers = normalizeHeaders(header);

            List<Map<String, String>> rows = new ArrayList<>();
            String[] row;
            while ((row = parser.parseNext()) != null) {
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    values.put(headers.get(i), i < row.length ? row[i] : null);
                }
                rows.add(values);
            }
            log.debug("Parsed {}: {} columns, {} rows", file.name(), headers.size(), rows.size());
            return new Table(headers, rows);
        } catch (IOException | TextParsingException e) {
            throw new FileLoadException("Cannot read CSV " + file.name() + ": " + e.getMessage(), e);
        } finally {
            parser.stopParsing();
        }
    }

    @Override
    public Sample sample(SourceFile file, Table table, int rows) {
        List<Object> sampleRows = new ArrayList<>(table.rows().subList(0, Math.min(rows, table.rows().size())));
        return new Sample(file.name(), family(), table.headers(), sampleRows);
    }

    @Override
    protected Set<SourceKind> mappableKinds() {
        return MAPPABLE;
    }

    @Override
    protected List<Map<String, String>> entries(Table table, SchemaMapping mapping) {
        return table.rows();
    }

    @Override
    protected Optional<String> resolve(Map<String, String> row, String column) {
        if (!row.containsKey(column)) {
            return Optional.empty();
        }
        String value = row.get(column);
        return Optional.of(value == null ? "" : value);
    }

    private static CsvParserSettings newSettings() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setMaxCharsPerColumn(-1);
        return settings;
    }

    private static List<String> normalizeHeaders(String[] header) {
        List<String> headers = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "column_" + (i + 1) : header[i].trim();
            if (i == 0 && name.startsWith("\uFEFF")) {
                name = name.substring(1);
            }
            headers.add(name);
        }
        return headers;
    }
}
