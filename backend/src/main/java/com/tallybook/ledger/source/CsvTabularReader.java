package com.tallybook.ledger.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class CsvTabularReader implements TabularReader {

    private static final char BOM = '\uFEFF';
    private static final String UNNAMED_PREFIX = "Unnamed: ";

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public TabularData read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CSVFormat fmt = CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setIgnoreEmptyLines(true)
                    .setTrim(true)
                    .setAllowMissingColumnNames(true)
                    .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                    .build();
            try (CSVParser parser = new CSVParser(reader, fmt)) {
                List<String> rawHeaders = parser.getHeaderNames();
                List<String> headers = new ArrayList<>(rawHeaders.size());
                Set<String> seen = new HashSet<>();
                for (int i = 0; i < rawHeaders.size(); i++) {
                    String h = stripBom(rawHeaders.get(i));
                    // blank cells (a trailing comma) get a positional name, repeats get a .N suffix
                    if (h == null || h.isBlank()) h = UNNAMED_PREFIX + i;
                    String name = h;
                    for (int n = 1; !seen.add(name); n++) {
                        name = h + "." + n;
                    }
                    headers.add(name);
                }
                List<Map<String, String>> rows = new ArrayList<>();
                for (CSVRecord rec : parser) {
                    Map<String, String> row = new LinkedHashMap<>();
                    for (int i = 0; i < headers.size(); i++) {
                        row.put(headers.get(i), i < rec.size() ? rec.get(i) : null);
                    }
                    rows.add(row);
                }
                return new TabularData(headers, rows);
            }
        }
    }

    private static String stripBom(String header) {
        if (header != null && !header.isEmpty() && header.charAt(0) == BOM) {
            return header.substring(1);
        }
        return header;
    }
}
