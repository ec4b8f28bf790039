package com.astrazeneca.varfinder.resources;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tab separated table with a header line. A leading "#" of the header is ignored, other lines starting
 * with "#" and empty lines are skipped. Missing trailing values are read as empty strings.
 */
public class TabularFile {
    public final List<String> header;
    public final List<Map<String, String>> rows;

    private TabularFile(List<String> header, List<Map<String, String>> rows) {
        this.header = Collections.unmodifiableList(header);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static TabularFile read(BufferedReader reader) throws IOException {
        List<String> header = null;
        List<Map<String, String>> rows = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (header == null) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                String headerLine = line.startsWith("#") ? line.substring(1) : line;
                header = Arrays.asList(headerLine.split("\t", -1));
                continue;
            }
            if (line.startsWith("#") || line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split("\t", -1);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), i < values.length ? values[i] : "");
            }
            rows.add(row);
        }
        return new TabularFile(header == null ? Collections.<String>emptyList() : header, rows);
    }

    /**
     * @return names of the given columns that are not in the header
     */
    public List<String> missingColumns(String... columns) {
        List<String> missing = new ArrayList<>();
        for (String column : columns) {
            if (!header.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * Splits a comma separated cell, empty cells give an empty list.
     */
    public static List<String> splitList(String cell) {
        List<String> values = new ArrayList<>();
        for (String value : cell.split(",")) {
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }
}
