package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.PatternTableRow;
import com.astrazeneca.varfinder.exception.PatternTableException;
import com.astrazeneca.varfinder.resources.TabularFile;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads pattern tables: tab separated files with the columns seqType, mutType, isCoding, patName and pat.
 * Lines starting with "#" are comments.
 */
public class PatternTableReader {
    private static final Log log = Log.getInstance(PatternTableReader.class);

    public static final String DEFAULT_PATTERN_RESOURCE = "/variant_patterns.tsv";

    static final String[] COLUMNS = {"seqType", "mutType", "isCoding", "patName", "pat"};

    /**
     * Reads the pattern table bundled with VarFinder.
     * @throws PatternTableException if the resource is missing or malformed
     */
    public List<PatternTableRow> readDefault() {
        InputStream stream = PatternTableReader.class.getResourceAsStream(DEFAULT_PATTERN_RESOURCE);
        if (stream == null) {
            throw new PatternTableException(DEFAULT_PATTERN_RESOURCE, "resource not found");
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return read(reader, DEFAULT_PATTERN_RESOURCE);
        } catch (IOException e) {
            throw new PatternTableException(DEFAULT_PATTERN_RESOURCE, e.getMessage(), e);
        }
    }

    /**
     * Reads a pattern table file.
     * @param path path to the table
     * @throws PatternTableException if the file can't be read or misses columns
     */
    public List<PatternTableRow> read(String path) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(path),
                StandardCharsets.UTF_8))) {
            return read(reader, path);
        } catch (IOException e) {
            throw new PatternTableException(path, e.getMessage(), e);
        }
    }

    List<PatternTableRow> read(BufferedReader reader, String source) throws IOException {
        log.info("Parsing regexes from ", source);
        TabularFile file = TabularFile.read(reader);
        List<String> missing = file.missingColumns(COLUMNS);
        if (!missing.isEmpty()) {
            throw new PatternTableException(source, "missing columns " + missing);
        }
        List<PatternTableRow> rows = new ArrayList<>(file.rows.size());
        for (Map<String, String> row : file.rows) {
            rows.add(new PatternTableRow(row.get("seqType"), row.get("mutType"), row.get("isCoding"),
                    row.get("patName"), row.get("pat")));
        }
        return rows;
    }
}
