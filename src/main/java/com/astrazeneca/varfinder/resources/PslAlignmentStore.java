package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.data.PslRecord;
import com.astrazeneca.varfinder.exception.ReferenceDataException;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Transcript alignments from a PSL file, by transcript accession without version.
 */
public class PslAlignmentStore implements AlignmentStore {
    private static final Log log = Log.getInstance(PslAlignmentStore.class);

    private final Map<String, List<PslRecord>> alignments = new HashMap<>();

    public void addAlignment(PslRecord psl) {
        alignments.computeIfAbsent(Utils.stripVersion(psl.qName), k -> new ArrayList<>()).add(psl);
    }

    /**
     * Reads a PSL file. Header lines of psLayout files are skipped.
     * @param path path to the file
     * @return loaded store
     * @throws ReferenceDataException if the file can't be read or has a wrong line
     */
    public static PslAlignmentStore load(String path) {
        PslAlignmentStore store = new PslAlignmentStore();
        try (BufferedReader reader = new BufferedReader(new FileReader(path))) {
            String line;
            int lineNumber = 0;
            int count = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty() || !Character.isDigit(line.charAt(0))) {
                    continue;
                }
                try {
                    store.addAlignment(PslRecord.parse(line));
                    count++;
                } catch (IllegalArgumentException e) {
                    throw new ReferenceDataException(path, "wrong PSL line " + lineNumber, e);
                }
            }
            log.info("Loaded ", count, " alignments from ", path);
        } catch (IOException e) {
            throw new ReferenceDataException(path, e.getMessage(), e);
        }
        return store;
    }

    @Override
    public List<PslRecord> getAlignments(String queryName) {
        List<PslRecord> psls = alignments.get(queryName);
        return psls == null ? Collections.<PslRecord>emptyList() : Collections.unmodifiableList(psls);
    }
}
