package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.data.GenomeLocus;
import com.astrazeneca.varfinder.exception.ReferenceDataException;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;

import static com.astrazeneca.varfinder.data.Patterns.RS_ID;

/**
 * dbSNP positions from a tab separated file with the columns chrom, start, end and rsId, without header.
 * Start is 0-based, end exclusive.
 */
public class TabularDbSnpStore implements DbSnpStore {
    private static final Log log = Log.getInstance(TabularDbSnpStore.class);

    private final Map<GenomeLocus, String> locusToRsId = new HashMap<>();
    private final Map<String, GenomeLocus> rsIdToLocus = new HashMap<>();

    /**
     * @param rsId identifier with or without the "rs" prefix
     */
    public void addSnp(String chrom, int start, int end, String rsId) {
        String normalized = normalize(rsId);
        if (normalized == null) {
            throw new IllegalArgumentException("Wrong dbSNP identifier " + rsId);
        }
        GenomeLocus locus = new GenomeLocus(chrom, start, end);
        locusToRsId.put(locus, normalized);
        rsIdToLocus.put(normalized, locus);
    }

    /**
     * Reads the dbSNP file.
     * @param path path to the file
     * @return loaded store
     * @throws ReferenceDataException if the file can't be read or has a wrong line
     */
    public static TabularDbSnpStore load(String path) {
        TabularDbSnpStore store = new TabularDbSnpStore();
        try (BufferedReader reader = new BufferedReader(new FileReader(path))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("#") || line.trim().isEmpty()) {
                    continue;
                }
                String[] columns = line.split("\t");
                if (columns.length < 4) {
                    throw new ReferenceDataException(path, "less than 4 columns in line " + lineNumber);
                }
                try {
                    store.addSnp(columns[0], Integer.parseInt(columns[1]), Integer.parseInt(columns[2]), columns[3]);
                } catch (IllegalArgumentException e) {
                    throw new ReferenceDataException(path, "wrong line " + lineNumber, e);
                }
            }
        } catch (IOException e) {
            throw new ReferenceDataException(path, e.getMessage(), e);
        }
        log.info("Loaded ", store.rsIdToLocus.size(), " dbSNP identifiers from ", path);
        return store;
    }

    private static String normalize(String rsId) {
        Matcher matcher = RS_ID.matcher(rsId.trim());
        return matcher.find() ? "rs" + matcher.group(1) : null;
    }

    @Override
    public String lookupDbSnp(String chrom, int start, int end) {
        return locusToRsId.get(new GenomeLocus(chrom, start, end));
    }

    @Override
    public GenomeLocus rsIdToGenome(String rsId) {
        String normalized = normalize(rsId);
        return normalized == null ? null : rsIdToLocus.get(normalized);
    }
}
