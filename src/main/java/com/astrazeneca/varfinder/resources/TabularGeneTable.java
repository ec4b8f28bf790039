package com.astrazeneca.varfinder.resources;

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

import static com.astrazeneca.varfinder.resources.TabularFile.splitList;

/**
 * Gene table read from a tab separated file with the columns entrezId, sym, refseqIds and refseqProtIds.
 * Accession columns are comma separated.
 */
public class TabularGeneTable implements GeneTable {
    private static final Log log = Log.getInstance(TabularGeneTable.class);

    static final String[] COLUMNS = {"entrezId", "sym", "refseqIds", "refseqProtIds"};

    private final Map<Integer, String> entrezToSym = new HashMap<>();
    private final Map<String, List<Integer>> symToEntrez = new HashMap<>();
    private final Map<Integer, List<String>> entrezToTranscripts = new HashMap<>();
    private final Map<Integer, List<String>> entrezToProteins = new HashMap<>();

    public void addGene(int entrezId, String symbol, List<String> transcriptIds, List<String> proteinIds) {
        entrezToSym.put(entrezId, symbol);
        symToEntrez.computeIfAbsent(symbol, k -> new ArrayList<>()).add(entrezId);
        entrezToTranscripts.put(entrezId, new ArrayList<>(transcriptIds));
        entrezToProteins.put(entrezId, new ArrayList<>(proteinIds));
    }

    /**
     * Reads the gene table file.
     * @param path path to the file
     * @return loaded table
     * @throws ReferenceDataException if the file can't be read or misses columns
     */
    public static TabularGeneTable load(String path) {
        try (BufferedReader reader = new BufferedReader(new FileReader(path))) {
            TabularFile file = TabularFile.read(reader);
            List<String> missing = file.missingColumns(COLUMNS);
            if (!missing.isEmpty()) {
                throw new ReferenceDataException(path, "missing columns " + missing);
            }
            TabularGeneTable table = new TabularGeneTable();
            for (Map<String, String> row : file.rows) {
                int entrezId;
                try {
                    entrezId = Integer.parseInt(row.get("entrezId").trim());
                } catch (NumberFormatException e) {
                    throw new ReferenceDataException(path, "wrong Entrez ID " + row.get("entrezId"), e);
                }
                table.addGene(entrezId, row.get("sym"), splitList(row.get("refseqIds")),
                        splitList(row.get("refseqProtIds")));
            }
            log.info("Loaded ", table.entrezToSym.size(), " genes from ", path);
            return table;
        } catch (IOException e) {
            throw new ReferenceDataException(path, e.getMessage(), e);
        }
    }

    @Override
    public String getSymbol(int entrezId) {
        return entrezToSym.get(entrezId);
    }

    @Override
    public List<Integer> getEntrezIds(String symbol) {
        List<Integer> ids = symToEntrez.get(symbol);
        return ids == null ? Collections.<Integer>emptyList() : Collections.unmodifiableList(ids);
    }

    @Override
    public List<String> getTranscriptIds(int entrezId) {
        List<String> ids = entrezToTranscripts.get(entrezId);
        return ids == null ? Collections.<String>emptyList() : Collections.unmodifiableList(ids);
    }

    @Override
    public List<String> getProteinIds(int entrezId) {
        List<String> ids = entrezToProteins.get(entrezId);
        return ids == null ? Collections.<String>emptyList() : Collections.unmodifiableList(ids);
    }
}
