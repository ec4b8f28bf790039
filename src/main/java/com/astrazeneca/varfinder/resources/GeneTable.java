package com.astrazeneca.varfinder.resources;

import java.util.List;

/**
 * Genes by Entrez ID with their symbols and RefSeq accessions.
 */
public interface GeneTable {
    /**
     * @return symbol of the gene or null if the gene is unknown
     */
    String getSymbol(int entrezId);

    /**
     * @return Entrez IDs with this symbol, empty if none
     */
    List<Integer> getEntrezIds(String symbol);

    /**
     * @return versioned RefSeq transcript accessions (NM_) of the gene, empty for unknown genes
     */
    List<String> getTranscriptIds(int entrezId);

    /**
     * @return versioned RefSeq protein accessions (NP_) of the gene, empty for unknown or non-coding genes
     */
    List<String> getProteinIds(int entrezId);
}
