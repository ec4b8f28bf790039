package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.data.GenomeLocus;

/**
 * Known variants of dbSNP by genome interval and by rs identifier.
 */
public interface DbSnpStore {
    /**
     * @return rs identifier ("rs123") of the exact interval or null
     */
    String lookupDbSnp(String chrom, int start, int end);

    /**
     * @param rsId identifier with or without the "rs" prefix
     * @return genome interval of the identifier or null
     */
    GenomeLocus rsIdToGenome(String rsId);
}
