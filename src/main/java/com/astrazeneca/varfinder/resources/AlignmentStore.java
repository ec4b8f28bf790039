package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.data.PslRecord;

import java.util.List;

/**
 * Alignments of transcripts on the genome.
 */
public interface AlignmentStore {
    /**
     * @param queryName transcript accession without version
     * @return alignments as stored, empty if there are none
     */
    List<PslRecord> getAlignments(String queryName);
}
