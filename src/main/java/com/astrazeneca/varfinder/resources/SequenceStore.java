package com.astrazeneca.varfinder.resources;

/**
 * Protein and transcript sequences and the link between them.
 */
public interface SequenceStore {
    /**
     * @return sequence of the accession or null if it isn't available
     */
    String getSeq(String seqId);

    /**
     * @return transcript accession coding for the protein or null
     */
    String getTranscriptId(String protId);

    /**
     * @return 0-based position of the first coding base in the transcript or null if unknown
     */
    Integer getCdsStart(String transcriptId);
}
