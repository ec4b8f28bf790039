package com.astrazeneca.varfinder.data;

/**
 * Codons of a transcript covering a protein range and their 0-based position on the transcript.
 */
public class CodingWindow {
    public final String codons;
    public final int start;
    public final int end;

    public CodingWindow(String codons, int start, int end) {
        this.codons = codons;
        this.start = start;
        this.end = end;
    }
}
