package com.astrazeneca.varfinder.data;

/**
 * One row of the pattern table, not validated yet.
 */
public class PatternTableRow {
    public final String seqType;
    public final String mutType;
    public final String isCoding;
    public final String patName;
    public final String pat;

    public PatternTableRow(String seqType, String mutType, String isCoding, String patName, String pat) {
        this.seqType = seqType;
        this.mutType = mutType;
        this.isCoding = isCoding;
        this.patName = patName;
        this.pat = pat;
    }

    @Override
    public String toString() {
        return seqType + "\t" + mutType + "\t" + isCoding + "\t" + patName + "\t" + pat;
    }
}
