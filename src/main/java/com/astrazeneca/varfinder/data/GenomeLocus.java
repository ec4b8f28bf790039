package com.astrazeneca.varfinder.data;

import java.util.Objects;

/**
 * Interval on a chromosome, 0-based, end exclusive.
 */
public class GenomeLocus {
    public final String chrom;
    public final int start;
    public final int end;

    public GenomeLocus(String chrom, int start, int end) {
        this.chrom = chrom;
        this.start = start;
        this.end = end;
    }

    public String key() {
        return chrom + ":" + start + "-" + end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenomeLocus locus = (GenomeLocus) o;
        return start == locus.start &&
                end == locus.end &&
                Objects.equals(chrom, locus.chrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chrom, start, end);
    }

    @Override
    public String toString() {
        return key();
    }
}
