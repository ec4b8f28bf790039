package com.astrazeneca.varfinder.data;

import java.util.Objects;

/**
 * Difference between two codons: position inside the codon, the original bases and the new bases.
 */
public class NucleotideChange {
    public final int relPos;
    public final String oldNucl;
    public final String newNucl;

    public NucleotideChange(int relPos, String oldNucl, String newNucl) {
        this.relPos = relPos;
        this.oldNucl = oldNucl;
        this.newNucl = newNucl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NucleotideChange that = (NucleotideChange) o;
        return relPos == that.relPos &&
                Objects.equals(oldNucl, that.oldNucl) &&
                Objects.equals(newNucl, that.newNucl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relPos, oldNucl, newNucl);
    }

    @Override
    public String toString() {
        return "(" + relPos + ", " + oldNucl + ", " + newNucl + ")";
    }
}
