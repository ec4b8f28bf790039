package com.astrazeneca.varfinder.data;

import java.util.Objects;

import static com.astrazeneca.varfinder.data.AminoAcid.oneToThree;

/**
 * A change to a sequence, found in text or derived from another variant while grounding.
 * <p>
 * Start and end are 0-based, end exclusive. A variant without seqId is "unlocated": its positions are
 * the ones written in the text. Intron variants carry the signed distance to the nearest exon in offset.
 * The dbSNP variants are located on a chromosome and keep the rs identifier in origSeq.
 */
public class VariantDescription {
    public final MutationType mutType;
    public final SequenceType seqType;
    public final String seqId;
    public final int start;
    public final int end;
    public final String origSeq;
    public final String mutSeq;
    public final int offset;
    /**
     * Matched text, trimmed.
     */
    public final String origStr;

    public VariantDescription(MutationType mutType, SequenceType seqType, String seqId, int start, int end,
                              String origSeq, String mutSeq, int offset, String origStr) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Wrong variant range " + start + "-" + end + " for " + origStr);
        }
        if (mutType == MutationType.SUB && !isValidSubstitution(start, end, origSeq, mutSeq)) {
            throw new IllegalArgumentException("Substitution " + origSeq + ">" + mutSeq
                    + " doesn't cover range " + start + "-" + end);
        }
        this.mutType = mutType;
        this.seqType = seqType;
        this.seqId = seqId;
        this.start = start;
        this.end = end;
        this.origSeq = origSeq;
        this.mutSeq = mutSeq;
        this.offset = offset;
        this.origStr = origStr;
    }

    /**
     * Unlocated variant without intron offset.
     */
    public VariantDescription(MutationType mutType, SequenceType seqType, int start, int end,
                              String origSeq, String mutSeq, String origStr) {
        this(mutType, seqType, null, start, end, origSeq, mutSeq, 0, origStr);
    }

    /**
     * Original and new sequence of a substitution must both span the whole range.
     */
    public static boolean isValidSubstitution(int start, int end, String origSeq, String mutSeq) {
        return origSeq != null && mutSeq != null
                && origSeq.length() == mutSeq.length()
                && origSeq.length() == end - start;
    }

    /**
     * Same change on another sequence at the same positions.
     */
    public VariantDescription withSeqId(String newSeqId, SequenceType newSeqType) {
        return new VariantDescription(mutType, newSeqType, newSeqId, start, end, origSeq, mutSeq, offset, origStr);
    }

    /**
     * Same change moved to other coordinates.
     */
    public VariantDescription withLocation(String newSeqId, SequenceType newSeqType, int newStart, int newEnd) {
        return new VariantDescription(mutType, newSeqType, newSeqId, newStart, newEnd, origSeq, mutSeq, offset, origStr);
    }

    public int length() {
        return end - start;
    }

    public boolean isLocated() {
        return seqId != null;
    }

    /**
     * Name of the variant: rs identifier for dbSNP variants, HGVS-like "p.R71G" for unlocated variants
     * and "NP_009225.1:p.Arg71Gly" for located ones.
     */
    public String getName() {
        if (mutType == MutationType.DB_SNP) {
            return origSeq;
        }
        if (seqId == null) {
            return seqType.getHgvsPrefix() + describeChange(false);
        }
        return makeHgvsStr();
    }

    /**
     * HGVS name on the variant sequence, protein residues as three-letter codes.
     */
    public String makeHgvsStr() {
        return seqId + ":" + seqType.getHgvsPrefix() + describeChange(seqType == SequenceType.PROT);
    }

    /**
     * Identity of the variant during extraction: the same change written twice in a text gets the same key.
     */
    public String getKey() {
        return seqType.getLabel() + "|" + getName();
    }

    private String describeChange(boolean threeLetter) {
        if (seqType == SequenceType.PROT) {
            return describeProteinChange(threeLetter);
        }
        return describeNucleotideChange();
    }

    private String describeProteinChange(boolean threeLetter) {
        int pos = start + 1;
        switch (mutType) {
            case SUB:
                if (length() == 1) {
                    return aa(origSeq, threeLetter) + pos + aa(mutSeq, threeLetter);
                }
                return aaRange(threeLetter) + "delins" + aa(mutSeq, threeLetter);
            case DEL:
                return aaRange(threeLetter) + "del";
            case DUP:
                return aaRange(threeLetter) + "dup";
            case INS:
                return pos + "_" + (end + 1) + "ins" + (mutSeq == null ? "" : aa(mutSeq, threeLetter));
            default:
                return pos + describeSequences();
        }
    }

    private String aaRange(boolean threeLetter) {
        if (origSeq == null) {
            return length() == 1 ? String.valueOf(start + 1) : (start + 1) + "_" + end;
        }
        String first = aa(origSeq.substring(0, 1), threeLetter);
        if (origSeq.length() == 1) {
            return first + (start + 1);
        }
        String last = aa(origSeq.substring(origSeq.length() - 1), threeLetter);
        return first + (start + 1) + "_" + last + end;
    }

    private String describeNucleotideChange() {
        String pos = (start + 1) + offsetString();
        String range = length() == 1 ? pos : pos + "_" + end;
        switch (mutType) {
            case SUB:
            case SPLICING:
                return pos + describeSequences();
            case DEL:
                return range + "del" + nullToEmpty(origSeq);
            case DUP:
                return range + "dup" + nullToEmpty(origSeq);
            case INS:
                return pos + "_" + (end + 1) + "ins" + nullToEmpty(mutSeq);
            default:
                return range;
        }
    }

    private String describeSequences() {
        return nullToEmpty(origSeq) + ">" + nullToEmpty(mutSeq);
    }

    private String offsetString() {
        if (offset == 0) {
            return "";
        }
        return offset > 0 ? "+" + offset : String.valueOf(offset);
    }

    private static String aa(String letters, boolean threeLetter) {
        return threeLetter ? oneToThree(letters) : letters;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariantDescription that = (VariantDescription) o;
        return start == that.start &&
                end == that.end &&
                offset == that.offset &&
                mutType == that.mutType &&
                seqType == that.seqType &&
                Objects.equals(seqId, that.seqId) &&
                Objects.equals(origSeq, that.origSeq) &&
                Objects.equals(mutSeq, that.mutSeq) &&
                Objects.equals(origStr, that.origStr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mutType, seqType, seqId, start, end, origSeq, mutSeq, offset, origStr);
    }

    @Override
    public String toString() {
        return seqType.getLabel() + ":" + mutType.getLabel() + ":" + seqId + ":" + start + "-" + end
                + ":" + origSeq + ">" + mutSeq + (offset == 0 ? "" : ":" + offset) + " (" + origStr + ")";
    }
}
