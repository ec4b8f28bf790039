package com.astrazeneca.varfinder.data;

/**
 * Sequence a variant position refers to. PROT, DNA, INTRON and DB_SNP are the categories text variants
 * are extracted into, CDS and RNA only appear on variants derived while grounding.
 */
public enum SequenceType {
    PROT("prot", "p."),
    DNA("dna", "c."),
    CDS("cds", "c."),
    RNA("rna", "r."),
    INTRON("intron", "c."),
    DB_SNP("dbSnp", "");

    private final String label;
    private final String hgvsPrefix;

    SequenceType(String label, String hgvsPrefix) {
        this.label = label;
        this.hgvsPrefix = hgvsPrefix;
    }

    public String getLabel() {
        return label;
    }

    public String getHgvsPrefix() {
        return hgvsPrefix;
    }

    /**
     * Categories of the extraction result, in output order.
     */
    public static SequenceType[] textCategories() {
        return new SequenceType[]{PROT, DNA, DB_SNP, INTRON};
    }

    public boolean isTextCategory() {
        return this == PROT || this == DNA || this == DB_SNP || this == INTRON;
    }

    /**
     * @param label value of the seqType column
     * @return matching sequence type or null if the label is unknown
     */
    public static SequenceType fromLabel(String label) {
        for (SequenceType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return null;
    }
}
