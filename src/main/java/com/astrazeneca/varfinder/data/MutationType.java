package com.astrazeneca.varfinder.data;

/**
 * Kinds of sequence changes a pattern can describe. The label is the value used in the
 * mutType column of the pattern table.
 */
public enum MutationType {
    SUB("sub"),
    DEL("del"),
    INS("ins"),
    DUP("dup"),
    SPLICING("splicing"),
    DB_SNP("dbSnp");

    private final String label;

    MutationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param label value of the mutType column
     * @return matching mutation type or null if the label is unknown
     */
    public static MutationType fromLabel(String label) {
        for (MutationType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return null;
    }
}
