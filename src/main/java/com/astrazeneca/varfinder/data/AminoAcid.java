package com.astrazeneca.varfinder.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Amino acids of the standard genetic code with their one-letter and three-letter codes,
 * the names they can be written with and their unambiguous codons.
 */
public enum AminoAcid {
    ALANINE("A", "Ala", new String[]{"alanine"}, "GCT", "GCC", "GCA", "GCG"),
    ARGININE("R", "Arg", new String[]{"arginine"}, "CGT", "CGC", "CGA", "CGG", "AGA", "AGG"),
    ASPARAGINE("N", "Asn", new String[]{"asparagine"}, "AAT", "AAC"),
    ASPARTIC_ACID("D", "Asp", new String[]{"aspartic acid", "aspartate"}, "GAT", "GAC"),
    CYSTEINE("C", "Cys", new String[]{"cysteine"}, "TGT", "TGC"),
    GLUTAMIC_ACID("E", "Glu", new String[]{"glutamic acid", "glutamate"}, "GAA", "GAG"),
    GLUTAMINE("Q", "Gln", new String[]{"glutamine"}, "CAA", "CAG"),
    GLYCINE("G", "Gly", new String[]{"glycine"}, "GGT", "GGC", "GGA", "GGG"),
    HISTIDINE("H", "His", new String[]{"histidine"}, "CAT", "CAC"),
    ISOLEUCINE("I", "Ile", new String[]{"isoleucine"}, "ATT", "ATC", "ATA"),
    LEUCINE("L", "Leu", new String[]{"leucine"}, "TTA", "TTG", "CTT", "CTC", "CTA", "CTG"),
    LYSINE("K", "Lys", new String[]{"lysine"}, "AAA", "AAG"),
    METHIONINE("M", "Met", new String[]{"methionine"}, "ATG"),
    PHENYLALANINE("F", "Phe", new String[]{"phenylalanine"}, "TTT", "TTC"),
    PROLINE("P", "Pro", new String[]{"proline"}, "CCT", "CCC", "CCA", "CCG"),
    SERINE("S", "Ser", new String[]{"serine"}, "TCT", "TCC", "TCA", "TCG", "AGT", "AGC"),
    THREONINE("T", "Thr", new String[]{"threonine"}, "ACT", "ACC", "ACA", "ACG"),
    TRYPTOPHAN("W", "Trp", new String[]{"tryptophan"}, "TGG"),
    TYROSINE("Y", "Tyr", new String[]{"tyrosine"}, "TAT", "TAC"),
    VALINE("V", "Val", new String[]{"valine"}, "GTT", "GTC", "GTA", "GTG"),
    STOP_CODON("*", "Ter", new String[]{"stop", "ter"}, "TAA", "TAG", "TGA");

    public static final int CODON_LENGTH = 3;

    /**
     * One-letter code of an unknown or untranslatable residue.
     */
    public static final char UNKNOWN = 'X';

    private static final Map<Character, AminoAcid> BY_LETTER = new HashMap<>();
    private static final Map<String, AminoAcid> BY_CODON = new HashMap<>();
    private static final Map<String, String> LONG_TO_LETTER = new HashMap<>();

    static {
        for (AminoAcid aa : values()) {
            BY_LETTER.put(aa.letter, aa);
            for (String codon : aa.codons) {
                BY_CODON.put(codon, aa);
            }
            LONG_TO_LETTER.put(aa.code.toLowerCase(Locale.US), String.valueOf(aa.letter));
            for (String name : aa.names) {
                LONG_TO_LETTER.put(name, String.valueOf(aa.letter));
            }
        }
        LONG_TO_LETTER.put("x", "X");
    }

    private final char letter;
    private final String code;
    private final String[] names;
    private final String[] codons;

    AminoAcid(String letter, String code, String[] names, String... codons) {
        this.letter = letter.charAt(0);
        this.code = code;
        this.names = names;
        this.codons = codons;
    }

    public char getLetter() {
        return letter;
    }

    public String getCode() {
        return code;
    }

    public String[] getCodons() {
        return codons.clone();
    }

    public static AminoAcid fromLetter(char letter) {
        return BY_LETTER.get(Character.toUpperCase(letter));
    }

    /**
     * @param codon three bases, case insensitive
     * @return amino acid encoded by the codon or null for codons with non-ACGT bases
     */
    public static AminoAcid fromCodon(String codon) {
        return BY_CODON.get(codon.toUpperCase(Locale.US));
    }

    /**
     * Converts a three-letter code or a full amino acid name to its one-letter code.
     * @param longName name as written in the text, any case
     * @return one-letter code or null if the name is not an amino acid
     */
    public static String threeToOne(String longName) {
        return LONG_TO_LETTER.get(longName.toLowerCase(Locale.US));
    }

    /**
     * Converts a run of concatenated three-letter codes, e.g. "ArgLys", to one-letter codes.
     * @return one-letter codes or null if any chunk is not an amino acid
     */
    public static String threeToOneMulti(String longNames) {
        if (longNames.length() % CODON_LENGTH != 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < longNames.length(); i += CODON_LENGTH) {
            String letter = threeToOne(longNames.substring(i, i + CODON_LENGTH));
            if (letter == null) {
                return null;
            }
            sb.append(letter);
        }
        return sb.toString();
    }

    /**
     * Converts one-letter codes to concatenated three-letter codes, "RG" becomes "ArgGly".
     * Unknown letters are written as "Xaa".
     */
    public static String oneToThree(String letters) {
        StringBuilder sb = new StringBuilder();
        for (char c : letters.toCharArray()) {
            AminoAcid aa = fromLetter(c);
            sb.append(aa == null ? "Xaa" : aa.code);
        }
        return sb.toString();
    }
}
