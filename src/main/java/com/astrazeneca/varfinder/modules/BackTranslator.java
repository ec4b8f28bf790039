package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.AminoAcid;
import com.astrazeneca.varfinder.data.NucleotideChange;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.astrazeneca.varfinder.data.AminoAcid.CODON_LENGTH;

/**
 * Finds the nucleotide changes that can explain an amino acid change, given the codons of the reference.
 */
public class BackTranslator {
    private static final Log log = Log.getInstance(BackTranslator.class);

    private final boolean allowTwoBpVariants;

    /**
     * @param allowTwoBpVariants accept two adjacent changed bases, otherwise only single base changes
     */
    public BackTranslator(boolean allowTwoBpVariants) {
        this.allowTwoBpVariants = allowTwoBpVariants;
    }

    /**
     * Which bases of the original codons may have changed to turn origAa into mutAa.
     * <pre>
     * possibleDnaChanges("V", "V", "GTA") = [(2, A, T), (2, A, C), (2, A, G)]
     * possibleDnaChanges("V", "I", "GTA") = [(0, G, A)]
     * </pre>
     * @param origAa original residues, only used for logging
     * @param mutAa new residues
     * @param origDna codons of the original residues
     * @return distinct changes, empty if no codon of mutAa is close enough to origDna
     */
    public List<NucleotideChange> possibleDnaChanges(String origAa, String mutAa, String origDna) {
        int maxDiff = allowTwoBpVariants ? 2 : 1;
        String dna = origDna.toUpperCase(Locale.US);
        log.debug("Looking for possible DNA change. Aa change ", origAa, " -> ", mutAa, ", original dna ", dna);

        Set<NucleotideChange> changes = new LinkedHashSet<>();
        for (String mutDna : backTrans(mutAa)) {
            if (mutDna.length() != dna.length()) {
                continue;
            }
            NucleotideChange change = firstDiffNucl(dna, mutDna, maxDiff);
            if (change != null) {
                log.debug("found possible mutated DNA: ", mutDna);
                changes.add(change);
            }
        }
        if (changes.isEmpty()) {
            log.debug("No possible DNA change found (max ", maxDiff, " bp change).");
        }
        return new ArrayList<>(changes);
    }

    /**
     * Position and bases where two sequences of same length differ.
     * @param maxDiff maximum number of differing bases, two differences are only accepted if adjacent
     * @return the change or null if the sequences are equal or differ too much
     */
    public static NucleotideChange firstDiffNucl(String str1, String str2, int maxDiff) {
        if (str1.length() != str2.length()) {
            throw new IllegalArgumentException("Sequences of different length: " + str1 + ", " + str2);
        }
        List<Integer> diffPos = new ArrayList<>();
        StringBuilder diff1 = new StringBuilder();
        StringBuilder diff2 = new StringBuilder();
        for (int i = 0; i < str1.length(); i++) {
            if (str1.charAt(i) != str2.charAt(i)) {
                diffPos.add(i);
                diff1.append(str1.charAt(i));
                diff2.append(str2.charAt(i));
                if (diffPos.size() > maxDiff) {
                    return null;
                }
            }
        }
        if (diffPos.size() == 1) {
            return new NucleotideChange(diffPos.get(0), diff1.toString(), diff2.toString());
        }
        if (diffPos.size() == 2 && diffPos.get(0) + 1 == diffPos.get(1)) {
            return new NucleotideChange(diffPos.get(0), diff1.toString(), diff2.toString());
        }
        return null;
    }

    /**
     * All nucleotide sequences that translate to the residues. "CD" gives TGTGAT, TGCGAT, TGTGAC, TGCGAC.
     * @param aaSeq one-letter residues
     * @return sequences, empty if a residue has no codons
     */
    public static List<String> backTrans(String aaSeq) {
        if (aaSeq.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> sequences = new ArrayList<>();
        sequences.add("");
        for (char letter : aaSeq.toCharArray()) {
            AminoAcid aa = AminoAcid.fromLetter(letter);
            if (aa == null) {
                log.debug("No codons for residue ", letter);
                return Collections.emptyList();
            }
            List<String> extended = new ArrayList<>(sequences.size() * aa.getCodons().length);
            for (String codon : aa.getCodons()) {
                for (String sequence : sequences) {
                    extended.add(sequence + codon);
                }
            }
            sequences = extended;
        }
        return sequences;
    }

    /**
     * Translates codons with the standard code, unknown codons become X. Trailing bases are ignored.
     */
    public static String translate(String dna) {
        StringBuilder aaSeq = new StringBuilder(dna.length() / CODON_LENGTH);
        for (int i = 0; i + CODON_LENGTH <= dna.length(); i += CODON_LENGTH) {
            AminoAcid aa = AminoAcid.fromCodon(dna.substring(i, i + CODON_LENGTH));
            aaSeq.append(aa == null ? AminoAcid.UNKNOWN : aa.getLetter());
        }
        return aaSeq.toString();
    }
}
