package com.astrazeneca.varfinder.data;

import htsjdk.samtools.util.Log;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Strings that look like point mutations but are gene, cell line, satellite or yeast strain names
 * (T47D, A375P, E2F and so on).
 */
public class Blacklist {
    private static final Log log = Log.getInstance(Blacklist.class);

    private static final Set<String> ENTRIES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            // genes
            "E2F",
            // satellites
            "D11S", "D12S", "D13S", "D14S", "D15S", "D16S",
            // cell lines
            "A84M", "A84P", "A94P", "C127I", "C86M", "C86P", "L283R", "H96V", "L5178Y", "L89M", "L89P",
            "L929S", "T89G", "T47D", "T84M", "T98G",
            // yeast strains
            "S288C", "T229C",
            // cellosaurus
            "F442A", "A101D", "A2H", "A375M", "A375P", "A529L", "A6L", "B10R", "B10S", "B1203L", "C2M", "C2W",
            "B16V", "B35M", "B3D", "B46M", "C33A", "C4I", "C463A", "C611B", "C831L", "D18T", "D1B", "D2N",
            "D422T", "D8G", "F36E", "F36P", "F11G", "F1B", "F4N", "G14D", "G1B", "G1E", "H2M", "H2P", "H48N",
            "H4M", "H4S", "H69V", "C3A", "C1R", "H766T", "I51T", "K562R", "L2C", "M59K", "M10K", "M10T",
            "M14K", "M22K", "M24K", "M25K", "M28K", "M33K", "M38K", "M9A", "M9K", "H1755A", "H295A", "H295R",
            "H322M", "H460M", "H510A", "H676B", "P3D", "R201C", "R2C", "S16Y", "S594S", "N303L", "N1003L",
            "N2307L", "N1108L", "T27A", "T88M", "H5D", "C1A", "C1D", "C2D", "C2G", "C2H", "C2N", "V79B",
            "V9P", "V10M", "V9M", "X16C"
    )));

    /**
     * Position below which histidine to A/C/D/E and cysteine to histidine changes are read as chemistry.
     */
    private static final int CHEMISTRY_MAX_POS = 80;

    private Blacklist() {
    }

    /**
     * Checks a single-residue change as written in the text, e.g. ("T", 47, "D").
     * @param orig original residue
     * @param pos 1-based position as written
     * @param mut new residue
     * @return true if the string is not a mutation
     */
    public static boolean isBlacklisted(String orig, int pos, String mut) {
        if (ENTRIES.contains(orig + pos + mut)) {
            log.debug("Variant ", orig, pos, mut, " is blacklisted");
            return true;
        }
        if (pos < CHEMISTRY_MAX_POS && mut.length() == 1) {
            if ("H".equals(orig) && "ACDE".contains(mut)) {
                log.debug("Variant ", orig, pos, mut, " looks like a chemical symbol");
                return true;
            }
            if ("C".equals(orig) && "H".equals(mut)) {
                log.debug("Variant ", orig, pos, mut, " looks like a chemical symbol");
                return true;
            }
        }
        return false;
    }
}
