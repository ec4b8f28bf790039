package com.astrazeneca.varfinder.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Regex Patterns of VarFinder stored in one place.
 */
public class Patterns {
    //Pattern table patterns
    public static final jregex.Pattern PLACEHOLDER = new jregex.Pattern("\\{(\\w+)\\}");
    public static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");

    //Accession patterns
    public static final Pattern ACCESSION_VERSION = Pattern.compile("^([^.]+)\\.(\\d+)$");
    public static final Pattern RS_ID = Pattern.compile("^(?:rs)?([1-9][0-9]*)$");

    //Documents file patterns
    public static final Pattern GENE_MENTION = Pattern.compile("^([^:]+):(\\d+)-(\\d+)$");

    private static final String AA_LONG = "CYS|ILE|SER|GLN|MET|ASN|PRO|LYS|ASP|THR|PHE|ALA|GLY|HIS|LEU|ARG|TRP|VAL|GLU|TYR|TER"
            + "|GLUTAMINE|GLUTAMIC ACID|LEUCINE|VALINE|ISOLEUCINE|LYSINE|ALANINE|GLYCINE|ASPARTATE|METHIONINE|THREONINE"
            + "|HISTIDINE|ASPARTIC ACID|ARGININE|ASPARAGINE|TRYPTOPHAN|PROLINE|PHENYLALANINE|CYSTEINE|SERINE|GLUTAMATE"
            + "|TYROSINE|STOP|X";
    private static final String AA_SHORT = "CISQMNPKDTFAGHLRWVEYX";
    private static final String NUMBER = "[1-9][0-9]*";

    /**
     * Regex fragments that replace the {placeholder} names of pattern table templates.
     */
    public static final Map<String, String> PLACEHOLDERS;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("sep", "(?:^|[:;\\s\\(\\[\\'\\\"/,\\-])");
        map.put("fromPos", "(?<fromPos>" + NUMBER + ")");
        map.put("toPos", "(?<toPos>" + NUMBER + ")");
        map.put("pos", "(?<pos>" + NUMBER + ")");
        map.put("offset", "(?<offset>" + NUMBER + ")");
        map.put("plusMinus", "(?<plusMinus>[+-])");
        map.put("origAaShort", "(?<origAaShort>[" + AA_SHORT + "])");
        map.put("origAasShort", "(?<origAasShort>[" + AA_SHORT + "]+)");
        map.put("skipAa", "(?:" + AA_LONG + ")");
        map.put("origAaLong", "(?<origAaLong>" + AA_LONG + ")");
        map.put("origAasLong", "(?<origAasLong>(?:" + AA_LONG + ")+)");
        // lower case f tolerates "fs"
        map.put("mutAaShort", "(?<mutAaShort>[f" + AA_SHORT + "*])");
        map.put("mutAaLong", "(?<mutAaLong>" + AA_LONG + "|FS)");
        map.put("mutAasShort", "(?<mutAasShort>[f" + AA_SHORT + "*]+)");
        map.put("mutAasLong", "(?<mutAasLong>(?:" + AA_LONG + "|FS)+)");
        map.put("dna", "(?<dna>[actgACTG])");
        map.put("dnas", "(?<dnas>[actgACTG]+)");
        map.put("origDna", "(?<origDna>[actgACTG])");
        map.put("origDnas", "(?<origDnas>[actgACTG]+)");
        map.put("mutDna", "(?<mutDna>[actgACTGfs])");
        map.put("fs", "(?<fs>fs\\*?[0-9]*|fs\\*|fs|)?");
        map.put("intron", "(?<intron>" + NUMBER + ")");
        map.put("rightArrow", "(?:-*>|\u2192|-?&gt;|r|R|4|\ufb02)");
        map.put("sp", "(?:\u00a0| |)");
        map.put("rsId", "(?<rsId>[1-9][0-9]{1,9})");
        PLACEHOLDERS = Collections.unmodifiableMap(map);
    }

    private Patterns() {
    }
}
