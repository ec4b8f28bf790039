package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.data.AminoAcid;
import com.astrazeneca.varfinder.data.Blacklist;
import com.astrazeneca.varfinder.data.GenomeLocus;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VariantPattern;
import com.astrazeneca.varfinder.resources.SeqData;
import htsjdk.samtools.util.Log;

import java.util.Locale;
import java.util.regex.Matcher;

/**
 * Turns a regex match of a variant pattern into a variant description. Positions written in the text are
 * 1-based, the descriptions are 0-based with exclusive end. Matches that don't describe a usable variant
 * (blacklisted names, frameshifts, unknown residue names, unknown rs identifiers) give null.
 */
public class VariantMatchParser {
    private static final Log log = Log.getInstance(VariantMatchParser.class);

    /**
     * Characters trimmed from the matched text.
     */
    private static final String ORIG_STR_TRIM = " \t\r\n ()[]:;,'\"/-";

    private final SeqData seqData;

    /**
     * @param seqData reference data to resolve rs identifiers, may be null if no dbSNP patterns are used
     */
    public VariantMatchParser(SeqData seqData) {
        this.seqData = seqData;
    }

    /**
     * @param pattern pattern that matched
     * @param match successful match
     * @return variant or null if the match is discarded
     */
    public VariantDescription parse(VariantPattern pattern, Matcher match) {
        try {
            switch (pattern.mutType) {
                case SUB:
                    return parseSub(pattern, match);
                case DEL:
                    return parseDel(pattern, match);
                case INS:
                    return parseIns(pattern, match);
                case DUP:
                    return parseDup(pattern, match);
                case SPLICING:
                    return parseSplicing(pattern, match);
                case DB_SNP:
                    return parseRsId(pattern, match);
                default:
                    return null;
            }
        } catch (NumberFormatException e) {
            log.debug("Position out of range in ", match.group());
            return null;
        }
    }

    private VariantDescription parseSub(VariantPattern pattern, Matcher match) {
        int offset = getOffset(pattern, match);
        if (pattern.has("fs") && match.group("fs") != null && !match.group("fs").isEmpty()) {
            log.debug("Frameshifts are not grounded: ", match.group());
            return null;
        }

        String origSeq = null;
        if (pattern.has("origAaShort")) {
            origSeq = match.group("origAaShort");
        }
        if (pattern.has("origAaLong")) {
            origSeq = AminoAcid.threeToOne(match.group("origAaLong"));
        }
        String mutSeq = null;
        if (pattern.has("mutAaShort")) {
            String mutAa = match.group("mutAaShort");
            // lower case f is the start of "fs"
            mutSeq = "f".equals(mutAa) ? null : mutAa;
        }
        if (pattern.has("mutAaLong")) {
            mutSeq = AminoAcid.threeToOne(match.group("mutAaLong"));
        }
        if (pattern.has("origDna")) {
            origSeq = match.group("origDna");
        }
        if (pattern.has("mutDna")) {
            mutSeq = dnaOrNull(match.group("mutDna"));
        }
        if (origSeq == null || mutSeq == null) {
            log.debug("Frameshift or unknown residue in ", match.group());
            return null;
        }
        origSeq = origSeq.toUpperCase(Locale.US);
        mutSeq = mutSeq.toUpperCase(Locale.US);

        int start;
        int end;
        if (pattern.has("fromPos") && pattern.has("toPos")) {
            start = Integer.parseInt(match.group("fromPos")) - 1;
            end = Integer.parseInt(match.group("toPos")) - 1;
        } else {
            int pos = Integer.parseInt(match.group("pos"));
            if (Blacklist.isBlacklisted(origSeq, pos, mutSeq)) {
                return null;
            }
            start = pos - 1;
            end = pos;
        }
        if (!VariantDescription.isValidSubstitution(start, end, origSeq, mutSeq)) {
            log.debug("Substitution ", origSeq, ">", mutSeq, " doesn't fit its range in ", match.group());
            return null;
        }
        return new VariantDescription(MutationType.SUB, pattern.seqType, null, start, end, origSeq, mutSeq,
                offset, origStr(match));
    }

    private VariantDescription parseDel(VariantPattern pattern, Matcher match) {
        int offset = getOffset(pattern, match);
        int start;
        int end;
        if (pattern.has("fromPos") && pattern.has("toPos")) {
            start = Integer.parseInt(match.group("fromPos")) - 1;
            end = Integer.parseInt(match.group("toPos"));
        } else {
            int pos = Integer.parseInt(match.group("pos"));
            start = pos - 1;
            end = pos;
        }

        String origSeq = null;
        if (pattern.has("origAasShort")) {
            origSeq = match.group("origAasShort");
        }
        if (pattern.has("origAasLong")) {
            origSeq = AminoAcid.threeToOneMulti(match.group("origAasLong"));
        }
        if (pattern.has("origDnas")) {
            origSeq = match.group("origDnas");
        }
        if (pattern.has("origDna")) {
            origSeq = match.group("origDna");
        }
        if (pattern.has("origAaShort")) {
            origSeq = match.group("origAaShort");
        } else if (pattern.has("origAaLong")) {
            origSeq = AminoAcid.threeToOne(match.group("origAaLong"));
        }
        if (origSeq == null || end <= start) {
            log.debug("No usable deletion in ", match.group());
            return null;
        }
        return new VariantDescription(MutationType.DEL, pattern.seqType, null, start, end,
                origSeq.toUpperCase(Locale.US), null, offset, origStr(match));
    }

    private VariantDescription parseIns(VariantPattern pattern, Matcher match) {
        int offset = getOffset(pattern, match);
        int start;
        int end;
        if (pattern.has("fromPos") && pattern.has("toPos")) {
            start = Integer.parseInt(match.group("fromPos")) - 1;
            end = Integer.parseInt(match.group("toPos")) - 1;
        } else {
            int pos = Integer.parseInt(match.group("pos"));
            start = pos - 1;
            end = pos;
        }

        String mutSeq = null;
        if (pattern.has("mutAasShort")) {
            mutSeq = match.group("mutAasShort");
        }
        if (pattern.has("mutAasLong")) {
            mutSeq = AminoAcid.threeToOneMulti(match.group("mutAasLong"));
            if (mutSeq == null) {
                log.debug("Frameshift or unknown residue in ", match.group());
                return null;
            }
        }
        if (pattern.has("dnas")) {
            mutSeq = match.group("dnas");
        }
        if (end <= start) {
            log.debug("Insertion range is empty in ", match.group());
            return null;
        }
        return new VariantDescription(MutationType.INS, pattern.seqType, null, start, end, null,
                mutSeq == null ? null : mutSeq.toUpperCase(Locale.US), offset, origStr(match));
    }

    private VariantDescription parseDup(VariantPattern pattern, Matcher match) {
        int offset = getOffset(pattern, match);
        String origSeq = pattern.has("origDna") ? match.group("origDna") : match.group("origDnas");
        origSeq = origSeq.toUpperCase(Locale.US);

        int start;
        int end;
        if (pattern.has("pos")) {
            start = Integer.parseInt(match.group("pos")) - 1;
            end = start + 1;
        } else {
            start = Integer.parseInt(match.group("fromPos")) - 1;
            end = Integer.parseInt(match.group("toPos")) - 1;
            // inclusive ranges are one short
            if (end - start != origSeq.length() && end - start == origSeq.length() - 1) {
                log.warn("Duplication range of ", match.group(), " is one shorter than ", origSeq,
                        ". Extending it by one.");
                end += 1;
            }
        }
        if (end <= start) {
            log.debug("Duplication range is empty in ", match.group());
            return null;
        }
        return new VariantDescription(MutationType.DUP, pattern.seqType, null, start, end, origSeq,
                origSeq + origSeq, offset, origStr(match));
    }

    private VariantDescription parseSplicing(VariantPattern pattern, Matcher match) {
        int start = Integer.parseInt(match.group("pos")) - 1;
        int offset = Integer.parseInt(match.group("offset"));
        if ("-".equals(match.group("plusMinus"))) {
            offset = -offset;
        }
        String mutSeq = dnaOrNull(match.group("mutDna"));
        if (mutSeq == null) {
            return null;
        }
        return new VariantDescription(MutationType.SPLICING, pattern.seqType, null, start, start + 1,
                match.group("origDna").toUpperCase(Locale.US), mutSeq.toUpperCase(Locale.US), offset, origStr(match));
    }

    private VariantDescription parseRsId(VariantPattern pattern, Matcher match) {
        String rsId = "rs" + match.group("rsId");
        GenomeLocus locus = seqData == null ? null : seqData.rsIdToGenome(rsId);
        if (locus == null) {
            log.debug("dbSNP identifier ", rsId, " is not known");
            return null;
        }
        if (locus.end <= locus.start) {
            log.debug("dbSNP identifier ", rsId, " has an empty interval ", locus);
            return null;
        }
        return new VariantDescription(MutationType.DB_SNP, SequenceType.DB_SNP, locus.chrom, locus.start, locus.end,
                rsId, null, 0, origStr(match));
    }

    /**
     * Signed intron offset, only for patterns of non coding positions.
     */
    private static int getOffset(VariantPattern pattern, Matcher match) {
        if (pattern.isCoding || !pattern.has("plusMinus") || !pattern.has("offset")) {
            return 0;
        }
        int offset = Integer.parseInt(match.group("offset"));
        return "-".equals(match.group("plusMinus")) ? -offset : offset;
    }

    /**
     * The "f" and "s" of a tolerated "fs" are not bases.
     */
    private static String dnaOrNull(String dna) {
        return "f".equals(dna) || "s".equals(dna) ? null : dna;
    }

    private static String origStr(Matcher match) {
        return Utils.strip(match.group(), ORIG_STR_TRIM);
    }
}
