package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VerifiedSequences;
import com.astrazeneca.varfinder.resources.SeqData;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Checks that a sequence of a candidate gene has the original residues or bases of a variant at its position.
 * Without this check a variant would be projected on genes that merely happen to be mentioned nearby.
 */
public class SequenceVerifier {
    private static final Log log = Log.getInstance(SequenceVerifier.class);

    private static final String NON_CODING_PREFIX = "NR_";

    private final SeqData seqData;
    private final boolean shuffle;
    private final Random random;

    /**
     * @param shuffle compare against shuffled sequences, for an estimate of random matches
     * @param seed seed of the shuffle
     */
    public SequenceVerifier(SeqData seqData, boolean shuffle, long seed) {
        this.seqData = seqData;
        this.shuffle = shuffle;
        this.random = new Random(seed);
    }

    /**
     * Checks the original sequence of the variant on one sequence. Coding DNA positions are moved by the
     * CDS start of the transcript.
     * @param seqId protein or transcript accession
     * @param variant variant with positions as written in the text
     * @param insertionRv answer for insertions, they have no original sequence to check
     * @return true if the sequence has the variant's original sequence at its position
     */
    public boolean isSeqCorrect(String seqId, VariantDescription variant, boolean insertionRv) {
        if (seqId.startsWith(NON_CODING_PREFIX)) {
            log.info("Skipping noncoding sequence ID ", seqId);
            return false;
        }
        if (variant.mutType == MutationType.INS && (variant.origSeq == null || variant.origSeq.isEmpty())) {
            return insertionRv;
        }
        String seq = seqData.getSeq(seqId);
        if (seq == null) {
            log.debug("sequence ", seqId, " is not human or not available");
            return false;
        }
        int cdsStart = 0;
        if (variant.seqType == SequenceType.DNA || variant.seqType == SequenceType.INTRON) {
            Integer transcriptCdsStart = seqData.getCdsStart(seqId);
            if (transcriptCdsStart == null) {
                log.debug("sequence ", seqId, " has no CDS start");
                return false;
            }
            cdsStart = transcriptCdsStart;
        }
        int vStart = variant.start + cdsStart;
        int vEnd = variant.end + cdsStart;
        if (vEnd > seq.length()) {
            log.debug("sequence ", seqId, " is too short");
            return false;
        }
        if (shuffle) {
            seq = shuffle(seq);
        }

        String foundSeq = seq.substring(vStart, vEnd).toUpperCase(Locale.US);
        if (foundSeq.equals(variant.origSeq.toUpperCase(Locale.US))) {
            log.debug("Seq match: Found ", foundSeq, " at pos ", vStart, "-", vEnd, " in seq ", seqId);
            return true;
        }
        String surroundingSeq = seq.substring(Math.max(0, vStart - 5), Math.min(seq.length(), vEnd + 5));
        log.debug("No seq match: Need ", variant.origSeq, ", but found ", foundSeq, " at pos ", vStart, "-", vEnd,
                " in seq ", seqId, " (surrounding: ", surroundingSeq, ", cdsStart: ", cdsStart, ")");
        return false;
    }

    /**
     * @return the accessions with the variant's original sequence at its position, in input order
     */
    public List<String> hasSeqAtPos(List<String> seqIds, VariantDescription variant, boolean insertionRv) {
        if (seqIds == null) {
            return Collections.emptyList();
        }
        List<String> foundIds = new ArrayList<>();
        for (String seqId : seqIds) {
            if (isSeqCorrect(seqId, variant, insertionRv)) {
                foundIds.add(seqId);
            }
        }
        return foundIds;
    }

    /**
     * Looks for the sequences of a gene that carry the variant, trying the databases in order. Proteins are
     * checked for protein variants, transcripts for coding DNA and intron variants.
     * @param variant variant found in the text
     * @param entrezGene Entrez ID, several IDs may be joined with "/"
     * @param insertionRv answer for insertions without original sequence
     * @param seqDbs database names, see {@link SeqData#entrezToProtDbIds(int, String)}
     * @return the first database with verified sequences and those sequences, or null if there are none
     */
    public VerifiedSequences checkVariantAgainstSequence(VariantDescription variant, String entrezGene,
                                                         boolean insertionRv, List<String> seqDbs) {
        for (String gene : entrezGene.split("/")) {
            Integer entrezId = SeqData.parseEntrezId(gene);
            if (entrezId == null) {
                continue;
            }
            log.debug("Trying to ground ", variant, " to entrez gene ", entrezId);
            for (String db : seqDbs) {
                List<String> seqIds;
                if (variant.seqType == SequenceType.PROT) {
                    seqIds = seqData.entrezToProtDbIds(entrezId, db);
                } else if (variant.seqType == SequenceType.DNA || variant.seqType == SequenceType.INTRON) {
                    seqIds = seqData.entrezToCodingSeqDbIds(entrezId, db);
                } else {
                    log.debug("variant is neither DNA nor prot variant, but ", variant.seqType.getLabel(), " instead");
                    return null;
                }
                if (seqIds.isEmpty()) {
                    continue;
                }
                List<String> foundSeqIds = hasSeqAtPos(seqIds, variant, insertionRv);
                if (!foundSeqIds.isEmpty()) {
                    return new VerifiedSequences(db, foundSeqIds);
                }
            }
        }
        return null;
    }

    private String shuffle(String seq) {
        List<Character> chars = new ArrayList<>(seq.length());
        for (char c : seq.toCharArray()) {
            chars.add(c);
        }
        Collections.shuffle(chars, random);
        StringBuilder sb = new StringBuilder(seq.length());
        for (Character c : chars) {
            sb.append(c);
        }
        return sb.toString();
    }
}
