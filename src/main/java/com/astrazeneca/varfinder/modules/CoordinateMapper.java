package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.CodingWindow;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.NucleotideChange;
import com.astrazeneca.varfinder.data.ProjectedVariants;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.exception.SequenceMismatchException;
import com.astrazeneca.varfinder.resources.SeqData;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.astrazeneca.varfinder.data.AminoAcid.CODON_LENGTH;

/**
 * Moves protein variants to the coding sequence and the transcript, and coding DNA variants to the transcript.
 * <p>
 * Coding positions count from the first base of the start codon, transcript positions from the first base of
 * the transcript. All positions are 0-based.
 */
public class CoordinateMapper {
    private static final Log log = Log.getInstance(CoordinateMapper.class);

    private final SeqData seqData;
    private final BackTranslator backTranslator;
    private final boolean shuffle;

    /**
     * @param shuffle shuffled sequences can't be checked, the codon translation check is skipped
     */
    public CoordinateMapper(SeqData seqData, BackTranslator backTranslator, boolean shuffle) {
        this.seqData = seqData;
        this.backTranslator = backTranslator;
        this.shuffle = shuffle;
    }

    /**
     * Codons of the transcript covering protein residues start to end and their position on the transcript.
     * @param transcriptId transcript accession
     * @param start first residue, 0-based
     * @param end residue after the last one
     * @param expectAa residues the codons must translate to, not checked if null
     * @return codons or null if the transcript, its CDS start or the codons are not available
     * @throws SequenceMismatchException if the codons don't translate to expectAa
     */
    public CodingWindow dnaAtCodingPos(String transcriptId, int start, int end, String expectAa) {
        log.debug("Making sure that codons from ", start, "-", end, " in ", transcriptId, " correspond to ", expectAa);
        Integer cdsStart = seqData.getCdsStart(transcriptId);
        if (cdsStart == null) {
            log.warn("No CDS start for ", transcriptId);
            return null;
        }
        String cdnaSeq = seqData.getSeq(transcriptId);
        if (cdnaSeq == null) {
            log.warn("Could not find seq ", transcriptId, " (update diff between UCSC/NCBI maps?)");
            return null;
        }
        int nuclStart = cdsStart + CODON_LENGTH * start;
        int nuclEnd = nuclStart + CODON_LENGTH * (end - start);
        if (nuclEnd > cdnaSeq.length()) {
            log.warn("Codons ", nuclStart, "-", nuclEnd, " are outside of ", transcriptId);
            return null;
        }
        String codons = cdnaSeq.substring(nuclStart, nuclEnd).toUpperCase(Locale.US);
        String foundAa = BackTranslator.translate(codons);
        log.debug("CDS start is ", cdsStart, ", nucl pos is ", nuclStart, ", codon is ", codons);
        if (expectAa != null && !shuffle && !foundAa.equals(expectAa)) {
            throw new SequenceMismatchException(transcriptId, start + 1, foundAa, expectAa);
        }
        return new CodingWindow(codons, nuclStart, nuclEnd);
    }

    /**
     * Finds the changes on the coding sequence and on the transcript that give the protein variants.
     * A substitution gives one variant per possible nucleotide change, other types cover the whole codons.
     * Transcripts whose codons don't match the protein are skipped.
     * @param protVars variants located on RefSeq proteins
     * @return protein, coding and transcript variants or null if a transcript sequence is not available
     */
    public ProjectedVariants mapToCodingAndRna(List<VariantDescription> protVars) {
        List<VariantDescription> codVars = new ArrayList<>();
        List<VariantDescription> rnaVars = new ArrayList<>();
        for (VariantDescription protVar : protVars) {
            String transId = seqData.getRefSeqId(protVar.seqId);
            if (transId == null) {
                log.error("could not resolve refprot ", protVar.seqId, " to refseq. This is due to a difference "
                        + "between UniProt and Refseq updates. Skipping this protein.");
                continue;
            }
            try {
                if (!mapProteinVariant(protVar, transId, codVars, rnaVars)) {
                    return null;
                }
            } catch (SequenceMismatchException e) {
                log.warn("Skipping transcript ", transId, ": ", e.getMessage());
            }
        }
        return new ProjectedVariants(protVars, codVars, rnaVars);
    }

    private boolean mapProteinVariant(VariantDescription protVar, String transId,
                                      List<VariantDescription> codVars, List<VariantDescription> rnaVars) {
        if (protVar.mutType == MutationType.INS && protVar.origSeq == null) {
            return mapInsertion(protVar, transId, codVars, rnaVars);
        }
        CodingWindow window = dnaAtCodingPos(transId, protVar.start, protVar.start + protVar.origSeq.length(),
                protVar.origSeq);
        if (window == null) {
            return false;
        }
        int cdStart = CODON_LENGTH * protVar.start;
        if (protVar.mutType != MutationType.SUB) {
            // the text rarely tells which bases exactly, the whole codons are used
            int cdEnd = cdStart + window.codons.length();
            String mutDna = protVar.mutType == MutationType.DUP ? window.codons + window.codons : null;
            codVars.add(new VariantDescription(protVar.mutType, SequenceType.CDS, transId, cdStart, cdEnd,
                    window.codons, mutDna, 0, protVar.origStr));
            rnaVars.add(new VariantDescription(protVar.mutType, SequenceType.RNA, transId, window.start, window.end,
                    window.codons, mutDna, 0, protVar.origStr));
            return true;
        }
        for (NucleotideChange change : backTranslator.possibleDnaChanges(protVar.origSeq, protVar.mutSeq, window.codons)) {
            int changeStart = cdStart + change.relPos;
            int changeLength = change.oldNucl.length();
            codVars.add(new VariantDescription(MutationType.SUB, SequenceType.CDS, transId, changeStart,
                    changeStart + changeLength, change.oldNucl, change.newNucl, 0, protVar.origStr));
            int rnaStart = window.start + change.relPos;
            rnaVars.add(new VariantDescription(MutationType.SUB, SequenceType.RNA, transId, rnaStart,
                    rnaStart + changeLength, change.oldNucl, change.newNucl, 0, protVar.origStr));
        }
        return true;
    }

    /**
     * Inserted residues can't be back-translated to one sequence. The variant is anchored on the last base
     * before the insertion point and carries no inserted bases.
     */
    private boolean mapInsertion(VariantDescription protVar, String transId,
                                 List<VariantDescription> codVars, List<VariantDescription> rnaVars) {
        CodingWindow window = dnaAtCodingPos(transId, protVar.end - 1, protVar.end, null);
        if (window == null) {
            return false;
        }
        int cdEnd = CODON_LENGTH * protVar.end;
        codVars.add(new VariantDescription(MutationType.INS, SequenceType.CDS, transId, cdEnd - 1, cdEnd,
                null, null, 0, protVar.origStr));
        rnaVars.add(new VariantDescription(MutationType.INS, SequenceType.RNA, transId, window.end - 1, window.end,
                null, null, 0, protVar.origStr));
        return true;
    }

    /**
     * Places a coding DNA (or intron) variant on each of the transcripts. The intron offset stays on the
     * variant and is applied on the genome.
     * @param variant variant with coding positions
     * @param seqIds transcripts it was verified on
     * @return coding and transcript variants, no protein variants
     */
    public ProjectedVariants mapDnaToCodingAndRna(VariantDescription variant, List<String> seqIds) {
        List<VariantDescription> codVars = new ArrayList<>();
        List<VariantDescription> rnaVars = new ArrayList<>();
        for (String seqId : seqIds) {
            Integer cdsStart = seqData.getCdsStart(seqId);
            if (cdsStart == null) {
                log.warn("No CDS start for ", seqId, ", skipping it");
                continue;
            }
            codVars.add(variant.withSeqId(seqId, SequenceType.CDS));
            int rnaStart = codingToRnaStart(variant.start + 1, cdsStart);
            rnaVars.add(variant.withLocation(seqId, SequenceType.RNA, rnaStart, rnaStart + variant.length()));
        }
        return new ProjectedVariants(new ArrayList<VariantDescription>(), codVars, rnaVars);
    }

    /**
     * Transcript position of a coding base.
     * @param hgvsPos position as written in c. notation, 1-based
     * @param cdsStart 0-based transcript position of the first coding base
     * @return 0-based transcript position
     */
    public static int codingToRnaStart(int hgvsPos, int cdsStart) {
        return hgvsPos + cdsStart - 1;
    }
}
