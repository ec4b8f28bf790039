package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.BedRecord;
import com.astrazeneca.varfinder.data.PslRecord;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.resources.SeqData;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects transcript variants on the genome through the transcript alignments.
 */
public class AlignmentProjector {
    private static final Log log = Log.getInstance(AlignmentProjector.class);

    private final SeqData seqData;
    private final PslMapper pslMapper;

    public AlignmentProjector(SeqData seqData, PslMapper pslMapper) {
        this.seqData = seqData;
        this.pslMapper = pslMapper;
    }

    /**
     * Moves a variant to the target of the alignment.
     * @return variant located on the target or null if it falls outside of the aligned blocks
     */
    public VariantDescription pslMapVariant(VariantDescription variant, PslRecord psl) {
        BedRecord bed = pslMapper.mapQuery(psl, variant.start, variant.end, variant.getName());
        if (bed == null) {
            return null;
        }
        return variant.withLocation(bed.chrom, variant.seqType, bed.start, bed.end);
    }

    /**
     * Genome features of transcript variants. Transcripts without alignment are skipped, of several
     * alignments only the first one is used. Intron offsets are added to the projected positions.
     * @param rnaVars variants located on transcripts
     * @param bedName name of the features
     * @return one feature per mapped variant, described by the variant name
     */
    public List<BedRecord> mapToGenome(List<VariantDescription> rnaVars, String bedName) {
        List<BedRecord> beds = new ArrayList<>();
        for (VariantDescription rnaVar : rnaVars) {
            log.debug("Mapping rnaVar ", rnaVar.seqId, ":", rnaVar.start, "-", rnaVar.end,
                    " (offset ", rnaVar.offset, ") to genome");
            List<PslRecord> psls = seqData.getRefseqPsls(rnaVar.seqId);
            if (psls.isEmpty()) {
                log.warn("No mapping for ", rnaVar.seqId, ", skipping variant");
                continue;
            }
            if (psls.size() > 1) {
                log.warn("refSeq ", rnaVar.seqId, " maps to multiple places, using only first one");
            }
            BedRecord bed = pslMapper.mapQuery(psls.get(0), rnaVar.start, rnaVar.end, bedName);
            if (bed == null) {
                log.debug("found mapping psl but nothing was mapped");
                continue;
            }
            bed = bed.shift(rnaVar.offset).withDescription(rnaVar.getName());
            log.debug("Got bed: ", bed);
            beds.add(bed);
        }
        return beds;
    }
}
