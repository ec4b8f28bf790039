package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.TestData;
import com.astrazeneca.varfinder.data.BedRecord;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.PslRecord;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.resources.SeqData;
import org.mockito.Mockito;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.astrazeneca.varfinder.TestData.BRCA1_TRANSCRIPT;
import static org.testng.Assert.*;

public class AlignmentProjectorTest {

    private static VariantDescription rnaVariant(String seqId, int offset) {
        return new VariantDescription(MutationType.SUB, SequenceType.RNA, seqId, 230, 231, "A", "G", offset, "R71G");
    }

    @Test
    public void testTranscriptVariantToGenome() {
        AlignmentProjector projector = new AlignmentProjector(TestData.seqData(), new PslMapper());
        List<BedRecord> beds = projector.mapToGenome(
                Collections.singletonList(rnaVariant(BRCA1_TRANSCRIPT, 0)), "BRCA1:R71G");

        assertEquals(beds.size(), 1);
        BedRecord bed = beds.get(0);
        assertEquals(bed.chrom, "chr17");
        assertEquals(bed.start, 41258469);
        assertEquals(bed.end, 41258470);
        assertEquals(bed.name, "BRCA1:R71G");
        assertEquals(bed.strand, '-');
        assertEquals(bed.score, BedRecord.DEFAULT_SCORE);
        assertEquals(bed.description, "NM_007294.3:r.231A>G");
    }

    @Test
    public void testIntronOffsetMovesFeature() {
        AlignmentProjector projector = new AlignmentProjector(TestData.seqData(), new PslMapper());
        List<BedRecord> beds = projector.mapToGenome(
                Collections.singletonList(rnaVariant(BRCA1_TRANSCRIPT, 2)), "BRCA1:c.211+2A>G");

        assertEquals(beds.get(0).start, 41258471);
        assertEquals(beds.get(0).end, 41258472);
        assertEquals(beds.get(0).thickStart, 41258471);
    }

    @Test
    public void testTranscriptWithoutAlignmentIsSkipped() {
        AlignmentProjector projector = new AlignmentProjector(TestData.seqData(), new PslMapper());
        List<BedRecord> beds = projector.mapToGenome(Arrays.asList(
                rnaVariant("NM_000546.5", 0), rnaVariant(BRCA1_TRANSCRIPT, 0)), "var");

        assertEquals(beds.size(), 1);
        assertEquals(beds.get(0).chrom, "chr17");
    }

    @Test
    public void testOnlyFirstOfSeveralAlignmentsIsUsed() {
        PslRecord first = new PslRecord(300, 0, 0, 0, 0, 0, 0, 0, "+", "NM_1", 300, 0, 300, "chr1", 10000, 1000,
                1300, new int[]{300}, new int[]{0}, new int[]{1000});
        PslRecord second = new PslRecord(300, 0, 0, 0, 0, 0, 0, 0, "+", "NM_1", 300, 0, 300, "chr2", 10000, 5000,
                5300, new int[]{300}, new int[]{0}, new int[]{5000});
        SeqData seqData = Mockito.mock(SeqData.class);
        Mockito.when(seqData.getRefseqPsls("NM_1.1")).thenReturn(Arrays.asList(first, second));

        List<BedRecord> beds = new AlignmentProjector(seqData, new PslMapper())
                .mapToGenome(Collections.singletonList(rnaVariant("NM_1.1", 0)), "var");

        assertEquals(beds.size(), 1);
        assertEquals(beds.get(0).chrom, "chr1");
        assertEquals(beds.get(0).start, 1230);
    }

    @Test
    public void testPslMapVariant() {
        AlignmentProjector projector = new AlignmentProjector(TestData.seqData(), new PslMapper());
        PslRecord psl = PslRecord.parse(PslMapperTest.BRCA1_PSL);

        VariantDescription mapped = projector.pslMapVariant(rnaVariant(BRCA1_TRANSCRIPT, 0), psl);

        assertEquals(mapped.seqId, "chr17");
        assertEquals(mapped.start, 41258469);
        assertEquals(mapped.end, 41258470);
        assertEquals(mapped.origSeq, "A");
        assertNull(projector.pslMapVariant(
                new VariantDescription(MutationType.SUB, SequenceType.RNA, BRCA1_TRANSCRIPT, 400, 401, "A", "G", 0, "x"),
                psl));
    }
}
