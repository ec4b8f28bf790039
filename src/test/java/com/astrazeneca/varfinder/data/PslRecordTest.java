package com.astrazeneca.varfinder.data;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class PslRecordTest {
    private static final String LINE = "300\t0\t0\t0\t0\t0\t1\t18550\t-\tNM_007294\t300\t0\t300\tchr17\t81195210\t"
            + "41258400\t41277000\t2\t150,150,\t0,150,\t41258400,41276850,";

    @Test
    public void testParse() {
        PslRecord psl = PslRecord.parse(LINE);

        assertEquals(psl.qName, "NM_007294");
        assertEquals(psl.tName, "chr17");
        assertEquals(psl.getQueryStrand(), '-');
        assertEquals(psl.getTargetStrand(), '+');
        assertEquals(psl.getBlockCount(), 2);
        assertEquals(psl.getTStart(1), 41276850);
        assertEquals(psl.getEntryString(), LINE);
    }

    @Test
    public void testReverseComplement() {
        PslRecord psl = PslRecord.parse(LINE).reverseComplement();

        assertEquals(psl.strand, "+-");
        assertEquals(psl.getQStart(0), 0);
        assertEquals(psl.getQStart(1), 150);
        assertEquals(psl.getTStart(0), 39918210);
        assertEquals(psl.getTStart(1), 39936660);
        assertEquals(psl.tStart, 41258400);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTooFewColumns() {
        PslRecord.parse("300\t0\t0\t0");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBlockCountMismatch() {
        PslRecord.parse(LINE.replace("\t2\t150,150,", "\t3\t150,150,"));
    }
}
