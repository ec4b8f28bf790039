package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.TestData;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VariantPattern;
import com.astrazeneca.varfinder.resources.SeqData;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;

import static org.testng.Assert.*;

public class VariantMatchParserTest {
    private final Map<String, VariantPattern> patternsByName = new HashMap<>();
    private VariantMatchParser parser;

    @BeforeClass
    public void setUp() {
        for (VariantPattern pattern : new PatternRegistry().compile(new PatternTableReader().readDefault())) {
            patternsByName.put(pattern.patName, pattern);
        }
        SeqData seqData = TestData.seqData();
        parser = new VariantMatchParser(seqData);
    }

    private VariantDescription parse(VariantMatchParser parser, String patName, String text) {
        VariantPattern pattern = patternsByName.get(patName);
        assertNotNull(pattern, "No pattern " + patName);
        Matcher match = pattern.pattern.matcher(text);
        assertTrue(match.find(), patName + " doesn't match " + text);
        return parser.parse(pattern, match);
    }

    private VariantDescription parse(String patName, String text) {
        return parse(parser, patName, text);
    }

    @DataProvider(name = "substitutions")
    public Object[][] substitutions() {
        return new Object[][] {
                {"short", "The R71G mutation", "R", "G", "R71G"},
                {"pShort", "a p.R71G mutation", "R", "G", "p.R71G"},
                {"pShort", "a p.(R71G) mutation", "R", "G", "p.(R71G"},
                {"long", "an Arg71Gly mutation", "R", "G", "Arg71Gly"},
                {"long", "an ARG71GLY mutation", "R", "G", "ARG71GLY"},
                {"pLong", "a p.Arg71Ter mutation", "R", "*", "p.Arg71Ter"},
                {"shortArrow", "a R71 -> G mutation", "R", "G", "R71 -> G"},
                {"longArrow", "an Arg71→Gly mutation", "R", "G", "Arg71→Gly"},
        };
    }

    @Test(dataProvider = "substitutions")
    public void testProteinSubstitution(String patName, String text, String origSeq, String mutSeq, String origStr) {
        VariantDescription variant = parse(patName, text);

        assertNotNull(variant);
        assertEquals(variant.mutType, MutationType.SUB);
        assertEquals(variant.seqType, SequenceType.PROT);
        assertNull(variant.seqId);
        assertEquals(variant.start, 70);
        assertEquals(variant.end, 71);
        assertEquals(variant.origSeq, origSeq);
        assertEquals(variant.mutSeq, mutSeq);
        assertEquals(variant.offset, 0);
        assertEquals(variant.origStr, origStr);
    }

    @Test
    public void testFrameshiftIsDiscarded() {
        assertNull(parse("pShort", "a p.R71Gfs*5 change"));
        assertNull(parse("pLong", "a p.Arg71GlyfsTer5 change"));
    }

    @Test
    public void testBlacklistedNameIsDiscarded() {
        assertNull(parse("short", "The T47D cell line"));
        assertNull(parse("short", "The H2A histone"));
    }

    @Test
    public void testTooLargePositionIsDiscarded() {
        assertNull(parse("short", "The R99999999999G mutation"));
    }

    @Test
    public void testProteinDeletion() {
        VariantDescription variant = parse("pShortDel", "a p.K70del change");

        assertEquals(variant.mutType, MutationType.DEL);
        assertEquals(variant.start, 69);
        assertEquals(variant.end, 70);
        assertEquals(variant.origSeq, "K");
        assertNull(variant.mutSeq);
        assertEquals(variant.getName(), "p.K70del");
    }

    @Test
    public void testProteinInsertion() {
        VariantDescription variant = parse("pLongIns", "a p.Lys70_Arg71insGlyGly change");

        assertEquals(variant.mutType, MutationType.INS);
        assertEquals(variant.start, 69);
        assertEquals(variant.end, 70);
        assertNull(variant.origSeq);
        assertEquals(variant.mutSeq, "GG");
    }

    @Test
    public void testDnaSubstitution() {
        VariantDescription variant = parse("cSub", "Carriers of c.211A>G were found.");

        assertEquals(variant.seqType, SequenceType.DNA);
        assertEquals(variant.start, 210);
        assertEquals(variant.end, 211);
        assertEquals(variant.origSeq, "A");
        assertEquals(variant.mutSeq, "G");
        assertEquals(variant.getName(), "c.211A>G");
    }

    @Test
    public void testDnaSubstitutionWithLowerCaseBases() {
        VariantDescription variant = parse("plainSub", "found 211a>g in");

        assertEquals(variant.origSeq, "A");
        assertEquals(variant.mutSeq, "G");
    }

    @Test
    public void testDnaRangeDeletionIncludesLastPosition() {
        VariantDescription variant = parse("cRangeDel", "the c.100_102delAGT allele");

        assertEquals(variant.mutType, MutationType.DEL);
        assertEquals(variant.start, 99);
        assertEquals(variant.end, 102);
        assertEquals(variant.origSeq, "AGT");
        assertEquals(variant.getName(), "c.100_102delAGT");
    }

    @Test
    public void testDnaInsertionBetweenPositions() {
        VariantDescription variant = parse("cIns", "the c.100_101insTT allele");

        assertEquals(variant.mutType, MutationType.INS);
        assertEquals(variant.start, 99);
        assertEquals(variant.end, 100);
        assertEquals(variant.mutSeq, "TT");
        assertEquals(variant.getName(), "c.100_101insTT");
    }

    @Test
    public void testDnaDuplication() {
        VariantDescription variant = parse("cDup", "the c.100dupA allele");

        assertEquals(variant.mutType, MutationType.DUP);
        assertEquals(variant.start, 99);
        assertEquals(variant.end, 100);
        assertEquals(variant.origSeq, "A");
        assertEquals(variant.mutSeq, "AA");
    }

    @Test
    public void testDuplicationRangeOneShortIsExtended() {
        VariantDescription variant = parse("cRangeDup", "the c.100_102dupAGT allele");

        assertEquals(variant.start, 99);
        assertEquals(variant.end, 102);
        assertEquals(variant.mutSeq, "AGTAGT");
    }

    @Test
    public void testSplicingVariantKeepsSignedOffset() {
        VariantDescription donor = parse("cSplice", "the c.100+2T>G allele");
        VariantDescription acceptor = parse("cSplice", "the c.100-2A>G allele");

        assertEquals(donor.mutType, MutationType.SPLICING);
        assertEquals(donor.seqType, SequenceType.INTRON);
        assertEquals(donor.start, 99);
        assertEquals(donor.offset, 2);
        assertEquals(donor.getName(), "c.100+2T>G");
        assertEquals(acceptor.offset, -2);
        assertEquals(acceptor.getName(), "c.100-2A>G");
    }

    @Test
    public void testIntronSubstitution() {
        VariantDescription variant = parse("cIntronArrow", "the c.100+5G→A allele");

        assertEquals(variant.mutType, MutationType.SUB);
        assertEquals(variant.seqType, SequenceType.INTRON);
        assertEquals(variant.offset, 5);
    }

    @Test
    public void testKnownRsIdIsLocated() {
        VariantDescription variant = parse("rsId", "mutation (rs80357382).");

        assertEquals(variant.mutType, MutationType.DB_SNP);
        assertEquals(variant.seqType, SequenceType.DB_SNP);
        assertEquals(variant.seqId, "chr17");
        assertEquals(variant.start, 41258469);
        assertEquals(variant.end, 41258470);
        assertEquals(variant.getName(), "rs80357382");
        assertEquals(variant.origStr, "rs80357382");
    }

    @Test
    public void testUnknownRsIdIsDiscarded() {
        assertNull(parse("rsId", "see rs123456789 for"));
        assertNull(parse(new VariantMatchParser(null), "rsId", "see rs80357382 for"));
    }
}
