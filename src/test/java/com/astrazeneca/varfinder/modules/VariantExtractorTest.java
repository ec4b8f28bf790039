package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.TestData;
import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VariantMentions;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.testng.Assert.*;

public class VariantExtractorTest {
    private static final String BRCA1_TEXT = "The R71G BRCA1 mutation is really a p.R71G mutation (rs80357382).";

    private VariantExtractor extractor;

    @BeforeClass
    public void setUp() {
        extractor = new VariantExtractor(new PatternRegistry().compile(new PatternTableReader().readDefault()),
                new VariantMatchParser(TestData.seqData()));
    }

    @Test
    public void testSameVariantWrittenTwiceIsMerged() {
        Set<Integer> geneName = new HashSet<>(Arrays.asList(9, 10, 11, 12, 13));
        Map<SequenceType, List<VariantMentions>> found = extractor.findVariantDescriptions(BRCA1_TEXT, geneName);

        List<VariantMentions> protVars = found.get(SequenceType.PROT);
        assertEquals(protVars.size(), 1);
        VariantDescription variant = protVars.get(0).variant;
        assertEquals(variant.mutType, MutationType.SUB);
        assertEquals(variant.start, 70);
        assertEquals(variant.origSeq, "R");
        assertEquals(variant.mutSeq, "G");
        assertEquals(protVars.get(0).getMentions(), Arrays.asList(
                new Mention("short", 3, 8),
                new Mention("pShort", 35, 42)));

        List<VariantMentions> snpVars = found.get(SequenceType.DB_SNP);
        assertEquals(snpVars.size(), 1);
        assertEquals(snpVars.get(0).variant.getName(), "rs80357382");
        assertEquals(snpVars.get(0).getMentions().get(0).patName, "rsId");

        assertTrue(found.get(SequenceType.DNA).isEmpty());
        assertTrue(found.get(SequenceType.INTRON).isEmpty());
    }

    @Test
    public void testExcludedPositionsDropOverlappingMatches() {
        Map<SequenceType, List<VariantMentions>> found = extractor.findVariantDescriptions(BRCA1_TEXT,
                Collections.singleton(5));

        List<VariantMentions> protVars = found.get(SequenceType.PROT);
        assertEquals(protVars.size(), 1);
        assertEquals(protVars.get(0).getMentions(), Collections.singletonList(new Mention("pShort", 35, 42)));
    }

    @Test
    public void testEveryCategoryIsPresent() {
        Map<SequenceType, List<VariantMentions>> found = extractor.findVariantDescriptions("No variants here.");

        assertEquals(found.keySet(), new HashSet<>(Arrays.asList(SequenceType.textCategories())));
        for (List<VariantMentions> variants : found.values()) {
            assertTrue(variants.isEmpty());
        }
    }

    @Test
    public void testCellLineIsNotAVariant() {
        Map<SequenceType, List<VariantMentions>> found =
                extractor.findVariantDescriptions("The T47D cell line carries rs1799966.");

        assertTrue(found.get(SequenceType.PROT).isEmpty());
        assertEquals(found.get(SequenceType.DB_SNP).size(), 1);
        assertEquals(found.get(SequenceType.DB_SNP).get(0).variant.start, 41276900);
    }

    @Test
    public void testFrameshiftsAreNotExtracted() {
        Map<SequenceType, List<VariantMentions>> found =
                extractor.findVariantDescriptions("Both p.R71Gfs*3 and Arg71Glyfs were seen, as was R71Gfs.");

        assertTrue(found.get(SequenceType.PROT).isEmpty());
    }

    @Test
    public void testVariantsOfDifferentCategories() {
        Map<SequenceType, List<VariantMentions>> found = extractor.findVariantDescriptions(
                "Carriers of c.211A>G, c.100+2T>G and p.K70del were found.");

        assertEquals(found.get(SequenceType.DNA).size(), 1);
        assertEquals(found.get(SequenceType.DNA).get(0).variant.getName(), "c.211A>G");
        assertEquals(found.get(SequenceType.INTRON).size(), 1);
        assertEquals(found.get(SequenceType.INTRON).get(0).variant.offset, 2);
        assertEquals(found.get(SequenceType.PROT).size(), 1);
        assertEquals(found.get(SequenceType.PROT).get(0).variant.mutType, MutationType.DEL);
    }

    @Test
    public void testHgvsNameIsFoundAgain() {
        VariantDescription located = new VariantDescription(MutationType.SUB, SequenceType.PROT, "NP_009225.1",
                70, 71, "R", "G", 0, "R71G");

        List<VariantMentions> protVars = extractor.findVariantDescriptions(located.makeHgvsStr()).get(SequenceType.PROT);

        assertEquals(protVars.size(), 1);
        VariantDescription found = protVars.get(0).variant;
        assertEquals(found.start, located.start);
        assertEquals(found.origSeq, located.origSeq);
        assertEquals(found.mutSeq, located.mutSeq);
        assertEquals(protVars.get(0).getMentions().get(0).patName, "pLong");
    }

    @Test
    public void testIntronOffsetIsNotReadAsCodingSubstitution() {
        Map<SequenceType, List<VariantMentions>> found =
                extractor.findVariantDescriptions("The splice variant c.1184-3A>T was found.");

        assertTrue(found.get(SequenceType.DNA).isEmpty());
        assertEquals(found.get(SequenceType.INTRON).size(), 1);
        VariantDescription intronVar = found.get(SequenceType.INTRON).get(0).variant;
        assertEquals(intronVar.offset, -3);
        assertEquals(intronVar.getName(), "c.1184-3A>T");
    }
}
