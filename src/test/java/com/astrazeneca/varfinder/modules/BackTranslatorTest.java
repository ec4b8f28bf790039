package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.NucleotideChange;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class BackTranslatorTest {

    @Test
    public void testBackTransEnumeratesAllCodonCombinations() {
        Assert.assertEquals(BackTranslator.backTrans("FVC").size(), 16);
        Assert.assertEquals(BackTranslator.backTrans("CD"), Arrays.asList("TGTGAT", "TGCGAT", "TGTGAC", "TGCGAC"));
    }

    @Test
    public void testBackTransOfUnknownResidueIsEmpty() {
        Assert.assertTrue(BackTranslator.backTrans("RB").isEmpty());
        Assert.assertTrue(BackTranslator.backTrans("").isEmpty());
    }

    @Test
    public void testSynonymousChangesOfThirdBase() {
        List<NucleotideChange> changes = new BackTranslator(false).possibleDnaChanges("V", "V", "GTA");

        Assert.assertEquals(changes, Arrays.asList(
                new NucleotideChange(2, "A", "T"),
                new NucleotideChange(2, "A", "C"),
                new NucleotideChange(2, "A", "G")));
    }

    @Test
    public void testSingleBaseChange() {
        List<NucleotideChange> changes = new BackTranslator(false).possibleDnaChanges("V", "I", "gta");

        Assert.assertEquals(changes, Collections.singletonList(new NucleotideChange(0, "G", "A")));
    }

    @Test
    public void testArginineToGlycine() {
        List<NucleotideChange> changes = new BackTranslator(false).possibleDnaChanges("R", "G", "AGA");

        Assert.assertEquals(changes, Collections.singletonList(new NucleotideChange(0, "A", "G")));
    }

    @Test
    public void testTwoAdjacentBasesOnlyWhenAllowed() {
        Assert.assertTrue(new BackTranslator(false).possibleDnaChanges("K", "S", "AAA").isEmpty());

        List<NucleotideChange> changes = new BackTranslator(true).possibleDnaChanges("K", "S", "AAA");
        Assert.assertEquals(changes, Arrays.asList(
                new NucleotideChange(0, "AA", "TC"),
                new NucleotideChange(1, "AA", "GT"),
                new NucleotideChange(1, "AA", "GC")));
    }

    @Test
    public void testFirstDiffNucl() {
        Assert.assertEquals(BackTranslator.firstDiffNucl("AGA", "GGA", 1), new NucleotideChange(0, "A", "G"));
        Assert.assertEquals(BackTranslator.firstDiffNucl("AAA", "AGT", 2), new NucleotideChange(1, "AA", "GT"));
        Assert.assertNull(BackTranslator.firstDiffNucl("AAA", "AAA", 1));
        Assert.assertNull(BackTranslator.firstDiffNucl("AAA", "GAG", 2));
        Assert.assertNull(BackTranslator.firstDiffNucl("AAA", "AGT", 1));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFirstDiffNuclNeedsSameLength() {
        BackTranslator.firstDiffNucl("AAA", "AA", 1);
    }

    @Test
    public void testTranslate() {
        Assert.assertEquals(BackTranslator.translate("ATGAGATAA"), "MR*");
        Assert.assertEquals(BackTranslator.translate("atgNNNgg"), "MX");
    }
}
