package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.PatternTableRow;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantPattern;
import com.astrazeneca.varfinder.exception.PatternTableException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static org.testng.Assert.*;

public class PatternRegistryTest {
    private final PatternRegistry registry = new PatternRegistry();

    @Test
    public void testDefaultTableCompilesEveryRow() {
        List<PatternTableRow> rows = new PatternTableReader().readDefault();
        List<VariantPattern> patterns = registry.compile(rows);

        assertEquals(patterns.size(), rows.size());
        Set<SequenceType> seqTypes = new HashSet<>();
        for (VariantPattern pattern : patterns) {
            seqTypes.add(pattern.seqType);
        }
        assertEquals(seqTypes, new HashSet<>(Arrays.asList(SequenceType.textCategories())));
    }

    @Test
    public void testShortPatternCapturesPlaceholders() {
        VariantPattern pattern = registry.compileRow(
                new PatternTableRow("prot", "sub", "True", "short", "{sep}{origAaShort}{pos}{mutAaShort}"));

        assertNotNull(pattern);
        assertEquals(pattern.seqType, SequenceType.PROT);
        assertEquals(pattern.mutType, MutationType.SUB);
        assertTrue(pattern.isCoding);
        assertEquals(pattern.getFields(), new LinkedHashSet<>(Arrays.asList("sep", "origAaShort", "pos", "mutAaShort")));
        assertTrue(pattern.pattern.matcher("The R71G BRCA1").find());
        assertFalse(pattern.pattern.matcher("The r71g BRCA1").find());
    }

    @Test
    public void testLongPatternIgnoresCase() {
        VariantPattern pattern = registry.compileRow(
                new PatternTableRow("prot", "sub", "True", "long", "{sep}{origAaLong}{pos}{mutAaLong}"));

        assertNotNull(pattern);
        assertTrue((pattern.pattern.flags() & Pattern.CASE_INSENSITIVE) != 0);
        assertTrue(pattern.pattern.matcher(" ARG71GLY").find());
        assertTrue(pattern.pattern.matcher(" arg71gly").find());
    }

    @Test
    public void testEmptyNameFallsBackToTemplate() {
        VariantPattern pattern = registry.compileRow(
                new PatternTableRow("dna", "sub", "True", "", "{sep}{pos}{origDna}>{mutDna}"));

        assertEquals(pattern.patName, "{sep}{pos}{origDna}>{mutDna}");
    }

    @DataProvider(name = "unusableRows")
    public Object[][] unusableRows() {
        return new Object[][] {
                {new PatternTableRow("prot", "sub", "yes", "badCoding", "{sep}{origAaShort}{pos}{mutAaShort}")},
                {new PatternTableRow("rna", "sub", "True", "badSeqType", "{sep}{origDna}{pos}{mutDna}")},
                {new PatternTableRow("prot", "frameshift", "True", "badMutType", "{sep}{origAaShort}{pos}fs")},
                {new PatternTableRow("prot", "sub", "True", "badPlaceholder", "{sep}{origAaShort}{position}{mutAaShort}")},
                {new PatternTableRow("prot", "sub", "True", "noPosition", "{sep}{origAaShort}>{mutAaShort}")},
                {new PatternTableRow("intron", "splicing", "False", "noPos", "{sep}IVS{intron}{plusMinus}{offset}{origDna}>{mutDna}")},
                {new PatternTableRow("intron", "sub", "False", "noOffset", "{sep}c\\.{pos}{origDna}>{mutDna}")},
                {new PatternTableRow("dbSnp", "dbSnp", "True", "noRsId", "{sep}rs[0-9]+")},
                {new PatternTableRow("prot", "sub", "True", "brokenRegex", "{sep}({origAaShort}{pos}{mutAaShort}")},
        };
    }

    @Test(dataProvider = "unusableRows")
    public void testUnusableRowIsSkipped(PatternTableRow row) {
        assertNull(registry.compileRow(row));
        assertTrue(registry.compile(Arrays.asList(row)).isEmpty());
    }

    @Test
    public void testQuantifierIsNotAPlaceholder() {
        Set<String> fields = new LinkedHashSet<>();
        String expanded = PatternRegistry.expand("{sep}rs[0-9]{2}{rsId}", fields);

        assertNotNull(expanded);
        assertTrue(expanded.contains("[0-9]{2}"));
        assertEquals(fields, new LinkedHashSet<>(Arrays.asList("sep", "rsId")));
    }

    @Test
    public void testSchemaOfInsertion() {
        assertNull(PatternRegistry.checkSchema(MutationType.INS, true,
                new HashSet<>(Arrays.asList("fromPos", "toPos", "mutAasShort"))));
        assertNotNull(PatternRegistry.checkSchema(MutationType.INS, true,
                new HashSet<>(Arrays.asList("fromPos", "mutAasShort"))));
    }

    @Test
    public void testTableReaderSkipsComments() throws IOException {
        String table = "#seqType\tmutType\tisCoding\tpatName\tpat\n"
                + "# comment\n"
                + "\n"
                + "prot\tsub\tTrue\tshort\t{sep}{origAaShort}{pos}{mutAaShort}\n";
        List<PatternTableRow> rows = new PatternTableReader().read(new BufferedReader(new StringReader(table)), "test");

        assertEquals(rows.size(), 1);
        assertEquals(rows.get(0).patName, "short");
        assertEquals(rows.get(0).pat, "{sep}{origAaShort}{pos}{mutAaShort}");
    }

    @Test(expectedExceptions = PatternTableException.class)
    public void testTableReaderRejectsMissingColumns() throws IOException {
        String table = "seqType\tmutType\tpat\nprot\tsub\t{sep}{origAaShort}{pos}{mutAaShort}\n";
        new PatternTableReader().read(new BufferedReader(new StringReader(table)), "test");
    }

    @Test
    public void testTableFileIsReadAsUtf8() throws IOException {
        String table = "#seqType\tmutType\tisCoding\tpatName\tpat\n"
                + "intron\tsub\tFalse\tcIntronArrow\t{sep}c\\.{pos}{plusMinus}{offset}{origDna}\u2192{mutDna}\n";
        Path path = Files.createTempFile("patterns", ".tsv");
        path.toFile().deleteOnExit();
        Files.write(path, table.getBytes(StandardCharsets.UTF_8));

        List<PatternTableRow> rows = new PatternTableReader().read(path.toString());

        assertEquals(rows.size(), 1);
        assertEquals(rows.get(0).pat, "{sep}c\\.{pos}{plusMinus}{offset}{origDna}\u2192{mutDna}");
        VariantPattern pattern = registry.compileRow(rows.get(0));
        assertNotNull(pattern);
        assertTrue(pattern.pattern.matcher("Carriers of c.100+2T\u2192G").find());
    }
}
