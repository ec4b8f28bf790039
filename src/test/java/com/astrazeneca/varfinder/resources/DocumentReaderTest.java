package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.TestData;
import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.exception.ReferenceDataException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

public class DocumentReaderTest {

    @Test
    public void testReadDocumentsFile() {
        List<DocumentContext> documents = new DocumentReader().read(TestData.path("/documents.tsv"));

        Assert.assertEquals(documents.size(), 3);
        DocumentContext doc1 = documents.get(0);
        Assert.assertEquals(doc1.docId, "doc1");
        Assert.assertEquals(doc1.entrezGenes, Collections.singletonList("672"));
        Assert.assertEquals(doc1.geneMentions.get("672"), Collections.singletonList(new Mention("gene", 9, 14)));
        Assert.assertEquals(doc1.excludedPositions, new HashSet<>(Arrays.asList(9, 10, 11, 12, 13)));
        Assert.assertEquals(documents.get(1).entrezGenes, Arrays.asList("7157", "672"));
        Assert.assertTrue(documents.get(1).geneMentions.isEmpty());
        Assert.assertTrue(documents.get(2).entrezGenes.isEmpty());
    }

    @Test
    public void testSeveralMentionsOfOneGene() {
        DocumentContext doc = DocumentReader.parseLine("d\t672\tBRCA1 and BRCA1\t672:0-5, 672:10-15", 1, "test");

        Assert.assertEquals(doc.geneMentions.get("672"),
                Arrays.asList(new Mention("gene", 0, 5), new Mention("gene", 10, 15)));
        Assert.assertEquals(doc.excludedPositions.size(), 10);
    }

    @Test
    public void testCommentsAndEmptyLinesAreSkipped() throws IOException {
        String file = "#docId\tentrezIds\ttext\n\n# comment\nd1\t\tsome text\n";
        List<DocumentContext> documents = new DocumentReader().read(new BufferedReader(new StringReader(file)), "test");

        Assert.assertEquals(documents.size(), 1);
        Assert.assertEquals(documents.get(0).text, "some text");
    }

    @Test(expectedExceptions = ReferenceDataException.class)
    public void testTooFewColumns() {
        DocumentReader.parseLine("d1\t672", 1, "test");
    }

    @Test(expectedExceptions = ReferenceDataException.class)
    public void testWrongGeneMention() {
        DocumentReader.parseLine("d1\t672\tBRCA1 text\tBRCA1@0", 1, "test");
    }

    @Test(expectedExceptions = ReferenceDataException.class)
    public void testGeneMentionOutsideOfText() {
        DocumentReader.parseLine("d1\t672\tBRCA1\t672:0-50", 1, "test");
    }
}
