package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.testng.Assert.*;

public class VarFinderLauncherTest {
    private final PrintStream systemOut = System.out;
    private ByteArrayOutputStream outContent;

    @BeforeMethod
    public void setUpStreams() {
        outContent = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outContent));
    }

    @AfterMethod
    public void restoreStreams() {
        System.setOut(systemOut);
    }

    @Test
    public void testInitResources() {
        ReadOnlyScope scope = new VarFinderLauncher().initResources(TestData.configuration());

        assertEquals(scope.patterns.size(), 22);
        assertNotNull(scope.seqData.rsIdToGenome("rs80357382"));
        assertEquals(scope.seqData.mapSymToEntrez("BRCA1").get(0), TestData.BRCA1_ENTREZ);
    }

    @Test
    public void testInitResourcesWithoutDbSnp() {
        Configuration conf = TestData.configuration();
        conf.dbSnp = null;

        ReadOnlyScope scope = new VarFinderLauncher().initResources(conf);

        assertNull(scope.seqData.rsIdToGenome("rs80357382"));
    }

    @Test
    public void testStartPrintsAllDocuments() {
        Configuration conf = TestData.configuration();
        conf.printHeader = true;

        new VarFinderLauncher().start(conf);

        String[] lines = outContent.toString().split(System.lineSeparator());
        assertEquals(lines.length, 4);
        assertTrue(lines[1].contains("doc1_0"));
    }
}
