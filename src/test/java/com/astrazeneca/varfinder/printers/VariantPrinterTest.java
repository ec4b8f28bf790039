package com.astrazeneca.varfinder.printers;

import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.SeqVariantData;
import com.astrazeneca.varfinder.data.SequenceType;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public class VariantPrinterTest {
    private static final String TEXT = "The T47D cell line carries rs1799966.";

    private VariantPrinter printer;
    private ByteArrayOutputStream outContent;

    @BeforeMethod
    public void setUpStreams() {
        outContent = new ByteArrayOutputStream();
        printer = new VariantPrinter(new PrintStream(outContent));
    }

    @AfterMethod
    public void cleanUpStreams() throws IOException {
        outContent.close();
    }

    private static SeqVariantData snpRecord() {
        return SeqVariantData.ungrounded(SequenceType.DB_SNP, MutationType.DB_SNP,
                Collections.singletonList(new Mention("rsId", 26, 36)), TEXT, 10);
    }

    @Test
    public void testColumnsOfUngroundedRecord() {
        printer.print(snpRecord());

        String line = outContent.toString().replace(System.lineSeparator(), "");
        String[] columns = line.split("\t", -1);
        assertEquals(columns.length, 29);
        assertEquals(columns[SeqVariantData.COLUMNS.indexOf("patType")], "dbSnp");
        assertEquals(columns[SeqVariantData.COLUMNS.indexOf("texts")], "rs1799966");
        assertEquals(columns[SeqVariantData.COLUMNS.indexOf("mutStarts")], "26");
        assertEquals(columns[SeqVariantData.COLUMNS.indexOf("mutSnippets")], "ne carries<<< rs1799966>>>.");
        assertEquals(columns[0], "");
    }

    @Test
    public void testHeader() {
        printer.printHeader();

        String[] columns = outContent.toString().trim().split("\t");
        assertEquals(columns.length, 29);
        assertEquals(columns[0], "chrom");
        assertEquals(columns[28], "dbSnpSnippets");
    }

    @Test
    public void testDelimiter() {
        printer.setDelimiter(",");
        printer.print(Arrays.asList(snpRecord(), snpRecord()));

        String[] lines = outContent.toString().split(System.lineSeparator());
        assertEquals(lines.length, 2);
        assertEquals(lines[0].split(",", -1).length, 29);
    }

    @Test
    public void testPrintCollectedOutput() {
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        VariantPrinter worker = new VariantPrinter(System.out);
        worker.setOut(new PrintStream(collected));
        worker.print(snpRecord());

        printer.print(collected);

        assertTrue(outContent.toString().contains("rs1799966"));
    }

    @Test
    public void testCreatePrinter() {
        assertEquals(VariantPrinter.createPrinter(PrinterType.OUT).getOut(), System.out);
        assertEquals(VariantPrinter.createPrinter(PrinterType.ERR).getOut(), System.err);
        assertEquals(PrinterType.fromName("err"), PrinterType.ERR);
        assertEquals(PrinterType.fromName("file"), PrinterType.OUT);
    }
}
