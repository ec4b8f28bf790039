package com.astrazeneca.varfinder.printers;

import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.data.SeqVariantData;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Prints variant records as delimited rows, one record per line.
 */
public class VariantPrinter {
    private PrintStream out;
    private String delimiter = "\t";

    public VariantPrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints one record, columns in the order of {@link SeqVariantData#COLUMNS}.
     * @param variant output record
     */
    public void print(SeqVariantData variant) {
        out.println(Utils.join(delimiter, variant.asRow()));
    }

    public void print(List<SeqVariantData> variants) {
        for (SeqVariantData variant : variants) {
            print(variant);
        }
    }

    /**
     * Prints output stream to the set output. Used to print the records of a document after they were
     * prepared by a worker in parallel mode.
     * @param outputStream output stream with printed records
     */
    public void print(OutputStream outputStream) {
        out.print(outputStream);
    }

    /**
     * Prints the names of the output columns.
     */
    public void printHeader() {
        out.println(Utils.join(delimiter, SeqVariantData.COLUMNS));
    }

    /**
     * Set out stream to the parameter. Used in parallel mode to collect the records of one document.
     * @param printStream print stream where to save records
     */
    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * @param type printer type of the scope
     * @return printer writing to the stream of the type
     */
    public static VariantPrinter createPrinter(PrinterType type) {
        return new VariantPrinter(type.stream());
    }
}
