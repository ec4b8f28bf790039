package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.printers.PrinterType;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

public class Configuration {
    public static final String REFSEQ_DB = "refseq";
    public static final String OLD_REFSEQ_DB = "oldRefseq";

    /**
     * Print a header row describing columns
     */
    public boolean printHeader; //-h
    /**
     * The delimiter for output columns
     */
    public String delimiter = "\t"; // -d
    /**
     * Path to tab separated documents file: document id, Entrez gene ids, text
     */
    public String documents;
    /**
     * Gene table: Entrez id, symbol, RefSeq transcripts and proteins
     */
    public String geneTable; // -G
    /**
     * FASTA with RefSeq protein and transcript sequences
     */
    public String sequences; // -S
    /**
     * Table of protein accession, transcript accession and 1-based CDS start
     */
    public String transcriptInfo; // -T
    /**
     * PSL alignments of transcripts on the genome
     */
    public String alignments; // -A
    /**
     * dbSNP table: chromosome, start, end, rs identifier
     */
    public String dbSnp; // -R
    /**
     * Custom pattern table. The bundled variant_patterns.tsv is used if not set.
     */
    public String patternTable; // -P
    /**
     * Insertions without original sequence can't be verified. If set they are accepted on every sequence
     * of the gene, otherwise they are dropped.
     */
    public boolean insertionRv = false; // -I
    /**
     * Allow two adjacent nucleotide changes when back-translating protein substitutions
     */
    public boolean allowTwoBpVariants = false; // -2
    /**
     * Shuffle the sequences before verification and skip codon checks. Gives a background estimate
     * of random matches.
     */
    public boolean shuffle = false; // -F
    /**
     * Seed of the shuffle
     */
    public long shuffleSeed = 0; // --seed
    /**
     * Sequence databases to verify variants against, in order
     */
    public List<String> seqDbs = new ArrayList<>(Arrays.asList(REFSEQ_DB, OLD_REFSEQ_DB)); // --seqdbs
    /**
     * The number of characters on each side of a mention in snippets
     */
    public int snippetContext = 50; // -x
    /**
     * Number of documents processed in parallel
     */
    public int threads = 1; // -th
    /**
     * Level of the log messages
     */
    public Log.LogLevel verbosity = Log.LogLevel.INFO; // -V

    /**
     * Default printer for variants - system.out
     */
    public PrinterType printerType = PrinterType.OUT;

    /**
     * Exception counter
     * */
    public AtomicInteger exceptionCounter = new AtomicInteger(0);

    /**
     * Maximum of exception to continue work
     */
    public static int MAX_EXCEPTION_COUNT = 10;

    public boolean hasPatternTable() {
        return patternTable != null;
    }

    public boolean hasDbSnp() {
        return dbSnp != null;
    }
}
