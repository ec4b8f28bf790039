package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.printers.PrinterType;
import htsjdk.samtools.util.Log;
import org.apache.commons.cli.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        Options options = buildOptions();

        CommandLineParser parser = new BasicParser();

        Configuration config = null;

        try {
            CommandLine cmd = parser.parse(options, args);
            if (cmd.getOptions().length == 0 || cmd.hasOption("H")) {
                help(options);
            }
            config = parseCmd(cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            System.err.print("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                Object object = iterator.next();
                System.err.print(object);
                if (iterator.hasNext()) {
                    System.err.print(", ");
                }
            }
            System.err.println();
            help(options);
        }

        return config;
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if a value is not valid
     */
    private Configuration parseCmd(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();

        String[] args = cmd.getArgs();
        if (args.length == 0) {
            throw new ParseException("Documents file is not set");
        }
        config.documents = args[0];

        config.printHeader = cmd.hasOption('h');
        config.delimiter = cmd.getOptionValue("d", "\t");

        config.geneTable = cmd.getOptionValue("G");
        config.sequences = cmd.getOptionValue("S");
        config.transcriptInfo = cmd.getOptionValue("T");
        config.alignments = cmd.getOptionValue("A");
        config.dbSnp = cmd.getOptionValue("R");
        config.patternTable = cmd.getOptionValue("P");

        config.insertionRv = cmd.hasOption("I");
        config.allowTwoBpVariants = cmd.hasOption("2");
        config.shuffle = cmd.hasOption("F");
        if (cmd.hasOption("seed")) {
            config.shuffleSeed = ((Number) cmd.getParsedOptionValue("seed")).longValue();
        }

        if (cmd.hasOption("seqdbs")) {
            config.seqDbs = readSeqDbs(cmd.getOptionValue("seqdbs"));
        }
        config.snippetContext = getIntValue(cmd, "x", 50);
        if (config.snippetContext < 0) {
            throw new ParseException("Snippet context must not be negative: " + config.snippetContext);
        }
        config.threads = Math.max(readThreadsCount(cmd), 1);

        if (cmd.hasOption("V")) {
            String level = cmd.getOptionValue("V").toUpperCase();
            try {
                config.verbosity = Log.LogLevel.valueOf(level);
            } catch (IllegalArgumentException e) {
                throw new ParseException("Unknown verbosity " + level + ". Use one of " + Arrays.toString(Log.LogLevel.values()));
            }
        }

        if (cmd.hasOption("DP")) {
            config.printerType = PrinterType.fromName(cmd.getOptionValue("DP"));
        }
        return config;
    }

    private List<String> readSeqDbs(String value) throws ParseException {
        List<String> seqDbs = new ArrayList<>();
        for (String db : value.split(",")) {
            db = db.trim();
            if (!Configuration.REFSEQ_DB.equals(db) && !Configuration.OLD_REFSEQ_DB.equals(db)) {
                throw new ParseException("Unknown sequence database " + db + ". Use " + Configuration.REFSEQ_DB
                        + " or " + Configuration.OLD_REFSEQ_DB);
            }
            seqDbs.add(db);
        }
        return seqDbs;
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    private Options buildOptions() {
        Options options = new Options();
        options.addOption("H", "?", false, "Print this help page");
        options.addOption("h", "header", false, "Print a header row describing columns");
        options.addOption("I", "insertion-rv", false, "Accept insertions without original sequence on every sequence of the gene. By default they are not grounded.");
        options.addOption("2", "two-bp", false, "Allow two adjacent nucleotide changes when back-translating protein substitutions");
        options.addOption("F", "shuffle", false, "Shuffle the sequences before verification and skip the codon check. Gives a background rate of random matches.");

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("Gene table with columns entrezId, sym, refseqIds, refseqProtIds")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("genes")
                .create('G'));

        options.addOption(OptionBuilder.withArgName("fasta")
                .hasArg(true)
                .withDescription("FASTA file with the RefSeq transcript and protein sequences")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("sequences")
                .create('S'));

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("Table with columns refProt, refSeq, cdsStart (1-based) linking proteins to transcripts")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("transcripts")
                .create('T'));

        options.addOption(OptionBuilder.withArgName("psl")
                .hasArg(true)
                .withDescription("PSL alignments of the transcripts on the genome")
                .withType(String.class)
                .isRequired(true)
                .withLongOpt("alignments")
                .create('A'));

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("dbSNP table with columns chrom, start, end, rsId. Without it rs identifiers are not recognized.")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("dbsnp")
                .create('R'));

        options.addOption(OptionBuilder.withArgName("file")
                .hasArg(true)
                .withDescription("Pattern table with columns seqType, mutType, isCoding, patName, pat. Default: the bundled table")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("patterns")
                .create('P'));

        options.addOption(OptionBuilder.withArgName("delimiter")
                .hasArg(true)
                .withDescription("The delimiter for output columns. Default: tab (\"\\t\")")
                .withType(String.class)
                .isRequired(false)
                .create('d'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Characters of text on each side of a mention in snippets. Default: 50")
                .withType(Number.class)
                .isRequired(false)
                .create('x'));

        options.addOption(OptionBuilder.withArgName("dbs")
                .hasArg(true)
                .withDescription("Comma separated sequence databases to verify variants on, in order. Default: refseq,oldRefseq")
                .withType(String.class)
                .isRequired(false)
                .create("seqdbs"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Seed of the shuffle (option -F). Default: 0")
                .withType(Number.class)
                .isRequired(false)
                .create("seed"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasOptionalArg()
                .withDescription("Threads count. If omitted, number of threads is equal to number of processor cores")
                .withType(Number.class)
                .isRequired(false)
                .create("th"));

        options.addOption(OptionBuilder.withArgName("level")
                .hasArg(true)
                .withDescription("Log level: ERROR, WARNING, INFO or DEBUG. Default: INFO")
                .withType(String.class)
                .isRequired(false)
                .withLongOpt("verbosity")
                .create('V'));

        options.addOption(OptionBuilder.withArgName("printer")
                .hasArg(true)
                .withDescription("The printer type used for different outputs. Default: OUT (i.e. System.out).")
                .withType(String.class)
                .isRequired(false)
                .create("DP"));

        return options;
    }

    private int getIntValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    /**
     * Calculates possible count of threads to use. If -th set without value, it will be set to number of
     * available processors.
     * @param cmd parsed CommandLine from apache CLI
     * @return number of threads
     * @throws ParseException if option -th can't be read
     */
    private int readThreadsCount(CommandLine cmd) throws ParseException {
        int threads = 0;
        if (cmd.hasOption("th")) {
            Object value = cmd.getParsedOptionValue("th");
            if (value == null) {
                threads = Runtime.getRuntime().availableProcessors();
            } else {
                threads = ((Number) value).intValue();
            }
        }
        return threads;
    }

    private void help(Options options) {
        HelpFormatter formater = new HelpFormatter();
        formater.setOptionComparator(null);
        formater.printHelp(142, "varfinder -G genes -S sequences -T transcripts -A alignments [-R dbsnp] [-P patterns] "
                        + "[-I] [-2] [-F] [-x #_chars] documents",
                "VarFinder finds mentions of protein and DNA sequence variants in text and grounds them on genes and on the\n"
                        + "genome. Each variant is checked against the RefSeq sequences of the genes of the document, moved to coding and\n"
                        + "transcript coordinates and projected on the genome through the transcript alignments. The documents file has\n"
                        + "the columns docId, entrezIds (comma separated), text and, optionally, gene mentions (entrezId:start-end,...).\nOptions:",
                options, "");

        System.exit(0);
    }
}
