package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.PatternTableRow;
import com.astrazeneca.varfinder.data.VariantPattern;
import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import com.astrazeneca.varfinder.modes.AbstractMode;
import com.astrazeneca.varfinder.modes.DocumentMode;
import com.astrazeneca.varfinder.modules.PatternRegistry;
import com.astrazeneca.varfinder.modules.PatternTableReader;
import com.astrazeneca.varfinder.resources.DbSnpStore;
import com.astrazeneca.varfinder.resources.DocumentReader;
import com.astrazeneca.varfinder.resources.FastaSequenceStore;
import com.astrazeneca.varfinder.resources.PslAlignmentStore;
import com.astrazeneca.varfinder.resources.SeqData;
import com.astrazeneca.varfinder.resources.TabularDbSnpStore;
import com.astrazeneca.varfinder.resources.TabularGeneTable;
import htsjdk.samtools.util.Log;

import java.util.List;

/**
 * Class starts the VarFinder for current run
 */
public class VarFinderLauncher {
    private static final Log log = Log.getInstance(VarFinderLauncher.class);

    /**
     * Loads the reference data and the patterns, reads the documents and runs them through the pipeline.
     * @param config starting configuration
     */
    public void start(Configuration config) {
        Log.setGlobalLogLevel(config.verbosity);
        ReadOnlyScope scope = initResources(config);
        List<DocumentContext> documents = new DocumentReader().read(config.documents);

        AbstractMode mode = new DocumentMode(documents, scope);
        if (config.threads == 1) {
            mode.notParallel();
        } else {
            mode.parallel();
        }
    }

    /**
     * Builds the scope: compiled patterns and the stores of genes, sequences, alignments and dbSNP.
     * @param conf VarFinder Configuration (parameters from command line)
     * @return scope shared by all documents
     */
    ReadOnlyScope initResources(Configuration conf) {
        PatternTableReader tableReader = new PatternTableReader();
        List<PatternTableRow> rows = conf.hasPatternTable() ? tableReader.read(conf.patternTable) : tableReader.readDefault();
        List<VariantPattern> patterns = new PatternRegistry().compile(rows);

        DbSnpStore dbSnpStore;
        if (conf.hasDbSnp()) {
            dbSnpStore = TabularDbSnpStore.load(conf.dbSnp);
        } else {
            log.warn("No dbSNP table set, rs identifiers will not be grounded");
            dbSnpStore = new TabularDbSnpStore();
        }
        SeqData seqData = new SeqData(
                TabularGeneTable.load(conf.geneTable),
                FastaSequenceStore.load(conf.sequences, conf.transcriptInfo),
                PslAlignmentStore.load(conf.alignments),
                dbSnpStore);
        return new ReadOnlyScope(conf, patterns, seqData);
    }
}
