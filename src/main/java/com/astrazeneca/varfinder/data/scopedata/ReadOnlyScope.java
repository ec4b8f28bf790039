package com.astrazeneca.varfinder.data.scopedata;

import com.astrazeneca.varfinder.Configuration;
import com.astrazeneca.varfinder.data.VariantPattern;
import com.astrazeneca.varfinder.printers.PrinterType;
import com.astrazeneca.varfinder.resources.SeqData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only scope of the VarFinder: configuration, compiled patterns and reference data. Built once by the
 * launcher (or a test) and handed to every object of the pipeline, so several scopes can live side by side.
 */
public class ReadOnlyScope {
    public final Configuration conf;
    public final List<VariantPattern> patterns;
    public final SeqData seqData;
    public final PrinterType printerTypeOut;

    public ReadOnlyScope(Configuration conf, List<VariantPattern> patterns, SeqData seqData) {
        this.conf = conf;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
        this.seqData = seqData;
        this.printerTypeOut = conf.printerType;
    }
}
