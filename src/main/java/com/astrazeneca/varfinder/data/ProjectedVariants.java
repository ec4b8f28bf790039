package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A text variant rewritten on protein, coding and transcript sequences, and projected on the genome.
 */
public class ProjectedVariants {
    public final List<VariantDescription> protVars;
    public final List<VariantDescription> codVars;
    public final List<VariantDescription> rnaVars;
    public final List<BedRecord> beds;

    public ProjectedVariants(List<VariantDescription> protVars, List<VariantDescription> codVars,
                             List<VariantDescription> rnaVars, List<BedRecord> beds) {
        this.protVars = Collections.unmodifiableList(new ArrayList<>(protVars));
        this.codVars = Collections.unmodifiableList(new ArrayList<>(codVars));
        this.rnaVars = Collections.unmodifiableList(new ArrayList<>(rnaVars));
        this.beds = Collections.unmodifiableList(new ArrayList<>(beds));
    }

    public ProjectedVariants(List<VariantDescription> protVars, List<VariantDescription> codVars,
                             List<VariantDescription> rnaVars) {
        this(protVars, codVars, rnaVars, Collections.<BedRecord>emptyList());
    }

    public ProjectedVariants withBeds(List<BedRecord> newBeds) {
        return new ProjectedVariants(protVars, codVars, rnaVars, newBeds);
    }
}
