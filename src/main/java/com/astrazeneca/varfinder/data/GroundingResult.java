package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of grounding one text variant. Either grounded is non empty or ungrounded is set.
 */
public class GroundingResult {
    public final List<SeqVariantData> grounded;
    public final SeqVariantData ungrounded;
    public final List<BedRecord> beds;
    /**
     * dbSNP identifiers mentioned in the text that matched the genome position of the variant
     */
    public final Set<String> mappedRsIds;

    public GroundingResult(List<SeqVariantData> grounded, SeqVariantData ungrounded, List<BedRecord> beds,
                           Set<String> mappedRsIds) {
        this.grounded = Collections.unmodifiableList(new ArrayList<>(grounded));
        this.ungrounded = ungrounded;
        this.beds = Collections.unmodifiableList(new ArrayList<>(beds));
        this.mappedRsIds = Collections.unmodifiableSet(new LinkedHashSet<>(mappedRsIds));
    }

    public boolean isGrounded() {
        return !grounded.isEmpty();
    }
}
