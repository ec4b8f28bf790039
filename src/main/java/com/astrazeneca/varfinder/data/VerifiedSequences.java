package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sequences of a gene on which a variant was verified and the sequence database they come from.
 */
public class VerifiedSequences {
    public final String seqDb;
    public final List<String> seqIds;

    public VerifiedSequences(String seqDb, List<String> seqIds) {
        this.seqDb = seqDb;
        this.seqIds = Collections.unmodifiableList(new ArrayList<>(seqIds));
    }

    @Override
    public String toString() {
        return seqDb + ":" + seqIds;
    }
}
