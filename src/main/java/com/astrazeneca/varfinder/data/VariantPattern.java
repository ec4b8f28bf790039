package com.astrazeneca.varfinder.data;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled row of the pattern table. The fields are the placeholder names the template uses, they are
 * the only capture groups the match interpreter may read.
 */
public class VariantPattern {
    public final SequenceType seqType;
    public final MutationType mutType;
    public final boolean isCoding;
    public final String patName;
    public final Pattern pattern;
    private final Set<String> fields;

    public VariantPattern(SequenceType seqType, MutationType mutType, boolean isCoding, String patName,
                          Pattern pattern, Set<String> fields) {
        this.seqType = seqType;
        this.mutType = mutType;
        this.isCoding = isCoding;
        this.patName = patName;
        this.pattern = pattern;
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    public boolean has(String field) {
        return fields.contains(field);
    }

    public Set<String> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return seqType.getLabel() + "/" + mutType.getLabel() + " " + patName;
    }
}
