package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Variant found in a text with all the places where it is mentioned, in order of finding.
 */
public class VariantMentions {
    public final VariantDescription variant;
    private final List<Mention> mentions;

    public VariantMentions(VariantDescription variant, List<Mention> mentions) {
        this.variant = variant;
        this.mentions = Collections.unmodifiableList(new ArrayList<>(mentions));
    }

    public List<Mention> getMentions() {
        return mentions;
    }

    @Override
    public String toString() {
        return variant.getName() + " " + mentions;
    }
}
