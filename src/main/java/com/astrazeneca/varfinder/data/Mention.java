package com.astrazeneca.varfinder.data;

import java.util.Objects;

/**
 * Span of text where a variant (or a gene) was found, with the name of the pattern that found it.
 * Start and end are character offsets, end is exclusive.
 */
public class Mention {
    public final String patName;
    public final int start;
    public final int end;

    public Mention(String patName, int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Wrong mention span " + start + "-" + end);
        }
        this.patName = patName;
        this.start = start;
        this.end = end;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Mention mention = (Mention) o;
        return start == mention.start &&
                end == mention.end &&
                Objects.equals(patName, mention.patName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patName, start, end);
    }

    @Override
    public String toString() {
        return patName + ":" + start + "-" + end;
    }
}
