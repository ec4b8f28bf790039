package com.astrazeneca.varfinder.exception;


import java.util.Locale;

public class PatternTableException extends RuntimeException {
    public final static String PatternTableExceptionMessage = "The pattern table %s can't be read: %s. " +
            "It must be tab separated with the header seqType, mutType, isCoding, patName, pat.";

    public PatternTableException(String source, String reason) {
            super(String.format(Locale.US, PatternTableExceptionMessage, source, reason));
    }

    public PatternTableException(String source, String reason, Throwable e) {
            super(String.format(Locale.US, PatternTableExceptionMessage, source, reason), e);
    }
}
