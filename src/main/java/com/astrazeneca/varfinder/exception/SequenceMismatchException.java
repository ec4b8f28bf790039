package com.astrazeneca.varfinder.exception;


import java.util.Locale;

public class SequenceMismatchException extends RuntimeException {
    public final static String SequenceMismatchExceptionMessage = "The codons of transcript %s at protein " +
            "position %d translate to \"%s\", but \"%s\" was expected. Transcript and protein sequences " +
            "or the CDS start may be out of date.";

    public SequenceMismatchException(String transcriptId, int protStart, String found, String expected) {
            super(String.format(Locale.US, SequenceMismatchExceptionMessage, transcriptId, protStart, found, expected));
    }
}
