package com.astrazeneca.varfinder.exception;


import java.util.Locale;

public class ReferenceDataException extends RuntimeException {
    public final static String ReferenceDataExceptionMessage = "The reference file %s is wrong: %s. " +
            "Please check the file format and that the file is not truncated.";

    public ReferenceDataException(String file, String reason) {
            super(String.format(Locale.US, ReferenceDataExceptionMessage, file, reason));
    }

    public ReferenceDataException(String file, String reason, Throwable e) {
            super(String.format(Locale.US, ReferenceDataExceptionMessage, file, reason), e);
    }
}
