package com.astrazeneca.varfinder.printers;

import java.io.PrintStream;

/**
 * Stream the variant records are printed to, chosen with the option -DP.
 */
public enum PrinterType {
    OUT,
    ERR;

    PrintStream stream() {
        return this == ERR ? System.err : System.out;
    }

    /**
     * @param name name from the command line, any case
     * @return the printer type or OUT if the name is unknown
     */
    public static PrinterType fromName(String name) {
        for (PrinterType type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return OUT;
    }
}
