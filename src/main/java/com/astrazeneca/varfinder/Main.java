package com.astrazeneca.varfinder;

import org.apache.commons.cli.ParseException;

public class Main {
    /**
     * Reads the parameters and runs VarFinder on the documents file.
     * @param args array of arguments from command line
     */
    public static void main(String[] args) {
        Configuration config;
        try {
            config = new CmdParser().parseParams(args);
        } catch (ParseException e) {
            System.err.println("Wrong parameters: " + e.getMessage());
            System.exit(1);
            return;
        }
        new VarFinderLauncher().start(config);
    }
}
