package com.astrazeneca.varfinder;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

import static com.astrazeneca.varfinder.data.Patterns.ACCESSION_VERSION;

public final class Utils {
    /**
     * Characters around a mention that are replaced in snippets.
     */
    private static final String SNIPPET_DELIMITER = "|";

    private Utils() {
    }

    /**
     * Method creates string from elements of specified collection by appending them with specified delimiter
     * @param delim specified delimiter
     * @param collection any collection
     * @param <E> generic type of collection elements
     * @return generated string
     */
    public static <E> String join(String delim, Collection<E> collection) {
        Iterator<E> it = collection.iterator();
        if (!it.hasNext())
            return "";

        StringBuilder sb = new StringBuilder();
        for (;;) {
            sb.append(it.next());
            if (!it.hasNext())
                return sb.toString();
            sb.append(delim);
        }
    }

    /**
     * Method creates string from arguments by appending them with specified delimiter
     * @param delim specified delimiter
     * @param args array of arguments
     * @return generated string
     */
    public static String join(String delim, Object... args) {
        if (args.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            sb.append(args[i]);
            if (i + 1 != args.length) {
                sb.append(delim);
            }
        }
        return sb.toString();
    }

    public static <K, V> V getOrElse(Map<K, V> map, K key, V or) {
        V v = map.get(key);
        if (v == null) {
            v = or;
        }
        return v;
    }

    /**
     * Method finds all groups of the pattern in string
     * @param pattern jregex pattern with one group
     * @param string string to find specified pattern
     * @return List of strings (found groups, in order)
     */
    public static List<String> globalFind(jregex.Pattern pattern, String string) {
        List<String> result = new LinkedList<>();
        jregex.Matcher matcher = pattern.matcher(string);
        while (matcher.find()) {
            result.add(matcher.group(1));
        }
        return result;
    }

    /**
     * Removes the version suffix of an accession: NM_007294.3 becomes NM_007294.
     */
    public static String stripVersion(String accession) {
        Matcher matcher = ACCESSION_VERSION.matcher(accession);
        return matcher.find() ? matcher.group(1) : accession;
    }

    /**
     * @return version number of the accession or -1 if it has no version
     */
    public static int getVersion(String accession) {
        Matcher matcher = ACCESSION_VERSION.matcher(accession);
        return matcher.find() ? Integer.parseInt(matcher.group(2)) : -1;
    }

    /**
     * Removes the given characters from both ends of the string.
     */
    public static String strip(String string, String chars) {
        int begin = 0;
        int end = string.length();
        while (begin < end && chars.indexOf(string.charAt(begin)) >= 0) {
            begin++;
        }
        while (end > begin && chars.indexOf(string.charAt(end - 1)) >= 0) {
            end--;
        }
        return string.substring(begin, end);
    }

    /**
     * Text around a span with the span marked: "The<<< R71G>>> BRCA1 mutation". Line breaks and the
     * column delimiter "|" are replaced by spaces.
     * @param text whole text
     * @param start start of the span
     * @param end end of the span, exclusive
     * @param context maximum number of characters on each side
     * @return snippet
     */
    public static String getSnippet(String text, int start, int end, int context) {
        int left = Math.max(0, start - context);
        int right = Math.min(text.length(), end + context);
        String snippet = text.substring(left, start) + "<<<" + text.substring(start, end) + ">>>"
                + text.substring(end, right);
        return snippet.replace("\n", " ").replace("\r", " ").replace("\t", " ").replace(SNIPPET_DELIMITER, " ");
    }

    /**
     * Method prints the exception to System.err and increases the counter of continued exceptions.
     * The run is stopped when the counter exceeds {@link Configuration#MAX_EXCEPTION_COUNT}.
     * @param exception exception to print
     * @param place what was processed, e.g. "document"
     * @param placeDef identifier of the processed item
     * @param conf configuration holding the exception counter
     */
    public static void printExceptionAndContinue(Exception exception, String place, String placeDef, Configuration conf) {
        System.err.println("There was Exception while processing " + place + " " + placeDef
                + ". The processing will be continued from the next " + place + ".");
        exception.printStackTrace();
        int currentCount = conf.exceptionCounter.incrementAndGet();

        if (currentCount > Configuration.MAX_EXCEPTION_COUNT) {
            System.err.println("VarFinder fails (there were " + conf.exceptionCounter.get()
                    + " continued exceptions during the run).");
            throw new RuntimeException(exception);
        }
    }
}
