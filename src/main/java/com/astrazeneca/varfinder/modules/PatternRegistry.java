package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.data.MutationType;
import com.astrazeneca.varfinder.data.PatternTableRow;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantPattern;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.astrazeneca.varfinder.data.Patterns.DIGITS_ONLY;
import static com.astrazeneca.varfinder.data.Patterns.PLACEHOLDER;
import static com.astrazeneca.varfinder.data.Patterns.PLACEHOLDERS;

/**
 * Compiles pattern table rows into variant patterns. Placeholders like {pos} or {origAaShort} are replaced by
 * named groups, patterns with a long amino acid placeholder ignore case. Rows that can't be used are logged
 * and skipped.
 */
public class PatternRegistry {
    private static final Log log = Log.getInstance(PatternRegistry.class);

    private static final String[] POSITION_RANGE = {"fromPos", "toPos"};

    /**
     * Compiles all usable rows, in table order.
     */
    public List<VariantPattern> compile(List<PatternTableRow> rows) {
        List<VariantPattern> patterns = new ArrayList<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PatternTableRow row : rows) {
            VariantPattern pattern = compileRow(row);
            if (pattern == null) {
                continue;
            }
            patterns.add(pattern);
            String type = pattern.seqType.getLabel() + "/" + pattern.mutType.getLabel();
            counts.put(type, Utils.getOrElse(counts, type, 0) + 1);
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            log.info("regexType ", entry.getKey(), ", found ", entry.getValue(), " regexes");
        }
        return patterns;
    }

    /**
     * @return compiled pattern or null if the row is skipped
     */
    public VariantPattern compileRow(PatternTableRow row) {
        boolean isCoding;
        if ("True".equals(row.isCoding)) {
            isCoding = true;
        } else if ("False".equals(row.isCoding)) {
            isCoding = false;
        } else {
            log.warn("Skipping regex. Invalid value for isCoding: ", row.isCoding);
            return null;
        }
        SequenceType seqType = SequenceType.fromLabel(row.seqType);
        if (seqType == null || !seqType.isTextCategory()) {
            log.warn("Skipping regex ", row.pat, ". Unknown seqType: ", row.seqType);
            return null;
        }
        MutationType mutType = MutationType.fromLabel(row.mutType);
        if (mutType == null) {
            log.warn("Skipping regex ", row.pat, ". Unknown mutType: ", row.mutType);
            return null;
        }

        Set<String> fields = new LinkedHashSet<>();
        String expanded = expand(row.pat, fields);
        if (expanded == null) {
            return null;
        }
        String schemaError = checkSchema(mutType, isCoding, fields);
        if (schemaError != null) {
            log.warn("Skipping regex ", row.pat, ". ", schemaError);
            return null;
        }

        int flags = 0;
        if (row.pat.contains("Long}")) {
            log.debug("ignoring case for pattern ", row.pat);
            flags = Pattern.CASE_INSENSITIVE;
        }
        Pattern compiled;
        try {
            compiled = Pattern.compile(expanded, flags);
        } catch (PatternSyntaxException e) {
            log.warn("Skipping regex ", row.pat, ". It doesn't compile: ", e.getDescription());
            return null;
        }
        log.debug("full pattern is ", expanded);
        String patName = row.patName == null || row.patName.isEmpty() ? row.pat : row.patName;
        return new VariantPattern(seqType, mutType, isCoding, patName, compiled, fields);
    }

    /**
     * Replaces the placeholders of a template by their regex fragments.
     * @param template pattern with {placeholder} names
     * @param fields collects the placeholder names found
     * @return full regex or null if the template has an unknown placeholder
     */
    static String expand(String template, Set<String> fields) {
        String expanded = template;
        for (String name : Utils.globalFind(PLACEHOLDER, template)) {
            // {2} and alike are regex quantifiers
            if (DIGITS_ONLY.matcher(name).find()) {
                continue;
            }
            String fragment = PLACEHOLDERS.get(name);
            if (fragment == null) {
                log.warn("Skipping regex ", template, ". Unknown placeholder {", name, "}");
                return null;
            }
            fields.add(name);
            expanded = expanded.replace("{" + name + "}", fragment);
        }
        return expanded;
    }

    /**
     * Checks that a pattern captures everything its mutation type needs.
     * @return description of the problem or null if the fields are sufficient
     */
    static String checkSchema(MutationType mutType, boolean isCoding, Set<String> fields) {
        boolean hasPosition = fields.contains("pos") || containsAll(fields, POSITION_RANGE);
        switch (mutType) {
            case SUB:
                if (!hasPosition) {
                    return "Substitution needs {pos} or {fromPos} and {toPos}";
                }
                if (!containsAny(fields, "origAaShort", "origAaLong", "origDna")) {
                    return "Substitution needs an original residue or base";
                }
                if (!containsAny(fields, "mutAaShort", "mutAaLong", "mutDna")) {
                    return "Substitution needs a new residue or base";
                }
                if (!isCoding && !containsAll(fields, "plusMinus", "offset")) {
                    return "Non coding substitution needs {plusMinus} and {offset}";
                }
                return null;
            case DEL:
                if (!hasPosition) {
                    return "Deletion needs {pos} or {fromPos} and {toPos}";
                }
                if (!containsAny(fields, "origAaShort", "origAaLong", "origAasShort", "origAasLong",
                        "origDna", "origDnas")) {
                    return "Deletion needs the deleted sequence";
                }
                return null;
            case INS:
                return hasPosition ? null : "Insertion needs {pos} or {fromPos} and {toPos}";
            case DUP:
                if (!hasPosition) {
                    return "Duplication needs {pos} or {fromPos} and {toPos}";
                }
                return containsAny(fields, "origDna", "origDnas") ? null : "Duplication needs {origDna} or {origDnas}";
            case SPLICING:
                return containsAll(fields, "pos", "plusMinus", "offset", "origDna", "mutDna") ? null
                        : "Splicing variant needs {pos}, {plusMinus}, {offset}, {origDna} and {mutDna}";
            case DB_SNP:
                return fields.contains("rsId") ? null : "dbSNP pattern needs {rsId}";
            default:
                return "Unsupported mutType " + mutType;
        }
    }

    private static boolean containsAny(Set<String> fields, String... names) {
        for (String name : names) {
            if (fields.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAll(Set<String> fields, String... names) {
        for (String name : names) {
            if (!fields.contains(name)) {
                return false;
            }
        }
        return true;
    }
}
