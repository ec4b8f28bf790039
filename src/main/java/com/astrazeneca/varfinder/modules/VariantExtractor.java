package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VariantMentions;
import com.astrazeneca.varfinder.data.VariantPattern;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Runs all variant patterns over a text and merges the matches that describe the same variant.
 */
public class VariantExtractor {
    private static final Log log = Log.getInstance(VariantExtractor.class);

    private final List<VariantPattern> patterns;
    private final VariantMatchParser parser;

    public VariantExtractor(List<VariantPattern> patterns, VariantMatchParser parser) {
        this.patterns = patterns;
        this.parser = parser;
    }

    /**
     * Finds the variants of a text.
     * @param text document text
     * @param excludedPositions character positions claimed by other annotations (e.g. gene names), matches
     *                          covering any of them are ignored
     * @return variants with their mentions per sequence category, every category of
     * {@link SequenceType#textCategories()} is present, lists keep the order of first finding
     */
    public Map<SequenceType, List<VariantMentions>> findVariantDescriptions(String text, Set<Integer> excludedPositions) {
        Map<String, VariantDescription> variantsByKey = new LinkedHashMap<>();
        Map<String, List<Mention>> mentionsByKey = new LinkedHashMap<>();

        for (VariantPattern pattern : patterns) {
            Matcher match = pattern.pattern.matcher(text);
            while (match.find()) {
                if (isExcluded(match.start(), match.end(), excludedPositions)) {
                    log.debug("Match ", match.group(), " overlaps an excluded position");
                    continue;
                }
                VariantDescription variant = parser.parse(pattern, match);
                if (variant == null) {
                    continue;
                }
                log.debug("Found ", variant, " with pattern ", pattern);
                String key = variant.getKey();
                if (!variantsByKey.containsKey(key)) {
                    variantsByKey.put(key, variant);
                    mentionsByKey.put(key, new ArrayList<Mention>());
                }
                mentionsByKey.get(key).add(new Mention(pattern.patName, match.start(), match.end()));
            }
        }

        Map<SequenceType, List<VariantMentions>> result = new EnumMap<>(SequenceType.class);
        for (SequenceType category : SequenceType.textCategories()) {
            result.put(category, new ArrayList<VariantMentions>());
        }
        for (Map.Entry<String, VariantDescription> entry : variantsByKey.entrySet()) {
            VariantDescription variant = entry.getValue();
            List<VariantMentions> variants = result.get(variant.seqType);
            if (variants == null) {
                log.warn("Variant ", variant, " has no text category, skipped");
                continue;
            }
            variants.add(new VariantMentions(variant, mentionsByKey.get(entry.getKey())));
        }
        return result;
    }

    public Map<SequenceType, List<VariantMentions>> findVariantDescriptions(String text) {
        return findVariantDescriptions(text, Collections.<Integer>emptySet());
    }

    private static boolean isExcluded(int start, int end, Set<Integer> excludedPositions) {
        if (excludedPositions.isEmpty()) {
            return false;
        }
        for (int pos = start; pos < end; pos++) {
            if (excludedPositions.contains(pos)) {
                return true;
            }
        }
        return false;
    }
}
