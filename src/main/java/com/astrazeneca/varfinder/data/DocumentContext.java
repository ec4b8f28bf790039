package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Text of one document and what is already known about it: the candidate genes, the gene mentions
 * per Entrez ID and the character positions where variant matches are not allowed.
 */
public class DocumentContext {
    public final String docId;
    public final String text;
    public final List<String> entrezGenes;
    public final Map<String, List<Mention>> geneMentions;
    public final Set<Integer> excludedPositions;

    public DocumentContext(String docId, String text, List<String> entrezGenes,
                           Map<String, List<Mention>> geneMentions, Set<Integer> excludedPositions) {
        this.docId = docId;
        this.text = text;
        this.entrezGenes = Collections.unmodifiableList(new ArrayList<>(entrezGenes));
        this.geneMentions = Collections.unmodifiableMap(new LinkedHashMap<>(geneMentions));
        this.excludedPositions = Collections.unmodifiableSet(new HashSet<>(excludedPositions));
    }

    public DocumentContext(String docId, String text, List<String> entrezGenes) {
        this(docId, text, entrezGenes, Collections.<String, List<Mention>>emptyMap(), Collections.<Integer>emptySet());
    }
}
