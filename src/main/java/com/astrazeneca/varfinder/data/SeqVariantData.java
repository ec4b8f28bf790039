package com.astrazeneca.varfinder.data;

import com.astrazeneca.varfinder.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output record: a variant with its genome position, names on all sequences, gene and the text mentions that
 * support it. Variants that could not be grounded are written with empty sequence and gene columns.
 */
public class SeqVariantData {
    public static final String GENE_TYPE_ENTREZ = "entrez";
    public static final String GENE_TYPE_NEARBY = "symNearby";

    private static final String TEXT_PUNCTUATION = "() -;,.";

    /**
     * Output columns in order.
     */
    public static final List<String> COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "chrom",          // chromosome
            "start",          // on chrom
            "end",            // on chrom
            "offset",         // intron offset
            "varId",          // a unique id
            "inDb",           // list of db names where was found
            "patType",        // the type of the patterns (sub, del, ins)
            "hgvsProt",       // hgvs on protein, can be multiple, separated with |
            "hgvsCoding",     // hgvs on cdna, can be multiple, separated with |
            "hgvsRna",        // hgvs on refseq, separated by |
            "comment",        // comment on how mapping was done
            "rsIds",          // possible rsIds, separated by |, obtained by mapping from hgvsRna
            "protId",         // the protein ID that was used for the first mapping
            "texts",          // mutation match in text
            "rsIdsMentioned", // mentioned dbSnp IDs that support any of the hgvsRna mutations
            "dbSnpStarts",    // mentioned dbSnp IDs in text, start positions
            "dbSnpEnds",      // mentioned dbSnp IDs in text, end positions
            "geneSymbol",     // symbol of gene
            "geneType",       // why was this gene selected (entrez, symNearby)
            "entrezId",       // entrez ID of gene
            "geneStarts",     // start positions of gene mentions in document
            "geneEnds",       // end positions of gene mentions in document
            "seqType",        // the seqType of the patterns, dna or protein
            "mutPatNames",    // the names of the patterns that matched, separated by |
            "mutStarts",      // start positions of mutation pattern matches in document
            "mutEnds",        // end positions of mutation pattern matches in document
            "mutSnippets",    // the phrases around the mutation mentions, separated by |
            "geneSnippets",   // the phrases around the gene mentions, separated by |
            "dbSnpSnippets"   // mentioned dbSNP Ids in text, snippets
    ));

    private final Map<String, String> values;

    private SeqVariantData(Map<String, String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : COLUMNS) {
            row.put(column, Utils.getOrElse(values, column, ""));
        }
        this.values = Collections.unmodifiableMap(row);
    }

    /**
     * Record of a variant grounded on a gene.
     * @param varId unique id of the record
     * @param variant text variant with its mentions
     * @param projected variant on protein, coding and transcript sequences and its genome features
     * @param entrezGene Entrez ID of the gene
     * @param geneSym symbol of the gene
     * @param geneType how the gene was selected
     * @param rsIds dbSNP identifiers at the genome features, "na" where there is none
     * @param dbSnpMentionsByRsId mentions of dbSNP identifiers in the text that are among rsIds
     * @param geneMentions mentions of the gene in the text
     * @param text document text
     * @param snippetContext characters of context in snippets
     */
    public static SeqVariantData grounded(String varId, VariantMentions variant, ProjectedVariants projected,
                                          String entrezGene, String geneSym, String geneType, List<String> rsIds,
                                          Map<String, List<Mention>> dbSnpMentionsByRsId, List<Mention> geneMentions,
                                          String text, int snippetContext) {
        Map<String, String> values = new LinkedHashMap<>();
        if (!projected.beds.isEmpty()) {
            BedRecord bed = projected.beds.get(0);
            values.put("chrom", bed.chrom);
            values.put("start", String.valueOf(bed.start));
            values.put("end", String.valueOf(bed.end));
        }
        values.put("offset", String.valueOf(variant.variant.offset));
        values.put("varId", varId);
        values.put("patType", variant.variant.mutType.getLabel());
        values.put("hgvsProt", joinNames(projected.protVars));
        values.put("hgvsCoding", joinNames(projected.codVars));
        values.put("hgvsRna", joinNames(projected.rnaVars));
        values.put("rsIds", Utils.join("|", rsIds));
        if (!projected.protVars.isEmpty()) {
            values.put("protId", projected.protVars.get(0).seqId);
        }
        values.put("geneSymbol", geneSym);
        values.put("geneType", geneType);
        values.put("entrezId", entrezGene);

        List<String> starts = new ArrayList<>();
        List<String> ends = new ArrayList<>();
        List<String> snippets = new ArrayList<>();
        List<String> mentionedRsIds = new ArrayList<>();
        for (Map.Entry<String, List<Mention>> entry : dbSnpMentionsByRsId.entrySet()) {
            for (Mention mention : entry.getValue()) {
                starts.add(String.valueOf(mention.start));
                ends.add(String.valueOf(mention.end));
                snippets.add(Utils.getSnippet(text, mention.start, mention.end, snippetContext));
                mentionedRsIds.add(entry.getKey());
            }
        }
        values.put("dbSnpStarts", Utils.join(",", starts));
        values.put("dbSnpEnds", Utils.join(",", ends));
        values.put("dbSnpSnippets", Utils.join("|", snippets));
        values.put("rsIdsMentioned", Utils.join("|", mentionedRsIds));

        putMentions(values, variant.variant.seqType, variant.getMentions(), text, snippetContext);
        putGeneMentions(values, geneMentions, text, snippetContext);
        return new SeqVariantData(values);
    }

    /**
     * Record of a text variant that could not be placed on any sequence. Only the text columns are filled.
     */
    public static SeqVariantData ungrounded(SequenceType seqType, MutationType patType, List<Mention> mentions,
                                            String text, int snippetContext) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("patType", patType.getLabel());
        putMentions(values, seqType, mentions, text, snippetContext);
        return new SeqVariantData(values);
    }

    private static void putMentions(Map<String, String> values, SequenceType seqType, List<Mention> mentions,
                                    String text, int snippetContext) {
        List<String> starts = new ArrayList<>();
        List<String> ends = new ArrayList<>();
        List<String> patNames = new ArrayList<>();
        List<String> snippets = new ArrayList<>();
        Set<String> texts = new LinkedHashSet<>();
        for (Mention mention : mentions) {
            starts.add(String.valueOf(mention.start));
            ends.add(String.valueOf(mention.end));
            patNames.add(mention.patName);
            snippets.add(Utils.getSnippet(text, mention.start, mention.end, snippetContext));
            texts.add(Utils.strip(text.substring(mention.start, mention.end), TEXT_PUNCTUATION));
        }
        values.put("seqType", seqType.getLabel());
        values.put("mutStarts", Utils.join(",", starts));
        values.put("mutEnds", Utils.join(",", ends));
        values.put("mutPatNames", Utils.join("|", patNames));
        values.put("mutSnippets", Utils.join("|", snippets));
        values.put("texts", Utils.join("|", texts));
    }

    private static void putGeneMentions(Map<String, String> values, List<Mention> geneMentions, String text,
                                        int snippetContext) {
        List<String> starts = new ArrayList<>();
        List<String> ends = new ArrayList<>();
        List<String> snippets = new ArrayList<>();
        for (Mention mention : geneMentions) {
            starts.add(String.valueOf(mention.start));
            ends.add(String.valueOf(mention.end));
            snippets.add(Utils.getSnippet(text, mention.start, mention.end, snippetContext));
        }
        values.put("geneStarts", Utils.join(",", starts));
        values.put("geneEnds", Utils.join(",", ends));
        values.put("geneSnippets", Utils.join("|", snippets));
    }

    private static String joinNames(List<VariantDescription> variants) {
        List<String> names = new ArrayList<>(variants.size());
        for (VariantDescription variant : variants) {
            names.add(variant.getName());
        }
        return Utils.join("|", names);
    }

    public String get(String column) {
        String value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Unknown output column: " + column);
        }
        return value;
    }

    /**
     * @return values of all columns in output order
     */
    public List<String> asRow() {
        return new ArrayList<>(values.values());
    }

    @Override
    public String toString() {
        return "SeqVariantData" + values;
    }
}
