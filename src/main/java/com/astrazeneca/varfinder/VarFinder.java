package com.astrazeneca.varfinder;

import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.GroundingResult;
import com.astrazeneca.varfinder.data.ProjectedVariants;
import com.astrazeneca.varfinder.data.SeqVariantData;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantMentions;
import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import com.astrazeneca.varfinder.modules.VariantExtractor;
import com.astrazeneca.varfinder.modules.VariantGrounder;
import com.astrazeneca.varfinder.modules.VariantMatchParser;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the variants of a document and grounds them on its genes.
 */
public class VarFinder {
    private static final Log log = Log.getInstance(VarFinder.class);

    private static final SequenceType[] GROUNDED_CATEGORIES = {SequenceType.PROT, SequenceType.DNA, SequenceType.INTRON};

    private final VariantExtractor extractor;
    private final VariantGrounder grounder;

    public VarFinder(ReadOnlyScope scope) {
        this(new VariantExtractor(scope.patterns, new VariantMatchParser(scope.seqData)), new VariantGrounder(scope));
    }

    public VarFinder(VariantExtractor extractor, VariantGrounder grounder) {
        this.extractor = extractor;
        this.grounder = grounder;
    }

    /**
     * @see VariantExtractor#findVariantDescriptions(String, Set)
     */
    public Map<SequenceType, List<VariantMentions>> findVariantDescriptions(String text, Set<Integer> excludedPositions) {
        return extractor.findVariantDescriptions(text, excludedPositions);
    }

    /**
     * Extracts and grounds the variants of a document.
     * <p>
     * Without candidate genes the gene mentioned closest to the variant is tried. dbSNP identifiers that no
     * grounded variant is located at are written as ungrounded records.
     * @param doc document with its candidate genes
     * @return grounded and ungrounded records, in order of finding
     */
    public List<SeqVariantData> processDocument(DocumentContext doc) {
        Map<SequenceType, List<VariantMentions>> variants = findVariantDescriptions(doc.text, doc.excludedPositions);
        List<VariantMentions> snpMentions = variants.get(SequenceType.DB_SNP);

        List<SeqVariantData> records = new ArrayList<>();
        Set<String> mappedRsIds = new HashSet<>();
        int varCount = 0;
        for (SequenceType category : GROUNDED_CATEGORIES) {
            for (VariantMentions variant : variants.get(category)) {
                String varId = doc.docId + "_" + varCount++;
                List<String> genes = doc.entrezGenes;
                String geneType = SeqVariantData.GENE_TYPE_ENTREZ;
                if (genes.isEmpty() && !doc.geneMentions.isEmpty()) {
                    String closestGene = VariantGrounder.findClosestGeneMention(variant.getMentions(), doc.geneMentions);
                    genes = closestGene == null ? Collections.<String>emptyList() : Collections.singletonList(closestGene);
                    geneType = SeqVariantData.GENE_TYPE_NEARBY;
                }
                GroundingResult result = grounder.groundVariant(varId, doc, variant, snpMentions, genes, geneType);
                records.addAll(result.grounded);
                if (result.ungrounded != null) {
                    records.add(result.ungrounded);
                }
                mappedRsIds.addAll(result.mappedRsIds);
            }
        }

        for (VariantMentions snp : snpMentions) {
            if (!mappedRsIds.contains(snp.variant.origSeq)) {
                records.add(SeqVariantData.ungrounded(SequenceType.DB_SNP, snp.variant.mutType, snp.getMentions(),
                        doc.text, grounder.getSnippetContext()));
            }
        }
        log.debug("Document ", doc.docId, ": ", records.size(), " records");
        return records;
    }

    /**
     * Grounds a protein change like "V600E" on a gene symbol.
     * @return coding and transcript variants with their genome features, or null if the change is not
     * a protein variant or doesn't fit the gene
     */
    public ProjectedVariants groundSymbolVariant(String geneSym, String protDesc) {
        List<VariantMentions> protVars = extractor.findVariantDescriptions(protDesc).get(SequenceType.PROT);
        if (protVars.isEmpty()) {
            log.info("No protein variant in ", protDesc);
            return null;
        }
        return grounder.groundProteinVariant(geneSym, protVars.get(0).variant, geneSym + ":" + protDesc);
    }
}
