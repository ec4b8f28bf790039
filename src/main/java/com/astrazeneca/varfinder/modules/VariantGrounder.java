package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.Configuration;
import com.astrazeneca.varfinder.data.BedRecord;
import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.GroundingResult;
import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.data.ProjectedVariants;
import com.astrazeneca.varfinder.data.SeqVariantData;
import com.astrazeneca.varfinder.data.SequenceType;
import com.astrazeneca.varfinder.data.VariantDescription;
import com.astrazeneca.varfinder.data.VariantMentions;
import com.astrazeneca.varfinder.data.VerifiedSequences;
import com.astrazeneca.varfinder.data.scopedata.ReadOnlyScope;
import com.astrazeneca.varfinder.resources.SeqData;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Grounds text variants on the genes of a document: verifies the variant on the gene sequences, moves it
 * to coding and transcript coordinates, projects it on the genome and collects the dbSNP identifiers
 * at the projected positions.
 */
public class VariantGrounder {
    private static final Log log = Log.getInstance(VariantGrounder.class);

    /**
     * dbSNP identifier of a genome position without dbSNP entry.
     */
    public static final String NO_RS_ID = "na";

    private final Configuration conf;
    private final SeqData seqData;
    private final SequenceVerifier verifier;
    private final CoordinateMapper coordinateMapper;
    private final AlignmentProjector alignmentProjector;

    public VariantGrounder(ReadOnlyScope scope) {
        this(scope.conf, scope.seqData,
                new SequenceVerifier(scope.seqData, scope.conf.shuffle, scope.conf.shuffleSeed),
                new CoordinateMapper(scope.seqData, new BackTranslator(scope.conf.allowTwoBpVariants), scope.conf.shuffle),
                new AlignmentProjector(scope.seqData, new PslMapper()));
    }

    public VariantGrounder(Configuration conf, SeqData seqData, SequenceVerifier verifier,
                           CoordinateMapper coordinateMapper, AlignmentProjector alignmentProjector) {
        this.conf = conf;
        this.seqData = seqData;
        this.verifier = verifier;
        this.coordinateMapper = coordinateMapper;
        this.alignmentProjector = alignmentProjector;
    }

    /**
     * Tries the genes in order, the first gene with a verified sequence wins. A failure on one gene is
     * logged and the next gene is tried.
     * @param varId id of the output record
     * @param doc document the variant was found in
     * @param variant text variant with its mentions
     * @param snpMentions dbSNP identifiers found in the same document
     * @param entrezGenes candidate genes, Entrez IDs
     * @param geneType how the genes were selected, see {@link SeqVariantData#GENE_TYPE_ENTREZ}
     * @return grounded record, or the ungrounded record if no gene fits
     */
    public GroundingResult groundVariant(String varId, DocumentContext doc, VariantMentions variant,
                                         List<VariantMentions> snpMentions, List<String> entrezGenes,
                                         String geneType) {
        VariantDescription textVar = variant.variant;
        List<SeqVariantData> grounded = new ArrayList<>();
        List<BedRecord> allBeds = new ArrayList<>();
        Set<String> mappedRsIds = new LinkedHashSet<>();
        log.debug("Grounding mutation ", textVar, " onto genes ", entrezGenes);

        for (String entrezGene : entrezGenes) {
            String geneSym = seqData.entrezToSym(entrezGene);
            if (geneSym == null) {
                log.warn("No symbol for entrez gene ", entrezGene, ". Skipping gene.");
                continue;
            }
            try {
                VerifiedSequences verified = verifier.checkVariantAgainstSequence(textVar, entrezGene,
                        conf.insertionRv, conf.seqDbs);
                if (verified == null) {
                    log.debug("No sequence of gene ", geneSym, " has ", textVar.origSeq, " at the variant position");
                    continue;
                }
                if (textVar.seqType == SequenceType.INTRON) {
                    log.debug("Intron variant ", textVar, " fits gene ", geneSym, " but intron variants are not grounded");
                    break;
                }

                ProjectedVariants projected = project(textVar, verified);
                if (projected == null || projected.rnaVars.isEmpty()) {
                    log.warn("No transcript of gene ", geneSym, " could be mapped for ", textVar.getName(),
                            ", trying the next gene");
                    continue;
                }
                List<BedRecord> beds = alignmentProjector.mapToGenome(projected.rnaVars, varId);
                projected = projected.withBeds(beds);
                log.info("Grounded ", textVar.getName(), " on ", geneSym, ": ", projected.rnaVars.size(),
                        " transcript variants, ", beds.size(), " genome positions");

                List<String> varRsIds = bedToRsIds(beds);
                Map<String, List<Mention>> mentionedDbSnpVars = getSnpMentions(varRsIds, snpMentions);
                mappedRsIds.addAll(mentionedDbSnpVars.keySet());

                grounded.add(SeqVariantData.grounded(varId, variant, projected, entrezGene, geneSym, geneType,
                        varRsIds, mentionedDbSnpVars, geneMentions(doc, entrezGene), doc.text, conf.snippetContext));
                allBeds.addAll(beds);
                break;
            } catch (RuntimeException e) {
                log.warn(e, "Could not ground ", textVar, " on gene ", entrezGene, ", trying the next gene");
            }
        }

        SeqVariantData ungrounded = null;
        if (grounded.isEmpty()) {
            ungrounded = SeqVariantData.ungrounded(textVar.seqType, textVar.mutType, variant.getMentions(),
                    doc.text, conf.snippetContext);
        }
        return new GroundingResult(grounded, ungrounded, allBeds, mappedRsIds);
    }

    private ProjectedVariants project(VariantDescription textVar, VerifiedSequences verified) {
        if (textVar.seqType == SequenceType.PROT) {
            List<VariantDescription> protVars = rewriteToRefProt(textVar, verified.seqIds);
            return coordinateMapper.mapToCodingAndRna(protVars);
        }
        return coordinateMapper.mapDnaToCodingAndRna(textVar, verified.seqIds);
    }

    public int getSnippetContext() {
        return conf.snippetContext;
    }

    /**
     * Same variant on each of the proteins.
     */
    public static List<VariantDescription> rewriteToRefProt(VariantDescription variant, List<String> protIds) {
        List<VariantDescription> varList = new ArrayList<>(protIds.size());
        for (String protId : protIds) {
            varList.add(variant.withSeqId(protId, SequenceType.PROT));
        }
        return varList;
    }

    /**
     * @return dbSNP identifier at each feature, {@link #NO_RS_ID} where there is none
     */
    public List<String> bedToRsIds(List<BedRecord> beds) {
        List<String> rsIds = new ArrayList<>(beds.size());
        for (BedRecord bed : beds) {
            String snpId = seqData.lookupDbSnp(bed.chrom, bed.start, bed.end);
            if (snpId == null) {
                log.debug("Chromosome location ", bed.getLocus().key(), " does not map to any dbSNP");
                rsIds.add(NO_RS_ID);
            } else {
                log.debug("Chromosome location ", bed.getLocus().key(), " corresponds to dbSNP ", snpId);
                rsIds.add(snpId);
            }
        }
        return rsIds;
    }

    /**
     * Mentions of the dbSNP variants whose identifier is among the mapped ones.
     * @param mappedRsIds identifiers at the genome positions of a variant, may contain {@link #NO_RS_ID}
     * @param snpVars dbSNP variants of the document
     * @return mentions per identifier
     */
    public static Map<String, List<Mention>> getSnpMentions(List<String> mappedRsIds, List<VariantMentions> snpVars) {
        Set<String> rsIds = new HashSet<>(mappedRsIds);
        rsIds.remove(NO_RS_ID);
        if (rsIds.isEmpty() || snpVars.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, List<Mention>> result = new LinkedHashMap<>();
        for (VariantMentions snpVar : snpVars) {
            String rsId = snpVar.variant.origSeq;
            if (rsIds.contains(rsId)) {
                if (!result.containsKey(rsId)) {
                    result.put(rsId, new ArrayList<Mention>());
                }
                result.get(rsId).addAll(snpVar.getMentions());
            }
        }
        return result;
    }

    /**
     * Gene mentioned closest to any of the variant mentions.
     * @param mentions mentions of a variant
     * @param geneMentions mentions per Entrez ID
     * @return Entrez ID or null if no gene is mentioned
     */
    public static String findClosestGeneMention(List<Mention> mentions, Map<String, List<Mention>> geneMentions) {
        String closestGene = null;
        int closestDistance = Integer.MAX_VALUE;
        for (Mention mention : mentions) {
            for (Map.Entry<String, List<Mention>> gene : geneMentions.entrySet()) {
                for (Mention geneMention : gene.getValue()) {
                    int distance = Math.min(Math.abs(geneMention.start - mention.start),
                            Math.abs(geneMention.end - mention.end));
                    if (distance < closestDistance) {
                        closestDistance = distance;
                        closestGene = gene.getKey();
                    }
                }
            }
        }
        return closestGene;
    }

    private static List<Mention> geneMentions(DocumentContext doc, String entrezGene) {
        List<Mention> mentions = doc.geneMentions.get(entrezGene);
        return mentions == null ? Collections.<Mention>emptyList() : mentions;
    }

    /**
     * Grounds a protein variant on the first gene of the symbol that has it, without document.
     * @return projected variants with genome features, or null if the variant can't be grounded
     */
    public ProjectedVariants groundProteinVariant(String geneSym, VariantDescription variant, String bedName) {
        VerifiedSequences verified = null;
        for (String entrezGene : seqData.mapSymToEntrez(geneSym)) {
            verified = verifier.checkVariantAgainstSequence(variant, entrezGene, conf.insertionRv, conf.seqDbs);
            if (verified != null) {
                break;
            }
        }
        if (verified == null) {
            log.info("Variant ", variant.getName(), " doesn't fit any sequence of ", geneSym);
            return null;
        }
        ProjectedVariants projected = coordinateMapper.mapToCodingAndRna(rewriteToRefProt(variant, verified.seqIds));
        if (projected == null || projected.rnaVars.isEmpty()) {
            log.info("No transcript of ", geneSym, " could be mapped for ", variant.getName());
            return null;
        }
        return projected.withBeds(alignmentProjector.mapToGenome(projected.rnaVars, bedName));
    }
}
