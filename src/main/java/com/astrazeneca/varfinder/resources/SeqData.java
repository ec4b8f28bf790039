package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.Configuration;
import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.data.GenomeLocus;
import com.astrazeneca.varfinder.data.PslRecord;
import htsjdk.samtools.util.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Access to the reference data needed for grounding: genes, sequences, transcript alignments and dbSNP.
 * Maps between Entrez genes, RefSeq proteins and transcripts.
 */
public class SeqData {
    private static final Log log = Log.getInstance(SeqData.class);

    private final GeneTable geneTable;
    private final SequenceStore sequenceStore;
    private final AlignmentStore alignmentStore;
    private final DbSnpStore dbSnpStore;

    /**
     * Alignments with canonical strand, per thread to avoid multithreading issues.
     */
    private final ThreadLocal<Map<String, List<PslRecord>>> threadLocalPslCache = ThreadLocal.withInitial(HashMap::new);

    public SeqData(GeneTable geneTable, SequenceStore sequenceStore, AlignmentStore alignmentStore,
                   DbSnpStore dbSnpStore) {
        this.geneTable = geneTable;
        this.sequenceStore = sequenceStore;
        this.alignmentStore = alignmentStore;
        this.dbSnpStore = dbSnpStore;
    }

    public String getSeq(String seqId) {
        log.debug("Looking up sequence for id ", seqId);
        return sequenceStore.getSeq(seqId);
    }

    /**
     * @return 0-based CDS start of the transcript or null
     */
    public Integer getCdsStart(String refseqId) {
        return sequenceStore.getCdsStart(refseqId);
    }

    /**
     * Resolves a RefSeq protein to the transcript coding for it.
     */
    public String getRefSeqId(String refProtId) {
        return sequenceStore.getTranscriptId(refProtId);
    }

    /**
     * @return rs identifier of the genome interval or null if not found
     */
    public String lookupDbSnp(String chrom, int start, int end) {
        return dbSnpStore.lookupDbSnp(chrom, start, end);
    }

    /**
     * @return genome interval of the rs identifier or null if not found
     */
    public GenomeLocus rsIdToGenome(String rsId) {
        return dbSnpStore.rsIdToGenome(rsId);
    }

    /**
     * @param entrezGene Entrez ID, several IDs may be joined with "/", only the first is used
     * @return symbol or null
     */
    public String entrezToSym(String entrezGene) {
        if (entrezGene.contains("/")) {
            log.debug("Got multiple entrez genes ", entrezGene, ". Using only first to get symbol.");
        }
        Integer entrezId = parseEntrezId(entrezGene.split("/")[0]);
        if (entrezId == null) {
            return null;
        }
        String geneSym = geneTable.getSymbol(entrezId);
        if (geneSym != null) {
            log.debug("Entrez gene ", entrezId, " = symbol ", geneSym);
        }
        return geneSym;
    }

    /**
     * @return Entrez IDs of the symbol as strings, empty if unknown
     */
    public List<String> mapSymToEntrez(String sym) {
        List<String> ids = new ArrayList<>();
        for (Integer id : geneTable.getEntrezIds(sym)) {
            ids.add(String.valueOf(id));
        }
        return ids;
    }

    /**
     * @param db "refseq" for the current accessions, "oldRefseq" for their previous versions
     * @return protein accessions of the gene in the database
     */
    public List<String> entrezToProtDbIds(int entrezGene, String db) {
        List<String> protIds = geneTable.getProteinIds(entrezGene);
        if (protIds.isEmpty()) {
            log.debug("gene ", entrezGene, " is not valid or a non-coding gene, no protein seq available");
        }
        return inDatabase(protIds, db);
    }

    /**
     * @param db "refseq" for the current accessions, "oldRefseq" for their previous versions
     * @return transcript accessions of the gene in the database
     */
    public List<String> entrezToCodingSeqDbIds(int entrezGene, String db) {
        List<String> seqIds = geneTable.getTranscriptIds(entrezGene);
        if (seqIds.isEmpty()) {
            log.debug("gene ", entrezGene, " is not valid or has no coding seq available");
        }
        return inDatabase(seqIds, db);
    }

    private static List<String> inDatabase(List<String> currentIds, String db) {
        switch (db) {
            case Configuration.REFSEQ_DB:
                return currentIds;
            case Configuration.OLD_REFSEQ_DB:
                return newToOldRefseqs(currentIds);
            default:
                throw new IllegalArgumentException("Unknown sequence database: " + db);
        }
    }

    /**
     * Alignments of a transcript on the genome. The UCSC tables have no accession versions, so the version is
     * stripped. Alignments on the minus strand are reverse complemented once, when they are cached.
     * @param refseqId transcript accession
     * @return alignments with the query on the plus strand, empty if there are none
     */
    public List<PslRecord> getRefseqPsls(String refseqId) {
        String qId = Utils.stripVersion(refseqId);
        Map<String, List<PslRecord>> cache = threadLocalPslCache.get();
        List<PslRecord> psls = cache.get(qId);
        if (psls == null) {
            List<PslRecord> stored = alignmentStore.getAlignments(qId);
            if (stored.isEmpty()) {
                log.warn("Could not find PSL for ", qId);
                return Collections.emptyList();
            }
            psls = new ArrayList<>(stored.size());
            for (PslRecord psl : stored) {
                psls.add(psl.getQueryStrand() == '-' ? psl.reverseComplement() : psl);
            }
            cache.put(qId, psls);
        }
        log.debug("Got mapping psl ", psls.get(0));
        return psls;
    }

    /**
     * Given a list of versioned accessions returns all their previous versions:
     * NM_000325.5 gives NM_000325.1 to NM_000325.4. Accessions without version are skipped.
     */
    public static List<String> newToOldRefseqs(List<String> accs) {
        List<String> oldAccs = new ArrayList<>();
        for (String newAcc : accs) {
            int version = Utils.getVersion(newAcc);
            if (version < 0) {
                log.debug("Accession ", newAcc, " has no version");
                continue;
            }
            String prefix = Utils.stripVersion(newAcc);
            for (int oldVersion = 1; oldVersion < version; oldVersion++) {
                oldAccs.add(prefix + "." + oldVersion);
            }
        }
        return oldAccs;
    }

    /**
     * @return Entrez ID as a number or null if it isn't a number
     */
    public static Integer parseEntrezId(String entrezGene) {
        try {
            return Integer.parseInt(entrezGene.trim());
        } catch (NumberFormatException e) {
            log.warn("Entrez gene ", entrezGene, " is not a number");
            return null;
        }
    }
}
