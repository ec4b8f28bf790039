package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.Utils;
import com.astrazeneca.varfinder.exception.ReferenceDataException;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Protein and transcript sequences from a FASTA file, with the protein to transcript links and CDS starts
 * from a table with the columns refProt, refSeq and cdsStart. The CDS start is 1-based in the file.
 */
public class FastaSequenceStore implements SequenceStore {
    private static final Log log = Log.getInstance(FastaSequenceStore.class);

    static final String[] COLUMNS = {"refProt", "refSeq", "cdsStart"};

    private final Map<String, String> sequences = new HashMap<>();
    private final Map<String, String> protToTranscript = new HashMap<>();
    private final Map<String, String> unversionedProtToTranscript = new HashMap<>();
    private final Map<String, Integer> cdsStarts = new HashMap<>();

    public void addSequence(String seqId, String sequence) {
        sequences.put(seqId, sequence);
    }

    /**
     * @param protId protein accession
     * @param transcriptId transcript accession
     * @param cdsStart 0-based CDS start on the transcript
     */
    public void addTranscript(String protId, String transcriptId, int cdsStart) {
        protToTranscript.put(protId, transcriptId);
        unversionedProtToTranscript.put(Utils.stripVersion(protId), transcriptId);
        cdsStarts.put(transcriptId, cdsStart);
    }

    /**
     * Reads the sequences and the transcript table.
     * @param fasta FASTA file, record names are the accessions
     * @param transcriptInfo table of refProt, refSeq and 1-based cdsStart
     * @return loaded store
     * @throws ReferenceDataException if a file can't be read
     */
    public static FastaSequenceStore load(String fasta, String transcriptInfo) {
        FastaSequenceStore store = new FastaSequenceStore();
        FastaSequenceFile fastaFile = null;
        try {
            fastaFile = new FastaSequenceFile(new File(fasta), true);
            ReferenceSequence sequence;
            while ((sequence = fastaFile.nextSequence()) != null) {
                store.addSequence(sequence.getName(), sequence.getBaseString());
            }
        } catch (SAMException e) {
            throw new ReferenceDataException(fasta, e.getMessage(), e);
        } finally {
            CloserUtil.close(fastaFile);
        }
        log.info("Loaded ", store.sequences.size(), " sequences from ", fasta);

        try (BufferedReader reader = new BufferedReader(new FileReader(transcriptInfo))) {
            TabularFile file = TabularFile.read(reader);
            List<String> missing = file.missingColumns(COLUMNS);
            if (!missing.isEmpty()) {
                throw new ReferenceDataException(transcriptInfo, "missing columns " + missing);
            }
            for (Map<String, String> row : file.rows) {
                try {
                    // 1-based in the file
                    int cdsStart = Integer.parseInt(row.get("cdsStart").trim()) - 1;
                    store.addTranscript(row.get("refProt"), row.get("refSeq"), cdsStart);
                } catch (NumberFormatException e) {
                    throw new ReferenceDataException(transcriptInfo, "wrong CDS start " + row.get("cdsStart"), e);
                }
            }
        } catch (IOException e) {
            throw new ReferenceDataException(transcriptInfo, e.getMessage(), e);
        }
        log.info("Loaded ", store.cdsStarts.size(), " transcripts from ", transcriptInfo);
        return store;
    }

    @Override
    public String getSeq(String seqId) {
        return sequences.get(seqId);
    }

    /**
     * Older versions of a protein are linked to the transcript of the current version.
     */
    @Override
    public String getTranscriptId(String protId) {
        String transcriptId = protToTranscript.get(protId);
        if (transcriptId == null) {
            transcriptId = unversionedProtToTranscript.get(Utils.stripVersion(protId));
        }
        return transcriptId;
    }

    @Override
    public Integer getCdsStart(String transcriptId) {
        return cdsStarts.get(transcriptId);
    }
}
