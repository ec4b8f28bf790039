package com.astrazeneca.varfinder.resources;

import com.astrazeneca.varfinder.data.DocumentContext;
import com.astrazeneca.varfinder.data.Mention;
import com.astrazeneca.varfinder.exception.ReferenceDataException;
import htsjdk.samtools.util.Log;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

import static com.astrazeneca.varfinder.data.Patterns.GENE_MENTION;

/**
 * Reads documents from a tab separated file with the columns docId, entrezIds (comma separated), text and,
 * optionally, gene mentions written as entrezId:start-end, comma separated. Gene mentions are excluded from
 * variant matching.
 */
public class DocumentReader {
    private static final Log log = Log.getInstance(DocumentReader.class);

    public static final String GENE_MENTION_PATTERN_NAME = "gene";

    /**
     * @param path path to the documents file
     * @return documents in file order
     * @throws ReferenceDataException if the file can't be read or a line is malformed
     */
    public List<DocumentContext> read(String path) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            return read(reader, path);
        } catch (IOException e) {
            throw new ReferenceDataException(path, e.getMessage(), e);
        }
    }

    List<DocumentContext> read(BufferedReader reader, String source) throws IOException {
        List<DocumentContext> documents = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.startsWith("#") || line.trim().isEmpty()) {
                continue;
            }
            documents.add(parseLine(line, lineNumber, source));
        }
        log.info("Read ", documents.size(), " documents from ", source);
        return documents;
    }

    /**
     * @throws ReferenceDataException if the line has less than 3 columns or wrong gene mentions
     */
    static DocumentContext parseLine(String line, int lineNumber, String source) {
        String[] columns = line.split("\t", -1);
        if (columns.length < 3) {
            throw new ReferenceDataException(source, "less than 3 columns in line " + lineNumber);
        }
        String docId = columns[0];
        List<String> entrezGenes = new ArrayList<>();
        for (String gene : columns[1].split(",")) {
            if (!gene.trim().isEmpty()) {
                entrezGenes.add(gene.trim());
            }
        }
        String text = columns[2];

        Map<String, List<Mention>> geneMentions = new LinkedHashMap<>();
        Set<Integer> excludedPositions = new HashSet<>();
        if (columns.length > 3 && !columns[3].trim().isEmpty()) {
            for (String mention : columns[3].split(",")) {
                Matcher matcher = GENE_MENTION.matcher(mention.trim());
                if (!matcher.find()) {
                    throw new ReferenceDataException(source, "wrong gene mention " + mention + " in line " + lineNumber);
                }
                int start = Integer.parseInt(matcher.group(2));
                int end = Integer.parseInt(matcher.group(3));
                if (end < start || end > text.length()) {
                    throw new ReferenceDataException(source, "gene mention " + mention + " is outside of the text in line "
                            + lineNumber);
                }
                String gene = matcher.group(1);
                if (!geneMentions.containsKey(gene)) {
                    geneMentions.put(gene, new ArrayList<Mention>());
                }
                geneMentions.get(gene).add(new Mention(GENE_MENTION_PATTERN_NAME, start, end));
                for (int pos = start; pos < end; pos++) {
                    excludedPositions.add(pos);
                }
            }
        }
        return new DocumentContext(docId, text, entrezGenes, geneMentions, excludedPositions);
    }
}
