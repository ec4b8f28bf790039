package com.astrazeneca.varfinder.data;

/**
 * One line of a PSL alignment file (transcript on genome).
 * <p>
 * The strand column holds the query strand and, optionally, the target strand: "+", "-", "+-" and so on.
 * Block starts on a minus strand are counted from the end of that sequence.
 */
public class PslRecord {
    public static final int COLUMN_COUNT = 21;

    public final int match;
    public final int misMatch;
    public final int repMatch;
    public final int nCount;
    public final int qNumInsert;
    public final int qBaseInsert;
    public final int tNumInsert;
    public final int tBaseInsert;
    public final String strand;
    public final String qName;
    public final int qSize;
    public final int qStart;
    public final int qEnd;
    public final String tName;
    public final int tSize;
    public final int tStart;
    public final int tEnd;
    private final int[] blockSizes;
    private final int[] qStarts;
    private final int[] tStarts;

    public PslRecord(int match, int misMatch, int repMatch, int nCount,
                     int qNumInsert, int qBaseInsert, int tNumInsert, int tBaseInsert,
                     String strand,
                     String qName, int qSize, int qStart, int qEnd,
                     String tName, int tSize, int tStart, int tEnd,
                     int[] blockSizes, int[] qStarts, int[] tStarts) {
        if (blockSizes.length != qStarts.length || blockSizes.length != tStarts.length) {
            throw new IllegalArgumentException("Different number of block sizes and starts in alignment of " + qName);
        }
        this.match = match;
        this.misMatch = misMatch;
        this.repMatch = repMatch;
        this.nCount = nCount;
        this.qNumInsert = qNumInsert;
        this.qBaseInsert = qBaseInsert;
        this.tNumInsert = tNumInsert;
        this.tBaseInsert = tBaseInsert;
        this.strand = strand;
        this.qName = qName;
        this.qSize = qSize;
        this.qStart = qStart;
        this.qEnd = qEnd;
        this.tName = tName;
        this.tSize = tSize;
        this.tStart = tStart;
        this.tEnd = tEnd;
        this.blockSizes = blockSizes.clone();
        this.qStarts = qStarts.clone();
        this.tStarts = tStarts.clone();
    }

    /**
     * Parses a tab separated PSL line.
     * @param line line of a PSL file, without header
     * @return parsed record
     * @throws IllegalArgumentException if the line has less than 21 columns or numbers can't be parsed
     */
    public static PslRecord parse(String line) {
        String[] tokens = line.split("\t");
        if (tokens.length < COLUMN_COUNT) {
            throw new IllegalArgumentException("Invalid psl entry. Less than " + COLUMN_COUNT + " columns: " + line);
        }
        int blockCount = Integer.parseInt(tokens[17]);
        int[] blockSizes = parseList(tokens[18], blockCount);
        int[] qStarts = parseList(tokens[19], blockCount);
        int[] tStarts = parseList(tokens[20], blockCount);
        return new PslRecord(
                Integer.parseInt(tokens[0]),
                Integer.parseInt(tokens[1]),
                Integer.parseInt(tokens[2]),
                Integer.parseInt(tokens[3]),
                Integer.parseInt(tokens[4]),
                Integer.parseInt(tokens[5]),
                Integer.parseInt(tokens[6]),
                Integer.parseInt(tokens[7]),
                tokens[8],
                tokens[9],
                Integer.parseInt(tokens[10]),
                Integer.parseInt(tokens[11]),
                Integer.parseInt(tokens[12]),
                tokens[13],
                Integer.parseInt(tokens[14]),
                Integer.parseInt(tokens[15]),
                Integer.parseInt(tokens[16]),
                blockSizes, qStarts, tStarts);
    }

    private static int[] parseList(String column, int expectedCount) {
        String[] parts = column.split(",");
        if (parts.length != expectedCount) {
            throw new IllegalArgumentException("Expected " + expectedCount + " values, found: " + column);
        }
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = Integer.parseInt(parts[i].trim());
        }
        return values;
    }

    public int getBlockCount() {
        return blockSizes.length;
    }

    public int getBlockSize(int i) {
        return blockSizes[i];
    }

    public int getQStart(int i) {
        return qStarts[i];
    }

    public int getTStart(int i) {
        return tStarts[i];
    }

    public char getQueryStrand() {
        return strand.charAt(0);
    }

    /**
     * @return strand of the target, '+' if the strand column has only the query strand
     */
    public char getTargetStrand() {
        return strand.length() > 1 ? strand.charAt(1) : '+';
    }

    /**
     * Same alignment seen from the other strand of both sequences: the blocks are reversed and their
     * starts are counted from the opposite ends. Reverse complementing a "-" alignment gives a "+-"
     * alignment whose query starts follow the transcript.
     */
    public PslRecord reverseComplement() {
        int count = blockSizes.length;
        int[] newSizes = new int[count];
        int[] newQStarts = new int[count];
        int[] newTStarts = new int[count];
        for (int i = 0; i < count; i++) {
            int j = count - 1 - i;
            newSizes[i] = blockSizes[j];
            newQStarts[i] = qSize - (qStarts[j] + blockSizes[j]);
            newTStarts[i] = tSize - (tStarts[j] + blockSizes[j]);
        }
        String newStrand = String.valueOf(opposite(getQueryStrand())) + opposite(getTargetStrand());
        return new PslRecord(match, misMatch, repMatch, nCount, qNumInsert, qBaseInsert, tNumInsert, tBaseInsert,
                newStrand, qName, qSize, qStart, qEnd, tName, tSize, tStart, tEnd, newSizes, newQStarts, newTStarts);
    }

    private static char opposite(char strand) {
        return strand == '-' ? '+' : '-';
    }

    /**
     * @return the record as a tab separated PSL line
     */
    public String getEntryString() {
        StringBuilder sb = new StringBuilder(256);
        sb.append(match).append("\t");
        sb.append(misMatch).append("\t");
        sb.append(repMatch).append("\t");
        sb.append(nCount).append("\t");
        sb.append(qNumInsert).append("\t");
        sb.append(qBaseInsert).append("\t");
        sb.append(tNumInsert).append("\t");
        sb.append(tBaseInsert).append("\t");
        sb.append(strand).append("\t");
        sb.append(qName).append("\t");
        sb.append(qSize).append("\t");
        sb.append(qStart).append("\t");
        sb.append(qEnd).append("\t");
        sb.append(tName).append("\t");
        sb.append(tSize).append("\t");
        sb.append(tStart).append("\t");
        sb.append(tEnd).append("\t");
        sb.append(blockSizes.length).append("\t");
        appendList(sb, blockSizes).append("\t");
        appendList(sb, qStarts).append("\t");
        appendList(sb, tStarts);
        return sb.toString();
    }

    private static StringBuilder appendList(StringBuilder sb, int[] values) {
        for (int value : values) {
            sb.append(value).append(",");
        }
        return sb;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getEntryString().equals(((PslRecord) o).getEntryString());
    }

    @Override
    public int hashCode() {
        return getEntryString().hashCode();
    }

    @Override
    public String toString() {
        return getEntryString();
    }
}
