package com.astrazeneca.varfinder.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BED12 feature of a variant on the genome. Block starts are relative to start. The description is the
 * name of the RNA variant the feature was projected from and is not part of the BED columns.
 */
public class BedRecord {
    public static final int DEFAULT_SCORE = 1;
    public static final String DEFAULT_ITEM_RGB = "0";

    public final String chrom;
    public final int start;
    public final int end;
    public final String name;
    public final int score;
    public final char strand;
    public final int thickStart;
    public final int thickEnd;
    public final String itemRgb;
    private final int[] blockSizes;
    private final int[] blockStarts;
    public final String description;

    public BedRecord(String chrom, int start, int end, String name, int score, char strand,
                     int thickStart, int thickEnd, String itemRgb,
                     int[] blockSizes, int[] blockStarts, String description) {
        this.chrom = chrom;
        this.start = start;
        this.end = end;
        this.name = name;
        this.score = score;
        this.strand = strand;
        this.thickStart = thickStart;
        this.thickEnd = thickEnd;
        this.itemRgb = itemRgb;
        this.blockSizes = blockSizes.clone();
        this.blockStarts = blockStarts.clone();
        this.description = description;
    }

    public int getBlockCount() {
        return blockSizes.length;
    }

    public int getBlockSize(int i) {
        return blockSizes[i];
    }

    public int getBlockStart(int i) {
        return blockStarts[i];
    }

    /**
     * Same feature moved by offset bases. Blocks are relative to start and don't change.
     */
    public BedRecord shift(int offset) {
        return new BedRecord(chrom, start + offset, end + offset, name, score, strand,
                thickStart + offset, thickEnd + offset, itemRgb, blockSizes, blockStarts, description);
    }

    public BedRecord withDescription(String newDescription) {
        return new BedRecord(chrom, start, end, name, score, strand,
                thickStart, thickEnd, itemRgb, blockSizes, blockStarts, newDescription);
    }

    public GenomeLocus getLocus() {
        return new GenomeLocus(chrom, start, end);
    }

    /**
     * @return the twelve BED columns
     */
    public List<String> getFields() {
        List<String> fields = new ArrayList<>(12);
        fields.add(chrom);
        fields.add(String.valueOf(start));
        fields.add(String.valueOf(end));
        fields.add(name);
        fields.add(String.valueOf(score));
        fields.add(String.valueOf(strand));
        fields.add(String.valueOf(thickStart));
        fields.add(String.valueOf(thickEnd));
        fields.add(itemRgb);
        fields.add(String.valueOf(blockSizes.length));
        fields.add(joinList(blockSizes));
        fields.add(joinList(blockStarts));
        return fields;
    }

    private static String joinList(int[] values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(",");
            }
            sb.append(values[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BedRecord that = (BedRecord) o;
        return getFields().equals(that.getFields()) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getFields(), description);
    }

    @Override
    public String toString() {
        return String.join("\t", getFields());
    }
}
