package com.astrazeneca.varfinder.modules;

import com.astrazeneca.varfinder.data.BedRecord;
import com.astrazeneca.varfinder.data.PslRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maps an interval of the query sequence of an alignment to the target sequence, block by block.
 * Parts of the interval that fall into gaps of the alignment are lost.
 */
public class PslMapper {

    /**
     * @param psl alignment
     * @param start start on the query, 0-based, counted on the query strand
     * @param end end on the query, exclusive
     * @param name name of the BED feature
     * @return feature on the target plus strand or null if the interval doesn't overlap any block
     */
    public BedRecord mapQuery(PslRecord psl, int start, int end, String name) {
        PslRecord alignment = psl.getQueryStrand() == '-' ? psl.reverseComplement() : psl;
        boolean targetMinus = alignment.getTargetStrand() == '-';

        List<int[]> pieces = new ArrayList<>();
        for (int i = 0; i < alignment.getBlockCount(); i++) {
            int qBlockStart = alignment.getQStart(i);
            int blockSize = alignment.getBlockSize(i);
            int overlapStart = Math.max(start, qBlockStart);
            int overlapEnd = Math.min(end, qBlockStart + blockSize);
            if (overlapStart >= overlapEnd) {
                continue;
            }
            int tStart = alignment.getTStart(i) + (overlapStart - qBlockStart);
            int tEnd = tStart + (overlapEnd - overlapStart);
            if (targetMinus) {
                pieces.add(new int[]{alignment.tSize - tEnd, alignment.tSize - tStart});
            } else {
                pieces.add(new int[]{tStart, tEnd});
            }
        }
        if (pieces.isEmpty()) {
            return null;
        }
        if (targetMinus) {
            // blocks were visited in reverse genome order
            Collections.reverse(pieces);
        }

        int chromStart = pieces.get(0)[0];
        int chromEnd = pieces.get(pieces.size() - 1)[1];
        int[] blockSizes = new int[pieces.size()];
        int[] blockStarts = new int[pieces.size()];
        for (int i = 0; i < pieces.size(); i++) {
            blockSizes[i] = pieces.get(i)[1] - pieces.get(i)[0];
            blockStarts[i] = pieces.get(i)[0] - chromStart;
        }
        char strand = alignment.getQueryStrand() == alignment.getTargetStrand() ? '+' : '-';
        return new BedRecord(alignment.tName, chromStart, chromEnd, name, BedRecord.DEFAULT_SCORE, strand,
                chromStart, chromEnd, BedRecord.DEFAULT_ITEM_RGB, blockSizes, blockStarts, null);
    }
}
