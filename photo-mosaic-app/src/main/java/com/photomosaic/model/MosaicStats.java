package com.photomosaic.model;

/**
 * Match quality of a finished mosaic.
 *
 * @param cells          number of grid cells filled
 * @param hits           cells whose tile matched the target brightness exactly
 * @param bigMisses      cells whose tile missed the target by more than the threshold
 * @param relaxedMatches cells filled after dropping the proximity constraint
 */
public record MosaicStats(int cells, int hits, int bigMisses, int relaxedMatches) {

    public int nonHits() {
        return cells - hits;
    }
}
