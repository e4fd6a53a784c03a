package com.photomosaic.model;

import java.util.Map;

/**
 * Brightness distribution of a prepared photo collection.
 *
 * @param photoCount number of records in the collection
 * @param histogram  photo count per brightness value, ordered by brightness,
 *                   containing only values with at least one photo
 */
public record CollectionSummary(int photoCount, Map<Integer, Integer> histogram) {

    public int countAt(int brightness) {
        return histogram.getOrDefault(brightness, 0);
    }
}
