package com.photomosaic.service;

import com.photomosaic.model.PhotoRecord;
import com.photomosaic.model.TileMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the photo whose brightness is closest to a grid cell's target.
 *
 * The search first skips every photo already used within the search radius.
 * Only when that leaves nothing does a second pass consider the whole list,
 * so a small collection can still fill a large grid.
 * Ties go to the photo that comes first in the list.
 */
@Service
public class TileMatcher {

    private static final Logger log = LoggerFactory.getLogger(TileMatcher.class);

    public PhotoRecord bestMatch(List<PhotoRecord> candidates, int brightness,
                                 UsageTracker usedTiles, int searchRadius, int x, int y) {
        return match(candidates, brightness, usedTiles, searchRadius, x, y).photo();
    }

    /**
     * Find the best photo for cell (x, y).
     *
     * @param candidates   photos to choose from, in tie-breaking order
     * @param brightness   target brightness of the cell
     * @param usedTiles    cells filled so far
     * @param searchRadius radius within which a photo must not repeat
     * @return the chosen photo and whether the proximity constraint was dropped
     * @throws IllegalArgumentException if there are no candidates
     */
    public TileMatch match(List<PhotoRecord> candidates, int brightness,
                           UsageTracker usedTiles, int searchRadius, int x, int y) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No photos to match brightness " + brightness
                + " at (" + x + ", " + y + ")");
        }

        PhotoRecord best = null;
        for (PhotoRecord candidate : candidates) {
            if (usedTiles.isUsedNearby(searchRadius, x, y, candidate)) {
                continue;
            }
            best = closer(best, candidate, brightness);
        }
        if (best != null) {
            return new TileMatch(best, false);
        }

        log.debug("All {} photos used within radius {} of ({}, {}), relaxing constraint",
            candidates.size(), searchRadius, x, y);
        for (PhotoRecord candidate : candidates) {
            best = closer(best, candidate, brightness);
        }
        return new TileMatch(best, true);
    }

    private static PhotoRecord closer(PhotoRecord best, PhotoRecord candidate, int brightness) {
        if (best == null) {
            return candidate;
        }
        int bestDelta = Math.abs(best.averageBrightness() - brightness);
        int candidateDelta = Math.abs(candidate.averageBrightness() - brightness);
        return candidateDelta < bestDelta ? candidate : best;
    }
}
