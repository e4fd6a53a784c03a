package com.photomosaic.service;

import com.photomosaic.model.GridCell;
import com.photomosaic.model.PhotoRecord;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Which photo fills which grid cell during one mosaic run.
 *
 * Written only by the assembler; the matcher reads it to keep identical tiles apart.
 */
public class UsageTracker {

    private final Map<GridCell, PhotoRecord> usedTiles = new HashMap<>();

    /**
     * Whether {@code photo} fills any cell within {@code radius} of (x, y),
     * measured as Chebyshev distance so the neighbourhood is a square.
     */
    public boolean isUsedNearby(int radius, int x, int y, PhotoRecord photo) {
        long side = 2L * radius + 1;
        if (side > usedTiles.size() || side * side > usedTiles.size()) {
            // Fewer filled cells than cells in the neighbourhood
            for (Map.Entry<GridCell, PhotoRecord> entry : usedTiles.entrySet()) {
                GridCell cell = entry.getKey();
                if (entry.getValue() == photo
                        && Math.abs((long) cell.col() - x) <= radius
                        && Math.abs((long) cell.row() - y) <= radius) {
                    return true;
                }
            }
            return false;
        }

        for (int i = x - radius; i <= x + radius; i++) {
            for (int j = y - radius; j <= y + radius; j++) {
                if (usedTiles.get(new GridCell(i, j)) == photo) {
                    return true;
                }
            }
        }
        return false;
    }

    public Optional<PhotoRecord> recordAt(int x, int y) {
        return Optional.ofNullable(usedTiles.get(new GridCell(x, y)));
    }

    /**
     * Store that {@code photo} fills (x, y).
     *
     * @throws DuplicateAssignmentException if a different photo already fills the cell
     */
    public void assign(int x, int y, PhotoRecord photo) {
        PhotoRecord previous = usedTiles.putIfAbsent(new GridCell(x, y), photo);
        if (previous != null && previous != photo) {
            throw new DuplicateAssignmentException(x, y, previous, photo);
        }
    }

    public int size() {
        return usedTiles.size();
    }

    public static class DuplicateAssignmentException extends IllegalStateException {
        public DuplicateAssignmentException(int x, int y, PhotoRecord existing, PhotoRecord attempted) {
            super("Cell (" + x + ", " + y + ") already holds " + existing.derived()
                + ", refusing " + attempted.derived());
        }
    }
}
