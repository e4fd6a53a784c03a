package com.photomosaic.model;

import com.photomosaic.config.MosaicConfig;

/**
 * Grid layout and matching rules for one mosaic run.
 *
 * @param gridColumns      tiles per row
 * @param gridRows         tiles per column
 * @param tileSizeSource   edge length of a cell on the motive, in motive pixels
 * @param tileSizeTarget   edge length of a tile on the canvas
 * @param proximityRadius  Chebyshev radius within which a photo is not reused
 * @param reuseAllowed     whether a photo may fill more than one cell
 * @param bigMissThreshold brightness delta above which a match counts as a big miss
 */
public record MosaicParameters(
    int gridColumns,
    int gridRows,
    int tileSizeSource,
    int tileSizeTarget,
    int proximityRadius,
    boolean reuseAllowed,
    int bigMissThreshold
) {

    public MosaicParameters {
        if (gridColumns <= 0 || gridRows <= 0) {
            throw new IllegalArgumentException("Grid must not be empty: " + gridColumns + "x" + gridRows);
        }
        if (tileSizeSource <= 0) {
            throw new IllegalArgumentException("Motive too small for " + gridColumns + " tiles per row");
        }
        if (tileSizeTarget <= 0) {
            throw new IllegalArgumentException("Target tile size must be positive: " + tileSizeTarget);
        }
        if (proximityRadius < 0) {
            throw new IllegalArgumentException("Search radius must not be negative: " + proximityRadius);
        }
    }

    /**
     * Derive the grid for a motive of the given size. The canvas keeps the
     * motive's aspect ratio at the configured target width.
     */
    public static MosaicParameters forMotive(int motiveWidth, int motiveHeight, MosaicConfig config) {
        int columns = config.getTilesPerRow();
        if (columns <= 0) {
            throw new IllegalArgumentException("Tiles per row must be positive: " + columns);
        }
        int tileSizeTarget = config.getConvertedImageWidth();
        int tileSizeSource = motiveWidth / columns;
        if (tileSizeTarget <= 0 || tileSizeSource <= 0) {
            throw new IllegalArgumentException("Tile size is zero for " + columns + " tiles per row "
                + "(target width " + config.getTargetWidth() + ", motive width " + motiveWidth + ")");
        }
        long targetHeight = (long) config.getTargetWidth() * motiveHeight / motiveWidth;
        // Rounding can make the canvas ask for one row more than the motive holds
        int rows = (int) Math.min(targetHeight / tileSizeTarget, motiveHeight / tileSizeSource);

        return new MosaicParameters(columns, rows, tileSizeSource, tileSizeTarget,
            config.getSearchRadius(), config.isReusePhotos(), config.getBigMissThreshold());
    }

    public int cellCount() {
        return gridColumns * gridRows;
    }
}
