package com.photomosaic.service;

import com.photomosaic.model.MosaicParameters;
import com.photomosaic.model.MosaicResult;
import com.photomosaic.model.MosaicStats;
import com.photomosaic.model.PhotoRecord;
import com.photomosaic.model.TileMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills the mosaic grid with tiles.
 *
 * Cells are visited column by column (x outer, y inner). The visiting order
 * decides which cell gets a contested photo first, so changing it changes
 * the output.
 */
@Service
public class MosaicAssembler {

    private static final Logger log = LoggerFactory.getLogger(MosaicAssembler.class);

    private final BrightnessAnalyzer brightnessAnalyzer;
    private final TileMatcher tileMatcher;
    private final ImageStore imageStore;

    public MosaicAssembler(BrightnessAnalyzer brightnessAnalyzer, TileMatcher tileMatcher, ImageStore imageStore) {
        this.brightnessAnalyzer = brightnessAnalyzer;
        this.tileMatcher = tileMatcher;
        this.imageStore = imageStore;
    }

    /**
     * Build the mosaic of {@code motive} from {@code photos}.
     *
     * @param motive     image whose brightness pattern is reproduced
     * @param photos     tile candidates, in tie-breaking order
     * @param parameters grid layout and matching rules
     * @return the canvas and match statistics
     * @throws IOException if a tile cannot be read
     * @throws IllegalStateException if reuse is disabled and the photos run out
     */
    public MosaicResult assemble(BufferedImage motive, List<PhotoRecord> photos,
                                 MosaicParameters parameters) throws IOException {
        int src = parameters.tileSizeSource();
        int tgt = parameters.tileSizeTarget();
        BufferedImage canvas = imageStore.createCanvas(parameters.gridColumns() * tgt, parameters.gridRows() * tgt);
        UsageTracker usedTiles = new UsageTracker();
        Map<PhotoRecord, BufferedImage> tiles = new IdentityHashMap<>();
        List<PhotoRecord> remainingPhotos = new ArrayList<>(photos);

        log.info("Creating new image. using {} photos", photos.size());
        int hits = 0;
        int bigMisses = 0;
        int relaxed = 0;

        for (int x = 0; x < parameters.gridColumns(); x++) {
            for (int y = 0; y < parameters.gridRows(); y++) {
                int avgBright = brightnessAnalyzer.brightness(motive, x * src, y * src, (x + 1) * src, (y + 1) * src);
                if (remainingPhotos.isEmpty()) {
                    throw new IllegalStateException("Ran out of photos at cell (" + x + ", " + y + ") after "
                        + usedTiles.size() + " tiles; allow reuse or add photos");
                }

                TileMatch match = tileMatcher.match(remainingPhotos, avgBright, usedTiles,
                    parameters.proximityRadius(), x, y);
                PhotoRecord best = match.photo();
                if (!parameters.reuseAllowed()) {
                    removeByIdentity(remainingPhotos, best);
                }

                int found = best.averageBrightness();
                log.debug("Searching brightness {} \t found {}", avgBright, found);
                if (avgBright == found) {
                    hits++;
                }
                if (Math.abs(avgBright - found) > parameters.bigMissThreshold()) {
                    log.debug("Big miss: {} found {}", avgBright, found);
                    bigMisses++;
                }
                if (match.constraintRelaxed()) {
                    relaxed++;
                }

                imageStore.compositeAt(canvas, tile(tiles, best), x * tgt, y * tgt);
                usedTiles.assign(x, y, best);
            }
        }

        MosaicStats stats = new MosaicStats(parameters.cellCount(), hits, bigMisses, relaxed);
        return new MosaicResult(canvas, stats);
    }

    private BufferedImage tile(Map<PhotoRecord, BufferedImage> tiles, PhotoRecord photo) throws IOException {
        BufferedImage image = tiles.get(photo);
        if (image == null) {
            image = imageStore.loadRaster(photo.derived());
            tiles.put(photo, image);
        }
        return image;
    }

    private static void removeByIdentity(List<PhotoRecord> photos, PhotoRecord photo) {
        for (int i = 0; i < photos.size(); i++) {
            if (photos.get(i) == photo) {
                photos.remove(i);
                return;
            }
        }
    }
}
