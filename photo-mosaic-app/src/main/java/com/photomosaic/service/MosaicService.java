package com.photomosaic.service;

import com.photomosaic.config.MosaicConfig;
import com.photomosaic.model.MosaicParameters;
import com.photomosaic.model.MosaicResult;
import com.photomosaic.model.MosaicStats;
import com.photomosaic.model.PhotoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Creates a photo mosaic from the configured motive and photo directory.
 */
@Service
public class MosaicService {

    private static final Logger log = LoggerFactory.getLogger(MosaicService.class);

    private final ImageStore imageStore;
    private final PhotoCatalog photoCatalog;
    private final MosaicAssembler mosaicAssembler;
    private final MosaicConfig config;

    public MosaicService(ImageStore imageStore, PhotoCatalog photoCatalog,
                         MosaicAssembler mosaicAssembler, MosaicConfig config) {
        this.imageStore = imageStore;
        this.photoCatalog = photoCatalog;
        this.mosaicAssembler = mosaicAssembler;
        this.config = config;
    }

    /**
     * Run the whole pipeline and write the canvas.
     *
     * @return the written canvas and its match statistics
     * @throws IOException if the motive, a photo or the canvas cannot be read or written
     */
    public MosaicResult createMosaic() throws IOException {
        BufferedImage motive = imageStore.toGreyscale(imageStore.loadRaster(Path.of(config.getMotivePath())));
        imageStore.saveRaster(Path.of(config.getMotiveGreyPath()), motive);

        List<PhotoRecord> photos = photoCatalog.prepare(Path.of(config.getSourceDirectory()));
        if (photos.isEmpty()) {
            throw new IllegalStateException("No photos found in " + config.getSourceDirectory());
        }

        MosaicParameters parameters = MosaicParameters.forMotive(motive.getWidth(), motive.getHeight(), config);
        log.info("Grid {}x{}, tile size {} px on motive, {} px on canvas",
            parameters.gridColumns(), parameters.gridRows(), parameters.tileSizeSource(), parameters.tileSizeTarget());

        MosaicResult result = mosaicAssembler.assemble(motive, photos, parameters);
        imageStore.saveRaster(Path.of(config.getCanvasPath()), result.canvas());

        photoCatalog.summarize(photos);
        MosaicStats stats = result.stats();
        log.info("In total matched {} cells. Hits: {}\t Big misses: {}\t Relaxed: {}",
            stats.cells(), stats.hits(), stats.bigMisses(), stats.relaxedMatches());
        return result;
    }
}
