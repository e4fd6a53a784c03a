package com.photomosaic.service;

import com.photomosaic.config.MosaicConfig;
import com.photomosaic.model.CollectionSummary;
import com.photomosaic.model.PhotoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a directory of photos into tile candidates.
 *
 * Every photo is converted to a greyscale square with the tile's edge length
 * and cached next to the sources, so later runs only read the converted files.
 * A non-square photo yields two tiles: the square at its start and the square
 * at its end along the longer side.
 */
@Service
public class PhotoCatalog {

    private static final Logger log = LoggerFactory.getLogger(PhotoCatalog.class);

    private final ImageStore imageStore;
    private final BrightnessAnalyzer brightnessAnalyzer;
    private final MosaicConfig config;

    public PhotoCatalog(ImageStore imageStore, BrightnessAnalyzer brightnessAnalyzer, MosaicConfig config) {
        this.imageStore = imageStore;
        this.brightnessAnalyzer = brightnessAnalyzer;
        this.config = config;
    }

    /**
     * Prepare tiles from every photo in {@code directory} using the configured tile size.
     */
    public List<PhotoRecord> prepare(Path directory) throws IOException {
        return prepare(directory, config.getConvertedImageWidth());
    }

    /**
     * Prepare tiles with edge length {@code tileSize} from every photo in {@code directory}.
     *
     * @return tile candidates in file name order
     * @throws IOException if a photo or a cached conversion cannot be read or written
     */
    public List<PhotoRecord> prepare(Path directory, int tileSize) throws IOException {
        Path cacheDirectory = directory.resolve(config.getCacheDirectoryName());
        List<PhotoRecord> records = new ArrayList<>();
        Set<String> cacheNames = new HashSet<>();

        for (Path file : imageStore.listFiles(directory)) {
            String fileName = file.getFileName().toString();
            if (!isSourcePhoto(fileName)) {
                continue;
            }

            String baseName = fileName.substring(0, fileName.lastIndexOf('.'));
            if (!cacheNames.add(baseName)) {
                // e.g. a.jpg and a.png would both be cached as a_grey.png
                log.warn("{} shares its name with another photo, caching it under its full file name", fileName);
                baseName = fileName;
                cacheNames.add(baseName);
            }
            Path greyPath = cacheDirectory.resolve(baseName + config.getGreySuffix());
            Path greyAltPath = cacheDirectory.resolve(baseName + config.getGreyAltSuffix());

            if (imageStore.exists(greyPath)) {
                if (imageStore.exists(greyAltPath)) {
                    records.add(loadRecord(file, greyPath));
                    records.add(loadRecord(file, greyAltPath));
                    continue;
                }
                Dimension size = imageStore.dimensions(file);
                if (size.width == size.height) {
                    records.add(loadRecord(file, greyPath));
                    continue;
                }
                log.debug("No cached alternate tile for {}, converting again", fileName);
            }

            BufferedImage image = imageStore.loadRaster(file);
            int width = image.getWidth();
            int height = image.getHeight();
            if (width == height) {
                records.add(createRecord(image, tileSize, file, greyPath));
            } else {
                // Not same proportions, create two tiles for this photo
                int dim = Math.min(width, height);
                records.add(createRecord(imageStore.crop(image, 0, 0, dim, dim), tileSize, file, greyPath));
                BufferedImage end = height < width
                    ? imageStore.crop(image, width - dim, 0, dim, dim)
                    : imageStore.crop(image, 0, height - dim, dim, dim);
                records.add(createRecord(end, tileSize, file, greyAltPath));
            }
        }

        log.info("Prepared {} tiles from {}", records.size(), directory);
        return records;
    }

    /**
     * Count photos per brightness value and log the distribution, which shows
     * the brightness ranges the collection lacks.
     */
    public CollectionSummary summarize(List<PhotoRecord> records) {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (PhotoRecord record : records) {
            histogram.merge(record.averageBrightness(), 1, Integer::sum);
        }

        log.info("Collection contains {} images.", records.size());
        histogram.forEach((brightness, count) ->
            log.info("brightness: {} -> {} photos.", brightness, count));
        return new CollectionSummary(records.size(), histogram);
    }

    private boolean isSourcePhoto(String fileName) {
        return fileName.contains(".")
            && !fileName.contains(config.getGreySuffix())
            && !fileName.contains(config.getGreyAltSuffix());
    }

    private PhotoRecord loadRecord(Path source, Path greyPath) throws IOException {
        return new PhotoRecord(source, greyPath, brightnessAnalyzer.brightness(imageStore.loadRaster(greyPath)));
    }

    private PhotoRecord createRecord(BufferedImage image, int tileSize, Path source, Path greyPath) throws IOException {
        BufferedImage converted = imageStore.resize(imageStore.toGreyscale(image), tileSize);
        imageStore.saveRaster(greyPath, converted);
        log.info("Converted and wrote {}", greyPath);
        return new PhotoRecord(source, greyPath, brightnessAnalyzer.brightness(converted));
    }
}
