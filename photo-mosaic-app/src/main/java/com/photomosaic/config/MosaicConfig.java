package com.photomosaic.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for a mosaic run.
 * Define values in application.yml under 'photomosaic'
 */
@Configuration
@ConfigurationProperties(prefix = "photomosaic")
public class MosaicConfig {

    private String canvasPath = "photos/canvas.png";
    private String motivePath = "photos/motive.jpg";
    private String motiveGreyPath = "photos/motive_grey.jpg";
    private String sourceDirectory = "photos/inputphotos";
    private String cacheDirectoryName = "tmp";
    private String greySuffix = "_grey.png";
    private String greyAltSuffix = "_grey_alt.png";
    private int targetWidth = 16384;
    private int tilesPerRow = 100;
    private boolean reusePhotos = true;
    private int searchRadius = 4;
    private int bigMissThreshold = 5;
    private Runner runner = new Runner();

    /**
     * Edge length of a converted photo, which is also the tile size on the canvas.
     */
    public int getConvertedImageWidth() {
        return targetWidth / tilesPerRow;
    }

    // Getters and setters for Spring Boot binding
    public String getCanvasPath() { return canvasPath; }
    public void setCanvasPath(String canvasPath) { this.canvasPath = canvasPath; }

    public String getMotivePath() { return motivePath; }
    public void setMotivePath(String motivePath) { this.motivePath = motivePath; }

    public String getMotiveGreyPath() { return motiveGreyPath; }
    public void setMotiveGreyPath(String motiveGreyPath) { this.motiveGreyPath = motiveGreyPath; }

    public String getSourceDirectory() { return sourceDirectory; }
    public void setSourceDirectory(String sourceDirectory) { this.sourceDirectory = sourceDirectory; }

    public String getCacheDirectoryName() { return cacheDirectoryName; }
    public void setCacheDirectoryName(String cacheDirectoryName) { this.cacheDirectoryName = cacheDirectoryName; }

    public String getGreySuffix() { return greySuffix; }
    public void setGreySuffix(String greySuffix) { this.greySuffix = greySuffix; }

    public String getGreyAltSuffix() { return greyAltSuffix; }
    public void setGreyAltSuffix(String greyAltSuffix) { this.greyAltSuffix = greyAltSuffix; }

    public int getTargetWidth() { return targetWidth; }
    public void setTargetWidth(int targetWidth) { this.targetWidth = targetWidth; }

    public int getTilesPerRow() { return tilesPerRow; }
    public void setTilesPerRow(int tilesPerRow) { this.tilesPerRow = tilesPerRow; }

    public boolean isReusePhotos() { return reusePhotos; }
    public void setReusePhotos(boolean reusePhotos) { this.reusePhotos = reusePhotos; }

    public int getSearchRadius() { return searchRadius; }
    public void setSearchRadius(int searchRadius) { this.searchRadius = searchRadius; }

    public int getBigMissThreshold() { return bigMissThreshold; }
    public void setBigMissThreshold(int bigMissThreshold) { this.bigMissThreshold = bigMissThreshold; }

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class Runner {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
