package com.photomosaic.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A candidate tile: one source photo and the greyscale raster derived from it.
 *
 * Records are compared by identity. A non-square source yields two records
 * sharing the same source path, and unrelated photos can share a brightness,
 * so value equality would make distinct tiles interchangeable.
 */
public final class PhotoRecord {

    private final Path source;
    private final Path derived;
    private final int averageBrightness;

    public PhotoRecord(Path source, Path derived, int averageBrightness) {
        if (averageBrightness < 0 || averageBrightness > 255) {
            throw new IllegalArgumentException("Brightness can't be " + averageBrightness);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.derived = Objects.requireNonNull(derived, "derived");
        this.averageBrightness = averageBrightness;
    }

    public Path source() {
        return source;
    }

    public Path derived() {
        return derived;
    }

    public int averageBrightness() {
        return averageBrightness;
    }

    @Override
    public String toString() {
        return "Brightness: " + averageBrightness + " \tpath: " + source + " \tgreyscale path: " + derived;
    }
}
