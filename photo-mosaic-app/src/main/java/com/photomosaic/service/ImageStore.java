package com.photomosaic.service;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Image I/O and raster operations used to prepare photos and build the canvas.
 */
public interface ImageStore {

    /**
     * Read an image from disk.
     *
     * @throws IOException if the file is missing or not a readable image
     */
    BufferedImage loadRaster(Path path) throws IOException;

    /**
     * Width and height of an image file, read from its header without decoding the pixels.
     *
     * @throws IOException if the file is missing or not a readable image
     */
    Dimension dimensions(Path path) throws IOException;

    /**
     * Write an image to disk as PNG, creating parent directories as needed.
     */
    void saveRaster(Path path, BufferedImage image) throws IOException;

    /**
     * Resize so the longest side equals {@code longestSide}, keeping proportions.
     */
    BufferedImage resize(BufferedImage image, int longestSide) throws IOException;

    BufferedImage crop(BufferedImage image, int x, int y, int width, int height) throws IOException;

    BufferedImage toGreyscale(BufferedImage image);

    /**
     * Create a blank greyscale image to draw tiles on.
     */
    BufferedImage createCanvas(int width, int height);

    /**
     * Paint {@code image} onto {@code canvas} with its top left corner at (x, y),
     * replacing the pixels underneath.
     */
    void compositeAt(BufferedImage canvas, BufferedImage image, int x, int y);

    /**
     * Regular files in a directory, ordered by file name.
     */
    List<Path> listFiles(Path directory) throws IOException;

    boolean exists(Path path);
}
