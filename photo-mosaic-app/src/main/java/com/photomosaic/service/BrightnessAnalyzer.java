package com.photomosaic.service;

import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Average brightness of images and image regions.
 *
 * A pixel's brightness is the plain mean of its red, green and blue channels,
 * so the result is always in [0, 255].
 */
@Service
public class BrightnessAnalyzer {

    /**
     * Average brightness of a whole image.
     */
    public int brightness(BufferedImage image) {
        return brightness(image, 0, 0, image.getWidth(), image.getHeight());
    }

    /**
     * Average brightness of the half-open region [startX, stopX) x [startY, stopY).
     *
     * @param image  image to analyse
     * @param startX first column of the region
     * @param startY first row of the region
     * @param stopX  column after the last one of the region
     * @param stopY  row after the last one of the region
     * @return average brightness of the region, rounded down
     * @throws IllegalArgumentException if the region is empty
     */
    public int brightness(BufferedImage image, int startX, int startY, int stopX, int stopY) {
        if (stopX <= startX || stopY <= startY) {
            throw new IllegalArgumentException("Empty region [" + startX + "," + stopX + ") x ["
                + startY + "," + stopY + ")");
        }

        long sum = 0;
        for (int y = startY; y < stopY; y++) {
            for (int x = startX; x < stopX; x++) {
                sum += rgbToGrey(image.getRGB(x, y));
            }
        }
        long pixels = (long) (stopX - startX) * (stopY - startY);
        return (int) (sum / pixels);
    }

    static int rgbToGrey(int rgb) {
        int red = (rgb >> 16) & 0xff;
        int green = (rgb >> 8) & 0xff;
        int blue = rgb & 0xff;
        return (red + green + blue) / 3;
    }
}
