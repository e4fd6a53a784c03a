package com.photomosaic.service;

import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@link ImageStore} backed by ImageIO for file access and Thumbnailator for scaling.
 */
@Service
public class ThumbnailatorImageStore implements ImageStore {

    @Override
    public BufferedImage loadRaster(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image not found: " + path);
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unsupported or unreadable image: " + path);
        }
        return image;
    }

    @Override
    public Dimension dimensions(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image not found: " + path);
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new IOException("Unsupported or unreadable image: " + path);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    @Override
    public void saveRaster(Path path, BufferedImage image) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, "png", path.toFile())) {
            throw new IOException("No PNG writer for image type " + image.getType() + ": " + path);
        }
    }

    @Override
    public BufferedImage resize(BufferedImage image, int longestSide) throws IOException {
        return Thumbnails.of(image)
            .size(longestSide, longestSide)
            .keepAspectRatio(true)
            .asBufferedImage();
    }

    @Override
    public BufferedImage crop(BufferedImage image, int x, int y, int width, int height) throws IOException {
        return Thumbnails.of(image)
            .sourceRegion(x, y, width, height)
            .scale(1.0)
            .asBufferedImage();
    }

    @Override
    public BufferedImage toGreyscale(BufferedImage image) {
        BufferedImage copy = createCanvas(image.getWidth(), image.getHeight());
        compositeAt(copy, image, 0, 0);
        return copy;
    }

    @Override
    public BufferedImage createCanvas(int width, int height) {
        return new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    }

    @Override
    public void compositeAt(BufferedImage canvas, BufferedImage image, int x, int y) {
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(image, x, y, null);
        } finally {
            g.dispose();
        }
    }

    @Override
    public List<Path> listFiles(Path directory) throws IOException {
        try (Stream<Path> paths = Files.list(directory)) {
            return paths.filter(Files::isRegularFile)
                .sorted()
                .toList();
        }
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }
}
