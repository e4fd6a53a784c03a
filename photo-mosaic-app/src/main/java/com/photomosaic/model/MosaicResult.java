package com.photomosaic.model;

import java.awt.image.BufferedImage;

public record MosaicResult(BufferedImage canvas, MosaicStats stats) {}
