package com.photomosaic.model;

public record GridCell(int col, int row) {}
