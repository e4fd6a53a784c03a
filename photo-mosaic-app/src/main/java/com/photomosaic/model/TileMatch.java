package com.photomosaic.model;

/**
 * Outcome of matching one grid cell.
 *
 * @param photo             the chosen tile
 * @param constraintRelaxed true when every candidate was used nearby and the
 *                          proximity constraint had to be dropped for this cell
 */
public record TileMatch(PhotoRecord photo, boolean constraintRelaxed) {}
