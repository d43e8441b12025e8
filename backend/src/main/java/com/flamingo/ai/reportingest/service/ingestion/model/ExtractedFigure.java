package com.flamingo.ai.reportingest.service.ingestion.model;

/**
 * Figure cropped from a page raster.
 *
 * @param imagePath saved crop, relative to the storage root
 * @param caption nearest caption text, empty when the page has none
 * @param index 1-based position among the page's accepted figure candidates
 */
public record ExtractedFigure(
    int pageNumber,
    BoundingBox bbox,
    byte[] imageBytes,
    String imagePath,
    String caption,
    int index) {}
