package com.flamingo.ai.reportingest.service.ingestion.model;

/** Placement of an embedded raster image on a page. */
public record ImageRegion(BoundingBox bbox, int pixelWidth, int pixelHeight) {}
