package com.flamingo.ai.reportingest.service.ingestion.model;

/** Group of nearby vector paths, usually a chart drawn with PDF operators. */
public record DrawingCluster(BoundingBox bbox, int pathCount, boolean filled, boolean stroked) {}
