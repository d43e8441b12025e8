package com.flamingo.ai.reportingest.store;

import com.flamingo.ai.reportingest.domain.chunk.ChunkMetadata;

/** A stored chunk returned by similarity search. */
public record ChunkSearchHit(String text, ChunkMetadata metadata, double score) {}
