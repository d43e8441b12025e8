package com.flamingo.ai.reportingest.service.ingestion.chunking;

/** Identity of the document being chunked. */
public record DocumentRef(String documentId, String sourceFile) {}
