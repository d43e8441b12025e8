package com.flamingo.ai.reportingest.service.ingestion.chunking;

import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/** SHA-256 identities for chunks and source documents, as lower-case hex. */
public final class ContentHasher {

  private ContentHasher() {}

  public static String hashText(String text) {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }

  /** Document id: hash of the file's bytes, independent of its name or location. */
  public static String hashFile(Path file) throws IOException {
    return Files.asByteSource(file.toFile()).hash(Hashing.sha256()).toString();
  }
}
