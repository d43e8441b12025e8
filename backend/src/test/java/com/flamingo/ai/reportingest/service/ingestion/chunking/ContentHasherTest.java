package com.flamingo.ai.reportingest.service.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link ContentHasher}. */
class ContentHasherTest {

  @TempDir Path tempDir;

  @Test
  void shouldProduceLowerCaseSha256Hex() {
    assertThat(ContentHasher.hashText("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    assertThat(ContentHasher.hashText(""))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  void shouldHashFileBytes_likeTheirText() throws Exception {
    Path file = tempDir.resolve("report.pdf");
    Files.writeString(file, "abc", StandardCharsets.UTF_8);

    assertThat(ContentHasher.hashFile(file)).isEqualTo(ContentHasher.hashText("abc"));
  }
}
