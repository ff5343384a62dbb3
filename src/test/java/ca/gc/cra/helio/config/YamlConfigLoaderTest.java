package ca.gc.cra.helio.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSectionsAndJoinsLists() throws IOException {
    Path yaml = tempDir.resolve("helio.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        acquire:
          schema: RAW
          channels: [9, 10, 11]
          maxConcurrency: 3
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "acquire").orElseThrow();

    assertEquals("none", map.get("metricsExporter"));
    assertEquals("RAW", map.get("schema"));
    assertEquals("9,10,11", map.get("channels"));
    assertEquals("3", map.get("maxConcurrency"));
  }

  @Test
  void nestedMapsAreFlattenedWithDots() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        inspect:
          extra:
            key: value
        """);

    assertEquals("value", YamlConfigLoader.load(yaml, "inspect").orElseThrow().get("extra.key"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "acquire").isPresent());
  }

  @Test
  void listsOfMapsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, """
        acquire:
          channels:
            - id: 9
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "acquire"));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - acquire:
            schema: RAW
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "acquire"));
  }
}
