package ca.gc.cra.helio.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"schema=RAW", "sourceUrl=https://h/?a=b", "schema=COMPOSITE"});

    assertEquals(List.of("schema", "sourceUrl"), List.copyOf(map.keySet()));
    assertEquals("COMPOSITE", map.get("schema"));
    assertEquals("https://h/?a=b", map.get("sourceUrl"));
  }

  @Test
  void emptyValueClearsSetting() {
    assertEquals("", CliArgsParser.toMap(new String[] {"timestampOut="}).get("timestampOut"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"channels"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=9"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9x=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"out=a\u0007b"}));
  }
}
