package org.waabox.metricat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PluginKey}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PluginKeyTest {

  @Test
  void whenPrinting_givenKey_shouldJoinItsParts() {
    assertEquals("collector:mock:2",
        new PluginKey("collector", "mock", 2).toString());
  }

  @Test
  void whenParsing_givenPrintedKey_shouldReadItBack() {
    assertEquals(new PluginKey("publisher", "file", 3),
        PluginKey.parse("publisher:file:3"));
  }

  @Test
  void whenParsing_givenMalformedText_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> PluginKey.parse("collector:mock"));
    assertThrows(IllegalArgumentException.class,
        () -> PluginKey.parse("collector:mock:two"));
    assertThrows(IllegalArgumentException.class,
        () -> PluginKey.parse("::1"));
  }
}
