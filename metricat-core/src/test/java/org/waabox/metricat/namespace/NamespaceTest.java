package org.waabox.metricat.namespace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Namespace}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NamespaceTest {

  @Test
  void whenGettingKey_givenSegments_shouldJoinThemWithPeriods() {
    final Namespace ns = Namespace.of("intel", "mock", "foo");

    assertEquals("intel.mock.foo", ns.key());
    assertEquals(3, ns.size());
    assertEquals("mock", ns.segment(1));
  }

  @Test
  void whenRebuildingFromKey_givenKeyOfNamespace_shouldReproduceIt() {
    final Namespace ns = Namespace.of("intel", "mock", "*", "baz");

    final Namespace rebuilt = Namespace.fromKey(ns.key());

    assertEquals(ns, rebuilt);
    assertEquals(ns.hashCode(), rebuilt.hashCode());
    assertEquals(List.of("intel", "mock", "*", "baz"), rebuilt.segments());
  }

  @Test
  void whenRebuildingFromKey_givenEmptyKey_shouldReturnRoot() {
    assertSame(Namespace.root(), Namespace.fromKey(""));
    assertEquals("", Namespace.root().key());
  }

  @Test
  void whenRebuildingFromKey_givenEmptySegment_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> Namespace.fromKey("intel..foo"));
  }

  @Test
  void whenParsing_givenSlashPath_shouldIgnoreEmptyPieces() {
    assertEquals(Namespace.of("intel", "mock"),
        Namespace.parse("/intel/mock/"));
    assertEquals(Namespace.of("intel", "mock"),
        Namespace.parse("intel//mock"));
    assertTrue(Namespace.parse("/").isRoot());
    assertTrue(Namespace.parse("").isRoot());
  }

  @Test
  void whenPrinting_givenNamespace_shouldRenderSlashPath() {
    assertEquals("/intel/mock/foo",
        Namespace.of("intel", "mock", "foo").toString());
    assertEquals("/", Namespace.root().toString());
  }

  @Test
  void whenCreating_givenEmptySegment_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> Namespace.of("intel", ""));
    assertThrows(NullPointerException.class,
        () -> Namespace.of("intel", null));
  }

  @Test
  void whenCheckingQuery_givenWildcardOrTuple_shouldDetectIt() {
    assertTrue(Namespace.parse("/intel/mock/*").isQuery());
    assertTrue(Namespace.of("intel", "(foo|bar)").isQuery());
    assertTrue(Namespace.of("intel", "(foo;bar)").isQuery());
    assertFalse(Namespace.of("intel", "mock", "foo").isQuery());
    assertFalse(Namespace.isTuple("()"));
    assertFalse(Namespace.isTuple("(foo)"));
  }
}
