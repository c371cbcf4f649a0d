package ca.gc.cra.voncount.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void addExactReturnsSum() {
    assertEquals(42L, Numbers.addExact("bytes", 40L, 2L));
    assertEquals(Long.MAX_VALUE, Numbers.addExact("bytes", Long.MAX_VALUE - 1, 1L));
  }

  @Test
  void addExactRejectsOverflowNamingTheCounter() {
    ArithmeticException ex =
        assertThrows(ArithmeticException.class, () -> Numbers.addExact("ReadCounter", Long.MAX_VALUE, 1L));

    assertTrue(ex.getMessage().startsWith("ReadCounter overflowed"));
  }

  @Test
  void addExactRejectsNegativeDelta() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.addExact("WriteCounter", 3L, -5L));

    assertTrue(ex.getMessage().startsWith("WriteCounter cannot decrease"));
  }

  @Test
  void addExactDefaultsBlankNames() {
    ArithmeticException ex =
        assertThrows(ArithmeticException.class, () -> Numbers.addExact(" ", Long.MAX_VALUE, 5L));

    assertTrue(ex.getMessage().startsWith("count overflowed"));
  }
}
