package com.gentoro.metabasemcp.dashboard;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class IdAllocatorTest {

  @Test
  void startsAtMinusOneWithoutNegativeIds() {
    IdAllocator ids = IdAllocator.negativeBelow(List.of(12L, 40L));
    assertEquals(-1L, ids.next());
    assertEquals(-2L, ids.next());
    assertEquals(-3L, ids.next());
  }

  @Test
  void startsBelowExistingNegativeIds() {
    IdAllocator ids = IdAllocator.negativeBelow(List.of(5L, -1L, -7L, -3L));
    assertEquals(-8L, ids.next());
    assertEquals(-9L, ids.next());
  }

  @Test
  void emptyScopeAndNullIds() {
    assertEquals(-1L, IdAllocator.negativeBelow(List.of()).next());
    assertEquals(-3L, IdAllocator.negativeBelow(Arrays.asList(null, -2L)).next());
  }
}
