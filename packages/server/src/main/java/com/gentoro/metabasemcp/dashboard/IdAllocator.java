package com.gentoro.metabasemcp.dashboard;

import java.util.Collection;

/**
 * Hands out identifiers for entities created by a dashboard write.
 *
 * <p>Metabase treats a negative id in a {@code PUT /dashboard/:id} payload as "create this entity";
 * the allocator keeps that convention in one place.
 */
public interface IdAllocator {

  long next();

  /**
   * Strictly decreasing negative ids, starting at {@code min(smallest existing id - 1, -1)}, so
   * every id handed out is below every id already in scope.
   */
  static IdAllocator negativeBelow(Collection<Long> existingIds) {
    long start = -1L;
    for (Long id : existingIds) {
      if (id != null && id - 1 < start) {
        start = id - 1;
      }
    }
    long first = start;
    return new IdAllocator() {
      private long cursor = first;

      @Override
      public long next() {
        return cursor--;
      }
    };
  }
}
