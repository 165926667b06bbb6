package com.github.libbloom;

/**
 * StaticFilter represents the query side of an approximate membership query object.
 */
public interface StaticFilter<T> {
  /**
   * Find an item in the filter.
   * <p>
   * A <code>false</code> result is definitive: the item was never inserted. A
   * <code>true</code> result means the item was <em>possibly</em> inserted; it may be a
   * false positive caused by other insertions covering all of the item's positions.
   * <p>
   * Querying never changes the filter.
   *
   * @param item the element you are checking the presence of
   * @return <code>false</code> if the item is certainly absent
   */
  boolean mayContain(T item);
}
