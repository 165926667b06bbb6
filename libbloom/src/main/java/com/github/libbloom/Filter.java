package com.github.libbloom;

/**
 * Filter represents approximate membership query objects that can be added to and reset.
 */
public interface Filter<T> extends StaticFilter<T> {
  /**
   * Add an item to the filter.
   * <p>
   * Adding the same item more than once has no further effect. Items cannot be removed
   * individually; see {@link #clear()}.
   *
   * @param item the element you wish to insert
   */
  void insert(T item);

  /**
   * Forget every inserted item. The filter's dimensions are unchanged.
   */
  void clear();

  /**
   * Calculates the expected false positive probability after <code>insertedCount</code>
   * distinct items have been added. The filter does not count insertions itself, so the
   * caller supplies the number.
   *
   * @param insertedCount the number of distinct values inserted so far
   * @return the false positive probability, between 0 and 1
   */
  double estimatedFalsePositiveRate(long insertedCount);
}
