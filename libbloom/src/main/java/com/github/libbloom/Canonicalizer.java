package com.github.libbloom;

/**
 * Turns an item into the string that a filter hashes.
 * <p>
 * Two items are the same element to a filter exactly when their canonical strings are
 * equal, so an implementation must be deterministic and must return the same string for
 * an item every time it is asked.
 */
@FunctionalInterface
public interface Canonicalizer<T> {
  String canonicalize(T item);
}
