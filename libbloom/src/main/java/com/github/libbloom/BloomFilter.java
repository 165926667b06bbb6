package com.github.libbloom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * BloomFilter is the classic Bloom filter from Bloom's "Space/Time Trade-offs in Hash
 * Coding with Allowable Errors": a fixed array of <code>size</code> bits and
 * <code>hashFunctionsCount</code> hash positions per item.
 * <p>
 * The positions come from double hashing (Kirsch and Mitzenmacher, "Less Hashing, Same
 * Performance: Building a Better Bloom Filter"): two MurmurHash3 values of the item's
 * canonical string, the second seeded with the first, combined as
 * <code>hash1 + i * hash2</code>.
 * <p>
 * The filter never grows. To hold more items than it was sized for, create a new one
 * with {@link #createWithNdvFpp} and insert the items again.
 * <p>
 * Inserts and queries may run concurrently. {@link #clear()} excludes both for its
 * duration. A query racing an insert of the same item can still observe the item as
 * absent; complete the insert before querying when that matters.
 *
 * @param <T> the type of items, turned into strings by the filter's {@link Canonicalizer}
 */
public class BloomFilter<T> implements Cloneable, Filter<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(BloomFilter.class);

  private final int size;
  private final int hashFunctionsCount;
  private final Canonicalizer<? super T> canonicalizer;
  private final BitArray bits;
  private final ReadWriteLock clearLock = new ReentrantReadWriteLock();

  BloomFilter(int size, int hashFunctionsCount, Canonicalizer<? super T> canonicalizer) {
    if (size < 1) {
      throw new FilterConfigurationException("size must be at least 1, got " + size);
    }
    if (hashFunctionsCount < 1) {
      throw new FilterConfigurationException(
          "hashFunctionsCount must be at least 1, got " + hashFunctionsCount);
    }
    if (canonicalizer == null) {
      throw new FilterConfigurationException("canonicalizer must not be null");
    }
    this.size = size;
    this.hashFunctionsCount = hashFunctionsCount;
    this.canonicalizer = canonicalizer;
    this.bits = new BitArray(size);
    LOGGER.debug("Created Bloom filter with {} bits and {} hash functions", size,
        hashFunctionsCount);
  }

  private BloomFilter(BloomFilter<T> that) {
    this.size = that.size;
    this.hashFunctionsCount = that.hashFunctionsCount;
    this.canonicalizer = that.canonicalizer;
    this.bits = that.bits.copy();
  }

  /**
   * Create a new filter of a given size whose items are canonicalized with
   * {@link Canonicalizers#stringValue()}. Read that method's caveat before mixing item
   * types.
   *
   * @param size               the number of bits, at least 1
   * @param hashFunctionsCount the number of hash positions per item, at least 1
   */
  public static BloomFilter<Object> create(int size, int hashFunctionsCount) {
    return new BloomFilter<>(size, hashFunctionsCount, Canonicalizers.stringValue());
  }

  /**
   * Create a new filter of a given size.
   *
   * @param size               the number of bits, at least 1
   * @param hashFunctionsCount the number of hash positions per item, at least 1
   * @param canonicalizer      the rule turning items into hashed strings
   */
  public static <T> BloomFilter<T> create(int size, int hashFunctionsCount,
      Canonicalizer<? super T> canonicalizer) {
    return new BloomFilter<>(size, hashFunctionsCount, canonicalizer);
  }

  /**
   * Create a new filter to hold the given number of distinct values with a false positive
   * probability of no more than <code>fpp</code>, using {@link Sizing#optimalSize} and
   * {@link Sizing#optimalHashCount}.
   *
   * @param ndv           the number of distinct values
   * @param fpp           the false positive probability, strictly between 0 and 1
   * @param canonicalizer the rule turning items into hashed strings
   */
  public static <T> BloomFilter<T> createWithNdvFpp(long ndv, double fpp,
      Canonicalizer<? super T> canonicalizer) {
    int bits = Sizing.optimalSize(ndv, fpp);
    int hashes = Sizing.optimalHashCount(bits, ndv);
    return new BloomFilter<>(bits, hashes, canonicalizer);
  }

  public int size() { return size; }

  public int hashFunctionsCount() { return hashFunctionsCount; }

  /**
   * The bit positions an item maps to, in hash order. Positions may repeat.
   *
   * @param item the element to hash
   * @return <code>hashFunctionsCount</code> indexes in <code>[0, size)</code>
   */
  public int[] positions(T item) {
    Objects.requireNonNull(item, "item");
    String canonical = canonicalizer.canonicalize(item);
    Objects.requireNonNull(canonical, "canonicalizer returned null");
    return HashPositions.compute(canonical, hashFunctionsCount, size);
  }

  @Override
  public void insert(T item) {
    int[] positions = positions(item);
    clearLock.readLock().lock();
    try {
      for (int position : positions) {
        bits.set(position);
      }
    } finally {
      clearLock.readLock().unlock();
    }
  }

  @Override
  public boolean mayContain(T item) {
    int[] positions = positions(item);
    clearLock.readLock().lock();
    try {
      for (int position : positions) {
        if (!bits.get(position)) return false;
      }
      return true;
    } finally {
      clearLock.readLock().unlock();
    }
  }

  @Override
  public void clear() {
    clearLock.writeLock().lock();
    try {
      bits.clear();
    } finally {
      clearLock.writeLock().unlock();
    }
    LOGGER.debug("Cleared Bloom filter with {} bits", size);
  }

  @Override
  public double estimatedFalsePositiveRate(long insertedCount) {
    return Sizing.falsePositiveRate(size, hashFunctionsCount, insertedCount);
  }

  /** The number of bits currently set. */
  public long bitCount() {
    clearLock.readLock().lock();
    try {
      return bits.cardinality();
    } finally {
      clearLock.readLock().unlock();
    }
  }

  public boolean isEmpty() { return bitCount() == 0; }

  /** An independent copy with the same dimensions, canonicalizer and bits. */
  @Override
  public BloomFilter<T> clone() {
    clearLock.readLock().lock();
    try {
      return new BloomFilter<>(this);
    } finally {
      clearLock.readLock().unlock();
    }
  }

  /**
   * Filters are equal when they have the same dimensions, the same canonicalizer instance
   * and the same bits, so that they answer every query alike.
   */
  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof BloomFilter)) return false;
    BloomFilter<?> that = (BloomFilter<?>) there;
    return size == that.size
        && hashFunctionsCount == that.hashFunctionsCount
        && canonicalizer.equals(that.canonicalizer)
        && bits.equals(that.bits);
  }

  @Override
  public int hashCode() {
    return Objects.hash(size, hashFunctionsCount, canonicalizer, bits);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("BloomFilter{size=")
        .append(size)
        .append(", hashFunctionsCount=")
        .append(hashFunctionsCount)
        .append(", bitCount=")
        .append(bitCount())
        .append('}')
        .toString();
  }
}
