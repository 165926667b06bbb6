package com.github.libbloom;

import org.apache.commons.math3.util.FastMath;

/**
 * Formulas for dimensioning a Bloom filter.
 * <p>
 * With <code>m</code> bits, <code>k</code> hash positions per item and <code>n</code>
 * distinct items inserted, the probability that a fixed bit is still zero is about
 * <code>e^(-kn/m)</code>, and a query for an absent item is a false positive when all
 * <code>k</code> of its bits are set.
 */
public final class Sizing {
  private Sizing() {}

  private static final double LN2 = FastMath.log(2);

  /**
   * Calculates the number of hash positions that minimizes the false positive probability
   * of a filter with <code>size</code> bits holding <code>expectedElements</code> items.
   * Never less than 1.
   *
   * @param size             the number of bits in the filter
   * @param expectedElements the number of distinct values expected
   * @return the number of hash positions per item
   */
  public static int optimalHashCount(long size, long expectedElements) {
    if (size < 1) {
      throw new FilterConfigurationException("size must be at least 1, got " + size);
    }
    if (expectedElements < 1) {
      throw new FilterConfigurationException(
          "expectedElements must be at least 1, got " + expectedElements);
    }
    long k = FastMath.round((double) size / expectedElements * LN2);
    return (int) FastMath.max(1, FastMath.min(k, Integer.MAX_VALUE));
  }

  /**
   * Calculates the number of bits needed for a filter holding
   * <code>expectedElements</code> items with a false positive probability of
   * <code>falsePositiveRate</code>, assuming it uses the optimal hash count.
   *
   * @param expectedElements  the number of distinct values expected, at least 1
   * @param falsePositiveRate the desired false positive probability, strictly between 0
   *                          and 1
   * @return the number of bits
   * @throws FilterConfigurationException if an input is out of range or the result does
   *     not fit a bit array
   */
  public static int optimalSize(long expectedElements, double falsePositiveRate) {
    if (expectedElements < 1) {
      throw new FilterConfigurationException(
          "expectedElements must be at least 1, got " + expectedElements);
    }
    if (!(falsePositiveRate > 0 && falsePositiveRate < 1)) {
      throw new FilterConfigurationException(
          "falsePositiveRate must be in (0, 1), got " + falsePositiveRate);
    }
    double bits =
        FastMath.ceil(-(expectedElements * FastMath.log(falsePositiveRate)) / (LN2 * LN2));
    if (bits > Integer.MAX_VALUE) {
      throw new FilterConfigurationException(String.format(
          "%d elements at rate %s need %.0f bits, more than a filter can hold",
          expectedElements, falsePositiveRate, bits));
    }
    return (int) FastMath.max(1, bits);
  }

  /**
   * Calculates <code>(1 - e^(-k*n/m))^k</code>.
   *
   * @param size               <code>m</code>, the number of bits
   * @param hashFunctionsCount <code>k</code>, the hash positions per item
   * @param insertedCount      <code>n</code>, the number of distinct values inserted
   * @return the false positive probability
   */
  public static double falsePositiveRate(long size, int hashFunctionsCount,
      long insertedCount) {
    if (size < 1) {
      throw new FilterConfigurationException("size must be at least 1, got " + size);
    }
    if (hashFunctionsCount < 1) {
      throw new FilterConfigurationException(
          "hashFunctionsCount must be at least 1, got " + hashFunctionsCount);
    }
    if (insertedCount < 0) {
      throw new FilterConfigurationException(
          "insertedCount must not be negative, got " + insertedCount);
    }
    if (insertedCount == 0) return 0.0;
    // 1 - e^x == -expm1(x), which keeps precision when k*n/m is tiny
    double setProbability =
        -FastMath.expm1(-(double) hashFunctionsCount * insertedCount / size);
    return FastMath.min(1.0, FastMath.pow(setProbability, hashFunctionsCount));
  }
}
