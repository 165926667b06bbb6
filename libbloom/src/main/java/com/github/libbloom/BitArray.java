package com.github.libbloom;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLongArray;

// A fixed-length array of bits packed into 64-bit words. Setting a bit is atomic, so
// concurrent writers never lose each other's bits. Bits beyond bitSize in the last word
// are always zero.
final class BitArray {
  private final AtomicLongArray data;
  private final int bitSize;

  BitArray(int bitSize) {
    this.bitSize = bitSize;
    this.data = new AtomicLongArray((int) (((long) bitSize + 63) >>> 6));
  }

  private BitArray(BitArray that) {
    this.bitSize = that.bitSize;
    this.data = new AtomicLongArray(that.words());
  }

  int bitSize() { return bitSize; }

  // Returns true if the bit changed
  boolean set(int index) {
    int word = index >>> 6;
    long mask = 1L << index;
    long old;
    do {
      old = data.get(word);
      if ((old & mask) != 0) return false;
    } while (!data.compareAndSet(word, old, old | mask));
    return true;
  }

  boolean get(int index) {
    return (data.get(index >>> 6) & (1L << index)) != 0;
  }

  void clear() {
    for (int i = 0; i < data.length(); ++i) {
      data.set(i, 0L);
    }
  }

  long cardinality() {
    long result = 0;
    for (int i = 0; i < data.length(); ++i) {
      result += Long.bitCount(data.get(i));
    }
    return result;
  }

  long[] words() {
    long[] result = new long[data.length()];
    for (int i = 0; i < result.length; ++i) {
      result[i] = data.get(i);
    }
    return result;
  }

  BitArray copy() { return new BitArray(this); }

  @Override
  public boolean equals(Object there) {
    if (there == null) return false;
    if (!(there instanceof BitArray)) return false;
    BitArray that = (BitArray) there;
    return bitSize == that.bitSize && Arrays.equals(words(), that.words());
  }

  @Override
  public int hashCode() {
    return 31 * bitSize + Arrays.hashCode(words());
  }
}
