package com.github.libbloom;

import com.sangupta.murmur.Murmur3;

import java.nio.charset.StandardCharsets;

// Kirsch-Mitzenmacher double hashing: two MurmurHash3 values stand in for
// hashFunctionsCount independent hash functions. The second hash is seeded with the
// first.
final class HashPositions {
  private HashPositions() {}

  private static final long UINT_MASK = 0xFFFFFFFFL;

  static int[] compute(String canonical, int hashFunctionsCount, int size) {
    byte[] data = canonical.getBytes(StandardCharsets.UTF_8);
    long hash1 = Murmur3.hash_x86_32(data, data.length, 0) & UINT_MASK;
    long hash2 = Murmur3.hash_x86_32(data, data.length, hash1) & UINT_MASK;
    int[] result = new int[hashFunctionsCount];
    for (int i = 0; i < hashFunctionsCount; ++i) {
      // hash1 + i * hash2 <= (2^32 - 1) + (2^31 - 1) * (2^32 - 1) < 2^63, no overflow
      result[i] = (int) ((hash1 + i * hash2) % size);
    }
    return result;
  }
}
