package com.github.libbloom;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Random;

public class FilterTest {
  public FilterTest() {}

  @Test
  public void InsertPersists() {
    InsertPersistsHelp(BloomFilter.create(32000, 4));
    InsertPersistsHelp(BloomFilter.create(1, 1));
    InsertPersistsHelp(BloomFilter.<Object>createWithNdvFpp(8000, 0.001, Canonicalizers.stringValue()));
  }

  public <T extends Filter<Object>> void InsertPersistsHelp(T x) {
    int ndv = 2000;
    ArrayList<Long> items = new ArrayList<Long>(ndv);
    Random r = new Random(0xdeadbeef);
    for (int i = 0; i < ndv; ++i) {
      items.add(r.nextLong());
    }
    for (int i = 0; i < ndv; ++i) {
      x.insert(items.get(i));
      for (int j = 0; j <= i; j += 7) {
        assertTrue(x.mayContain(items.get(j)));
      }
    }
    for (int i = 0; i < ndv; ++i) {
      assertTrue(x.mayContain(items.get(i)));
    }
  }

  @Test
  public void StartEmpty() {
    BloomFilter<Object> x = BloomFilter.create(1000, 3);
    assertTrue(x.isEmpty());
    Random r = new Random(0xdeadbeef);
    for (int j = 0; j < 100000; ++j) {
      assertFalse(x.mayContain(r.nextLong()));
    }
  }

  @Test
  public void InsertIsIdempotent() {
    BloomFilter<Object> once = BloomFilter.create(256, 5);
    BloomFilter<Object> many = BloomFilter.create(256, 5);
    once.insert("kiwi");
    for (int i = 0; i < 10; ++i) {
      many.insert("kiwi");
    }
    assertEquals(once, many);
    assertEquals(once.bitCount(), many.bitCount());
  }

  @Test
  public void ClearResetsFully() {
    BloomFilter<Object> x = BloomFilter.create(512, 4);
    for (int i = 0; i < 100; ++i) {
      x.insert("item-" + i);
    }
    assertFalse(x.isEmpty());
    x.clear();
    assertTrue(x.isEmpty());
    assertEquals(BloomFilter.create(512, 4), x);
    for (int i = 0; i < 100; ++i) {
      assertFalse(x.mayContain("item-" + i));
    }
    assertEquals(512, x.size());
    assertEquals(4, x.hashFunctionsCount());
  }

  @Test
  public void SameInsertsSameState() {
    BloomFilter<Object> a = BloomFilter.create(4096, 6);
    BloomFilter<Object> b = BloomFilter.create(4096, 6);
    for (int i = 0; i < 300; ++i) {
      a.insert("key-" + i);
      b.insert("key-" + i);
    }
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    b.insert("one more");
    assertNotEquals(a, b);
  }

  @Test
  public void SetBitsOnlyGrow() {
    BloomFilter<Object> x = BloomFilter.create(2048, 3);
    long last = 0;
    for (int i = 0; i < 500; ++i) {
      BloomFilter<Object> before = x.clone();
      x.insert(i);
      long now = x.bitCount();
      assertTrue(now >= last);
      last = now;
      // a probe that hit only set bits before still does
      for (int j = 0; j < 50; ++j) {
        if (before.mayContain("probe-" + j)) assertTrue(x.mayContain("probe-" + j));
      }
    }
  }

  @Test
  public void MinimalFilterAlwaysAnswersTrue() {
    BloomFilter<Object> x = BloomFilter.create(1, 1);
    assertFalse(x.mayContain("anything"));
    x.insert("first");
    assertEquals(1, x.bitCount());
    assertTrue(x.mayContain("first"));
    for (int i = 0; i < 1000; ++i) {
      assertTrue(x.mayContain("never-inserted-" + i));
    }
  }

  @Test
  public void Fruit() {
    BloomFilter<Object> x = BloomFilter.create(100, 3);
    x.insert("apple");
    x.insert("banana");
    x.insert("orange");
    assertTrue(x.mayContain("apple"));
    assertTrue(x.mayContain("banana"));
    assertTrue(x.mayContain("orange"));
    // "grape" may or may not be a false positive, the answer just has to be stable
    assertEquals(x.mayContain("grape"), x.mayContain("grape"));
    x.clear();
    assertFalse(x.mayContain("apple"));
  }

  @Test
  public void CloneIsIndependent() {
    BloomFilter<Object> x = BloomFilter.create(1024, 4);
    x.insert("shared");
    BloomFilter<Object> y = x.clone();
    assertEquals(x, y);
    y.insert("only in the copy");
    assertTrue(y.mayContain("shared"));
    assertNotEquals(x, y);
    x.clear();
    assertTrue(y.mayContain("shared"));
  }

  @Test
  public void PositionsAreStable() {
    BloomFilter<Object> a = BloomFilter.create(997, 8);
    BloomFilter<Object> b = BloomFilter.create(997, 8);
    int[] first = a.positions("stable");
    assertEquals(8, first.length);
    for (int p : first) {
      assertTrue(0 <= p && p < 997);
    }
    assertTrue(Arrays.equals(first, a.positions("stable")));
    assertTrue(Arrays.equals(first, b.positions("stable")));
  }

  @Test
  public void CanonicalizerDecidesIdentity() {
    BloomFilter<Object> plain = BloomFilter.create(100000, 5);
    plain.insert(1);
    assertTrue(plain.mayContain("1"));

    BloomFilter<Object> typed = BloomFilter.create(100000, 5, Canonicalizers.typed());
    typed.insert(1);
    assertTrue(typed.mayContain(1));
    assertFalse(typed.mayContain("1"));
  }

  @Test
  public void EqualityIncludesCanonicalizer() {
    BloomFilter<Object> plain = BloomFilter.create(64, 1);
    BloomFilter<Object> typed = BloomFilter.create(64, 1, Canonicalizers.typed());
    // both empty, same dimensions, yet they would answer mayContain(1) differently once
    // "1" is inserted into each
    assertNotEquals(plain, typed);
    plain.insert("1");
    typed.insert("1");
    assertTrue(plain.mayContain(1));
    assertNotEquals(plain, typed);
    assertEquals(plain, plain.clone());
    assertEquals(typed.hashCode(), typed.clone().hashCode());
  }

  @Test(expected = NullPointerException.class)
  public void NullItemRejected() {
    BloomFilter.create(10, 1).insert(null);
  }

  @Test
  public void RejectsBadDimensions() {
    SizingTest.assertRejected(() -> BloomFilter.create(0, 3));
    SizingTest.assertRejected(() -> BloomFilter.create(-1, 3));
    SizingTest.assertRejected(() -> BloomFilter.create(100, 0));
    SizingTest.assertRejected(() -> BloomFilter.create(100, -2));
    SizingTest.assertRejected(() -> BloomFilter.create(100, 2, null));
    SizingTest.assertRejected(
        () -> BloomFilter.createWithNdvFpp(100, 1.0, Canonicalizers.identity()));
    SizingTest.assertRejected(() -> BloomFilter.create(100, 2).estimatedFalsePositiveRate(-1));
  }

  @Test
  public void CreateWithNdvFppUsesSizing() {
    BloomFilter<String> x = BloomFilter.createWithNdvFpp(1000, 0.05, Canonicalizers.identity());
    assertEquals(6236, x.size());
    assertEquals(4, x.hashFunctionsCount());
    assertEquals(0.0502516, x.estimatedFalsePositiveRate(1000), 1e-6);
    assertEquals("BloomFilter{size=6236, hashFunctionsCount=4, bitCount=0}", x.toString());
  }
}
