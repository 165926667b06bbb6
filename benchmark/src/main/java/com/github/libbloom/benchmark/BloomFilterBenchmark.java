/*
 * Copyright (c) 2014, Oracle America, Inc.
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 *  * Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 *
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 *
 *  * Neither the name of Oracle nor the names of its contributors may be used
 *    to endorse or promote products derived from this software without
 *    specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF
 * THE POSSIBILITY OF SUCH DAMAGE.
 */

package com.github.libbloom.benchmark;

import com.github.libbloom.BloomFilter;
import com.github.libbloom.Canonicalizers;

import org.openjdk.jmh.annotations.*;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Compares a Bloom filter sized for 1% false positives with a <code>HashSet</code> holding
 * the same strings.
 */
@BenchmarkMode(Mode.AverageTime)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BloomFilterBenchmark {
  @State(Scope.Thread)
  public static class MyState {
    @Param({"1000", "100000"})
    int itemCount;
    int lookupCount = 10000;
    String[] present;
    String[] absent;
    BloomFilter<String> b;
    Set<String> s;

    @Setup
    public void setup() {
      present = new String[itemCount];
      for (int i = 0; i < itemCount; ++i) {
        present[i] = "item-" + i;
      }
      absent = new String[lookupCount];
      for (int i = 0; i < lookupCount; ++i) {
        absent[i] = "non-existing-" + i;
      }
      b = BloomFilter.createWithNdvFpp(itemCount, 0.01, Canonicalizers.identity());
      s = new HashSet<>();
      for (String item : present) {
        b.insert(item);
        s.add(item);
      }
    }
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public BloomFilter<String> BenchBloomInsert(MyState st) {
    BloomFilter<String> b =
        BloomFilter.createWithNdvFpp(st.itemCount, 0.01, Canonicalizers.identity());
    for (String item : st.present) {
      b.insert(item);
    }
    return b;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public Set<String> BenchSetInsert(MyState st) {
    Set<String> s = new HashSet<>();
    for (String item : st.present) {
      s.add(item);
    }
    return s;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public int BenchBloomLookupPresent(MyState st) {
    int found = 0;
    for (int i = 0; i < st.lookupCount; ++i) {
      if (st.b.mayContain(st.present[i % st.itemCount])) ++found;
    }
    return found;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public int BenchSetLookupPresent(MyState st) {
    int found = 0;
    for (int i = 0; i < st.lookupCount; ++i) {
      if (st.s.contains(st.present[i % st.itemCount])) ++found;
    }
    return found;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public int BenchBloomLookupAbsent(MyState st) {
    int found = 0;
    for (String item : st.absent) {
      if (st.b.mayContain(item)) ++found;
    }
    return found;
  }

  @Benchmark
  @OutputTimeUnit(TimeUnit.MICROSECONDS)
  @Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
  public int BenchSetLookupAbsent(MyState st) {
    int found = 0;
    for (String item : st.absent) {
      if (st.s.contains(item)) ++found;
    }
    return found;
  }
}
