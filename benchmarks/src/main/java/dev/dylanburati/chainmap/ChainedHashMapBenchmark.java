package dev.dylanburati.chainmap;

import java.util.HashMap;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import dev.dylanburati.App;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

@State(Scope.Benchmark)
public class ChainedHashMapBenchmark {
  private static final int WORDS = 10_000_000;

  // starting bucket count; small values measure the cost of repeated resizes
  @Param({"16", "100", "65536"})
  public int initialCapacity;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedChainedHashMap(Blackhole bh) {
    try (ChainedHashMap<String, Integer> m = ChainedHashMap.<String, Integer>createNatural(initialCapacity).get()) {
      bh.consume(App.wordcount(m.asMap(), WORDS));
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedHashMap(Blackhole bh) {
    bh.consume(App.wordcount(new HashMap<>(initialCapacity), WORDS));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedObject2IntMap(Blackhole bh) {
    bh.consume(App.wordcount(new Object2IntOpenHashMap<>(initialCapacity), WORDS));
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  public void putGetRemoveChainedHashMap(Blackhole bh) {
    try (ChainedHashMap<Integer, Integer> m = ChainedHashMap.<Integer, Integer>create(k -> k, (a, b) -> a.intValue() == b.intValue(), initialCapacity).get()) {
      for (int i = 0; i < 100_000; i++) {
        m.put(i, i);
      }
      long sum = 0;
      for (int i = 0; i < 100_000; i++) {
        sum += m.get(i).orElse(0);
      }
      for (int i = 0; i < 100_000; i++) {
        m.remove(i);
      }
      bh.consume(sum);
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.AverageTime)
  public void putGetRemoveInt2IntMap(Blackhole bh) {
    Int2IntOpenHashMap m = new Int2IntOpenHashMap(initialCapacity);
    for (int i = 0; i < 100_000; i++) {
      m.put(i, i);
    }
    long sum = 0;
    for (int i = 0; i < 100_000; i++) {
      sum += m.get(i);
    }
    for (int i = 0; i < 100_000; i++) {
      m.remove(i);
    }
    bh.consume(sum);
  }
}
