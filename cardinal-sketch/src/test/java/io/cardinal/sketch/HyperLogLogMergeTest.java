package io.cardinal.sketch;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class HyperLogLogMergeTest
{
  private static HyperLogLog<Long> sketchOf(int p, long from, long to) throws ConfigurationException
  {
    HyperLogLog<Long> hll = HyperLogLog.create(p, ElementEncoders.longs());
    for (long i = from; i < to; i++) {
      hll.add(i);
    }
    return hll;
  }

  @Test
  public void testMergeDisjointSketches() throws Exception
  {
    HyperLogLog<Long> left = sketchOf(10, 0, 10);
    HyperLogLog<Long> right = sketchOf(10, 10, 20);

    left.merge(right);
    assertThat(left.getRegisters()).isEqualTo(sketchOf(10, 0, 20).getRegisters());
    assertThat(left.cardinality()).isBetween(18L, 22L);
  }

  @Test
  public void testMergeTakesPointwiseMaximum() throws Exception
  {
    HyperLogLog<Long> left = sketchOf(8, 0, 500);
    HyperLogLog<Long> right = sketchOf(8, 300, 2_000);
    byte[] leftRegisters = left.getRegisters();
    byte[] rightRegisters = right.getRegisters();

    left.merge(right);
    byte[] merged = left.getRegisters();
    for (int i = 0; i < merged.length; i++) {
      assertThat(merged[i]).isEqualTo((byte) Math.max(leftRegisters[i], rightRegisters[i]));
    }
    // union of the registers is exactly the sketch of the union
    assertThat(left).isEqualTo(sketchOf(8, 0, 2_000));
    // the argument is left alone
    assertThat(right.getRegisters()).isEqualTo(rightRegisters);
  }

  @Test
  public void testPrecisionMismatch() throws Exception
  {
    HyperLogLog<Long> left = sketchOf(10, 0, 100);
    HyperLogLog<Long> right = sketchOf(11, 50, 150);
    byte[] leftRegisters = left.getRegisters();
    byte[] rightRegisters = right.getRegisters();

    assertThatThrownBy(() -> left.merge(right))
        .isInstanceOfSatisfying(MergeException.class, e -> {
          assertThat(e.getExpectedPrecision()).isEqualTo(10);
          assertThat(e.getActualPrecision()).isEqualTo(11);
        })
        .hasMessage("precision mismatch : expected [10], found [11]");

    assertThat(left.getRegisters()).isEqualTo(leftRegisters);
    assertThat(right.getRegisters()).isEqualTo(rightRegisters);
  }

  @Test
  public void testMergeIsCommutative() throws Exception
  {
    HyperLogLog<Long> ab = sketchOf(12, 0, 30_000);
    ab.merge(sketchOf(12, 20_000, 60_000));
    HyperLogLog<Long> ba = sketchOf(12, 20_000, 60_000);
    ba.merge(sketchOf(12, 0, 30_000));

    assertThat(ab.getRegisters()).isEqualTo(ba.getRegisters());
    assertThat(ab.cardinality()).isCloseTo(ba.cardinality(), within(2L));
  }

  @Test
  public void testMergeIsAssociative() throws Exception
  {
    HyperLogLog<Long> a = sketchOf(12, 0, 10_000);
    HyperLogLog<Long> b = sketchOf(12, 5_000, 25_000);
    HyperLogLog<Long> c = sketchOf(12, 40_000, 45_000);

    // (a + b) + c
    HyperLogLog<Long> left = a.copy();
    left.merge(b);
    left.merge(c);

    // a + (b + c)
    HyperLogLog<Long> bc = b.copy();
    bc.merge(c);
    HyperLogLog<Long> right = a.copy();
    right.merge(bc);

    assertThat(left.getRegisters()).isEqualTo(right.getRegisters());
    assertThat(left.cardinality()).isCloseTo(right.cardinality(), within(2L));
  }

  @Test
  public void testMergeWithCopyOfSelf() throws Exception
  {
    HyperLogLog<Long> hll = sketchOf(10, 0, 5_000);
    final long before = hll.cardinality();
    hll.merge(hll.copy());
    assertThat(hll.cardinality()).isEqualTo(before);
    assertThat(hll).isEqualTo(sketchOf(10, 0, 5_000));
  }

  @Test
  public void testMergeWithEmptySketch() throws Exception
  {
    HyperLogLog<Long> hll = sketchOf(10, 0, 5_000);
    final long before = hll.cardinality();
    hll.merge(HyperLogLog.create(10, ElementEncoders.longs()));
    assertThat(hll.cardinality()).isEqualTo(before);

    HyperLogLog<Long> empty = HyperLogLog.create(10, ElementEncoders.longs());
    empty.merge(hll);
    assertThat(empty).isEqualTo(hll);
  }

  @Test
  public void testMergeAfterReset() throws Exception
  {
    HyperLogLog<Long> hll = sketchOf(6, 0, 1_000);
    hll.reset();
    hll.merge(sketchOf(6, 0, 1));
    assertThat(hll.cardinality()).isEqualTo(1);
  }
}
