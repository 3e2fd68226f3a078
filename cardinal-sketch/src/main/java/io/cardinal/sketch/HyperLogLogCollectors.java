package io.cardinal.sketch;

import java.util.stream.Collector;

/**
 * Stream collectors estimating the number of distinct elements. Each partition of a parallel
 * stream fills its own sketch; partitions are combined with {@link HyperLogLog#merge}.
 */
public final class HyperLogLogCollectors
{
  private HyperLogLogCollectors()
  {
  }

  public static <E> Collector<E, ?, HyperLogLog<E>> toHyperLogLog(int precision, ElementEncoder<E> encoder)
      throws ConfigurationException
  {
    return toHyperLogLog(precision, encoder, HashFamilies.defaultFamily());
  }

  public static <E> Collector<E, ?, HyperLogLog<E>> toHyperLogLog(
      int precision,
      ElementEncoder<E> encoder,
      HashFamily hashFamily
  ) throws ConfigurationException
  {
    // fails here rather than inside the stream
    final HyperLogLog<E> prototype = HyperLogLog.create(precision, encoder, hashFamily);
    return Collector.of(
        prototype::emptyCopy,
        HyperLogLog::add,
        HyperLogLogCollectors::combine,
        Collector.Characteristics.UNORDERED,
        Collector.Characteristics.IDENTITY_FINISH
    );
  }

  public static <E> Collector<E, ?, Long> approxCountDistinct(int precision, ElementEncoder<E> encoder)
      throws ConfigurationException
  {
    return approxCountDistinct(precision, encoder, HashFamilies.defaultFamily());
  }

  public static <E> Collector<E, ?, Long> approxCountDistinct(
      int precision,
      ElementEncoder<E> encoder,
      HashFamily hashFamily
  ) throws ConfigurationException
  {
    final HyperLogLog<E> prototype = HyperLogLog.create(precision, encoder, hashFamily);
    return Collector.of(
        prototype::emptyCopy,
        HyperLogLog::add,
        HyperLogLogCollectors::combine,
        HyperLogLog::cardinality,
        Collector.Characteristics.UNORDERED
    );
  }

  private static <E> HyperLogLog<E> combine(HyperLogLog<E> left, HyperLogLog<E> right)
  {
    try {
      left.merge(right);
    }
    catch (MergeException e) {
      // every partition comes from the same prototype
      throw new IllegalStateException(e);
    }
    return left;
  }
}
