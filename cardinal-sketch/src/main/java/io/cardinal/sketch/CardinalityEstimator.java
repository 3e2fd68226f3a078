package io.cardinal.sketch;

/**
 * Approximate distinct counter of elements of type {@code E}.
 *
 * @param <S> the concrete estimator type, which only merges with its own kind
 */
public interface CardinalityEstimator<E, S extends CardinalityEstimator<E, S>>
{
  void add(E value);

  void merge(S that) throws MergeException;

  long cardinality();

  void reset();

  long memoryFootprint();

  String name();
}
