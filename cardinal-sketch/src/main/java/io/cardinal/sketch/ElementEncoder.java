package io.cardinal.sketch;

import com.google.common.hash.Funnel;

/**
 * Turns an element into the byte sequence that gets hashed, and names the element type.
 *
 * <p>Distinct elements should funnel distinct bytes; elements sharing an encoding are counted
 * once. The type tag is only used to fingerprint serialized sketches and is never mixed into
 * the per-element hash.
 */
public interface ElementEncoder<E> extends Funnel<E>
{
  /**
   * @return a fixed, non-empty ASCII label of the element type, e.g. {@code "i64"}
   */
  byte[] typeTag();
}
