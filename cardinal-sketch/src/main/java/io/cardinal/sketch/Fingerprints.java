package io.cardinal.sketch;

import com.google.common.hash.HashFunction;

import java.nio.charset.StandardCharsets;

/**
 * Fingerprint of a (hash family, element type) pair, stored with serialized sketches.
 *
 * <p>The fingerprint is the 64-bit hash of {@link #MARKER} followed by the element type tag,
 * computed with a fresh default instance of the family class, so it depends only on the family
 * class and the tag.
 */
final class Fingerprints
{
  static final byte[] MARKER = "cardinal-hll-fingerprint".getBytes(StandardCharsets.US_ASCII);

  private Fingerprints()
  {
  }

  static long compute(Class<? extends HashFamily> familyClass, ElementEncoder<?> encoder) throws ConfigurationException
  {
    HashFunction hashFunction = HashFamilies.newInstance(familyClass).hashFunction();
    return hashFunction.newHasher()
        .putBytes(MARKER)
        .putBytes(encoder.typeTag())
        .hash()
        .asLong();
  }

  static String describeTag(ElementEncoder<?> encoder)
  {
    return new String(encoder.typeTag(), StandardCharsets.UTF_8);
  }
}
