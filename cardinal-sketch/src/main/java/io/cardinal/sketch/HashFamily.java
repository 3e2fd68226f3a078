package io.cardinal.sketch;

import com.google.common.hash.HashFunction;

/**
 * A family of stateless hash functions used to place elements into registers.
 *
 * <p>Implementations must produce at least 64 bits and be public classes with a public
 * no-argument constructor: serialized sketches are fingerprinted with a freshly constructed
 * instance of the family class, so the class, not the instance, identifies the family.
 */
public interface HashFamily
{
  HashFunction hashFunction();
}
