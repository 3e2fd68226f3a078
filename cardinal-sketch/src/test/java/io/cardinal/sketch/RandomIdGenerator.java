package io.cardinal.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;

/**
 * A random id generator based on sha1, see http://antirez.com/news/99
 *
 * <p>Ids are sha1(counter, seed), so a given seed always yields the same distinct sequence.
 */
public class RandomIdGenerator
{
  @SuppressWarnings("deprecation")
  private final HashFunction sha1 = Hashing.sha1();
  private final ByteBuffer buffer;
  private long counter = 0;

  public RandomIdGenerator(long seed)
  {
    buffer = ByteBuffer.allocate(16);
    buffer.putLong(8, seed);
  }

  /**
   * @return a 20 bytes random id with a very low collision rate
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return sha1.hashBytes(buffer.array()).asBytes();
  }
}
