package io.cardinal.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

public final class HashFamilies
{
  private HashFamilies()
  {
  }

  public static HashFamily defaultFamily()
  {
    return new SipHash24();
  }

  /**
   * Creates a fresh default instance of {@code familyClass}, independent of the state of any
   * instance already in use.
   *
   * <p>Java has no default-constructible type bound, so the public no-argument constructor is
   * looked up reflectively.
   *
   * @throws ConfigurationException if the class is abstract, not public, or has no public
   *     no-argument constructor, or if the family produces fewer than 64 bits
   */
  public static HashFamily newInstance(Class<? extends HashFamily> familyClass) throws ConfigurationException
  {
    Preconditions.checkNotNull(familyClass, "familyClass");
    if (familyClass.isSynthetic()
        || familyClass.isAnonymousClass()
        || Modifier.isAbstract(familyClass.getModifiers())
        || !Modifier.isPublic(familyClass.getModifiers())) {
      throw invalidFamily(familyClass, "must be a concrete public class", null);
    }

    final HashFamily family;
    try {
      Constructor<? extends HashFamily> constructor = familyClass.getConstructor();
      family = constructor.newInstance();
    }
    catch (NoSuchMethodException e) {
      throw invalidFamily(familyClass, "has no public no-argument constructor", e);
    }
    catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
      throw invalidFamily(familyClass, "cannot be instantiated", e);
    }

    HashFunction hashFunction = family.hashFunction();
    if (hashFunction == null || hashFunction.bits() < Long.SIZE) {
      throw invalidFamily(familyClass, "must produce at least 64 bits", null);
    }
    return family;
  }

  private static ConfigurationException invalidFamily(Class<?> familyClass, String reason, Throwable cause)
  {
    return new ConfigurationException(
        ConfigurationException.Kind.INVALID_HASH_FAMILY,
        String.format("invalid hash family [%s] : %s", familyClass.getName(), reason),
        cause
    );
  }

  /**
   * SipHash-2-4 with Guava's fixed default key. The default family.
   */
  public static final class SipHash24 implements HashFamily
  {
    private static final HashFunction HASH_FUNCTION = Hashing.sipHash24();

    @Override
    public HashFunction hashFunction()
    {
      return HASH_FUNCTION;
    }
  }

  /**
   * The lower 64 bits of x64 MurmurHash3 128, seed 0.
   */
  public static final class Murmur3_128 implements HashFamily
  {
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    @Override
    public HashFunction hashFunction()
    {
      return HASH_FUNCTION;
    }
  }

  public static final class FarmHashFingerprint64 implements HashFamily
  {
    private static final HashFunction HASH_FUNCTION = Hashing.farmHashFingerprint64();

    @Override
    public HashFunction hashFunction()
    {
      return HASH_FUNCTION;
    }
  }
}
