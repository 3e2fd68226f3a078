package io.cardinal.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HashFamiliesTest
{
  @Test
  public void testDefaultFamily()
  {
    assertThat(HashFamilies.defaultFamily()).isInstanceOf(HashFamilies.SipHash24.class);
    assertThat(HashFamilies.defaultFamily().hashFunction().bits()).isEqualTo(64);
  }

  @Test
  public void testNewInstance() throws Exception
  {
    HashFamily murmur = new HashFamilies.Murmur3_128();
    HashFamily fresh = HashFamilies.newInstance(murmur.getClass());
    assertThat(fresh).isInstanceOf(HashFamilies.Murmur3_128.class).isNotSameAs(murmur);
    assertThat(fresh.hashFunction().hashLong(1L)).isEqualTo(Hashing.murmur3_128().hashLong(1L));

    assertThat(HashFamilies.newInstance(HashFamilies.FarmHashFingerprint64.class).hashFunction().bits()).isEqualTo(64);
  }

  @Test
  public void testNewInstanceRejectsInvalidFamilies()
  {
    assertInvalid(HashFamily.class);
    assertInvalid(HiddenFamily.class);
    assertInvalid(HyperLogLogTest.SeededFamily.class);
    assertInvalid(HyperLogLogTest.Murmur3_32Family.class);
    assertInvalid(FailingFamily.class);
  }

  private static void assertInvalid(Class<? extends HashFamily> familyClass)
  {
    assertThatThrownBy(() -> HashFamilies.newInstance(familyClass))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining(familyClass.getName())
        .extracting(e -> ((ConfigurationException) e).getKind())
        .isEqualTo(ConfigurationException.Kind.INVALID_HASH_FAMILY);
  }

  @Test
  public void testMurmurFamilyOnStrings() throws Exception
  {
    HyperLogLog<CharSequence> hll = HyperLogLog.create(10, ElementEncoders.strings(), new HashFamilies.Murmur3_128());
    for (int i = 1; i < 10_000; i++) {
      hll.add("test" + i);
    }
    assertThat(hll.cardinality()).isBetween(9_799L, 10_199L);
  }

  @Test
  public void testFamiliesDisagree() throws Exception
  {
    HyperLogLog<Long> sip = HyperLogLog.create(12, ElementEncoders.longs(), new HashFamilies.SipHash24());
    HyperLogLog<Long> farm = HyperLogLog.create(12, ElementEncoders.longs(), new HashFamilies.FarmHashFingerprint64());
    for (long i = 0; i < 1_000; i++) {
      sip.add(i);
      farm.add(i);
    }
    assertThat(sip.getRegisters()).isNotEqualTo(farm.getRegisters());
  }

  static final class HiddenFamily implements HashFamily
  {
    public HiddenFamily()
    {
    }

    @Override
    public HashFunction hashFunction()
    {
      return Hashing.sipHash24();
    }
  }

  public static final class FailingFamily implements HashFamily
  {
    public FailingFamily()
    {
      throw new IllegalStateException("no key configured");
    }

    @Override
    public HashFunction hashFunction()
    {
      return Hashing.sipHash24();
    }
  }
}
