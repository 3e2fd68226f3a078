package io.cardinal.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf
 * over a 64-bit hash.
 *
 * <p>The top {@code p} bits of an element's hash select one of {@code m = 2^p} registers, the
 * register keeps the largest rank (leading zeros + 1) seen in the remaining bits. Expected
 * relative error is about {@code 1.04 / sqrt(m)}:
 * <pre>
 * p[4], m[16] =&gt; error[26%]
 * p[10], m[1,024] =&gt; error[3.25%]
 * p[14], m[16,384] =&gt; error[0.81%]
 * </pre>
 *
 * <p>Instances are not thread-safe. To count from several producers, give each producer its own
 * sketch and {@link #merge} them afterwards (see {@link HyperLogLogCollectors}).
 */
public class HyperLogLog<E> implements CardinalityEstimator<E, HyperLogLog<E>>
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLog.class);

  public static final int MIN_PRECISION = 4;
  // largest p with 2^p registers still addressable by a java array
  public static final int MAX_PRECISION = 30;
  public static final int DEFAULT_PRECISION = 14;

  // a register never exceeds the largest rank of a 64-bit hash
  static final int MAX_RANK = Long.SIZE;

  private final int p;
  private final ElementEncoder<E> encoder;
  private final HashFamily hashFamily;
  private final HashFunction hashFunction;
  private final long fingerprint;

  // each register actually only needs 7-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  private HyperLogLog(
      int p,
      ElementEncoder<E> encoder,
      HashFamily hashFamily,
      long fingerprint,
      byte[] registers
  )
  {
    this.p = p;
    this.encoder = encoder;
    this.hashFamily = hashFamily;
    this.hashFunction = hashFamily.hashFunction();
    this.fingerprint = fingerprint;
    this.registers = registers;
  }

  public static <E> HyperLogLog<E> create(ElementEncoder<E> encoder) throws ConfigurationException
  {
    return create(DEFAULT_PRECISION, encoder);
  }

  public static <E> HyperLogLog<E> create(int precision, ElementEncoder<E> encoder) throws ConfigurationException
  {
    return create(precision, encoder, HashFamilies.defaultFamily());
  }

  /**
   * @throws ConfigurationException if {@code precision} is outside
   *     [{@value #MIN_PRECISION}, {@value #MAX_PRECISION}], or if {@code hashFamily} cannot be
   *     default-constructed or yields fewer than 64 bits
   */
  public static <E> HyperLogLog<E> create(int precision, ElementEncoder<E> encoder, HashFamily hashFamily)
      throws ConfigurationException
  {
    Preconditions.checkNotNull(encoder, "encoder");
    Preconditions.checkNotNull(hashFamily, "hashFamily");
    checkPrecision(precision);

    HashFunction hashFunction = hashFamily.hashFunction();
    if (hashFunction == null || hashFunction.bits() < Long.SIZE) {
      throw new ConfigurationException(
          ConfigurationException.Kind.INVALID_HASH_FAMILY,
          String.format("invalid hash family [%s] : must produce at least 64 bits", hashFamily.getClass().getName())
      );
    }
    long fingerprint = Fingerprints.compute(hashFamily.getClass(), encoder);

    LOG.debug("Created sketch with precision [{}] and hash family [{}]", precision, hashFamily.getClass().getName());
    return new HyperLogLog<>(precision, encoder, hashFamily, fingerprint, new byte[1 << precision]);
  }

  static void checkPrecision(int precision) throws ConfigurationException
  {
    if (precision < MIN_PRECISION) {
      throw new ConfigurationException(
          ConfigurationException.Kind.PRECISION_BELOW_MINIMUM,
          String.format("invalid precision [%d] : should be at least %d", precision, MIN_PRECISION)
      );
    }
    if (precision > MAX_PRECISION) {
      throw new ConfigurationException(
          ConfigurationException.Kind.PRECISION_TOO_LARGE,
          String.format("invalid precision [%d] : 2^p registers exceed the limit of 2^%d", precision, MAX_PRECISION)
      );
    }
  }

  /**
   * Rebuilds a sketch from a record written by {@link #toRecord()}.
   *
   * @throws SerializationException if the record is malformed, or its fingerprint shows it was
   *     written with another hash family class or element type
   */
  public static <E> HyperLogLog<E> fromRecord(SketchRecord record, ElementEncoder<E> encoder, HashFamily hashFamily)
      throws SerializationException, ConfigurationException
  {
    Preconditions.checkNotNull(record, "record");
    record.validate();

    HyperLogLog<E> sketch = create(record.getP(), encoder, hashFamily);
    if (sketch.fingerprint != record.getFingerprint()) {
      LOG.debug(
          "Rejected record with fingerprint [{}], expected [{}]",
          Long.toUnsignedString(record.getFingerprint()),
          Long.toUnsignedString(sketch.fingerprint)
      );
      throw new SerializationException(
          SerializationException.Kind.FINGERPRINT_MISMATCH,
          String.format(
              "fingerprint mismatch : record was not written with hash family [%s] and element type [%s]",
              hashFamily.getClass().getName(),
              Fingerprints.describeTag(encoder)
          )
      );
    }
    System.arraycopy(record.getRegisters(), 0, sketch.registers, 0, sketch.registers.length);
    return sketch;
  }

  public SketchRecord toRecord()
  {
    return new SketchRecord(p, registers.length, registers.clone(), fingerprint);
  }

  @Override
  public void add(E value)
  {
    add64BitsHash(hashFunction.hashObject(value, encoder).asLong());
  }

  public void addAll(Iterable<? extends E> values)
  {
    for (E value : values) {
      add(value);
    }
  }

  private void add64BitsHash(long hash)
  {
    final int bucket = (int) (hash >>> (Long.SIZE - p));
    // a remainder of all zeros would give 65
    byte rank = (byte) Math.min(Long.numberOfLeadingZeros(hash << p) + 1, MAX_RANK);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  @Override
  public void merge(HyperLogLog<E> that) throws MergeException
  {
    Preconditions.checkNotNull(that, "that");
    if (this.p != that.p) {
      LOG.debug("Rejected merge of precision [{}] into precision [{}]", that.p, this.p);
      throw new MergeException(this.p, that.p);
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  @Override
  public long cardinality()
  {
    return HllEstimator.estimate(registers);
  }

  @Override
  public void reset()
  {
    Arrays.fill(registers, (byte) 0);
  }

  public boolean isEmpty()
  {
    for (byte register : registers) {
      if (register != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return an independent sketch with the same registers, encoder and hash family
   */
  public HyperLogLog<E> copy()
  {
    return new HyperLogLog<>(p, encoder, hashFamily, fingerprint, registers.clone());
  }

  /**
   * @return a sketch with the same precision, encoder and hash family and no registers set
   */
  public HyperLogLog<E> emptyCopy()
  {
    return new HyperLogLog<>(p, encoder, hashFamily, fingerprint, new byte[registers.length]);
  }

  public int getPrecision()
  {
    return p;
  }

  public int getRegisterCount()
  {
    return registers.length;
  }

  public byte[] getRegisters()
  {
    return registers.clone();
  }

  public ElementEncoder<E> getEncoder()
  {
    return encoder;
  }

  public HashFamily getHashFamily()
  {
    return hashFamily;
  }

  public double relativeStandardError()
  {
    return 1.04 / Math.sqrt(registers.length);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `p`, encoder and hash family references
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HyperLogLog<?> that = (HyperLogLog<?>) o;
    return p == that.p
        && fingerprint == that.fingerprint
        && Arrays.equals(registers, that.registers);
  }

  @Override
  public int hashCode()
  {
    return 31 * (31 * p + Long.hashCode(fingerprint)) + Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return "HyperLogLog{" +
        "p=" + p +
        ", m=" + registers.length +
        ", hashFamily=" + hashFamily.getClass().getSimpleName() +
        ", elementType=" + Fingerprints.describeTag(encoder) +
        '}';
  }
}
