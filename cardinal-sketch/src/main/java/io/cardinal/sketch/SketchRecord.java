package io.cardinal.sketch;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLong;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Portable form of a sketch: precision, register count, raw registers and the fingerprint of
 * the hash family and element type that filled them.
 *
 * <p>The fingerprint is an unsigned 64-bit value, kept here in a {@code long} and written to
 * JSON as a non-negative number.
 */
@JsonPropertyOrder({"p", "m", "registers", "fingerprint"})
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE,
    setterVisibility = JsonAutoDetect.Visibility.NONE
)
public final class SketchRecord
{
  private final int p;
  private final int m;
  private final byte[] registers;
  private final long fingerprint;

  public SketchRecord(int p, int m, byte[] registers, long fingerprint)
  {
    this.p = p;
    this.m = m;
    this.registers = registers;
    this.fingerprint = fingerprint;
  }

  @JsonCreator
  private static SketchRecord fromJson(
      @JsonProperty(value = "p", required = true) int p,
      @JsonProperty(value = "m", required = true) int m,
      @JsonProperty(value = "registers", required = true) byte[] registers,
      @JsonProperty(value = "fingerprint", required = true) BigInteger fingerprint
  )
  {
    Preconditions.checkArgument(fingerprint != null, "fingerprint must not be null");
    // rejects negative values and values of 2^64 and above
    return new SketchRecord(p, m, registers, UnsignedLong.valueOf(fingerprint).longValue());
  }

  @JsonProperty("p")
  public int getP()
  {
    return p;
  }

  @JsonProperty("m")
  public int getM()
  {
    return m;
  }

  @JsonProperty("registers")
  public byte[] getRegisters()
  {
    return registers == null ? null : registers.clone();
  }

  public long getFingerprint()
  {
    return fingerprint;
  }

  @JsonProperty("fingerprint")
  BigInteger getUnsignedFingerprint()
  {
    return UnsignedLong.fromLongBits(fingerprint).bigIntegerValue();
  }

  /**
   * Checks the structure of the record, not its fingerprint.
   */
  void validate() throws SerializationException
  {
    if (registers == null) {
      throw malformed("registers are missing");
    }
    try {
      HyperLogLog.checkPrecision(p);
    }
    catch (ConfigurationException e) {
      throw new SerializationException(SerializationException.Kind.MALFORMED, "malformed sketch record : " + e.getMessage(), e);
    }
    if (m != 1 << p) {
      throw malformed(String.format("m [%d] is not 2^p for p [%d]", m, p));
    }
    if (registers.length != m) {
      throw malformed(String.format("expected [%d] registers, found [%d]", m, registers.length));
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < 0 || registers[i] > HyperLogLog.MAX_RANK) {
        throw malformed(String.format("register [%d] holds [%d], outside [0, %d]", i, registers[i] & 0xff, HyperLogLog.MAX_RANK));
      }
    }
  }

  private static SerializationException malformed(String reason)
  {
    return new SerializationException(SerializationException.Kind.MALFORMED, "malformed sketch record : " + reason);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SketchRecord)) {
      return false;
    }
    SketchRecord that = (SketchRecord) o;
    return p == that.p
        && m == that.m
        && fingerprint == that.fingerprint
        && Arrays.equals(registers, that.registers);
  }

  @Override
  public int hashCode()
  {
    int result = 31 * p + m;
    result = 31 * result + Long.hashCode(fingerprint);
    return 31 * result + Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return "SketchRecord{" +
        "p=" + p +
        ", m=" + m +
        ", fingerprint=" + Long.toUnsignedString(fingerprint) +
        '}';
  }
}
