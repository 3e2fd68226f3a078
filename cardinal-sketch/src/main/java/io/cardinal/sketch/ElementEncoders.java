package io.cardinal.sketch;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;

import java.nio.charset.StandardCharsets;

/**
 * Built-in encoders. Numbers are funneled little-endian, strings as UTF-8.
 */
public final class ElementEncoders
{
  private ElementEncoders()
  {
  }

  public static ElementEncoder<Long> longs()
  {
    return LongEncoder.INSTANCE;
  }

  public static ElementEncoder<Integer> integers()
  {
    return IntegerEncoder.INSTANCE;
  }

  public static ElementEncoder<Short> shorts()
  {
    return ShortEncoder.INSTANCE;
  }

  public static ElementEncoder<Byte> bytes()
  {
    return ByteEncoder.INSTANCE;
  }

  public static ElementEncoder<Double> doubles()
  {
    return DoubleEncoder.INSTANCE;
  }

  public static ElementEncoder<Float> floats()
  {
    return FloatEncoder.INSTANCE;
  }

  public static ElementEncoder<CharSequence> strings()
  {
    return StringEncoder.INSTANCE;
  }

  public static ElementEncoder<byte[]> byteArrays()
  {
    return ByteArrayEncoder.INSTANCE;
  }

  /**
   * Wraps a funnel of a custom element type.
   *
   * @param typeTag non-empty ASCII name of the element type
   */
  public static <E> ElementEncoder<E> of(String typeTag, Funnel<? super E> funnel)
  {
    Preconditions.checkNotNull(typeTag, "typeTag");
    Preconditions.checkNotNull(funnel, "funnel");
    Preconditions.checkArgument(!typeTag.isEmpty(), "typeTag must not be empty");
    Preconditions.checkArgument(CharMatcher.ascii().matchesAllOf(typeTag), "typeTag [%s] must be ASCII", typeTag);
    return new CustomEncoder<>(tag(typeTag), funnel);
  }

  private static byte[] tag(String name)
  {
    return name.getBytes(StandardCharsets.US_ASCII);
  }

  private enum LongEncoder implements ElementEncoder<Long>
  {
    INSTANCE;

    @Override
    public void funnel(Long value, PrimitiveSink into)
    {
      into.putLong(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("i64");
    }
  }

  private enum IntegerEncoder implements ElementEncoder<Integer>
  {
    INSTANCE;

    @Override
    public void funnel(Integer value, PrimitiveSink into)
    {
      into.putInt(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("i32");
    }
  }

  private enum ShortEncoder implements ElementEncoder<Short>
  {
    INSTANCE;

    @Override
    public void funnel(Short value, PrimitiveSink into)
    {
      into.putShort(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("i16");
    }
  }

  private enum ByteEncoder implements ElementEncoder<Byte>
  {
    INSTANCE;

    @Override
    public void funnel(Byte value, PrimitiveSink into)
    {
      into.putByte(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("i8");
    }
  }

  private enum DoubleEncoder implements ElementEncoder<Double>
  {
    INSTANCE;

    @Override
    public void funnel(Double value, PrimitiveSink into)
    {
      into.putDouble(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("f64");
    }
  }

  private enum FloatEncoder implements ElementEncoder<Float>
  {
    INSTANCE;

    @Override
    public void funnel(Float value, PrimitiveSink into)
    {
      into.putFloat(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("f32");
    }
  }

  private enum StringEncoder implements ElementEncoder<CharSequence>
  {
    INSTANCE;

    @Override
    public void funnel(CharSequence value, PrimitiveSink into)
    {
      into.putString(value, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("String");
    }
  }

  private enum ByteArrayEncoder implements ElementEncoder<byte[]>
  {
    INSTANCE;

    @Override
    public void funnel(byte[] value, PrimitiveSink into)
    {
      into.putBytes(value);
    }

    @Override
    public byte[] typeTag()
    {
      return tag("bytes");
    }
  }

  private static final class CustomEncoder<E> implements ElementEncoder<E>
  {
    private final byte[] typeTag;
    private final Funnel<? super E> funnel;

    CustomEncoder(byte[] typeTag, Funnel<? super E> funnel)
    {
      this.typeTag = typeTag;
      this.funnel = funnel;
    }

    @Override
    public void funnel(E value, PrimitiveSink into)
    {
      funnel.funnel(value, into);
    }

    @Override
    public byte[] typeTag()
    {
      return typeTag.clone();
    }
  }
}
