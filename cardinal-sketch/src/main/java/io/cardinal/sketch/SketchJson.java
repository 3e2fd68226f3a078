package io.cardinal.sketch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.google.common.base.Preconditions;

import java.io.IOException;

/**
 * JSON form of {@link SketchRecord}:
 * <pre>
 * {"p":10,"m":1024,"registers":"AAEC...","fingerprint":12345678901234567890}
 * </pre>
 * Registers are written as base64; a JSON array of numbers is accepted too.
 */
public final class SketchJson
{
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
      .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

  static {
    // "p":"10" or a quoted fingerprint is malformed, not a number
    OBJECT_MAPPER.coercionConfigFor(LogicalType.Integer)
        .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
  }

  private SketchJson()
  {
  }

  public static String toJson(HyperLogLog<?> sketch) throws SerializationException
  {
    Preconditions.checkNotNull(sketch, "sketch");
    try {
      return OBJECT_MAPPER.writeValueAsString(sketch.toRecord());
    }
    catch (JsonProcessingException e) {
      throw new SerializationException(SerializationException.Kind.MALFORMED, "cannot write sketch record", e);
    }
  }

  public static byte[] toJsonBytes(HyperLogLog<?> sketch) throws SerializationException
  {
    Preconditions.checkNotNull(sketch, "sketch");
    try {
      return OBJECT_MAPPER.writeValueAsBytes(sketch.toRecord());
    }
    catch (JsonProcessingException e) {
      throw new SerializationException(SerializationException.Kind.MALFORMED, "cannot write sketch record", e);
    }
  }

  public static SketchRecord readRecord(String json) throws SerializationException
  {
    Preconditions.checkNotNull(json, "json");
    try {
      return OBJECT_MAPPER.readValue(json, SketchRecord.class);
    }
    catch (JsonProcessingException e) {
      throw new SerializationException(SerializationException.Kind.MALFORMED, "malformed sketch record : " + e.getOriginalMessage(), e);
    }
  }

  public static SketchRecord readRecord(byte[] json) throws SerializationException
  {
    Preconditions.checkNotNull(json, "json");
    try {
      return OBJECT_MAPPER.readValue(json, SketchRecord.class);
    }
    catch (IOException e) {
      throw new SerializationException(SerializationException.Kind.MALFORMED, "malformed sketch record : " + e.getMessage(), e);
    }
  }

  /**
   * @throws SerializationException if the json is not a well-formed sketch record, or was
   *     written with another hash family class or element type
   */
  public static <E> HyperLogLog<E> fromJson(String json, ElementEncoder<E> encoder, HashFamily hashFamily)
      throws SerializationException, ConfigurationException
  {
    return HyperLogLog.fromRecord(readRecord(json), encoder, hashFamily);
  }

  public static <E> HyperLogLog<E> fromJson(String json, ElementEncoder<E> encoder)
      throws SerializationException, ConfigurationException
  {
    return fromJson(json, encoder, HashFamilies.defaultFamily());
  }

  public static <E> HyperLogLog<E> fromJson(byte[] json, ElementEncoder<E> encoder, HashFamily hashFamily)
      throws SerializationException, ConfigurationException
  {
    return HyperLogLog.fromRecord(readRecord(json), encoder, hashFamily);
  }
}
