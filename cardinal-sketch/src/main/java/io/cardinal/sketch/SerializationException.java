package io.cardinal.sketch;

public class SerializationException extends SketchException
{
  public enum Kind
  {
    // a field is missing, unknown or out of range, or the input is not a record at all
    MALFORMED,
    // the record was written with another hash family or element type
    FINGERPRINT_MISMATCH
  }

  private final Kind kind;

  public SerializationException(Kind kind, String message)
  {
    super(message);
    this.kind = kind;
  }

  public SerializationException(Kind kind, String message, Throwable cause)
  {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind()
  {
    return kind;
  }
}
