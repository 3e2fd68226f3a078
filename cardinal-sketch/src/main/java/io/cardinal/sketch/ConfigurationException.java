package io.cardinal.sketch;

/**
 * Thrown when a sketch cannot be built from the given precision or hash family.
 * No sketch is produced.
 */
public class ConfigurationException extends SketchException
{
  public enum Kind
  {
    PRECISION_BELOW_MINIMUM,
    PRECISION_TOO_LARGE,
    INVALID_HASH_FAMILY
  }

  private final Kind kind;

  public ConfigurationException(Kind kind, String message)
  {
    super(message);
    this.kind = kind;
  }

  public ConfigurationException(Kind kind, String message, Throwable cause)
  {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind()
  {
    return kind;
  }
}
