package io.cardinal.sketch;

/**
 * Base class of the recoverable failures reported by sketches: rejected construction,
 * rejected merge and rejected load.
 */
public abstract class SketchException extends Exception
{
  protected SketchException(String message)
  {
    super(message);
  }

  protected SketchException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
