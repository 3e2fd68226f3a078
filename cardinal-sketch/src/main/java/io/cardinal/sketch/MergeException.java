package io.cardinal.sketch;

/**
 * Thrown when two sketches of different precision are merged. Neither operand is modified.
 */
public class MergeException extends SketchException
{
  private final int expectedPrecision;
  private final int actualPrecision;

  public MergeException(int expectedPrecision, int actualPrecision)
  {
    super(String.format("precision mismatch : expected [%d], found [%d]", expectedPrecision, actualPrecision));
    this.expectedPrecision = expectedPrecision;
    this.actualPrecision = actualPrecision;
  }

  public int getExpectedPrecision()
  {
    return expectedPrecision;
  }

  public int getActualPrecision()
  {
    return actualPrecision;
  }
}
