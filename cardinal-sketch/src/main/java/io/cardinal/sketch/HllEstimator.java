package io.cardinal.sketch;

/**
 * Cardinality estimate of a register array, as described in
 * http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Regimes, in order: an untouched array estimates exactly 0; while some registers are
 * still empty and linear counting stays within 2.5 * m, linear counting is used; otherwise the
 * bias-corrected harmonic mean, with the large range correction once it exceeds 2^32 / 30.
 */
final class HllEstimator
{
  static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;

  private HllEstimator()
  {
  }

  static double alpha(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  static long estimate(byte[] registers)
  {
    final int m = registers.length;

    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      // registers go up to 64, past the range of an int or long shift
      registerSum += Math.scalb(1.0d, -registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    if (zeros == m) {
      return 0;
    }

    if (zeros > 0) { // small range correction
      final double linear = m * Math.log(m / (double) zeros);
      if (linear <= 2.5d * m) {
        return Math.round(linear);
      }
    }

    final double e = alpha(m) * m * m * (1 / registerSum);
    return Math.round(makeHighCorrection(e));
  }

  // Only reachable when the registers look like a 32-bit hash space close to saturation,
  // which a 64-bit hash does not produce at realistic cardinalities.
  private static double makeHighCorrection(double e)
  {
    if (e > HIGH_CORRECTION_THRESHOLD && e < TWO_TO_THE_THIRTY_TWO) {
      return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
    }
    return e;
  }
}
