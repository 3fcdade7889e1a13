/*
 * This file is licensed under the GNU General Public License v3.0.
 *
 * You may obtain a copy of the License at
 * https://www.gnu.org/licenses/gpl-3.0.html
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU General Public License for more details.
 */
package io.github.dkaukov.sync.dsp;

/**
 * FIR tap designers for the band-filter decomposition: Kaiser-windowed band-pass.
 * Band-pass designs are normalized to unity gain at the band center.
 */
public final class FilterDesignUtils {
  private FilterDesignUtils() {}

  /** Band-pass via difference of two windowed sincs (Kaiser window). Pass (lowHz..highHz). */
  public static double[] designBandPassKaiser(int numTaps, double lowHz, double highHz, double sampleRate,
                                              double attenuationDb) {
    if (!(lowHz > 0) || !(highHz > lowHz) || highHz >= sampleRate / 2) {
      throw new IllegalArgumentException("band (" + lowHz + ", " + highHz + ") invalid for sample rate " + sampleRate);
    }
    if ((numTaps & 1) == 0) {
      numTaps++; // force odd, symmetric around the center tap
    }
    double[] h = new double[numTaps];
    double fl = lowHz / sampleRate;
    double fh = highHz / sampleRate;
    int mid = numTaps / 2;
    double beta = kaiserBeta(attenuationDb);
    double denom = besselI0(beta);

    for (int i = 0; i < numTaps; i++) {
      int n = i - mid;
      double sincH = (n == 0)
        ? 2.0 * fh
        : Math.sin(2.0 * Math.PI * fh * n) / (Math.PI * n);
      double sincL = (n == 0)
        ? 2.0 * fl
        : Math.sin(2.0 * Math.PI * fl * n) / (Math.PI * n);
      double r = numTaps == 1 ? 0.0 : (2.0 * i) / (numTaps - 1) - 1.0; // -1..+1 across the window
      double w = besselI0(beta * Math.sqrt(1.0 - r * r)) / denom;
      h[i] = (sincH - sincL) * w;
    }
    normalizeGainAt(h, Math.sqrt(lowHz * highHz), sampleRate);
    return h;
  }

  /**
   * Tap count for a band edge: about three cycles of the lower edge, odd.
   */
  public static int suggestedTaps(double lowHz, double sampleRate) {
    int n = (int) Math.ceil(3.0 * sampleRate / lowHz);
    return (n & 1) == 0 ? n + 1 : n;
  }

  // ---------- helpers ----------

  /** Scale taps so |H(freqHz)| = 1. */
  public static void normalizeGainAt(double[] taps, double freqHz, double sampleRate) {
    double w = 2.0 * Math.PI * freqHz / sampleRate;
    double re = 0;
    double im = 0;
    for (int n = 0; n < taps.length; n++) {
      re += taps[n] * Math.cos(w * n);
      im -= taps[n] * Math.sin(w * n);
    }
    double mag = Math.hypot(re, im);
    if (mag == 0.0) {
      return;
    }
    for (int i = 0; i < taps.length; i++) {
      taps[i] /= mag;
    }
  }

  /** Kaiser window beta from desired stopband attenuation (dB). */
  public static double kaiserBeta(double attenuationDb) {
    if (attenuationDb > 50.0) {
      return 0.1102 * (attenuationDb - 8.7);
    } else if (attenuationDb >= 21.0) {
      return 0.5842 * Math.pow(attenuationDb - 21.0, 0.4)
        + 0.07886 * (attenuationDb - 21.0);
    } else {
      return 0.0;
    }
  }

  /** Zeroth-order modified Bessel function of the first kind (I0), series approx. */
  public static double besselI0(double x) {
    double sum = 1.0;
    double y = (x * x) / 4.0;
    double term = y;
    for (int k = 1; k < 30; k++) { // 25–30 terms is plenty
      sum += term;
      term *= y / (k * k);
    }
    return sum;
  }
}
