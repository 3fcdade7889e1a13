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

import java.util.Arrays;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Thin helpers over the commons-math radix-2 FFT, working on split real/imaginary planes.
 */
public final class FftUtils {
  private FftUtils() {}

  /** Smallest power of two >= n (1 for n <= 1). */
  public static int nextPowerOfTwo(int n) {
    int p = 1;
    while (p < n) {
      p <<= 1;
    }
    return p;
  }

  /** In-place forward DFT; {@code data = {re, im}}, length a power of two. */
  public static void forward(double[][] data) {
    FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
  }

  /** In-place inverse DFT, scaled by 1/N. */
  public static void inverse(double[][] data) {
    FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.INVERSE);
  }

  /** Zero-padded split planes of a real signal. */
  public static double[][] padded(double[] x, int nfft) {
    return new double[][]{Arrays.copyOf(x, nfft), new double[nfft]};
  }

  /**
   * Analytic signal x + i·H{x} via the frequency-domain Hilbert transform
   * (negative frequencies zeroed, positive doubled), zero-padded to a power of two.
   *
   * @return {@code {re, im}}, each the length of {@code x}
   */
  public static double[][] analytic(double[] x) {
    int n = x.length;
    if (n == 0) {
      return new double[][]{new double[0], new double[0]};
    }
    int nfft = nextPowerOfTwo(n);
    double[][] d = padded(x, nfft);
    forward(d);
    int half = nfft / 2;
    for (int k = 1; k < nfft; k++) {
      double g;
      if (k < half) {
        g = 2.0;
      } else if (k == half) {
        g = 1.0;
      } else {
        g = 0.0;
      }
      d[0][k] *= g;
      d[1][k] *= g;
    }
    inverse(d);
    return new double[][]{Arrays.copyOf(d[0], n), Arrays.copyOf(d[1], n)};
  }
}
