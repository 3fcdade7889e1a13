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
import java.util.Comparator;
import java.util.stream.IntStream;

import org.apache.commons.math3.linear.EigenDecomposition;

/**
 * Discrete prolate spheroidal (Slepian) sequences.
 *
 * Tapers are the leading eigenvectors of the symmetric tridiagonal matrix
 * diag = ((N-1-2i)/2)²·cos(2πW), off-diag = i(N-i)/2, with W = NW/N.
 * Each taper has unit energy; even-order tapers have positive sum and odd-order
 * tapers start with a positive lobe.
 */
public final class Dpss {
  private Dpss() {}

  /**
   * @param length           taper length N
   * @param timeHalfBandwidth NW
   * @param numTapers        number of leading tapers K
   * @return {@code [K][N]} tapers
   */
  public static double[][] tapers(int length, double timeHalfBandwidth, int numTapers) {
    if (length < 2) {
      throw new IllegalArgumentException("taper length must be >= 2, got " + length);
    }
    if (numTapers < 1 || numTapers > length) {
      throw new IllegalArgumentException("invalid taper count " + numTapers + " for length " + length);
    }
    double w = timeHalfBandwidth / length;
    double cos = Math.cos(2.0 * Math.PI * w);
    double[] main = new double[length];
    double[] secondary = new double[length - 1];
    for (int i = 0; i < length; i++) {
      double c = (length - 1 - 2.0 * i) / 2.0;
      main[i] = c * c * cos;
    }
    for (int i = 1; i < length; i++) {
      secondary[i - 1] = i * (double) (length - i) / 2.0;
    }
    EigenDecomposition eig = new EigenDecomposition(main, secondary);
    double[] values = eig.getRealEigenvalues();
    int[] order = IntStream.range(0, values.length)
      .boxed()
      .sorted(Comparator.comparingDouble((Integer i) -> values[i]).reversed())
      .mapToInt(Integer::intValue)
      .toArray();

    double[][] out = new double[numTapers][];
    double thresh = Math.max(1e-7, 1.0 / length);
    for (int k = 0; k < numTapers; k++) {
      double[] v = eig.getEigenvector(order[k]).toArray();
      double energy = 0;
      for (double x : v) {
        energy += x * x;
      }
      double norm = 1.0 / Math.sqrt(energy);
      boolean flip;
      if ((k & 1) == 0) {
        flip = Arrays.stream(v).sum() < 0;
      } else {
        flip = false;
        for (double x : v) {
          if (Math.abs(x * norm) > thresh) {
            flip = x < 0;
            break;
          }
        }
      }
      double s = flip ? -norm : norm;
      for (int i = 0; i < v.length; i++) {
        v[i] *= s;
      }
      out[k] = v;
    }
    return out;
  }
}
