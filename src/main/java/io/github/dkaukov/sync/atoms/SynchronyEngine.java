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
package io.github.dkaukov.sync.atoms;

import java.util.Arrays;

import javax.annotation.Nullable;

import io.github.dkaukov.sync.SyncMethod;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Trial-pooled synchrony statistics over canonical spectra.
 *
 * <p>Phase statistics work on the unit vector of the cross-spectral sample
 * {@code z1 * conj(z2)}; a sample whose product is exactly zero carries no phase and is left out
 * of the pool.
 */
public final class SynchronyEngine {
  private SynchronyEngine() {}

  /** Synchrony magnitude and optional mean phase, both {@code (freq, time, free)}. */
  @Getter
  public static final class Result {
    private final NdArray sync;
    @Nullable
    private final NdArray phase;

    Result(NdArray sync, @Nullable NdArray phase) {
      this.sync = sync;
      this.phase = phase;
    }
  }

  /**
   * Field-field synchrony between two canonical spectra {@code (trial, freq, time, taper, free)}
   * of equal shape. Tapers are complex-averaged before pooling over trials. Cells without a
   * defined sample report synchrony 0 and phase 0.
   */
  public static Result compute(NdArray spec1, NdArray spec2, SyncMethod method, boolean returnPhase) {
    int[] shape = spec1.shape();
    if (shape.length != 5 || !Arrays.equals(shape, spec2.shape())) {
      throw new IllegalArgumentException("canonical spectra must share a 5-d shape, got "
        + Arrays.toString(shape) + " and " + Arrays.toString(spec2.shape()));
    }
    int nTrials = shape[0];
    int nf = shape[1];
    int nt = shape[2];
    int nk = shape[3];
    int np = shape[4];
    double[] sync = new double[nf * nt * np];
    double[] phase = returnPhase ? new double[sync.length] : null;
    for (int f = 0; f < nf; f++) {
      for (int t = 0; t < nt; t++) {
        for (int p = 0; p < np; p++) {
          double crossRe = 0;
          double crossIm = 0;
          double power1 = 0;
          double power2 = 0;
          double sumCos = 0;
          double sumSin = 0;
          long valid = 0;
          for (int n = 0; n < nTrials; n++) {
            int base = (((n * nf + f) * nt + t) * nk) * np + p;
            double a = 0;
            double b = 0;
            double c = 0;
            double d = 0;
            for (int k = 0; k < nk; k++) {
              int i = base + k * np;
              a += spec1.realAt(i);
              b += spec1.imagAt(i);
              c += spec2.realAt(i);
              d += spec2.imagAt(i);
            }
            a /= nk;
            b /= nk;
            c /= nk;
            d /= nk;
            // (a + ib)(c - id)
            double xr = a * c + b * d;
            double xi = b * c - a * d;
            crossRe += xr;
            crossIm += xi;
            power1 += a * a + b * b;
            power2 += c * c + d * d;
            double mag = Math.hypot(xr, xi);
            if (mag > 0) {
              sumCos += xr / mag;
              sumSin += xi / mag;
              valid++;
            }
          }
          int o = (f * nt + t) * np + p;
          if (method == SyncMethod.COHERENCE) {
            double denom = Math.sqrt(power1 * power2);
            sync[o] = denom > 0 ? Math.hypot(crossRe, crossIm) / denom : 0.0;
          } else {
            double s = statistic(method, sumCos, sumSin, valid);
            sync[o] = Double.isNaN(s) ? 0.0 : s;
          }
          if (phase != null) {
            phase[o] = valid > 0 ? meanPhase(sumCos, sumSin) : 0.0;
          }
        }
      }
    }
    int[] out = {nf, nt, np};
    return new Result(NdArray.real(sync, out), phase == null ? null : NdArray.real(phase, out));
  }

  /**
   * PLV or PPC of {@code n} pooled unit vectors with the given component sums.
   *
   * @return NaN when the pool is too small for the statistic to be defined
   */
  public static double statistic(SyncMethod method, double sumCos, double sumSin, long n) {
    double r2 = sumCos * sumCos + sumSin * sumSin;
    switch (method) {
      case PLV:
        return n > 0 ? Math.sqrt(r2) / n : Double.NaN;
      case PPC:
        // pairwise average of cos(phi_i - phi_j) over distinct pairs
        return n > 1 ? (r2 - n) / ((double) n * (n - 1)) : Double.NaN;
      default:
        throw new IllegalArgumentException("not a phase statistic: " + method);
    }
  }

  /** Circular mean angle of the pooled unit vectors, in (-pi, pi]. */
  public static double meanPhase(double sumCos, double sumSin) {
    return wrap(Math.atan2(sumSin, sumCos));
  }

  static double wrap(double angle) {
    double a = Math.IEEEremainder(angle, 2 * Math.PI);
    return a <= -Math.PI ? a + 2 * Math.PI : a;
  }
}
