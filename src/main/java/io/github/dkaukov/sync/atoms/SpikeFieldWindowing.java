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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import javax.annotation.Nullable;

import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.SyncMethod;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Pools field phases at spike times within sliding windows (PLV and PPC).
 *
 * <p>A window with center {@code c} and width {@code w} covers {@code [c - w/2, c + w/2]}, both
 * ends included. Each spike is mapped to the nearest field timepoint; spikes outside the field's
 * time range are dropped.
 */
@Slf4j
public final class SpikeFieldWindowing {

  private static final double EPS = 1e-9;

  private SpikeFieldWindowing() {}

  /** Per-window outputs, {@code (freq, window, free)} and counts {@code (window, free)}. */
  @Getter
  public static final class Result {
    private final NdArray sync;
    @Nullable
    private final NdArray phase;
    private final NdArray counts;
    private final double[] centers;

    Result(NdArray sync, @Nullable NdArray phase, NdArray counts, double[] centers) {
      this.sync = sync;
      this.phase = phase;
      this.counts = counts;
      this.centers = centers;
    }

    public double[] getCenters() {
      return centers.clone();
    }
  }

  /**
   * Window centers stepping by {@code width} from {@code first + width/2} while the window
   * still ends at or before {@code last}.
   */
  public static double[] defaultCenters(double first, double last, double width) {
    List<Double> centers = new ArrayList<>();
    double start = first + width / 2;
    for (int i = 0; ; i++) {
      double c = start + i * width;
      if (c > last - width / 2 + EPS) {
        break;
      }
      centers.add(c);
    }
    double[] out = new double[centers.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = centers.get(i);
    }
    return out;
  }

  /** Centers whose whole window lies within {@code [first, last]}. */
  public static double[] fittingCenters(double[] centers, double first, double last, double width) {
    return Arrays.stream(centers)
      .filter(c -> c - width / 2 >= first - EPS && c + width / 2 <= last + EPS)
      .toArray();
  }

  /**
   * Spike-conditioned PLV or PPC. Every spike contributes one phase sample per taper; samples
   * are pooled over trials. Cells with an empty pool report NaN.
   *
   * @param spikes     canonical spike trains {@code (trial, time, free)}, non-zero means a spike
   * @param spikeTimes time of each spike sample
   * @param field      canonical field spectrum {@code (trial, freq, time, taper, free)}
   * @param fieldTimes time of each field spectral sample, ascending
   * @param centers    window centers
   * @param width      window width
   */
  public static Result compute(NdArray spikes, double[] spikeTimes, NdArray field, double[] fieldTimes,
                               SyncMethod method, double[] centers, double width, boolean returnPhase) {
    int[] ss = spikes.shape();
    int[] fs = field.shape();
    int nTrials = fs[0];
    int nf = fs[1];
    int nt = fs[2];
    int nk = fs[3];
    int np = fs[4];
    int ns = ss[1];
    if (ss[0] != nTrials || ss[2] != np) {
      throw new IllegalArgumentException("spike shape " + Arrays.toString(ss) + " does not match field "
        + Arrays.toString(fs));
    }
    if (spikeTimes.length != ns || fieldTimes.length != nt) {
      throw new IllegalArgumentException("timepoint arrays do not match the time axes");
    }
    if (method == SyncMethod.COHERENCE) {
      throw new IllegalArgumentException("coherence is not a spike-conditioned statistic");
    }
    int nw = centers.length;
    if (nw == 0) {
      throw new ConfigurationException("no analysis windows");
    }
    // nearest field sample for every spike sample, -1 if outside the field range
    int[] nearest = new int[ns];
    for (int s = 0; s < ns; s++) {
      nearest[s] = nearestIndex(fieldTimes, spikeTimes[s]);
    }
    int cells = nf * nw * np;
    double[] sumCos = new double[cells];
    double[] sumSin = new double[cells];
    long[] valid = new long[cells];
    long[] counts = new long[nw * np];
    long spikesSeen = 0;
    for (int n = 0; n < nTrials; n++) {
      for (int s = 0; s < ns; s++) {
        int ti = nearest[s];
        if (ti < 0) {
          continue;
        }
        for (int p = 0; p < np; p++) {
          if (spikes.realAt((n * ns + s) * np + p) == 0) {
            continue;
          }
          spikesSeen++;
          for (int w = 0; w < nw; w++) {
            if (Math.abs(spikeTimes[s] - centers[w]) > width / 2 + EPS) {
              continue;
            }
            counts[w * np + p] += nk;
            for (int f = 0; f < nf; f++) {
              int o = (f * nw + w) * np + p;
              for (int k = 0; k < nk; k++) {
                int i = (((n * nf + f) * nt + ti) * nk + k) * np + p;
                double re = field.realAt(i);
                double im = field.imagAt(i);
                double mag = Math.hypot(re, im);
                if (mag > 0) {
                  sumCos[o] += re / mag;
                  sumSin[o] += im / mag;
                  valid[o]++;
                }
              }
            }
          }
        }
      }
    }
    log.debug("{} spike samples pooled into {} windows", spikesSeen, nw);
    double[] sync = new double[cells];
    double[] phase = returnPhase ? new double[cells] : null;
    for (int o = 0; o < cells; o++) {
      long m = valid[o];
      sync[o] = SynchronyEngine.statistic(method, sumCos[o], sumSin[o], m);
      if (phase != null) {
        phase[o] = m == 0 ? Double.NaN : SynchronyEngine.meanPhase(sumCos[o], sumSin[o]);
      }
    }
    double[] c = new double[counts.length];
    for (int i = 0; i < c.length; i++) {
      c[i] = counts[i];
    }
    int[] out = {nf, nw, np};
    return new Result(NdArray.real(sync, out), phase == null ? null : NdArray.real(phase, out),
      NdArray.real(c, nw, np), centers.clone());
  }

  static int nearestIndex(double[] times, double t) {
    int len = times.length;
    if (len == 0 || t < times[0] - EPS || t > times[len - 1] + EPS) {
      return -1;
    }
    int i = Arrays.binarySearch(times, t);
    if (i >= 0) {
      return i;
    }
    int hi = -i - 1;
    if (hi >= len) {
      return len - 1;
    }
    if (hi == 0) {
      return 0;
    }
    return t - times[hi - 1] <= times[hi] - t ? hi - 1 : hi;
  }
}
