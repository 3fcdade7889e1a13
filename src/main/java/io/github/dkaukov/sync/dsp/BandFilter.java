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

import io.github.dkaukov.sync.SpectralMethod;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Band-filter decomposition: one Kaiser band-pass FIR per band, run as a causal streaming
 * filter with group-delay compensation, followed by the Hilbert analytic signal.
 *
 * The filter starts from zero state, so the first samples carry a start-up transient.
 * This makes the output not exactly time-reversal symmetric.
 */
public class BandFilter implements SpectralProvider {

  @Getter
  private final double sampleRate;
  private final double[][] bands;
  private final double[][] taps;

  /**
   * @param sampleRate    sampling rate (Hz)
   * @param bands         {@code [nBands][2]} band edges (Hz)
   * @param attenuationDb Kaiser stopband attenuation
   * @param numTaps       fixed tap count, or {@code null} to size each filter from its lower edge
   */
  public BandFilter(double sampleRate, double[][] bands, double attenuationDb, Integer numTaps) {
    this.sampleRate = sampleRate;
    this.bands = new double[bands.length][];
    this.taps = new double[bands.length][];
    for (int b = 0; b < bands.length; b++) {
      this.bands[b] = bands[b].clone();
      double lo = bands[b][0];
      double hi = bands[b][1];
      int m = numTaps != null ? numTaps : FilterDesignUtils.suggestedTaps(lo, sampleRate);
      this.taps[b] = FilterDesignUtils.designBandPassKaiser(m, lo, hi, sampleRate, attenuationDb);
    }
  }

  @Override
  public SpectralMethod method() {
    return SpectralMethod.BANDFILTER;
  }

  @Override
  public Spectrogram transform(double[] signal) {
    int n = signal.length;
    int nb = bands.length;
    double[] re = new double[nb * n];
    double[] im = new double[nb * n];
    for (int b = 0; b < nb; b++) {
      double[] filtered = new FastFIR(taps[b]).filterAligned(signal);
      double[][] analytic = FftUtils.analytic(filtered);
      System.arraycopy(analytic[0], 0, re, b * n, n);
      System.arraycopy(analytic[1], 0, im, b * n, n);
    }
    double[] timepts = new double[n];
    for (int i = 0; i < n; i++) {
      timepts[i] = i / sampleRate;
    }
    return new Spectrogram(re, im, nb, n, 1, NdArray.matrix(bands), timepts);
  }

  /** Tap count of each band's filter. */
  public int[] getFilterLengths() {
    int[] out = new int[taps.length];
    for (int b = 0; b < taps.length; b++) {
      out[b] = taps[b].length;
    }
    return out;
  }
}
