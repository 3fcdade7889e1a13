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

import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.SpectralMethod;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Sliding-window multitaper spectrogram.
 *
 * Windows of {@code round(timeWidth·fs)} samples start every {@code round(spacing·fs)} samples
 * while they fit inside the signal; each window is (optionally) de-meaned, multiplied by every
 * DPSS taper and zero-padded to the next power of two. Output frequencies are
 * {@code 0..fs/2} in steps of {@code fs/nfft}; timepoints are the window centers.
 * Tapers are kept separate, callers average them if needed.
 */
public class Multitaper implements SpectralProvider {

  @Getter
  private final double sampleRate;
  @Getter
  private final int windowLength;
  @Getter
  private final int windowSpacing;
  @Getter
  private final int nfft;
  private final boolean removeDc;
  private final double[][] tapers;

  /**
   * @param sampleRate sampling rate (Hz)
   * @param timeWidth  window length (s)
   * @param freqWidth  full frequency smoothing bandwidth (Hz)
   * @param spacing    window step (s)
   * @param numTapers  taper count, or {@code null} for floor(2·NW − 1)
   * @param removeDc   subtract each window's mean before tapering
   */
  public Multitaper(double sampleRate, double timeWidth, double freqWidth, double spacing,
                    Integer numTapers, boolean removeDc) {
    this.sampleRate = sampleRate;
    this.windowLength = (int) Math.round(timeWidth * sampleRate);
    this.windowSpacing = Math.max(1, (int) Math.round(spacing * sampleRate));
    if (windowLength < 2) {
      throw new ConfigurationException("multitaper window of " + timeWidth + " s is under 2 samples");
    }
    this.nfft = FftUtils.nextPowerOfTwo(windowLength);
    this.removeDc = removeDc;
    double nw = timeWidth * freqWidth / 2.0;
    int k = numTapers != null ? numTapers : defaultTaperCount(nw);
    if (k < 1 || k > windowLength) {
      throw new ConfigurationException("invalid taper count " + k);
    }
    this.tapers = Dpss.tapers(windowLength, nw, k);
  }

  /** floor(2·NW − 1), at least one taper. */
  public static int defaultTaperCount(double timeHalfBandwidth) {
    return Math.max(1, (int) Math.floor(2.0 * timeHalfBandwidth - 1.0));
  }

  public int getNumTapers() {
    return tapers.length;
  }

  @Override
  public SpectralMethod method() {
    return SpectralMethod.MULTITAPER;
  }

  @Override
  public Spectrogram transform(double[] signal) {
    int n = signal.length;
    if (n < windowLength) {
      throw new ConfigurationException("signal of " + n + " samples is shorter than the "
        + windowLength + "-sample multitaper window");
    }
    int numWindows = (n - windowLength) / windowSpacing + 1;
    int numFreqs = nfft / 2 + 1;
    int numTapers = tapers.length;
    double[] re = new double[numFreqs * numWindows * numTapers];
    double[] im = new double[re.length];
    double[] timepts = new double[numWindows];
    double[] segment = new double[windowLength];

    for (int w = 0; w < numWindows; w++) {
      int start = w * windowSpacing;
      timepts[w] = (start + windowLength / 2.0) / sampleRate;
      double mean = 0;
      if (removeDc) {
        for (int i = 0; i < windowLength; i++) {
          mean += signal[start + i];
        }
        mean /= windowLength;
      }
      for (int k = 0; k < numTapers; k++) {
        double[] taper = tapers[k];
        for (int i = 0; i < windowLength; i++) {
          segment[i] = (signal[start + i] - mean) * taper[i];
        }
        double[][] d = FftUtils.padded(segment, nfft);
        FftUtils.forward(d);
        for (int f = 0; f < numFreqs; f++) {
          int idx = (f * numWindows + w) * numTapers + k;
          re[idx] = d[0][f];
          im[idx] = d[1][f];
        }
      }
    }
    double[] freqs = new double[numFreqs];
    for (int f = 0; f < numFreqs; f++) {
      freqs[f] = f * sampleRate / nfft;
    }
    return new Spectrogram(re, im, numFreqs, numWindows, numTapers, NdArray.vector(freqs), timepts);
  }
}
