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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Complex spectrogram of one time series, laid out {@code [freq][time][taper]} in flat planes.
 * Timepoints are in seconds relative to the first input sample.
 */
public final class Spectrogram {

  private final double[] re;
  private final double[] im;
  @Getter
  private final int numFreqs;
  @Getter
  private final int numTimepts;
  @Getter
  private final int numTapers;
  @Getter
  private final NdArray freqs;
  private final double[] timepts;

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "planes are handed over by the provider")
  public Spectrogram(double[] re, double[] im, int numFreqs, int numTimepts, int numTapers,
                     NdArray freqs, double[] timepts) {
    if (re.length != numFreqs * numTimepts * numTapers || im.length != re.length) {
      throw new IllegalArgumentException("plane length does not match "
        + numFreqs + "x" + numTimepts + "x" + numTapers);
    }
    if (timepts.length != numTimepts) {
      throw new IllegalArgumentException("timepts length " + timepts.length + " != " + numTimepts);
    }
    this.re = re;
    this.im = im;
    this.numFreqs = numFreqs;
    this.numTimepts = numTimepts;
    this.numTapers = numTapers;
    this.freqs = freqs;
    this.timepts = timepts.clone();
  }

  public double real(int freq, int time, int taper) {
    return re[index(freq, time, taper)];
  }

  public double imag(int freq, int time, int taper) {
    return im[index(freq, time, taper)];
  }

  public double[] getTimepts() {
    return timepts.clone();
  }

  private int index(int freq, int time, int taper) {
    return (freq * numTimepts + time) * numTapers + taper;
  }
}
