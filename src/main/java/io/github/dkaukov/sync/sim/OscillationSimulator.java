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
package io.github.dkaukov.sync.sim;

import java.util.Arrays;
import java.util.Random;

import javax.annotation.Nonnull;

import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Builder;
import lombok.Getter;

/**
 * Simulates sets of noisy, partially phase-locked oscillations, one per channel:
 * {@code amplitude * cos(2*pi*f*t + phase[c] + phaseSd[c] * e) + noise * h}, where {@code e} is a
 * standard normal drawn once per trial and channel and {@code h} once per sample.
 */
@Getter
public final class OscillationSimulator {

  private final int numChannels;
  private final double frequency;
  private final double amplitude;
  private final double[] phase;
  private final double[] phaseSd;
  private final double noise;
  private final int numTrials;
  private final double timeRange;
  private final double smpRate;

  @Builder
  private OscillationSimulator(Integer numChannels, Double frequency, Double amplitude, double[] phase,
                               double[] phaseSd, Double noise, Integer numTrials, Double timeRange, Double smpRate) {
    this.numChannels = numChannels != null ? numChannels : 2;
    this.frequency = frequency != null ? frequency : 32.0;
    this.amplitude = amplitude != null ? amplitude : 1.0;
    this.phase = perChannel("phase", phase, this.numChannels);
    this.phaseSd = perChannel("phase_sd", phaseSd, this.numChannels);
    this.noise = noise != null ? noise : 0.0;
    this.numTrials = numTrials != null ? numTrials : 1000;
    this.timeRange = timeRange != null ? timeRange : 1.0;
    this.smpRate = smpRate != null ? smpRate : 1000.0;
    if (this.numChannels < 1 || this.numTrials < 1) {
      throw new ConfigurationException("need at least one channel and one trial");
    }
    if (!(this.smpRate > 0) || !(this.timeRange > 0) || this.noise < 0) {
      throw new ConfigurationException("smp_rate and time_range must be positive, noise non-negative");
    }
  }

  private static double[] perChannel(String name, double[] values, int channels) {
    if (values == null) {
      return new double[channels];
    }
    if (values.length == 1) {
      double[] out = new double[channels];
      Arrays.fill(out, values[0]);
      return out;
    }
    if (values.length != channels) {
      throw new ConfigurationException(name + " needs 1 or " + channels + " values, got " + values.length);
    }
    return values.clone();
  }

  public double[] getPhase() {
    return phase.clone();
  }

  public double[] getPhaseSd() {
    return phaseSd.clone();
  }

  /** Number of samples per trial. */
  public int numTimepts() {
    return (int) Math.round(timeRange * smpRate);
  }

  /** Sample times, starting at 0. */
  public double[] timepts() {
    double[] t = new double[numTimepts()];
    for (int i = 0; i < t.length; i++) {
      t[i] = i / smpRate;
    }
    return t;
  }

  /**
   * Draw one data set.
   *
   * @return real array shaped {@code (time, trial, channel)}
   */
  public NdArray simulate(@Nonnull Random random) {
    int nt = numTimepts();
    double[] t = timepts();
    double[] data = new double[nt * numTrials * numChannels];
    double w = 2 * Math.PI * frequency;
    for (int trial = 0; trial < numTrials; trial++) {
      for (int c = 0; c < numChannels; c++) {
        double ph = phase[c] + phaseSd[c] * random.nextGaussian();
        for (int i = 0; i < nt; i++) {
          data[(i * numTrials + trial) * numChannels + c] = amplitude * Math.cos(w * t[i] + ph);
        }
      }
    }
    if (noise > 0) {
      for (int i = 0; i < data.length; i++) {
        data[i] += noise * random.nextGaussian();
      }
    }
    return NdArray.wrap(new int[]{nt, numTrials, numChannels}, data, null);
  }
}
