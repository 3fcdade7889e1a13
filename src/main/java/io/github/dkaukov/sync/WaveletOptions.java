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
package io.github.dkaukov.sync;

import io.github.dkaukov.sync.dsp.MorletWavelet;
import io.github.dkaukov.sync.dsp.SpectralProvider;
import lombok.Builder;
import lombok.Getter;

/**
 * Morlet wavelet options.
 * Defaults: frequencies 2^(1, 1.25, ..., 7.25) Hz (26 values), wavenumber 6, kernel cut at ±5 SD.
 */
public final class WaveletOptions extends SpectralOptions {

  public static final double DEFAULT_WAVENUMBER = 6.0;
  public static final double DEFAULT_TRUNCATION = 5.0;

  private final double[] freqs;
  @Getter
  private final double wavenumber;
  @Getter
  private final double truncation;

  @Builder
  private WaveletOptions(double[] freqs, Double wavenumber, Double truncation) {
    this.freqs = freqs != null ? freqs.clone() : defaultFreqs();
    this.wavenumber = wavenumber != null ? wavenumber : DEFAULT_WAVENUMBER;
    this.truncation = truncation != null ? truncation : DEFAULT_TRUNCATION;
    if (this.freqs.length == 0) {
      throw new ConfigurationException("wavelet needs at least one frequency");
    }
    for (double f : this.freqs) {
      requirePositive("wavelet frequency", f);
    }
    requirePositive("wavenumber", this.wavenumber);
    requirePositive("truncation", this.truncation);
  }

  /** 2^(1..7.25) in quarter-octave steps. */
  public static double[] defaultFreqs() {
    double[] f = new double[26];
    for (int i = 0; i < f.length; i++) {
      f[i] = Math.pow(2.0, 1.0 + 0.25 * i);
    }
    return f;
  }

  public double[] getFreqs() {
    return freqs.clone();
  }

  @Override
  public SpectralMethod getMethod() {
    return SpectralMethod.WAVELET;
  }

  @Override
  public SpectralProvider createProvider(double sampleRate) {
    return new MorletWavelet(sampleRate, freqs, wavenumber, truncation);
  }

  static WaveletOptions read(OptionReader r) {
    return builder()
      .freqs(r.numbers("freqs"))
      .wavenumber(r.number("wavenumber"))
      .truncation(r.number("truncation"))
      .build();
  }
}
