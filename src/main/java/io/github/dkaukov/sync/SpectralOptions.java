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

import io.github.dkaukov.sync.dsp.SpectralProvider;

/**
 * Closed configuration of one spectral backend. Each subtype validates its values when built
 * and knows which keyword options belong to it.
 */
public abstract class SpectralOptions {

  SpectralOptions() {
  }

  public abstract SpectralMethod getMethod();

  /**
   * Build a provider for the given sampling rate.
   *
   * @throws ConfigurationException if the options do not fit the sampling rate
   */
  public abstract SpectralProvider createProvider(double sampleRate);

  /** Default options of a backend. */
  public static SpectralOptions defaults(SpectralMethod method) {
    switch (method) {
      case WAVELET:
        return WaveletOptions.builder().build();
      case MULTITAPER:
        return MultitaperOptions.builder().build();
      case BANDFILTER:
        return BandfilterOptions.builder().build();
      default:
        throw new ConfigurationException("unsupported spectral method: " + method);
    }
  }

  /** Consume this backend's keys from the reader. */
  static SpectralOptions read(SpectralMethod method, OptionReader reader) {
    switch (method) {
      case WAVELET:
        return WaveletOptions.read(reader);
      case MULTITAPER:
        return MultitaperOptions.read(reader);
      case BANDFILTER:
        return BandfilterOptions.read(reader);
      default:
        throw new ConfigurationException("unsupported spectral method: " + method);
    }
  }

  static void requirePositive(String name, double value) {
    if (!(value > 0) || Double.isInfinite(value)) {
      throw new ConfigurationException(name + " must be positive and finite, got " + value);
    }
  }
}
