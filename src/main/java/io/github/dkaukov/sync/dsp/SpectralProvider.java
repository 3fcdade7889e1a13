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

/**
 * Complex time-frequency decomposition of a single time series.
 *
 * <p>Implementations are configured once (sample rate, method parameters) and then applied
 * to every trial and channel of a call. They may cache per-length state and are not thread-safe.</p>
 */
public interface SpectralProvider {

  SpectralMethod method();

  /**
   * Decompose one real time series.
   *
   * @param signal samples, never modified
   * @return complex spectrogram with frequency, time and taper dimensions
   */
  Spectrogram transform(double[] signal);
}
