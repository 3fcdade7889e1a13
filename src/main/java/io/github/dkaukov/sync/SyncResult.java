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

import javax.annotation.Nullable;

import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Synchrony over a frequency-by-time grid: {@code sync} and {@code phase} are shaped
 * {@code (freq, time, free...)}.
 */
public class SyncResult {

  @Getter
  private final NdArray sync;
  /** Frequency sampling, null when the input was already spectral. */
  @Getter
  @Nullable
  private final NdArray freqs;
  @Nullable
  private final double[] timepts;
  @Getter
  @Nullable
  private final NdArray phase;

  SyncResult(NdArray sync, @Nullable NdArray freqs, @Nullable double[] timepts, @Nullable NdArray phase) {
    this.sync = sync;
    this.freqs = freqs;
    this.timepts = timepts == null ? null : timepts.clone();
    this.phase = phase;
  }

  @Nullable
  public double[] getTimepts() {
    return timepts == null ? null : timepts.clone();
  }
}
