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
 * Spike-field synchrony per analysis window. The time axis of {@code sync} and {@code phase}
 * indexes windows and {@link #getTimepts()} returns their centers.
 */
public final class SpikeFieldResult extends SyncResult {

  /** Pooled sample count per window, {@code (window, free...)}; null for coherence. */
  @Getter
  @Nullable
  private final NdArray n;

  SpikeFieldResult(NdArray sync, @Nullable NdArray freqs, double[] timepts, @Nullable NdArray phase,
                   @Nullable NdArray n) {
    super(sync, freqs, timepts, phase);
    this.n = n;
  }
}
