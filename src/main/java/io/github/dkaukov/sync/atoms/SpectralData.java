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

import javax.annotation.Nullable;

import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/** Complex spectrum with the frequency and time sampling it was computed on. */
public final class SpectralData {

  @Getter
  private final NdArray spectrum;
  @Getter
  @Nullable
  private final NdArray freqs;
  @Nullable
  private final double[] timepts;

  public SpectralData(NdArray spectrum, @Nullable NdArray freqs, @Nullable double[] timepts) {
    this.spectrum = spectrum;
    this.freqs = freqs;
    this.timepts = timepts == null ? null : timepts.clone();
  }

  @Nullable
  public double[] getTimepts() {
    return timepts == null ? null : timepts.clone();
  }
}
