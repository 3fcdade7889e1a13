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

import io.github.dkaukov.sync.AxisRoles;
import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.util.NdArray;

/**
 * Maps caller tensors onto the fixed internal layout and results back.
 *
 * Forward: trial first, then frequency (spectral input), time, taper (if any), then all free
 * axes flattened in their original order. Inverse: a result whose last axis is the flattened
 * free axis gets that axis expanded back, so frequency and time lead and free axes follow in
 * the caller's order.
 */
public final class AxisCanonicalizer {
  private AxisCanonicalizer() {}

  /**
   * Resolve roles against a shape.
   *
   * @param spectral whether the tensor is a complex spectrum (needs a frequency role)
   * @throws ConfigurationException on bad or inconsistent roles
   */
  public static AxisLayout describe(int[] shape, AxisRoles roles, boolean spectral) {
    AxisRoles resolved = roles.resolve(shape.length);
    if (spectral && !resolved.hasFrequency()) {
      throw new ConfigurationException("spectral input needs a frequency axis role, got " + roles);
    }
    if (!spectral && (resolved.hasFrequency() || resolved.hasTaper())) {
      throw new ConfigurationException("raw time-series input cannot have frequency or taper roles, got " + roles);
    }
    return new AxisLayout(shape, resolved, spectral);
  }

  /** Copy of {@code data} in canonical layout; {@code data} is not modified. */
  public static NdArray canonicalize(NdArray data, AxisLayout layout) {
    return data.transpose(layout.canonicalPermutation()).reshape(layout.canonicalShape());
  }

  /**
   * Expand the trailing flattened free axis of {@code result} back to the caller's free axes.
   * With no free axes the trailing (length 1) axis is dropped.
   */
  public static NdArray restore(NdArray result, AxisLayout layout) {
    int[] shape = result.shape();
    int lead = shape.length - 1;
    if (shape[lead] != layout.getFreeSize()) {
      throw new IllegalArgumentException("trailing axis " + shape[lead] + " != free size " + layout.getFreeSize());
    }
    int[] free = layout.getFreeShape();
    int[] out = new int[lead + free.length];
    System.arraycopy(shape, 0, out, 0, lead);
    System.arraycopy(free, 0, out, lead, free.length);
    return result.reshape(out);
  }
}
