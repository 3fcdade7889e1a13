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

import java.util.Arrays;

import io.github.dkaukov.sync.AxisRoles;
import lombok.Getter;

/**
 * Reversible description of how a caller's tensor maps onto the canonical layout:
 * {@code (trial, time, free)} for raw input, {@code (trial, freq, time, taper, free)} for spectral
 * input, where {@code free} is every remaining axis flattened in original order.
 */
@Getter
public final class AxisLayout {

  private final int[] originalShape;
  private final AxisRoles roles;
  private final boolean spectral;
  private final int numTrials;
  private final int numFreqs;
  private final int numTimepts;
  private final int numTapers;
  private final int[] freeAxes;
  private final int[] freeShape;
  private final int freeSize;

  AxisLayout(int[] originalShape, AxisRoles roles, boolean spectral) {
    this.originalShape = originalShape.clone();
    this.roles = roles;
    this.spectral = spectral;
    this.numTrials = originalShape[roles.getTrial()];
    this.numTimepts = originalShape[roles.getTime()];
    this.numFreqs = roles.hasFrequency() ? originalShape[roles.getFrequency()] : 1;
    this.numTapers = roles.hasTaper() ? originalShape[roles.getTaper()] : 1;
    int rank = originalShape.length;
    boolean[] assigned = new boolean[rank];
    assigned[roles.getTrial()] = true;
    assigned[roles.getTime()] = true;
    if (roles.hasFrequency()) {
      assigned[roles.getFrequency()] = true;
    }
    if (roles.hasTaper()) {
      assigned[roles.getTaper()] = true;
    }
    int count = 0;
    for (boolean a : assigned) {
      if (!a) {
        count++;
      }
    }
    this.freeAxes = new int[count];
    this.freeShape = new int[count];
    int j = 0;
    int size = 1;
    for (int d = 0; d < rank; d++) {
      if (!assigned[d]) {
        freeAxes[j] = d;
        freeShape[j] = originalShape[d];
        size *= originalShape[d];
        j++;
      }
    }
    this.freeSize = size;
  }

  /** Axis permutation taking the caller's layout to canonical order. */
  int[] canonicalPermutation() {
    int rank = originalShape.length;
    int[] perm = new int[rank];
    int j = 0;
    perm[j++] = roles.getTrial();
    if (spectral) {
      perm[j++] = roles.getFrequency();
    }
    perm[j++] = roles.getTime();
    if (roles.hasTaper()) {
      perm[j++] = roles.getTaper();
    }
    for (int a : freeAxes) {
      perm[j++] = a;
    }
    return perm;
  }

  /** Canonical shape after flattening free axes. */
  int[] canonicalShape() {
    return spectral
      ? new int[]{numTrials, numFreqs, numTimepts, numTapers, freeSize}
      : new int[]{numTrials, numTimepts, freeSize};
  }

  public int[] getOriginalShape() {
    return originalShape.clone();
  }

  public int[] getFreeAxes() {
    return freeAxes.clone();
  }

  public int[] getFreeShape() {
    return freeShape.clone();
  }

  /** True when the other layout has the same free-axis shape. */
  public boolean sameFreeShape(AxisLayout other) {
    return Arrays.equals(freeShape, other.freeShape);
  }
}
