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

import lombok.Getter;

/**
 * Explicit axis-role record of an input tensor: which axis holds trials, time, and (for spectral
 * input) frequency and tapers. Every axis without a role is a free axis. Indexes may be negative
 * and count from the end.
 */
@Getter
public final class AxisRoles {

  private final int trial;
  private final int time;
  @Nullable
  private final Integer frequency;
  @Nullable
  private final Integer taper;

  private AxisRoles(int trial, int time, @Nullable Integer frequency, @Nullable Integer taper) {
    this.trial = trial;
    this.time = time;
    this.frequency = frequency;
    this.taper = taper;
  }

  /** Raw time-series roles. */
  public static AxisRoles of(int trial, int time) {
    return new AxisRoles(trial, time, null, null);
  }

  /** Spectral roles: trial, frequency and time axes. */
  public static AxisRoles spectral(int trial, int frequency, int time) {
    return new AxisRoles(trial, time, frequency, null);
  }

  public AxisRoles withFrequency(int axis) {
    return new AxisRoles(trial, time, axis, taper);
  }

  public AxisRoles withTaper(int axis) {
    return new AxisRoles(trial, time, frequency, axis);
  }

  public boolean hasFrequency() {
    return frequency != null;
  }

  public boolean hasTaper() {
    return taper != null;
  }

  /**
   * Normalize negative indexes against {@code rank} and check range and uniqueness.
   *
   * @throws ConfigurationException on an out-of-range or repeated axis
   */
  public AxisRoles resolve(int rank) {
    int tr = resolveOne("trial", trial, rank);
    int ti = resolveOne("time", time, rank);
    Integer fr = frequency == null ? null : resolveOne("frequency", frequency, rank);
    Integer tp = taper == null ? null : resolveOne("taper", taper, rank);
    boolean[] used = new boolean[rank];
    for (Integer a : new Integer[]{tr, ti, fr, tp}) {
      if (a == null) {
        continue;
      }
      if (used[a]) {
        throw new ConfigurationException("axis " + a + " assigned to more than one role in " + this);
      }
      used[a] = true;
    }
    return new AxisRoles(tr, ti, fr, tp);
  }

  private static int resolveOne(String role, int axis, int rank) {
    int a = axis < 0 ? axis + rank : axis;
    if (a < 0 || a >= rank) {
      throw new ConfigurationException(role + " axis " + axis + " out of range for rank " + rank);
    }
    return a;
  }

  @Override
  public String toString() {
    return "AxisRoles{trial=" + trial + ", time=" + time
      + (frequency != null ? ", frequency=" + frequency : "")
      + (taper != null ? ", taper=" + taper : "") + "}";
  }
}
