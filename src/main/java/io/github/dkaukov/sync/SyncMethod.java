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

import java.util.Locale;

/**
 * Cross-trial synchrony statistic.
 */
public enum SyncMethod {
  /** Amplitude-weighted cross-spectral coherence. */
  COHERENCE,
  /** Phase-locking value, amplitude independent. */
  PLV,
  /** Pairwise phase consistency, bias-corrected PLV squared. */
  PPC;

  /**
   * Case-insensitive lookup ("coherence", "PLV", "ppc").
   *
   * @throws ConfigurationException for unknown names
   */
  public static SyncMethod parse(String name) {
    if (name != null) {
      String n = name.trim().toUpperCase(Locale.ROOT);
      for (SyncMethod m : values()) {
        if (m.name().equals(n)) {
          return m;
        }
      }
    }
    throw new ConfigurationException("unsupported synchrony method: " + name);
  }
}
