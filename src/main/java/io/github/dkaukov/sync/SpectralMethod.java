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
 * Spectral decomposition backend.
 */
public enum SpectralMethod {
  WAVELET,
  MULTITAPER,
  BANDFILTER;

  /**
   * Case-insensitive lookup ("wavelet", "multitaper", "bandfilter").
   *
   * @throws ConfigurationException for unknown names
   */
  public static SpectralMethod parse(String name) {
    if (name != null) {
      String n = name.trim().toUpperCase(Locale.ROOT);
      for (SpectralMethod m : values()) {
        if (m.name().equals(n)) {
          return m;
        }
      }
    }
    throw new ConfigurationException("unsupported spectral method: " + name);
  }
}
