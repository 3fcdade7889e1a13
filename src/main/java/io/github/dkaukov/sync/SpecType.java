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
 * Declares whether input data is a raw time series or an already computed complex spectrum.
 * When not given, complex-valued input is taken as spectral and real-valued input as raw.
 */
public enum SpecType {
  RAW,
  COMPLEX;

  public static SpecType parse(String name) {
    if (name != null) {
      String n = name.trim().toUpperCase(Locale.ROOT);
      if (n.equals("RAW") || n.equals("TIME")) {
        return RAW;
      }
      if (n.equals("COMPLEX")) {
        return COMPLEX;
      }
    }
    throw new ConfigurationException("unsupported spec_type: " + name);
  }
}
