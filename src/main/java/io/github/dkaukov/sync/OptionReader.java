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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Keyword-style option map reader. Every key read is marked consumed;
 * {@link #rejectUnconsumed()} fails on whatever the caller did not recognize.
 */
final class OptionReader {

  private final Map<String, Object> remaining;

  OptionReader(Map<String, ?> options) {
    this.remaining = new LinkedHashMap<>(options == null ? Map.of() : options);
  }

  boolean has(String key) {
    return remaining.containsKey(key);
  }

  String string(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof Enum) {
      return ((Enum<?>) v).name();
    }
    if (v instanceof CharSequence) {
      return v.toString();
    }
    throw typeError(key, v, "a string");
  }

  Double number(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof Number) {
      return ((Number) v).doubleValue();
    }
    throw typeError(key, v, "a number");
  }

  Integer integer(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof Integer || v instanceof Long || v instanceof Short) {
      return ((Number) v).intValue();
    }
    throw typeError(key, v, "an integer");
  }

  Boolean flag(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof Boolean) {
      return (Boolean) v;
    }
    throw typeError(key, v, "a boolean");
  }

  double[] numbers(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof double[]) {
      return ((double[]) v).clone();
    }
    if (v instanceof Collection) {
      Collection<?> c = (Collection<?>) v;
      double[] out = new double[c.size()];
      int i = 0;
      for (Object o : c) {
        if (!(o instanceof Number)) {
          throw typeError(key, v, "a list of numbers");
        }
        out[i++] = ((Number) o).doubleValue();
      }
      return out;
    }
    throw typeError(key, v, "a double[] or list of numbers");
  }

  double[][] pairs(String key) {
    Object v = remaining.remove(key);
    if (v == null) {
      return null;
    }
    if (v instanceof double[][]) {
      double[][] src = (double[][]) v;
      double[][] out = new double[src.length][];
      for (int i = 0; i < src.length; i++) {
        out[i] = src[i].clone();
      }
      return out;
    }
    if (v instanceof Collection) {
      Collection<?> c = (Collection<?>) v;
      double[][] out = new double[c.size()][];
      int i = 0;
      for (Object row : c) {
        out[i++] = row(key, v, row);
      }
      return out;
    }
    throw typeError(key, v, "a double[][] or list of number lists");
  }

  /**
   * @throws ConfigurationException listing every key nobody consumed
   */
  void rejectUnconsumed() {
    if (!remaining.isEmpty()) {
      throw new ConfigurationException("unrecognized option(s): " + new TreeSet<>(remaining.keySet()));
    }
  }

  private static double[] row(String key, Object whole, Object row) {
    if (row instanceof double[]) {
      return ((double[]) row).clone();
    }
    if (row instanceof Collection) {
      Collection<?> c = (Collection<?>) row;
      double[] out = new double[c.size()];
      int i = 0;
      for (Object o : c) {
        if (!(o instanceof Number)) {
          throw typeError(key, whole, "a list of number lists");
        }
        out[i++] = ((Number) o).doubleValue();
      }
      return out;
    }
    throw typeError(key, whole, "a list of number lists");
  }

  private static ConfigurationException typeError(String key, Object value, String expected) {
    return new ConfigurationException("option '" + key + "' must be " + expected
      + ", got " + value.getClass().getSimpleName());
  }
}
