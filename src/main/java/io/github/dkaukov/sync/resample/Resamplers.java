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
package io.github.dkaukov.sync.resample;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.IntStream;

import javax.annotation.Nonnull;

import io.github.dkaukov.sync.ConfigurationException;

/**
 * Index resamplings for randomization statistics. Every generator draws from a caller-owned
 * {@link Random}, so a seeded generator gives repeatable sequences. Each
 * {@link Iterable#iterator()} call continues from the generator's current state.
 */
public final class Resamplers {

  public static final int DEFAULT_RESAMPLES = 9999;

  private Resamplers() {}

  /** Random permutations of {@code 0..n-1}. */
  public static Iterable<int[]> permutations(int n, int nResamples, @Nonnull Random random) {
    return generate(n, nResamples, r -> {
      int[] p = new int[n];
      for (int i = 0; i < n; i++) {
        p[i] = i;
      }
      // Fisher-Yates
      for (int i = n - 1; i > 0; i--) {
        int j = r.nextInt(i + 1);
        int tmp = p[i];
        p[i] = p[j];
        p[j] = tmp;
      }
      return p;
    }, random);
  }

  /** Resamplings with replacement of {@code 0..n-1}. */
  public static Iterable<int[]> bootstraps(int n, int nResamples, @Nonnull Random random) {
    return generate(n, nResamples, r -> {
      int[] b = new int[n];
      for (int i = 0; i < n; i++) {
        b[i] = r.nextInt(n);
      }
      return b;
    }, random);
  }

  /** Fair coin flips, for sign-randomization tests. */
  public static Iterable<boolean[]> signs(int n, int nResamples, @Nonnull Random random) {
    return generate(n, nResamples, r -> {
      boolean[] s = new boolean[n];
      for (int i = 0; i < n; i++) {
        s[i] = r.nextBoolean();
      }
      return s;
    }, random);
  }

  /** Leave-one-out masks: the i-th mask excludes observation i. */
  public static Iterable<boolean[]> jackknifes(int n) {
    return jackknifes(n, n);
  }

  /**
   * @throws ConfigurationException unless {@code nResamples == n}
   */
  public static Iterable<boolean[]> jackknifes(int n, int nResamples) {
    if (nResamples != n) {
      throw new ConfigurationException("jackknife needs n_resamples == n, got " + nResamples + " for n=" + n);
    }
    return () -> IntStream.range(0, n).mapToObj(excluded -> {
      boolean[] keep = new boolean[n];
      Arrays.fill(keep, true);
      keep[excluded] = false;
      return keep;
    }).iterator();
  }

  private static <T> Iterable<T> generate(int n, int nResamples, Function<Random, T> draw, Random random) {
    if (n < 1 || nResamples < 0) {
      throw new ConfigurationException("need n >= 1 and n_resamples >= 0, got n=" + n + ", n_resamples=" + nResamples);
    }
    return () -> new Iterator<T>() {
      private int emitted;

      @Override
      public boolean hasNext() {
        return emitted < nResamples;
      }

      @Override
      public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        emitted++;
        return draw.apply(random);
      }
    };
  }
}
