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
package io.github.dkaukov.sync.dsp;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.github.dkaukov.sync.ConfigurationException;

class MultitaperTest {

  @ParameterizedTest(name = "window {0} s, bandwidth {1} Hz")
  @DisplayName("Grid follows window, spacing and padding")
  @CsvSource({
    "0.5, 4, 0.5, 257, 2, 1",
    "0.2, 10, 0.2, 129, 5, 1",
    "0.5, 10, 0.25, 257, 3, 4"})
  void testGrid(double tw, double fw, double spacing, int nf, int nt, int nk) {
    Multitaper mt = new Multitaper(1000, tw, fw, spacing, null, true);
    Spectrogram s = mt.transform(new double[1000]);
    assertEquals(nf, s.getNumFreqs());
    assertEquals(nt, s.getNumTimepts());
    assertEquals(nk, s.getNumTapers());
    assertEquals(tw / 2, s.getTimepts()[0], 1e-12);
    assertEquals(500.0, s.getFreqs().get(nf - 1), 1e-9);
  }

  @Test
  @DisplayName("Tone energy lands in the matching frequency bin")
  void testTonePeak() {
    double fs = 1000;
    double[] x = new double[1000];
    for (int i = 0; i < x.length; i++) {
      x[i] = Math.sin(2 * Math.PI * 125 * i / fs) + 3.0;
    }
    Multitaper mt = new Multitaper(fs, 0.512, 4, 0.512, null, true);
    Spectrogram s = mt.transform(x);
    int best = 0;
    double bestPow = -1;
    for (int f = 0; f < s.getNumFreqs(); f++) {
      double p = Math.hypot(s.real(f, 0, 0), s.imag(f, 0, 0));
      if (p > bestPow) {
        bestPow = p;
        best = f;
      }
    }
    assertEquals(125.0, s.getFreqs().get(best), 1e-9);
    // DC removed before tapering
    assertEquals(0.0, Math.hypot(s.real(0, 0, 0), s.imag(0, 0, 0)), 0.5);
  }

  @Test
  @DisplayName("Explicit taper count and window timing")
  void testExplicitTapers() {
    Multitaper mt = new Multitaper(200, 1.0, 4, 0.5, 3, false);
    assertEquals(3, mt.getNumTapers());
    assertEquals(200, mt.getWindowLength());
    assertEquals(100, mt.getWindowSpacing());
    assertEquals(256, mt.getNfft());
    Spectrogram s = mt.transform(new double[400]);
    assertArrayEquals(new double[]{0.5, 1.0, 1.5}, s.getTimepts(), 1e-12);
    assertEquals(3, Multitaper.defaultTaperCount(2.0));
    assertEquals(1, Multitaper.defaultTaperCount(0.5));
  }

  @Test
  @DisplayName("Signals shorter than the window are rejected")
  void testShortSignal() {
    Multitaper mt = new Multitaper(1000, 0.5, 4, 0.5, null, true);
    assertThrows(ConfigurationException.class, () -> mt.transform(new double[100]));
  }
}
