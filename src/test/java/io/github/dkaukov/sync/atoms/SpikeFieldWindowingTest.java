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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.SyncMethod;
import io.github.dkaukov.sync.util.NdArray;

class SpikeFieldWindowingTest {

  @Test
  @DisplayName("Default centers tile the time range with whole windows")
  void testDefaultCenters() {
    assertArrayEquals(new double[]{0.1, 0.3, 0.5, 0.7}, SpikeFieldWindowing.defaultCenters(0, 0.999, 0.2), 1e-12);
    assertArrayEquals(new double[]{0.2, 0.4, 0.6, 0.8}, SpikeFieldWindowing.defaultCenters(0.1, 0.9, 0.2), 1e-12);
    assertEquals(0, SpikeFieldWindowing.defaultCenters(0, 0.1, 0.2).length);
  }

  @Test
  @DisplayName("Only centers whose window fits the range are kept")
  void testFittingCenters() {
    double[] c = SpikeFieldWindowing.fittingCenters(new double[]{0.1, 0.2, 0.5, 0.8, 0.85}, 0.1, 0.9, 0.2);
    assertArrayEquals(new double[]{0.2, 0.5, 0.8}, c, 1e-12);
  }

  @Test
  @DisplayName("Nearest timepoint lookup, out-of-range times rejected")
  void testNearestIndex() {
    double[] t = {0.1, 0.2, 0.3};
    assertEquals(0, SpikeFieldWindowing.nearestIndex(t, 0.1));
    assertEquals(1, SpikeFieldWindowing.nearestIndex(t, 0.16));
    assertEquals(0, SpikeFieldWindowing.nearestIndex(t, 0.14));
    assertEquals(2, SpikeFieldWindowing.nearestIndex(t, 0.3));
    assertEquals(-1, SpikeFieldWindowing.nearestIndex(t, 0.05));
    assertEquals(-1, SpikeFieldWindowing.nearestIndex(t, 0.31));
  }

  @Test
  @DisplayName("Spikes pool field phases over trials, window edges included")
  void testPooling() {
    // 2 trials, 5 samples at 0.0..0.4 s, one free series
    double[] spk = {
      1, 0, 0, 0, 1,
      0, 0, 1, 0, 0};
    NdArray spikes = NdArray.real(spk, 2, 5, 1);
    double[] times = {0.0, 0.1, 0.2, 0.3, 0.4};
    // field phase 0 everywhere in trial 0, pi/2 at sample 2 of trial 1
    double[] re = new double[10];
    double[] im = new double[10];
    Arrays.fill(re, 1.0);
    re[7] = 0.0;
    im[7] = 2.0;
    NdArray field = NdArray.complex(re, im, 2, 1, 5, 1, 1);

    SpikeFieldWindowing.Result r = SpikeFieldWindowing.compute(spikes, times, field, times, SyncMethod.PLV,
      new double[]{0.1, 0.3}, 0.2, true);
    // window [0, 0.2]: spikes at 0.0 (phase 0) and 0.2 (phase pi/2)
    assertEquals(2.0, r.getCounts().get(0, 0));
    assertEquals(Math.sqrt(2) / 2, r.getSync().get(0, 0, 0), 1e-12);
    assertEquals(Math.PI / 4, r.getPhase().get(0, 0, 0), 1e-12);
    // window [0.2, 0.4]: spikes at 0.2 and 0.4
    assertEquals(2.0, r.getCounts().get(1, 0));

    SpikeFieldWindowing.Result ppc = SpikeFieldWindowing.compute(spikes, times, field, times, SyncMethod.PPC,
      new double[]{0.1}, 0.2, false);
    assertEquals(0.0, ppc.getSync().get(0, 0, 0), 1e-12);
  }

  @Test
  @DisplayName("Empty windows are NaN with zero count")
  void testEmptyWindow() {
    NdArray spikes = NdArray.real(new double[]{0, 0, 0, 1}, 1, 4, 1);
    double[] times = {0.0, 0.1, 0.2, 0.3};
    NdArray field = NdArray.complex(new double[]{1, 1, 1, 1}, new double[4], 1, 1, 4, 1, 1);
    SpikeFieldWindowing.Result r = SpikeFieldWindowing.compute(spikes, times, field, times, SyncMethod.PLV,
      new double[]{0.05, 0.25}, 0.1, true);
    assertEquals(0.0, r.getCounts().get(0, 0));
    assertTrue(Double.isNaN(r.getSync().get(0, 0, 0)));
    assertTrue(Double.isNaN(r.getPhase().get(0, 0, 0)));
    assertEquals(1.0, r.getCounts().get(1, 0));
    assertEquals(1.0, r.getSync().get(0, 1, 0), 1e-12);
  }

  @Test
  @DisplayName("Each taper counts as a sample")
  void testTaperSamples() {
    NdArray spikes = NdArray.real(new double[]{1, 1}, 1, 2, 1);
    double[] times = {0.0, 0.1};
    NdArray field = NdArray.complex(new double[]{1, 1, 1, 1}, new double[4], 1, 1, 2, 2, 1);
    SpikeFieldWindowing.Result r = SpikeFieldWindowing.compute(spikes, times, field, times, SyncMethod.PLV,
      new double[]{0.05}, 0.1, false);
    assertEquals(4.0, r.getCounts().get(0, 0));
  }

  @Test
  @DisplayName("No windows is a configuration error")
  void testNoWindows() {
    NdArray spikes = NdArray.real(new double[]{1}, 1, 1, 1);
    NdArray field = NdArray.complex(new double[]{1}, new double[1], 1, 1, 1, 1, 1);
    assertThrows(ConfigurationException.class, () -> SpikeFieldWindowing.compute(spikes, new double[]{0},
      field, new double[]{0}, SyncMethod.PLV, new double[0], 0.1, false));
  }
}
