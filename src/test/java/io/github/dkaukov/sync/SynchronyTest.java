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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.LogManager;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.bridge.SLF4JBridgeHandler;

import io.github.dkaukov.sync.atoms.SpectralAdapter;
import io.github.dkaukov.sync.atoms.SpectralData;
import io.github.dkaukov.sync.util.NdArray;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class SynchronyTest {

  private static final AxisRoles TIME_FIRST = AxisRoles.of(1, 0);

  @BeforeAll
  static void redirectJulToSlf4j() {
    LogManager.getLogManager().reset();
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  static Stream<Arguments> methodsAndBackends() {
    return Stream.of(SyncMethod.values())
      .flatMap(m -> Stream.of(SpectralMethod.values()).map(s -> Arguments.of(m, s)));
  }

  private static SyncOptions options(SyncMethod method, SpectralMethod spec, boolean phase) {
    return SyncOptions.builder()
      .method(method)
      .spectral(SpectralOptions.defaults(spec))
      .smpRate(SimulatedData.SMP_RATE)
      .returnPhase(phase)
      .build();
  }

  @ParameterizedTest(name = "{0} over {1}")
  @DisplayName("Output shapes per spectral backend")
  @MethodSource("methodsAndBackends")
  void testShapes(SyncMethod method, SpectralMethod spec) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    SyncResult r = Synchrony.synchrony(d1, d2, TIME_FIRST, options(method, spec, true));
    int[] expected;
    switch (spec) {
      case WAVELET:
        expected = new int[]{26, 1000};
        break;
      case MULTITAPER:
        expected = new int[]{257, 2};
        break;
      default:
        expected = new int[]{3, 1000};
        assertArrayEquals(new int[]{3, 2}, r.getFreqs().shape());
        break;
    }
    assertArrayEquals(expected, r.getSync().shape());
    assertArrayEquals(expected, r.getPhase().shape());
    assertEquals(expected[1], r.getTimepts().length);
    assertEquals(expected[0], r.getFreqs().size(0));
    log.debug("{}/{}: mean sync {}", method, spec, r.getSync().mean());
  }

  @ParameterizedTest(name = "{0} over {1}")
  @DisplayName("Inputs are left untouched")
  @MethodSource("methodsAndBackends")
  void testNonMutation(SyncMethod method, SpectralMethod spec) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    NdArray c1 = d1.copy();
    NdArray c2 = d2.copy();
    Synchrony.synchrony(d1, d2, TIME_FIRST, options(method, spec, true));
    assertEquals(c1, d1);
    assertEquals(c2, d2);
  }

  @ParameterizedTest(name = "{0} over {1}")
  @DisplayName("Swapping signals negates phase and keeps magnitude")
  @MethodSource("methodsAndBackends")
  void testSwapAntisymmetry(SyncMethod method, SpectralMethod spec) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    SyncResult a = Synchrony.synchrony(d1, d2, TIME_FIRST, options(method, spec, true));
    SyncResult b = Synchrony.synchrony(d2, d1, TIME_FIRST, options(method, spec, true));
    double[] sa = a.getSync().toArray();
    double[] sb = b.getSync().toArray();
    double[] pa = a.getPhase().toArray();
    double[] pb = b.getPhase().toArray();
    for (int i = 0; i < sa.length; i++) {
      assertEquals(sa[i], sb[i], 1e-12);
      assertTrue(SimulatedData.angleDiff(pa[i], -pb[i]) < 1e-9, "phase not negated at " + i);
    }
  }

  @ParameterizedTest(name = "{0}")
  @DisplayName("Wavelet: time reversal negates phase and keeps magnitude")
  @EnumSource(SyncMethod.class)
  void testWaveletTimeReversal(SyncMethod method) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    SyncOptions opts = options(method, SpectralMethod.WAVELET, true);
    SyncResult fwd = Synchrony.synchrony(d1, d2, TIME_FIRST, opts);
    SyncResult rev = Synchrony.synchrony(d1.flip(0), d2.flip(0), TIME_FIRST, opts);
    double[] s1 = fwd.getSync().toArray();
    double[] s2 = rev.getSync().flip(1).toArray();
    double[] p1 = fwd.getPhase().toArray();
    double[] p2 = rev.getPhase().flip(1).toArray();
    for (int i = 0; i < s1.length; i++) {
      assertEquals(s1[i], s2[i], 1e-6);
      if (s1[i] > 1e-3) {
        assertTrue(SimulatedData.angleDiff(p1[i], -p2[i]) < 1e-5, "phase not negated at " + i);
      }
    }
  }

  @ParameterizedTest(name = "{0}")
  @DisplayName("Multitaper: time reversal keeps magnitude")
  @EnumSource(SyncMethod.class)
  void testMultitaperTimeReversal(SyncMethod method) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    SyncOptions opts = options(method, SpectralMethod.MULTITAPER, false);
    SyncResult fwd = Synchrony.synchrony(d1, d2, TIME_FIRST, opts);
    SyncResult rev = Synchrony.synchrony(d1.flip(0), d2.flip(0), TIME_FIRST, opts);
    assertArrayEquals(fwd.getSync().toArray(), rev.getSync().flip(1).toArray(), 1e-8);
  }

  @ParameterizedTest(name = "{0} over {1}")
  @DisplayName("Axis order does not change the result")
  @MethodSource("methodsAndBackends")
  void testAxisOrderInvariance(SyncMethod method, SpectralMethod spec) {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    SyncOptions opts = options(method, spec, true);
    SyncResult a = Synchrony.synchrony(d1, d2, TIME_FIRST, opts);
    SyncResult b = Synchrony.synchrony(d1.transpose(1, 0), d2.transpose(1, 0), AxisRoles.of(0, 1), opts);
    assertArrayEquals(a.getSync().toArray(), b.getSync().toArray(), 1e-4);
    assertArrayEquals(a.getPhase().toArray(), b.getPhase().toArray(), 1e-4);
  }

  @Test
  @DisplayName("Free axes are carried through in caller order")
  void testFreeAxes() {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    // (time, channel, trial) with two identical channels
    NdArray s1 = NdArray.stack(1, d1, d1);
    NdArray s2 = NdArray.stack(1, d2, d2);
    SyncOptions opts = options(SyncMethod.PPC, SpectralMethod.MULTITAPER, false);
    SyncResult single = Synchrony.synchrony(d1, d2, TIME_FIRST, opts);
    SyncResult multi = Synchrony.synchrony(s1, s2, AxisRoles.of(2, 0), opts);
    assertArrayEquals(new int[]{257, 2, 2}, multi.getSync().shape());
    for (int c = 0; c < 2; c++) {
      NdArray slice = multi.getSync().select(2, new int[]{c}).reshape(257, 2);
      assertArrayEquals(single.getSync().toArray(), slice.toArray(), 1e-12);
    }
  }

  @ParameterizedTest(name = "{0} over {1}")
  @DisplayName("Pre-computed spectra give the same result as raw input")
  @MethodSource("methodsAndBackends")
  void testSpectralInputEquivalence(SyncMethod method, SpectralMethod spec) {
    NdArray d1 = SimulatedData.channel(0).transpose(1, 0);
    NdArray d2 = SimulatedData.channel(1).transpose(1, 0);
    SyncOptions opts = options(method, spec, true);
    SyncResult raw = Synchrony.synchrony(d1, d2, AxisRoles.of(0, 1), opts);

    SpectralAdapter adapter = new SpectralAdapter(opts.getSpectral(), SimulatedData.SMP_RATE, null);
    SpectralData spec1 = adapter.spectrogram(d1, 1);
    SpectralData spec2 = adapter.spectrogram(d2, 1);
    SyncOptions specOpts = SyncOptions.builder()
      .method(method)
      .spectral(opts.getSpectral())
      .specType(SpecType.COMPLEX)
      .timepts(spec1.getTimepts())
      .returnPhase(true)
      .build();
    SyncResult pre = Synchrony.synchrony(spec1.getSpectrum(), spec2.getSpectrum(), AxisRoles.spectral(0, 1, 2), specOpts);

    assertNull(pre.getFreqs());
    assertArrayEquals(raw.getTimepts(), pre.getTimepts(), 1e-12);
    assertArrayEquals(raw.getSync().toArray(), pre.getSync().toArray(), 1e-4);
    assertArrayEquals(raw.getPhase().toArray(), pre.getPhase().toArray(), 1e-4);
  }

  @Test
  @DisplayName("Multitaper spectra with a taper axis are averaged over tapers")
  void testTaperAxisInput() {
    NdArray d1 = SimulatedData.channel(0).transpose(1, 0);
    NdArray d2 = SimulatedData.channel(1).transpose(1, 0);
    MultitaperOptions mt = MultitaperOptions.builder().freqWidth(10.0).keepTapers(true).build();
    SyncOptions opts = SyncOptions.builder().method(SyncMethod.PLV).spectral(mt).smpRate(SimulatedData.SMP_RATE).build();
    SyncResult raw = Synchrony.synchrony(d1, d2, AxisRoles.of(0, 1), opts);

    SpectralAdapter adapter = new SpectralAdapter(mt, SimulatedData.SMP_RATE, null);
    NdArray spec1 = adapter.spectrogram(d1, 1).getSpectrum();
    NdArray spec2 = adapter.spectrogram(d2, 1).getSpectrum();
    // NW = 2.5 -> 4 tapers
    assertEquals(4, spec1.size(3));
    SyncResult pre = Synchrony.synchrony(spec1, spec2, AxisRoles.spectral(0, 1, 2).withTaper(3), opts);
    assertArrayEquals(raw.getSync().toArray(), pre.getSync().toArray(), 1e-10);
  }

  @Test
  @DisplayName("Undeclared taper axis is reported per taper like any free axis")
  void testUndeclaredTaperAxis() {
    NdArray d1 = SimulatedData.channel(0).transpose(1, 0);
    NdArray d2 = SimulatedData.channel(1).transpose(1, 0);
    MultitaperOptions mt = MultitaperOptions.builder().freqWidth(10.0).keepTapers(true).build();
    SyncOptions opts = SyncOptions.builder().method(SyncMethod.PLV).spectral(mt).smpRate(SimulatedData.SMP_RATE).build();
    SpectralAdapter adapter = new SpectralAdapter(mt, SimulatedData.SMP_RATE, null);
    NdArray spec1 = adapter.spectrogram(d1, 1).getSpectrum();
    NdArray spec2 = adapter.spectrogram(d2, 1).getSpectrum();
    SyncResult perTaper = Synchrony.synchrony(spec1, spec2, AxisRoles.spectral(0, 1, 2), opts);
    assertArrayEquals(new int[]{257, 2, 4}, perTaper.getSync().shape());
    for (int k = 0; k < 4; k++) {
      NdArray t1 = spec1.select(3, new int[]{k}).reshape(40, 257, 2);
      NdArray t2 = spec2.select(3, new int[]{k}).reshape(40, 257, 2);
      SyncResult single = Synchrony.synchrony(t1, t2, AxisRoles.spectral(0, 1, 2), opts);
      NdArray slice = perTaper.getSync().select(2, new int[]{k}).reshape(257, 2);
      assertArrayEquals(single.getSync().toArray(), slice.toArray(), 1e-12);
    }
  }

  @Test
  @DisplayName("Taper axis with a non-multitaper backend is rejected")
  void testTaperAxisWrongBackend() {
    NdArray spec = NdArray.complex(new double[24], new double[24], 2, 3, 4);
    NdArray dummy = spec.reshape(2, 3, 4, 1);
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(dummy, dummy,
      AxisRoles.spectral(0, 1, 2).withTaper(3), SyncOptions.defaults()));
  }

  @Test
  @DisplayName("Phase is not returned unless asked for")
  void testNoPhaseByDefault() {
    SyncResult r = Synchrony.synchrony(SimulatedData.channel(0), SimulatedData.channel(1), TIME_FIRST,
      options(SyncMethod.PPC, SpectralMethod.MULTITAPER, false));
    assertNull(r.getPhase());
    assertNotNull(r.getSync());
  }

  @Test
  @DisplayName("Phase-locked simulation shows locking near 32 Hz")
  void testLockingAtOscillationFrequency() {
    Map<String, Object> kw = new HashMap<>();
    kw.put("method", "PLV");
    kw.put("spec_method", "wavelet");
    kw.put("smp_rate", SimulatedData.SMP_RATE);
    kw.put("return_phase", true);
    SyncResult r = Synchrony.synchrony(SimulatedData.channel(0), SimulatedData.channel(1), TIME_FIRST, kw);
    double[] freqs = r.getFreqs().toArray();
    int at32 = 0;
    int at4 = 0;
    for (int f = 0; f < freqs.length; f++) {
      if (Math.abs(freqs[f] - 32) < Math.abs(freqs[at32] - 32)) {
        at32 = f;
      }
      if (Math.abs(freqs[f] - 4) < Math.abs(freqs[at4] - 4)) {
        at4 = f;
      }
    }
    double plv32 = r.getSync().select(0, new int[]{at32}).mean();
    double plv4 = r.getSync().select(0, new int[]{at4}).mean();
    double phi32 = r.getPhase().select(0, new int[]{at32}).select(1, new int[]{500}).get(0, 0);
    log.info("PLV at 32 Hz {}, at 4 Hz {}, phase at 32 Hz {}", plv32, plv4, phi32);
    assertTrue(plv32 > 0.5, "expected strong locking at 32 Hz");
    assertTrue(plv32 > plv4);
    // channel 0 leads by pi/4
    assertTrue(SimulatedData.angleDiff(phi32, Math.PI / 4) < 0.3);
  }

  @Test
  @DisplayName("Configuration errors are raised before computing")
  void testConfigurationErrors() {
    NdArray d1 = SimulatedData.channel(0);
    NdArray d2 = SimulatedData.channel(1);
    Map<String, Object> kw = new HashMap<>();
    kw.put("smp_rate", 1000.0);
    kw.put("bogus_option", 1);
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(d1, d2, TIME_FIRST, kw));
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(d1, d2, AxisRoles.of(2, 0),
      options(SyncMethod.PLV, SpectralMethod.WAVELET, false)));
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(d1, d2, AxisRoles.of(0, 0),
      options(SyncMethod.PLV, SpectralMethod.WAVELET, false)));
    NdArray fewerTrials = d2.select(1, new int[]{0, 1, 2});
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(d1, fewerTrials, TIME_FIRST,
      options(SyncMethod.PLV, SpectralMethod.WAVELET, false)));
    // raw input without a sampling rate
    assertThrows(ConfigurationException.class, () -> Synchrony.synchrony(d1, d2, TIME_FIRST, SyncOptions.defaults()));
  }

  @Test
  @DisplayName("Negative axis indexes count from the end")
  void testNegativeAxes() {
    SyncOptions opts = options(SyncMethod.COHERENCE, SpectralMethod.MULTITAPER, false);
    SyncResult a = Synchrony.synchrony(SimulatedData.channel(0), SimulatedData.channel(1), TIME_FIRST, opts);
    SyncResult b = Synchrony.synchrony(SimulatedData.channel(0), SimulatedData.channel(1), AxisRoles.of(-1, -2), opts);
    assertEquals(a.getSync(), b.getSync());
  }
}
