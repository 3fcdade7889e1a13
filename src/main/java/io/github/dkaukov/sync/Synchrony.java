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

import java.util.Arrays;
import java.util.Map;

import javax.annotation.Nonnull;

import io.github.dkaukov.sync.atoms.AxisCanonicalizer;
import io.github.dkaukov.sync.atoms.AxisLayout;
import io.github.dkaukov.sync.atoms.SpectralAdapter;
import io.github.dkaukov.sync.atoms.SpectralData;
import io.github.dkaukov.sync.atoms.SynchronyEngine;
import io.github.dkaukov.sync.util.NdArray;
import lombok.extern.slf4j.Slf4j;

/**
 * Field-field synchrony between two signals recorded over the same trials.
 *
 * <p>Both inputs share one axis-role record. Raw time series are decomposed with the configured
 * spectral backend; complex input (or {@link SpecType#COMPLEX}) is taken as an already computed
 * spectrum. The result is shaped {@code (freq, time, free...)} with free axes in the caller's
 * order. Inputs are never modified.
 *
 * <pre>{@code
 * SyncResult r = Synchrony.synchrony(lfp1, lfp2, AxisRoles.of(1, 0),
 *     Map.of("method", "PLV", "spec_method", "multitaper", "smp_rate", 1000.0));
 * }</pre>
 */
@Slf4j
public final class Synchrony {
  private Synchrony() {}

  public static SyncResult synchrony(@Nonnull NdArray data1, @Nonnull NdArray data2, @Nonnull AxisRoles roles) {
    return synchrony(data1, data2, roles, SyncOptions.defaults());
  }

  /**
   * Keyword-style variant.
   *
   * @throws ConfigurationException on any unrecognized key
   */
  public static SyncResult synchrony(@Nonnull NdArray data1, @Nonnull NdArray data2, @Nonnull AxisRoles roles,
                                     Map<String, ?> options) {
    return synchrony(data1, data2, roles, SyncOptions.fromMap(options));
  }

  /**
   * Compute synchrony between {@code data1} and {@code data2}.
   *
   * @throws ConfigurationException on bad axis roles, mismatched inputs or options that do not
   *                                fit the data; nothing is computed in that case
   */
  public static SyncResult synchrony(@Nonnull NdArray data1, @Nonnull NdArray data2, @Nonnull AxisRoles roles,
                                     @Nonnull SyncOptions options) {
    if (data1.rank() != data2.rank()) {
      throw new ConfigurationException("signals differ in rank: " + data1.rank() + " vs " + data2.rank());
    }
    boolean spectral = SpectralAdapter.isSpectral(data1, roles, options.getSpecType())
      || SpectralAdapter.isSpectral(data2, roles, options.getSpecType());
    AxisLayout layout = AxisCanonicalizer.describe(data1.shape(), roles, spectral);
    AxisLayout layout2 = AxisCanonicalizer.describe(data2.shape(), roles, spectral);
    if (layout.getNumTrials() != layout2.getNumTrials()) {
      throw new ConfigurationException("signals differ in number of trials: "
        + layout.getNumTrials() + " vs " + layout2.getNumTrials());
    }
    if (!Arrays.equals(data1.shape(), data2.shape())) {
      throw new ConfigurationException("signals differ in shape: "
        + Arrays.toString(data1.shape()) + " vs " + Arrays.toString(data2.shape()));
    }
    log.debug("synchrony: method={}, backend={}, {} input {}",
      options.getMethod(), options.getSpectral().getMethod(), spectral ? "spectral" : "raw",
      Arrays.toString(data1.shape()));
    SpectralAdapter adapter = new SpectralAdapter(options.getSpectral(), options.getSmpRate(), options.getTimepts());
    SpectralData s1 = adapter.ensureSpectral(data1, layout);
    SpectralData s2 = adapter.ensureSpectral(data2, layout);
    SynchronyEngine.Result r = SynchronyEngine.compute(s1.getSpectrum(), s2.getSpectrum(),
      options.getMethod(), options.isReturnPhase());
    NdArray sync = AxisCanonicalizer.restore(r.getSync(), layout);
    NdArray phase = r.getPhase() == null ? null : AxisCanonicalizer.restore(r.getPhase(), layout);
    if (log.isTraceEnabled()) {
      log.trace("synchrony result {}, mean {}", Arrays.toString(sync.shape()), sync.nanMean());
    }
    return new SyncResult(sync, s1.getFreqs(), s1.getTimepts(), phase);
  }
}
