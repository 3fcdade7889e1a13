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
import io.github.dkaukov.sync.atoms.SpikeFieldWindowing;
import io.github.dkaukov.sync.atoms.SynchronyEngine;
import io.github.dkaukov.sync.util.NdArray;
import lombok.extern.slf4j.Slf4j;

/**
 * Synchrony between spike trains and a field signal recorded over the same trials.
 *
 * <p>Coherence treats the 0/1 spike train as a time series and compares its spectrum with the
 * field's. PLV and PPC pool the field phase at every spike within sliding windows, across trials,
 * and also report the pooled sample count per window. Windows without spikes yield NaN.
 */
@Slf4j
public final class SpikeFieldCoupling {
  private SpikeFieldCoupling() {}

  /** Spikes and field share the same axis roles. */
  public static SpikeFieldResult couple(@Nonnull NdArray spikes, @Nonnull NdArray field, @Nonnull AxisRoles roles,
                                        @Nonnull SpikeFieldOptions options) {
    AxisRoles spikeRoles = AxisRoles.of(roles.getTrial(), roles.getTime());
    return couple(spikes, spikeRoles, field, roles, options);
  }

  /**
   * Keyword-style variant with shared axis roles.
   *
   * @throws ConfigurationException on any unrecognized key
   */
  public static SpikeFieldResult couple(@Nonnull NdArray spikes, @Nonnull NdArray field, @Nonnull AxisRoles roles,
                                        Map<String, ?> options) {
    return couple(spikes, field, roles, SpikeFieldOptions.fromMap(options));
  }

  /**
   * Compute spike-field synchrony.
   *
   * @param spikes     0/1 spike trains, real-valued, with trial and time roles only
   * @param spikeRoles axis roles of {@code spikes}
   * @param field      raw field signal or its complex spectrum
   * @param fieldRoles axis roles of {@code field}
   * @throws ConfigurationException on bad roles, mismatched inputs or when no analysis window
   *                                fits the data
   */
  public static SpikeFieldResult couple(@Nonnull NdArray spikes, @Nonnull AxisRoles spikeRoles,
                                        @Nonnull NdArray field, @Nonnull AxisRoles fieldRoles,
                                        @Nonnull SpikeFieldOptions options) {
    if (spikes.isComplex()) {
      throw new ConfigurationException("spike trains must be real-valued");
    }
    AxisLayout spikeLayout = AxisCanonicalizer.describe(spikes.shape(), spikeRoles, false);
    boolean spectral = SpectralAdapter.isSpectral(field, fieldRoles, options.getSpecType());
    AxisLayout fieldLayout = AxisCanonicalizer.describe(field.shape(), fieldRoles, spectral);
    if (spikeLayout.getNumTrials() != fieldLayout.getNumTrials()) {
      throw new ConfigurationException("spikes and field differ in number of trials: "
        + spikeLayout.getNumTrials() + " vs " + fieldLayout.getNumTrials());
    }
    if (!spikeLayout.sameFreeShape(fieldLayout)) {
      String hint = spectral && !fieldRoles.hasTaper() && options.getSpectral().getMethod() == SpectralMethod.MULTITAPER
        ? " (is the field's taper axis declared?)" : "";
      throw new ConfigurationException("spikes and field differ in free axes: "
        + Arrays.toString(spikeLayout.getFreeShape()) + " vs " + Arrays.toString(fieldLayout.getFreeShape()) + hint);
    }
    if (!spectral && spikeLayout.getNumTimepts() != fieldLayout.getNumTimepts()) {
      throw new ConfigurationException("spikes and field differ in number of timepoints: "
        + spikeLayout.getNumTimepts() + " vs " + fieldLayout.getNumTimepts());
    }
    double[] spikeTimes = spikeTimes(spikeLayout.getNumTimepts(), options);
    log.debug("spike-field: method={}, backend={}, {} field {}, spikes {}",
      options.getMethod(), options.getSpectral().getMethod(), spectral ? "spectral" : "raw",
      Arrays.toString(field.shape()), Arrays.toString(spikes.shape()));

    SpectralAdapter fieldAdapter = new SpectralAdapter(fieldSpectralOptions(options, spectral), options.getSmpRate(),
      spectral ? spectralFieldTimes(fieldLayout.getNumTimepts(), options) : spikeTimes);
    SpectralData fieldData = fieldAdapter.ensureSpectral(field, fieldLayout);

    if (options.getMethod() == SyncMethod.COHERENCE) {
      SpectralAdapter spikeAdapter = new SpectralAdapter(options.getSpectral(), options.getSmpRate(), spikeTimes);
      SpectralData spikeData = spikeAdapter.ensureSpectral(spikes, spikeLayout);
      if (!Arrays.equals(spikeData.getSpectrum().shape(), fieldData.getSpectrum().shape())) {
        throw new ConfigurationException("spike spectrum " + Arrays.toString(spikeData.getSpectrum().shape())
          + " does not match field spectrum " + Arrays.toString(fieldData.getSpectrum().shape()));
      }
      SynchronyEngine.Result r = SynchronyEngine.compute(spikeData.getSpectrum(), fieldData.getSpectrum(),
        SyncMethod.COHERENCE, options.isReturnPhase());
      return new SpikeFieldResult(AxisCanonicalizer.restore(r.getSync(), fieldLayout),
        fieldData.getFreqs() != null ? fieldData.getFreqs() : spikeData.getFreqs(),
        fieldData.getTimepts() != null ? fieldData.getTimepts() : spikeData.getTimepts(),
        r.getPhase() == null ? null : AxisCanonicalizer.restore(r.getPhase(), fieldLayout), null);
    }

    double[] fieldTimes = fieldData.getTimepts();
    if (fieldTimes == null || fieldTimes.length == 0) {
      throw new ConfigurationException("field timepoints unknown, pass field_timepts or smp_rate");
    }
    double first = fieldTimes[0];
    double last = fieldTimes[fieldTimes.length - 1];
    double width = options.getWidth();
    double[] centers = options.getWindowCenters() != null
      ? options.getWindowCenters()
      : SpikeFieldWindowing.defaultCenters(first, last, width);
    if (options.getSpectral().getMethod() == SpectralMethod.MULTITAPER) {
      centers = SpikeFieldWindowing.fittingCenters(centers, first, last, width);
    }
    if (centers.length == 0) {
      throw new ConfigurationException("no analysis window of width " + width + " fits field timepoints ["
        + first + ", " + last + "]");
    }
    SpikeFieldWindowing.Result r = SpikeFieldWindowing.compute(
      AxisCanonicalizer.canonicalize(spikes, spikeLayout), spikeTimes,
      fieldData.getSpectrum(), fieldTimes, options.getMethod(), centers, width, options.isReturnPhase());
    return new SpikeFieldResult(AxisCanonicalizer.restore(r.getSync(), fieldLayout), fieldData.getFreqs(),
      r.getCenters(), r.getPhase() == null ? null : AxisCanonicalizer.restore(r.getPhase(), fieldLayout),
      AxisCanonicalizer.restore(r.getCounts(), fieldLayout));
  }

  /**
   * Spike-triggered phases are read at each spike's own sample, so a raw field under multitaper
   * is transformed with one window per sample whatever spacing the caller asked for.
   */
  private static SpectralOptions fieldSpectralOptions(SpikeFieldOptions options, boolean spectral) {
    SpectralOptions spectralOptions = options.getSpectral();
    if (spectral || options.getMethod() == SyncMethod.COHERENCE || options.getSmpRate() == null
      || !(spectralOptions instanceof MultitaperOptions)) {
      return spectralOptions;
    }
    return ((MultitaperOptions) spectralOptions).withSpacing(1.0 / options.getSmpRate());
  }

  private static double[] spikeTimes(int n, SpikeFieldOptions options) {
    double[] t = options.getTimepts();
    if (t != null) {
      if (t.length != n) {
        throw new ConfigurationException("timepts length " + t.length + " != spike time axis " + n);
      }
      return t;
    }
    if (options.getSmpRate() == null) {
      throw new ConfigurationException("spike timing unknown, pass timepts or smp_rate");
    }
    t = new double[n];
    for (int i = 0; i < n; i++) {
      t[i] = i / options.getSmpRate();
    }
    return t;
  }

  private static double[] spectralFieldTimes(int n, SpikeFieldOptions options) {
    if (options.getFieldTimepts() != null) {
      return options.getFieldTimepts();
    }
    double[] t = options.getTimepts();
    return t != null && t.length == n ? t : null;
  }
}
