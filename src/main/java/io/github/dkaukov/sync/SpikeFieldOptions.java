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

import java.util.Map;

import javax.annotation.Nullable;

import lombok.Builder;
import lombok.Getter;

/**
 * Options of a spike-field synchrony run.
 *
 * <p>On top of the field-field keys the keyword map accepts {@code window_width} (window width in
 * seconds, default 0.5; {@code width} is an alias), {@code window_centers} and {@code field_timepts} (timepoints of an
 * already-computed field spectrum). {@code timepts} are the sample times of the spike trains and
 * of a raw field; they default to {@code index / smp_rate}.
 */
@Getter
public final class SpikeFieldOptions {

  public static final double DEFAULT_WIDTH = 0.5;

  private final SyncMethod method;
  private final SpectralOptions spectral;
  @Nullable
  private final Double smpRate;
  private final boolean returnPhase;
  @Nullable
  private final SpecType specType;
  @Nullable
  private final double[] timepts;
  private final double width;
  @Nullable
  private final double[] windowCenters;
  @Nullable
  private final double[] fieldTimepts;

  @Builder
  private SpikeFieldOptions(SyncMethod method, SpectralOptions spectral, Double smpRate, Boolean returnPhase,
                            SpecType specType, double[] timepts, Double width, double[] windowCenters,
                            double[] fieldTimepts) {
    this.method = method != null ? method : SyncMethod.PPC;
    this.spectral = spectral != null ? spectral : SpectralOptions.defaults(SpectralMethod.WAVELET);
    this.smpRate = smpRate;
    this.returnPhase = returnPhase != null && returnPhase;
    this.specType = specType;
    this.timepts = timepts == null ? null : timepts.clone();
    this.width = width != null ? width : DEFAULT_WIDTH;
    this.windowCenters = windowCenters == null ? null : windowCenters.clone();
    this.fieldTimepts = fieldTimepts == null ? null : fieldTimepts.clone();
    if (smpRate != null) {
      SpectralOptions.requirePositive("smp_rate", smpRate);
    }
    SpectralOptions.requirePositive("window_width", this.width);
  }

  public static SpikeFieldOptions defaults() {
    return builder().build();
  }

  /**
   * Parse a keyword map.
   *
   * @throws ConfigurationException on unknown keys, bad values or wrongly typed values
   */
  public static SpikeFieldOptions fromMap(Map<String, ?> options) {
    OptionReader r = new OptionReader(options);
    if (r.has("width") && r.has("window_width")) {
      throw new ConfigurationException("pass either window_width or width, not both");
    }
    SyncOptions common = SyncOptions.read(r).build();
    SpikeFieldOptions parsed = builder()
      .method(common.getMethod())
      .spectral(common.getSpectral())
      .smpRate(common.getSmpRate())
      .returnPhase(common.isReturnPhase())
      .specType(common.getSpecType())
      .timepts(common.getTimepts())
      .width(r.has("window_width") ? r.number("window_width") : r.number("width"))
      .windowCenters(r.numbers("window_centers"))
      .fieldTimepts(r.numbers("field_timepts"))
      .build();
    r.rejectUnconsumed();
    return parsed;
  }

  @Nullable
  public double[] getTimepts() {
    return timepts == null ? null : timepts.clone();
  }

  @Nullable
  public double[] getWindowCenters() {
    return windowCenters == null ? null : windowCenters.clone();
  }

  @Nullable
  public double[] getFieldTimepts() {
    return fieldTimepts == null ? null : fieldTimepts.clone();
  }
}
