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
 * Options of a field-field synchrony run.
 *
 * <p>Keyword map form ({@link #fromMap(Map)}): {@code method}, {@code spec_method},
 * {@code smp_rate}, {@code return_phase}, {@code spec_type}, {@code timepts}, plus the keys of the
 * chosen spectral backend. Any other key is rejected.
 */
@Getter
public final class SyncOptions {

  private final SyncMethod method;
  private final SpectralOptions spectral;
  @Nullable
  private final Double smpRate;
  private final boolean returnPhase;
  /** Declared input type, or null to infer it from the data. */
  @Nullable
  private final SpecType specType;
  @Nullable
  private final double[] timepts;

  @Builder
  private SyncOptions(SyncMethod method, SpectralOptions spectral, Double smpRate, Boolean returnPhase,
                      SpecType specType, double[] timepts) {
    this.method = method != null ? method : SyncMethod.PPC;
    this.spectral = spectral != null ? spectral : SpectralOptions.defaults(SpectralMethod.WAVELET);
    this.smpRate = smpRate;
    this.returnPhase = returnPhase != null && returnPhase;
    this.specType = specType;
    this.timepts = timepts == null ? null : timepts.clone();
    if (smpRate != null) {
      SpectralOptions.requirePositive("smp_rate", smpRate);
    }
  }

  /** Defaults: PPC over a Morlet wavelet transform, no phase. */
  public static SyncOptions defaults() {
    return builder().build();
  }

  /**
   * Parse a keyword map.
   *
   * @throws ConfigurationException on unknown keys, bad values or wrongly typed values
   */
  public static SyncOptions fromMap(Map<String, ?> options) {
    OptionReader r = new OptionReader(options);
    SyncOptions parsed = read(r).build();
    r.rejectUnconsumed();
    return parsed;
  }

  static SyncOptionsBuilder read(OptionReader r) {
    String method = r.string("method");
    String specMethod = r.string("spec_method");
    String specType = r.string("spec_type");
    SpectralMethod sm = specMethod != null ? SpectralMethod.parse(specMethod) : SpectralMethod.WAVELET;
    return builder()
      .method(method != null ? SyncMethod.parse(method) : null)
      .smpRate(r.number("smp_rate"))
      .returnPhase(r.flag("return_phase"))
      .specType(specType != null ? SpecType.parse(specType) : null)
      .timepts(r.numbers("timepts"))
      .spectral(SpectralOptions.read(sm, r));
  }

  @Nullable
  public double[] getTimepts() {
    return timepts == null ? null : timepts.clone();
  }
}
