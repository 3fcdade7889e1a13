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

import io.github.dkaukov.sync.dsp.BandFilter;
import io.github.dkaukov.sync.dsp.SpectralProvider;
import lombok.Builder;
import lombok.Getter;

/**
 * Band-filter options.
 * Defaults: bands (2,8), (10,32), (40,100) Hz, 60 dB Kaiser stopband, filter length sized per band.
 */
public final class BandfilterOptions extends SpectralOptions {

  public static final double DEFAULT_ATTENUATION_DB = 60.0;

  private final double[][] bands;
  @Getter
  private final double attenuationDb;
  /** Fixed tap count, or null to size each filter from its band. */
  @Getter
  private final Integer numTaps;

  @Builder
  private BandfilterOptions(double[][] bands, Double attenuationDb, Integer numTaps) {
    this.bands = bands != null ? copy(bands) : defaultBands();
    this.attenuationDb = attenuationDb != null ? attenuationDb : DEFAULT_ATTENUATION_DB;
    this.numTaps = numTaps;
    if (this.bands.length == 0) {
      throw new ConfigurationException("bandfilter needs at least one band");
    }
    for (double[] band : this.bands) {
      if (band.length != 2 || !(band[0] > 0) || !(band[1] > band[0])) {
        throw new ConfigurationException("each band must be {low, high} with 0 < low < high");
      }
    }
    requirePositive("attenuation_db", this.attenuationDb);
    if (numTaps != null && numTaps < 3) {
      throw new ConfigurationException("num_taps must be >= 3, got " + numTaps);
    }
  }

  public static double[][] defaultBands() {
    return new double[][]{{2, 8}, {10, 32}, {40, 100}};
  }

  public double[][] getBands() {
    return copy(bands);
  }

  @Override
  public SpectralMethod getMethod() {
    return SpectralMethod.BANDFILTER;
  }

  @Override
  public SpectralProvider createProvider(double sampleRate) {
    for (double[] band : bands) {
      if (band[1] >= sampleRate / 2) {
        throw new ConfigurationException("band upper edge " + band[1] + " Hz is not below Nyquist");
      }
    }
    return new BandFilter(sampleRate, bands, attenuationDb, numTaps);
  }

  static BandfilterOptions read(OptionReader r) {
    return builder()
      .bands(r.pairs("bands"))
      .attenuationDb(r.number("attenuation_db"))
      .numTaps(r.integer("num_taps"))
      .build();
  }

  private static double[][] copy(double[][] src) {
    double[][] out = new double[src.length][];
    for (int i = 0; i < src.length; i++) {
      out[i] = src[i].clone();
    }
    return out;
  }
}
