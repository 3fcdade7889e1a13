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

import io.github.dkaukov.sync.dsp.Multitaper;
import io.github.dkaukov.sync.dsp.SpectralProvider;
import lombok.Builder;
import lombok.Getter;

/**
 * Multitaper options.
 * Defaults: 0.5 s windows, 4 Hz bandwidth, spacing equal to the window, floor(2·NW − 1) tapers,
 * DC removed per window, tapers averaged in spectrogram output.
 */
@Getter
public final class MultitaperOptions extends SpectralOptions {

  public static final double DEFAULT_TIME_WIDTH = 0.5;
  public static final double DEFAULT_FREQ_WIDTH = 4.0;

  private final double timeWidth;
  private final double freqWidth;
  private final double spacing;
  /** Explicit taper count, or null for the default. */
  private final Integer numTapers;
  private final boolean keepTapers;
  private final boolean removeDc;

  @Builder
  private MultitaperOptions(Double timeWidth, Double freqWidth, Double spacing, Integer numTapers,
                            Boolean keepTapers, Boolean removeDc) {
    this.timeWidth = timeWidth != null ? timeWidth : DEFAULT_TIME_WIDTH;
    this.freqWidth = freqWidth != null ? freqWidth : DEFAULT_FREQ_WIDTH;
    this.spacing = spacing != null ? spacing : this.timeWidth;
    this.numTapers = numTapers;
    this.keepTapers = keepTapers != null && keepTapers;
    this.removeDc = removeDc == null || removeDc;
    requirePositive("time_width", this.timeWidth);
    requirePositive("freq_width", this.freqWidth);
    requirePositive("spacing", this.spacing);
    if (numTapers != null && numTapers < 1) {
      throw new ConfigurationException("n_tapers must be >= 1, got " + numTapers);
    }
  }

  @Override
  public SpectralMethod getMethod() {
    return SpectralMethod.MULTITAPER;
  }

  @Override
  public SpectralProvider createProvider(double sampleRate) {
    return new Multitaper(sampleRate, timeWidth, freqWidth, spacing, numTapers, removeDc);
  }

  /** Same options with another window step (s). */
  public MultitaperOptions withSpacing(double spacing) {
    return new MultitaperOptions(timeWidth, freqWidth, spacing, numTapers, keepTapers, removeDc);
  }

  static MultitaperOptions read(OptionReader r) {
    return builder()
      .timeWidth(r.number("time_width"))
      .freqWidth(r.number("freq_width"))
      .spacing(r.number("spacing"))
      .numTapers(r.integer("n_tapers"))
      .keepTapers(r.flag("keep_tapers"))
      .removeDc(r.flag("remove_dc"))
      .build();
  }
}
