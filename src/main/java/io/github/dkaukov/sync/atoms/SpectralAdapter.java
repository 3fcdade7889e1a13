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

import javax.annotation.Nullable;

import io.github.dkaukov.sync.AxisRoles;
import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.MultitaperOptions;
import io.github.dkaukov.sync.SpecType;
import io.github.dkaukov.sync.SpectralMethod;
import io.github.dkaukov.sync.SpectralOptions;
import io.github.dkaukov.sync.dsp.SpectralProvider;
import io.github.dkaukov.sync.dsp.Spectrogram;
import io.github.dkaukov.sync.util.NdArray;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw time series into canonical complex spectra with the configured backend, or accepts
 * already-computed spectra as they are.
 */
@Slf4j
public final class SpectralAdapter {

  private final SpectralOptions options;
  @Nullable
  private final Double sampleRate;
  @Nullable
  private final double[] timepts;
  private SpectralProvider provider;

  /**
   * @param options    backend and its parameters
   * @param sampleRate sampling rate in Hz, required for raw input
   * @param timepts    timepoints of the input's time axis; sample times for raw input (only the
   *                   first one is used, as an offset), spectral timepoints for spectral input
   */
  public SpectralAdapter(SpectralOptions options, @Nullable Double sampleRate, @Nullable double[] timepts) {
    this.options = options;
    this.sampleRate = sampleRate;
    this.timepts = timepts == null ? null : timepts.clone();
  }

  /**
   * Decide whether input already is a spectrum. An explicit type wins; otherwise complex data or
   * a frequency role marks spectral input.
   */
  public static boolean isSpectral(NdArray data, AxisRoles roles, @Nullable SpecType specType) {
    if (specType != null) {
      return specType == SpecType.COMPLEX;
    }
    return data.isComplex() || roles.hasFrequency();
  }

  /**
   * Canonical complex spectrum {@code (trial, freq, time, taper, free)} of the input.
   *
   * @throws ConfigurationException on missing sampling rate, bad timepoints or a taper axis
   *                                with a backend that has none
   */
  public SpectralData ensureSpectral(NdArray data, AxisLayout layout) {
    return layout.isSpectral() ? accept(data, layout) : transform(data, layout);
  }

  private SpectralData accept(NdArray data, AxisLayout layout) {
    if (layout.getRoles().hasTaper() && options.getMethod() != SpectralMethod.MULTITAPER) {
      throw new ConfigurationException("taper axis given but spec_method is " + options.getMethod());
    }
    double[] times = timepts;
    if (times == null && sampleRate != null) {
      times = new double[layout.getNumTimepts()];
      for (int i = 0; i < times.length; i++) {
        times[i] = i / sampleRate;
      }
    }
    if (times != null && times.length != layout.getNumTimepts()) {
      throw new ConfigurationException("timepts length " + times.length + " != spectral time axis "
        + layout.getNumTimepts());
    }
    NdArray canonical = AxisCanonicalizer.canonicalize(data.isComplex() ? data : data.toComplex(), layout);
    return new SpectralData(canonical, null, times);
  }

  private SpectralData transform(NdArray data, AxisLayout layout) {
    if (data.isComplex()) {
      throw new ConfigurationException("raw time-series input must be real");
    }
    SpectralProvider p = provider();
    int nTrials = layout.getNumTrials();
    int nTime = layout.getNumTimepts();
    int nFree = layout.getFreeSize();
    if (timepts != null && timepts.length != nTime) {
      throw new ConfigurationException("timepts length " + timepts.length + " != time axis " + nTime);
    }
    NdArray raw = AxisCanonicalizer.canonicalize(data, layout);
    double[] series = new double[nTime];
    double[] re = null;
    double[] im = null;
    Spectrogram first = null;
    int nf = 0;
    int nt = 0;
    int nk = 0;
    for (int n = 0; n < nTrials; n++) {
      for (int q = 0; q < nFree; q++) {
        for (int t = 0; t < nTime; t++) {
          series[t] = raw.realAt((n * nTime + t) * nFree + q);
        }
        Spectrogram sg = p.transform(series);
        if (first == null) {
          first = sg;
          nf = sg.getNumFreqs();
          nt = sg.getNumTimepts();
          nk = sg.getNumTapers();
          re = new double[nTrials * nf * nt * nk * nFree];
          im = new double[re.length];
        }
        for (int f = 0; f < nf; f++) {
          for (int t = 0; t < nt; t++) {
            for (int k = 0; k < nk; k++) {
              int idx = (((n * nf + f) * nt + t) * nk + k) * nFree + q;
              re[idx] = sg.real(f, t, k);
              im[idx] = sg.imag(f, t, k);
            }
          }
        }
      }
    }
    if (first == null) {
      // no series to transform, probe the provider for the output grid
      first = p.transform(new double[nTime]);
      nf = first.getNumFreqs();
      nt = first.getNumTimepts();
      nk = first.getNumTapers();
      re = new double[0];
      im = new double[0];
    }
    double[] times = first.getTimepts();
    double t0 = timepts != null && timepts.length > 0 ? timepts[0] : 0.0;
    for (int i = 0; i < times.length; i++) {
      times[i] += t0;
    }
    log.debug("{}: {} trials x {} series -> {} freqs x {} times x {} tapers",
      p.method(), nTrials, nFree, nf, nt, nk);
    return new SpectralData(NdArray.wrap(new int[]{nTrials, nf, nt, nk, nFree}, re, im), first.getFreqs(), times);
  }

  /**
   * Spectrogram of every series along {@code timeAxis}, in the caller's layout with the time
   * axis replaced by {@code (freq, time)}, or by {@code (freq, time, taper)} for multitaper with
   * tapers kept. Tapers are complex-averaged otherwise. Timepoints are offset by the first
   * entry of the {@code timepts} this adapter was built with.
   */
  public SpectralData spectrogram(NdArray data, int timeAxis) {
    if (data.isComplex()) {
      throw new ConfigurationException("raw time-series input must be real");
    }
    int rank = data.rank();
    int axis;
    try {
      axis = NdArray.normalizeAxis(timeAxis, rank);
    } catch (IndexOutOfBoundsException e) {
      throw new ConfigurationException("time axis " + timeAxis + " out of range for rank " + rank, e);
    }
    NdArray moved = data.moveAxis(axis, rank - 1);
    int nTime = moved.size(rank - 1);
    int rows = nTime == 0 ? 0 : moved.size() / nTime;
    SpectralProvider p = provider();
    boolean keep = options instanceof MultitaperOptions && ((MultitaperOptions) options).isKeepTapers();
    double[] series = new double[nTime];
    double[] re = null;
    double[] im = null;
    Spectrogram first = null;
    int nf = 0;
    int nt = 0;
    int nk = 0;
    int nkOut = 0;
    for (int r = 0; r < rows; r++) {
      for (int t = 0; t < nTime; t++) {
        series[t] = moved.realAt(r * nTime + t);
      }
      Spectrogram sg = p.transform(series);
      if (first == null) {
        first = sg;
        nf = sg.getNumFreqs();
        nt = sg.getNumTimepts();
        nk = sg.getNumTapers();
        nkOut = keep ? nk : 1;
        re = new double[rows * nf * nt * nkOut];
        im = new double[re.length];
      }
      for (int f = 0; f < nf; f++) {
        for (int t = 0; t < nt; t++) {
          int base = ((r * nf + f) * nt + t) * nkOut;
          if (keep) {
            for (int k = 0; k < nk; k++) {
              re[base + k] = sg.real(f, t, k);
              im[base + k] = sg.imag(f, t, k);
            }
          } else {
            double sr = 0;
            double si = 0;
            for (int k = 0; k < nk; k++) {
              sr += sg.real(f, t, k);
              si += sg.imag(f, t, k);
            }
            re[base] = sr / nk;
            im[base] = si / nk;
          }
        }
      }
    }
    if (first == null) {
      first = p.transform(new double[nTime]);
      nf = first.getNumFreqs();
      nt = first.getNumTimepts();
      nk = first.getNumTapers();
      nkOut = keep ? nk : 1;
      re = new double[0];
      im = new double[0];
    }
    int[] lead = moved.shape();
    int block = keep ? 3 : 2;
    int[] outShape = new int[rank - 1 + block];
    System.arraycopy(lead, 0, outShape, 0, rank - 1);
    outShape[rank - 1] = nf;
    outShape[rank] = nt;
    if (keep) {
      outShape[rank + 1] = nkOut;
    }
    NdArray out = NdArray.wrap(outShape, re, im);
    // move the (freq, time[, taper]) block back to where the time axis was
    int[] perm = new int[outShape.length];
    int j = 0;
    for (int d = 0; d < axis; d++) {
      perm[j++] = d;
    }
    for (int b = 0; b < block; b++) {
      perm[j++] = rank - 1 + b;
    }
    for (int d = axis; d < rank - 1; d++) {
      perm[j++] = d;
    }
    double[] times = first.getTimepts();
    double t0 = timepts != null && timepts.length > 0 ? timepts[0] : 0.0;
    for (int i = 0; i < times.length; i++) {
      times[i] += t0;
    }
    return new SpectralData(out.transpose(perm), first.getFreqs(), times);
  }

  private SpectralProvider provider() {
    if (provider == null) {
      if (sampleRate == null) {
        throw new ConfigurationException("smp_rate is required to transform raw time-series input");
      }
      provider = options.createProvider(sampleRate);
    }
    return provider;
  }
}
