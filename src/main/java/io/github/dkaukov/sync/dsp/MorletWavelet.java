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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import io.github.dkaukov.sync.ConfigurationException;
import io.github.dkaukov.sync.SpectralMethod;
import io.github.dkaukov.sync.util.NdArray;
import lombok.Getter;

/**
 * Continuous complex Morlet wavelet transform.
 *
 * Each frequency f uses a Gaussian-windowed complex exponential with temporal SD
 * σ = wavenumber / (2πf), truncated at ±truncation·σ and scaled so a unit-amplitude
 * cosine at f gives unit magnitude. Convolution is done via FFT in "same" mode, so every
 * input sample keeps one output timepoint. The kernel is conjugate-symmetric, which makes
 * reversing the input conjugate and reverse the output.
 *
 * <p>Not thread-safe (kernel spectra are cached per FFT length).</p>
 */
public class MorletWavelet implements SpectralProvider {

  @Getter
  private final double sampleRate;
  private final double[] freqs;
  private final double[][] kernelRe;
  private final double[][] kernelIm;
  private final int[] halfWidths;

  private final int[] cachedNfft;
  private final double[][][] cachedKernelFft;

  public MorletWavelet(double sampleRate, double[] freqs, double wavenumber, double truncation) {
    this.sampleRate = sampleRate;
    this.freqs = freqs.clone();
    int nf = freqs.length;
    this.kernelRe = new double[nf][];
    this.kernelIm = new double[nf][];
    this.halfWidths = new int[nf];
    this.cachedNfft = new int[nf];
    this.cachedKernelFft = new double[nf][][];
    for (int f = 0; f < nf; f++) {
      double freq = freqs[f];
      if (!(freq > 0) || freq >= sampleRate / 2) {
        throw new ConfigurationException("wavelet frequency " + freq + " Hz outside (0, Nyquist) for "
          + sampleRate + " Hz sampling");
      }
      double sigma = wavenumber / (2.0 * Math.PI * freq);
      int h = Math.max(1, (int) Math.ceil(truncation * sigma * sampleRate));
      double[] re = new double[2 * h + 1];
      double[] im = new double[2 * h + 1];
      double envSum = 0;
      for (int j = 0; j < re.length; j++) {
        double t = (j - h) / sampleRate;
        double env = Math.exp(-t * t / (2.0 * sigma * sigma));
        double arg = 2.0 * Math.PI * freq * t;
        re[j] = env * Math.cos(arg);
        im[j] = env * Math.sin(arg);
        envSum += env;
      }
      double scale = 2.0 / envSum;
      for (int j = 0; j < re.length; j++) {
        re[j] *= scale;
        im[j] *= scale;
      }
      kernelRe[f] = re;
      kernelIm[f] = im;
      halfWidths[f] = h;
    }
  }

  @Override
  public SpectralMethod method() {
    return SpectralMethod.WAVELET;
  }

  @Override
  public Spectrogram transform(double[] signal) {
    int n = signal.length;
    int nf = freqs.length;
    double[] outRe = new double[nf * n];
    double[] outIm = new double[nf * n];
    Map<Integer, double[][]> signalSpectra = new HashMap<>();
    for (int f = 0; f < nf; f++) {
      int h = halfWidths[f];
      int nfft = FftUtils.nextPowerOfTwo(n + 2 * h);
      double[][] x = signalSpectra.computeIfAbsent(nfft, m -> {
        double[][] d = FftUtils.padded(signal, m);
        FftUtils.forward(d);
        return d;
      });
      double[][] k = kernelSpectrum(f, nfft);
      double[][] y = new double[2][nfft];
      for (int i = 0; i < nfft; i++) {
        y[0][i] = x[0][i] * k[0][i] - x[1][i] * k[1][i];
        y[1][i] = x[0][i] * k[1][i] + x[1][i] * k[0][i];
      }
      FftUtils.inverse(y);
      // "same" mode: output sample i sits at full-convolution index i + h
      for (int i = 0; i < n; i++) {
        outRe[f * n + i] = y[0][i + h];
        outIm[f * n + i] = y[1][i + h];
      }
    }
    double[] timepts = new double[n];
    for (int i = 0; i < n; i++) {
      timepts[i] = i / sampleRate;
    }
    return new Spectrogram(outRe, outIm, nf, n, 1, NdArray.vector(freqs), timepts);
  }

  public double[] getFreqs() {
    return freqs.clone();
  }

  private double[][] kernelSpectrum(int f, int nfft) {
    if (cachedNfft[f] != nfft) {
      double[][] d = new double[][]{
        Arrays.copyOf(kernelRe[f], nfft),
        Arrays.copyOf(kernelIm[f], nfft)};
      FftUtils.forward(d);
      cachedKernelFft[f] = d;
      cachedNfft[f] = nfft;
    }
    return cachedKernelFft[f];
  }
}
