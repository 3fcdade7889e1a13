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
package io.github.dkaukov.sync.util;

import java.util.Arrays;

import javax.annotation.Nonnull;

/**
 * Dense row-major N-dimensional array of doubles, real or complex.
 *
 * <p>Key properties:</p>
 * <ul>
 *   <li>Immutable from the outside: every shape operation returns a new array.</li>
 *   <li>Complex arrays keep separate real and imaginary planes.</li>
 *   <li>Element order is C order (last axis varies fastest).</li>
 * </ul>
 */
public final class NdArray {

  private final int[] shape;
  private final int[] strides;
  private final double[] re;
  private final double[] im; // null for real arrays

  private NdArray(int[] shape, double[] re, double[] im) {
    if (shape.length == 0) {
      throw new IllegalArgumentException("rank must be >= 1");
    }
    int size = 1;
    for (int d : shape) {
      if (d < 0) {
        throw new IllegalArgumentException("negative dimension in shape " + Arrays.toString(shape));
      }
      size *= d;
    }
    if (re.length != size || (im != null && im.length != size)) {
      throw new IllegalArgumentException(
        "data length " + re.length + " does not match shape " + Arrays.toString(shape));
    }
    this.shape = shape;
    this.strides = stridesOf(shape);
    this.re = re;
    this.im = im;
  }

  /** Real array; {@code data} is copied. */
  public static NdArray real(double[] data, int... shape) {
    return new NdArray(shape.clone(), data.clone(), null);
  }

  /** Complex array; both planes are copied. */
  public static NdArray complex(double[] re, double[] im, int... shape) {
    return new NdArray(shape.clone(), re.clone(), im.clone());
  }

  /**
   * Wraps the given planes without copying. The caller hands over ownership and must not
   * touch the arrays afterwards.
   */
  public static NdArray wrap(int[] shape, double[] re, double[] im) {
    return new NdArray(shape.clone(), re, im);
  }

  public static NdArray zeros(int... shape) {
    return new NdArray(shape.clone(), new double[sizeOf(shape)], null);
  }

  /** 1-d real array. */
  public static NdArray vector(double... values) {
    return new NdArray(new int[]{values.length}, values.clone(), null);
  }

  /** 2-d real array from rows of equal length. */
  public static NdArray matrix(double[][] rows) {
    int cols = rows.length == 0 ? 0 : rows[0].length;
    double[] data = new double[rows.length * cols];
    for (int r = 0; r < rows.length; r++) {
      if (rows[r].length != cols) {
        throw new IllegalArgumentException("ragged rows");
      }
      System.arraycopy(rows[r], 0, data, r * cols, cols);
    }
    return new NdArray(new int[]{rows.length, cols}, data, null);
  }

  /** 2-d 0/1 array from boolean rows (spike trains). */
  public static NdArray matrix(boolean[][] rows) {
    int cols = rows.length == 0 ? 0 : rows[0].length;
    double[] data = new double[rows.length * cols];
    for (int r = 0; r < rows.length; r++) {
      if (rows[r].length != cols) {
        throw new IllegalArgumentException("ragged rows");
      }
      for (int c = 0; c < cols; c++) {
        data[r * cols + c] = rows[r][c] ? 1.0 : 0.0;
      }
    }
    return new NdArray(new int[]{rows.length, cols}, data, null);
  }

  public int rank() {
    return shape.length;
  }

  public int[] shape() {
    return shape.clone();
  }

  public int size(int axis) {
    return shape[axis];
  }

  /** Total number of elements. */
  public int size() {
    return re.length;
  }

  public boolean isComplex() {
    return im != null;
  }

  /** Flat (row-major) offset of a multi-index. */
  public int offset(int... index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException("expected " + shape.length + " indexes, got " + index.length);
    }
    int off = 0;
    for (int d = 0; d < index.length; d++) {
      if (index[d] < 0 || index[d] >= shape[d]) {
        throw new IndexOutOfBoundsException("index " + index[d] + " out of range for axis " + d);
      }
      off += index[d] * strides[d];
    }
    return off;
  }

  public double get(int... index) {
    return re[offset(index)];
  }

  public double getImag(int... index) {
    return im == null ? 0.0 : im[offset(index)];
  }

  /** Real part at a flat offset. */
  public double realAt(int flat) {
    return re[flat];
  }

  /** Imaginary part at a flat offset (0 for real arrays). */
  public double imagAt(int flat) {
    return im == null ? 0.0 : im[flat];
  }

  /** Copy of the real plane in row-major order. */
  public double[] toArray() {
    return re.clone();
  }

  public NdArray copy() {
    return new NdArray(shape.clone(), re.clone(), im == null ? null : im.clone());
  }

  /** Real array holding the real part of this one. */
  public NdArray realPart() {
    return new NdArray(shape.clone(), re.clone(), null);
  }

  /** Complex view of this array; real arrays get a zero imaginary plane. */
  public NdArray toComplex() {
    return new NdArray(shape.clone(), re.clone(), im == null ? new double[re.length] : im.clone());
  }

  public NdArray reshape(int... newShape) {
    if (sizeOf(newShape) != re.length) {
      throw new IllegalArgumentException(
        "cannot reshape " + Arrays.toString(shape) + " into " + Arrays.toString(newShape));
    }
    return new NdArray(newShape.clone(), re.clone(), im == null ? null : im.clone());
  }

  /**
   * Permute axes: output axis {@code i} is input axis {@code perm[i]}.
   */
  public NdArray transpose(@Nonnull int... perm) {
    int n = shape.length;
    if (perm.length != n) {
      throw new IllegalArgumentException("permutation length " + perm.length + " != rank " + n);
    }
    boolean[] seen = new boolean[n];
    int[] outShape = new int[n];
    int[] srcStrides = new int[n];
    for (int i = 0; i < n; i++) {
      int p = perm[i];
      if (p < 0 || p >= n || seen[p]) {
        throw new IllegalArgumentException("invalid permutation " + Arrays.toString(perm));
      }
      seen[p] = true;
      outShape[i] = shape[p];
      srcStrides[i] = strides[p];
    }
    int total = re.length;
    double[] r = new double[total];
    double[] m = im == null ? null : new double[total];
    int[] idx = new int[n];
    int src = 0;
    for (int k = 0; k < total; k++) {
      r[k] = re[src];
      if (m != null) {
        m[k] = im[src];
      }
      // odometer increment, last axis fastest
      for (int d = n - 1; d >= 0; d--) {
        idx[d]++;
        src += srcStrides[d];
        if (idx[d] < outShape[d]) {
          break;
        }
        src -= srcStrides[d] * outShape[d];
        idx[d] = 0;
      }
    }
    return new NdArray(outShape, r, m);
  }

  /** Move one axis to a new position, keeping the order of the rest. */
  public NdArray moveAxis(int source, int destination) {
    int n = shape.length;
    int src = normalizeAxis(source, n);
    int dst = normalizeAxis(destination, n);
    int[] perm = new int[n];
    int j = 0;
    for (int i = 0; i < n; i++) {
      if (i != src) {
        perm[j++] = i;
      }
    }
    System.arraycopy(perm, dst, perm, dst + 1, n - 1 - dst);
    perm[dst] = src;
    return transpose(perm);
  }

  /** Reverse element order along one axis. */
  public NdArray flip(int axis) {
    int a = normalizeAxis(axis, shape.length);
    int len = shape[a];
    int inner = strides[a];
    int outer = re.length / Math.max(1, len * inner);
    double[] r = new double[re.length];
    double[] m = im == null ? null : new double[re.length];
    for (int o = 0; o < outer; o++) {
      for (int i = 0; i < len; i++) {
        int from = (o * len + i) * inner;
        int to = (o * len + (len - 1 - i)) * inner;
        System.arraycopy(re, from, r, to, inner);
        if (m != null) {
          System.arraycopy(im, from, m, to, inner);
        }
      }
    }
    return new NdArray(shape.clone(), r, m);
  }

  /** Keep the positions along {@code axis} where {@code mask} is true. */
  public NdArray select(int axis, @Nonnull boolean[] mask) {
    int a = normalizeAxis(axis, shape.length);
    if (mask.length != shape[a]) {
      throw new IllegalArgumentException("mask length " + mask.length + " != axis length " + shape[a]);
    }
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    int[] indexes = new int[count];
    int j = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        indexes[j++] = i;
      }
    }
    return select(a, indexes);
  }

  /** Gather the given positions along {@code axis}, in the given order. */
  public NdArray select(int axis, @Nonnull int[] indexes) {
    int a = normalizeAxis(axis, shape.length);
    int len = shape[a];
    int inner = strides[a];
    int outer = len * inner == 0 ? 0 : re.length / (len * inner);
    int[] outShape = shape.clone();
    outShape[a] = indexes.length;
    double[] r = new double[sizeOf(outShape)];
    double[] m = im == null ? null : new double[r.length];
    for (int o = 0; o < outer; o++) {
      for (int k = 0; k < indexes.length; k++) {
        int i = indexes[k];
        if (i < 0 || i >= len) {
          throw new IndexOutOfBoundsException("index " + i + " out of range for axis " + a);
        }
        int from = (o * len + i) * inner;
        int to = (o * indexes.length + k) * inner;
        System.arraycopy(re, from, r, to, inner);
        if (m != null) {
          System.arraycopy(im, from, m, to, inner);
        }
      }
    }
    return new NdArray(outShape, r, m);
  }

  /** Stack equally-shaped arrays along a new axis inserted at {@code axis}. */
  public static NdArray stack(int axis, @Nonnull NdArray... arrays) {
    if (arrays.length == 0) {
      throw new IllegalArgumentException("nothing to stack");
    }
    int[] base = arrays[0].shape;
    boolean complex = false;
    for (NdArray x : arrays) {
      if (!Arrays.equals(base, x.shape)) {
        throw new IllegalArgumentException("cannot stack shapes " + Arrays.toString(base)
          + " and " + Arrays.toString(x.shape));
      }
      complex |= x.isComplex();
    }
    int a = normalizeAxis(axis, base.length + 1);
    int[] outShape = new int[base.length + 1];
    System.arraycopy(base, 0, outShape, 0, a);
    outShape[a] = arrays.length;
    System.arraycopy(base, a, outShape, a + 1, base.length - a);
    int inner = 1;
    for (int d = a; d < base.length; d++) {
      inner *= base[d];
    }
    int outer = inner == 0 ? 0 : arrays[0].re.length / inner;
    double[] r = new double[sizeOf(outShape)];
    double[] m = complex ? new double[r.length] : null;
    for (int o = 0; o < outer; o++) {
      for (int k = 0; k < arrays.length; k++) {
        int to = (o * arrays.length + k) * inner;
        System.arraycopy(arrays[k].re, o * inner, r, to, inner);
        if (m != null && arrays[k].im != null) {
          System.arraycopy(arrays[k].im, o * inner, m, to, inner);
        }
      }
    }
    return new NdArray(outShape, r, m);
  }

  /** Mean of the real plane. */
  public double mean() {
    double sum = 0;
    for (double v : re) {
      sum += v;
    }
    return sum / re.length;
  }

  /** Mean of the real plane ignoring NaNs; NaN when every element is NaN. */
  public double nanMean() {
    double sum = 0;
    int n = 0;
    for (double v : re) {
      if (!Double.isNaN(v)) {
        sum += v;
        n++;
      }
    }
    return n == 0 ? Double.NaN : sum / n;
  }

  /**
   * Resolve a possibly negative axis against a rank.
   *
   * @throws IndexOutOfBoundsException if the axis is out of range after wrapping
   */
  public static int normalizeAxis(int axis, int rank) {
    int a = axis < 0 ? axis + rank : axis;
    if (a < 0 || a >= rank) {
      throw new IndexOutOfBoundsException("axis " + axis + " out of range for rank " + rank);
    }
    return a;
  }

  public static int sizeOf(int[] shape) {
    int size = 1;
    for (int d : shape) {
      size *= d;
    }
    return size;
  }

  private static int[] stridesOf(int[] shape) {
    int[] s = new int[shape.length];
    int acc = 1;
    for (int d = shape.length - 1; d >= 0; d--) {
      s[d] = acc;
      acc *= shape[d];
    }
    return s;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NdArray)) {
      return false;
    }
    NdArray other = (NdArray) o;
    return Arrays.equals(shape, other.shape)
      && Arrays.equals(re, other.re)
      && Arrays.equals(im, other.im);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(shape) + Arrays.hashCode(re)) + Arrays.hashCode(im);
  }

  @Override
  public String toString() {
    return "NdArray" + Arrays.toString(shape) + (im == null ? "" : " complex");
  }
}
