package io.nosqlbench.scandata.store;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A dense, row-major array of float values with an explicit shape.
///
/// This is the value type exchanged with a [KeyedArrayStore]. Frame stacks are rank 3
/// `(frames, rows, columns)`, frame-invariant calibration planes are rank 2 `(rows, columns)`.
/// Nested Java arrays, as read from or written to HDF5, are converted with [#fromNested(Object)]
/// and [#toNested()].
///
/// @param shape the extent of each dimension, outermost first
/// @param values the row-major values
public record NdArray(int[] shape, float[] values) {

  /// create an array, checking that the shape matches the number of values
  /// @param shape the extent of each dimension
  /// @param values the row-major values
  public NdArray {
    long size = 1;
    for (int extent : shape) {
      if (extent < 0) {
        throw new IllegalArgumentException("negative extent in shape " + Arrays.toString(shape));
      }
      size *= extent;
    }
    if (size != values.length) {
      throw new IllegalArgumentException(
          "shape " + Arrays.toString(shape) + " requires " + size + " values, but " + values.length
          + " were given");
    }
  }

  /// @param value the fill value
  /// @param shape the shape
  /// @return an array filled with a single value
  public static NdArray filled(float value, int... shape) {
    float[] values = new float[Math.toIntExact(sizeOf(shape))];
    Arrays.fill(values, value);
    return new NdArray(shape.clone(), values);
  }

  /// @param shape the shape
  /// @return an array of zeros
  public static NdArray zeros(int... shape) {
    return filled(0.0f, shape);
  }

  /// @param shape the shape
  /// @return an array of ones
  public static NdArray ones(int... shape) {
    return filled(1.0f, shape);
  }

  /// stack planes of equal shape into a rank 3 array
  /// @param planes the planes, in frame order
  /// @return a rank 3 array
  public static NdArray stack(List<float[][]> planes) {
    if (planes.isEmpty()) {
      return new NdArray(new int[]{0, 0, 0}, new float[0]);
    }
    int rows = planes.get(0).length;
    int cols = rows == 0 ? 0 : planes.get(0)[0].length;
    float[] values = new float[planes.size() * rows * cols];
    int offset = 0;
    for (int k = 0; k < planes.size(); k++) {
      float[][] plane = planes.get(k);
      if (plane.length != rows || (rows > 0 && plane[0].length != cols)) {
        throw new IllegalArgumentException(
            "plane " + k + " is " + plane.length + "x" + (plane.length == 0 ? 0 : plane[0].length)
            + ", expected " + rows + "x" + cols);
      }
      for (float[] row : plane) {
        System.arraycopy(row, 0, values, offset, cols);
        offset += cols;
      }
    }
    return new NdArray(new int[]{planes.size(), rows, cols}, values);
  }

  /// concatenate arrays of equal trailing shape along the outermost dimension
  /// @param slabs the arrays to join, in order
  /// @return the joined array
  public static NdArray concat(List<NdArray> slabs) {
    if (slabs.isEmpty()) {
      throw new IllegalArgumentException("nothing to concatenate");
    }
    int[] trailing = Arrays.copyOfRange(slabs.get(0).shape, 1, slabs.get(0).shape.length);
    int outer = 0;
    int total = 0;
    for (NdArray slab : slabs) {
      if (!Arrays.equals(trailing, Arrays.copyOfRange(slab.shape, 1, slab.shape.length))) {
        throw new IllegalArgumentException(
            "cannot concatenate shape " + Arrays.toString(slab.shape) + " onto trailing shape "
            + Arrays.toString(trailing));
      }
      outer += slab.shape[0];
      total += slab.values.length;
    }
    float[] values = new float[total];
    int offset = 0;
    for (NdArray slab : slabs) {
      System.arraycopy(slab.values, 0, values, offset, slab.values.length);
      offset += slab.values.length;
    }
    int[] shape = new int[trailing.length + 1];
    shape[0] = outer;
    System.arraycopy(trailing, 0, shape, 1, trailing.length);
    return new NdArray(shape, values);
  }

  /// Convert a nested Java array, of any numeric or boolean element type, into a float array.
  /// @param nested a rectangular nested array, such as `int[][][]` or `double[][]`
  /// @return the converted array
  public static NdArray fromNested(Object nested) {
    if (nested == null || !nested.getClass().isArray()) {
      throw new IllegalArgumentException("not an array: " + nested);
    }
    List<Integer> dims = new ArrayList<>();
    Object cursor = nested;
    while (cursor != null && cursor.getClass().isArray()) {
      int length = Array.getLength(cursor);
      dims.add(length);
      if (length == 0) {
        break;
      }
      cursor = Array.get(cursor, 0);
    }
    int[] shape = dims.stream().mapToInt(Integer::intValue).toArray();
    float[] values = new float[Math.toIntExact(sizeOf(shape))];
    if (values.length > 0) {
      flatten(nested, 0, shape, values, new int[]{0});
    }
    return new NdArray(shape, values);
  }

  private static void flatten(Object array, int depth, int[] shape, float[] out, int[] cursor) {
    int length = Array.getLength(array);
    if (length != shape[depth]) {
      throw new IllegalArgumentException("ragged array at depth " + depth);
    }
    if (depth == shape.length - 1) {
      if (array instanceof float[] floats) {
        System.arraycopy(floats, 0, out, cursor[0], floats.length);
        cursor[0] += floats.length;
        return;
      }
      for (int i = 0; i < length; i++) {
        Object element = Array.get(array, i);
        if (element instanceof Number n) {
          out[cursor[0]++] = n.floatValue();
        } else if (element instanceof Boolean b) {
          out[cursor[0]++] = b ? 1.0f : 0.0f;
        } else {
          throw new IllegalArgumentException(
              "unsupported element type " + array.getClass().getComponentType());
        }
      }
      return;
    }
    for (int i = 0; i < length; i++) {
      flatten(Array.get(array, i), depth + 1, shape, out, cursor);
    }
  }

  private static long sizeOf(int[] shape) {
    long size = 1;
    for (int extent : shape) {
      size *= extent;
    }
    return size;
  }

  /// @return the number of dimensions
  public int rank() {
    return shape.length;
  }

  /// @param dimension the dimension, outermost first
  /// @return the extent of the dimension
  public int dim(int dimension) {
    return shape[dimension];
  }

  /// @return the single plane of a rank 2 array
  public float[][] asPlane() {
    if (rank() != 2) {
      throw new IllegalStateException("array of shape " + Arrays.toString(shape) + " is not a plane");
    }
    return planeAt(0, shape[0], shape[1]);
  }

  /// @param k the position along the outermost dimension
  /// @return a copy of the k-th plane of a rank 3 array
  public float[][] plane(int k) {
    if (rank() != 3) {
      throw new IllegalStateException("array of shape " + Arrays.toString(shape) + " is not a stack");
    }
    if (k < 0 || k >= shape[0]) {
      throw new IndexOutOfBoundsException("plane " + k + " of " + shape[0]);
    }
    return planeAt(k * shape[1] * shape[2], shape[1], shape[2]);
  }

  private float[][] planeAt(int offset, int rows, int cols) {
    float[][] plane = new float[rows][cols];
    for (int r = 0; r < rows; r++) {
      System.arraycopy(values, offset + r * cols, plane[r], 0, cols);
    }
    return plane;
  }

  /// Apply a slice to this array.
  /// @param slice a slice of the same rank as this array
  /// @return the selected values
  /// @throws SliceIndexException if the slice rank differs or a selection does not fit
  public NdArray select(SliceSpec slice) {
    if (slice.rank() != rank()) {
      throw new SliceIndexException(
          "slice " + slice.toData() + " of rank " + slice.rank() + " does not match stored rank "
          + rank());
    }
    int[][] positions = new int[rank()][];
    int[] outShape = new int[rank()];
    for (int d = 0; d < rank(); d++) {
      positions[d] = slice.dim(d).resolve(shape[d]);
      outShape[d] = positions[d].length;
    }
    int[] strides = new int[rank()];
    int stride = 1;
    for (int d = rank() - 1; d >= 0; d--) {
      strides[d] = stride;
      stride *= shape[d];
    }
    float[] out = new float[Math.toIntExact(sizeOf(outShape))];
    if (out.length == 0) {
      return new NdArray(outShape, out);
    }
    int[] odometer = new int[rank()];
    for (int i = 0; i < out.length; i++) {
      int source = 0;
      for (int d = 0; d < rank(); d++) {
        source += positions[d][odometer[d]] * strides[d];
      }
      out[i] = values[source];
      for (int d = rank() - 1; d >= 0; d--) {
        if (++odometer[d] < outShape[d]) {
          break;
        }
        odometer[d] = 0;
      }
    }
    return new NdArray(outShape, out);
  }

  /// @return the values as a nested Java array: `float[]`, `float[][]` or `float[][][]`
  public Object toNested() {
    return switch (rank()) {
      case 1 -> values.clone();
      case 2 -> asPlane();
      case 3 -> {
        float[][][] stack = new float[shape[0]][][];
        for (int k = 0; k < shape[0]; k++) {
          stack[k] = plane(k);
        }
        yield stack;
      }
      default -> throw new IllegalStateException("unsupported rank " + rank() + " for nesting");
    };
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NdArray other && Arrays.equals(shape, other.shape)
           && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "NdArray{shape=" + Arrays.toString(shape) + "}";
  }
}
