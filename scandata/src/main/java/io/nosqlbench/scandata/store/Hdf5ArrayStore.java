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


import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfInvalidPathException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A [KeyedArrayStore] over an HDF5 scan container file.
///
/// Arrays are top-level datasets of the file. The file is opened for each request, so a store
/// instance holds no open handles between reads.
///
/// Contiguous selections are read with a single hyperslab request. When the outermost selector
/// is an explicit index list, the file is read one outer index at a time and the pieces are
/// stacked in selection order.
public class Hdf5ArrayStore implements KeyedArrayStore {

  private static final Logger logger = LogManager.getLogger(Hdf5ArrayStore.class);

  private final Path path;

  /// create a store over an HDF5 file
  /// @param path the file to read
  public Hdf5ArrayStore(Path path) {
    this.path = path;
  }

  @Override
  public NdArray read(String key) {
    try (HdfFile hdf = new HdfFile(path)) {
      return NdArray.fromNested(requireDataset(hdf, key).getData());
    }
  }

  @Override
  public NdArray read(String key, SliceSpec slice) {
    try (HdfFile hdf = new HdfFile(path)) {
      Dataset dataset = requireDataset(hdf, key);
      int[] dims = dataset.getDimensions();
      if (slice.rank() != dims.length) {
        throw new SliceIndexException(
            "slice " + slice.toData() + " of rank " + slice.rank() + " does not match dataset '"
            + key + "' of shape " + Arrays.toString(dims));
      }

      int[][] positions = new int[dims.length][];
      int[] selected = new int[dims.length];
      boolean empty = false;
      for (int d = 0; d < dims.length; d++) {
        positions[d] = slice.dim(d).resolve(dims[d]);
        selected[d] = positions[d].length;
        empty |= selected[d] == 0;
      }
      if (empty) {
        return NdArray.zeros(selected);
      }

      if (slice.dim(0).isContiguous()) {
        return readBox(dataset, positions, 0, positions[0].length);
      }

      List<NdArray> slabs = new ArrayList<>(positions[0].length);
      int[][] single = positions.clone();
      for (int index : positions[0]) {
        single[0] = new int[]{index};
        slabs.add(readBox(dataset, single, 0, 1));
      }
      logger.trace("read {} slabs of '{}' from {}", slabs.size(), key, path);
      return NdArray.concat(slabs);
    }
  }

  /// Read the bounding box of the selected positions, then select within it in memory.
  @NotNull
  private NdArray readBox(Dataset dataset, int[][] positions, int outerFrom, int outerCount) {
    int rank = positions.length;
    long[] offsets = new long[rank];
    int[] extents = new int[rank];
    List<DimSelector> relative = new ArrayList<>(rank);
    for (int d = 0; d < rank; d++) {
      int[] selected = d == 0 ? Arrays.copyOfRange(positions[0], outerFrom, outerFrom + outerCount)
          : positions[d];
      int min = Arrays.stream(selected).min().orElseThrow();
      int max = Arrays.stream(selected).max().orElseThrow();
      offsets[d] = min;
      extents[d] = max - min + 1;
      int[] shifted = new int[selected.length];
      for (int i = 0; i < selected.length; i++) {
        shifted[i] = selected[i] - min;
      }
      relative.add(new IndexList(shifted));
    }
    NdArray box = NdArray.fromNested(dataset.getData(offsets, extents));
    return box.select(new SliceSpec(relative));
  }

  @NotNull
  private Dataset requireDataset(HdfFile hdf, String key) {
    try {
      return hdf.getDatasetByPath(key);
    } catch (HdfInvalidPathException e) {
      throw new MissingKeyException(key, "no dataset named '" + key + "' in " + path);
    }
  }

  @Override
  public Set<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    try (HdfFile hdf = new HdfFile(path)) {
      hdf.getChildren().forEach((name, node) -> {
        if (node instanceof Dataset) {
          keys.add(name);
        }
      });
    }
    return keys;
  }

  /// Read a string attribute of the root group.
  /// @param name the attribute name
  /// @return the attribute value, if present
  public Optional<String> readRootAttribute(String name) {
    try (HdfFile hdf = new HdfFile(path)) {
      Attribute attribute = hdf.getAttribute(name);
      if (attribute == null) {
        return Optional.empty();
      }
      return Optional.of(String.valueOf(attribute.getData()));
    }
  }

  /// Read the attributes of a group as plain values. Groups of this kind are how older scan
  /// files store their metadata.
  /// @param groupPath the path to the group
  /// @return the attribute values by name, or empty if there is no such group
  public Optional<Map<String, Object>> readGroupAttributes(String groupPath) {
    try (HdfFile hdf = new HdfFile(path)) {
      Node node;
      try {
        node = hdf.getByPath(groupPath);
      } catch (HdfInvalidPathException e) {
        return Optional.empty();
      }
      if (!node.isGroup()) {
        return Optional.empty();
      }
      Map<String, Object> values = new LinkedHashMap<>();
      node.getAttributes().forEach((name, attribute) -> values.put(name, attribute.getData()));
      return Optional.of(values);
    }
  }

  @Override
  public String toString() {
    return "Hdf5ArrayStore{" + path + "}";
  }
}
