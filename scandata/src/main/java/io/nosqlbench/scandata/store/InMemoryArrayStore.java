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


import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// A [KeyedArrayStore] over arrays which are already in memory.
public class InMemoryArrayStore implements KeyedArrayStore {

  private final Map<String, NdArray> arrays;

  /// create a store over a mapping of arrays
  /// @param arrays the arrays by name; the mapping is copied
  public InMemoryArrayStore(Map<String, NdArray> arrays) {
    this.arrays = new LinkedHashMap<>(arrays);
  }

  @Override
  public NdArray read(String key) {
    return require(key);
  }

  @Override
  public NdArray read(String key, SliceSpec slice) {
    return require(key).select(slice);
  }

  private NdArray require(String key) {
    NdArray array = arrays.get(key);
    if (array == null) {
      throw new MissingKeyException(key, "no array named '" + key + "' in memory store " + keys());
    }
    return array;
  }

  @Override
  public Set<String> keys() {
    return arrays.keySet();
  }
}
