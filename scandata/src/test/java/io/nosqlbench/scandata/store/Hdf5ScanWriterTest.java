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


import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Hdf5ScanWriterTest {

  @TempDir
  Path tempDir;

  @Test
  public void testWriteAndReadBack() throws IOException {
    Map<String, NdArray> arrays = new HashMap<>();
    arrays.put("data", NdArray.stack(List.of(new float[][]{{1, 2}, {3, 4}},
        new float[][]{{5, 6}, {7, 8}})));
    arrays.put("mask", NdArray.ones(2, 2));
    arrays.put("dark", null);
    Path target = tempDir.resolve("scans").resolve("written.h5");

    new Hdf5ScanWriter().write(target,
        new ScanRecord(arrays, Map.of("scan_info", "{}", "ignored", List.of(1, 2))),
        WriteMode.RELAXED);

    Hdf5ArrayStore store = new Hdf5ArrayStore(target);
    assertThat(store.keys()).containsExactlyInAnyOrder("data", "mask");
    assertThat(store.read("data").values()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
    assertThat(store.readRootAttribute("scan_info")).contains("{}");
    assertThat(store.readRootAttribute("ignored")).isEmpty();
    try (Stream<Path> files = Files.list(target.getParent())) {
      assertThat(files).containsExactly(target);
    }
  }

  @Test
  public void testStrictModeRejectsAbsentArrays() throws IOException {
    Map<String, NdArray> arrays = new HashMap<>();
    arrays.put("data", NdArray.zeros(1, 2, 2));
    arrays.put("flat", null);
    Path target = tempDir.resolve("strict.h5");

    assertThatThrownBy(() -> new Hdf5ScanWriter().write(target, new ScanRecord(arrays, Map.of()),
        WriteMode.STRICT)).isInstanceOf(IllegalArgumentException.class);
    assertThat(target).doesNotExist();
    try (Stream<Path> files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  public void testReplacesExistingFile() throws IOException {
    Path target = tempDir.resolve("replace.h5");
    Files.writeString(target, "not a scan");
    new Hdf5ScanWriter().write(target,
        new ScanRecord(Map.of("data", NdArray.ones(1, 1, 1)), Map.of()), WriteMode.RELAXED);
    assertThat(new Hdf5ArrayStore(target).read("data").values()).containsExactly(1);
  }
}
