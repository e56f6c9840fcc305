package io.nosqlbench.scandata.scan;

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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.errors.ConsistencyException;
import io.nosqlbench.scandata.errors.DestinationConflictException;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.store.Hdf5ArrayStore;
import io.nosqlbench.scandata.store.NdArray;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScanContainerTest {

  @TempDir
  Path tempDir;

  private static ScanContainer container(String label, int count, int rows, int cols) {
    return new ScanContainer(ScanFixtures.scan(label, count, rows, cols), null,
        SingleProcessContext.INSTANCE);
  }

  @Test
  public void testLoadFillsViews() {
    ScanContainer scan = container("S", 4, 3, 3);
    assertThat(scan.isLoaded()).isFalse();
    assertThat(scan.getView("data")).hasSize(4).allMatch(slot -> !slot.isOwned());

    scan.load(LoadOptions.DEFAULT);
    assertThat(scan.isLoaded()).isTrue();
    assertThat(scan.getIndices()).containsExactly(0, 1, 2, 3);
    assertThat(scan.getView("data").get(2).plane()[1][2]).isEqualTo(212.0f);
    assertThat(scan.getArray("mask").map(NdArray::rank)).contains(2);
    assertThat(scan.getView("mask")).allMatch(FrameSlot::isOwned);
    assertThat(scan.getView("flat")).noneMatch(FrameSlot::isOwned);
    assertThat(scan.getArray("dark")).isEmpty();

    scan.unload();
    assertThat(scan.isLoaded()).isFalse();
    assertThat(scan.getArray("data")).isEmpty();
    assertThat(scan.getView("data")).hasSize(4).noneMatch(FrameSlot::isOwned);
  }

  @Test
  public void testLoadRangeAndRegionOfInterest() {
    ScanContainer scan = container("S", 6, 10, 10);
    scan.load(LoadOptions.DEFAULT.withRange(2, 5).withRoi(4, List.of(5, 5)));
    assertThat(scan.getIndices()).containsExactly(2, 3, 4);
    assertThat(scan.getRegionOfInterest().shape()).containsExactly(4, 4);
    float[][] plane = scan.getView("data").get(3).plane();
    assertThat(plane.length).isEqualTo(4);
    assertThat(plane[0][0]).isEqualTo(333.0f);
    assertThat(scan.getView("data").get(1).isOwned()).isFalse();
    assertThat(scan.getView("mask").get(3).plane()[0]).containsExactly(1, 1, 1, 1);
  }

  @Test
  public void testExplicitIndices() {
    ScanContainer scan = container("S", 6, 2, 2);
    scan.load(LoadOptions.DEFAULT.withPartition(PartitionMode.explicit(List.of(5, 1))));
    assertThat(scan.getIndices()).containsExactly(5, 1);
    assertThat(scan.getView("data").get(5).plane()[0][0]).isEqualTo(500.0f);
    assertThat(scan.getView("data").get(1).plane()[0][0]).isEqualTo(100.0f);
    assertThat(scan.getView("data").get(0).isOwned()).isFalse();
  }

  @Test
  public void testInvalidLoads() {
    ScanContainer scan = container("S", 4, 3, 3);
    assertThatThrownBy(() -> scan.load(LoadOptions.DEFAULT.withRange(3, 3)))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> scan.load(LoadOptions.DEFAULT.withRange(0, 9)))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> scan.load(LoadOptions.DEFAULT.withRoi(8, null)))
        .isInstanceOf(ConfigException.class);
    assertThatThrownBy(() -> scan.load(
        LoadOptions.DEFAULT.withPartition(PartitionMode.explicit(List.of(4)))))
        .isInstanceOf(ConfigException.class);
    assertThat(scan.isLoaded()).isFalse();
  }

  @Test
  public void testSaveAndReopen() {
    ScanContainer scan = container("S", 4, 3, 3);
    scan.load(LoadOptions.DEFAULT);
    Path target = tempDir.resolve("saved.h5");
    assertThat(scan.save(target, OverwritePolicy.REFUSE, null)).contains(target);

    Hdf5ArrayStore stored = new Hdf5ArrayStore(target);
    assertThat(stored.keys()).containsExactlyInAnyOrder("data", "mask");
    assertThat(stored.read("data")).isEqualTo(ScanFixtures.frames(4, 3, 3));

    ScanContainer reopened =
        new ScanContainer(new FileScanSource(target), null, SingleProcessContext.INSTANCE);
    assertThat(reopened.getLabel()).isEqualTo("S");
    assertThat(reopened.getMetadata().shape()).containsExactly(4, 3, 3);
    assertThat(reopened.getMetadata().dataFilename()).isEqualTo(target.toString());
    reopened.load(LoadOptions.DEFAULT);
    assertThat(reopened.getView("data").get(3).plane()[2][1]).isEqualTo(321.0f);
  }

  @Test
  public void testSaveToDataFilename() {
    Path target = tempDir.resolve("by-metadata.ptyd");
    ScanContainer scan = new ScanContainer(EmptyScanSource.INSTANCE,
        Map.of("shape", List.of(2, 2, 2), "data_filename", target.toString()),
        SingleProcessContext.INSTANCE);
    scan.load(LoadOptions.DEFAULT);
    assertThat(scan.save(null, OverwritePolicy.FORCE, null)).contains(target);
    assertThat(new Hdf5ArrayStore(target).keys())
        .containsExactlyInAnyOrder("data", "mask", "flat", "dark");
  }

  @Test
  public void testSaveRequiresFullLoad() {
    ScanContainer scan = container("S", 4, 3, 3);
    assertThatThrownBy(() -> scan.save(tempDir.resolve("never.h5"), OverwritePolicy.FORCE, null))
        .isInstanceOf(ConsistencyException.class);
    scan.load(LoadOptions.DEFAULT.withRange(0, 2));
    assertThatThrownBy(() -> scan.save(tempDir.resolve("partial.h5"), OverwritePolicy.FORCE, null))
        .isInstanceOf(ConsistencyException.class)
        .hasMessageContaining("non-native");
  }

  @Test
  public void testOverwritePolicies() throws IOException {
    Path target = tempDir.resolve("exists.h5");
    Files.writeString(target, "occupied");
    ScanContainer scan = container("S", 2, 2, 2);
    scan.load(LoadOptions.DEFAULT);

    assertThatThrownBy(() -> scan.save(target, OverwritePolicy.REFUSE, null))
        .isInstanceOf(DestinationConflictException.class);
    assertThatThrownBy(() -> scan.save(target, OverwritePolicy.ASK, OverwriteConfirmation.DECLINE))
        .isInstanceOf(DestinationConflictException.class);
    assertThat(Files.readString(target)).isEqualTo("occupied");

    assertThat(scan.save(target, OverwritePolicy.ASK, path -> true)).contains(target);
    assertThat(new Hdf5ArrayStore(target).keys()).contains("data");
    assertThat(scan.save(target, OverwritePolicy.FORCE, null)).contains(target);
  }

  @Test
  public void testDataPackage() {
    Map<String, Object> info = Map.of("scan_label", "P", "shape", List.of(3, 2, 2),
        "wavelength", 1.0e-10,
        "positions", List.of(List.of(0.0, 0.0), List.of(1.0, 0.5), List.of(2.0, 1.0)));
    ScanContainer scan = new ScanContainer(new MappingScanSource(
        Map.of("data", ScanFixtures.frames(3, 2, 2)), info), null, SingleProcessContext.INSTANCE);
    scan.setLabel("renamed");
    scan.load(LoadOptions.DEFAULT);

    DataPackage batch = scan.asDataPackage(MetaTranslator.standard(), 1, 99);
    assertThat(batch.label()).isEqualTo("renamed");
    assertThat(batch.common()).containsEntry("lam", 1.0e-10).containsEntry("label_original", "P");
    assertThat(batch.size()).isEqualTo(2);
    FramePackage frame = batch.iterable().get(0);
    assertThat(frame.index()).isEqualTo(1);
    assertThat(frame.position()).containsExactly(1.0, 0.5);
    assertThat(frame.mask()).isNull();
    assertThat(frame.data()[1][1]).isEqualTo(111.0f);
  }
}
