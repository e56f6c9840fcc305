package io.nosqlbench.scandata.feed;

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


import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.parallel.LocalCoordinationGroup;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.DataPackage;
import io.nosqlbench.scandata.scan.FramePackage;
import io.nosqlbench.scandata.scan.MetaTranslator;
import io.nosqlbench.scandata.scan.ScanContainer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeliveryTest {

  private static ScanAggregator emptyScans(CoordinationContext context, DeliveryStrategy delivery,
                                           int... frameCounts) {
    List<Object> sources = new ArrayList<>();
    List<Map<String, Object>> overrides = new ArrayList<>();
    for (int count : frameCounts) {
      sources.add(null);
      overrides.add(Map.of("shape", List.of(count, 2, 2)));
    }
    return new ScanAggregator(sources, overrides, null, context, MetaTranslator.standard(),
        delivery);
  }

  private static List<Integer> indices(DataPackage batch) {
    return batch.iterable().stream().map(FramePackage::index).toList();
  }

  @Test
  public void testWholeScanDelivery() {
    ScanAggregator aggregator =
        emptyScans(SingleProcessContext.INSTANCE, new WholeScanDelivery(), 3, 2);
    Iterator<DataPackage> feed = aggregator.feed();

    assertThat(feed.hasNext()).isTrue();
    DataPackage first = feed.next();
    assertThat(first.label()).isEqualTo("Scan00");
    assertThat(indices(first)).containsExactly(0, 1, 2);
    assertThat(aggregator.getScan("Scan00").isLoaded()).isTrue();

    DataPackage second = feed.next();
    assertThat(second.label()).isEqualTo("Scan01");
    assertThat(second.size()).isEqualTo(2);
    assertThat(aggregator.getScan("Scan00").isLoaded()).isFalse();
    assertThat(aggregator.isAvailable()).isTrue();

    assertThat(feed.hasNext()).isFalse();
    assertThat(aggregator.isAvailable()).isFalse();
    assertThat(aggregator.getScan("Scan01").isLoaded()).isFalse();
    assertThatThrownBy(aggregator::feed).isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testChunkedDelivery() {
    ChunkedDelivery delivery = new ChunkedDelivery(5);
    ScanAggregator aggregator = emptyScans(SingleProcessContext.INSTANCE, delivery, 12);

    List<Integer> sizes = new ArrayList<>();
    List<Boolean> availability = new ArrayList<>();
    while (aggregator.isAvailable()) {
      aggregator.feed().forEachRemaining(batch -> sizes.add(batch.size()));
      availability.add(aggregator.isAvailable());
    }
    assertThat(sizes).containsExactly(5, 5, 2);
    assertThat(availability).containsExactly(true, true, false);
    assertThat(delivery.getDelivered()).isEqualTo(12);
    assertThat(aggregator.getScans().get(0).isLoaded()).isFalse();
    assertThat(aggregator.feed().hasNext()).isFalse();
  }

  @Test
  public void testChunkedDeliveryRestartsPerScan() {
    ScanAggregator aggregator =
        emptyScans(SingleProcessContext.INSTANCE, new ChunkedDelivery(5), 7, 3);
    List<String> windows = new ArrayList<>();
    while (aggregator.isAvailable()) {
      aggregator.feed().forEachRemaining(
          batch -> windows.add(batch.label() + indices(batch)));
    }
    assertThat(windows).containsExactly(
        "Scan00[0, 1, 2, 3, 4]", "Scan00[5, 6]", "Scan01[0, 1, 2]");
  }

  @Test
  @Timeout(30)
  public void testChunkedDeliveryAcrossWorkers() {
    List<List<Integer>> perWorker = new LocalCoordinationGroup(2).run(context -> {
      ScanAggregator aggregator = emptyScans(context, new ChunkedDelivery(4), 6);
      List<Integer> frames = new ArrayList<>();
      while (aggregator.isAvailable()) {
        aggregator.feed().forEachRemaining(batch -> frames.addAll(indices(batch)));
      }
      return frames;
    });
    assertThat(perWorker.get(0)).containsExactly(0, 1, 2);
    assertThat(perWorker.get(1)).containsExactly(3, 4, 5);
  }

  @Test
  public void testPackagesUseScanMetadata() {
    ScanAggregator aggregator = new ScanAggregator(Arrays.asList((Object) null),
        List.of(Map.of("shape", List.of(1, 2, 2), "wavelength", 2.0e-10)), List.of("only"),
        SingleProcessContext.INSTANCE, MetaTranslator.standard(), new WholeScanDelivery());
    DataPackage batch = aggregator.feed().next();
    assertThat(batch.common()).containsEntry("lam", 2.0e-10).containsEntry("label", "only");
    ScanContainer scan = aggregator.getScan("only");
    assertThat(scan.getLabel()).isEqualTo("only");
  }
}
