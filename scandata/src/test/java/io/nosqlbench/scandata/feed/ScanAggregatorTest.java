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


import io.nosqlbench.scandata.errors.DuplicateLabelException;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.MetaTranslator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScanAggregatorTest {

  @Test
  public void testExplicitLabelWhenFree() {
    assertThat(ScanAggregator.resolveLabel("mine", "Scan%02d", 3, Set.of())).isEqualTo("mine");
  }

  @Test
  public void testTemplateFallback() {
    assertThat(ScanAggregator.resolveLabel(null, "Scan%02d", 3, Set.of())).isEqualTo("Scan03");
    assertThat(ScanAggregator.resolveLabel("mine", "Scan%02d", 4, Set.of("mine")))
        .isEqualTo("Scan04");
    assertThat(ScanAggregator.resolveLabel(null, "Scan%(idx)02d", 7, Set.of()))
        .isEqualTo("Scan07");
  }

  @Test
  public void testLiteralFallback() {
    assertThat(ScanAggregator.resolveLabel(null, "sample", 1, Set.of())).isEqualTo("sample");
    assertThat(ScanAggregator.resolveLabel(null, "sample", 1, Set.of("sample")))
        .isEqualTo("sample_01");
  }

  @Test
  public void testCollisionAfterFallback() {
    assertThatThrownBy(
        () -> ScanAggregator.resolveLabel("x", "sample", 1, Set.of("x", "sample", "sample_01")))
        .isInstanceOf(DuplicateLabelException.class)
        .hasMessageContaining("sample_01");
    assertThatThrownBy(() -> ScanAggregator.resolveLabel(null, "Scan%02d", 0, Set.of("Scan00")))
        .isInstanceOf(DuplicateLabelException.class);
  }

  @Test
  public void testConstructionResolvesLabelsAndTotals() {
    List<Map<String, Object>> overrides = List.of(
        Map.of("shape", List.of(3, 2, 2)),
        Map.of("shape", List.of(4, 2, 2)),
        Map.of("shape", List.of(5, 2, 2), "scan_label", "fixed"));
    ScanAggregator aggregator = new ScanAggregator(Arrays.asList(null, null, null), overrides,
        Arrays.asList("first", "first"), SingleProcessContext.INSTANCE,
        MetaTranslator.standard(), new WholeScanDelivery());
    assertThat(aggregator.getLabels()).containsExactly("first", "Scan01", "fixed");
    assertThat(aggregator.getTotalFrames()).isEqualTo(12);
    assertThat(aggregator.isAvailable()).isTrue();
    assertThat(aggregator.getScan("Scan01").getMetadata().frameCount()).isEqualTo(4);
  }

  @Test
  public void testEmptyAggregatorIsUnavailable() {
    ScanAggregator aggregator = new ScanAggregator(List.of(), null, null,
        SingleProcessContext.INSTANCE, MetaTranslator.standard(), new WholeScanDelivery());
    assertThat(aggregator.isAvailable()).isFalse();
    assertThat(aggregator.feed().hasNext()).isFalse();
  }

  @Test
  public void testSourcesSharingALiteralLabelGetDistinctLabels() {
    Map<String, Object> source =
        Map.of("scan_info", Map.of("scan_label", "Scan01", "shape", List.of(2, 2, 2)));
    ScanAggregator aggregator = new ScanAggregator(List.of(source, source), null, null,
        SingleProcessContext.INSTANCE, MetaTranslator.standard(), new WholeScanDelivery());
    assertThat(aggregator.getLabels()).containsExactly("Scan01", "Scan01_01");
    assertThat(aggregator.getTotalFrames()).isEqualTo(4);
  }

  @Test
  public void testRepeatedExplicitLabelCollidingWithFallbackFails() {
    assertThatThrownBy(() -> new ScanAggregator(Arrays.asList(null, null, null), null,
        Arrays.asList("Scan01", "Scan01", null), SingleProcessContext.INSTANCE,
        MetaTranslator.standard(), new WholeScanDelivery()))
        .isInstanceOf(DuplicateLabelException.class)
        .hasMessageContaining("Scan01");
  }
}
