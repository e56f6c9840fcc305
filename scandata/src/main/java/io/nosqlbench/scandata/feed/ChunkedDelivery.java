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


import io.nosqlbench.scandata.errors.ConfigException;
import io.nosqlbench.scandata.scan.DataPackage;
import io.nosqlbench.scandata.scan.LoadOptions;
import io.nosqlbench.scandata.scan.ScanContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// Delivers a fixed number of frames per call.
///
/// Call `c` on a scan delivers the window `[chunkSize*c, chunkSize*(c+1))`, clamped to the
/// scan's frame count. When a scan is used up the call count starts over on the next scan. A
/// scan is loaded on its first window and unloaded after its last. Windows never span scans,
/// so the last window of a scan may be short.
public class ChunkedDelivery implements DeliveryStrategy {

  private static final Logger logger = LogManager.getLogger(ChunkedDelivery.class);

  /// the default number of frames per window
  public static final int DEFAULT_CHUNK_SIZE = 5;

  private final int chunkSize;
  private int scanIndex;
  private int calls;
  private long delivered;

  /// @param chunkSize the number of frames per window
  public ChunkedDelivery(int chunkSize) {
    if (chunkSize < 1) {
      throw new ConfigException("chunk size must be at least 1, but was " + chunkSize);
    }
    this.chunkSize = chunkSize;
  }

  @Override
  public Iterator<DataPackage> feed(ScanAggregator aggregator) {
    List<ScanContainer> scans = aggregator.getScans();
    while (scanIndex < scans.size()
        && (long) calls * chunkSize >= scans.get(scanIndex).getMetadata().frameCount()) {
      advance(scans.get(scanIndex));
    }
    if (scanIndex >= scans.size()) {
      aggregator.markExhausted();
      return Collections.emptyIterator();
    }

    ScanContainer scan = scans.get(scanIndex);
    if (!scan.isLoaded()) {
      scan.load(LoadOptions.DEFAULT);
    }
    int frameCount = scan.getMetadata().frameCount();
    int start = calls * chunkSize;
    int stop = Math.min(start + chunkSize, frameCount);
    DataPackage window = scan.asDataPackage(aggregator.getTranslator(), start, stop);
    calls++;
    delivered += stop - start;
    aggregator.getContext().barrier();
    logger.debug("delivered frames [{},{}) of scan {}, {} of {} frames in total", start, stop,
        scan.getLabel(), delivered, aggregator.getTotalFrames());

    if (stop >= frameCount) {
      advance(scan);
    }
    if (delivered >= aggregator.getTotalFrames()) {
      aggregator.markExhausted();
    }
    return List.of(window).iterator();
  }

  private void advance(ScanContainer finished) {
    if (finished.isLoaded()) {
      finished.unload();
    }
    scanIndex++;
    calls = 0;
  }

  /// @return the number of frames per window
  public int getChunkSize() {
    return chunkSize;
  }

  /// @return the number of frames delivered so far
  public long getDelivered() {
    return delivered;
  }
}
