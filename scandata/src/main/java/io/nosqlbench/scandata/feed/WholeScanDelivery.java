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


import io.nosqlbench.scandata.scan.DataPackage;
import io.nosqlbench.scandata.scan.LoadOptions;
import io.nosqlbench.scandata.scan.ScanContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/// Delivers one batch per scan, in the order the scans were added.
///
/// Each scan is loaded, split between workers, only when its batch is requested, and unloaded
/// when the next batch is requested or the iteration ends. The iteration can be made only once.
public class WholeScanDelivery implements DeliveryStrategy {

  private static final Logger logger = LogManager.getLogger(WholeScanDelivery.class);

  private boolean started;

  @Override
  public Iterator<DataPackage> feed(ScanAggregator aggregator) {
    if (started) {
      throw new IllegalStateException("whole scan delivery has already been iterated");
    }
    started = true;
    return new ScanIterator(aggregator);
  }

  private static final class ScanIterator implements Iterator<DataPackage> {
    private final ScanAggregator aggregator;
    private final List<ScanContainer> scans;
    private int next;
    private ScanContainer current;

    private ScanIterator(ScanAggregator aggregator) {
      this.aggregator = aggregator;
      this.scans = aggregator.getScans();
    }

    @Override
    public boolean hasNext() {
      if (next < scans.size()) {
        return true;
      }
      release();
      aggregator.markExhausted();
      return false;
    }

    @Override
    public DataPackage next() {
      if (!hasNext()) {
        throw new NoSuchElementException("all " + scans.size() + " scans were delivered");
      }
      release();
      current = scans.get(next++);
      current.load(LoadOptions.DEFAULT);
      DataPackage batch = current.asDataPackage(aggregator.getTranslator(), 0, null);
      aggregator.getContext().barrier();
      logger.debug("delivered scan {} with {} frames", current.getLabel(), batch.size());
      return batch;
    }

    private void release() {
      if (current != null) {
        current.unload();
        current = null;
      }
    }
  }
}
