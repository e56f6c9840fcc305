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

import java.util.Iterator;

/// Decides how the scans of a [ScanAggregator] are cut into batches.
///
/// A strategy holds the progress of one aggregator and must not be shared between aggregators.
public interface DeliveryStrategy {

  /// @param aggregator the scans to deliver from
  /// @return the next batches
  Iterator<DataPackage> feed(ScanAggregator aggregator);
}
