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
import io.nosqlbench.scandata.scan.MetaTranslator;

/// Builds aggregators from data source configurations.
public class ScanAggregators {

  /// @param config the data source configuration
  /// @param context the worker the aggregator runs on
  /// @return an aggregator with the configured delivery strategy and the standard translator
  public static ScanAggregator fromConfig(DataSourceConfig config, CoordinationContext context) {
    return fromConfig(config, context, MetaTranslator.standard());
  }

  /// @param config the data source configuration
  /// @param context the worker the aggregator runs on
  /// @param translator the consumer's metadata vocabulary
  /// @return an aggregator with the configured delivery strategy
  public static ScanAggregator fromConfig(
      DataSourceConfig config,
      CoordinationContext context,
      MetaTranslator translator
  ) {
    return new ScanAggregator(config.sources(), config.overrides(), config.labels(), context,
        translator, config.newDeliveryStrategy());
  }
}
