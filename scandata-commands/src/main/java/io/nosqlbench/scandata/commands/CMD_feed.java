package io.nosqlbench.scandata.commands;

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


import io.nosqlbench.scandata.errors.ScanDataException;
import io.nosqlbench.scandata.feed.DataSourceConfig;
import io.nosqlbench.scandata.feed.ScanAggregator;
import io.nosqlbench.scandata.feed.ScanAggregators;
import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.parallel.LocalCoordinationGroup;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.DataPackage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Run scans through the aggregator and summarize the delivered batches
@CommandLine.Command(name = "feed",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "deliver scan files as batches and print one line per batch",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "2: the scans could not be delivered"
    })
public class CMD_feed implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_feed.class);

  @CommandLine.Parameters(arity = "0..*", description = "The scan files to feed, in order")
  private List<String> files = new ArrayList<>();

  @CommandLine.Option(names = {"--config"},
      description = "A YAML data source configuration, used instead of the files")
  private Path config;

  @CommandLine.Option(names = {"--labels"}, split = ",", description = "Labels for the files")
  private List<String> labels = new ArrayList<>();

  @CommandLine.Option(names = {"--chunk"},
      description = "Deliver this many frames per batch instead of one batch per scan")
  private Integer chunk;

  @CommandLine.Option(names = {"--workers"}, defaultValue = "1",
      description = "The number of workers to split frames between (default: ${DEFAULT-VALUE})")
  private int workers;

  @Override
  public Integer call() {
    try {
      DataSourceConfig sourceConfig = sourceConfig();
      List<List<BatchSummary>> perWorker;
      if (workers <= 1) {
        perWorker = List.of(run(sourceConfig, SingleProcessContext.INSTANCE));
      } else {
        perWorker = new LocalCoordinationGroup(workers).run(context -> run(sourceConfig, context));
      }
      List<BatchSummary> batches = merge(perWorker);
      for (int i = 0; i < batches.size(); i++) {
        BatchSummary batch = batches.get(i);
        System.out.printf("batch %d: scan %s frames %d%n", i, batch.label(), batch.frames());
      }
      System.out.printf("delivered %d frames in %d batches%n",
          batches.stream().mapToLong(BatchSummary::frames).sum(), batches.size());
      return 0;
    } catch (ScanDataException e) {
      System.err.println(e.getMessage());
      return 2;
    }
  }

  private DataSourceConfig sourceConfig() {
    if (config != null) {
      return DataSourceConfig.fromPath(config);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("sources", new ArrayList<Object>(files));
    map.put("labels", labels);
    if (chunk != null) {
      map.put("delivery", "chunked");
      map.put("chunk_size", chunk);
    }
    return DataSourceConfig.fromMap(map);
  }

  private List<BatchSummary> run(DataSourceConfig sourceConfig, CoordinationContext context) {
    ScanAggregator aggregator = ScanAggregators.fromConfig(sourceConfig, context);
    List<BatchSummary> batches = new ArrayList<>();
    while (aggregator.isAvailable()) {
      Iterator<DataPackage> feed = aggregator.feed();
      while (feed.hasNext()) {
        DataPackage batch = feed.next();
        batches.add(new BatchSummary(batch.label(), batch.size()));
        logger.debug("worker {} received {} frames of scan {}", context.rank(), batch.size(),
            batch.label());
      }
    }
    return batches;
  }

  private static List<BatchSummary> merge(List<List<BatchSummary>> perWorker) {
    List<BatchSummary> merged = new ArrayList<>(perWorker.get(0));
    for (List<BatchSummary> worker : perWorker.subList(1, perWorker.size())) {
      for (int i = 0; i < merged.size(); i++) {
        BatchSummary mine = merged.get(i);
        merged.set(i, new BatchSummary(mine.label(), mine.frames() + worker.get(i).frames()));
      }
    }
    return merged;
  }

  private record BatchSummary(String label, long frames) {
  }
}
