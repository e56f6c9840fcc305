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


import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.nosqlbench.scandata.errors.ScanDataException;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.FileScanSource;
import io.nosqlbench.scandata.scan.FrameSlot;
import io.nosqlbench.scandata.scan.LoadOptions;
import io.nosqlbench.scandata.scan.PartitionMode;
import io.nosqlbench.scandata.scan.ScanContainer;
import io.nosqlbench.scandata.store.Interval;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/// Show the metadata and datasets of a scan file
@CommandLine.Command(name = "show",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "show the metadata and datasets of a scan file",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "2: the file is not a readable scan file"
    })
public class CMD_show implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_show.class);

  @CommandLine.Parameters(description = "The scan file to show")
  private Path file;

  @CommandLine.Option(names = {"--frames"},
      description = "Print the mean value of each frame in this interval, like 0..4")
  private String frames;

  @Override
  public Integer call() {
    StringBuilder sb = new StringBuilder();
    try {
      ScanContainer scan =
          new ScanContainer(new FileScanSource(file), null, SingleProcessContext.INSTANCE);
      sb.append("scan ").append(scan.getLabel()).append(" (")
          .append(scan.getMetadata().frameCount()).append(" frames)\n");
      sb.append("scan_info: ").append(scan.getMetadata().toJson()).append("\n");
      if (frames != null) {
        describeFrames(scan, Interval.parse(frames), sb);
      }
    } catch (ScanDataException | IllegalArgumentException e) {
      System.err.println(e.getMessage());
      return 2;
    }

    try (HdfFile hdf = new HdfFile(file)) {
      sb.append("datasets:\n");
      for (Node node : hdf.getChildren().values()) {
        if (node instanceof Dataset dataset) {
          sb.append(" ").append(dataset.getName())
              .append(" ").append(Arrays.toString(dataset.getDimensions()))
              .append(" ").append(dataset.getJavaType().getSimpleName()).append("\n");
        }
      }
      sb.append("attributes:\n");
      for (Attribute attribute : hdf.getAttributes().values()) {
        sb.append(" ").append(attribute.getName()).append(" (")
            .append(attribute.getJavaType().getSimpleName()).append(")\n");
      }
    }
    logger.debug("showed {}", file);
    System.out.print(sb);
    return 0;
  }

  private void describeFrames(ScanContainer scan, Interval interval, StringBuilder sb) {
    scan.load(LoadOptions.DEFAULT.withRange(interval.minIncl(), interval.maxExcl())
        .withPartition(PartitionMode.ALL_FRAMES));
    List<FrameSlot> data = scan.getView("data");
    for (int i = interval.minIncl(); i < interval.maxExcl(); i++) {
      double sum = 0;
      int count = 0;
      for (float[] row : data.get(i).plane()) {
        for (float value : row) {
          sum += value;
          count++;
        }
      }
      sb.append(String.format("frame %d: mean %.4f%n", i, count == 0 ? 0.0 : sum / count));
    }
    scan.unload();
  }
}
