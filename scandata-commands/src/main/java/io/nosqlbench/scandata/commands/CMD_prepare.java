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
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.EmptyScanSource;
import io.nosqlbench.scandata.scan.LoadOptions;
import io.nosqlbench.scandata.scan.OverwritePolicy;
import io.nosqlbench.scandata.scan.PartitionMode;
import io.nosqlbench.scandata.scan.ScanContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Write an empty scan file, with zero frames and unit masks, in a given shape
@CommandLine.Command(name = "prepare",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "write an empty scan file with the given metadata",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "2: the scan could not be written"
    })
public class CMD_prepare implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_prepare.class);

  @CommandLine.Option(names = {"-o", "--output"}, required = true,
      description = "The scan file to write (.h5 or .ptyd)")
  private Path output;

  @CommandLine.Option(names = {"--shape"}, split = ",", defaultValue = "10,96,96",
      description = "The scan shape as frames,rows,columns (default: ${DEFAULT-VALUE})")
  private List<Integer> shape;

  @CommandLine.Option(names = {"--label"}, description = "The scan label")
  private String label;

  @CommandLine.Option(names = {"--wavelength"}, description = "The wavelength in meters")
  private Double wavelength;

  @CommandLine.Option(names = {"--force"}, description = "Overwrite an existing file")
  private boolean force;

  @Override
  public Integer call() {
    Map<String, Object> overrides = new LinkedHashMap<>();
    overrides.put("shape", shape);
    overrides.put("data_filename", output.toString());
    if (label != null) {
      overrides.put("scan_label", label);
    }
    if (wavelength != null) {
      overrides.put("wavelength", wavelength);
    }
    try {
      ScanContainer scan =
          new ScanContainer(EmptyScanSource.INSTANCE, overrides, SingleProcessContext.INSTANCE);
      scan.load(LoadOptions.DEFAULT.withPartition(PartitionMode.ALL_FRAMES));
      Path written =
          scan.save(output, force ? OverwritePolicy.FORCE : OverwritePolicy.REFUSE, null)
              .orElseThrow();
      System.out.println("wrote scan " + scan.getLabel() + " " + Arrays.toString(
          scan.getMetadata().shape()) + " to " + written);
      logger.info("prepared {}", written);
      return 0;
    } catch (ScanDataException e) {
      System.err.println(e.getMessage());
      return 2;
    }
  }
}
