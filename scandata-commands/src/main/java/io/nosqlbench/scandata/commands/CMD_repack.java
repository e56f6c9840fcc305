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
import io.nosqlbench.scandata.parallel.CoordinationContext;
import io.nosqlbench.scandata.parallel.LocalCoordinationGroup;
import io.nosqlbench.scandata.parallel.SingleProcessContext;
import io.nosqlbench.scandata.scan.FileScanSource;
import io.nosqlbench.scandata.scan.LoadOptions;
import io.nosqlbench.scandata.scan.OverwritePolicy;
import io.nosqlbench.scandata.scan.ScanContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/// Load a scan file split between workers and save it again through the coordinator
@CommandLine.Command(name = "repack",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    description = "load a scan across workers and save it as a new scan file",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: no errors",
        "2: the scan could not be repacked"
    })
public class CMD_repack implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(CMD_repack.class);

  @CommandLine.Parameters(description = "The scan file to read")
  private Path input;

  @CommandLine.Option(names = {"-o", "--output"}, required = true,
      description = "The scan file to write")
  private Path output;

  @CommandLine.Option(names = {"--workers"}, defaultValue = "1",
      description = "The number of workers to split frames between (default: ${DEFAULT-VALUE})")
  private int workers;

  @CommandLine.Option(names = {"--force"}, description = "Overwrite an existing file")
  private boolean force;

  @Override
  public Integer call() {
    try {
      Optional<Path> written;
      if (workers <= 1) {
        written = repack(SingleProcessContext.INSTANCE);
      } else {
        List<Optional<Path>> results = new LocalCoordinationGroup(workers).run(this::repack);
        written = results.get(CoordinationContext.COORDINATOR);
      }
      System.out.println("repacked " + input + " to " + written.orElseThrow());
      return 0;
    } catch (ScanDataException e) {
      System.err.println(e.getMessage());
      return 2;
    }
  }

  private Optional<Path> repack(CoordinationContext context) {
    ScanContainer scan = new ScanContainer(new FileScanSource(input), null, context);
    scan.load(LoadOptions.DEFAULT);
    logger.debug("worker {} holds frames {}", context.rank(), scan.getIndices());
    return scan.save(output, force ? OverwritePolicy.FORCE : OverwritePolicy.REFUSE, null);
  }
}
