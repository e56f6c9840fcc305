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


import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/// Tools for preparing, inspecting and feeding diffraction scan files
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "scandata",
    mixinStandardHelpOptions = true,
    description = "prepare, inspect, repack and feed diffraction scan files",
    subcommands = {
        CMD_show.class, CMD_prepare.class, CMD_feed.class, CMD_repack.class,
        CommandLine.HelpCommand.class
    })
public class CMD_scandata {

  @CommandLine.Option(names = {"-v", "--verbose"},
      description = "log loader and gather details")
  private void setVerbose(boolean verbose) {
    if (verbose) {
      Configurator.setRootLevel(Level.DEBUG);
    }
  }

  /// run a scandata command
  /// @param args command line args
  public static void main(String[] args) {
    System.setProperty("slf4j.internal.verbosity", "ERROR");
    CMD_scandata command = new CMD_scandata();
    CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
    int exitCode = commandLine.execute(args);
    System.exit(exitCode);
  }
}
