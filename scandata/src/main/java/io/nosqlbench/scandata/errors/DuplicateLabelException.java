package io.nosqlbench.scandata.errors;

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


/// Two scans of one aggregator resolved to the same label.
public class DuplicateLabelException extends ScanDataException {

  private final String label;

  /// @param label the label which is not unique
  public DuplicateLabelException(String label) {
    super("Scan label '" + label + "' is not unique. Are you loading the same data twice? "
          + "Please assign a different label.");
    this.label = label;
  }

  /// @return the label which is not unique
  public String getLabel() {
    return label;
  }
}
