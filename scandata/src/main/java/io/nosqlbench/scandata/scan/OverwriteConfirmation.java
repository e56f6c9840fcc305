package io.nosqlbench.scandata.scan;

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

import java.nio.file.Path;

/// Asks whether an existing file may be replaced.
@FunctionalInterface
public interface OverwriteConfirmation {

  /// never replace anything
  OverwriteConfirmation DECLINE = path -> false;

  /// @param existing the file that would be replaced
  /// @return true to overwrite
  boolean confirm(Path existing);
}
