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


/// Base type of all failures raised by scan loading, gathering and aggregation.
///
/// Errors are fatal to the calling worker. A failure on one worker is not reported to its
/// peers; peers waiting at the next barrier will block.
public class ScanDataException extends RuntimeException {

  /// @param message the error message
  public ScanDataException(String message) {
    super(message);
  }

  /// @param message the error message
  /// @param cause the underlying failure
  public ScanDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
