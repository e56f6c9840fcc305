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


/// Workers or arrays disagree about the shape of a scan, or a scan is saved before it is loaded.
public class ConsistencyException extends ScanDataException {

  /// @param message the error message
  public ConsistencyException(String message) {
    super(message);
  }

  /// @param message the error message
  /// @param cause the underlying failure
  public ConsistencyException(String message, Throwable cause) {
    super(message, cause);
  }
}
