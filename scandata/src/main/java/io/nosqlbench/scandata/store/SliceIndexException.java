package io.nosqlbench.scandata.store;

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


/// Raised by a [KeyedArrayStore] when a slice does not match the stored array, either because
/// its rank differs from the stored rank or because a selection exceeds a stored extent.
public class SliceIndexException extends RuntimeException {

  /// create a slice index condition
  /// @param message the error message
  public SliceIndexException(String message) {
    super(message);
  }
}
