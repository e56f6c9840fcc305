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


import java.nio.file.Path;

/// Persists a [ScanRecord]. A write is atomic with respect to the whole record: readers of the
/// destination see either the previous content or the complete new record.
public interface ScanRecordWriter {

  /// write a record
  /// @param destination the file to write
  /// @param record the arrays and attributes to write
  /// @param mode how to treat unsupported fields
  void write(Path destination, ScanRecord record, WriteMode mode);
}
