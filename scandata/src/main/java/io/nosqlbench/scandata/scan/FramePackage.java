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


/// One frame as handed to a reconstruction model.
///
/// @param data the frame values
/// @param mask the frame mask, or null if the scan has none
/// @param index the frame index within its scan
/// @param position the measured sample position, or null if unknown
public record FramePackage(float[][] data, float[][] mask, int index, double[] position) {
}
