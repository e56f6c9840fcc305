package io.nosqlbench.scandata.parallel;

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


/// Identifies one frame for partitioning purposes. Never persisted.
/// @param scanLabel the label of the scan the frame belongs to
/// @param frameIndex the index of the frame within its scan
public record FrameIdentity(String scanLabel, int frameIndex) {
}
