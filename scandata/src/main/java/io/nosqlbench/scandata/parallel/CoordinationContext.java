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


/// The explicit handle to the group of cooperating workers.
///
/// All workers run the same control flow in lockstep. They coordinate only through
/// point-to-point messages to the coordinator and through barriers. Blocking happens only in
/// [#receive()] and [#barrier()]; neither has a timeout.
public interface CoordinationContext {

  /// the rank of the coordinator, which reassembles and persists gathered data
  int COORDINATOR = 0;

  /// @return the rank of this worker, `0..size-1`
  int rank();

  /// @return the number of workers in the group
  int size();

  /// @return true if this worker is the coordinator
  default boolean isCoordinator() {
    return rank() == COORDINATOR;
  }

  /// @return true if more than one worker takes part
  default boolean isParallel() {
    return size() > 1;
  }

  /// Send a value to the coordinator.
  /// @param value the value to send
  void send(Object value);

  /// Receive the next value sent to this worker, blocking until one arrives.
  /// @param <T> the expected value type
  /// @return the received value
  <T> T receive();

  /// Block until every worker of the group has reached this barrier.
  void barrier();
}
