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


/// The context of a worker which runs alone. Barriers return at once; there is nobody to
/// exchange messages with.
public final class SingleProcessContext implements CoordinationContext {

  /// the shared single-process context
  public static final SingleProcessContext INSTANCE = new SingleProcessContext();

  private SingleProcessContext() {
  }

  @Override
  public int rank() {
    return COORDINATOR;
  }

  @Override
  public int size() {
    return 1;
  }

  @Override
  public void send(Object value) {
    throw new IllegalStateException("a single process has no coordinator to send to");
  }

  @Override
  public <T> T receive() {
    throw new IllegalStateException("a single process has no peers to receive from");
  }

  @Override
  public void barrier() {
    // alone at the barrier
  }

  @Override
  public String toString() {
    return "SingleProcessContext";
  }
}
