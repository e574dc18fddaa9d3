// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.topology.impl;

import static com.rabbitmq.topology.Resource.State.CLOSED;
import static com.rabbitmq.topology.Resource.State.CLOSING;
import static com.rabbitmq.topology.Resource.State.OPENING;

import com.rabbitmq.topology.AmqpException;
import com.rabbitmq.topology.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

abstract class ResourceBase implements Resource {

  private final AtomicReference<State> state = new AtomicReference<>();
  private final StateEventSupport stateEventSupport;
  private volatile Throwable closeReason;

  ResourceBase(List<StateListener> listeners) {
    this.stateEventSupport = new StateEventSupport(listeners);
    this.state.set(OPENING);
  }

  /**
   * Fail if the resource is closing or closed.
   *
   * <p>Opening and recovering resources accept operations, which wait for the resource to be
   * ready.
   */
  protected void checkOpen() {
    State state = this.state.get();
    if ((state == CLOSING || state == CLOSED) && this.closeReason instanceof AmqpException) {
      throw (AmqpException) this.closeReason;
    } else if (state == CLOSED) {
      throw new AmqpException.AmqpResourceClosedException(this + " is closed");
    } else if (state == CLOSING) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "%s is not open, current state is %s", this, state.name());
    }
  }

  @Override
  public State state() {
    return this.state.get();
  }

  protected void state(Resource.State state) {
    this.state(state, null);
  }

  protected void state(Resource.State state, Throwable failureCause) {
    Resource.State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      if ((state == CLOSING || state == CLOSED) && this.closeReason == null) {
        this.closeReason = failureCause;
      }
      this.dispatch(previousState, state, failureCause);
    }
  }

  Throwable closeReason() {
    return this.closeReason;
  }

  private void dispatch(State previous, State current, Throwable failureCause) {
    this.stateEventSupport.dispatch(this, failureCause, previous, current);
  }
}
