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

import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.topology.AmqpException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static <T> T wrapGet(Future<T> future) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      throw convert(e.getCause() == null ? e : e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  /** Strip the wrappers asynchronous stages put around failures. */
  static Throwable unwrap(Throwable t) {
    Throwable result = t;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  static AmqpException convert(Throwable t) {
    Throwable e = unwrap(t);
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else {
      return convertChannelOperation(e, null);
    }
  }

  /** Conversion of a failure of a connection attempt. */
  static AmqpException convertConnect(Throwable t, String format, Object... args) {
    Throwable e = unwrap(t);
    String message = format == null ? e.getMessage() : String.format(format, args);
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof AuthenticationFailureException
        || e instanceof SSLException
        || e.getCause() instanceof SSLException) {
      return new AmqpException.AmqpSecurityException(message, e);
    } else {
      return new AmqpException.AmqpConnectionException(message, e);
    }
  }

  /**
   * Conversion of a failure of an operation on a channel (assert, bind, consume, delete).
   *
   * <p>A connection-level shutdown gives an {@link AmqpException.AmqpConnectionException}, anything
   * else is a refusal of the operation by the broker.
   */
  static AmqpException convertChannelOperation(Throwable t, String format, Object... args) {
    Throwable e = unwrap(t);
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    String message = format == null ? e.getMessage() : String.format(format, args);
    ShutdownSignalException shutdownSignal = shutdownSignal(e);
    if (shutdownSignal != null && shutdownSignal.isHardError()) {
      return new AmqpException.AmqpConnectionException(message, e);
    } else if (e instanceof TimeoutException) {
      return new AmqpException.AmqpConnectionException(message, e);
    } else {
      return new AmqpException.AmqpChannelException(message, e);
    }
  }

  static boolean isConnectionFailure(Throwable t) {
    return unwrap(t) instanceof AmqpException.AmqpConnectionException;
  }

  private static ShutdownSignalException shutdownSignal(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof ShutdownSignalException) {
        return (ShutdownSignalException) current;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }
}
