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
package com.rabbitmq.topology;

/**
 * Root of the exceptions raised by the library.
 *
 * <p>Asynchronous operations complete their {@link java.util.concurrent.CompletableFuture}
 * exceptionally with one of these exceptions.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The broker refused the credentials or the TLS handshake failed. */
  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpSecurityException(Throwable cause) {
      super(cause);
    }
  }

  /**
   * Transport-level failure: the connection could not be opened (retries exhausted) or went away.
   */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String format, Object... args) {
      super(format, args);
    }

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker rejected an operation (assert, bind, consume, delete) on a channel. */
  public static class AmqpChannelException extends AmqpException {

    public AmqpChannelException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A publish failed, then failed again after the connection got rebuilt. */
  public static class AmqpPublishException extends AmqpException {

    public AmqpPublishException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A consumer is already registered on the queue or exchange. */
  public static class AmqpConsumerConflictException extends AmqpException {

    public AmqpConsumerConflictException(String format, Object... args) {
      super(format, args);
    }
  }

  /** No consumer is registered on the queue or exchange. */
  public static class AmqpConsumerAbsentException extends AmqpException {

    public AmqpConsumerAbsentException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class AmqpEntityNotFoundException extends AmqpException {

    public AmqpEntityNotFoundException(String format, Object... args) {
      super(format, args);
    }

    public AmqpEntityNotFoundException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpResourceClosedException extends AmqpResourceInvalidStateException {

    public AmqpResourceClosedException(String message) {
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
