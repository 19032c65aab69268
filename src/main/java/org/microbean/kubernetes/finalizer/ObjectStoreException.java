/* -*- mode: Java; c-basic-offset: 2; indent-tabs-mode: nil; coding: utf-8-unix -*-
 *
 * Copyright © 2017-2018 microBean.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or
 * implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.microbean.kubernetes.finalizer;

import java.io.Serializable; // for javadoc only

/**
 * An {@link Exception} indicating that an {@link ObjectStoreClient}
 * operation failed.
 *
 * <p>Every {@link ObjectStoreException} carries a machine-readable
 * {@linkplain #getCode() code}, a short {@linkplain #getReason()
 * reason} and a human-readable {@linkplain #getMessage() message},
 * mirroring the {@code Status} object returned by a Kubernetes API
 * server.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ObjectStoreClient
 */
public class ObjectStoreException extends Exception {


  /*
   * Static fields.
   */


  /**
   * The version of this class for {@linkplain Serializable
   * serialization purposes}.
   *
   * @see Serializable
   */
  private static final long serialVersionUID = 1L;

  /**
   * The code used when an object does not exist.
   */
  public static final int NOT_FOUND = 404;

  /**
   * The code used when a conditional write was rejected because the
   * stored object has changed since it was read.
   */
  public static final int CONFLICT = 409;


  /*
   * Instance fields.
   */


  /**
   * The machine-readable code of the failure, usually an HTTP status
   * code; {@code 0} if none was available.
   */
  private final int code;

  /**
   * The short reason of the failure, e.g. {@code Conflict}.
   *
   * <p>This field may be {@code null}.</p>
   */
  private final String reason;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ObjectStoreException}.
   *
   * @param code the machine-readable code of the failure
   *
   * @param reason the short reason; may be {@code null}
   *
   * @param message the human-readable message; may be {@code null}
   */
  public ObjectStoreException(final int code, final String reason, final String message) {
    this(code, reason, message, null);
  }

  /**
   * Creates a new {@link ObjectStoreException}.
   *
   * @param code the machine-readable code of the failure
   *
   * @param reason the short reason; may be {@code null}
   *
   * @param message the human-readable message; may be {@code null}
   *
   * @param cause the underlying cause; may be {@code null}
   */
  public ObjectStoreException(final int code, final String reason, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
    this.reason = reason;
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the machine-readable code of the failure.
   *
   * @return the code, or {@code 0} if none was available
   */
  public final int getCode() {
    return this.code;
  }

  /**
   * Returns the short reason of the failure.
   *
   * <p>This method may return {@code null}.</p>
   *
   * @return the reason, or {@code null}
   */
  public final String getReason() {
    return this.reason;
  }

  /**
   * Returns {@code true} if this {@link ObjectStoreException}
   * represents a missing object.
   *
   * @return {@code true} if the {@linkplain #getCode() code} is
   * {@link #NOT_FOUND}
   */
  public final boolean isNotFound() {
    return this.code == NOT_FOUND;
  }

  /**
   * Returns {@code true} if this {@link ObjectStoreException}
   * represents a rejected conditional write.
   *
   * @return {@code true} if the {@linkplain #getCode() code} is
   * {@link #CONFLICT}
   */
  public final boolean isConflict() {
    return this.code == CONFLICT;
  }

  /**
   * Returns a {@link String} of the form {@code code=<code>,
   * reason=<reason>, <message>}.
   *
   * @return a non-{@code null} description of this failure
   */
  public final String describe() {
    return new StringBuilder("code=").append(this.code)
      .append(", reason=").append(this.reason)
      .append(", ").append(this.getMessage())
      .toString();
  }

}
