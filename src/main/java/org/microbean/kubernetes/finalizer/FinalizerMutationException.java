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

import java.util.Objects;

/**
 * An {@link Exception} indicating that a {@link FinalizerMutator}
 * could not add or remove a finalizer because the underlying {@link
 * ObjectStoreClient} failed.
 *
 * <p>The object is left as it was before the call.  Callers are
 * expected to try again on a later reconciliation pass; a {@link
 * FinalizerMutator} never retries on its own.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see FinalizerMutator
 */
public class FinalizerMutationException extends Exception {


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


  /*
   * Instance fields.
   */


  private final Phase phase;

  private final ResourceReference reference;

  private final String finalizer;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link FinalizerMutationException}.
   *
   * @param message the detail message; may be {@code null}
   *
   * @param phase the {@link Phase} that failed; must not be {@code
   * null}
   *
   * @param reference the object concerned; must not be {@code null}
   *
   * @param finalizer the finalizer that was being added or removed;
   * must not be {@code null}
   *
   * @param cause the {@link ObjectStoreException} that caused the
   * failure; must not be {@code null}
   *
   * @exception NullPointerException if any parameter other than
   * {@code message} is {@code null}
   */
  public FinalizerMutationException(final String message,
                                    final Phase phase,
                                    final ResourceReference reference,
                                    final String finalizer,
                                    final ObjectStoreException cause) {
    super(message, Objects.requireNonNull(cause, "cause"));
    this.phase = Objects.requireNonNull(phase, "phase");
    this.reference = Objects.requireNonNull(reference, "reference");
    this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the {@link Phase} that failed.
   *
   * @return a non-{@code null} {@link Phase}
   */
  public final Phase getPhase() {
    return this.phase;
  }

  /**
   * Returns the {@link ResourceReference} of the object concerned.
   *
   * @return a non-{@code null} {@link ResourceReference}
   */
  public final ResourceReference getReference() {
    return this.reference;
  }

  /**
   * Returns the finalizer that was being added or removed.
   *
   * @return a non-{@code null} finalizer
   */
  public final String getFinalizer() {
    return this.finalizer;
  }

  /**
   * Returns the {@link ObjectStoreException} that caused this {@link
   * FinalizerMutationException}.
   *
   * @return a non-{@code null} {@link ObjectStoreException}
   */
  @Override
  public synchronized ObjectStoreException getCause() {
    return (ObjectStoreException)super.getCause();
  }


  /*
   * Inner and nested classes.
   */


  /**
   * The step of a finalizer mutation during which a failure
   * occurred.
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static enum Phase {

    /**
     * A {@link Phase} representing the retrieval of the object.
     */
    FETCH,

    /**
     * A {@link Phase} representing the conditional replacement of the
     * object.
     */
    REPLACE

  }

}
