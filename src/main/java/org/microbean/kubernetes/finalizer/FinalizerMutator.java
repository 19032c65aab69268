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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.jcip.annotations.ThreadSafe;

import org.microbean.kubernetes.finalizer.FinalizerMutationException.Phase;

/**
 * Adds and removes <em>finalizers</em> on custom objects of a single
 * kind in a single namespace.
 *
 * <p>Each {@linkplain #addFinalizer(String, String) addition} or
 * {@linkplain #removeFinalizer(String, String) removal} reads the
 * current state of the object from an {@link ObjectStoreClient},
 * computes the new finalizer list, and writes the whole object back
 * conditioned on the resource version that was read.  If another
 * writer changed the object in between, the write is rejected and a
 * {@link FinalizerMutationException} is thrown.  No operation is ever
 * retried; callers are expected to invoke the operation again on
 * their next reconciliation pass.</p>
 *
 * <p>A finalizer is never added to an object that has been marked for
 * deletion, but may always be removed from one, so that a controller
 * can release its hold on an object that is going away.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class hold no mutable state and are safe for
 * concurrent use by multiple {@link Thread}s.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ObjectStoreClient
 *
 * @see Outcome
 */
@ThreadSafe
public class FinalizerMutator {


  /*
   * Instance fields.
   */


  private final String group;

  private final String version;

  private final String namespace;

  private final String plural;

  /**
   * The {@link ObjectStoreClient} objects are read from and written
   * to.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final ObjectStoreClient objectStoreClient;

  /**
   * A {@link Logger} for use by this {@link FinalizerMutator}.
   *
   * <p>This field is never {@code null}.</p>
   *
   * @see #createLogger()
   */
  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link FinalizerMutator} that logs to the {@link
   * Logger} returned by {@link #createLogger()}.
   *
   * @param namespace the namespace of the objects to be mutated; must
   * not be {@code null} or empty
   *
   * @param group the API group of the custom resource; must not be
   * {@code null}
   *
   * @param version the API version of the custom resource; must not
   * be {@code null} or empty
   *
   * @param plural the plural name of the custom resource; must not be
   * {@code null} or empty
   *
   * @param objectStoreClient the {@link ObjectStoreClient} to read
   * from and write to; must not be {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalArgumentException if {@code namespace}, {@code
   * version} or {@code plural} is empty
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   *
   * @see #FinalizerMutator(String, String, String, String,
   * ObjectStoreClient, Logger)
   */
  public FinalizerMutator(final String namespace,
                          final String group,
                          final String version,
                          final String plural,
                          final ObjectStoreClient objectStoreClient) {
    this(namespace, group, version, plural, objectStoreClient, null);
  }

  /**
   * Creates a new {@link FinalizerMutator}.
   *
   * @param namespace the namespace of the objects to be mutated; must
   * not be {@code null} or empty
   *
   * @param group the API group of the custom resource; must not be
   * {@code null}
   *
   * @param version the API version of the custom resource; must not
   * be {@code null} or empty
   *
   * @param plural the plural name of the custom resource; must not be
   * {@code null} or empty
   *
   * @param objectStoreClient the {@link ObjectStoreClient} to read
   * from and write to; must not be {@code null}
   *
   * @param logger the {@link Logger} to log to; may be {@code null} in
   * which case the return value of {@link #createLogger()} will be
   * used instead
   *
   * @exception NullPointerException if any parameter other than
   * {@code logger} is {@code null}
   *
   * @exception IllegalArgumentException if {@code namespace}, {@code
   * version} or {@code plural} is empty
   *
   * @exception IllegalStateException if {@code logger} is {@code
   * null} and the {@link #createLogger()} method returns {@code null}
   */
  public FinalizerMutator(final String namespace,
                          final String group,
                          final String version,
                          final String plural,
                          final ObjectStoreClient objectStoreClient,
                          final Logger logger) {
    super();
    if (logger == null) {
      this.logger = this.createLogger();
      if (this.logger == null) {
        throw new IllegalStateException("createLogger() == null");
      }
    } else {
      this.logger = logger;
    }
    final String cn = this.getClass().getName();
    final String mn = "<init>";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { namespace, group, version, plural, objectStoreClient });
    }

    this.objectStoreClient = Objects.requireNonNull(objectStoreClient, "objectStoreClient");
    // Validates the coordinates once so that per-call failures can
    // only concern the name.
    final ResourceReference prototype = new ResourceReference(group, version, namespace, plural, "prototype");
    this.group = prototype.getGroup();
    this.version = prototype.getVersion();
    this.namespace = prototype.getNamespace();
    this.plural = prototype.getPlural();

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }


  /*
   * Instance methods.
   */


  /**
   * Returns a {@link Logger} that will be used for this {@link
   * FinalizerMutator} when none is supplied at construction time.
   *
   * <p>This method never returns {@code null}.</p>
   *
   * <p>Overrides of this method must not return {@code null}.</p>
   *
   * @return a non-{@code null} {@link Logger}
   */
  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  /**
   * Returns the namespace of the objects this {@link
   * FinalizerMutator} mutates.
   *
   * @return the non-{@code null} namespace
   */
  public final String getNamespace() {
    return this.namespace;
  }

  /**
   * Returns a {@link ResourceReference} identifying the object with
   * the supplied name.
   *
   * @param name the name of the object; must not be {@code null} or
   * empty
   *
   * @return a non-{@code null} {@link ResourceReference}
   *
   * @exception NullPointerException if {@code name} is {@code null}
   *
   * @exception IllegalArgumentException if {@code name} is empty
   */
  public final ResourceReference getReference(final String name) {
    return new ResourceReference(this.group, this.version, this.namespace, this.plural, name);
  }

  /**
   * Adds the supplied finalizer to the end of the finalizer list of
   * the named object, unless the object is being deleted or already
   * carries it.
   *
   * @param name the name of the object; must not be {@code null} or
   * empty
   *
   * @param finalizer the finalizer to add; must not be {@code null}
   * or empty
   *
   * @return {@link Outcome#ADDED} if the object was written, {@link
   * Outcome#TERMINATING} if the object is being deleted, or {@link
   * Outcome#ALREADY_PRESENT} if the finalizer was already present;
   * never {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception IllegalArgumentException if either parameter is empty
   *
   * @exception FinalizerMutationException if the object could not be
   * read or written; the object is unchanged
   */
  public Outcome addFinalizer(final String name, final String finalizer) throws FinalizerMutationException {
    final String cn = this.getClass().getName();
    final String mn = "addFinalizer";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { name, finalizer });
    }
    validateFinalizer(finalizer);
    final ResourceReference reference = this.getReference(name);
    final String description = "add finalizer:" + finalizer + " to " + this.plural + ":" + name;

    final ObjectSnapshot snapshot = this.fetch(reference, finalizer, description, mn);
    assert snapshot != null;

    final Outcome returnValue;
    if (snapshot.isTerminating()) {
      if (this.logger.isLoggable(Level.WARNING)) {
        this.logger.logp(Level.WARNING, cn, mn, "addFinalizer({0},{1}), deletionTimestamp is set", new Object[] { name, finalizer });
      }
      returnValue = Outcome.TERMINATING;
    } else if (snapshot.containsFinalizer(finalizer)) {
      if (this.logger.isLoggable(Level.WARNING)) {
        this.logger.logp(Level.WARNING, cn, mn, "addFinalizer({0},{1}), finalizer already present", new Object[] { name, finalizer });
      }
      returnValue = Outcome.ALREADY_PRESENT;
    } else {
      final List<String> finalizers = new ArrayList<>(snapshot.getFinalizers());
      finalizers.add(finalizer);
      this.replace(reference, snapshot.withFinalizers(finalizers), finalizer, description, mn);
      if (this.logger.isLoggable(Level.INFO)) {
        this.logger.logp(Level.INFO, cn, mn, "added finalizer:{0} to {1}:{2}", new Object[] { finalizer, this.plural, name });
      }
      returnValue = Outcome.ADDED;
    }

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  /**
   * Removes the supplied finalizer from the finalizer list of the
   * named object, preserving the order of the remaining finalizers.
   *
   * <p>Removal proceeds even if the object is being deleted.</p>
   *
   * @param name the name of the object; must not be {@code null} or
   * empty
   *
   * @param finalizer the finalizer to remove; must not be {@code
   * null} or empty
   *
   * @return {@link Outcome#REMOVED} if the object was written, {@link
   * Outcome#NO_FINALIZERS} if the object has no finalizers at all, or
   * {@link Outcome#NOT_PRESENT} if the finalizer was not present;
   * never {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception IllegalArgumentException if either parameter is empty
   *
   * @exception FinalizerMutationException if the object could not be
   * read or written; the object is unchanged
   */
  public Outcome removeFinalizer(final String name, final String finalizer) throws FinalizerMutationException {
    final String cn = this.getClass().getName();
    final String mn = "removeFinalizer";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { name, finalizer });
    }
    validateFinalizer(finalizer);
    final ResourceReference reference = this.getReference(name);
    final String description = "remove finalizer:" + finalizer + " from " + this.plural + ":" + name;

    final ObjectSnapshot snapshot = this.fetch(reference, finalizer, description, mn);
    assert snapshot != null;

    final List<String> finalizers = new ArrayList<>(snapshot.getFinalizers());
    final Outcome returnValue;
    if (finalizers.isEmpty()) {
      if (this.logger.isLoggable(Level.WARNING)) {
        this.logger.logp(Level.WARNING, cn, mn, "removeFinalizer({0},{1}), no finalizers on {2}", new Object[] { name, finalizer, this.plural });
      }
      returnValue = Outcome.NO_FINALIZERS;
    } else if (!finalizers.remove(finalizer)) {
      if (this.logger.isLoggable(Level.WARNING)) {
        this.logger.logp(Level.WARNING, cn, mn, "removeFinalizer({0},{1}), finalizer not found", new Object[] { name, finalizer });
      }
      returnValue = Outcome.NOT_PRESENT;
    } else {
      this.replace(reference, snapshot.withFinalizers(finalizers), finalizer, description, mn);
      if (this.logger.isLoggable(Level.INFO)) {
        this.logger.logp(Level.INFO, cn, mn, "removed finalizer:{0} from {1}:{2}", new Object[] { finalizer, this.plural, name });
      }
      returnValue = Outcome.REMOVED;
    }

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  /**
   * Invokes {@link #addFinalizer(String, String)} using the supplied
   * {@link Executor} and returns a {@link CompletableFuture}
   * representing its result.
   *
   * <p>The returned {@link CompletableFuture} completes exceptionally
   * with a {@link FinalizerMutationException} or {@link
   * RuntimeException} if the addition fails.</p>
   *
   * @param name the name of the object; must not be {@code null} or
   * empty
   *
   * @param finalizer the finalizer to add; must not be {@code null}
   * or empty
   *
   * @param executor the {@link Executor} that will run the addition;
   * must not be {@code null}
   *
   * @return a non-{@code null} {@link CompletableFuture}
   *
   * @exception NullPointerException if {@code executor} is {@code
   * null}
   *
   * @see #addFinalizer(String, String)
   */
  public final CompletableFuture<Outcome> addFinalizerAsync(final String name, final String finalizer, final Executor executor) {
    return submit(() -> this.addFinalizer(name, finalizer), executor);
  }

  /**
   * Invokes {@link #removeFinalizer(String, String)} using the
   * supplied {@link Executor} and returns a {@link CompletableFuture}
   * representing its result.
   *
   * <p>The returned {@link CompletableFuture} completes exceptionally
   * with a {@link FinalizerMutationException} or {@link
   * RuntimeException} if the removal fails.</p>
   *
   * @param name the name of the object; must not be {@code null} or
   * empty
   *
   * @param finalizer the finalizer to remove; must not be {@code
   * null} or empty
   *
   * @param executor the {@link Executor} that will run the removal;
   * must not be {@code null}
   *
   * @return a non-{@code null} {@link CompletableFuture}
   *
   * @exception NullPointerException if {@code executor} is {@code
   * null}
   *
   * @see #removeFinalizer(String, String)
   */
  public final CompletableFuture<Outcome> removeFinalizerAsync(final String name, final String finalizer, final Executor executor) {
    return submit(() -> this.removeFinalizer(name, finalizer), executor);
  }

  private final ObjectSnapshot fetch(final ResourceReference reference,
                                     final String finalizer,
                                     final String description,
                                     final String mn)
    throws FinalizerMutationException {
    final ObjectSnapshot returnValue;
    try {
      returnValue = this.objectStoreClient.get(reference);
    } catch (final ObjectStoreException objectStoreException) {
      throw this.failure(description + ", get failed", Phase.FETCH, reference, finalizer, objectStoreException, mn);
    }
    if (returnValue == null) {
      throw new IllegalStateException("objectStoreClient.get(" + reference + ") == null");
    }
    return returnValue;
  }

  private final ObjectSnapshot replace(final ResourceReference reference,
                                       final ObjectSnapshot snapshot,
                                       final String finalizer,
                                       final String description,
                                       final String mn)
    throws FinalizerMutationException {
    try {
      return this.objectStoreClient.replace(reference, snapshot);
    } catch (final ObjectStoreException objectStoreException) {
      throw this.failure(description + ", update failed", Phase.REPLACE, reference, finalizer, objectStoreException, mn);
    }
  }

  private final FinalizerMutationException failure(final String message,
                                                   final Phase phase,
                                                   final ResourceReference reference,
                                                   final String finalizer,
                                                   final ObjectStoreException cause,
                                                   final String mn) {
    final String fullMessage = message + ": " + cause.describe();
    if (this.logger.isLoggable(Level.SEVERE)) {
      this.logger.logp(Level.SEVERE, this.getClass().getName(), mn, fullMessage);
    }
    return new FinalizerMutationException(fullMessage, phase, reference, finalizer, cause);
  }


  /*
   * Static methods.
   */


  private static final void validateFinalizer(final String finalizer) {
    Objects.requireNonNull(finalizer, "finalizer");
    if (finalizer.isEmpty()) {
      throw new IllegalArgumentException("finalizer.isEmpty()");
    }
  }

  private static final CompletableFuture<Outcome> submit(final Mutation mutation, final Executor executor) {
    Objects.requireNonNull(executor, "executor");
    final CompletableFuture<Outcome> returnValue = new CompletableFuture<>();
    executor.execute(() -> {
        try {
          returnValue.complete(mutation.run());
        } catch (final FinalizerMutationException | RuntimeException exception) {
          returnValue.completeExceptionally(exception);
        }
      });
    return returnValue;
  }


  /*
   * Inner and nested classes.
   */


  @FunctionalInterface
  private static interface Mutation {

    Outcome run() throws FinalizerMutationException;

  }

  /**
   * The result of a successful {@link FinalizerMutator} operation.
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   *
   * @see #isMutated()
   */
  public static enum Outcome {

    /**
     * An {@link Outcome} indicating that the finalizer was added and
     * the object was written.
     */
    ADDED(true),

    /**
     * An {@link Outcome} indicating that the finalizer was not added
     * because the object is being deleted.
     */
    TERMINATING(false),

    /**
     * An {@link Outcome} indicating that the finalizer was not added
     * because it was already present.
     */
    ALREADY_PRESENT(false),

    /**
     * An {@link Outcome} indicating that the finalizer was removed and
     * the object was written.
     */
    REMOVED(true),

    /**
     * An {@link Outcome} indicating that nothing was removed because
     * the object has no finalizers.
     */
    NO_FINALIZERS(false),

    /**
     * An {@link Outcome} indicating that nothing was removed because
     * the finalizer was not present.
     */
    NOT_PRESENT(false);

    private final boolean mutated;

    private Outcome(final boolean mutated) {
      this.mutated = mutated;
    }

    /**
     * Returns {@code true} if this {@link Outcome} represents a write
     * to the object store.
     *
     * @return {@code true} if the object was written
     */
    public final boolean isMutated() {
      return this.mutated;
    }

  }

}
