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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * An immutable point-in-time representation of a custom object as
 * retrieved from an {@link ObjectStoreClient}.
 *
 * <p>An {@link ObjectSnapshot} exposes the metadata this package
 * cares about&mdash;the {@linkplain #getDeletionTimestamp() deletion
 * timestamp}, the {@linkplain #getFinalizers() finalizers} and the
 * {@linkplain #getResourceVersion() resource version}&mdash;as typed
 * accessors, and carries the rest of the document as an opaque
 * {@linkplain #getBody() body} so that it can be written back
 * unchanged.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are immutable and therefore safe for
 * concurrent use by multiple {@link Thread}s.  {@link Map}s and
 * {@link List}s supplied to or returned from this class are
 * copies.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #withFinalizers(Collection)
 */
@Immutable
public final class ObjectSnapshot {


  /*
   * Static fields.
   */


  private static final String METADATA = "metadata";

  private static final String NAME = "name";

  private static final String DELETION_TIMESTAMP = "deletionTimestamp";

  private static final String FINALIZERS = "finalizers";

  private static final String RESOURCE_VERSION = "resourceVersion";


  /*
   * Instance fields.
   */


  /**
   * A private deep copy of the full document.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final Map<String, Object> body;

  /**
   * The value of {@code metadata.name}.
   *
   * <p>This field may be {@code null}.</p>
   */
  private final String name;

  /**
   * The value of {@code metadata.deletionTimestamp}.
   *
   * <p>This field may be {@code null}.</p>
   */
  private final String deletionTimestamp;

  /**
   * An unmodifiable copy of {@code metadata.finalizers}.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final List<String> finalizers;

  /**
   * The value of {@code metadata.resourceVersion}.
   *
   * <p>This field may be {@code null}.</p>
   */
  private final String resourceVersion;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ObjectSnapshot} from a full object
   * document.
   *
   * @param body the document; must not be {@code null}; will be
   * deeply copied
   *
   * @exception NullPointerException if {@code body} is {@code null}
   *
   * @exception IllegalArgumentException if {@code metadata} is
   * present but is not a {@link Map}, or if {@code
   * metadata.finalizers} is present but is not a {@link List} of
   * {@link String}s
   */
  public ObjectSnapshot(final Map<? extends String, ?> body) {
    super();
    this.body = copyMap(Objects.requireNonNull(body, "body"));
    final Map<?, ?> metadata = metadata(this.body);
    if (metadata == null) {
      this.name = null;
      this.deletionTimestamp = null;
      this.finalizers = Collections.emptyList();
      this.resourceVersion = null;
    } else {
      this.name = stringValue(metadata.get(NAME));
      this.deletionTimestamp = stringValue(metadata.get(DELETION_TIMESTAMP));
      this.finalizers = finalizers(metadata.get(FINALIZERS));
      this.resourceVersion = stringValue(metadata.get(RESOURCE_VERSION));
    }
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the value of {@code metadata.name}.
   *
   * <p>This method may return {@code null}.</p>
   *
   * @return the name of the object, or {@code null}
   */
  public final String getName() {
    return this.name;
  }

  /**
   * Returns the value of {@code metadata.deletionTimestamp}.
   *
   * <p>This method may return {@code null}.</p>
   *
   * @return the deletion timestamp, or {@code null} if the object
   * has not been marked for deletion
   *
   * @see #isTerminating()
   */
  public final String getDeletionTimestamp() {
    return this.deletionTimestamp;
  }

  /**
   * Returns {@code true} if the object this {@link ObjectSnapshot}
   * represents has been marked for deletion.
   *
   * @return {@code true} if the deletion timestamp is set and not
   * empty
   */
  public final boolean isTerminating() {
    return this.deletionTimestamp != null && !this.deletionTimestamp.isEmpty();
  }

  /**
   * Returns an unmodifiable, ordered {@link List} of the object's
   * finalizers.
   *
   * <p>This method never returns {@code null}.  If the object has no
   * finalizers an empty {@link List} is returned.</p>
   *
   * @return a non-{@code null}, unmodifiable {@link List}
   */
  public final List<String> getFinalizers() {
    return this.finalizers;
  }

  /**
   * Returns {@code true} if the supplied finalizer is present.
   *
   * @param finalizer the finalizer to look for; may be {@code null}
   * in which case {@code false} will be returned
   *
   * @return {@code true} if {@code finalizer} is present
   */
  public final boolean containsFinalizer(final String finalizer) {
    return finalizer != null && this.finalizers.contains(finalizer);
  }

  /**
   * Returns the value of {@code metadata.resourceVersion}.
   *
   * <p>This method may return {@code null}, in which case writes
   * derived from this {@link ObjectSnapshot} cannot be conditioned on
   * it.</p>
   *
   * @return the resource version, or {@code null}
   */
  public final String getResourceVersion() {
    return this.resourceVersion;
  }

  /**
   * Returns a deep copy of the full document this {@link
   * ObjectSnapshot} represents.
   *
   * <p>This method never returns {@code null}.  Changes to the
   * returned {@link Map} do not affect this {@link
   * ObjectSnapshot}.</p>
   *
   * @return a non-{@code null}, mutable copy of the document
   */
  public final Map<String, Object> getBody() {
    return copyMap(this.body);
  }

  /**
   * Returns a new {@link ObjectSnapshot} identical to this one except
   * that its finalizers are replaced by the supplied ones.
   *
   * <p>This {@link ObjectSnapshot} is not modified.  The returned
   * snapshot keeps this snapshot's {@linkplain #getResourceVersion()
   * resource version}.</p>
   *
   * @param finalizers the new finalizers, in order; must not be
   * {@code null}
   *
   * @return a new, non-{@code null} {@link ObjectSnapshot}
   *
   * @exception NullPointerException if {@code finalizers} is {@code
   * null}
   */
  public final ObjectSnapshot withFinalizers(final Collection<? extends String> finalizers) {
    Objects.requireNonNull(finalizers, "finalizers");
    final Map<String, Object> newBody = copyMap(this.body);
    @SuppressWarnings("unchecked")
    Map<String, Object> metadata = (Map<String, Object>)newBody.get(METADATA);
    if (metadata == null) {
      metadata = new LinkedHashMap<>();
      newBody.put(METADATA, metadata);
    }
    metadata.put(FINALIZERS, new ArrayList<>(finalizers));
    return new ObjectSnapshot(newBody);
  }

  @Override
  public final int hashCode() {
    return this.body.hashCode();
  }

  @Override
  public final boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof ObjectSnapshot) {
      return this.body.equals(((ObjectSnapshot)other).body);
    } else {
      return false;
    }
  }

  @Override
  public final String toString() {
    return new StringBuilder(String.valueOf(this.name))
      .append(" (resourceVersion ").append(this.resourceVersion)
      .append(", deletionTimestamp ").append(this.deletionTimestamp)
      .append(", finalizers ").append(this.finalizers)
      .append(")")
      .toString();
  }


  /*
   * Static methods.
   */


  private static final Map<?, ?> metadata(final Map<String, Object> body) {
    final Object metadata = body.get(METADATA);
    if (metadata == null) {
      return null;
    } else if (metadata instanceof Map) {
      return (Map<?, ?>)metadata;
    } else {
      throw new IllegalArgumentException("metadata is not a Map: " + metadata);
    }
  }

  private static final List<String> finalizers(final Object value) {
    if (value == null) {
      return Collections.emptyList();
    } else if (!(value instanceof List)) {
      throw new IllegalArgumentException("metadata.finalizers is not a List: " + value);
    }
    final List<?> list = (List<?>)value;
    final List<String> returnValue = new ArrayList<>(list.size());
    for (final Object element : list) {
      if (!(element instanceof String)) {
        throw new IllegalArgumentException("metadata.finalizers contains a non-String element: " + element);
      }
      returnValue.add((String)element);
    }
    return Collections.unmodifiableList(returnValue);
  }

  private static final String stringValue(final Object value) {
    return value == null ? null : value.toString();
  }

  private static final Map<String, Object> copyMap(final Map<?, ?> map) {
    final Map<String, Object> returnValue = new LinkedHashMap<>();
    for (final Map.Entry<?, ?> entry : map.entrySet()) {
      returnValue.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
    }
    return returnValue;
  }

  private static final Object copyValue(final Object value) {
    if (value instanceof Map) {
      return copyMap((Map<?, ?>)value);
    } else if (value instanceof List) {
      final List<?> list = (List<?>)value;
      final List<Object> returnValue = new ArrayList<>(list.size());
      for (final Object element : list) {
        returnValue.add(copyValue(element));
      }
      return returnValue;
    } else {
      return value;
    }
  }

}
