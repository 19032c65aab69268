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

import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * An immutable identifier of a single namespaced custom object,
 * composed of its API group, API version, namespace, plural resource
 * name and object name.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ObjectStoreClient
 */
@Immutable
public final class ResourceReference {


  /*
   * Instance fields.
   */


  /**
   * The API group of the custom resource.
   *
   * <p>This field is never {@code null} but may be {@linkplain
   * String#isEmpty() empty} to designate the core API group.</p>
   */
  private final String group;

  /**
   * The API version of the custom resource.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final String version;

  /**
   * The namespace in which the object lives.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final String namespace;

  /**
   * The plural name of the custom resource, e.g. {@code pools}.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final String plural;

  /**
   * The name of the object.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final String name;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ResourceReference}.
   *
   * @param group the API group; must not be {@code null}; may be
   * {@linkplain String#isEmpty() empty}
   *
   * @param version the API version; must not be {@code null} or
   * empty
   *
   * @param namespace the namespace; must not be {@code null} or
   * empty
   *
   * @param plural the plural resource name; must not be {@code null}
   * or empty
   *
   * @param name the object name; must not be {@code null} or empty
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalArgumentException if {@code version}, {@code
   * namespace}, {@code plural} or {@code name} is empty
   */
  public ResourceReference(final String group,
                           final String version,
                           final String namespace,
                           final String plural,
                           final String name) {
    super();
    this.group = Objects.requireNonNull(group, "group");
    this.version = requireNonEmpty(version, "version");
    this.namespace = requireNonEmpty(namespace, "namespace");
    this.plural = requireNonEmpty(plural, "plural");
    this.name = requireNonEmpty(name, "name");
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the API group.
   *
   * @return the non-{@code null} API group
   */
  public final String getGroup() {
    return this.group;
  }

  /**
   * Returns the API version.
   *
   * @return the non-{@code null} API version
   */
  public final String getVersion() {
    return this.version;
  }

  /**
   * Returns the namespace.
   *
   * @return the non-{@code null} namespace
   */
  public final String getNamespace() {
    return this.namespace;
  }

  /**
   * Returns the plural resource name.
   *
   * @return the non-{@code null} plural resource name
   */
  public final String getPlural() {
    return this.plural;
  }

  /**
   * Returns the object name.
   *
   * @return the non-{@code null} object name
   */
  public final String getName() {
    return this.name;
  }

  /**
   * Returns the {@code apiVersion} string for this reference, i.e.
   * {@code group/version}, or just the version for the core group.
   *
   * @return a non-{@code null} {@code apiVersion} string
   */
  public final String getApiVersion() {
    if (this.group.isEmpty()) {
      return this.version;
    }
    return new StringBuilder(this.group).append("/").append(this.version).toString();
  }

  /**
   * Returns a {@link ResourceReference} identical to this one except
   * for its {@linkplain #getName() name}.
   *
   * @param name the new name; must not be {@code null} or empty
   *
   * @return a non-{@code null} {@link ResourceReference}
   *
   * @exception NullPointerException if {@code name} is {@code null}
   *
   * @exception IllegalArgumentException if {@code name} is empty
   */
  public final ResourceReference withName(final String name) {
    return new ResourceReference(this.group, this.version, this.namespace, this.plural, name);
  }

  @Override
  public final int hashCode() {
    return Objects.hash(this.group, this.version, this.namespace, this.plural, this.name);
  }

  @Override
  public final boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof ResourceReference) {
      final ResourceReference her = (ResourceReference)other;
      return
        this.group.equals(her.group) &&
        this.version.equals(her.version) &&
        this.namespace.equals(her.namespace) &&
        this.plural.equals(her.plural) &&
        this.name.equals(her.name);
    } else {
      return false;
    }
  }

  /**
   * Returns a {@link String} representation of this {@link
   * ResourceReference} of the form {@code
   * apiVersion/namespace/plural/name}.
   *
   * @return a non-{@code null} {@link String}
   */
  @Override
  public final String toString() {
    return new StringBuilder(this.getApiVersion())
      .append("/").append(this.namespace)
      .append("/").append(this.plural)
      .append("/").append(this.name)
      .toString();
  }


  /*
   * Static methods.
   */


  private static final String requireNonEmpty(final String value, final String parameterName) {
    Objects.requireNonNull(value, parameterName);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(parameterName + ".isEmpty()");
    }
    return value;
  }

}
