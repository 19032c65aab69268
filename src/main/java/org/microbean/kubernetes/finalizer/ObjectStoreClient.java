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

/**
 * A minimal store of named custom objects that can be read and
 * wholly replaced.
 *
 * <p>Implementations of this interface must be safe for concurrent
 * use by multiple {@link Thread}s.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see KubernetesObjectStoreClient
 *
 * @see FinalizerMutator
 */
public interface ObjectStoreClient {

  /**
   * Retrieves the current state of the object identified by the
   * supplied {@link ResourceReference}.
   *
   * <p>Implementations of this method must not return {@code
   * null}.</p>
   *
   * @param reference the object to retrieve; must not be {@code
   * null}
   *
   * @return a non-{@code null} {@link ObjectSnapshot}
   *
   * @exception NullPointerException if {@code reference} is {@code
   * null}
   *
   * @exception ObjectStoreException if the object does not exist
   * (with a {@linkplain ObjectStoreException#NOT_FOUND not found
   * code}) or could not be retrieved
   */
  public ObjectSnapshot get(final ResourceReference reference) throws ObjectStoreException;

  /**
   * Atomically replaces the whole object identified by the supplied
   * {@link ResourceReference} with the supplied {@link
   * ObjectSnapshot}'s {@linkplain ObjectSnapshot#getBody() body}.
   *
   * <p>If the supplied {@link ObjectSnapshot} carries a {@linkplain
   * ObjectSnapshot#getResourceVersion() resource version} and it does
   * not match that of the stored object, implementations must reject
   * the write with an {@link ObjectStoreException} whose {@linkplain
   * ObjectStoreException#getCode() code} is {@link
   * ObjectStoreException#CONFLICT}.</p>
   *
   * <p>Implementations of this method must not return {@code
   * null}.</p>
   *
   * @param reference the object to replace; must not be {@code null}
   *
   * @param snapshot the new state; must not be {@code null}
   *
   * @return a non-{@code null} {@link ObjectSnapshot} representing
   * the stored object after the write
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception ObjectStoreException if the write was rejected or
   * could not be performed
   */
  public ObjectSnapshot replace(final ResourceReference reference, final ObjectSnapshot snapshot) throws ObjectStoreException;

}
