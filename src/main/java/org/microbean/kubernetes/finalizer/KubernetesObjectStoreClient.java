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

import java.io.Closeable;

import java.util.Map;
import java.util.Objects;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Status;

import io.fabric8.kubernetes.client.Config; // for javadoc only
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import net.jcip.annotations.ThreadSafe;

/**
 * An {@link ObjectStoreClient} backed by a Kubernetes API server
 * reached through a {@link KubernetesClient}.
 *
 * <p>Objects are handled as {@link GenericKubernetesResource}s so
 * that any custom resource can be read and written back without a
 * dedicated Java model.  {@linkplain #replace(ResourceReference,
 * ObjectSnapshot) Replacements} are locked to the {@code
 * metadata.resourceVersion} carried by the supplied {@link
 * ObjectSnapshot}, so the API server rejects them with a {@code 409
 * Conflict} if the object has changed since it was read.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see KubernetesClient#genericKubernetesResources(ResourceDefinitionContext)
 */
@ThreadSafe
public class KubernetesObjectStoreClient implements ObjectStoreClient, Closeable {


  /*
   * Instance fields.
   */


  /**
   * The {@link KubernetesClient} used to talk to the API server.
   *
   * <p>This field is never {@code null}.</p>
   */
  private final KubernetesClient client;

  /**
   * Whether {@link #client} was created by this {@link
   * KubernetesObjectStoreClient} and should therefore be closed by
   * {@link #close()}.
   */
  private final boolean closeClient;

  /**
   * A {@link Logger} for use by this {@link
   * KubernetesObjectStoreClient}.
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
   * Creates a new {@link KubernetesObjectStoreClient} connected to
   * the cluster described by the default {@link Config}, i.e. a
   * combination of system properties, environment variables, {@code
   * ~/.kube/config} and in-cluster service account settings.
   *
   * <p>The {@link KubernetesClient} so created is closed when this
   * {@link KubernetesObjectStoreClient} is {@linkplain #close()
   * closed}.</p>
   *
   * @exception KubernetesClientException if the default
   * configuration could not be loaded
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public KubernetesObjectStoreClient() {
    this(new KubernetesClientBuilder().build(), true);
  }

  /**
   * Creates a new {@link KubernetesObjectStoreClient}.
   *
   * <p>The supplied {@link KubernetesClient} is <strong>not</strong>
   * closed when this {@link KubernetesObjectStoreClient} is
   * {@linkplain #close() closed}.</p>
   *
   * @param client the {@link KubernetesClient} to use; must not be
   * {@code null}
   *
   * @exception NullPointerException if {@code client} is {@code
   * null}
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public KubernetesObjectStoreClient(final KubernetesClient client) {
    this(client, false);
  }

  private KubernetesObjectStoreClient(final KubernetesClient client, final boolean closeClient) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    this.client = Objects.requireNonNull(client, "client");
    this.closeClient = closeClient;
  }


  /*
   * Instance methods.
   */


  /**
   * Returns a {@link Logger} that will be used for this {@link
   * KubernetesObjectStoreClient}.
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
   * {@inheritDoc}
   *
   * <p>A missing object is reported as an {@link
   * ObjectStoreException} with a {@linkplain
   * ObjectStoreException#NOT_FOUND not found code} and a reason of
   * {@code NotFound}.</p>
   */
  @Override
  public ObjectSnapshot get(final ResourceReference reference) throws ObjectStoreException {
    final String cn = this.getClass().getName();
    final String mn = "get";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, reference);
    }
    Objects.requireNonNull(reference, "reference");

    final GenericKubernetesResource resource;
    try {
      resource = this.client.genericKubernetesResources(toResourceDefinitionContext(reference))
        .inNamespace(reference.getNamespace())
        .withName(reference.getName())
        .get();
    } catch (final KubernetesClientException kubernetesClientException) {
      throw toObjectStoreException(kubernetesClientException);
    }
    if (resource == null) {
      throw new ObjectStoreException(ObjectStoreException.NOT_FOUND,
                                     "NotFound",
                                     reference.getPlural() + " \"" + reference.getName() + "\" not found");
    }
    final ObjectSnapshot returnValue = toObjectSnapshot(resource, this.client.getKubernetesSerialization());

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  /**
   * {@inheritDoc}
   *
   * <p>This implementation uses the {@code update} operation of the
   * fabric8 client, which locks the write to the supplied {@link
   * ObjectSnapshot}'s {@linkplain ObjectSnapshot#getResourceVersion()
   * resource version}.</p>
   */
  @Override
  public ObjectSnapshot replace(final ResourceReference reference, final ObjectSnapshot snapshot) throws ObjectStoreException {
    final String cn = this.getClass().getName();
    final String mn = "replace";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { reference, snapshot });
    }
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(snapshot, "snapshot");

    final KubernetesSerialization serialization = this.client.getKubernetesSerialization();
    final GenericKubernetesResource resource = toGenericKubernetesResource(reference, snapshot, serialization);
    final GenericKubernetesResource updated;
    try {
      updated = this.client.genericKubernetesResources(toResourceDefinitionContext(reference))
        .inNamespace(reference.getNamespace())
        .resource(resource)
        .update();
    } catch (final KubernetesClientException kubernetesClientException) {
      throw toObjectStoreException(kubernetesClientException);
    }
    final ObjectSnapshot returnValue = toObjectSnapshot(updated, serialization);

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  /**
   * Closes the underlying {@link KubernetesClient} if it was created
   * by this {@link KubernetesObjectStoreClient}.
   */
  @Override
  public void close() {
    if (this.closeClient) {
      this.client.close();
    }
  }


  /*
   * Static methods.
   */


  static final ResourceDefinitionContext toResourceDefinitionContext(final ResourceReference reference) {
    return new ResourceDefinitionContext.Builder()
      .withGroup(reference.getGroup())
      .withVersion(reference.getVersion())
      .withPlural(reference.getPlural())
      .withNamespaced(true)
      .build();
  }

  @SuppressWarnings("unchecked")
  static final ObjectSnapshot toObjectSnapshot(final GenericKubernetesResource resource,
                                               final KubernetesSerialization serialization) {
    return new ObjectSnapshot(serialization.convertValue(resource, Map.class));
  }

  static final GenericKubernetesResource toGenericKubernetesResource(final ResourceReference reference,
                                                                     final ObjectSnapshot snapshot,
                                                                     final KubernetesSerialization serialization) {
    final GenericKubernetesResource returnValue = serialization.convertValue(snapshot.getBody(), GenericKubernetesResource.class);
    if (returnValue.getApiVersion() == null) {
      returnValue.setApiVersion(reference.getApiVersion());
    }
    ObjectMeta metadata = returnValue.getMetadata();
    if (metadata == null) {
      metadata = new ObjectMeta();
      returnValue.setMetadata(metadata);
    }
    if (metadata.getName() == null) {
      metadata.setName(reference.getName());
    } else if (!metadata.getName().equals(reference.getName())) {
      throw new IllegalArgumentException("snapshot.getName() != reference.getName(): " + metadata.getName() + " != " + reference.getName());
    }
    if (metadata.getNamespace() == null) {
      metadata.setNamespace(reference.getNamespace());
    }
    return returnValue;
  }

  static final ObjectStoreException toObjectStoreException(final KubernetesClientException kubernetesClientException) {
    final Status status = kubernetesClientException.getStatus();
    final String reason;
    final String message;
    if (status == null) {
      reason = null;
      message = kubernetesClientException.getMessage();
    } else {
      reason = status.getReason();
      message = status.getMessage() == null ? kubernetesClientException.getMessage() : status.getMessage();
    }
    return new ObjectStoreException(kubernetesClientException.getCode(), reason, message, kubernetesClientException);
  }

}
