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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import java.util.logging.Level;

import org.junit.Before;
import org.junit.Test;

import org.microbean.kubernetes.finalizer.FinalizerMutationException.Phase;
import org.microbean.kubernetes.finalizer.FinalizerMutator.Outcome;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestFinalizerMutator {

  private static final String STORAGE = "cleanup.vendor/storage";

  private InMemoryObjectStoreClient store;

  private CapturingHandler handler;

  private FinalizerMutator mutator;

  public TestFinalizerMutator() {
    super();
  }

  @Before
  public void setUp() {
    this.store = new InMemoryObjectStoreClient();
    this.handler = new CapturingHandler();
    this.mutator = new FinalizerMutator("mayastor", "openebs.io", "v1alpha1", "mayastorpools", this.store, CapturingHandler.newLogger(this.handler));
  }

  @Test
  public void testAddToObjectWithoutFinalizers() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", STORAGE));
    final List<ObjectSnapshot> replacements = this.store.replacements();
    assertEquals(1, replacements.size());
    assertEquals(Collections.singletonList(STORAGE), replacements.get(0).getFinalizers());
    assertEquals(Collections.singletonList(STORAGE), this.finalizers("pool-1"));
    assertEquals(Collections.singletonList("added finalizer:" + STORAGE + " to mayastorpools:pool-1"), this.handler.messages(Level.INFO));
  }

  @Test
  public void testAddIsIdempotent() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", STORAGE));
    assertEquals(Outcome.ALREADY_PRESENT, this.mutator.addFinalizer("pool-1", STORAGE));
    assertEquals(1, this.store.replacements().size());
    assertEquals(Collections.singletonList(STORAGE), this.finalizers("pool-1"));
    assertEquals(Collections.singletonList("addFinalizer(pool-1," + STORAGE + "), finalizer already present"), this.handler.messages(Level.WARNING));
  }

  @Test
  public void testAddAppendsAndPreservesOrder() throws FinalizerMutationException {
    this.createPool("pool-1", Arrays.asList("a", "b"), null);
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", "c"));
    assertEquals(Arrays.asList("a", "b", "c"), this.finalizers("pool-1"));
  }

  @Test
  public void testAddRefusedOnTerminatingObject() throws FinalizerMutationException {
    this.createPool("pool-1", Collections.singletonList("a"), "2020-06-01T00:00:00Z");
    assertEquals(Outcome.TERMINATING, this.mutator.addFinalizer("pool-1", STORAGE));
    // Even when the finalizer is already there.
    assertEquals(Outcome.TERMINATING, this.mutator.addFinalizer("pool-1", "a"));
    assertTrue(this.store.replacements().isEmpty());
    assertEquals(Collections.singletonList("a"), this.finalizers("pool-1"));
    assertEquals(Arrays.asList("addFinalizer(pool-1," + STORAGE + "), deletionTimestamp is set",
                               "addFinalizer(pool-1,a), deletionTimestamp is set"),
                 this.handler.messages(Level.WARNING));
  }

  @Test
  public void testRemoveAllowedOnTerminatingObject() throws FinalizerMutationException {
    this.createPool("pool-1", Arrays.asList("a", STORAGE), "2020-06-01T00:00:00Z");
    assertEquals(Outcome.REMOVED, this.mutator.removeFinalizer("pool-1", STORAGE));
    assertEquals(1, this.store.replacements().size());
    assertEquals(Collections.singletonList("a"), this.finalizers("pool-1"));
    assertEquals(Collections.singletonList("removed finalizer:" + STORAGE + " from mayastorpools:pool-1"), this.handler.messages(Level.INFO));
  }

  @Test
  public void testRemovePreservesOrder() throws FinalizerMutationException {
    this.createPool("pool-1", Arrays.asList("a", "b", "c"), null);
    assertEquals(Outcome.REMOVED, this.mutator.removeFinalizer("pool-1", "b"));
    assertEquals(Arrays.asList("a", "c"), this.finalizers("pool-1"));
  }

  @Test
  public void testRemoveAbsentFinalizerIsNoOp() throws FinalizerMutationException {
    this.createPool("pool-1", Collections.singletonList("a"), null);
    assertEquals(Outcome.NOT_PRESENT, this.mutator.removeFinalizer("pool-1", STORAGE));
    assertTrue(this.store.replacements().isEmpty());
    assertEquals(Collections.singletonList("removeFinalizer(pool-1," + STORAGE + "), finalizer not found"), this.handler.messages(Level.WARNING));
  }

  @Test
  public void testRemoveFromObjectWithoutFinalizersIsNoOp() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    assertEquals(Outcome.NO_FINALIZERS, this.mutator.removeFinalizer("pool-1", STORAGE));
    assertTrue(this.store.replacements().isEmpty());
    assertEquals(Collections.singletonList("removeFinalizer(pool-1," + STORAGE + "), no finalizers on mayastorpools"), this.handler.messages(Level.WARNING));
  }

  @Test
  public void testAddThenRemoveRestoresFinalizers() throws FinalizerMutationException {
    this.createPool("pool-1", Arrays.asList("a", "b"), null);
    final List<String> before = this.finalizers("pool-1");
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", STORAGE));
    assertEquals(Outcome.REMOVED, this.mutator.removeFinalizer("pool-1", STORAGE));
    assertEquals(before, this.finalizers("pool-1"));
  }

  @Test
  public void testUnrelatedFieldsSurviveReplacement() throws FinalizerMutationException {
    final ObjectSnapshot created = this.createPool("pool-1", null, null);
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", STORAGE));
    final Map<String, Object> body = this.store.stored(this.mutator.getReference("pool-1")).getBody();
    assertEquals(created.getBody().get("spec"), body.get("spec"));
    assertEquals("MayastorPool", body.get("kind"));
    @SuppressWarnings("unchecked")
    final Map<String, Object> labels = (Map<String, Object>)((Map<String, Object>)body.get("metadata")).get("labels");
    assertEquals(Collections.singletonMap("app", "moac"), labels);
  }

  @Test
  public void testFetchFailureIsLoggedAndThrown() {
    try {
      this.mutator.addFinalizer("missing", STORAGE);
      fail();
    } catch (final FinalizerMutationException expected) {
      assertSame(Phase.FETCH, expected.getPhase());
      assertTrue(expected.getCause().isNotFound());
      assertEquals("NotFound", expected.getCause().getReason());
      assertEquals(this.mutator.getReference("missing"), expected.getReference());
      assertEquals(STORAGE, expected.getFinalizer());
    }
    assertTrue(this.store.replacements().isEmpty());
    assertEquals(Collections.singletonList("add finalizer:" + STORAGE + " to mayastorpools:missing, get failed: code=404, reason=NotFound, mayastorpools \"missing\" not found"),
                 this.handler.messages(Level.SEVERE));
  }

  @Test
  public void testRemoveFetchFailureIsLoggedAndThrown() {
    this.createPool("pool-1", Collections.singletonList(STORAGE), null);
    this.store.failGet(new ObjectStoreException(403, "Forbidden", "access denied"));
    try {
      this.mutator.removeFinalizer("pool-1", STORAGE);
      fail();
    } catch (final FinalizerMutationException expected) {
      assertSame(Phase.FETCH, expected.getPhase());
    }
    assertEquals(Collections.singletonList("remove finalizer:" + STORAGE + " from mayastorpools:pool-1, get failed: code=403, reason=Forbidden, access denied"),
                 this.handler.messages(Level.SEVERE));
  }

  @Test
  public void testWriteFailureIsLoggedAndNotRetried() {
    this.createPool("pool-1", null, null);
    this.store.failReplace(new ObjectStoreException(422, "Invalid", "finalizer name is invalid"));
    try {
      this.mutator.addFinalizer("pool-1", STORAGE);
      fail();
    } catch (final FinalizerMutationException expected) {
      assertSame(Phase.REPLACE, expected.getPhase());
      assertEquals(422, expected.getCause().getCode());
    }
    assertEquals(1, this.store.replacements().size());
    assertTrue(this.finalizers("pool-1").isEmpty());
    assertEquals(Collections.singletonList("add finalizer:" + STORAGE + " to mayastorpools:pool-1, update failed: code=422, reason=Invalid, finalizer name is invalid"),
                 this.handler.messages(Level.SEVERE));
    assertTrue(this.handler.messages(Level.INFO).isEmpty());
  }

  @Test
  public void testConcurrentWriterCausesConflictInsteadOfLostUpdate() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    final FinalizerMutator other = new FinalizerMutator("mayastor", "openebs.io", "v1alpha1", "mayastorpools", this.store, CapturingHandler.newLogger(new CapturingHandler()));
    // Another controller slips its finalizer in between our read and our write.
    this.store.beforeReplace(() -> {
        try {
          assertEquals(Outcome.ADDED, other.addFinalizer("pool-1", "other.vendor/cleanup"));
        } catch (final FinalizerMutationException e) {
          throw new AssertionError(e);
        }
      });
    try {
      this.mutator.addFinalizer("pool-1", STORAGE);
      fail();
    } catch (final FinalizerMutationException expected) {
      assertSame(Phase.REPLACE, expected.getPhase());
      assertTrue(expected.getCause().isConflict());
    }
    assertEquals(Collections.singletonList("other.vendor/cleanup"), this.finalizers("pool-1"));

    // The next reconciliation pass succeeds with a fresh read.
    assertEquals(Outcome.ADDED, this.mutator.addFinalizer("pool-1", STORAGE));
    assertEquals(Arrays.asList("other.vendor/cleanup", STORAGE), this.finalizers("pool-1"));
  }

  @Test
  public void testConflictLeavesSnapshotsUnmodified() {
    final ObjectSnapshot created = this.createPool("pool-1", Collections.singletonList("a"), null);
    this.store.failReplace(new ObjectStoreException(ObjectStoreException.CONFLICT, "Conflict", "the object has been modified"));
    try {
      this.mutator.addFinalizer("pool-1", STORAGE);
      fail();
    } catch (final FinalizerMutationException expected) {
      assertTrue(expected.getCause().isConflict());
    }
    assertEquals(Collections.singletonList("a"), created.getFinalizers());
    assertEquals(created, this.store.stored(this.mutator.getReference("pool-1")));
  }

  @Test
  public void testScenario() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    this.mutator.addFinalizer("pool-1", STORAGE);
    assertEquals(1, this.store.replacements().size());
    assertEquals(Collections.singletonList(STORAGE), this.store.replacements().get(0).getFinalizers());
    this.mutator.addFinalizer("pool-1", STORAGE);
    assertEquals(1, this.store.replacements().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyFinalizerIsRejected() throws FinalizerMutationException {
    this.createPool("pool-1", null, null);
    this.mutator.addFinalizer("pool-1", "");
  }

  @Test(expected = NullPointerException.class)
  public void testNullNameIsRejected() throws FinalizerMutationException {
    this.mutator.removeFinalizer(null, STORAGE);
  }

  @Test
  public void testDefaultLogger() {
    final FinalizerMutator defaultMutator = new FinalizerMutator("mayastor", "openebs.io", "v1alpha1", "mayastorpools", this.store);
    assertEquals(FinalizerMutator.class.getName(), defaultMutator.logger.getName());
    assertEquals("mayastor", defaultMutator.getNamespace());
  }

  @Test
  public void testOutcomeMutated() {
    assertTrue(Outcome.ADDED.isMutated());
    assertTrue(Outcome.REMOVED.isMutated());
    assertFalse(Outcome.TERMINATING.isMutated());
    assertFalse(Outcome.ALREADY_PRESENT.isMutated());
    assertFalse(Outcome.NO_FINALIZERS.isMutated());
    assertFalse(Outcome.NOT_PRESENT.isMutated());
  }

  private final ObjectSnapshot createPool(final String name, final List<String> finalizers, final String deletionTimestamp) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("labels", Collections.singletonMap("app", "moac"));
    if (finalizers != null) {
      metadata.put("finalizers", finalizers);
    }
    if (deletionTimestamp != null) {
      metadata.put("deletionTimestamp", deletionTimestamp);
    }
    final Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("node", "node-1");
    spec.put("disks", Collections.singletonList("/dev/sdb"));
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("apiVersion", "openebs.io/v1alpha1");
    body.put("kind", "MayastorPool");
    body.put("metadata", metadata);
    body.put("spec", spec);
    return this.store.put(this.mutator.getReference(name), body);
  }

  private final List<String> finalizers(final String name) {
    return this.store.stored(this.mutator.getReference(name)).getFinalizers();
  }

}
