/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.yangpath.node;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.Identity;
import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.SchemaNodeKind;
import io.yangpath.api.YangContext;

/**
 * In-memory {@link Module} with a small builder API for its schema.
 */
public final class SimpleModule implements Module {

  private final YangContext context;

  private final String name;

  private final String prefix;

  private final String namespace;

  private final Map<String, Module> imports = new HashMap<>();

  private final List<SchemaNode> data = new ArrayList<>();

  private final List<Identity> identities = new ArrayList<>();

  private boolean implemented = true;

  SimpleModule(final YangContext context, final String name, final String prefix,
      final String namespace) {
    this.context = checkNotNull(context);
    this.name = checkNotNull(name);
    this.prefix = checkNotNull(prefix);
    this.namespace = checkNotNull(namespace);
  }

  /**
   * Import another module under a local prefix.
   *
   * @param importPrefix the prefix
   * @param module the imported module
   * @return this module
   */
  public SimpleModule addImport(final String importPrefix, final Module module) {
    imports.put(checkNotNull(importPrefix), checkNotNull(module));
    return this;
  }

  public SimpleModule setImplemented(final boolean implemented) {
    this.implemented = implemented;
    return this;
  }

  /**
   * Define an identity.
   *
   * @param identityName the identity name
   * @param bases its direct bases
   * @return the identity
   */
  public SimpleIdentity addIdentity(final String identityName, final Identity... bases) {
    final SimpleIdentity identity = new SimpleIdentity(this, identityName, List.of(bases));
    identities.add(identity);
    return identity;
  }

  /**
   * Add a top-level node.
   *
   * @param kind node kind
   * @param nodeName node name
   * @return the node
   */
  public SimpleSchemaNode addNode(final SchemaNodeKind kind, final String nodeName) {
    final SimpleSchemaNode node = new SimpleSchemaNode(kind, nodeName, this, null);
    data.add(node);
    return node;
  }

  public SimpleSchemaNode container(final String nodeName) {
    return addNode(SchemaNodeKind.CONTAINER, nodeName);
  }

  public SimpleSchemaNode list(final String nodeName) {
    return addNode(SchemaNodeKind.LIST, nodeName);
  }

  public SimpleSchemaNode leaf(final String nodeName, final SimpleLeafType type) {
    return addNode(SchemaNodeKind.LEAF, nodeName).setType(type);
  }

  /**
   * Augment a node of this or another module.
   *
   * @param target the augmented node
   * @return the augment, children added to it appear under {@code target}
   */
  public SimpleSchemaNode augment(final SimpleSchemaNode target) {
    final SimpleSchemaNode augment = new SimpleSchemaNode(SchemaNodeKind.AUGMENT,
        "augment", this, null);
    augment.setAugmentTarget(target);
    target.attach(augment);
    data.add(augment);
    return augment;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getPrefix() {
    return prefix;
  }

  @Override
  public String getNamespace() {
    return namespace;
  }

  @Override
  public @Nullable Module getImport(final String importPrefix) {
    return imports.get(importPrefix);
  }

  @Override
  public List<SchemaNode> getData() {
    return Collections.unmodifiableList(data);
  }

  @Override
  public List<Identity> getIdentities() {
    return Collections.unmodifiableList(identities);
  }

  @Override
  public boolean isImplemented() {
    return implemented;
  }

  @Override
  public YangContext getContext() {
    return context;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("prefix", prefix).toString();
  }
}
