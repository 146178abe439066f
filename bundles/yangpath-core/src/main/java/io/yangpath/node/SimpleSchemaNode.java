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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.LeafType;
import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.SchemaNodeKind;

/**
 * In-memory {@link SchemaNode}. The builder methods return the created child so that trees can be
 * written top-down.
 */
public final class SimpleSchemaNode implements SchemaNode {

  private final SchemaNodeKind kind;

  private final String name;

  private final Module module;

  private final @Nullable SchemaNode parent;

  private final List<SchemaNode> children = new ArrayList<>();

  private final List<String> musts = new ArrayList<>();

  private boolean config = true;

  private @Nullable LeafType type;

  private @Nullable String when;

  private @Nullable SchemaNode augmentTarget;

  SimpleSchemaNode(final SchemaNodeKind kind, final String name, final Module module,
      final @Nullable SchemaNode parent) {
    this.kind = checkNotNull(kind);
    this.name = checkNotNull(name);
    this.module = checkNotNull(module);
    this.parent = parent;
  }

  /**
   * Add a child of this node's module.
   *
   * @param childKind the kind
   * @param childName the name
   * @return the child
   */
  public SimpleSchemaNode addChild(final SchemaNodeKind childKind, final String childName) {
    return addChild(childKind, childName, module);
  }

  /**
   * Add a child belonging to another module.
   *
   * @param childKind the kind
   * @param childName the name
   * @param childModule the module of the child
   * @return the child
   */
  public SimpleSchemaNode addChild(final SchemaNodeKind childKind, final String childName,
      final Module childModule) {
    final SimpleSchemaNode child = new SimpleSchemaNode(childKind, childName, childModule, this);
    children.add(child);
    return child;
  }

  public SimpleSchemaNode container(final String childName) {
    return addChild(SchemaNodeKind.CONTAINER, childName);
  }

  public SimpleSchemaNode list(final String childName) {
    return addChild(SchemaNodeKind.LIST, childName);
  }

  public SimpleSchemaNode leaf(final String childName, final LeafType leafType) {
    return addChild(SchemaNodeKind.LEAF, childName).setType(leafType);
  }

  public SimpleSchemaNode leafList(final String childName, final LeafType leafType) {
    return addChild(SchemaNodeKind.LEAF_LIST, childName).setType(leafType);
  }

  public SimpleSchemaNode choice(final String childName) {
    return addChild(SchemaNodeKind.CHOICE, childName);
  }

  public SimpleSchemaNode caseNode(final String childName) {
    return addChild(SchemaNodeKind.CASE, childName);
  }

  public SimpleSchemaNode setType(final LeafType leafType) {
    checkArgument(kind.isLeaf(), "only leaves have a type");
    type = checkNotNull(leafType);
    return this;
  }

  public SimpleSchemaNode setConfig(final boolean config) {
    this.config = config;
    return this;
  }

  public SimpleSchemaNode setWhen(final String expression) {
    when = checkNotNull(expression);
    return this;
  }

  public SimpleSchemaNode addMust(final String expression) {
    musts.add(checkNotNull(expression));
    return this;
  }

  void setAugmentTarget(final SchemaNode target) {
    augmentTarget = checkNotNull(target);
  }

  void attach(final SimpleSchemaNode augment) {
    children.add(augment);
  }

  @Override
  public SchemaNodeKind getKind() {
    return kind;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Module getModule() {
    return module;
  }

  @Override
  public @Nullable SchemaNode getParent() {
    return parent;
  }

  @Override
  public List<SchemaNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public boolean isConfig() {
    switch (kind) {
      case RPC:
      case ACTION:
      case NOTIFICATION:
        return false;
      default:
        break;
    }
    if (!config) {
      return false;
    }
    if (augmentTarget != null) {
      return augmentTarget.isConfig();
    }
    return parent == null || parent.isConfig();
  }

  @Override
  public @Nullable LeafType getType() {
    return type;
  }

  @Override
  public @Nullable String getWhen() {
    return when;
  }

  @Override
  public List<String> getMusts() {
    return Collections.unmodifiableList(musts);
  }

  @Override
  public @Nullable SchemaNode getAugmentTarget() {
    return augmentTarget;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("kind", kind).add("name", name)
        .add("module", module.getName()).toString();
  }
}
