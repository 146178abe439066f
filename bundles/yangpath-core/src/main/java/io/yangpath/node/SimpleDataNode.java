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
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.Attribute;
import io.yangpath.api.DataNode;
import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.WhenStatus;

/**
 * In-memory {@link DataNode} with doubly linked siblings.
 */
public final class SimpleDataNode implements DataNode {

  private final SchemaNode schema;

  private final @Nullable String value;

  private @Nullable SimpleDataNode parent;

  private @Nullable SimpleDataNode firstChild;

  private @Nullable SimpleDataNode lastChild;

  private @Nullable SimpleDataNode next;

  private @Nullable SimpleDataNode prev;

  private final List<Attribute> attributes = new ArrayList<>();

  private WhenStatus whenStatus;

  private boolean dummy;

  private SimpleDataNode(final SchemaNode schema, final @Nullable String value) {
    this.schema = checkNotNull(schema);
    this.value = value;
    whenStatus = schema.getWhen() == null ? WhenStatus.NONE : WhenStatus.TRUE;
  }

  /**
   * Create an inner node.
   *
   * @param schema its schema node
   * @return the node
   */
  public static SimpleDataNode of(final SchemaNode schema) {
    checkArgument(!schema.getKind().isLeaf(), "leaves need a value");
    return new SimpleDataNode(schema, null);
  }

  /**
   * Create a leaf or leaf-list instance.
   *
   * @param schema its schema node
   * @param value canonical value
   * @return the node
   */
  public static SimpleDataNode leaf(final SchemaNode schema, final String value) {
    checkArgument(schema.getKind().isLeaf(), "not a leaf");
    return new SimpleDataNode(schema, checkNotNull(value));
  }

  /**
   * Append a child as the last child of this node.
   *
   * @param child the unlinked child
   * @return the child
   */
  public SimpleDataNode append(final SimpleDataNode child) {
    checkState(child.parent == null && child.prev == null && child.next == null,
        "node is already linked");
    child.parent = this;
    if (lastChild == null) {
      firstChild = child;
    } else {
      lastChild.next = child;
      child.prev = lastChild;
    }
    lastChild = child;
    return child;
  }

  /**
   * Create and append an inner child.
   *
   * @param childSchema schema of the child
   * @return the child
   */
  public SimpleDataNode child(final SchemaNode childSchema) {
    return append(of(childSchema));
  }

  /**
   * Create and append a leaf child.
   *
   * @param childSchema schema of the child
   * @param childValue the leaf value
   * @return the child
   */
  public SimpleDataNode leafChild(final SchemaNode childSchema, final String childValue) {
    return append(leaf(childSchema, childValue));
  }

  /**
   * Link a top-level sibling after the last sibling of this top-level node.
   *
   * @param sibling the unlinked sibling
   * @return the sibling
   */
  public SimpleDataNode appendSibling(final SimpleDataNode sibling) {
    checkState(parent == null, "only top-level nodes are linked this way");
    SimpleDataNode last = this;
    while (last.next != null) {
      last = last.next;
    }
    last.next = sibling;
    sibling.prev = last;
    return sibling;
  }

  /**
   * Add a metadata annotation.
   *
   * @param module the annotation module
   * @param name the annotation name
   * @param attributeValue the value
   * @return this node
   */
  public SimpleDataNode addAttribute(final Module module, final String name,
      final String attributeValue) {
    attributes.add(new SimpleAttribute(this, module, name, attributeValue));
    return this;
  }

  public SimpleDataNode setWhenStatus(final WhenStatus whenStatus) {
    this.whenStatus = checkNotNull(whenStatus);
    return this;
  }

  public SimpleDataNode setDummy(final boolean dummy) {
    this.dummy = dummy;
    return this;
  }

  @Override
  public SchemaNode getSchema() {
    return schema;
  }

  @Override
  public @Nullable DataNode getParent() {
    return parent;
  }

  @Override
  public @Nullable DataNode getFirstChild() {
    return firstChild;
  }

  @Override
  public @Nullable DataNode getNextSibling() {
    return next;
  }

  @Override
  public @Nullable DataNode getPreviousSibling() {
    return prev;
  }

  @Override
  public List<Attribute> getAttributes() {
    return Collections.unmodifiableList(attributes);
  }

  @Override
  public @Nullable String getValue() {
    return value;
  }

  @Override
  public WhenStatus getWhenStatus() {
    return whenStatus;
  }

  @Override
  public boolean isDummy() {
    return dummy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", schema.getName()).omitNullValues()
        .add("value", value).toString();
  }
}
