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

package io.yangpath.xpath;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.SchemaNode;

/**
 * One member of a schema node-set. Besides the schema node it carries a context marker: several
 * hypothetical context states coexist during analysis and the marker tells which one an entry
 * belongs to.
 */
public final class SchemaEntry {

  /** The entry is only an atom, not a context node. */
  public static final int NOT_IN_CONTEXT = 0;

  /** The entry is a context node of the next step. */
  public static final int IN_CONTEXT = 1;

  /** First marker value used to park context nodes while a predicate is analyzed. */
  public static final int FIRST_PREDICATE_MARKER = 2;

  private final @Nullable SchemaNode node;

  private final NodeType type;

  private int marker;

  /**
   * Constructor.
   *
   * @param node the schema node, {@code null} for root entries
   * @param type axis type
   * @param marker context marker
   */
  public SchemaEntry(final @Nullable SchemaNode node, final NodeType type, final int marker) {
    this.node = node;
    this.type = checkNotNull(type);
    this.marker = marker;
  }

  public @Nullable SchemaNode getNode() {
    return node;
  }

  public NodeType getType() {
    return type;
  }

  public int getMarker() {
    return marker;
  }

  void setMarker(final int marker) {
    this.marker = marker;
  }

  public boolean isInContext() {
    return marker == IN_CONTEXT;
  }

  boolean matches(final @Nullable SchemaNode otherNode, final NodeType otherType) {
    return node == otherNode && type == otherType;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("node", node == null ? "/" : node.getName())
        .add("type", type).add("marker", marker).toString();
  }
}
