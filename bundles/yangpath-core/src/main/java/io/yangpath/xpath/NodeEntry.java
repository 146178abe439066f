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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Attribute;
import io.yangpath.api.DataNode;

/**
 * One member of a node-set. Root entries reference the first top-level node, attribute entries
 * reference the owner and the attribute. Equality is by identity of the referenced nodes.
 *
 * @param type axis type
 * @param node the node
 * @param attribute the attribute of {@link NodeType#ATTR} entries
 */
public record NodeEntry(NodeType type, DataNode node, @Nullable Attribute attribute) {

  public NodeEntry {
    checkNotNull(type);
    checkNotNull(node);
    checkArgument((type == NodeType.ATTR) == (attribute != null),
        "attribute entries need an attribute");
  }

  public static NodeEntry ofElement(final DataNode node) {
    return new NodeEntry(NodeType.ELEM, node, null);
  }

  public static NodeEntry ofText(final DataNode node) {
    return new NodeEntry(NodeType.TEXT, node, null);
  }

  public static NodeEntry ofAttribute(final Attribute attribute) {
    return new NodeEntry(NodeType.ATTR, attribute.getParent(), attribute);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof NodeEntry other)) {
      return false;
    }
    return type == other.type && node == other.node && attribute == other.attribute;
  }

  @Override
  public int hashCode() {
    int result = System.identityHashCode(node);
    result = 31 * result + System.identityHashCode(attribute);
    return 31 * result + type.hashCode();
  }
}
