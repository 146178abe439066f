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

package io.yangpath.xpath.axis;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.DataNode;
import io.yangpath.api.Module;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.XPathContext;

/**
 * Navigation helpers over the data tree.
 */
public final class DataTree {

  private DataTree() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get the children of an entry visible in the evaluation. Roots have the top-level nodes as
   * children; leaves, opaque nodes and dummy nodes have none; state nodes are hidden below a
   * configuration root.
   *
   * @param context the evaluation
   * @param entry the entry
   * @return the children in document order
   */
  public static List<DataNode> children(final XPathContext context, final NodeEntry entry) {
    final DataNode first;
    switch (entry.type()) {
      case ROOT:
      case ROOT_CONFIG:
        first = entry.node();
        break;
      case ELEM:
        final DataNode node = entry.node();
        if (node.isDummy() || node.getSchema().getKind().isLeaf()
            || node.getSchema().getKind().isOpaque()) {
          return List.of();
        }
        first = node.getFirstChild();
        break;
      default:
        return List.of();
    }
    final List<DataNode> children = new ArrayList<>();
    for (DataNode child = first; child != null; child = child.getNextSibling()) {
      if (!context.isHidden(child)) {
        children.add(child);
      }
    }
    return children;
  }

  /**
   * Get the module unprefixed names inherit when stepping from an entry.
   *
   * @param entry the entry
   * @return the module of the node or {@code null} for roots
   */
  public static @Nullable Module moduleOf(final NodeEntry entry) {
    return entry.type().isRoot() ? null : entry.node().getSchema().getModule();
  }

  public static boolean isLeaf(final DataNode node) {
    return node.getSchema().getKind().isLeaf();
  }
}
