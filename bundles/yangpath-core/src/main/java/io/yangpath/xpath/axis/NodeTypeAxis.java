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

import io.yangpath.api.Attribute;
import io.yangpath.api.DataNode;
import io.yangpath.api.SchemaNode;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <p>
 * Node type tests: {@code node()}, {@code text()} and {@code comment()}, on the child or the
 * attribute axis. The value of a leaf is its text child; data trees have no comments.
 * </p>
 */
public final class NodeTypeAxis {

  /** {@code node()}. */
  public static final String NODE = "node";

  /** {@code text()}. */
  public static final String TEXT = "text";

  /** {@code comment()}. */
  public static final String COMMENT = "comment";

  private NodeTypeAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Apply a node type test.
   *
   * @param set the set
   * @param context the evaluation
   * @param nodeType {@link #NODE}, {@link #TEXT} or {@link #COMMENT}
   * @param attribute {@code true} on the attribute axis
   * @param allDesc {@code true} if the step follows {@code //}
   * @throws XPathException if the set is not a node-set
   * @throws UnresolvedDependencyException if a matched node has an unresolved when
   */
  public static void moveTo(final XPathSet set, final XPathContext context, final String nodeType,
      final boolean attribute, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    if (!AxisSupport.requireNodeSet(set, nodeType + "()")) {
      return;
    }
    if (allDesc) {
      SelfAxis.moveTo(set, context, true);
    }
    final List<NodeEntry> result = new ArrayList<>();
    for (final NodeEntry entry : set.getNodes()) {
      if (attribute) {
        if (NODE.equals(nodeType) && entry.type() == NodeType.ELEM) {
          for (final Attribute attr : entry.node().getAttributes()) {
            result.add(NodeEntry.ofAttribute(attr));
          }
        }
      } else if (entry.type() == NodeType.ELEM && DataTree.isLeaf(entry.node())) {
        if (!COMMENT.equals(nodeType)) {
          result.add(NodeEntry.ofText(entry.node()));
        }
      } else if (NODE.equals(nodeType)) {
        for (final DataNode child : DataTree.children(context, entry)) {
          context.checkWhen(child);
          result.add(NodeEntry.ofElement(child));
        }
      }
    }
    set.replaceNodes(result);
    set.sortAndClean();
  }

  /**
   * Schema twin of {@link #moveTo(XPathSet, XPathContext, String, boolean, boolean)}.
   *
   * @param set the set
   * @param context the analysis
   * @param nodeType {@link #NODE}, {@link #TEXT} or {@link #COMMENT}
   * @param attribute {@code true} on the attribute axis
   * @param allDesc {@code true} if the step follows {@code //}
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context,
      final String nodeType, final boolean attribute, final boolean allDesc) {
    if (allDesc) {
      SelfAxis.moveToSchema(set, context, true);
    }
    final List<SchemaEntry> from = set.takeSchemaContext();
    if (attribute || COMMENT.equals(nodeType)) {
      return;
    }
    for (final SchemaEntry entry : from) {
      final SchemaNode node = entry.getNode();
      if (entry.getType() == NodeType.ELEM && node.getKind().isLeaf()) {
        set.addSchemaNode(node, NodeType.TEXT, SchemaEntry.IN_CONTEXT);
      } else if (NODE.equals(nodeType)
          && (entry.getType() == NodeType.ELEM || entry.getType().isRoot())) {
        for (final SchemaNode child : SchemaTree.children(context, node)) {
          SchemaTree.addChild(context, set, child);
        }
      }
    }
  }
}
