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
 * The parent axis ({@code ..}). The parent of the root is the root, the parent of a text or
 * attribute node is its owner element.
 * </p>
 */
public final class ParentAxis {

  private ParentAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Replace every member with its parent.
   *
   * @param set the set
   * @param context the evaluation
   * @param allDesc {@code true} if the step follows {@code //}
   * @throws XPathException if the set is not a node-set
   * @throws UnresolvedDependencyException if a parent has an unresolved when
   */
  public static void moveTo(final XPathSet set, final XPathContext context, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    if (!AxisSupport.requireNodeSet(set, "parent step")) {
      return;
    }
    if (allDesc) {
      SelfAxis.moveTo(set, context, true);
    }
    final XPathSet result = set.emptyCopy();
    result.clearNodes();
    for (final NodeEntry entry : set.getNodes()) {
      final NodeEntry parent;
      switch (entry.type()) {
        case ROOT:
        case ROOT_CONFIG:
          parent = entry;
          break;
        case TEXT:
        case ATTR:
          parent = NodeEntry.ofElement(entry.node());
          break;
        default:
          final DataNode node = entry.node().getParent();
          parent = node == null ? context.rootEntry() : NodeEntry.ofElement(node);
          break;
      }
      if (parent.type() == NodeType.ELEM) {
        if (context.isHidden(parent.node())) {
          continue;
        }
        context.checkWhen(parent.node());
      }
      result.addNodeUnique(parent);
    }
    set.replaceNodes(result.getNodes());
    set.sortAndClean();
  }

  /**
   * Replace the context nodes with their data parents.
   *
   * @param set the set
   * @param context the analysis
   * @param allDesc {@code true} if the step follows {@code //}
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context,
      final boolean allDesc) {
    if (allDesc) {
      SelfAxis.moveToSchema(set, context, true);
    }
    for (final SchemaEntry entry : set.takeSchemaContext()) {
      if (entry.getType().isRoot()) {
        set.addSchemaNode((SchemaNode) null, context.getRootType(), SchemaEntry.IN_CONTEXT);
      } else if (entry.getType() != NodeType.ELEM) {
        set.addSchemaNode(entry.getNode(), NodeType.ELEM, SchemaEntry.IN_CONTEXT);
      } else {
        final SchemaNode parent = SchemaTree.dataParent(entry.getNode());
        if (parent == null) {
          set.addSchemaNode((SchemaNode) null, context.getRootType(), SchemaEntry.IN_CONTEXT);
        } else {
          SchemaTree.addChild(context, set, parent);
        }
      }
    }
  }
}
