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
 * The self axis. Plain {@code .} keeps the set, the descendant form used by {@code //} adds every
 * element below the members.
 * </p>
 */
public final class SelfAxis {

  private SelfAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Move to self, or to self and all descendant elements.
   *
   * @param set the set
   * @param context the evaluation
   * @param allDesc {@code true} for descendant-or-self
   * @throws XPathException if the set is not a node-set
   * @throws UnresolvedDependencyException if a traversed node has an unresolved when
   */
  public static void moveTo(final XPathSet set, final XPathContext context, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    if (!AxisSupport.requireNodeSet(set, allDesc ? "descendant-or-self" : "self") || !allDesc) {
      return;
    }
    final XPathSet result = set.emptyCopy();
    result.clearNodes();
    for (final NodeEntry entry : set.getNodes()) {
      result.addNodeUnique(entry);
      if (entry.type() == NodeType.ELEM || entry.type().isRoot()) {
        addDescendants(context, entry, result);
      }
    }
    set.replaceNodes(result.getNodes());
    set.sortAndClean();
  }

  private static void addDescendants(final XPathContext context, final NodeEntry entry,
      final XPathSet result) throws UnresolvedDependencyException {
    for (final DataNode child : DataTree.children(context, entry)) {
      if (child.isDummy()) {
        continue;
      }
      context.checkWhen(child);
      final NodeEntry childEntry = NodeEntry.ofElement(child);
      if (result.addNodeUnique(childEntry)) {
        addDescendants(context, childEntry, result);
      }
    }
  }

  /**
   * Schema twin of {@link #moveTo(XPathSet, XPathContext, boolean)}; the context nodes stay in
   * context and all their descendants join them.
   *
   * @param set the set
   * @param context the analysis
   * @param allDesc {@code true} for descendant-or-self
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context,
      final boolean allDesc) {
    if (!allDesc) {
      return;
    }
    for (final SchemaEntry entry : set.getSchemaContext()) {
      if (entry.getType() == NodeType.ELEM || entry.getType().isRoot()) {
        addSchemaDescendants(context, set, entry.getNode());
      }
    }
  }

  private static void addSchemaDescendants(final SchemaContext context, final XPathSet set,
      final SchemaNode parent) {
    for (final SchemaNode child : SchemaTree.children(context, parent)) {
      if (SchemaTree.addChild(context, set, child)) {
        addSchemaDescendants(context, set, child);
      }
    }
  }
}
