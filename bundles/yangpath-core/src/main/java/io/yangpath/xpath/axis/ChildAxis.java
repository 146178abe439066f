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
 * The child axis with a name test, the default step of a location path.
 * </p>
 */
public final class ChildAxis {

  private ChildAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Replace every member with its children matching the name test.
   *
   * @param set the set
   * @param context the evaluation
   * @param test the name test
   * @param allDesc {@code true} if the step follows {@code //}
   * @throws XPathException if the set is not a node-set or the prefix is unknown
   * @throws UnresolvedDependencyException if a matched child has an unresolved when
   */
  public static void moveTo(final XPathSet set, final XPathContext context, final NameTest test,
      final boolean allDesc) throws XPathException, UnresolvedDependencyException {
    final @Nullable Module module = test.resolve(context);
    if (!AxisSupport.requireNodeSet(set, "child step")) {
      return;
    }
    if (allDesc) {
      SelfAxis.moveTo(set, context, true);
    }
    final List<NodeEntry> result = new ArrayList<>();
    for (final NodeEntry entry : set.getNodes()) {
      final Module parentModule = DataTree.moduleOf(entry);
      for (final DataNode child : DataTree.children(context, entry)) {
        final SchemaNode schema = child.getSchema();
        if (test.matches(schema.getName(), schema.getModule(), module, context.getLocalModule(),
            parentModule)) {
          context.checkWhen(child);
          result.add(NodeEntry.ofElement(child));
        }
      }
    }
    final boolean sorted = set.getNodes().size() < 2;
    set.replaceNodes(result);
    if (!sorted) {
      set.sortAndClean();
    }
  }

  /**
   * Replace the context nodes with their schema children matching the name test. A name that
   * matches nothing is reported to the listener.
   *
   * @param set the set
   * @param context the analysis
   * @param test the name test
   * @param allDesc {@code true} if the step follows {@code //}
   * @throws XPathException if the prefix is unknown
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context,
      final NameTest test, final boolean allDesc) throws XPathException {
    final @Nullable Module module = test.resolve(context);
    if (allDesc) {
      SelfAxis.moveToSchema(set, context, true);
    }
    final List<SchemaEntry> from = set.takeSchemaContext();
    boolean found = false;
    for (final SchemaEntry entry : from) {
      if (entry.getType() != NodeType.ELEM && !entry.getType().isRoot()) {
        continue;
      }
      final SchemaNode parent = entry.getNode();
      final Module parentModule = parent == null ? null : parent.getModule();
      for (final SchemaNode child : SchemaTree.children(context, parent)) {
        if (test.matches(child.getName(), child.getModule(), module, context.getLocalModule(),
            parentModule) && SchemaTree.addChild(context, set, child)) {
          found = true;
        }
      }
    }
    if (!found && !from.isEmpty() && !test.isAnyName()) {
      context.warn(from.get(0).getNode(), "Schema node \"%s\" not found.", test);
    }
  }
}
