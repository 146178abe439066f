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

package io.yangpath.xpath.expr;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;

import io.yangpath.api.DataNode;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.axis.AttributeAxis;
import io.yangpath.xpath.axis.ChildAxis;
import io.yangpath.xpath.axis.NameTest;
import io.yangpath.xpath.axis.NodeTypeAxis;
import io.yangpath.xpath.axis.ParentAxis;
import io.yangpath.xpath.axis.RootAxis;
import io.yangpath.xpath.axis.SelfAxis;
import io.yangpath.xpath.axis.UnionAxis;
import io.yangpath.xpath.comparators.CompKind;
import io.yangpath.xpath.comparators.GeneralComp;
import io.yangpath.xpath.functions.FuncDef;
import io.yangpath.xpath.operators.OpKind;

/**
 * <p>
 * Evaluates an expression over a data tree following XPath 1.0 with the YANG context rules.
 * </p>
 */
public final class DataEvaluator extends AbstractEvaluator<XPathContext> {

  /** Group of the nodes without a parent element. */
  private static final Object TOP_LEVEL = new Object();

  /**
   * Constructor.
   *
   * @param context the evaluation context
   */
  public DataEvaluator(final XPathContext context) {
    super(context);
  }

  /**
   * Evaluate the expression with the context node as the only member of the initial set.
   *
   * @return the result
   * @throws XPathException if the evaluation fails
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  public XPathSet evaluate() throws XPathException, UnresolvedDependencyException {
    final XPathSet set = context.newSet();
    set.setSingleNode(context.contextEntry());
    set.setContext(1, 1);
    evaluate(set);
    return set;
  }

  @Override
  protected void toBoolean(final XPathSet set) throws XPathException {
    set.cast(SetType.BOOLEAN);
  }

  @Override
  protected boolean isDecided(final XPathSet set, final boolean or) {
    return set.getBoolean() == or;
  }

  @Override
  protected void combineLogic(final XPathSet set, final XPathSet operand) {
    set.setBoolean(operand.asBoolean());
  }

  @Override
  protected void compare(final XPathSet set, final XPathSet operand, final CompKind kind,
      final @Nullable String leftLiteral, final @Nullable String rightLiteral) {
    GeneralComp.compare(set, operand, kind);
  }

  @Override
  protected void arithmetic(final XPathSet set, final XPathSet operand, final OpKind op) {
    op.apply(set, operand);
  }

  @Override
  protected void negate(final XPathSet set) {
    set.setNumber(-set.asNumber());
  }

  @Override
  protected void union(final XPathSet set, final XPathSet operand) throws XPathException {
    UnionAxis.moveTo(set, operand);
  }

  @Override
  protected void literal(final XPathSet set, final String value) {
    set.setString(value);
  }

  @Override
  protected void number(final XPathSet set, final double value) {
    set.setNumber(value);
  }

  @Override
  protected void root(final XPathSet set) {
    RootAxis.moveTo(set, context);
  }

  @Override
  protected void self(final XPathSet set, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    SelfAxis.moveTo(set, context, allDesc);
  }

  @Override
  protected void parent(final XPathSet set, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    ParentAxis.moveTo(set, context, allDesc);
  }

  @Override
  protected void child(final XPathSet set, final NameTest test, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    ChildAxis.moveTo(set, context, test, allDesc);
  }

  @Override
  protected void attribute(final XPathSet set, final NameTest test, final boolean allDesc)
      throws XPathException, UnresolvedDependencyException {
    AttributeAxis.moveTo(set, context, test, allDesc);
  }

  @Override
  protected void nodeType(final XPathSet set, final String nodeType, final boolean attribute,
      final boolean allDesc) throws XPathException, UnresolvedDependencyException {
    NodeTypeAxis.moveTo(set, context, nodeType, attribute, allDesc);
  }

  @Override
  protected void filter(final XPathSet set, final int start, final boolean step)
      throws XPathException, UnresolvedDependencyException {
    switch (set.getType()) {
      case EMPTY:
        return;
      case NODE_SET:
        filterNodes(set, start, step);
        return;
      default:
        final XPathSet candidate = set.copy();
        evalPredicateExpr(start, candidate);
        if (!candidate.asBoolean()) {
          set.setEmpty();
        }
    }
  }

  /**
   * Keep the nodes the predicate holds for. Step predicates count positions among the nodes
   * sharing a parent, with the group size taken before any node is removed.
   */
  private void filterNodes(final XPathSet set, final int start, final boolean step)
      throws XPathException, UnresolvedDependencyException {
    final List<NodeEntry> nodes = new ArrayList<>(set.getNodes());
    final int size = nodes.size();
    if (size == 0) {
      return;
    }
    final int[] positions = new int[size];
    final int[] sizes = new int[size];
    if (step) {
      final Reference2IntOpenHashMap<Object> groupSizes = new Reference2IntOpenHashMap<>();
      for (final NodeEntry node : nodes) {
        groupSizes.addTo(groupOf(node), 1);
      }
      final Reference2IntOpenHashMap<Object> seen = new Reference2IntOpenHashMap<>();
      for (int i = 0; i < size; i++) {
        final Object group = groupOf(nodes.get(i));
        positions[i] = seen.addTo(group, 1) + 1;
        sizes[i] = groupSizes.getInt(group);
      }
    } else {
      for (int i = 0; i < size; i++) {
        positions[i] = i + 1;
        sizes[i] = size;
      }
    }

    final boolean[] keep = new boolean[size];
    for (int i = 0; i < size; i++) {
      final XPathSet candidate = set.emptyCopy();
      candidate.setSingleNode(nodes.get(i));
      candidate.setContext(positions[i], sizes[i]);
      evalPredicateExpr(start, candidate);
      if (candidate.getType() == SetType.NUMBER) {
        keep[i] = candidate.getNumber() == positions[i];
      } else {
        keep[i] = candidate.asBoolean();
      }
    }
    set.retain(keep);
  }

  private static Object groupOf(final NodeEntry node) {
    switch (node.type()) {
      case ELEM:
        final DataNode parent = node.node().getParent();
        return parent == null ? TOP_LEVEL : parent;
      case TEXT:
      case ATTR:
        return node.node();
      default:
        return node;
    }
  }

  @Override
  protected void call(final FuncDef function, final List<XPathSet> args, final XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    function.getFunction().evaluate(args, set, context);
  }
}
