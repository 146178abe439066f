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

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.SchemaNode;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
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
import io.yangpath.xpath.functions.FuncDef;
import io.yangpath.xpath.functions.SchemaWarnings;
import io.yangpath.xpath.operators.OpKind;

/**
 * <p>
 * Collects the schema nodes an expression can reach without any data. Every operand is
 * evaluated, nothing short-circuits, and values are never computed: the result set holds all
 * touched schema nodes, those the expression selects marked as context nodes.
 * </p>
 * <p>
 * Type mismatches between operands and their consumers are reported as warnings.
 * </p>
 */
public final class SchemaEvaluator extends AbstractEvaluator<SchemaContext> {

  /**
   * Constructor.
   *
   * @param context the analysis context
   */
  public SchemaEvaluator(final SchemaContext context) {
    super(context);
  }

  /**
   * Atomize the expression starting from the context node.
   *
   * @return the schema node-set
   * @throws XPathException if the expression is invalid
   */
  public XPathSet atomize() throws XPathException {
    final XPathSet set = context.newSet();
    final SchemaNode node = context.getContextNode();
    if (node == null || context.getContextType().isRoot()) {
      set.addSchemaNode((SchemaNode) null, context.getRootType(), SchemaEntry.IN_CONTEXT);
    } else {
      set.addSchemaNode(node, NodeType.ELEM, SchemaEntry.IN_CONTEXT);
    }
    try {
      evaluate(set);
    } catch (final UnresolvedDependencyException e) {
      throw new IllegalStateException("Schema analysis reached a data node.", e);
    }
    return set;
  }

  @Override
  protected void toBoolean(final XPathSet set) {
    set.clearSchemaContext();
  }

  @Override
  protected boolean isDecided(final XPathSet set, final boolean or) {
    return false;
  }

  @Override
  protected void combineLogic(final XPathSet set, final XPathSet operand) {
    operand.clearSchemaContext();
    set.mergeSchema(operand);
  }

  @Override
  protected void compare(final XPathSet set, final XPathSet operand, final CompKind kind,
      final @Nullable String leftLiteral, final @Nullable String rightLiteral) {
    final String what = "Operand of \"" + kind + "\"";
    if (kind.isEquality()) {
      SchemaWarnings.checkLeaf(context, set, what);
      SchemaWarnings.checkLeaf(context, operand, what);
    } else {
      SchemaWarnings.checkNumeric(context, set, what);
      SchemaWarnings.checkNumeric(context, operand, what);
    }
    if (rightLiteral != null) {
      SchemaWarnings.checkLiteralValue(context, set, rightLiteral);
    }
    if (leftLiteral != null) {
      SchemaWarnings.checkLiteralValue(context, operand, leftLiteral);
    }
    mergeOperands(set, operand);
  }

  @Override
  protected void arithmetic(final XPathSet set, final XPathSet operand, final OpKind op) {
    final String what = "Operand of \"" + op + "\"";
    SchemaWarnings.checkNumeric(context, set, what);
    SchemaWarnings.checkNumeric(context, operand, what);
    mergeOperands(set, operand);
  }

  private static void mergeOperands(final XPathSet set, final XPathSet operand) {
    operand.clearSchemaContext();
    set.clearSchemaContext();
    set.mergeSchema(operand);
  }

  @Override
  protected void negate(final XPathSet set) {
    SchemaWarnings.checkNumeric(context, set, "Operand of unary \"-\"");
    set.clearSchemaContext();
  }

  @Override
  protected void union(final XPathSet set, final XPathSet operand) {
    UnionAxis.moveToSchema(set, operand);
  }

  @Override
  protected void literal(final XPathSet set, final String value) {
    set.clearSchemaContext();
  }

  @Override
  protected void number(final XPathSet set, final double value) {
    set.clearSchemaContext();
  }

  @Override
  protected void root(final XPathSet set) {
    RootAxis.moveToSchema(set, context);
  }

  @Override
  protected void self(final XPathSet set, final boolean allDesc) {
    SelfAxis.moveToSchema(set, context, allDesc);
  }

  @Override
  protected void parent(final XPathSet set, final boolean allDesc) {
    ParentAxis.moveToSchema(set, context, allDesc);
  }

  @Override
  protected void child(final XPathSet set, final NameTest test, final boolean allDesc)
      throws XPathException {
    ChildAxis.moveToSchema(set, context, test, allDesc);
  }

  @Override
  protected void attribute(final XPathSet set, final NameTest test, final boolean allDesc)
      throws XPathException {
    AttributeAxis.moveToSchema(set, context, test);
  }

  @Override
  protected void nodeType(final XPathSet set, final String nodeType, final boolean attribute,
      final boolean allDesc) {
    NodeTypeAxis.moveToSchema(set, context, nodeType, attribute, allDesc);
  }

  /**
   * Atomize the predicate once per context node, with that node as the only context node. The
   * other context nodes are parked under a fresh marker meanwhile, so nested predicates keep
   * their own.
   */
  @Override
  protected void filter(final XPathSet set, final int start, final boolean step)
      throws XPathException, UnresolvedDependencyException {
    final int parked = set.newContextMarker();
    set.remark(SchemaEntry.IN_CONTEXT, parked);
    for (int i = 0; i < set.getSchemaEntries().size(); i++) {
      if (set.getSchemaEntries().get(i).getMarker() != parked) {
        continue;
      }
      set.mark(i, SchemaEntry.IN_CONTEXT);
      final XPathSet candidate = set.copy();
      evalPredicateExpr(start, candidate);
      set.mark(i, parked);
      set.mergeSchema(candidate);
    }
    set.remark(SchemaEntry.IN_CONTEXT, SchemaEntry.NOT_IN_CONTEXT);
    set.remark(parked, SchemaEntry.IN_CONTEXT);
  }

  @Override
  protected void call(final FuncDef function, final List<XPathSet> args, final XPathSet set)
      throws XPathException {
    function.getFunction().atomize(args, set, context);
  }
}
