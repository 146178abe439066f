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

package io.yangpath.xpath.functions;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.DataNode;
import io.yangpath.api.LeafType;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.expr.DataEvaluator;
import io.yangpath.xpath.expr.SchemaEvaluator;
import io.yangpath.xpath.parser.Expression;

/**
 * <h1>FNDeref</h1>
 * <p>
 * {@code deref(node-set)}: the nodes the first node refers to. A leafref selects the nodes of
 * its path whose value equals the leaf value, an instance-identifier the nodes its value selects.
 * </p>
 */
public class FNDeref extends AbstractFunction {

  public FNDeref() {
    super("deref");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) throws XPathException, UnresolvedDependencyException {
    final @Nullable DataNode leaf = leafOf(firstNode(1, args.get(0)));
    set.clearNodes();
    if (leaf == null || leaf.getValue() == null) {
      return;
    }
    final LeafType declared = leaf.getSchema().getType();
    final LeafType leafref = findType(declared, TypeBase.LEAFREF);
    if (leafref != null && leafref.getPath() != null) {
      final XPathSet targets = evaluate(context, leafref.getPath(), leaf);
      for (final NodeEntry target : targets.getNodes()) {
        if (target.type() == NodeType.ELEM && leaf.getValue().equals(targets.stringValue(target))) {
          set.addNode(target);
        }
      }
    } else if (findType(declared, TypeBase.INSTANCE_IDENTIFIER) != null) {
      for (final NodeEntry target : evaluate(context, leaf.getValue(), leaf).getNodes()) {
        if (target.type() == NodeType.ELEM) {
          set.addNode(target);
        }
      }
    }
    set.sortAndClean();
  }

  private static XPathSet evaluate(final XPathContext context, final String path,
      final DataNode leaf) throws XPathException, UnresolvedDependencyException {
    final Expression expression = context.getCompiler().compile(path);
    final XPathSet result = new DataEvaluator(
        context.nested(expression, leaf, leaf.getSchema().getModule(), context.getOptions()))
            .evaluate();
    if (!result.isNodeSet()) {
      result.clearNodes();
    }
    return result;
  }

  @Override
  public void atomize(final List<XPathSet> args, final XPathSet set,
      final SchemaContext context) throws XPathException {
    final List<SchemaNode> leafrefs = new ArrayList<>();
    for (final SchemaEntry entry : args.get(0).getSchemaContext()) {
      if (entry.getType() == NodeType.ELEM && entry.getNode().getKind().isLeaf()) {
        final LeafType type = findType(entry.getNode().getType(), TypeBase.LEAFREF);
        if (type != null && type.getPath() != null) {
          leafrefs.add(entry.getNode());
        }
      }
    }
    super.atomize(args, set, context);
    for (final SchemaNode leaf : leafrefs) {
      final String path = findType(leaf.getType(), TypeBase.LEAFREF).getPath();
      final Expression expression = context.getCompiler().compile(path);
      set.mergeSchema(
          new SchemaEvaluator(context.nested(expression, leaf, leaf.getModule())).atomize());
    }
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    SchemaWarnings.checkType(context, args.get(0), "Argument #1 of deref()",
        EnumSet.of(TypeBase.LEAFREF, TypeBase.INSTANCE_IDENTIFIER));
  }
}
