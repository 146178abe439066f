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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.collect.ImmutableList;

import io.yangpath.api.DataNode;
import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.SchemaNodeKind;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.axis.SchemaTree;
import io.yangpath.xpath.expr.DataEvaluator;
import io.yangpath.xpath.expr.SchemaEvaluator;
import io.yangpath.xpath.parser.Expression;
import io.yangpath.xpath.parser.XPathParser;

/**
 * <h1>XPathEvaluator</h1>
 * <p>
 * Entry point of the evaluator: evaluates YANG XPath expressions over data trees and atomizes
 * them over schema trees. Parsed expressions are cached, an instance can be shared between
 * threads.
 * </p>
 *
 * <pre>
 * final XPathEvaluator evaluator = new XPathEvaluator();
 * final XPathResult result =
 *     evaluator.evaluate("count(interface[enabled = 'true'])", node, NodeType.ELEM, module,
 *         EnumSet.noneOf(XPathOption.class));
 * </pre>
 */
public final class XPathEvaluator implements ExpressionCompiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(XPathEvaluator.class);

  private final XPathProperties properties;

  private final DiagnosticListener listener;

  /** Parsed expressions by source. */
  private final Cache<String, Expression> expressions;

  /**
   * Create an evaluator with the default properties, warnings are logged.
   */
  public XPathEvaluator() {
    this(new XPathProperties());
  }

  /**
   * Create an evaluator, warnings are logged.
   *
   * @param properties the properties
   */
  public XPathEvaluator(final XPathProperties properties) {
    this(properties, new LoggingDiagnosticListener());
  }

  /**
   * Constructor.
   *
   * @param properties the properties
   * @param listener receiver of schema analysis warnings
   */
  public XPathEvaluator(final XPathProperties properties, final DiagnosticListener listener) {
    this.properties = checkNotNull(properties);
    this.listener = checkNotNull(listener);
    expressions =
        Caffeine.newBuilder().maximumSize(properties.getExpressionCacheSize()).build();
  }

  public XPathProperties getProperties() {
    return properties;
  }

  @Override
  public Expression compile(final String expression) throws XPathException {
    checkNotNull(expression);
    try {
      return expressions.get(expression, XPathEvaluator::parse);
    } catch (final CompletionException e) {
      if (e.getCause() instanceof final XPathException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private static Expression parse(final String expression) {
    LOGGER.debug("Compiling \"{}\".", expression);
    try {
      return XPathParser.parse(expression);
    } catch (final XPathException e) {
      throw new CompletionException(e);
    }
  }

  /**
   * Evaluate an expression over the data tree of the context node.
   *
   * @param expression the expression
   * @param contextNode the context node, any top-level node for root contexts
   * @param contextType axis type of the context node
   * @param module module the expression is defined in, resolves unprefixed names and prefixes
   * @param options evaluation restrictions
   * @return the value, or unresolved if a {@code when} dependency is still pending
   * @throws XPathException if the expression is invalid or cannot be evaluated
   */
  public XPathResult evaluate(final String expression, final DataNode contextNode,
      final NodeType contextType, final Module module, final Set<XPathOption> options)
      throws XPathException {
    final XPathContext context = new XPathContext(compile(expression), contextNode, contextType,
        module, options, this, properties, null);
    try {
      return XPathResult.of(new DataEvaluator(context).evaluate());
    } catch (final UnresolvedDependencyException e) {
      return XPathResult.unresolved(e.getNode());
    }
  }

  /**
   * Collect the schema nodes an expression can reach. With {@link XPathOption#WHEN} the context
   * of a condition on a choice, case or uses is the closest data ancestor, on an augment the
   * augmented node.
   *
   * @param expression the expression
   * @param contextNode the context schema node, {@code null} for the root
   * @param contextType axis type of the context node
   * @param module module the expression is defined in
   * @param options evaluation restrictions
   * @return the atoms and the effective context node
   * @throws XPathException if the expression is invalid
   */
  public SchemaAtoms atomize(final String expression, final @Nullable SchemaNode contextNode,
      final NodeType contextType, final Module module, final Set<XPathOption> options)
      throws XPathException {
    SchemaNode effective = contextNode;
    if (contextNode != null && options.contains(XPathOption.WHEN)) {
      effective = whenContext(contextNode);
    } else if (contextNode != null) {
      effective = SchemaTree.firstDataNode(contextNode);
    }
    final NodeType type = effective == null && !contextType.isRoot() ? NodeType.ROOT
        : contextType;
    final SchemaContext context = new SchemaContext(compile(expression), effective, type, module,
        options, this, properties, listener);
    return new SchemaAtoms(new SchemaEvaluator(context).atomize(), effective);
  }

  private static @Nullable SchemaNode whenContext(final SchemaNode node) {
    return switch (node.getKind()) {
      case AUGMENT -> SchemaTree.firstDataNode(node.getAugmentTarget());
      case CHOICE, CASE, USES -> SchemaTree.dataParent(node);
      default -> node;
    };
  }

  /**
   * Cast a set the way an evaluation with the given context would.
   *
   * @param set the set
   * @param target the target type
   * @param contextNode the context node of the evaluation
   * @param module module of the expression
   * @param options evaluation restrictions
   * @throws XPathException if a scalar is cast to a node-set
   */
  public void cast(final XPathSet set, final SetType target, final DataNode contextNode,
      final Module module, final Set<XPathOption> options) throws XPathException {
    checkNotNull(module);
    if (set.getType() == target) {
      return;
    }
    final NodeType rootType = EvaluationContext.rootTypeOf(NodeType.ELEM,
        contextNode.getSchema().isConfig(), options);
    if (target == SetType.STRING && set.isNodeSet() && rootType != set.getRootType()) {
      final XPathSet view = new XPathSet(set.getOrder(), properties.getHashThreshold(), rootType,
          rootType == NodeType.ROOT_CONFIG && properties.isStringConfigFilter());
      view.fill(set);
      view.cast(target);
      set.fill(view);
      return;
    }
    set.cast(target);
  }

  /**
   * Find the data nodes a path selects.
   *
   * @param contextNode the context node
   * @param path the path, prefixes resolved against the module of the context node
   * @return the selected elements in document order
   * @throws XPathException if the path is invalid or selects no node-set
   */
  public List<DataNode> findPath(final DataNode contextNode, final String path)
      throws XPathException {
    final XPathSet set = evaluate(path, contextNode, NodeType.ELEM,
        contextNode.getSchema().getModule(), EnumSet.noneOf(XPathOption.class)).getSet();
    if (!set.isNodeSet()) {
      throw XPathError.NOT_A_NODE_SET.newException("path", set.describe());
    }
    final ImmutableList.Builder<DataNode> nodes = ImmutableList.builder();
    for (final NodeEntry entry : set.getNodes()) {
      if (entry.type() == NodeType.ELEM) {
        nodes.add(entry.node());
      }
    }
    return nodes.build();
  }

  /**
   * Find all schema nodes an expression can reach.
   *
   * @param contextNode the context node
   * @param contextType axis type of the context node
   * @param expression the expression
   * @param options evaluation restrictions
   * @return the schema nodes in order of first use
   * @throws XPathException if the expression is invalid
   */
  public List<SchemaNode> findXPathAtoms(final SchemaNode contextNode, final NodeType contextType,
      final String expression, final Set<XPathOption> options) throws XPathException {
    return ImmutableList.copyOf(
        atomize(expression, contextNode, contextType, contextNode.getModule(), options)
            .getNodes());
  }

  /**
   * Atomize all {@code when} and {@code must} expressions of a schema node.
   *
   * @param node the node
   * @return the merged atoms, none of them in context
   * @throws XPathException if an expression is invalid
   */
  public XPathSet atomizeNode(final SchemaNode node) throws XPathException {
    return atomizeNode(node, false).set();
  }

  /**
   * Atomize all {@code when} and {@code must} expressions of a schema node and optionally mark
   * which data they need from outside the subtree. The subtree is the enclosing input, output or
   * notification, or the node itself elsewhere.
   *
   * @param node the node
   * @param markDependencies {@code true} to compute the dependency flags
   * @return the merged atoms, flags stay {@code false} unless requested
   * @throws XPathException if an expression is invalid
   */
  public NodeAtoms atomizeNode(final SchemaNode node, final boolean markDependencies)
      throws XPathException {
    final XPathSet result = new XPathSet();
    final boolean output = isUnder(node, SchemaNodeKind.OUTPUT);
    if (node.getWhen() != null) {
      final Set<XPathOption> options = EnumSet.of(XPathOption.WHEN);
      if (output) {
        options.add(XPathOption.OUTPUT);
      }
      mergeAtoms(result,
          atomize(node.getWhen(), node, NodeType.ELEM, node.getModule(), options).set());
    }
    for (final String must : node.getMusts()) {
      final Set<XPathOption> options = EnumSet.of(XPathOption.MUST);
      if (output) {
        options.add(XPathOption.OUTPUT);
      }
      mergeAtoms(result, atomize(must, node, NodeType.ELEM, node.getModule(), options).set());
    }
    if (!markDependencies) {
      return new NodeAtoms(result, false, false);
    }

    final SchemaNode operation = operationOf(node);
    final SchemaNode subtree = operation == null ? node : operation;
    boolean config = false;
    boolean state = false;
    for (final SchemaEntry entry : result.getSchemaEntries()) {
      final SchemaNode atom = entry.getNode();
      if (entry.getType() != NodeType.ELEM || atom == null
          || SchemaTree.isInSubtree(atom, subtree)) {
        continue;
      }
      if (atom.isConfig()) {
        config = true;
      } else {
        state = true;
      }
    }
    if (config || state) {
      LOGGER.debug("Conditions of \"{}\" depend on foreign data (config: {}, state: {}).",
          node.getName(), config, state);
    }
    return new NodeAtoms(result, config, state);
  }

  private static void mergeAtoms(final XPathSet result, final XPathSet atoms) {
    atoms.clearSchemaContext();
    result.mergeSchema(atoms);
  }

  /**
   * Collect the schema nodes the constraints of an operation or notification node depend on.
   *
   * @param node a node inside an input, output or notification
   * @param recursive {@code true} to include all descendants
   * @param noLocal {@code true} to drop nodes inside the same operation or notification
   * @return the atoms in order of first use
   * @throws XPathException if an expression is invalid
   */
  public List<SchemaNode> atomizeConstraints(final SchemaNode node, final boolean recursive,
      final boolean noLocal) throws XPathException {
    final SchemaNode operation = operationOf(node);
    checkArgument(operation != null, "Node \"%s\" is not part of an operation or notification.",
        node.getName());

    final Set<SchemaNode> atoms = new LinkedHashSet<>();
    final Deque<SchemaNode> pending = new ArrayDeque<>();
    pending.push(node);
    while (!pending.isEmpty()) {
      final SchemaNode current = pending.pop();
      final NodeAtoms nodeAtoms = atomizeNode(current, noLocal);
      if (noLocal && !nodeAtoms.isExternallyDependent()) {
        pushChildren(pending, current, recursive);
        continue;
      }
      for (final SchemaEntry entry : nodeAtoms.set().getSchemaEntries()) {
        final SchemaNode atom = entry.getNode();
        if (entry.getType() != NodeType.ELEM || atom == null) {
          continue;
        }
        if (noLocal && SchemaTree.isInSubtree(atom, operation)) {
          continue;
        }
        atoms.add(atom);
      }
      pushChildren(pending, current, recursive);
    }
    return ImmutableList.copyOf(atoms);
  }

  private static void pushChildren(final Deque<SchemaNode> pending, final SchemaNode node,
      final boolean recursive) {
    if (recursive) {
      final List<SchemaNode> children = node.getChildren();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
  }

  private static @Nullable SchemaNode operationOf(final SchemaNode node) {
    for (SchemaNode current = node; current != null;
        current = current.getKind() == SchemaNodeKind.AUGMENT ? current.getAugmentTarget()
            : current.getParent()) {
      switch (current.getKind()) {
        case INPUT:
        case OUTPUT:
        case NOTIFICATION:
          return current;
        default:
          break;
      }
    }
    return null;
  }

  private static boolean isUnder(final SchemaNode node, final SchemaNodeKind kind) {
    for (SchemaNode current = node; current != null;
        current = current.getKind() == SchemaNodeKind.AUGMENT ? current.getAugmentTarget()
            : current.getParent()) {
      if (current.getKind() == kind) {
        return true;
      }
    }
    return false;
  }

  /**
   * Parse all {@code when} and {@code must} expressions of a schema node.
   *
   * @param node the node
   * @throws XPathException if an expression is not well-formed
   */
  public void checkSyntax(final SchemaNode node) throws XPathException {
    if (node.getWhen() != null) {
      compile(node.getWhen());
    }
    for (final String must : node.getMusts()) {
      compile(must);
    }
  }

  /**
   * Evaluate the {@code when} condition of a data node.
   *
   * @param node the node
   * @return a boolean, or unresolved if the condition depends on an unresolved condition
   * @throws XPathException if the condition cannot be evaluated
   */
  public XPathResult evaluateWhen(final DataNode node) throws XPathException {
    final String when = node.getSchema().getWhen();
    checkArgument(when != null, "Node \"%s\" has no when condition.",
        node.getSchema().getName());
    final XPathResult result = evaluate(when, node, NodeType.ELEM, node.getSchema().getModule(),
        EnumSet.of(XPathOption.WHEN));
    if (!result.isUnresolved()) {
      result.getSet().cast(SetType.BOOLEAN);
    }
    return result;
  }

  /**
   * Evaluate the {@code must} conditions of a data node.
   *
   * @param node the node
   * @return the conditions that do not hold
   * @throws XPathException if a condition cannot be evaluated
   */
  public List<String> checkMusts(final DataNode node) throws XPathException {
    final ImmutableList.Builder<String> failed = ImmutableList.builder();
    for (final String must : node.getSchema().getMusts()) {
      final XPathSet set = evaluate(must, node, NodeType.ELEM, node.getSchema().getModule(),
          EnumSet.of(XPathOption.MUST)).getSet();
      if (!set.asBoolean()) {
        LOGGER.debug("Must \"{}\" does not hold for node \"{}\".", must,
            node.getSchema().getName());
        failed.add(must);
      }
    }
    return failed.build();
  }
}
