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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yangpath.api.DataNode;
import io.yangpath.api.Module;
import io.yangpath.api.WhenStatus;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.xpath.parser.Expression;

/**
 * State of one evaluation against a data tree.
 */
public final class XPathContext extends EvaluationContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(XPathContext.class);

  /** The original context node, returned by {@code current()}. */
  private final DataNode contextNode;

  private final NodeType contextType;

  private final DocumentOrder order;

  /**
   * Constructor.
   *
   * @param expression the evaluated expression
   * @param contextNode the context node, the first top-level node for root contexts
   * @param contextType axis type of the context node
   * @param localModule module the expression is defined in
   * @param options evaluation restrictions
   * @param compiler compiler for nested expressions
   * @param properties evaluator properties
   * @param order document order of the tree, {@code null} to create one
   */
  public XPathContext(final Expression expression, final DataNode contextNode,
      final NodeType contextType, final Module localModule, final Set<XPathOption> options,
      final ExpressionCompiler compiler, final XPathProperties properties,
      final @Nullable DocumentOrder order) {
    super(expression, localModule, options,
        rootTypeOf(contextType, contextNode.getSchema().isConfig(), options), compiler,
        properties);
    this.contextNode = checkNotNull(contextNode);
    this.contextType = checkNotNull(contextType);
    this.order = order == null ? new DocumentOrder(treeRootOf(contextNode)) : order;
  }

  /**
   * Find the first top-level node of the tree a node belongs to.
   *
   * @param node any node of the tree
   * @return the first top-level sibling
   */
  public static DataNode treeRootOf(final DataNode node) {
    DataNode top = node;
    while (top.getParent() != null) {
      top = top.getParent();
    }
    while (top.getPreviousSibling() != null) {
      top = top.getPreviousSibling();
    }
    return top;
  }

  /**
   * Create the context of a nested evaluation on the same tree.
   *
   * @param nested the nested expression
   * @param nestedContextNode its context node
   * @param module its local module
   * @param nestedOptions its options
   * @return the context
   */
  public XPathContext nested(final Expression nested, final DataNode nestedContextNode,
      final Module module, final Set<XPathOption> nestedOptions) {
    return new XPathContext(nested, nestedContextNode, NodeType.ELEM, module, nestedOptions,
        compiler, properties, order);
  }

  public DataNode getContextNode() {
    return contextNode;
  }

  public NodeType getContextType() {
    return contextType;
  }

  public DocumentOrder getOrder() {
    return order;
  }

  public DataNode getTreeRoot() {
    return order.getRoot();
  }

  /**
   * Create an empty set for this evaluation.
   *
   * @return the set
   */
  public XPathSet newSet() {
    return new XPathSet(order, properties.getHashThreshold(), rootType,
        properties.isStringConfigFilter());
  }

  public NodeEntry rootEntry() {
    return new NodeEntry(rootType, order.getRoot(), null);
  }

  /**
   * Get the entry of the original context node.
   *
   * @return the entry
   */
  public NodeEntry contextEntry() {
    return switch (contextType) {
      case ROOT, ROOT_CONFIG -> rootEntry();
      case TEXT -> NodeEntry.ofText(contextNode);
      default -> NodeEntry.ofElement(contextNode);
    };
  }

  /**
   * Determines if a node is hidden by the configuration root restriction.
   *
   * @param node the node
   * @return {@code true} for state nodes below a configuration root
   */
  public boolean isHidden(final DataNode node) {
    return rootType == NodeType.ROOT_CONFIG && !node.getSchema().isConfig();
  }

  /**
   * Signal an unresolved dependency when evaluating a {@code when} condition and the node's own
   * condition is still pending.
   *
   * @param node a node the evaluation reached
   * @throws UnresolvedDependencyException if the node's condition is unresolved
   */
  public void checkWhen(final DataNode node) throws UnresolvedDependencyException {
    if (hasOption(XPathOption.WHEN) && node.getWhenStatus() == WhenStatus.UNRESOLVED) {
      LOGGER.debug("\"{}\" depends on node \"{}\" with an unresolved when.",
          expression.getSource(), node.getSchema().getName());
      throw new UnresolvedDependencyException(node);
    }
  }
}
