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

import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.YangContext;
import io.yangpath.xpath.parser.Expression;

/**
 * State of one schema analysis.
 */
public final class SchemaContext extends EvaluationContext {

  /** The original context node, {@code null} for the root. */
  private final @Nullable SchemaNode contextNode;

  private final NodeType contextType;

  private final DiagnosticListener listener;

  /**
   * Constructor.
   *
   * @param expression the analyzed expression
   * @param contextNode the context node, {@code null} for the root
   * @param contextType axis type of the context node
   * @param localModule module the expression is defined in
   * @param options evaluation restrictions
   * @param compiler compiler for nested expressions
   * @param properties evaluator properties
   * @param listener receiver of warnings
   */
  public SchemaContext(final Expression expression, final @Nullable SchemaNode contextNode,
      final NodeType contextType, final Module localModule, final Set<XPathOption> options,
      final ExpressionCompiler compiler, final XPathProperties properties,
      final DiagnosticListener listener) {
    super(expression, localModule, options,
        rootTypeOf(contextType, contextNode != null && contextNode.isConfig(), options),
        compiler, properties);
    this.contextNode = contextNode;
    this.contextType = checkNotNull(contextType);
    this.listener = checkNotNull(listener);
  }

  /**
   * Create the context of a nested analysis.
   *
   * @param nested the nested expression
   * @param nestedContextNode its context node
   * @param module its local module
   * @return the context
   */
  public SchemaContext nested(final Expression nested, final SchemaNode nestedContextNode,
      final Module module) {
    return new SchemaContext(nested, nestedContextNode, NodeType.ELEM, module, options, compiler,
        properties, listener);
  }

  public @Nullable SchemaNode getContextNode() {
    return contextNode;
  }

  public NodeType getContextType() {
    return contextType;
  }

  public YangContext getYangContext() {
    return localModule.getContext();
  }

  /**
   * Create an empty set for this analysis.
   *
   * @return the set
   */
  public XPathSet newSet() {
    return new XPathSet(null, properties.getHashThreshold(), rootType, false);
  }

  /**
   * Report a warning.
   *
   * @param node the node the warning is about
   * @param format message format
   * @param args message arguments
   */
  public void warn(final @Nullable SchemaNode node, final String format, final Object... args) {
    listener.warning(new Diagnostic(String.format(format, args), expression.getSource(), node));
  }
}
