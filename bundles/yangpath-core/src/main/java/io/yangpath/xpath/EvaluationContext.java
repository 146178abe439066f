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

import com.google.common.collect.Sets;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Module;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.parser.Expression;

/**
 * State shared by data evaluation and schema analysis of one expression.
 */
public abstract class EvaluationContext {

  protected final Expression expression;

  protected final Module localModule;

  protected final Set<XPathOption> options;

  protected final NodeType rootType;

  protected final ExpressionCompiler compiler;

  protected final XPathProperties properties;

  protected EvaluationContext(final Expression expression, final Module localModule,
      final Set<XPathOption> options, final NodeType rootType, final ExpressionCompiler compiler,
      final XPathProperties properties) {
    this.expression = checkNotNull(expression);
    this.localModule = checkNotNull(localModule);
    this.options = options.isEmpty() ? Set.of() : Sets.immutableEnumSet(options);
    this.rootType = checkNotNull(rootType);
    this.compiler = checkNotNull(compiler);
    this.properties = checkNotNull(properties);
  }

  public Expression getExpression() {
    return expression;
  }

  public Module getLocalModule() {
    return localModule;
  }

  public Set<XPathOption> getOptions() {
    return options;
  }

  public boolean hasOption(final XPathOption option) {
    return options.contains(option);
  }

  public NodeType getRootType() {
    return rootType;
  }

  public ExpressionCompiler getCompiler() {
    return compiler;
  }

  public XPathProperties getProperties() {
    return properties;
  }

  /**
   * Resolve a prefix: the prefix of the local module, then its imports, then module names.
   *
   * @param prefix the prefix
   * @return the module
   * @throws XPathException if no module matches
   */
  public Module resolveModule(final String prefix) throws XPathException {
    return resolveModule(localModule, prefix);
  }

  /**
   * Resolve a prefix relative to a module.
   *
   * @param module the module the prefix is used in
   * @param prefix the prefix
   * @return the module
   * @throws XPathException if no module matches
   */
  public static Module resolveModule(final Module module, final String prefix)
      throws XPathException {
    final Module found = findModule(module, prefix);
    if (found == null) {
      throw XPathError.UNKNOWN_PREFIX.newException(prefix);
    }
    return found;
  }

  /**
   * Look up the module of a prefix relative to a module.
   *
   * @param module the module the prefix is used in
   * @param prefix the prefix
   * @return the module or {@code null}
   */
  public static @Nullable Module findModule(final Module module, final String prefix) {
    if (module.getPrefix().equals(prefix)) {
      return module;
    }
    final Module imported = module.getImport(prefix);
    if (imported != null) {
      return imported;
    }
    return module.getContext().getModule(prefix);
  }

  static NodeType rootTypeOf(final NodeType contextType, final boolean config,
      final Set<XPathOption> options) {
    if (contextType == NodeType.ROOT_CONFIG) {
      return NodeType.ROOT_CONFIG;
    }
    if ((options.contains(XPathOption.WHEN) || options.contains(XPathOption.MUST)) && config) {
      return NodeType.ROOT_CONFIG;
    }
    return NodeType.ROOT;
  }
}
