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

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.DataNode;
import io.yangpath.api.LeafType;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * <p>
 * Abstract super class for all function classes.
 * </p>
 * <p>
 * Subclasses compute the value; the schema branch by default only folds the argument atoms into
 * the result, out of context. Argument checks of the schema branch go into
 * {@link #checkArguments(List, SchemaContext)}.
 * </p>
 */
public abstract class AbstractFunction implements Function {

  /** The function name. */
  private final String name;

  /**
   * Constructor.
   *
   * @param name the function name
   */
  protected AbstractFunction(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public void atomize(final List<XPathSet> args, final XPathSet set, final SchemaContext context)
      throws XPathException {
    checkArguments(args, context);
    set.clearSchemaContext();
    for (final XPathSet arg : args) {
      arg.clearSchemaContext();
      set.mergeSchema(arg);
    }
  }

  /**
   * Report arguments of unexpected kind or type. The in-context nodes of each argument are the
   * nodes it selects.
   *
   * @param args atomized arguments, context nodes still marked
   * @param context the analysis
   * @throws XPathException if an argument is invalid
   */
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context)
      throws XPathException {
  }

  /**
   * Create the error for an invalid argument.
   *
   * @param argNumber 1-based argument number
   * @param set the argument
   * @return the exception
   */
  protected XPathException invalidArgument(final int argNumber, final XPathSet set) {
    return XPathError.INVALID_ARGUMENT.newException(argNumber, name, set.describe());
  }

  /**
   * Check that an argument is a node-set.
   *
   * @param argNumber 1-based argument number
   * @param set the argument
   * @throws XPathException if the argument is a scalar
   */
  protected void requireNodeSet(final int argNumber, final XPathSet set) throws XPathException {
    if (!set.isNodeSet()) {
      throw invalidArgument(argNumber, set);
    }
  }

  /**
   * Get the first node of a node-set argument, in document order.
   *
   * @param argNumber 1-based argument number
   * @param set the argument
   * @return the node or {@code null} if the node-set is empty
   * @throws XPathException if the argument is a scalar
   */
  protected @Nullable NodeEntry firstNode(final int argNumber, final XPathSet set)
      throws XPathException {
    requireNodeSet(argNumber, set);
    set.sortAndClean();
    return set.getNodes().isEmpty() ? null : set.getNodes().get(0);
  }

  /**
   * Get the string of an optional argument, the context defaults to the set the function is
   * called on.
   *
   * @param args the arguments
   * @param set the context set
   * @return the string
   */
  protected static String stringArgOrContext(final List<XPathSet> args, final XPathSet set) {
    return args.isEmpty() ? set.asString() : args.get(0).asString();
  }

  /**
   * Get the leaf value behind an entry.
   *
   * @param entry the entry
   * @return the leaf, {@code null} if the entry is no leaf or leaf-list element or text
   */
  protected static @Nullable DataNode leafOf(final @Nullable NodeEntry entry) {
    if (entry == null || (entry.type() != NodeType.ELEM && entry.type() != NodeType.TEXT)) {
      return null;
    }
    return entry.node().getSchema().getKind().isLeaf() ? entry.node() : null;
  }

  /**
   * Find a type with the given base, looking into union members.
   *
   * @param type the declared type
   * @param base the wanted base type
   * @return the type or {@code null}
   */
  protected static @Nullable LeafType findType(final @Nullable LeafType type,
      final TypeBase base) {
    if (type == null) {
      return null;
    }
    if (type.getBase() == base) {
      return type;
    }
    if (type.getBase() == TypeBase.UNION) {
      for (final LeafType member : type.getUnionTypes()) {
        final LeafType found = findType(member, base);
        if (found != null) {
          return found;
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return name + "()";
  }
}
