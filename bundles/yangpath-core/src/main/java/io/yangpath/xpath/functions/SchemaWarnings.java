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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.LeafType;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.TypeBase;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathSet;

/**
 * Type checks of the schema analysis. Each check inspects the in-context nodes of an atomized
 * operand and reports mismatches to the diagnostic listener; none of them fails the analysis.
 */
public final class SchemaWarnings {

  private static final Set<TypeBase> STRING_TYPES = EnumSet.of(TypeBase.STRING, TypeBase.BINARY,
      TypeBase.BITS, TypeBase.ENUMERATION, TypeBase.IDENTITYREF, TypeBase.INSTANCE_IDENTIFIER);

  private SchemaWarnings() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Warn about selected nodes that are no leaf or leaf-list.
   *
   * @param context the analysis
   * @param operand the atomized operand
   * @param what the consumer, for the message
   * @return {@code true} if all selected nodes are leaves
   */
  public static boolean checkLeaf(final SchemaContext context, final XPathSet operand,
      final String what) {
    boolean ok = true;
    for (final SchemaEntry entry : operand.getSchemaContext()) {
      if (entry.getType() == NodeType.ELEM && !entry.getNode().getKind().isLeaf()) {
        context.warn(entry.getNode(), "%s is a %s node \"%s\".", what,
            entry.getNode().getKind().name().toLowerCase(Locale.ROOT),
            entry.getNode().getName());
        ok = false;
      }
    }
    return ok;
  }

  /**
   * Warn about selected leaves not of a numeric type.
   *
   * @param context the analysis
   * @param operand the atomized operand
   * @param what the consumer, for the message
   */
  public static void checkNumeric(final SchemaContext context, final XPathSet operand,
      final String what) {
    if (!checkLeaf(context, operand, what)) {
      return;
    }
    for (final SchemaNode leaf : selectedLeaves(operand)) {
      if (!matchesType(leaf.getType(), EnumSet.noneOf(TypeBase.class), true)) {
        context.warn(leaf, "%s is node \"%s\", not of numeric type.", what, leaf.getName());
      }
    }
  }

  /**
   * Warn about selected leaves not of a string-like type.
   *
   * @param context the analysis
   * @param operand the atomized operand
   * @param what the consumer, for the message
   */
  public static void checkString(final SchemaContext context, final XPathSet operand,
      final String what) {
    if (!checkLeaf(context, operand, what)) {
      return;
    }
    for (final SchemaNode leaf : selectedLeaves(operand)) {
      if (!matchesType(leaf.getType(), STRING_TYPES, false)) {
        context.warn(leaf, "%s is node \"%s\", not of string-type.", what, leaf.getName());
      }
    }
  }

  /**
   * Warn about selected leaves not of one of the given types.
   *
   * @param context the analysis
   * @param operand the atomized operand
   * @param what the consumer, for the message
   * @param expected the accepted base types
   */
  public static void checkType(final SchemaContext context, final XPathSet operand,
      final String what, final Set<TypeBase> expected) {
    if (!checkLeaf(context, operand, what)) {
      return;
    }
    for (final SchemaNode leaf : selectedLeaves(operand)) {
      if (!matchesType(leaf.getType(), expected, false)) {
        context.warn(leaf, "%s is node \"%s\", not of type %s.", what, leaf.getName(),
            expected.toString().toLowerCase(Locale.ROOT));
      }
    }
  }

  private static List<SchemaNode> selectedLeaves(final XPathSet operand) {
    final List<SchemaNode> leaves = new ArrayList<>();
    for (final SchemaEntry entry : operand.getSchemaContext()) {
      if (entry.getType() == NodeType.ELEM) {
        leaves.add(entry.getNode());
      }
    }
    return leaves;
  }

  /**
   * Check a type, unions match if any member does.
   *
   * @param type the type, {@code null} if unknown
   * @param expected the accepted base types
   * @param numeric {@code true} to accept numeric types
   * @return {@code true} on a match
   */
  static boolean matchesType(final @Nullable LeafType type, final Set<TypeBase> expected,
      final boolean numeric) {
    if (type == null) {
      return true;
    }
    if (type.getBase() == TypeBase.UNION) {
      for (final LeafType member : type.getUnionTypes()) {
        if (matchesType(member, expected, numeric)) {
          return true;
        }
      }
      return false;
    }
    if (type.getBase() == TypeBase.LEAFREF && !expected.contains(TypeBase.LEAFREF)) {
      return true;
    }
    return expected.contains(type.getBase()) || (numeric && type.getBase().isNumeric());
  }

  /**
   * Warn if a literal compared with a leaf cannot be a value of the leaf type.
   *
   * @param context the analysis
   * @param operand the atomized node operand
   * @param literal the literal
   */
  public static void checkLiteralValue(final SchemaContext context, final XPathSet operand,
      final String literal) {
    for (final SchemaNode leaf : selectedLeaves(operand)) {
      final LeafType type = leaf.getType();
      if (!leaf.getKind().isLeaf() || type == null || fitsType(type, literal)) {
        continue;
      }
      context.warn(leaf, "Value \"%s\" does not fit the type of node \"%s\".", literal,
          leaf.getName());
    }
  }

  private static boolean fitsType(final LeafType type, final String literal) {
    final TypeBase base = type.getBase();
    if (base == TypeBase.UNION) {
      for (final LeafType member : type.getUnionTypes()) {
        if (fitsType(member, literal)) {
          return true;
        }
      }
      return false;
    }
    if (base.isInteger()) {
      try {
        return base.inRange(new BigInteger(literal.trim()));
      } catch (final NumberFormatException e) {
        return false;
      }
    }
    if (base == TypeBase.DECIMAL64) {
      try {
        new BigDecimal(literal.trim());
        return true;
      } catch (final NumberFormatException e) {
        return false;
      }
    }
    if (base == TypeBase.ENUMERATION) {
      return type.getEnums().containsKey(literal);
    }
    if (base == TypeBase.BOOLEAN) {
      return "true".equals(literal) || "false".equals(literal);
    }
    if (base == TypeBase.EMPTY) {
      return literal.isEmpty();
    }
    return true;
  }
}
