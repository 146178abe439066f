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

package io.yangpath.xpath.comparators;

import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>GeneralComp</h1>
 * <p>
 * XPath 1.0 comparison of two values. A node-set compares true if any of its members does; a
 * node-set compared with a boolean is converted to a boolean first.
 * </p>
 */
public final class GeneralComp {

  private GeneralComp() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Compare two values and store the boolean result in {@code left}.
   *
   * @param left first operand, receives the result
   * @param right second operand
   * @param kind the comparison
   */
  public static void compare(final XPathSet left, final XPathSet right, final CompKind kind) {
    left.setBoolean(evaluate(left, right, kind));
  }

  /**
   * Compare two values.
   *
   * @param left first operand
   * @param right second operand
   * @param kind the comparison
   * @return result of the comparison
   */
  public static boolean evaluate(final XPathSet left, final XPathSet right, final CompKind kind) {
    if (left.isNodeSet() && right.isNodeSet()) {
      for (final NodeEntry leftNode : left.getNodes()) {
        final Atom leftAtom = Atom.of(left.stringValue(leftNode));
        for (final NodeEntry rightNode : right.getNodes()) {
          if (compare(leftAtom, Atom.of(right.stringValue(rightNode)), kind)) {
            return true;
          }
        }
      }
      return false;
    }
    if (left.isNodeSet()) {
      final Atom rightAtom = Atom.of(right);
      if (rightAtom.type == SetType.BOOLEAN) {
        return compare(Atom.of(left.asBoolean()), rightAtom, kind);
      }
      for (final NodeEntry node : left.getNodes()) {
        if (compare(Atom.of(left.stringValue(node)), rightAtom, kind)) {
          return true;
        }
      }
      return false;
    }
    if (right.isNodeSet()) {
      final Atom leftAtom = Atom.of(left);
      if (leftAtom.type == SetType.BOOLEAN) {
        return compare(leftAtom, Atom.of(right.asBoolean()), kind);
      }
      for (final NodeEntry node : right.getNodes()) {
        if (compare(leftAtom, Atom.of(right.stringValue(node)), kind)) {
          return true;
        }
      }
      return false;
    }
    return compare(Atom.of(left), Atom.of(right), kind);
  }

  private static boolean compare(final Atom left, final Atom right, final CompKind kind) {
    if (!kind.isEquality()) {
      return kind.compare(left.asNumber(), right.asNumber());
    }
    if (left.type == SetType.BOOLEAN || right.type == SetType.BOOLEAN) {
      return kind.compare(left.asBoolean(), right.asBoolean());
    }
    if (left.type == SetType.NUMBER || right.type == SetType.NUMBER) {
      return kind.compare(left.asNumber(), right.asNumber());
    }
    return kind.compare(left.asString(), right.asString());
  }

  /** A scalar operand. */
  private static final class Atom {

    private final SetType type;

    private final boolean bool;

    private final double number;

    private final String string;

    private Atom(final SetType type, final boolean bool, final double number,
        final String string) {
      this.type = type;
      this.bool = bool;
      this.number = number;
      this.string = string;
    }

    static Atom of(final String value) {
      return new Atom(SetType.STRING, false, 0d, value);
    }

    static Atom of(final boolean value) {
      return new Atom(SetType.BOOLEAN, value, 0d, "");
    }

    static Atom of(final XPathSet set) {
      return switch (set.getType()) {
        case BOOLEAN -> of(set.getBoolean());
        case NUMBER -> new Atom(SetType.NUMBER, false, set.getNumber(), "");
        default -> of(set.asString());
      };
    }

    boolean asBoolean() {
      return switch (type) {
        case BOOLEAN -> bool;
        case NUMBER -> number != 0d && !Double.isNaN(number);
        default -> !string.isEmpty();
      };
    }

    double asNumber() {
      return switch (type) {
        case BOOLEAN -> bool ? 1d : 0d;
        case NUMBER -> number;
        default -> XPathSet.parseNumber(string);
      };
    }

    String asString() {
      return switch (type) {
        case BOOLEAN -> Boolean.toString(bool);
        case NUMBER -> XPathSet.formatNumber(number);
        default -> string;
      };
    }
  }
}
