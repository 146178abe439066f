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

import java.util.EnumMap;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.parser.TokenType;

/**
 * <h1>CompKind</h1>
 * <p>
 * Enumeration for all comparison kinds. Equality compares booleans, numbers or strings,
 * relational comparisons always compare numbers.
 * </p>
 */
public enum CompKind {

  /** comparison type 'equal'. */
  EQ("=") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 == operand2;
    }

    @Override
    public boolean compare(final String operand1, final String operand2) {
      return operand1.equals(operand2);
    }

    @Override
    public boolean compare(final boolean operand1, final boolean operand2) {
      return operand1 == operand2;
    }
  },

  /** comparison type 'not equal'. */
  NE("!=") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 != operand2;
    }

    @Override
    public boolean compare(final String operand1, final String operand2) {
      return !operand1.equals(operand2);
    }

    @Override
    public boolean compare(final boolean operand1, final boolean operand2) {
      return operand1 != operand2;
    }
  },

  /** comparison type 'less than'. */
  LT("<") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 < operand2;
    }
  },

  /** comparison type 'less or equal than'. */
  LE("<=") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 <= operand2;
    }
  },

  /** comparison type 'greater than'. */
  GT(">") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 > operand2;
    }
  },

  /** comparison type 'greater or equal than'. */
  GE(">=") {
    @Override
    public boolean compare(final double operand1, final double operand2) {
      return operand1 >= operand2;
    }
  };

  private static final Map<TokenType, CompKind> TOKEN_TO_ENUM = new EnumMap<>(TokenType.class);

  static {
    TOKEN_TO_ENUM.put(TokenType.EQ, EQ);
    TOKEN_TO_ENUM.put(TokenType.N_EQ, NE);
    TOKEN_TO_ENUM.put(TokenType.LT, LT);
    TOKEN_TO_ENUM.put(TokenType.LE, LE);
    TOKEN_TO_ENUM.put(TokenType.GT, GT);
    TOKEN_TO_ENUM.put(TokenType.GE, GE);
  }

  /** String representation of the operator. */
  private final String compAsString;

  CompKind(final String compAsString) {
    this.compAsString = compAsString;
  }

  /**
   * Compares two numbers.
   *
   * @param operand1 first operand
   * @param operand2 second operand
   * @return result of the comparison
   */
  public abstract boolean compare(final double operand1, final double operand2);

  /**
   * Compares two strings, relational kinds compare their numeric values.
   *
   * @param operand1 first operand
   * @param operand2 second operand
   * @return result of the comparison
   */
  public boolean compare(final String operand1, final String operand2) {
    return compare(XPathSet.parseNumber(operand1),
        XPathSet.parseNumber(operand2));
  }

  /**
   * Compares two booleans, relational kinds compare them as {@code 1} and {@code 0}.
   *
   * @param operand1 first operand
   * @param operand2 second operand
   * @return result of the comparison
   */
  public boolean compare(final boolean operand1, final boolean operand2) {
    return compare(operand1 ? 1d : 0d, operand2 ? 1d : 0d);
  }

  public boolean isEquality() {
    return this == EQ || this == NE;
  }

  /**
   * Get the comparison of an operator token.
   *
   * @param token the token type
   * @return the comparison or {@code null} if the token is no comparison
   */
  public static @Nullable CompKind fromToken(final TokenType token) {
    return TOKEN_TO_ENUM.get(token);
  }

  @Override
  public String toString() {
    return compAsString;
  }
}
