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

package io.yangpath.xpath.operators;

import java.util.EnumMap;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.parser.TokenType;

/**
 * <h1>OpKind</h1>
 * <p>
 * Enumeration for the arithmetic operators. Operands are converted to numbers, {@code mod}
 * keeps the sign of the dividend.
 * </p>
 */
public enum OpKind {

  /** Addition. */
  PLUS("+") {
    @Override
    public double calculate(final double operand1, final double operand2) {
      return operand1 + operand2;
    }
  },

  /** Subtraction. */
  MINUS("-") {
    @Override
    public double calculate(final double operand1, final double operand2) {
      return operand1 - operand2;
    }
  },

  /** Multiplication. */
  STAR("*") {
    @Override
    public double calculate(final double operand1, final double operand2) {
      return operand1 * operand2;
    }
  },

  /** Division. */
  DIV("div") {
    @Override
    public double calculate(final double operand1, final double operand2) {
      return operand1 / operand2;
    }
  },

  /** Remainder of a truncating division. */
  MOD("mod") {
    @Override
    public double calculate(final double operand1, final double operand2) {
      return operand1 % operand2;
    }
  };

  private static final Map<TokenType, OpKind> TOKEN_TO_ENUM = new EnumMap<>(TokenType.class);

  static {
    TOKEN_TO_ENUM.put(TokenType.PLUS, PLUS);
    TOKEN_TO_ENUM.put(TokenType.MINUS, MINUS);
    TOKEN_TO_ENUM.put(TokenType.STAR, STAR);
    TOKEN_TO_ENUM.put(TokenType.DIV, DIV);
    TOKEN_TO_ENUM.put(TokenType.MOD, MOD);
  }

  private final String opAsString;

  OpKind(final String opAsString) {
    this.opAsString = opAsString;
  }

  /**
   * Apply the operator.
   *
   * @param operand1 first operand
   * @param operand2 second operand
   * @return the result
   */
  public abstract double calculate(final double operand1, final double operand2);

  /**
   * Apply the operator to two values and store the number in {@code left}.
   *
   * @param left first operand, receives the result
   * @param right second operand
   */
  public void apply(final XPathSet left, final XPathSet right) {
    left.setNumber(calculate(left.asNumber(), right.asNumber()));
  }

  /**
   * Get the operator of a token.
   *
   * @param token the token type
   * @return the operator or {@code null} if the token is no arithmetic operator
   */
  public static @Nullable OpKind fromToken(final TokenType token) {
    return TOKEN_TO_ENUM.get(token);
  }

  @Override
  public String toString() {
    return opAsString;
  }
}
