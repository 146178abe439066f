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

package io.yangpath.xpath.parser;

/**
 * Types of tokens produced by the {@link XPathScanner}.
 */
public enum TokenType {
  /** Token type that represents a left parenthesis. */
  OPEN_BR("("),
  /** Token type that represents a right parenthesis. */
  CLOSE_BR(")"),
  /** Token type that represents an opening squared bracket. */
  OPEN_SQP("["),
  /** Token type that represents a closing squared bracket. */
  CLOSE_SQP("]"),
  /** Token type that represents the point. */
  POINT("."),
  /** Token type that represents a shortcut for the parent: .. . */
  PARENT(".."),
  /** Token type that represents the @ symbol. */
  AT("@"),
  /** Token type that represents a comma. */
  COMMA(","),
  /** Quoted string literal, including its quotes. */
  LITERAL(""),
  /** Number without exponent. */
  NUMBER(""),
  /** NCName, QName, * or prefix:*. */
  NAME_TEST(""),
  /** node, text or comment followed by a left parenthesis. */
  NODE_TYPE(""),
  /** Any other name followed by a left parenthesis. */
  FUNC_NAME(""),
  /** Token type that represents a '/' . */
  SLASH("/"),
  /** Token type that represents a descendant step. */
  DESC_STEP("//"),
  /** Logical or. */
  OR("or"),
  /** Logical and. */
  AND("and"),
  /** Token type that represents an equality comparison. */
  EQ("="),
  /** Token type that represents a diversity comparison. */
  N_EQ("!="),
  /** Less than. */
  LT("<"),
  /** Less than or equal. */
  LE("<="),
  /** Greater than. */
  GT(">"),
  /** Greater than or equal. */
  GE(">="),
  /** Token type that represents a plus. */
  PLUS("+"),
  /** Token type that represents a minus. */
  MINUS("-"),
  /** Token type that represents a star used as multiplication. */
  STAR("*"),
  /** Division. */
  DIV("div"),
  /** Modulo. */
  MOD("mod"),
  /** Token type that represents the union sign: | . */
  UNION("|"),
  /** Token type for the end of the string to parse. */
  END("");

  private final String content;

  TokenType(final String content) {
    this.content = content;
  }

  /**
   * Get the fixed text of this token type.
   *
   * @return the text or an empty string for variable tokens
   */
  public String getContent() {
    return content;
  }

  /**
   * Determines if a token of this type is an operator. An operator cannot end an operand, so a
   * following {@code *} or operator name is a name test.
   *
   * @return {@code true} for operators
   */
  public boolean isOperator() {
    switch (this) {
      case SLASH:
      case DESC_STEP:
      case OR:
      case AND:
      case EQ:
      case N_EQ:
      case LT:
      case LE:
      case GT:
      case GE:
      case PLUS:
      case MINUS:
      case STAR:
      case DIV:
      case MOD:
      case UNION:
        return true;
      default:
        return false;
    }
  }

  public boolean isEquality() {
    return this == EQ || this == N_EQ;
  }

  public boolean isRelational() {
    return this == LT || this == LE || this == GT || this == GE;
  }

  public boolean isAdditive() {
    return this == PLUS || this == MINUS;
  }

  public boolean isMultiplicative() {
    return this == STAR || this == DIV || this == MOD;
  }

  public boolean isPath() {
    return this == SLASH || this == DESC_STEP;
  }

  /**
   * Determines if a token of this type starts a location step.
   *
   * @return {@code true} for ., .., @, name tests and node type tests
   */
  public boolean isStepStart() {
    return this == POINT || this == PARENT || this == AT || this == NAME_TEST
        || this == NODE_TYPE;
  }
}
