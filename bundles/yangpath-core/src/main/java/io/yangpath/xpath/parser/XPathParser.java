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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.functions.FuncDef;

/**
 * <h1>XPathParser</h1>
 * <p>
 * Validates the token stream of the {@link XPathScanner} against the XPath 1.0 grammar according
 * to the EBNF given in <a href="https://www.w3.org/TR/1999/REC-xpath-19991116/">XML Path Language
 * (XPath) Version 1.0</a>.
 * </p>
 * <p>
 * Besides validation the parser records, for the first token of every repeated production, the
 * precedence level that repeats. A token starting {@code a + b + c} gets {@link ExprType#ADDITIVE}
 * twice. Levels are appended innermost first, so an evaluator can find the number of operands of
 * every level by looking at one token only.
 * </p>
 */
public final class XPathParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(XPathParser.class);

  /** Expression under construction. */
  private final Expression expression;

  /** Current read position. */
  private final TokenCursor cursor;

  private XPathParser(final Expression expression) {
    this.expression = expression;
    cursor = new TokenCursor(expression);
  }

  /**
   * Scan and validate an expression.
   *
   * @param query the expression
   * @return the immutable expression with its repeat lists
   * @throws XPathException if the expression is not well-formed
   */
  public static Expression parse(final String query) throws XPathException {
    final Expression expression = new XPathScanner(query).scan();
    if (expression.size() == 0) {
      throw XPathError.UNEXPECTED_END.newException(query);
    }
    final XPathParser parser = new XPathParser(expression);
    parser.parseOrExpr();
    if (!parser.cursor.atEnd()) {
      final int position = parser.cursor.position();
      throw XPathError.TRAILING_TOKENS.atPosition(position, query.substring(position), position);
    }
    LOGGER.trace("Parsed \"{}\" into {} tokens.", query, expression.size());
    return expression.freeze();
  }

  /**
   * Parses the rule OrExpr according to the following production rule:
   * <p>
   * [21] OrExpr ::= AndExpr | OrExpr 'or' AndExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseOrExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseAndExpr();
    while (cursor.is(TokenType.OR)) {
      expression.pushRepeat(start, ExprType.OR);
      cursor.next();
      parseAndExpr();
    }
  }

  /**
   * Parses the rule AndExpr according to the following production rule:
   * <p>
   * [22] AndExpr ::= EqualityExpr | AndExpr 'and' EqualityExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseAndExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseEqualityExpr();
    while (cursor.is(TokenType.AND)) {
      expression.pushRepeat(start, ExprType.AND);
      cursor.next();
      parseEqualityExpr();
    }
  }

  /**
   * Parses the rule EqualityExpr according to the following production rule:
   * <p>
   * [23] EqualityExpr ::= RelationalExpr | EqualityExpr ('=' | '!=') RelationalExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseEqualityExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseRelationalExpr();
    while (cursor.type().isEquality()) {
      expression.pushRepeat(start, ExprType.EQUALITY);
      cursor.next();
      parseRelationalExpr();
    }
  }

  /**
   * Parses the rule RelationalExpr according to the following production rule:
   * <p>
   * [24] RelationalExpr ::= AdditiveExpr | RelationalExpr ('&lt;' | '&gt;' | '&lt;=' | '&gt;=')
   * AdditiveExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseRelationalExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseAdditiveExpr();
    while (cursor.type().isRelational()) {
      expression.pushRepeat(start, ExprType.RELATIONAL);
      cursor.next();
      parseAdditiveExpr();
    }
  }

  /**
   * Parses the rule AdditiveExpr according to the following production rule:
   * <p>
   * [25] AdditiveExpr ::= MultiplicativeExpr | AdditiveExpr ('+' | '-') MultiplicativeExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseAdditiveExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseMultiplicativeExpr();
    while (cursor.type().isAdditive()) {
      expression.pushRepeat(start, ExprType.ADDITIVE);
      cursor.next();
      parseMultiplicativeExpr();
    }
  }

  /**
   * Parses the rule MultiplicativeExpr according to the following production rule:
   * <p>
   * [26] MultiplicativeExpr ::= UnaryExpr | MultiplicativeExpr ('*' | 'div' | 'mod') UnaryExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseMultiplicativeExpr() throws XPathException {
    final int start = cursor.getIndex();
    parseUnaryExpr();
    while (cursor.type().isMultiplicative()) {
      expression.pushRepeat(start, ExprType.MULTIPLICATIVE);
      cursor.next();
      parseUnaryExpr();
    }
  }

  /**
   * Parses the rule UnaryExpr according to the following production rule. Every minus sign is
   * recorded on the first one.
   * <p>
   * [27] UnaryExpr ::= UnionExpr | '-' UnaryExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseUnaryExpr() throws XPathException {
    final int start = cursor.getIndex();
    while (cursor.is(TokenType.MINUS)) {
      expression.pushRepeat(start, ExprType.UNARY);
      cursor.next();
    }
    parseUnionExpr();
  }

  /**
   * Parses the rule UnionExpr according to the following production rule:
   * <p>
   * [18] UnionExpr ::= PathExpr | UnionExpr '|' PathExpr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseUnionExpr() throws XPathException {
    final int start = cursor.getIndex();
    parsePathExpr();
    while (cursor.is(TokenType.UNION)) {
      expression.pushRepeat(start, ExprType.UNION);
      cursor.next();
      parsePathExpr();
    }
  }

  /**
   * Parses the rule PathExpr according to the following production rules:
   * <p>
   * [19] PathExpr ::= LocationPath | FilterExpr | FilterExpr '/' RelativeLocationPath |
   * FilterExpr '//' RelativeLocationPath .
   * </p>
   * <p>
   * [20] FilterExpr ::= PrimaryExpr | FilterExpr Predicate .
   * </p>
   * <p>
   * [15] PrimaryExpr ::= '(' Expr ')' | Literal | Number | FunctionCall .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parsePathExpr() throws XPathException {
    switch (cursor.type()) {
      case OPEN_BR:
        cursor.next();
        parseOrExpr();
        cursor.consume(TokenType.CLOSE_BR);
        break;
      case POINT:
      case PARENT:
      case AT:
      case NAME_TEST:
      case NODE_TYPE:
        parseRelativeLocationPath();
        return;
      case FUNC_NAME:
        parseFunctionCall();
        break;
      case SLASH:
      case DESC_STEP:
        parseAbsoluteLocationPath();
        return;
      case LITERAL:
      case NUMBER:
        cursor.next();
        break;
      case END:
        throw XPathError.UNEXPECTED_END.newException(expression.getSource());
      default:
        throw XPathError.UNEXPECTED_TOKEN.atPosition(cursor.position(), cursor.text(),
            cursor.position());
    }

    while (cursor.is(TokenType.OPEN_SQP)) {
      parsePredicate();
    }
    if (cursor.type().isPath()) {
      cursor.next();
      parseRelativeLocationPath();
    }
  }

  /**
   * Parses the rule AbsoluteLocationPath according to the following production rule:
   * <p>
   * [2] AbsoluteLocationPath ::= '/' RelativeLocationPath? | '//' RelativeLocationPath .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseAbsoluteLocationPath() throws XPathException {
    if (cursor.is(TokenType.SLASH)) {
      cursor.next();
      if (cursor.type().isStepStart()) {
        parseRelativeLocationPath();
      }
    } else {
      cursor.consume(TokenType.DESC_STEP);
      parseRelativeLocationPath();
    }
  }

  /**
   * Parses the rule RelativeLocationPath according to the following production rules:
   * <p>
   * [3] RelativeLocationPath ::= Step | RelativeLocationPath '/' Step | RelativeLocationPath '//'
   * Step .
   * </p>
   * <p>
   * [4] Step ::= '@'? NodeTest Predicate* | '.' | '..' .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parseRelativeLocationPath() throws XPathException {
    do {
      switch (cursor.type()) {
        case POINT:
        case PARENT:
          cursor.next();
          continue;
        case AT:
          cursor.next();
          if (!cursor.is(TokenType.NAME_TEST) && !cursor.is(TokenType.NODE_TYPE)) {
            throw unexpected();
          }
          break;
        case NAME_TEST:
        case NODE_TYPE:
          break;
        default:
          throw unexpected();
      }

      if (cursor.is(TokenType.NODE_TYPE)) {
        cursor.next();
        cursor.consume(TokenType.OPEN_BR);
        cursor.consume(TokenType.CLOSE_BR);
      } else {
        cursor.next();
      }
      while (cursor.is(TokenType.OPEN_SQP)) {
        parsePredicate();
      }
    } while (advanceStep());
  }

  private boolean advanceStep() {
    if (cursor.type().isPath()) {
      cursor.next();
      return true;
    }
    return false;
  }

  /**
   * Parses the rule Predicate according to the following production rules:
   * <p>
   * [8] Predicate ::= '[' PredicateExpr ']' .
   * </p>
   * <p>
   * [9] PredicateExpr ::= Expr .
   * </p>
   *
   * @throws XPathException if the expression is malformed
   */
  private void parsePredicate() throws XPathException {
    cursor.consume(TokenType.OPEN_SQP);
    parseOrExpr();
    cursor.consume(TokenType.CLOSE_SQP);
  }

  /**
   * Parses the rule FunctionCall and checks the number of arguments against the function
   * library.
   * <p>
   * [16] FunctionCall ::= FunctionName '(' ( Argument ( ',' Argument )* )? ')' .
   * </p>
   *
   * @throws XPathException if the function is unknown or called with a wrong number of arguments
   */
  private void parseFunctionCall() throws XPathException {
    final String name = cursor.text();
    final int position = cursor.position();
    final FuncDef function = FuncDef.fromName(name);
    if (function == null) {
      throw XPathError.UNKNOWN_FUNCTION.atPosition(position, name, position);
    }
    cursor.next();
    cursor.consume(TokenType.OPEN_BR);

    int argCount = 0;
    if (!cursor.is(TokenType.CLOSE_BR)) {
      parseOrExpr();
      argCount++;
      while (cursor.is(TokenType.COMMA)) {
        cursor.next();
        parseOrExpr();
        argCount++;
      }
    }
    cursor.consume(TokenType.CLOSE_BR);

    if (!function.acceptsArgs(argCount)) {
      throw XPathError.WRONG_ARITY.atPosition(position, name, position, argCount);
    }
  }

  private XPathException unexpected() {
    if (cursor.atEnd()) {
      return XPathError.UNEXPECTED_END.newException(expression.getSource());
    }
    return XPathError.UNEXPECTED_TOKEN.atPosition(cursor.position(), cursor.text(),
        cursor.position());
  }
}
