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

package io.yangpath.xpath.expr;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.EvaluationContext;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.axis.NameTest;
import io.yangpath.xpath.comparators.CompKind;
import io.yangpath.xpath.functions.FuncDef;
import io.yangpath.xpath.operators.OpKind;
import io.yangpath.xpath.parser.ExprType;
import io.yangpath.xpath.parser.Expression;
import io.yangpath.xpath.parser.TokenCursor;
import io.yangpath.xpath.parser.TokenType;

/**
 * <p>
 * Walks a parsed expression once, driven by the repeat lists of its tokens, and delegates the
 * semantics of every construct to a subclass: {@link DataEvaluator} computes values over a data
 * tree, {@link SchemaEvaluator} collects the schema nodes an expression can reach.
 * </p>
 * <p>
 * A {@code null} set means the tokens are only skipped, for short-circuited operands and for
 * predicates of empty sets.
 * </p>
 *
 * @param <C> the context type
 */
public abstract class AbstractEvaluator<C extends EvaluationContext> {

  /** The context. */
  protected final C context;

  /** Read position in the expression. */
  protected final TokenCursor cursor;

  /**
   * Constructor.
   *
   * @param context the context
   */
  protected AbstractEvaluator(final C context) {
    this.context = checkNotNull(context);
    cursor = new TokenCursor(context.getExpression());
  }

  public C getContext() {
    return context;
  }

  /**
   * Evaluate the whole expression on a set.
   *
   * @param set the initial context, receives the result
   * @throws XPathException if the evaluation fails
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  protected final void evaluate(final XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    cursor.reset(0);
    evalExprSelect(ExprType.NONE, set);
  }

  /**
   * Evaluate the operand at the current token that binds tighter than {@code level}.
   *
   * @param level the level of the caller
   * @param set the set or {@code null} to skip the operand
   * @throws XPathException if the evaluation fails
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  protected final void evalExprSelect(final ExprType level, final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    final List<ExprType> repeat = cursor.getExpression().getRepeat(cursor.getIndex());
    int i = 0;
    while (i < repeat.size() && repeat.get(i).isTighterThan(level)) {
      i++;
    }
    if (i == 0) {
      evalPathExpr(set);
      return;
    }

    final ExprType next = repeat.get(i - 1);
    int count = 0;
    while (i > 0 && repeat.get(i - 1) == next) {
      count++;
      i--;
    }

    switch (next) {
      case OR:
      case AND:
        evalLogic(next, count, set);
        break;
      case EQUALITY:
      case RELATIONAL:
        evalComparison(next, count, set);
        break;
      case ADDITIVE:
      case MULTIPLICATIVE:
        evalArithmetic(next, count, set);
        break;
      case UNARY:
        evalUnary(count, set);
        break;
      case UNION:
        evalUnion(count, set);
        break;
      default:
        throw new IllegalStateException("Unexpected level " + next);
    }
  }

  /**
   * OrExpr and AndExpr.
   * <p>
   * [21] OrExpr ::= AndExpr | OrExpr 'or' AndExpr .
   * </p>
   * <p>
   * [22] AndExpr ::= EqualityExpr | AndExpr 'and' EqualityExpr .
   * </p>
   */
  private void evalLogic(final ExprType level, final int repeat, final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    final boolean or = level == ExprType.OR;
    final XPathSet orig = set == null ? null : set.copy();
    evalExprSelect(level, set);
    if (set != null) {
      toBoolean(set);
    }
    for (int i = 0; i < repeat; i++) {
      cursor.next();
      if (set == null || isDecided(set, or)) {
        evalExprSelect(level, null);
        continue;
      }
      final XPathSet operand = orig.copy();
      evalExprSelect(level, operand);
      combineLogic(set, operand);
    }
  }

  /**
   * EqualityExpr and RelationalExpr.
   * <p>
   * [23] EqualityExpr ::= RelationalExpr | EqualityExpr ('=' | '!=') RelationalExpr .
   * </p>
   * <p>
   * [24] RelationalExpr ::= AdditiveExpr | RelationalExpr ('&lt;' | '&gt;' | '&lt;=' |
   * '&gt;=') AdditiveExpr .
   * </p>
   */
  private void evalComparison(final ExprType level, final int repeat,
      final @Nullable XPathSet set) throws XPathException, UnresolvedDependencyException {
    final XPathSet orig = set == null ? null : set.copy();
    int start = cursor.getIndex();
    evalExprSelect(level, set);
    for (int i = 0; i < repeat; i++) {
      final String leftLiteral = literalBetween(start, cursor.getIndex());
      final CompKind kind = checkNotNull(CompKind.fromToken(cursor.type()));
      cursor.next();
      start = cursor.getIndex();
      if (set == null) {
        evalExprSelect(level, null);
        continue;
      }
      final XPathSet operand = orig.copy();
      evalExprSelect(level, operand);
      compare(set, operand, kind, i == 0 ? leftLiteral : null,
          literalBetween(start, cursor.getIndex()));
    }
  }

  /**
   * AdditiveExpr and MultiplicativeExpr.
   * <p>
   * [25] AdditiveExpr ::= MultiplicativeExpr | AdditiveExpr ('+' | '-') MultiplicativeExpr .
   * </p>
   * <p>
   * [26] MultiplicativeExpr ::= UnaryExpr | MultiplicativeExpr ('*' | 'div' | 'mod') UnaryExpr .
   * </p>
   */
  private void evalArithmetic(final ExprType level, final int repeat,
      final @Nullable XPathSet set) throws XPathException, UnresolvedDependencyException {
    final XPathSet orig = set == null ? null : set.copy();
    evalExprSelect(level, set);
    for (int i = 0; i < repeat; i++) {
      final OpKind op = checkNotNull(OpKind.fromToken(cursor.type()));
      cursor.next();
      if (set == null) {
        evalExprSelect(level, null);
        continue;
      }
      final XPathSet operand = orig.copy();
      evalExprSelect(level, operand);
      arithmetic(set, operand, op);
    }
  }

  /**
   * UnaryExpr, the operand is negated once per odd number of signs.
   * <p>
   * [27] UnaryExpr ::= UnionExpr | '-' UnaryExpr .
   * </p>
   */
  private void evalUnary(final int repeat, final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    for (int i = 0; i < repeat; i++) {
      cursor.consume(TokenType.MINUS);
    }
    evalExprSelect(ExprType.UNARY, set);
    if (set != null && repeat % 2 == 1) {
      negate(set);
    }
  }

  /**
   * UnionExpr.
   * <p>
   * [18] UnionExpr ::= PathExpr | UnionExpr '|' PathExpr .
   * </p>
   */
  private void evalUnion(final int repeat, final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    final XPathSet orig = set == null ? null : set.copy();
    evalExprSelect(ExprType.UNION, set);
    for (int i = 0; i < repeat; i++) {
      cursor.consume(TokenType.UNION);
      if (set == null) {
        evalExprSelect(ExprType.UNION, null);
        continue;
      }
      final XPathSet operand = orig.copy();
      evalExprSelect(ExprType.UNION, operand);
      union(set, operand);
    }
  }

  /**
   * PathExpr.
   * <p>
   * [19] PathExpr ::= LocationPath | FilterExpr | FilterExpr '/' RelativeLocationPath |
   * FilterExpr '//' RelativeLocationPath .
   * </p>
   * <p>
   * [20] FilterExpr ::= PrimaryExpr | FilterExpr Predicate .
   * </p>
   */
  private void evalPathExpr(final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    switch (cursor.type()) {
      case OPEN_BR:
        cursor.next();
        evalExprSelect(ExprType.NONE, set);
        cursor.consume(TokenType.CLOSE_BR);
        break;
      case POINT:
      case PARENT:
      case AT:
      case NAME_TEST:
      case NODE_TYPE:
        evalRelativeLocationPath(set, false);
        return;
      case FUNC_NAME:
        evalFunctionCall(set);
        break;
      case SLASH:
      case DESC_STEP:
        evalAbsoluteLocationPath(set);
        return;
      case LITERAL:
        if (set != null) {
          literal(set, unquote(cursor.text()));
        }
        cursor.next();
        break;
      case NUMBER:
        if (set != null) {
          number(set, Double.parseDouble(cursor.text()));
        }
        cursor.next();
        break;
      default:
        throw XPathError.UNEXPECTED_TOKEN.atPosition(cursor.position(), cursor.text(),
            cursor.position());
    }

    while (cursor.is(TokenType.OPEN_SQP)) {
      evalPredicate(set, false);
    }
    if (cursor.type().isPath()) {
      final boolean allDesc = cursor.is(TokenType.DESC_STEP);
      cursor.next();
      evalRelativeLocationPath(set, allDesc);
    }
  }

  /**
   * AbsoluteLocationPath.
   * <p>
   * [2] AbsoluteLocationPath ::= '/' RelativeLocationPath? | '//' RelativeLocationPath .
   * </p>
   */
  private void evalAbsoluteLocationPath(final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    if (set != null) {
      root(set);
    }
    if (cursor.is(TokenType.SLASH)) {
      cursor.next();
      if (cursor.type().isStepStart()) {
        evalRelativeLocationPath(set, false);
      }
    } else {
      cursor.consume(TokenType.DESC_STEP);
      evalRelativeLocationPath(set, true);
    }
  }

  /**
   * RelativeLocationPath.
   * <p>
   * [3] RelativeLocationPath ::= Step | RelativeLocationPath '/' Step | RelativeLocationPath '//'
   * Step .
   * </p>
   * <p>
   * [4] Step ::= '@'? NodeTest Predicate* | '.' | '..' .
   * </p>
   */
  private void evalRelativeLocationPath(final @Nullable XPathSet set, final boolean firstAllDesc)
      throws XPathException, UnresolvedDependencyException {
    boolean allDesc = firstAllDesc;
    while (true) {
      switch (cursor.type()) {
        case POINT:
          cursor.next();
          if (set != null) {
            self(set, allDesc);
          }
          break;
        case PARENT:
          cursor.next();
          if (set != null) {
            parent(set, allDesc);
          }
          break;
        case AT:
          cursor.next();
          evalNodeTest(set, true, allDesc);
          break;
        default:
          evalNodeTest(set, false, allDesc);
          break;
      }
      if (!cursor.type().isPath()) {
        return;
      }
      allDesc = cursor.is(TokenType.DESC_STEP);
      cursor.next();
    }
  }

  /**
   * NodeTest with its predicates.
   * <p>
   * [7] NodeTest ::= NameTest | NodeType '(' ')' .
   * </p>
   */
  private void evalNodeTest(final @Nullable XPathSet set, final boolean attribute,
      final boolean allDesc) throws XPathException, UnresolvedDependencyException {
    if (cursor.is(TokenType.NODE_TYPE)) {
      final String nodeType = cursor.text();
      cursor.next();
      cursor.consume(TokenType.OPEN_BR);
      cursor.consume(TokenType.CLOSE_BR);
      if (set != null) {
        nodeType(set, nodeType, attribute, allDesc);
      }
    } else {
      cursor.check(TokenType.NAME_TEST);
      final NameTest test = NameTest.parse(cursor.text());
      cursor.next();
      if (set != null) {
        if (attribute) {
          attribute(set, test, allDesc);
        } else {
          child(set, test, allDesc);
        }
      }
    }
    while (cursor.is(TokenType.OPEN_SQP)) {
      evalPredicate(set, true);
    }
  }

  /**
   * Predicate.
   * <p>
   * [8] Predicate ::= '[' PredicateExpr ']' .
   * </p>
   */
  private void evalPredicate(final @Nullable XPathSet set, final boolean step)
      throws XPathException, UnresolvedDependencyException {
    cursor.consume(TokenType.OPEN_SQP);
    final int start = cursor.getIndex();
    if (set != null) {
      filter(set, start, step);
    }
    cursor.reset(start);
    evalExprSelect(ExprType.NONE, null);
    cursor.consume(TokenType.CLOSE_SQP);
  }

  /**
   * Evaluate the expression of the current predicate on one candidate.
   *
   * @param start index of the first token of the predicate expression
   * @param candidate the candidate set, receives the predicate value
   * @throws XPathException if the evaluation fails
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  protected final void evalPredicateExpr(final int start, final XPathSet candidate)
      throws XPathException, UnresolvedDependencyException {
    cursor.reset(start);
    evalExprSelect(ExprType.NONE, candidate);
  }

  /**
   * FunctionCall, every argument is evaluated on a copy of the context set.
   * <p>
   * [16] FunctionCall ::= FunctionName '(' ( Argument ( ',' Argument )* )? ')' .
   * </p>
   */
  private void evalFunctionCall(final @Nullable XPathSet set)
      throws XPathException, UnresolvedDependencyException {
    final FuncDef function = checkNotNull(FuncDef.fromName(cursor.text()));
    cursor.next();
    cursor.consume(TokenType.OPEN_BR);
    final List<XPathSet> args = new ArrayList<>();
    if (!cursor.is(TokenType.CLOSE_BR)) {
      while (true) {
        final XPathSet arg = set == null ? null : set.copy();
        evalExprSelect(ExprType.NONE, arg);
        if (arg != null) {
          args.add(arg);
        }
        if (!cursor.is(TokenType.COMMA)) {
          break;
        }
        cursor.next();
      }
    }
    cursor.consume(TokenType.CLOSE_BR);
    if (set != null) {
      call(function, args, set);
    }
  }

  private @Nullable String literalBetween(final int start, final int end) {
    if (end != start + 1) {
      return null;
    }
    final Expression expression = cursor.getExpression();
    return switch (expression.getType(start)) {
      case LITERAL -> unquote(expression.getText(start));
      case NUMBER -> expression.getText(start);
      default -> null;
    };
  }

  private static String unquote(final String literal) {
    return literal.substring(1, literal.length() - 1);
  }

  // ---------------------------------------------------------------------------------------------
  // semantics

  /** Convert the first operand of {@code or} / {@code and}. */
  protected abstract void toBoolean(XPathSet set) throws XPathException;

  /**
   * Determines if the result of {@code or} / {@code and} is known already.
   *
   * @param set the running result
   * @param or {@code true} for {@code or}
   * @return {@code true} if further operands are only skipped
   */
  protected abstract boolean isDecided(XPathSet set, boolean or);

  /** Combine the running {@code or} / {@code and} result with the next operand. */
  protected abstract void combineLogic(XPathSet set, XPathSet operand) throws XPathException;

  /**
   * Compare two operands.
   *
   * @param set left operand, receives the result
   * @param operand right operand
   * @param kind the comparison
   * @param leftLiteral the left operand if it is a single literal or number
   * @param rightLiteral the right operand if it is a single literal or number
   * @throws XPathException if the comparison fails
   */
  protected abstract void compare(XPathSet set, XPathSet operand, CompKind kind,
      @Nullable String leftLiteral, @Nullable String rightLiteral) throws XPathException;

  protected abstract void arithmetic(XPathSet set, XPathSet operand, OpKind op)
      throws XPathException;

  protected abstract void negate(XPathSet set) throws XPathException;

  protected abstract void union(XPathSet set, XPathSet operand) throws XPathException;

  protected abstract void literal(XPathSet set, String value);

  protected abstract void number(XPathSet set, double value);

  protected abstract void root(XPathSet set);

  protected abstract void self(XPathSet set, boolean allDesc)
      throws XPathException, UnresolvedDependencyException;

  protected abstract void parent(XPathSet set, boolean allDesc)
      throws XPathException, UnresolvedDependencyException;

  protected abstract void child(XPathSet set, NameTest test, boolean allDesc)
      throws XPathException, UnresolvedDependencyException;

  protected abstract void attribute(XPathSet set, NameTest test, boolean allDesc)
      throws XPathException, UnresolvedDependencyException;

  protected abstract void nodeType(XPathSet set, String nodeType, boolean attribute,
      boolean allDesc) throws XPathException, UnresolvedDependencyException;

  /**
   * Apply the predicate starting at token {@code start} to a set.
   *
   * @param set the set
   * @param start index of the first token of the predicate expression
   * @param step {@code true} for step predicates, positions counted per parent
   * @throws XPathException if the evaluation fails
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  protected abstract void filter(XPathSet set, int start, boolean step)
      throws XPathException, UnresolvedDependencyException;

  protected abstract void call(FuncDef function, List<XPathSet> args, XPathSet set)
      throws XPathException, UnresolvedDependencyException;
}
