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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathEvaluator;

/**
 * Tests for {@link XPathParser}.
 */
class XPathParserTest {

  @Test
  void testRepeatOfBinaryOperators() throws XPathException {
    final Expression expression = XPathParser.parse("1 + 2 * 3 - 4");
    assertEquals(List.of(ExprType.ADDITIVE, ExprType.ADDITIVE), expression.getRepeat(0));
    assertEquals(List.of(ExprType.MULTIPLICATIVE), expression.getRepeat(2));
    assertTrue(expression.getRepeat(4).isEmpty());
    assertTrue(expression.getRepeat(6).isEmpty());
  }

  @Test
  void testRepeatInnermostFirst() throws XPathException {
    final Expression expression = XPathParser.parse("mtu = 1500 or enabled and name != 'lo'");
    assertEquals(List.of(ExprType.EQUALITY, ExprType.OR), expression.getRepeat(0));
    assertEquals(List.of(ExprType.AND), expression.getRepeat(4));
    assertEquals(List.of(ExprType.EQUALITY), expression.getRepeat(6));
  }

  @Test
  void testRepeatOfUnaryAndUnion() throws XPathException {
    assertEquals(List.of(ExprType.UNARY, ExprType.UNARY),
        XPathParser.parse("--mtu").getRepeat(0));
    assertEquals(List.of(ExprType.UNION, ExprType.UNION),
        XPathParser.parse("name | mtu | type").getRepeat(0));
    assertEquals(List.of(ExprType.RELATIONAL), XPathParser.parse("(1) < 2").getRepeat(0));
  }

  @Test
  void testRepeatInsidePredicate() throws XPathException {
    final Expression expression = XPathParser.parse("interface[mtu > 1500]/name");
    assertTrue(expression.getRepeat(0).isEmpty());
    assertEquals(List.of(ExprType.RELATIONAL), expression.getRepeat(2));
  }

  @Test
  void testWellFormed() throws XPathException {
    XPathParser.parse("/if:interfaces/if:interface[if:name = current()/../name][1]");
    XPathParser.parse("count(//*) > 2 and not(../enabled = 'false')");
    XPathParser.parse("concat('a', 'b', 'c', 'd')");
    XPathParser.parse("@xml:lang | text() | node() | ..");
    XPathParser.parse("deref(.)/../mtu");
    XPathParser.parse("(1 + 2)[. = 3]");
  }

  @Test
  void testFunctionErrors() {
    XPathException e = assertThrows(XPathException.class,
        () -> XPathParser.parse("foo(1)"));
    assertEquals(XPathError.UNKNOWN_FUNCTION, e.getError());
    assertEquals(0, e.getPosition());

    e = assertThrows(XPathException.class, () -> XPathParser.parse("1 + count(a, b)"));
    assertEquals(XPathError.WRONG_ARITY, e.getError());
    assertEquals(4, e.getPosition());

    e = assertThrows(XPathException.class, () -> XPathParser.parse("concat('a')"));
    assertEquals(XPathError.WRONG_ARITY, e.getError());

    e = assertThrows(XPathException.class, () -> XPathParser.parse("true(1)"));
    assertEquals(XPathError.WRONG_ARITY, e.getError());
  }

  @Test
  void testSyntaxErrors() {
    assertEquals(XPathError.UNEXPECTED_END,
        assertThrows(XPathException.class, () -> XPathParser.parse("")).getError());
    assertEquals(XPathError.UNEXPECTED_END,
        assertThrows(XPathException.class, () -> XPathParser.parse("mtu +")).getError());
    assertEquals(XPathError.UNEXPECTED_END,
        assertThrows(XPathException.class, () -> XPathParser.parse("interface[1")).getError());
    assertEquals(XPathError.UNEXPECTED_TOKEN,
        assertThrows(XPathException.class, () -> XPathParser.parse("mtu = )")).getError());

    final XPathException e =
        assertThrows(XPathException.class, () -> XPathParser.parse("name mtu"));
    assertEquals(XPathError.TRAILING_TOKENS, e.getError());
    assertEquals(5, e.getPosition());
    assertEquals(XPathError.Category.SYNTAX, e.getError().getCategory());
  }

  @Test
  void testCompiledExpressionsAreCached() throws XPathException {
    final XPathEvaluator evaluator = new XPathEvaluator();
    final Expression first = evaluator.compile("count(interface)");
    assertSame(first, evaluator.compile("count(interface)"));
    assertEquals("count(interface)", first.getSource());
  }
}
