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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;

/**
 * Tests for {@link XPathScanner}.
 */
class XPathScannerTest {

  private static List<TokenType> types(final String query) throws XPathException {
    final Expression expression = new XPathScanner(query).scan();
    final List<TokenType> types = new ArrayList<>();
    for (int i = 0; i < expression.size(); i++) {
      types.add(expression.getType(i));
    }
    return types;
  }

  @Test
  void testLocationPath() throws XPathException {
    assertEquals(List.of(TokenType.SLASH, TokenType.NAME_TEST, TokenType.SLASH,
        TokenType.NAME_TEST, TokenType.OPEN_SQP, TokenType.NAME_TEST, TokenType.EQ,
        TokenType.LITERAL, TokenType.CLOSE_SQP),
        types("/if:interfaces/interface[name='eth0']"));
  }

  @Test
  void testTokenText() throws XPathException {
    final Expression expression = new XPathScanner("../if:mtu >= 1500.5").scan();
    assertEquals(4, expression.size());
    assertEquals(TokenType.PARENT, expression.getType(0));
    assertEquals("if:mtu", expression.getText(2));
    assertEquals(TokenType.GE, expression.getType(3));

    final Expression literal = new XPathScanner("\"it's\"").scan();
    assertEquals("\"it's\"", literal.getText(0));
    assertEquals(0, literal.getPosition(0));
    assertEquals(6, literal.getLength(0));
  }

  @Test
  void testStarAndOperatorNames() throws XPathException {
    assertEquals(List.of(TokenType.NAME_TEST, TokenType.STAR, TokenType.NAME_TEST),
        types("* * *"));
    assertEquals(List.of(TokenType.NAME_TEST, TokenType.DIV, TokenType.NAME_TEST),
        types("div div div"));
    assertEquals(List.of(TokenType.NAME_TEST, TokenType.OR, TokenType.NAME_TEST,
        TokenType.AND, TokenType.NAME_TEST), types("and or mod and or"));
    assertEquals(List.of(TokenType.NUMBER, TokenType.MOD, TokenType.NUMBER), types("7 mod 2"));
    assertEquals(List.of(TokenType.SLASH, TokenType.NAME_TEST), types("/if:*"));
  }

  @Test
  void testFunctionAndNodeType() throws XPathException {
    assertEquals(List.of(TokenType.FUNC_NAME, TokenType.OPEN_BR, TokenType.NODE_TYPE,
        TokenType.OPEN_BR, TokenType.CLOSE_BR, TokenType.CLOSE_BR), types("count (node())"));
    assertEquals(List.of(TokenType.DESC_STEP, TokenType.NODE_TYPE, TokenType.OPEN_BR,
        TokenType.CLOSE_BR), types("//text()"));
    assertEquals(List.of(TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER),
        types(".5+1."));
  }

  @Test
  void testErrors() {
    XPathException e = assertThrows(XPathException.class,
        () -> new XPathScanner("name = 'eth0").scan());
    assertEquals(XPathError.UNTERMINATED_LITERAL, e.getError());
    assertEquals(7, e.getPosition());

    e = assertThrows(XPathException.class, () -> new XPathScanner("mtu # 2").scan());
    assertEquals(XPathError.INVALID_CHARACTER, e.getError());

    e = assertThrows(XPathException.class, () -> new XPathScanner("a ! b").scan());
    assertEquals(XPathError.INVALID_CHARACTER, e.getError());
  }
}
