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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathSet;
import io.yangpath.xpath.parser.TokenType;

/**
 * Tests for {@link OpKind}.
 */
class OpKindTest {

  @Test
  void testCalculate() {
    assertEquals(5, OpKind.PLUS.calculate(2, 3));
    assertEquals(-1, OpKind.MINUS.calculate(2, 3));
    assertEquals(6, OpKind.STAR.calculate(2, 3));
    assertEquals(2.5, OpKind.DIV.calculate(5, 2));
    assertEquals(Double.POSITIVE_INFINITY, OpKind.DIV.calculate(1, 0));
    assertEquals(1, OpKind.MOD.calculate(5, 2));
    assertEquals(-1, OpKind.MOD.calculate(-5, 2));
  }

  @Test
  void testApply() {
    final XPathSet left = new XPathSet();
    left.setString(" 40 ");
    final XPathSet right = new XPathSet();
    right.setBoolean(true);
    OpKind.PLUS.apply(left, right);
    assertEquals(SetType.NUMBER, left.getType());
    assertEquals(41, left.getNumber());

    right.setString("");
    OpKind.STAR.apply(left, right);
    assertTrue(Double.isNaN(left.getNumber()));
  }

  @Test
  void testFromToken() {
    assertEquals(OpKind.MOD, OpKind.fromToken(TokenType.MOD));
    assertNull(OpKind.fromToken(TokenType.UNION));
    assertEquals("div", OpKind.DIV.toString());
  }
}
