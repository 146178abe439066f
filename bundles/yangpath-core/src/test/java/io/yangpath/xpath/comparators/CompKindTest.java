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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import io.yangpath.xpath.parser.TokenType;

/**
 * Tests for {@link CompKind}.
 */
class CompKindTest {

  @Test
  void testEQ() {
    assertTrue(CompKind.EQ.compare(2.0, 2));
    assertFalse(CompKind.EQ.compare(2.0, 2.01));
    assertFalse(CompKind.EQ.compare(Double.NaN, Double.NaN));
    assertTrue(CompKind.EQ.compare("eth0", "eth0"));
    assertFalse(CompKind.EQ.compare("2.0", "2"));
    assertTrue(CompKind.EQ.compare(true, true));
  }

  @Test
  void testNE() {
    assertTrue(CompKind.NE.compare(Double.NaN, Double.NaN));
    assertTrue(CompKind.NE.compare("2.0", "2"));
    assertFalse(CompKind.NE.compare(false, false));
  }

  @Test
  void testRelational() {
    assertTrue(CompKind.LT.compare(1, 2));
    assertTrue(CompKind.LE.compare(2, 2));
    assertTrue(CompKind.GT.compare("10", "9"));
    assertFalse(CompKind.GE.compare("abc", "1"));
    assertTrue(CompKind.GT.compare(true, false));
    assertFalse(CompKind.LT.compare(Double.NaN, 1));
  }

  @Test
  void testFromToken() {
    assertEquals(CompKind.NE, CompKind.fromToken(TokenType.N_EQ));
    assertEquals(CompKind.GE, CompKind.fromToken(TokenType.GE));
    assertNull(CompKind.fromToken(TokenType.PLUS));
    assertTrue(CompKind.EQ.isEquality());
    assertFalse(CompKind.LE.isEquality());
    assertEquals("<=", CompKind.LE.toString());
  }
}
