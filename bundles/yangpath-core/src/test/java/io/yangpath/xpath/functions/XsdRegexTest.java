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

package io.yangpath.xpath.functions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;

/**
 * Tests for {@link XsdRegex}.
 */
class XsdRegexTest {

  @Test
  void testAnchorsAreLiterals() throws XPathException {
    assertEquals("\\^a\\$", XsdRegex.toJava("^a$"));
    assertEquals("[^$]", XsdRegex.toJava("[^$]"));
    assertEquals("a\\$", XsdRegex.toJava("a\\$"));
  }

  @Test
  void testSubtraction() throws XPathException {
    assertEquals("[[a-z]&&[^[aeiou]]]", XsdRegex.toJava("[a-z-[aeiou]]"));
    final Pattern consonant = Pattern.compile(XsdRegex.toJava("[a-z-[aeiou]]+"));
    assertTrue(consonant.matcher("xyz").matches());
    assertFalse(consonant.matcher("xaz").matches());

    final Pattern nested = Pattern.compile(XsdRegex.toJava("[\\p{L}-[a-z-[x]]]"));
    assertTrue(nested.matcher("x").matches());
    assertTrue(nested.matcher("Q").matches());
    assertFalse(nested.matcher("b").matches());

    final Pattern negated = Pattern.compile(XsdRegex.toJava("[^a-c-[0-9]]"));
    assertTrue(negated.matcher("d").matches());
    assertFalse(negated.matcher("5").matches());
    assertFalse(negated.matcher("b").matches());
  }

  @Test
  void testEscapes() throws XPathException {
    assertEquals("\\p{InBasicLatin}", XsdRegex.toJava("\\p{IsBasicLatin}"));
    assertEquals("\\P{InGreek}", XsdRegex.toJava("\\P{IsGreek}"));
    assertEquals("\\p{Lu}", XsdRegex.toJava("\\p{Lu}"));
    final Pattern name = Pattern.compile(XsdRegex.toJava("\\i\\c*"));
    assertTrue(name.matcher("if:name-1").matches());
    assertFalse(name.matcher("1name").matches());
  }

  @Test
  void testUnterminatedClass() {
    final XPathException e = assertThrows(XPathException.class, () -> XsdRegex.toJava("[a-z"));
    assertEquals(XPathError.INVALID_REGEX, e.getError());
    assertThrows(XPathException.class, () -> XsdRegex.toJava("[a-[b]c]"));
  }
}
