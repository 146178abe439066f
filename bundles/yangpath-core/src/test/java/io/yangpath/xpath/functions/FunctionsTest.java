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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.yangpath.YangTestHelper;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleLeafType;
import io.yangpath.node.SimpleSchemaNode;
import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * Tests for the function library.
 */
class FunctionsTest {

  private YangTestHelper helper;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper();
  }

  private XPathSet root(final String expression) throws XPathException {
    return helper.evalRoot(expression);
  }

  private XPathSet at(final String expression) throws XPathException {
    return helper.eval(expression, helper.eth0);
  }

  @Test
  void testLibrary() {
    assertEquals(33, FuncDef.values().length);
    assertSame(FuncDef.CONCAT, FuncDef.fromName("concat"));
    assertNull(FuncDef.fromName("upper-case"));
    assertTrue(FuncDef.SUBSTRING.acceptsArgs(3));
    assertFalse(FuncDef.SUBSTRING.acceptsArgs(1));
    assertTrue(FuncDef.CONCAT.acceptsArgs(12));
    assertEquals("bit-is-set", FuncDef.BIT_IS_SET.getName());
    assertTrue(FuncDef.BIT_IS_SET.getFunction() instanceof FNBitIsSet);
  }

  @Test
  void testBooleanFunctions() throws XPathException {
    assertTrue(root("true()").getBoolean());
    assertFalse(root("false()").getBoolean());
    assertTrue(root("not(0)").getBoolean());
    assertFalse(root("boolean(interfaces/interface/description)").getBoolean());
    assertTrue(root("boolean('false')").getBoolean());
    assertEquals(SetType.BOOLEAN, root("not(interfaces)").getType());
  }

  @Test
  void testNumberFunctions() throws XPathException {
    assertEquals(76035, root("sum(interfaces/interface/mtu)").getNumber());
    assertTrue(Double.isNaN(root("sum(interfaces/interface/name)").getNumber()));
    assertEquals(0, root("sum(interfaces/interface/description)").getNumber());
    assertEquals(3, root("count(interfaces/interface)").getNumber());
    assertEquals(1500, at("number(mtu)").getNumber());
    assertTrue(Double.isNaN(at("number()").getNumber()));
    assertEquals(2, root("floor(2.7)").getNumber());
    assertEquals(-3, root("floor(-2.1)").getNumber());
    assertEquals(3, root("ceiling(2.1)").getNumber());
    assertEquals(3, root("round(2.5)").getNumber());
    assertEquals(-2, root("round(-2.5)").getNumber());
    assertEquals(Double.NEGATIVE_INFINITY, root("1 div round(-0.4)").getNumber());
    assertTrue(Double.isNaN(root("round(0 div 0)").getNumber()));
  }

  @Test
  void testSumRequiresNodeSet() {
    final XPathException e = assertThrows(XPathException.class, () -> root("sum(1)"));
    assertEquals(XPathError.INVALID_ARGUMENT, e.getError());
  }

  @Test
  void testStringFunctions() throws XPathException {
    assertEquals("eth0/1500", at("concat(name, '/', mtu)").getString());
    assertTrue(at("contains(name, 'th')").getBoolean());
    assertTrue(at("starts-with(name, 'eth')").getBoolean());
    assertFalse(at("starts-with(name, 'lo')").getBoolean());
    assertEquals("1999", root("substring-before('1999/04/01', '/')").getString());
    assertEquals("04/01", root("substring-after('1999/04/01', '/')").getString());
    assertEquals("", root("substring-after('1999', '/')").getString());
    assertEquals("BAr", root("translate('bar', 'abc', 'ABC')").getString());
    assertEquals("AAA", root("translate('--aaa--', 'abc-', 'ABC')").getString());
    assertEquals("a b c", root("normalize-space('  a \t b\n\nc ')").getString());
    assertEquals(4, at("string-length(name)").getNumber());
    assertEquals("eth0", helper.eval("string()", helper.eth0).getString().substring(0, 4));
    assertEquals("1500", at("string(mtu)").getString());
    assertEquals("0.5", root("string(1 div 2)").getString());
  }

  @Test
  void testSubstring() throws XPathException {
    assertEquals("234", root("substring('12345', 1.5, 2.6)").getString());
    assertEquals("12", root("substring('12345', 0, 3)").getString());
    assertEquals("2345", root("substring('12345', 2)").getString());
    assertEquals("", root("substring('12345', 0 div 0, 3)").getString());
    assertEquals("", root("substring('12345', 1, 0 div 0)").getString());
    assertEquals("12345", root("substring('12345', -42, 1 div 0)").getString());
    assertEquals("", root("substring('12345', -1 div 0, 1 div 0)").getString());
  }

  @Test
  void testNodeNames() throws XPathException {
    helper.eth0.addAttribute(helper.xmlModule, "lang", "en-US");
    assertEquals("ietf-interfaces:interface", at("name()").getString());
    assertEquals("interface", at("local-name()").getString());
    assertEquals("mtu", at("local-name(mtu)").getString());
    assertEquals("urn:ietf:params:xml:ns:yang:ietf-interfaces",
        at("namespace-uri()").getString());
    assertEquals("xml:lang", at("name(@*)").getString());
    assertEquals("", root("name()").getString());
    assertEquals("", at("local-name(description)").getString());
  }

  @Test
  void testPositionAndLast() throws XPathException {
    assertEquals(1, at("position()").getNumber());
    assertEquals(1, at("last()").getNumber());
    assertEquals("eth1", root("interfaces/interface[position() = 2]/name").asString());
    assertEquals(3, root("count(interfaces/interface[last() = 3])").getNumber());
  }

  @Test
  void testLang() throws XPathException {
    helper.interfaces.addAttribute(helper.xmlModule, "lang", "en-US");
    assertTrue(at("lang('en')").getBoolean());
    assertTrue(at("lang('EN-us')").getBoolean());
    assertFalse(at("lang('de')").getBoolean());
    assertFalse(helper.eval("lang('en')", helper.system).getBoolean());
  }

  @Test
  void testReMatch() throws XPathException {
    assertTrue(at("re-match(name, 'eth[0-9]+')").getBoolean());
    assertFalse(at("re-match(name, 'eth')").getBoolean());
    assertTrue(root("re-match('1.22.333', '\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}')").getBoolean());
    assertTrue(root("re-match('abc', '\\p{IsBasicLatin}+')").getBoolean());
    assertTrue(root("re-match('a^b', 'a^b')").getBoolean());
    assertTrue(root("re-match('a$', 'a$')").getBoolean());
    assertFalse(root("re-match('ab', '^ab$')").getBoolean());
    assertFalse(root("re-match('e', '[a-z-[aeiou]]')").getBoolean());
    assertTrue(root("re-match('x', '[a-z-[aeiou]]')").getBoolean());
    assertTrue(root("re-match('a&b', 'a[&]b')").getBoolean());

    final XPathException e =
        assertThrows(XPathException.class, () -> root("re-match('a', '[a-')"));
    assertEquals(XPathError.INVALID_REGEX, e.getError());
  }

  @Test
  void testDerivedFrom() throws XPathException {
    assertTrue(at("derived-from(type, 'if:interface-type')").getBoolean());
    assertTrue(at("derived-from(type, 'interface-type')").getBoolean());
    assertTrue(at("derived-from(type, 'ianaift:iana-interface-type')").getBoolean());
    assertFalse(at("derived-from(type, 'ianaift:ethernetCsmacd')").getBoolean());
    assertTrue(at("derived-from-or-self(type, 'ianaift:ethernetCsmacd')").getBoolean());
    assertFalse(at("derived-from-or-self(type, 'ianaift:softwareLoopback')").getBoolean());
    assertEquals(1, root("count(interfaces/interface"
        + "[derived-from-or-self(type, 'ianaift:softwareLoopback')])").getNumber());

    final XPathException e = assertThrows(XPathException.class,
        () -> at("derived-from(type, 'foo:bar')"));
    assertEquals(XPathError.UNKNOWN_PREFIX, e.getError());
    final XPathException missing = assertThrows(XPathException.class,
        () -> at("derived-from(type, 'if:no-such-identity')"));
    assertEquals(XPathError.INVALID_ARGUMENT, missing.getError());
  }

  @Test
  void testEnumValue() throws XPathException {
    assertEquals(0, at("enum-value(oper-status)").getNumber());
    assertEquals(1, helper.eval("enum-value(oper-status)", helper.eth1).getNumber());
    assertEquals(SetType.EMPTY, at("enum-value(name)").getType());
    assertEquals(SetType.EMPTY, at("enum-value(description)").getType());
  }

  @Test
  void testEnumValueOfUnionMember() throws XPathException {
    final SimpleSchemaNode speed = helper.interfaceSchema.leaf("speed",
        SimpleLeafType.union(SimpleLeafType.of(TypeBase.UINT32),
            SimpleLeafType.enumeration("auto").withEnum("auto", 42)));
    helper.eth0.leafChild(speed, "auto");
    assertEquals(42, at("enum-value(speed)").getNumber());
  }

  @Test
  void testBitIsSet() throws XPathException {
    assertTrue(at("bit-is-set(flags, 'running')").getBoolean());
    assertFalse(at("bit-is-set(flags, 'broadcast')").getBoolean());
    assertFalse(at("bit-is-set(flags, 'unknown')").getBoolean());
    assertFalse(at("bit-is-set(name, 'up')").getBoolean());
  }

  @Test
  void testDeref() throws XPathException {
    assertEquals(1500, helper.eval("deref(lower-layer)/../mtu", helper.eth1).asNumber());
    assertEquals(0, at("count(deref(name))").getNumber());

    final SimpleSchemaNode reference = helper.systemSchema.leaf("uplink",
        SimpleLeafType.of(TypeBase.INSTANCE_IDENTIFIER));
    helper.system.leafChild(reference,
        "/ietf-interfaces:interfaces/interface[name = 'lo']/mtu");
    assertEquals(65535, root("deref(/sys:system/sys:uplink)").asNumber());
  }

  @Test
  void testCurrentAtRoot() throws XPathException {
    assertEquals(2, root("count(current()/*)").getNumber());
  }
}
