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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.yangpath.YangTestHelper;
import io.yangpath.api.WhenStatus;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleDataNode;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathOption;
import io.yangpath.xpath.XPathResult;
import io.yangpath.xpath.XPathSet;

/**
 * Tests for {@link DataEvaluator}.
 */
class DataEvaluatorTest {

  private YangTestHelper helper;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper();
  }

  private double number(final String expression) throws XPathException {
    return helper.evalRoot(expression).asNumber();
  }

  private String string(final String expression) throws XPathException {
    return helper.evalRoot(expression).asString();
  }

  private boolean bool(final String expression) throws XPathException {
    return helper.evalRoot(expression).asBoolean();
  }

  @Test
  void testAbsolutePaths() throws XPathException {
    assertEquals(9000, number("/if:interfaces/if:interface[if:name = 'eth1']/if:mtu"));
    assertEquals(3, number("count(/if:interfaces/interface)"));
    assertEquals("router1", string("/ietf-system:system/hostname"));
    assertEquals("router1", string("/sys:system/sys:hostname"));
    assertEquals(2, number("count(/*)"));
  }

  @Test
  void testUnprefixedNamesFollowModules() throws XPathException {
    assertEquals(0, number("count(/system)"));
    assertEquals(1, number("count(/sys:system)"));
    assertEquals(1, number("count(interfaces)"));
  }

  @Test
  void testUnknownPrefix() {
    final XPathException e =
        assertThrows(XPathException.class, () -> helper.evalRoot("/foo:interfaces"));
    assertEquals(XPathError.UNKNOWN_PREFIX, e.getError());
  }

  @Test
  void testStepPredicates() throws XPathException {
    assertEquals("eth1", string("interfaces/interface[2]/name"));
    assertEquals("lo", string("interfaces/interface[last()]/name"));
    assertEquals("eth1", string("interfaces/interface[position() = last() - 1]/name"));
    assertEquals(2, number("count(interfaces/interface[enabled = 'true'])"));
    assertEquals(1, number("count(interfaces/interface[enabled = 'true'][2])"));
    assertEquals("lo", string("interfaces/interface[enabled = 'true'][2]/name"));
    assertEquals(0, number("count(interfaces/interface[1.5])"));
  }

  @Test
  void testStepPredicatesCountPerParent() throws XPathException {
    assertEquals(3, number("count(//name[1])"));
    assertEquals(3, number("count(//interface/*[last()])"));
    assertEquals(1, number("count((//name)[1])"));
    assertEquals("eth1", string("(//name)[2]"));
    assertEquals("lo", string("(//name)[last()]"));
  }

  @Test
  void testScalarFilter() throws XPathException {
    assertEquals(3, number("(1 + 2)[true()]"));
    assertEquals(3, number("(1 + 2)[position() = 1]"));
    final XPathSet set = helper.evalRoot("(1 + 2)[false()]");
    assertEquals(SetType.EMPTY, set.getType());
    assertEquals(SetType.EMPTY, helper.evalRoot("(1 + 2)[false()][1]").getType());

    final XPathException e =
        assertThrows(XPathException.class, () -> helper.evalRoot("(1 + 2)[. = 3]"));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testNodeSetComparisons() throws XPathException {
    assertTrue(bool("interfaces/interface/mtu > 9000"));
    assertTrue(bool("interfaces/interface/mtu = 1500"));
    assertTrue(bool("interfaces/interface/name != 'eth0'"));
    assertFalse(bool("interfaces/interface/name = 'eth3'"));
    assertTrue(bool("interfaces/interface/name = interfaces/interface[3]/name"));
    assertFalse(bool("interfaces/interface/description = ''"));
    assertTrue(bool("interfaces/interface/description = false()"));
    assertTrue(bool("interfaces/interface/mtu = true()"));
  }

  @Test
  void testScalarComparisons() throws XPathException {
    assertTrue(bool("'abc' = 'abc'"));
    assertTrue(bool("1 = '1.0'"));
    assertFalse(bool("'1' = '1.0'"));
    assertTrue(bool("true() = 'x'"));
    assertFalse(bool("0 div 0 = 0 div 0"));
    assertTrue(bool("0 div 0 != 0 div 0"));
    assertTrue(bool("'10' > 9"));
    assertFalse(bool("'' < 1"));
  }

  @Test
  void testArithmetic() throws XPathException {
    assertEquals(7, number("1 + 2 * 3"));
    assertEquals(-1, number("1 - 2"));
    assertEquals(2.5, number("5 div 2"));
    assertEquals(1, number("7 mod 3"));
    assertEquals(-1, number("-7 mod 3"));
    assertEquals(2, number("--2"));
    assertEquals(Double.POSITIVE_INFINITY, number("1 div 0"));
    assertTrue(Double.isNaN(number("0 div 0")));
    assertTrue(Double.isNaN(number("'a' + 1")));
    assertEquals(10500, number("interfaces/interface[1]/mtu + interfaces/interface[2]/mtu"));
    assertEquals("Infinity", string("1 div 0"));
  }

  @Test
  void testLogic() throws XPathException {
    assertTrue(bool("true() or count(nothing)"));
    assertFalse(bool("false() and interfaces"));
    assertTrue(bool("interfaces and 1"));
    assertFalse(bool("0 or ''"));
    assertEquals(SetType.BOOLEAN, helper.evalRoot("1 or 0").getType());
  }

  @Test
  void testUnion() throws XPathException {
    assertEquals(3,
        number("count(interfaces/interface/name | interfaces/interface[1]/name)"));
    assertEquals("eth0", string("interfaces/interface[3]/name | interfaces/interface[1]/name"));

    final XPathException e =
        assertThrows(XPathException.class, () -> helper.evalRoot("interfaces | 1"));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testStepOnScalar() {
    final XPathException e =
        assertThrows(XPathException.class, () -> helper.evalRoot("1/name"));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testParentAndSelf() throws XPathException {
    assertEquals("lo", helper.eval("../interface[3]/name", helper.eth0).asString());
    assertEquals("eth0", helper.eval("./name", helper.eth0).asString());
    assertEquals(6, helper.eval("count(.//*)", helper.eth0).asNumber());
    assertEquals(1, number("count(..)"));
    assertEquals(1, number("count(/..)"));
    assertEquals(1, helper.eval("count(../../..)", helper.eth0).asNumber());
  }

  @Test
  void testNodeTypes() throws XPathException {
    assertEquals("eth0", helper.eval("name/text()", helper.eth0).asString());
    assertEquals(0, helper.eval("count(text())", helper.eth0).asNumber());
    assertEquals(6, helper.eval("count(node())", helper.eth0).asNumber());
    assertEquals(6, helper.eval("count(*/node())", helper.eth0).asNumber());
    assertEquals(0, helper.eval("count(//comment())", helper.eth0).asNumber());
  }

  @Test
  void testAttributes() throws XPathException {
    helper.eth0.addAttribute(helper.ifModule, "origin", "intended");
    helper.eth0.addAttribute(helper.xmlModule, "lang", "en-US");
    assertEquals("intended", helper.eval("@origin", helper.eth0).asString());
    assertEquals(2, helper.eval("count(@*)", helper.eth0).asNumber());
    assertEquals(1, helper.eval("count(@xml:*)", helper.eth0).asNumber());
    assertEquals(2, number("count(//@*)"));
    assertEquals(2, helper.eval("count(@node())", helper.eth0).asNumber());
  }

  @Test
  void testCurrentInPredicate() throws XPathException {
    assertEquals(1500,
        helper.eval("../interface[name = current()/lower-layer]/mtu", helper.eth1).asNumber());
    assertSame(helper.eth1, helper.eval("current()", helper.eth1).getNodes().get(0).node());
  }

  @Test
  void testStateHiddenUnderConfigRoot() throws XPathException {
    assertEquals(1, helper.eval("count(oper-status)", helper.eth0).asNumber());
    final XPathSet set = helper.evaluator.evaluate("count(oper-status)", helper.eth0,
        NodeType.ELEM, helper.ifModule, EnumSet.of(XPathOption.MUST)).getSet();
    assertEquals(0, set.asNumber());
  }

  @Test
  void testUnresolvedWhenDependency() throws XPathException {
    helper.descriptionSchema.setWhen("../enabled = 'true'");
    final SimpleDataNode description =
        helper.eth0.leafChild(helper.descriptionSchema, "uplink");
    description.setWhenStatus(WhenStatus.UNRESOLVED);

    final XPathResult result = helper.evalWhen("description = 'uplink'", helper.eth0);
    assertTrue(result.isUnresolved());
    assertSame(description, result.getBlockingNode());

    assertTrue(helper.eval("description = 'uplink'", helper.eth0).asBoolean());

    description.setWhenStatus(WhenStatus.TRUE);
    final XPathResult resolved = helper.evalWhen("description = 'uplink'", helper.eth0);
    assertFalse(resolved.isUnresolved());
    assertTrue(resolved.getSet().asBoolean());
  }
}
