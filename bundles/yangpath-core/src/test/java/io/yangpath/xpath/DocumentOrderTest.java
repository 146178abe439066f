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

package io.yangpath.xpath;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.yangpath.YangTestHelper;
import io.yangpath.api.Attribute;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleDataNode;

/**
 * Tests for {@link DocumentOrder}.
 */
class DocumentOrderTest {

  private YangTestHelper helper;

  private DocumentOrder order;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper();
    order = new DocumentOrder(helper.interfaces);
  }

  @Test
  void testPreorderPositions() throws XPathException {
    assertEquals(1, order.positionOf(helper.interfaces));
    assertEquals(2, order.positionOf(helper.eth0));
    assertEquals(3, order.positionOf(helper.eth0.getFirstChild()));
    assertEquals(9, order.positionOf(helper.eth1));
    assertTrue(order.positionOf(helper.system) > order.positionOf(helper.lo.getFirstChild()));
  }

  @Test
  void testEntryKeys() throws XPathException {
    helper.eth0.addAttribute(helper.xmlModule, "lang", "en");
    helper.eth0.addAttribute(helper.ifModule, "origin", "intended");
    final Attribute lang = helper.eth0.getAttributes().get(0);
    final Attribute origin = helper.eth0.getAttributes().get(1);

    final long element = order.keyOf(NodeEntry.ofElement(helper.eth0));
    final long first = order.keyOf(NodeEntry.ofAttribute(lang));
    final long second = order.keyOf(NodeEntry.ofAttribute(origin));
    final long text = order.keyOf(NodeEntry.ofText(helper.eth0));
    final long child = order.keyOf(NodeEntry.ofElement(helper.eth0.getFirstChild()));

    assertTrue(element < first);
    assertTrue(first < second);
    assertTrue(second < text);
    assertTrue(text < child);
    assertEquals(0L, order.keyOf(new NodeEntry(NodeType.ROOT, helper.interfaces, null)));
  }

  @Test
  void testNodeAddedAfterFirstUse() throws XPathException {
    order.positionOf(helper.lo);
    final SimpleDataNode added = helper.system.leafChild(helper.hostnameSchema, "backup");
    assertTrue(order.positionOf(added) > order.positionOf(helper.system));
  }

  @Test
  void testForeignNode() {
    final SimpleDataNode foreign = SimpleDataNode.of(helper.interfacesSchema);
    final XPathException e =
        assertThrows(XPathException.class, () -> order.positionOf(foreign));
    assertEquals(XPathError.INTERNAL, e.getError());
  }
}
