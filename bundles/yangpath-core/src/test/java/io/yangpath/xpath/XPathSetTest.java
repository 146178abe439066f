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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.yangpath.YangTestHelper;
import io.yangpath.api.DataNode;
import io.yangpath.exception.XPathException;

/**
 * Tests for {@link XPathSet}.
 */
class XPathSetTest {

  private YangTestHelper helper;

  private DocumentOrder order;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper();
    order = new DocumentOrder(helper.interfaces);
  }

  private XPathSet newSet(final int hashThreshold) {
    return new XPathSet(order, hashThreshold, NodeType.ROOT, false);
  }

  private static DataNode name(final DataNode list) {
    return list.getFirstChild();
  }

  @Test
  void testBooleanCast() {
    final XPathSet set = new XPathSet();
    assertFalse(set.asBoolean());
    set.setNumber(Double.NaN);
    assertFalse(set.asBoolean());
    set.setNumber(-0.5);
    assertTrue(set.asBoolean());
    set.setString("");
    assertFalse(set.asBoolean());
    set.setString("false");
    assertTrue(set.asBoolean());
    set.clearNodes();
    assertFalse(set.asBoolean());
  }

  @Test
  void testNumberCast() {
    final XPathSet set = new XPathSet();
    set.setString(" 12.5\n");
    assertEquals(12.5, set.asNumber());
    set.setString("");
    assertTrue(Double.isNaN(set.asNumber()));
    set.setString("1e3");
    assertTrue(Double.isNaN(set.asNumber()));
    set.setString("+1");
    assertTrue(Double.isNaN(set.asNumber()));
    set.setBoolean(true);
    assertEquals(1.0, set.asNumber());
    set.setEmpty();
    assertTrue(Double.isNaN(set.asNumber()));
  }

  @Test
  void testFormatNumber() {
    assertEquals("NaN", XPathSet.formatNumber(Double.NaN));
    assertEquals("Infinity", XPathSet.formatNumber(Double.POSITIVE_INFINITY));
    assertEquals("-Infinity", XPathSet.formatNumber(Double.NEGATIVE_INFINITY));
    assertEquals("3", XPathSet.formatNumber(3.0));
    assertEquals("0", XPathSet.formatNumber(-0.0));
    assertEquals("-0.25", XPathSet.formatNumber(-0.25));
    assertEquals("0.000001", XPathSet.formatNumber(1e-6));
    assertEquals("100000000000000000000", XPathSet.formatNumber(1e20));
  }

  @Test
  void testStringValueOfNodes() throws XPathException {
    final XPathSet set = newSet(20);
    set.setSingleNode(NodeEntry.ofElement(name(helper.eth1)));
    assertEquals("eth1", set.asString());
    assertTrue(Double.isNaN(set.asNumber()));

    set.setSingleNode(NodeEntry.ofElement(helper.system));
    assertEquals("router1", set.asString());

    set.cast(SetType.STRING);
    assertEquals(SetType.STRING, set.getType());
    assertEquals("router1", set.getString());
  }

  @Test
  void testHiddenStateInStringValue() {
    final XPathSet shown = new XPathSet(order, 20, NodeType.ROOT_CONFIG, false);
    shown.setSingleNode(NodeEntry.ofElement(helper.lo));
    assertEquals("loianaift:softwareLoopbacktrue65535up", shown.asString());

    final XPathSet hidden = new XPathSet(order, 20, NodeType.ROOT_CONFIG, true);
    hidden.setSingleNode(NodeEntry.ofElement(helper.lo));
    assertEquals("loianaift:softwareLoopbacktrue65535", hidden.asString());
  }

  @Test
  void testScalarToNodeSetFails() {
    final XPathSet set = new XPathSet();
    set.setNumber(1);
    final XPathException e =
        assertThrows(XPathException.class, () -> set.cast(SetType.NODE_SET));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testSortAndClean() throws XPathException {
    for (final int threshold : new int[] {2, 100}) {
      final XPathSet set = newSet(threshold);
      set.clearNodes();
      set.addNode(NodeEntry.ofElement(helper.lo));
      set.addNode(NodeEntry.ofElement(helper.eth0));
      set.addNode(NodeEntry.ofElement(helper.lo));
      set.addNode(NodeEntry.ofElement(helper.interfaces));
      assertFalse(set.addNodeUnique(NodeEntry.ofElement(helper.eth0)));
      set.sortAndClean();
      assertEquals(List.of(NodeEntry.ofElement(helper.interfaces),
          NodeEntry.ofElement(helper.eth0), NodeEntry.ofElement(helper.lo)), set.getNodes());
    }
  }

  @Test
  void testUnion() throws XPathException {
    final XPathSet left = newSet(20);
    left.clearNodes();
    left.addNode(NodeEntry.ofElement(helper.eth1));
    left.addNode(NodeEntry.ofElement(helper.system));
    final XPathSet right = newSet(20);
    right.clearNodes();
    right.addNode(NodeEntry.ofElement(helper.system));
    right.addNode(NodeEntry.ofElement(helper.eth0));

    left.union(right);
    assertEquals(List.of(NodeEntry.ofElement(helper.eth0), NodeEntry.ofElement(helper.eth1),
        NodeEntry.ofElement(helper.system)), left.getNodes());
  }

  @Test
  void testUnionWithEmpty() throws XPathException {
    final XPathSet empty = newSet(20);
    final XPathSet nodes = newSet(20);
    nodes.clearNodes();
    empty.union(nodes);
    assertEquals(SetType.NODE_SET, empty.getType());
    assertTrue(empty.getNodes().isEmpty());
  }

  @Test
  void testContextAndCopy() {
    final XPathSet set = newSet(20);
    set.setSingleNode(NodeEntry.ofElement(helper.eth0));
    set.setContext(2, 3);
    final XPathSet copy = set.copy();
    assertEquals(2, copy.getContextPosition());
    assertEquals(3, copy.getContextSize());
    assertEquals(set.getNodes(), copy.getNodes());

    copy.addNode(NodeEntry.ofElement(helper.lo));
    assertEquals(1, set.getNodes().size());
    assertEquals(SetType.EMPTY, set.emptyCopy().getType());
  }

  @Test
  void testSchemaMarkers() {
    final XPathSet set = new XPathSet();
    set.addSchemaNode(helper.interfacesSchema, NodeType.ELEM, SchemaEntry.NOT_IN_CONTEXT);
    assertEquals(0, set.addSchemaNode(helper.interfacesSchema, NodeType.ELEM,
        SchemaEntry.IN_CONTEXT));
    set.addSchemaNode(helper.interfaceSchema, NodeType.ELEM, SchemaEntry.IN_CONTEXT);
    assertEquals(2, set.getSchemaContext().size());

    final int parked = set.newContextMarker();
    assertEquals(SchemaEntry.FIRST_PREDICATE_MARKER, parked);
    set.remark(SchemaEntry.IN_CONTEXT, parked);
    assertTrue(set.getSchemaContext().isEmpty());
    set.addSchemaNode(helper.interfaceSchema, NodeType.ELEM, SchemaEntry.IN_CONTEXT);
    assertEquals(parked, set.getSchemaEntries().get(1).getMarker());
    assertEquals(parked + 1, set.newContextMarker());

    set.remark(parked, SchemaEntry.IN_CONTEXT);
    set.clearSchemaContext();
    assertEquals(2, set.getSchemaEntries().size());
    assertTrue(set.getSchemaContext().isEmpty());
  }

  @Test
  void testMergeSchema() {
    final XPathSet set = new XPathSet();
    set.addSchemaNode(helper.nameSchema, NodeType.ELEM, SchemaEntry.NOT_IN_CONTEXT);
    final XPathSet other = new XPathSet();
    other.addSchemaNode(helper.nameSchema, NodeType.ELEM, SchemaEntry.IN_CONTEXT);
    other.addSchemaNode(helper.mtuSchema, NodeType.ELEM, SchemaEntry.NOT_IN_CONTEXT);
    set.mergeSchema(other);
    assertEquals(2, set.getSchemaEntries().size());
    assertTrue(set.getSchemaEntries().get(0).isInContext());
  }
}
