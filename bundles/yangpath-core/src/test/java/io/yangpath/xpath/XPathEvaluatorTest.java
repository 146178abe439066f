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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.yangpath.YangTestHelper;
import io.yangpath.api.DataNode;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.SchemaNodeKind;
import io.yangpath.api.TypeBase;
import io.yangpath.api.WhenStatus;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleDataNode;
import io.yangpath.node.SimpleLeafType;
import io.yangpath.node.SimpleSchemaNode;
import io.yangpath.xpath.parser.Expression;

/**
 * Tests for {@link XPathEvaluator}.
 */
class XPathEvaluatorTest {

  private YangTestHelper helper;

  private XPathEvaluator evaluator;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper();
    evaluator = helper.evaluator;
  }

  @Test
  void testScalarExpressions() throws XPathException {
    final XPathSet sum = helper.evalRoot("1 + 1");
    assertEquals(SetType.NUMBER, sum.getType());
    assertEquals(2, sum.getNumber());

    final XPathSet equal = helper.evalRoot("'a' = 'a'");
    assertEquals(SetType.BOOLEAN, equal.getType());
    assertTrue(equal.getBoolean());

    final XPathSet substring = helper.evalRoot("substring('12345', 2, 3)");
    assertEquals(SetType.STRING, substring.getType());
    assertEquals("234", substring.getString());
  }

  @Test
  void testCountChildren() throws XPathException {
    final SimpleSchemaNode clock = helper.systemSchema.container("clock");
    final SimpleDataNode data = helper.system.child(clock);
    final SimpleSchemaNode zone = clock.leaf("timezone-name", SimpleLeafType.string());
    final SimpleSchemaNode offset =
        clock.leaf("timezone-utc-offset", SimpleLeafType.string());
    final SimpleSchemaNode source = clock.leaf("source", SimpleLeafType.string());
    data.leafChild(zone, "Europe/Berlin");
    data.leafChild(offset, "60");
    data.leafChild(source, "ntp");

    final XPathSet count = evaluator.evaluate("count(*)", data, NodeType.ELEM,
        helper.sysModule, YangTestHelper.noOptions()).getSet();
    assertEquals(3, count.getNumber());
  }

  @Test
  void testSiblingByKey() throws XPathException {
    final XPathSet set = helper.eval("../interface[name = 'eth1']", helper.eth0);
    assertEquals(SetType.NODE_SET, set.getType());
    assertEquals(List.of(NodeEntry.ofElement(helper.eth1)), set.getNodes());
  }

  @Test
  void testUnresolvedSibling() throws XPathException {
    helper.descriptionSchema.setWhen("../enabled = 'true'");
    final SimpleDataNode description =
        helper.eth0.leafChild(helper.descriptionSchema, "uplink");
    description.setWhenStatus(WhenStatus.UNRESOLVED);

    final XPathResult result = helper.evalWhen("../description != ''", description);
    assertTrue(result.isUnresolved());
    assertSame(description, result.getBlockingNode());
    assertThrows(IllegalStateException.class, result::getSet);
  }

  @Test
  void testEvaluateWhen() throws XPathException {
    helper.descriptionSchema.setWhen("../enabled = 'true'");
    final SimpleDataNode eth0Description =
        helper.eth0.leafChild(helper.descriptionSchema, "uplink");
    final SimpleDataNode eth1Description =
        helper.eth1.leafChild(helper.descriptionSchema, "spare");

    final XPathResult holds = evaluator.evaluateWhen(eth0Description);
    assertEquals(SetType.BOOLEAN, holds.getSet().getType());
    assertTrue(holds.getSet().getBoolean());
    assertFalse(evaluator.evaluateWhen(eth1Description).getSet().getBoolean());

    assertThrows(IllegalArgumentException.class, () -> evaluator.evaluateWhen(helper.eth0));
  }

  @Test
  void testEvaluateWhenOnUnresolvedDependency() throws XPathException {
    helper.descriptionSchema.setWhen("../enabled = 'true'");
    helper.mtuSchema.setWhen("../description != ''");
    final SimpleDataNode description =
        helper.eth0.leafChild(helper.descriptionSchema, "uplink");
    description.setWhenStatus(WhenStatus.UNRESOLVED);
    final DataNode mtu = evaluator.findPath(helper.eth0, "mtu").get(0);
    assertSame(helper.mtuSchema, mtu.getSchema());

    final XPathResult result = evaluator.evaluateWhen(mtu);
    assertTrue(result.isUnresolved());
    assertSame(description, result.getBlockingNode());
  }

  @Test
  void testCheckMusts() throws XPathException {
    helper.mtuSchema.addMust(". >= 68").addMust(". <= 9000");
    final DataNode eth1Mtu = evaluator.findPath(helper.eth1, "mtu").get(0);
    final DataNode loMtu = evaluator.findPath(helper.lo, "mtu").get(0);
    assertTrue(evaluator.checkMusts(eth1Mtu).isEmpty());
    assertEquals(List.of(". <= 9000"), evaluator.checkMusts(loMtu));
  }

  @Test
  void testFindPath() throws XPathException {
    final List<DataNode> names = evaluator.findPath(helper.eth0, "../interface/name");
    assertEquals(3, names.size());
    assertEquals("lo", names.get(2).getValue());

    assertTrue(evaluator.findPath(helper.eth0, "nosuch").isEmpty());
    assertTrue(evaluator.findPath(helper.eth0, "name/text()").isEmpty());

    final XPathException e =
        assertThrows(XPathException.class, () -> evaluator.findPath(helper.eth0, "1 + 1"));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testCast() throws XPathException {
    final XPathSet set = helper.eval(".", helper.lo);
    evaluator.cast(set, SetType.STRING, helper.lo, helper.ifModule,
        EnumSet.of(XPathOption.MUST));
    assertEquals("loianaift:softwareLoopbacktrue65535", set.getString());

    final XPathSet plain = helper.eval(".", helper.lo);
    evaluator.cast(plain, SetType.STRING, helper.lo, helper.ifModule,
        YangTestHelper.noOptions());
    assertEquals("loianaift:softwareLoopbacktrue65535up", plain.getString());

    final XPathSet number = helper.eval("mtu", helper.lo);
    evaluator.cast(number, SetType.NUMBER, helper.lo, helper.ifModule,
        YangTestHelper.noOptions());
    assertEquals(65535, number.getNumber());

    final XPathSet scalar = helper.evalRoot("1");
    final XPathException e = assertThrows(XPathException.class,
        () -> evaluator.cast(scalar, SetType.NODE_SET, helper.lo, helper.ifModule,
            YangTestHelper.noOptions()));
    assertEquals(XPathError.NOT_A_NODE_SET, e.getError());
  }

  @Test
  void testFindXPathAtoms() throws XPathException {
    final List<SchemaNode> atoms = evaluator.findXPathAtoms(helper.mtuSchema, NodeType.ELEM,
        "../enabled = 'true' and ../name != 'lo'", YangTestHelper.noOptions());
    assertEquals(List.of(helper.mtuSchema, helper.interfaceSchema, helper.enabledSchema,
        helper.nameSchema), atoms);
  }

  @Test
  void testAtomizeNode() throws XPathException {
    helper.mtuSchema.setWhen("../enabled = 'true'").addMust(". >= ../../interface/mtu");
    final XPathSet atoms = evaluator.atomizeNode(helper.mtuSchema);
    final List<SchemaNode> nodes = new SchemaAtoms(atoms, null).getNodes();
    assertTrue(nodes.contains(helper.enabledSchema));
    assertTrue(nodes.contains(helper.interfacesSchema));
    assertTrue(atoms.getSchemaContext().isEmpty());

    assertTrue(evaluator.atomizeNode(helper.nameSchema).getSchemaEntries().isEmpty());
  }

  @Test
  void testAtomizeConstraints() throws XPathException {
    final SimpleSchemaNode rpc = helper.addResetRpc();
    final SchemaNode input = rpc.getChildren().get(0);
    final SchemaNode target = input.getChildren().get(0);

    final List<SchemaNode> all = evaluator.atomizeConstraints(input, true, false);
    assertTrue(all.contains(helper.interfacesSchema));
    assertTrue(all.contains(target));

    final List<SchemaNode> external = evaluator.atomizeConstraints(input, true, true);
    assertEquals(List.of(helper.interfacesSchema, helper.interfaceSchema, helper.nameSchema),
        external);

    assertTrue(evaluator.atomizeConstraints(target, false, true).contains(helper.nameSchema));
    assertThrows(IllegalArgumentException.class,
        () -> evaluator.atomizeConstraints(helper.mtuSchema, false, false));
  }

  @Test
  void testDependencyFlags() throws XPathException {
    final SimpleSchemaNode rpc = helper.addResetRpc();
    final SimpleSchemaNode input = (SimpleSchemaNode) rpc.getChildren().get(0);
    final SchemaNode target = input.getChildren().get(0);
    final SchemaNode delay = input.getChildren().get(1);
    final SimpleSchemaNode force = input.leaf("force", SimpleLeafType.of(TypeBase.BOOLEAN))
        .addMust("/if:interfaces/if:interface[if:name = 'eth0']/if:oper-status = 'up'");

    final NodeAtoms targetAtoms = evaluator.atomizeNode(target, true);
    assertTrue(targetAtoms.configDependent());
    assertFalse(targetAtoms.stateDependent());
    assertTrue(targetAtoms.isExternallyDependent());

    final NodeAtoms forceAtoms = evaluator.atomizeNode(force, true);
    assertTrue(forceAtoms.stateDependent());
    assertTrue(forceAtoms.configDependent());

    final NodeAtoms delayAtoms = evaluator.atomizeNode(delay, true);
    assertFalse(delayAtoms.isExternallyDependent());
    assertEquals(List.of(delay), new SchemaAtoms(delayAtoms.set(), null).getNodes());

    final NodeAtoms unmarked = evaluator.atomizeNode(force, false);
    assertFalse(unmarked.isExternallyDependent());
    assertTrue(new SchemaAtoms(unmarked.set(), null).getNodes()
        .contains(helper.operStatusSchema));
  }

  @Test
  void testDependencyFlagsOutsideOperations() throws XPathException {
    helper.mtuSchema.addMust(". <= 9000");
    assertFalse(evaluator.atomizeNode(helper.mtuSchema, true).isExternallyDependent());

    helper.operStatusSchema.addMust("../enabled = 'true' or . = 'down'");
    final NodeAtoms operStatus = evaluator.atomizeNode(helper.operStatusSchema, true);
    assertTrue(operStatus.configDependent());
    assertFalse(operStatus.stateDependent());

    // a config root hides the state leaf from a config node
    helper.enabledSchema.addMust("../oper-status = 'up'");
    assertFalse(evaluator.atomizeNode(helper.enabledSchema, true).stateDependent());
  }

  @Test
  void testOutputConstraints() throws XPathException {
    final SimpleSchemaNode rpc = helper.addResetRpc();
    final SchemaNode output = rpc.getChildren().get(1);
    assertEquals(SchemaNodeKind.OUTPUT, output.getKind());
    final List<SchemaNode> atoms = evaluator.atomizeConstraints(output, true, false);
    assertEquals("status", atoms.get(0).getName());
  }

  @Test
  void testConcurrentCompile() throws Exception {
    final int threads = 8;
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      final CountDownLatch start = new CountDownLatch(1);
      final List<Future<Expression>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return evaluator.compile("count(../interface[enabled = 'true']) > 1");
        }));
      }
      start.countDown();
      final Expression first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (final Future<Expression> future : futures) {
        assertSame(first, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    final XPathException e = assertThrows(XPathException.class, () -> evaluator.compile("1 +"));
    assertEquals(XPathError.UNEXPECTED_END, e.getError());
    assertThrows(XPathException.class, () -> evaluator.compile("1 +"));
  }

  @Test
  void testCheckSyntax() throws XPathException {
    helper.mtuSchema.setWhen("../enabled = 'true'");
    evaluator.checkSyntax(helper.mtuSchema);
    helper.nameSchema.addMust("string-length(.) < ");
    final XPathException e =
        assertThrows(XPathException.class, () -> evaluator.checkSyntax(helper.nameSchema));
    assertEquals(XPathError.UNEXPECTED_END, e.getError());
  }
}
