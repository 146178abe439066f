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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.yangpath.YangTestHelper;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleLeafType;
import io.yangpath.node.SimpleSchemaNode;
import io.yangpath.xpath.DiagnosticListener;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaAtoms;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathEvaluator;
import io.yangpath.xpath.XPathOption;
import io.yangpath.xpath.XPathProperties;

/**
 * Tests for {@link SchemaEvaluator}.
 */
@ExtendWith(MockitoExtension.class)
class SchemaEvaluatorTest {

  @Mock
  private DiagnosticListener listener;

  private YangTestHelper helper;

  @BeforeEach
  void setUp() {
    helper = new YangTestHelper(new XPathEvaluator(new XPathProperties(), listener));
  }

  private SchemaAtoms atomize(final String expression) throws XPathException {
    return helper.evaluator.atomize(expression, helper.interfaceSchema, NodeType.ELEM,
        helper.ifModule, YangTestHelper.noOptions());
  }

  private static List<SchemaNode> inContext(final SchemaAtoms atoms) {
    return atoms.set().getSchemaContext().stream().map(SchemaEntry::getNode).toList();
  }

  private void verifyWarning(final String fragment) {
    verify(listener, atLeastOnce()).warning(argThat(d -> d.message().contains(fragment)));
  }

  @Test
  void testAbsolutePathWithPredicate() throws XPathException {
    final SchemaAtoms atoms = helper.evaluator.atomize(
        "/if:interfaces/if:interface[if:name = 'eth0']/if:mtu", null, NodeType.ROOT,
        helper.ifModule, YangTestHelper.noOptions());
    assertEquals(List.of(helper.interfacesSchema, helper.interfaceSchema, helper.nameSchema,
        helper.mtuSchema), atoms.getNodes());
    assertEquals(List.of(helper.mtuSchema), inContext(atoms));
    verifyNoInteractions(listener);
  }

  @Test
  void testPredicateKeepsOuterContext() throws XPathException {
    final SchemaAtoms atoms = atomize("../interface[enabled = 'true'][mtu > 1500]");
    assertEquals(List.of(helper.interfaceSchema), inContext(atoms));
    assertTrue(atoms.getNodes().contains(helper.enabledSchema));
    assertTrue(atoms.getNodes().contains(helper.mtuSchema));
    verifyNoInteractions(listener);
  }

  @Test
  void testNoShortCircuit() throws XPathException {
    final SchemaAtoms atoms = atomize("true() or mtu > 1500 and name != 'lo'");
    assertTrue(atoms.getNodes().contains(helper.mtuSchema));
    assertTrue(atoms.getNodes().contains(helper.nameSchema));
    assertTrue(inContext(atoms).isEmpty());
  }

  @Test
  void testMissingNode() throws XPathException {
    final SchemaAtoms atoms = atomize("nosuch = 1");
    verifyWarning("Schema node \"nosuch\" not found.");
    assertEquals(List.of(helper.interfaceSchema), atoms.getNodes());
  }

  @Test
  void testWildcardIsNotReported() throws XPathException {
    final SchemaAtoms atoms = atomize("count(description/*)");
    assertTrue(atoms.getNodes().contains(helper.descriptionSchema));
    verify(listener, never()).warning(any());
  }

  @Test
  void testLiteralOutOfType() throws XPathException {
    atomize("mtu = 'abc'");
    verifyWarning("Value \"abc\" does not fit the type of node \"mtu\".");
  }

  @Test
  void testNumberOutOfRange() throws XPathException {
    atomize("70000 < mtu");
    verifyWarning("Value \"70000\" does not fit the type of node \"mtu\".");
  }

  @Test
  void testEnumLiteral() throws XPathException {
    atomize("oper-status = 'up'");
    verifyNoInteractions(listener);
    atomize("oper-status = 'sideways'");
    verifyWarning("Value \"sideways\"");
  }

  @Test
  void testNonLeafOperand() throws XPathException {
    atomize("../interface = 'eth0'");
    verifyWarning("list node \"interface\"");
  }

  @Test
  void testNonNumericOperand() throws XPathException {
    atomize("name + 1");
    verifyWarning("is node \"name\", not of numeric type.");
  }

  @Test
  void testFunctionArgumentType() throws XPathException {
    atomize("bit-is-set(name, 'up')");
    verifyWarning("Argument #1 of bit-is-set() is node \"name\"");
  }

  @Test
  void testLeafrefAcceptedAsString() throws XPathException {
    atomize("starts-with(lower-layer, 'eth')");
    verifyNoInteractions(listener);
  }

  @Test
  void testDerefFollowsLeafref() throws XPathException {
    final SchemaAtoms atoms = atomize("deref(lower-layer)/../mtu");
    assertTrue(atoms.getNodes().contains(helper.lowerLayerSchema));
    assertTrue(atoms.getNodes().contains(helper.nameSchema));
    assertEquals(List.of(helper.mtuSchema), inContext(atoms));
    verifyNoInteractions(listener);
  }

  @Test
  void testCurrent() throws XPathException {
    final SchemaAtoms atoms = atomize("../interface[name = current()/lower-layer]/mtu");
    assertTrue(atoms.getNodes().contains(helper.lowerLayerSchema));
    assertEquals(List.of(helper.mtuSchema), inContext(atoms));
    verifyNoInteractions(listener);
  }

  @Test
  void testConfigRootHidesState() throws XPathException {
    final SchemaAtoms atoms = helper.evaluator.atomize("oper-status = 'up'",
        helper.interfaceSchema, NodeType.ELEM, helper.ifModule,
        EnumSet.of(XPathOption.MUST));
    assertFalse(atoms.getNodes().contains(helper.operStatusSchema));
    verifyWarning("Schema node \"oper-status\" not found.");
  }

  @Test
  void testAugmentedNodesNeedTheirPrefix() throws XPathException {
    final SimpleSchemaNode augment = helper.ianaModule.augment(helper.interfaceSchema);
    final SimpleSchemaNode speed = augment.leaf("speed", SimpleLeafType.string());

    assertEquals(List.of(speed), inContext(atomize("ianaift:speed")));
    verifyNoInteractions(listener);
    assertTrue(inContext(atomize("speed")).isEmpty());
    verifyWarning("Schema node \"speed\" not found.");
  }

  @Test
  void testChoiceIsTransparent() throws XPathException {
    final SimpleSchemaNode choice = helper.interfaceSchema.choice("encapsulation");
    final SimpleSchemaNode vlan = choice.caseNode("dot1q").leaf("vlan-id",
        SimpleLeafType.of(TypeBase.UINT16));
    assertEquals(List.of(vlan), inContext(atomize("vlan-id")));
  }

  @Test
  void testWhenContextOfChoice() throws XPathException {
    final SimpleSchemaNode choice = helper.interfaceSchema.choice("encapsulation");
    final SchemaAtoms atoms = helper.evaluator.atomize("enabled = 'true'", choice,
        NodeType.ELEM, helper.ifModule, EnumSet.of(XPathOption.WHEN));
    assertSame(helper.interfaceSchema, atoms.contextNode());
    assertTrue(atoms.getNodes().contains(helper.enabledSchema));
  }

  @Test
  void testUnknownPrefixFails() {
    final XPathException e =
        assertThrows(XPathException.class, () -> atomize("foo:mtu"));
    assertEquals(XPathError.UNKNOWN_PREFIX, e.getError());
  }

  @Test
  void testRootChildren() throws XPathException {
    final SchemaAtoms atoms = helper.evaluator.atomize("/*", null, NodeType.ROOT,
        helper.ifModule, YangTestHelper.noOptions());
    assertEquals(List.of(helper.interfacesSchema, helper.systemSchema), inContext(atoms));
  }
}
