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

package io.yangpath;

import java.util.EnumSet;
import java.util.Set;

import io.yangpath.api.SchemaNodeKind;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.node.SimpleContext;
import io.yangpath.node.SimpleDataNode;
import io.yangpath.node.SimpleIdentity;
import io.yangpath.node.SimpleLeafType;
import io.yangpath.node.SimpleModule;
import io.yangpath.node.SimpleSchemaNode;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.XPathEvaluator;
import io.yangpath.xpath.XPathOption;
import io.yangpath.xpath.XPathProperties;
import io.yangpath.xpath.XPathResult;
import io.yangpath.xpath.XPathSet;

/**
 * Interface configuration used by the tests.
 *
 * <pre>
 * interfaces
 *   interface eth0   ethernetCsmacd  enabled  mtu 1500   up    flags "up running"
 *   interface eth1   ethernetCsmacd  disabled mtu 9000   down  lower-layer eth0
 *   interface lo     softwareLoopback enabled mtu 65535  up
 * system
 *   hostname router1
 * </pre>
 *
 * {@code oper-status} is state data.
 */
public final class YangTestHelper {

  public final SimpleContext context = new SimpleContext();

  public final SimpleModule ifModule;

  public final SimpleModule ianaModule;

  public final SimpleModule sysModule;

  public final SimpleModule xmlModule;

  public final SimpleIdentity interfaceType;

  public final SimpleIdentity ianaInterfaceType;

  public final SimpleIdentity ethernet;

  public final SimpleIdentity loopback;

  public final SimpleSchemaNode interfacesSchema;

  public final SimpleSchemaNode interfaceSchema;

  public final SimpleSchemaNode nameSchema;

  public final SimpleSchemaNode typeSchema;

  public final SimpleSchemaNode enabledSchema;

  public final SimpleSchemaNode mtuSchema;

  public final SimpleSchemaNode operStatusSchema;

  public final SimpleSchemaNode flagsSchema;

  public final SimpleSchemaNode lowerLayerSchema;

  public final SimpleSchemaNode descriptionSchema;

  public final SimpleSchemaNode systemSchema;

  public final SimpleSchemaNode hostnameSchema;

  public final SimpleDataNode interfaces;

  public final SimpleDataNode eth0;

  public final SimpleDataNode eth1;

  public final SimpleDataNode lo;

  public final SimpleDataNode system;

  public final XPathEvaluator evaluator;

  public YangTestHelper() {
    this(new XPathEvaluator());
  }

  public YangTestHelper(final XPathEvaluator evaluator) {
    this.evaluator = evaluator;

    ifModule = context.addModule("ietf-interfaces", "if",
        "urn:ietf:params:xml:ns:yang:ietf-interfaces");
    ianaModule = context.addModule("iana-if-type", "ianaift",
        "urn:ietf:params:xml:ns:yang:iana-if-type");
    sysModule = context.addModule("ietf-system", "sys",
        "urn:ietf:params:xml:ns:yang:ietf-system");
    xmlModule = context.addModule("xml", "xml", "http://www.w3.org/XML/1998/namespace")
        .setImplemented(false);
    ifModule.addImport("ianaift", ianaModule);
    ianaModule.addImport("if", ifModule);

    interfaceType = ifModule.addIdentity("interface-type");
    ianaInterfaceType = ianaModule.addIdentity("iana-interface-type", interfaceType);
    ethernet = ianaModule.addIdentity("ethernetCsmacd", ianaInterfaceType);
    loopback = ianaModule.addIdentity("softwareLoopback", ianaInterfaceType);

    interfacesSchema = ifModule.container("interfaces");
    interfaceSchema = interfacesSchema.list("interface");
    nameSchema = interfaceSchema.leaf("name", SimpleLeafType.string());
    typeSchema = interfaceSchema.leaf("type", SimpleLeafType.identityref(interfaceType));
    enabledSchema = interfaceSchema.leaf("enabled", SimpleLeafType.of(TypeBase.BOOLEAN));
    mtuSchema = interfaceSchema.leaf("mtu", SimpleLeafType.of(TypeBase.UINT16));
    operStatusSchema = interfaceSchema.leaf("oper-status",
        SimpleLeafType.enumeration("up", "down", "testing")).setConfig(false);
    flagsSchema = interfaceSchema.leaf("flags",
        SimpleLeafType.bits("up", "broadcast", "running"));
    lowerLayerSchema = interfaceSchema.leafList("lower-layer",
        SimpleLeafType.leafref("../../interface/name"));
    descriptionSchema = interfaceSchema.leaf("description", SimpleLeafType.string());

    systemSchema = sysModule.container("system");
    hostnameSchema = systemSchema.leaf("hostname", SimpleLeafType.string());

    interfaces = SimpleDataNode.of(interfacesSchema);
    eth0 = interfaces.child(interfaceSchema);
    eth0.leafChild(nameSchema, "eth0");
    eth0.leafChild(typeSchema, "ianaift:ethernetCsmacd");
    eth0.leafChild(enabledSchema, "true");
    eth0.leafChild(mtuSchema, "1500");
    eth0.leafChild(operStatusSchema, "up");
    eth0.leafChild(flagsSchema, "up running");

    eth1 = interfaces.child(interfaceSchema);
    eth1.leafChild(nameSchema, "eth1");
    eth1.leafChild(typeSchema, "ianaift:ethernetCsmacd");
    eth1.leafChild(enabledSchema, "false");
    eth1.leafChild(mtuSchema, "9000");
    eth1.leafChild(operStatusSchema, "down");
    eth1.leafChild(lowerLayerSchema, "eth0");

    lo = interfaces.child(interfaceSchema);
    lo.leafChild(nameSchema, "lo");
    lo.leafChild(typeSchema, "ianaift:softwareLoopback");
    lo.leafChild(enabledSchema, "true");
    lo.leafChild(mtuSchema, "65535");
    lo.leafChild(operStatusSchema, "up");

    system = interfaces.appendSibling(SimpleDataNode.of(systemSchema));
    system.leafChild(hostnameSchema, "router1");
  }

  /**
   * Create a helper whose evaluator uses the given properties.
   *
   * @param properties the properties
   * @return the helper
   */
  public static YangTestHelper withProperties(final XPathProperties properties) {
    return new YangTestHelper(new XPathEvaluator(properties));
  }

  public static Set<XPathOption> noOptions() {
    return EnumSet.noneOf(XPathOption.class);
  }

  /**
   * Evaluate with the root as context node.
   *
   * @param expression the expression
   * @return the result
   * @throws XPathException if the evaluation fails
   */
  public XPathSet evalRoot(final String expression) throws XPathException {
    return evaluator.evaluate(expression, interfaces, NodeType.ROOT, ifModule, noOptions())
        .getSet();
  }

  /**
   * Evaluate with an element as context node.
   *
   * @param expression the expression
   * @param contextNode the context node
   * @return the result
   * @throws XPathException if the evaluation fails
   */
  public XPathSet eval(final String expression, final SimpleDataNode contextNode)
      throws XPathException {
    return evaluator.evaluate(expression, contextNode, NodeType.ELEM, ifModule, noOptions())
        .getSet();
  }

  /**
   * Evaluate a {@code when} style condition with an element as context node.
   *
   * @param expression the expression
   * @param contextNode the context node
   * @return the result, possibly unresolved
   * @throws XPathException if the evaluation fails
   */
  public XPathResult evalWhen(final String expression, final SimpleDataNode contextNode)
      throws XPathException {
    return evaluator.evaluate(expression, contextNode, NodeType.ELEM, ifModule,
        EnumSet.of(XPathOption.WHEN));
  }

  /**
   * Add an RPC with input and output to the interfaces module.
   *
   * @return the RPC node
   */
  public SimpleSchemaNode addResetRpc() {
    final SimpleSchemaNode rpc = ifModule.addNode(SchemaNodeKind.RPC, "reset");
    final SimpleSchemaNode input = rpc.addChild(SchemaNodeKind.INPUT, "input");
    input.leaf("target", SimpleLeafType.string())
        .addMust("/if:interfaces/if:interface[if:name = current()]");
    input.leaf("delay", SimpleLeafType.of(TypeBase.UINT32)).addMust(". < 60");
    final SimpleSchemaNode output = rpc.addChild(SchemaNodeKind.OUTPUT, "output");
    output.leaf("status", SimpleLeafType.string()).addMust("../status != ''");
    return rpc;
  }
}
