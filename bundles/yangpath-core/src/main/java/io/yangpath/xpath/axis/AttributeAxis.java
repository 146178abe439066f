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

package io.yangpath.xpath.axis;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Attribute;
import io.yangpath.api.Module;
import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <p>
 * The attribute axis ({@code @name}). Attributes are metadata of data nodes and are never part
 * of schema atoms.
 * </p>
 */
public final class AttributeAxis {

  private AttributeAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Replace every member with its attributes matching the name test. Unprefixed names match
   * attributes of any module.
   *
   * @param set the set
   * @param context the evaluation
   * @param test the name test
   * @param allDesc {@code true} if the step follows {@code //}
   * @throws XPathException if the set is not a node-set or the prefix is unknown
   * @throws UnresolvedDependencyException if a traversed node has an unresolved when
   */
  public static void moveTo(final XPathSet set, final XPathContext context, final NameTest test,
      final boolean allDesc) throws XPathException, UnresolvedDependencyException {
    final @Nullable Module module = test.resolve(context);
    if (!AxisSupport.requireNodeSet(set, "attribute step")) {
      return;
    }
    if (allDesc) {
      SelfAxis.moveTo(set, context, true);
    }
    final List<NodeEntry> result = new ArrayList<>();
    for (final NodeEntry entry : set.getNodes()) {
      if (entry.type() != NodeType.ELEM) {
        continue;
      }
      for (final Attribute attribute : entry.node().getAttributes()) {
        if (module != null && attribute.getModule() != module) {
          continue;
        }
        if (test.isAnyName() || test.name().equals(attribute.getName())) {
          result.add(NodeEntry.ofAttribute(attribute));
        }
      }
    }
    set.replaceNodes(result);
    set.sortAndClean();
  }

  /**
   * Attributes have no schema nodes, the context is dropped.
   *
   * @param set the set
   * @param context the analysis
   * @param test the name test
   * @throws XPathException if the prefix is unknown
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context,
      final NameTest test) throws XPathException {
    test.resolve(context);
    set.clearSchemaContext();
  }
}
