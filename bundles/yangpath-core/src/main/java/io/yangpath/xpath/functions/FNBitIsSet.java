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

import java.util.EnumSet;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.Splitter;

import io.yangpath.api.DataNode;
import io.yangpath.api.LeafType;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>FNBitIsSet</h1>
 * <p>
 * {@code bit-is-set(node-set, string)}: tests whether the bits value of the first node has the
 * named bit set.
 * </p>
 */
public class FNBitIsSet extends AbstractFunction {

  private static final Splitter BITS_SPLITTER =
      Splitter.on(' ').trimResults().omitEmptyStrings();

  public FNBitIsSet() {
    super("bit-is-set");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) throws XPathException {
    final @Nullable DataNode leaf = leafOf(firstNode(1, args.get(0)));
    final String bit = args.get(1).asString();
    final LeafType type =
        leaf == null ? null : findType(leaf.getSchema().getType(), TypeBase.BITS);
    if (type == null || leaf.getValue() == null || !type.getBits().containsKey(bit)) {
      set.setBoolean(false);
      return;
    }
    for (final String value : BITS_SPLITTER.split(leaf.getValue())) {
      if (value.equals(bit)) {
        set.setBoolean(true);
        return;
      }
    }
    set.setBoolean(false);
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    SchemaWarnings.checkType(context, args.get(0), "Argument #1 of bit-is-set()",
        EnumSet.of(TypeBase.BITS));
    SchemaWarnings.checkString(context, args.get(1), "Argument #2 of bit-is-set()");
  }
}
