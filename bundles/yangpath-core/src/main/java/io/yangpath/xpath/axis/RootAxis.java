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

import io.yangpath.api.SchemaNode;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <p>
 * Moves to the root of the evaluated tree, the start of an absolute location path.
 * </p>
 */
public final class RootAxis {

  private RootAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Replace the set content with the root entry.
   *
   * @param set the set
   * @param context the evaluation
   */
  public static void moveTo(final XPathSet set, final XPathContext context) {
    set.setSingleNode(context.rootEntry());
  }

  /**
   * Replace the context nodes with the schema root.
   *
   * @param set the set
   * @param context the analysis
   */
  public static void moveToSchema(final XPathSet set, final SchemaContext context) {
    set.takeSchemaContext();
    set.addSchemaNode((SchemaNode) null, context.getRootType(), SchemaEntry.IN_CONTEXT);
  }
}
