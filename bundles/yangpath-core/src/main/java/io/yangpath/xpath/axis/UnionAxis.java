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

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * <p>
 * The union operator {@code |} of two node-sets.
 * </p>
 */
public final class UnionAxis {

  private UnionAxis() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Merge {@code other} into {@code set} in document order.
   *
   * @param set the left operand, receives the result
   * @param other the right operand
   * @throws XPathException if an operand is not a node-set
   */
  public static void moveTo(final XPathSet set, final XPathSet other) throws XPathException {
    if (!set.isNodeSet()) {
      throw XPathError.NOT_A_NODE_SET.newException("union", set.describe());
    }
    if (!other.isNodeSet()) {
      throw XPathError.NOT_A_NODE_SET.newException("union", other.describe());
    }
    set.union(other);
  }

  /**
   * Merge the atoms of {@code other} into {@code set}.
   *
   * @param set the left operand, receives the result
   * @param other the right operand
   */
  public static void moveToSchema(final XPathSet set, final XPathSet other) {
    set.mergeSchema(other);
  }
}
