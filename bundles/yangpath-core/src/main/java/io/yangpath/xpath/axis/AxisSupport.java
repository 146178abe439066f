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
import io.yangpath.xpath.SetType;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * Checks shared by the move-to primitives.
 */
final class AxisSupport {

  private AxisSupport() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Check that a step is applied to a node-set.
   *
   * @param set the set
   * @param operation the step, for the message
   * @return {@code false} if the set is empty and the step has nothing to do
   * @throws XPathException if the set holds a scalar
   */
  static boolean requireNodeSet(final XPathSet set, final String operation)
      throws XPathException {
    if (set.getType() == SetType.EMPTY) {
      return false;
    }
    if (set.getType() != SetType.NODE_SET) {
      throw XPathError.NOT_A_NODE_SET.newException(operation, set.describe());
    }
    return true;
  }
}
