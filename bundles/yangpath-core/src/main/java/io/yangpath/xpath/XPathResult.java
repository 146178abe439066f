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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.DataNode;

/**
 * Outcome of an evaluation: a value, or unresolved because a node with a pending {@code when}
 * condition was crossed.
 */
public final class XPathResult {

  private final @Nullable XPathSet set;

  private final @Nullable DataNode blockingNode;

  private XPathResult(final @Nullable XPathSet set, final @Nullable DataNode blockingNode) {
    this.set = set;
    this.blockingNode = blockingNode;
  }

  public static XPathResult of(final XPathSet set) {
    return new XPathResult(checkNotNull(set), null);
  }

  public static XPathResult unresolved(final DataNode blockingNode) {
    return new XPathResult(null, checkNotNull(blockingNode));
  }

  public boolean isUnresolved() {
    return set == null;
  }

  /**
   * Get the value.
   *
   * @return the result set
   * @throws IllegalStateException if the result is unresolved
   */
  public XPathSet getSet() {
    checkState(set != null, "result is unresolved");
    return set;
  }

  /**
   * Get the node whose {@code when} condition blocked the evaluation.
   *
   * @return the node
   * @throws IllegalStateException if the result is resolved
   */
  public DataNode getBlockingNode() {
    checkState(blockingNode != null, "result is resolved");
    return blockingNode;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).omitNullValues().add("set", set)
        .add("unresolvedOn", blockingNode).toString();
  }
}
