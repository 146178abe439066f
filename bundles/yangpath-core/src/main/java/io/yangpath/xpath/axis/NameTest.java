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

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Module;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.EvaluationContext;

/**
 * A parsed name test: {@code name}, {@code prefix:name}, {@code *} or {@code prefix:*}.
 *
 * @param prefix the prefix or {@code null}
 * @param name the local name or {@code *}
 */
public record NameTest(@Nullable String prefix, String name) {

  /** The wildcard name. */
  public static final String ANY = "*";

  public NameTest {
    checkNotNull(name);
  }

  /**
   * Parse the text of a name test token.
   *
   * @param text the token text
   * @return the name test
   */
  public static NameTest parse(final String text) {
    final int colon = text.indexOf(':');
    if (colon == -1) {
      return new NameTest(null, text);
    }
    return new NameTest(text.substring(0, colon), text.substring(colon + 1));
  }

  public boolean isAnyName() {
    return ANY.equals(name);
  }

  /**
   * Resolve the prefix.
   *
   * @param context the evaluation context
   * @return the module or {@code null} if there is no prefix
   * @throws XPathException if the prefix resolves to no module
   */
  public @Nullable Module resolve(final EvaluationContext context) throws XPathException {
    return prefix == null ? null : context.resolveModule(prefix);
  }

  /**
   * Match a node. Prefixed tests match the resolved module, a bare {@code *} matches every module
   * and an unprefixed name matches nodes of the local module or of the module of the node the
   * step starts from.
   *
   * @param nodeName name of the candidate
   * @param nodeModule module of the candidate
   * @param resolved the resolved prefix
   * @param localModule the local module of the expression
   * @param parentModule module of the node the step starts from, {@code null} for the root
   * @return {@code true} if the candidate matches
   */
  public boolean matches(final String nodeName, final Module nodeModule,
      final @Nullable Module resolved, final Module localModule,
      final @Nullable Module parentModule) {
    if (!isAnyName() && !name.equals(nodeName)) {
      return false;
    }
    if (resolved != null) {
      return nodeModule == resolved;
    }
    if (isAnyName()) {
      return true;
    }
    return nodeModule == localModule || nodeModule == parentModule;
  }

  @Override
  public String toString() {
    return prefix == null ? name : prefix + ':' + name;
  }
}
