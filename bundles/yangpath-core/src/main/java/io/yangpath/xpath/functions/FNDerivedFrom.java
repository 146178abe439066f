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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.DataNode;
import io.yangpath.api.Identity;
import io.yangpath.api.Module;
import io.yangpath.api.TypeBase;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.EvaluationContext;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>FNDerivedFrom</h1>
 * <p>
 * {@code derived-from(node-set, string)}: tests whether any node holds an identity derived from
 * the named identity, directly or through other bases.
 * </p>
 */
public class FNDerivedFrom extends AbstractFunction {

  private final boolean orSelf;

  public FNDerivedFrom() {
    this("derived-from", false);
  }

  protected FNDerivedFrom(final String name, final boolean orSelf) {
    super(name);
    this.orSelf = orSelf;
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) throws XPathException {
    final XPathSet nodes = args.get(0);
    requireNodeSet(1, nodes);
    final String qualifiedName = args.get(1).asString();
    final @Nullable Identity base = findIdentity(context.getLocalModule(), qualifiedName);
    if (base == null) {
      throw XPathError.INVALID_ARGUMENT.newException(2, getName(),
          "identity \"" + qualifiedName + "\" not found");
    }
    for (final NodeEntry entry : nodes.getNodes()) {
      final @Nullable DataNode leaf = leafOf(entry);
      if (leaf == null || leaf.getValue() == null) {
        continue;
      }
      final @Nullable Identity value =
          lookupIdentity(leaf.getSchema().getModule(), leaf.getValue());
      if (value != null && isDerived(value, base)) {
        set.setBoolean(true);
        return;
      }
    }
    set.setBoolean(false);
  }

  private boolean isDerived(final Identity identity, final Identity base) {
    if (orSelf && identity == base) {
      return true;
    }
    final Deque<Identity> pending = new ArrayDeque<>(identity.getBases());
    while (!pending.isEmpty()) {
      final Identity current = pending.pop();
      if (current == base) {
        return true;
      }
      pending.addAll(current.getBases());
    }
    return false;
  }

  /**
   * Find an identity by its optionally prefixed name.
   *
   * @param module the module unprefixed names and prefixes are resolved in
   * @param qualifiedName {@code name} or {@code prefix:name}
   * @return the identity or {@code null}
   * @throws XPathException if the prefix is unknown
   */
  static @Nullable Identity findIdentity(final Module module, final String qualifiedName)
      throws XPathException {
    final int colon = qualifiedName.indexOf(':');
    final Module owner = colon == -1 ? module
        : EvaluationContext.resolveModule(module, qualifiedName.substring(0, colon));
    return identityIn(owner, qualifiedName.substring(colon + 1));
  }

  /**
   * Find the identity a value names, values with unknown prefixes name none.
   *
   * @param module the module of the leaf holding the value
   * @param qualifiedName {@code name} or {@code prefix:name}
   * @return the identity or {@code null}
   */
  static @Nullable Identity lookupIdentity(final Module module, final String qualifiedName) {
    final int colon = qualifiedName.indexOf(':');
    final Module owner = colon == -1 ? module
        : EvaluationContext.findModule(module, qualifiedName.substring(0, colon));
    return owner == null ? null : identityIn(owner, qualifiedName.substring(colon + 1));
  }

  private static @Nullable Identity identityIn(final Module owner, final String name) {
    for (final Identity identity : owner.getIdentities()) {
      if (identity.getName().equals(name)) {
        return identity;
      }
    }
    return null;
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    SchemaWarnings.checkType(context, args.get(0), "Argument #1 of " + getName() + "()",
        EnumSet.of(TypeBase.IDENTITYREF));
    SchemaWarnings.checkString(context, args.get(1), "Argument #2 of " + getName() + "()");
  }
}
