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

import java.util.List;
import java.util.Locale;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Attribute;
import io.yangpath.api.DataNode;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.NodeEntry;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>FNLang</h1>
 * <p>
 * {@code lang(string)}: tests the {@code xml:lang} attribute of the closest ancestor-or-self of
 * the context node that has one. The language matches if it equals the argument or starts with
 * it followed by {@code -}, ignoring case.
 * </p>
 */
public class FNLang extends AbstractFunction {

  /** Module of the language attribute. */
  public static final String XML_MODULE = "xml";

  /** Name of the language attribute. */
  public static final String LANG = "lang";

  public FNLang() {
    super("lang");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) throws XPathException {
    final @Nullable NodeEntry node = firstNode(0, set);
    final String language = args.get(0).asString().toLowerCase(Locale.ROOT);
    if (node == null || node.type().isRoot()) {
      set.setBoolean(false);
      return;
    }
    final @Nullable String value = findLanguage(node.node());
    if (value == null) {
      set.setBoolean(false);
      return;
    }
    final String found = value.toLowerCase(Locale.ROOT);
    set.setBoolean(found.equals(language)
        || (found.startsWith(language) && found.charAt(language.length()) == '-'));
  }

  private static @Nullable String findLanguage(final DataNode start) {
    for (DataNode node = start; node != null; node = node.getParent()) {
      for (final Attribute attribute : node.getAttributes()) {
        if (LANG.equals(attribute.getName())
            && XML_MODULE.equals(attribute.getModule().getName())) {
          return attribute.getValue();
        }
      }
    }
    return null;
  }
}
