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

import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>FNTranslate</h1>
 * <p>
 * {@code translate(string, string, string)}: replaces every character found in the second string
 * with the character at the same position in the third one, or removes it if the third string is
 * shorter. The first occurrence in the second string wins.
 * </p>
 */
public class FNTranslate extends AbstractFunction {

  public FNTranslate() {
    super("translate");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) {
    final String string = args.get(0).asString();
    final int[] from = args.get(1).asString().codePoints().toArray();
    final int[] to = args.get(2).asString().codePoints().toArray();

    final StringBuilder result = new StringBuilder(string.length());
    string.codePoints().forEach(codePoint -> {
      int index = -1;
      for (int i = 0; i < from.length; i++) {
        if (from[i] == codePoint) {
          index = i;
          break;
        }
      }
      if (index == -1) {
        result.appendCodePoint(codePoint);
      } else if (index < to.length) {
        result.appendCodePoint(to[index]);
      }
    });
    set.setString(result.toString());
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    for (int i = 0; i < args.size(); i++) {
      SchemaWarnings.checkString(context, args.get(i), "Argument #" + (i + 1) + " of translate()");
    }
  }
}
