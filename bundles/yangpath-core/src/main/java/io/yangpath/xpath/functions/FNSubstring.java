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
 * <h1>FNSubstring</h1>
 * <p>
 * {@code substring(string, number, number?)}: the characters at positions {@code p} with
 * {@code round(start) <= p < round(start) + round(length)}, positions counted from 1 over code
 * points.
 * </p>
 */
public class FNSubstring extends AbstractFunction {

  public FNSubstring() {
    super("substring");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) {
    final String string = args.get(0).asString();
    final double start = FNRound.round(args.get(1).asNumber());
    final double length =
        args.size() > 2 ? FNRound.round(args.get(2).asNumber()) : Double.POSITIVE_INFINITY;
    final double end = start + length;

    final StringBuilder result = new StringBuilder();
    int position = 1;
    for (int i = 0; i < string.length(); position++) {
      final int codePoint = string.codePointAt(i);
      if (position >= start && position < end) {
        result.appendCodePoint(codePoint);
      }
      i += Character.charCount(codePoint);
    }
    set.setString(result.toString());
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    SchemaWarnings.checkString(context, args.get(0), "Argument #1 of substring()");
    SchemaWarnings.checkNumeric(context, args.get(1), "Argument #2 of substring()");
    if (args.size() > 2) {
      SchemaWarnings.checkNumeric(context, args.get(2), "Argument #3 of substring()");
    }
  }
}
