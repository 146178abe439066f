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
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathError;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>FNReMatch</h1>
 * <p>
 * {@code re-match(string, string)}: tests whether the whole string matches the XML Schema
 * regular expression, translated by {@link XsdRegex}.
 * </p>
 */
public class FNReMatch extends AbstractFunction {

  private static final Cache<String, Pattern> PATTERNS =
      Caffeine.newBuilder().maximumSize(128).build();

  public FNReMatch() {
    super("re-match");
  }

  @Override
  public void evaluate(final List<XPathSet> args, final XPathSet set,
      final XPathContext context) throws XPathException {
    final Pattern pattern = compile(args.get(1).asString());
    set.setBoolean(pattern.matcher(args.get(0).asString()).matches());
  }

  /**
   * Compile an XML Schema regular expression.
   *
   * @param regex the expression
   * @return the pattern
   * @throws XPathException if the expression is invalid
   */
  static Pattern compile(final String regex) throws XPathException {
    final Pattern cached = PATTERNS.getIfPresent(regex);
    if (cached != null) {
      return cached;
    }
    final String java = XsdRegex.toJava(regex);
    try {
      return PATTERNS.get(regex, key -> Pattern.compile(java));
    } catch (final PatternSyntaxException e) {
      throw XPathError.INVALID_REGEX.newException(regex, e.getDescription());
    }
  }

  @Override
  protected void checkArguments(final List<XPathSet> args, final SchemaContext context) {
    SchemaWarnings.checkString(context, args.get(0), "Argument #1 of re-match()");
    SchemaWarnings.checkString(context, args.get(1), "Argument #2 of re-match()");
  }
}
