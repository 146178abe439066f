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

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;

/**
 * Translates XML Schema regular expressions into {@link java.util.regex.Pattern} syntax.
 * <ul>
 * <li>{@code ^} and {@code $} are literals outside character classes.</li>
 * <li>Class subtraction {@code [base-[excluded]]} becomes {@code [[base]&&[^[excluded]]]}.</li>
 * <li>Block escapes {@code \p{IsX}} become {@code \p{InX}}.</li>
 * <li>The name escapes {@code \i}, {@code \c} and their complements are expanded.</li>
 * </ul>
 */
final class XsdRegex {

  private static final String NAME_START = "\\p{L}_:";

  private static final String NAME_CHAR = "\\p{L}\\p{Nd}._:\\-\\u00B7";

  private final String regex;

  private int pos;

  private XsdRegex(final String regex) {
    this.regex = regex;
  }

  /**
   * Translate an expression.
   *
   * @param regex the XML Schema expression
   * @return the equivalent Java expression
   * @throws XPathException if a character class is not terminated
   */
  static String toJava(final String regex) throws XPathException {
    final XsdRegex translator = new XsdRegex(regex);
    final StringBuilder java = new StringBuilder(regex.length() + 8);
    while (translator.pos < regex.length()) {
      final char c = regex.charAt(translator.pos);
      switch (c) {
        case '\\' -> translator.escape(java, false);
        case '[' -> java.append(translator.charClass());
        case '^', '$' -> {
          java.append('\\').append(c);
          translator.pos++;
        }
        default -> {
          java.append(c);
          translator.pos++;
        }
      }
    }
    return java.toString();
  }

  private void escape(final StringBuilder java, final boolean inClass) throws XPathException {
    if (pos + 1 >= regex.length()) {
      throw XPathError.INVALID_REGEX.newException(regex, "trailing backslash");
    }
    final char escaped = regex.charAt(pos + 1);
    pos += 2;
    switch (escaped) {
      case 'i' -> java.append(inClass ? NAME_START : "[" + NAME_START + "]");
      case 'c' -> java.append(inClass ? NAME_CHAR : "[" + NAME_CHAR + "]");
      case 'I' -> java.append("[^" + NAME_START + "]");
      case 'C' -> java.append("[^" + NAME_CHAR + "]");
      case 'p', 'P' -> {
        java.append('\\').append(escaped);
        if (regex.startsWith("{Is", pos)) {
          java.append("{In");
          pos += 3;
        }
      }
      default -> java.append('\\').append(escaped);
    }
  }

  /**
   * Translate the character class starting at the current {@code [}.
   */
  private String charClass() throws XPathException {
    pos++;
    final boolean negated = pos < regex.length() && regex.charAt(pos) == '^';
    if (negated) {
      pos++;
    }
    final StringBuilder body = new StringBuilder();
    String excluded = null;
    while (true) {
      if (pos >= regex.length()) {
        throw XPathError.INVALID_REGEX.newException(regex, "unterminated character class");
      }
      final char c = regex.charAt(pos);
      if (c == ']') {
        pos++;
        break;
      }
      if (c == '-' && body.length() > 0 && regex.startsWith("-[", pos)) {
        pos++;
        excluded = charClass();
        if (pos >= regex.length() || regex.charAt(pos) != ']') {
          throw XPathError.INVALID_REGEX.newException(regex,
              "subtraction must end the character class");
        }
        pos++;
        break;
      }
      switch (c) {
        case '\\' -> escape(body, true);
        case '[', '&' -> {
          body.append('\\').append(c);
          pos++;
        }
        default -> {
          body.append(c);
          pos++;
        }
      }
    }
    final String base = "[" + (negated ? "^" : "") + body + "]";
    return excluded == null ? base : "[" + base + "&&[^" + excluded + "]]";
  }
}
