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

package io.yangpath.xpath.parser;

import io.yangpath.exception.XPathException;
import io.yangpath.xpath.XPathError;

/**
 * Moving read position over the tokens of an {@link Expression}. Every parse and evaluation owns
 * its cursor.
 */
public final class TokenCursor {

  private final Expression expression;

  private int index;

  public TokenCursor(final Expression expression) {
    this.expression = expression;
  }

  public Expression getExpression() {
    return expression;
  }

  public int getIndex() {
    return index;
  }

  /**
   * Move back to a token seen before.
   *
   * @param index the token index
   */
  public void reset(final int index) {
    this.index = index;
  }

  public boolean atEnd() {
    return index >= expression.size();
  }

  /**
   * Get the type of the current token.
   *
   * @return the type or {@link TokenType#END}
   */
  public TokenType type() {
    return atEnd() ? TokenType.END : expression.getType(index);
  }

  public boolean is(final TokenType type) {
    return type() == type;
  }

  public String text() {
    return expression.getText(index);
  }

  public int position() {
    return atEnd() ? expression.getSource().length() : expression.getPosition(index);
  }

  public void next() {
    index++;
  }

  /**
   * Consume a token of the given type.
   *
   * @param type expected type
   * @throws XPathException if the current token has another type
   */
  public void consume(final TokenType type) throws XPathException {
    check(type);
    index++;
  }

  /**
   * Check the current token without consuming it.
   *
   * @param type expected type
   * @throws XPathException if the current token has another type
   */
  public void check(final TokenType type) throws XPathException {
    if (atEnd()) {
      throw XPathError.UNEXPECTED_END.newException(expression.getSource());
    }
    if (type() != type) {
      throw XPathError.UNEXPECTED_TOKEN.atPosition(position(), text(), position());
    }
  }
}
