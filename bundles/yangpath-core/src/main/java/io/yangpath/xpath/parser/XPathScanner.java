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
 * <h1>XPathScanner</h1>
 * <p>
 * Lexical scanner to extract tokens from the query.
 * </p>
 * <p>
 * The scanner reads the query char by char, decides the type of every logic text unit by its
 * first character and appends the token to an {@link Expression}. Whitespace separates tokens and
 * is dropped.
 * </p>
 * <p>
 * Two ambiguities of the XPath lexical structure are resolved here: {@code *} and the names
 * {@code and}, {@code or}, {@code mod} and {@code div} are operators if there is a preceding token
 * that can end an operand, that is neither {@code @}, {@code (}, {@code [}, {@code ,} nor an
 * operator. A name followed by {@code (} is a node type test if it is {@code node}, {@code text}
 * or {@code comment} and a function name otherwise.
 * </p>
 */
public final class XPathScanner {

  /** The XPath query to scan. */
  private final String query;

  /** The current position of the cursor to the query string. */
  private int pos;

  /** The expression the tokens are appended to. */
  private Expression expression;

  /** Scanner states, chosen by the first character of a token. */
  private enum State {
    /** Whitespace between tokens. */
    SPACE,
    /** Number state. */
    NUMBER,
    /** Name state. */
    TEXT,
    /** Literal state. */
    LITERAL,
    /** Special character with one digit. */
    SPECIAL,
    /** Special character that could have two digits. */
    SPECIAL2,
    /** Unknown state. */
    UNKNOWN
  }

  /**
   * Constructor.
   *
   * @param query the query to scan
   */
  public XPathScanner(final String query) {
    this.query = query;
  }

  /**
   * Scan the whole query.
   *
   * @return the token stream, not yet validated
   * @throws XPathException on an invalid character or an unterminated literal
   */
  public Expression scan() throws XPathException {
    expression = new Expression(query);
    pos = 0;
    while (pos < query.length()) {
      final char input = query.charAt(pos);
      switch (retrieveState(input)) {
        case SPACE:
          pos++;
          break;
        case NUMBER:
          scanNumber();
          break;
        case TEXT:
          scanText();
          break;
        case LITERAL:
          scanLiteral(input);
          break;
        case SPECIAL:
          addToken(retrieveType(input), pos, 1);
          break;
        case SPECIAL2:
          scanTwoDigitSpecial(input);
          break;
        default:
          throw XPathError.INVALID_CHARACTER.atPosition(pos, input, pos);
      }
    }
    return expression;
  }

  private State retrieveState(final char input) {
    if (isWhitespace(input)) {
      return State.SPACE;
    }
    if (isNumber(input)
        || (input == '.' && pos + 1 < query.length() && isNumber(query.charAt(pos + 1)))) {
      return State.NUMBER;
    }
    if (isFirstLetter(input)) {
      return State.TEXT;
    }
    switch (input) {
      case '\'':
      case '"':
        return State.LITERAL;
      case '(':
      case ')':
      case '[':
      case ']':
      case '@':
      case ',':
      case '=':
      case '|':
      case '+':
      case '-':
      case '*':
        return State.SPECIAL;
      case '.':
      case '/':
      case '!':
      case '<':
      case '>':
        return State.SPECIAL2;
      default:
        return State.UNKNOWN;
    }
  }

  /**
   * Returns the type of the given one digit character.
   *
   * @param input the character the type should be determined
   * @return type of the given character
   */
  private TokenType retrieveType(final char input) {
    switch (input) {
      case '(':
        return TokenType.OPEN_BR;
      case ')':
        return TokenType.CLOSE_BR;
      case '[':
        return TokenType.OPEN_SQP;
      case ']':
        return TokenType.CLOSE_SQP;
      case '@':
        return TokenType.AT;
      case ',':
        return TokenType.COMMA;
      case '=':
        return TokenType.EQ;
      case '|':
        return TokenType.UNION;
      case '+':
        return TokenType.PLUS;
      case '-':
        return TokenType.MINUS;
      case '*':
        return isOperatorContext() ? TokenType.STAR : TokenType.NAME_TEST;
      default:
        throw new IllegalStateException("no single character token: " + input);
    }
  }

  /**
   * Scans special characters that can have two digits: . .. / // != < <= > >=.
   *
   * @param input the first character
   * @throws XPathException if {@code !} is not followed by {@code =}
   */
  private void scanTwoDigitSpecial(final char input) throws XPathException {
    final char second = pos + 1 < query.length() ? query.charAt(pos + 1) : '\0';
    switch (input) {
      case '.':
        if (second == '.') {
          addToken(TokenType.PARENT, pos, 2);
        } else {
          addToken(TokenType.POINT, pos, 1);
        }
        break;
      case '/':
        if (second == '/') {
          addToken(TokenType.DESC_STEP, pos, 2);
        } else {
          addToken(TokenType.SLASH, pos, 1);
        }
        break;
      case '!':
        if (second != '=') {
          throw XPathError.INVALID_CHARACTER.atPosition(pos, input, pos);
        }
        addToken(TokenType.N_EQ, pos, 2);
        break;
      case '<':
        if (second == '=') {
          addToken(TokenType.LE, pos, 2);
        } else {
          addToken(TokenType.LT, pos, 1);
        }
        break;
      case '>':
        if (second == '=') {
          addToken(TokenType.GE, pos, 2);
        } else {
          addToken(TokenType.GT, pos, 1);
        }
        break;
      default:
        throw new IllegalStateException("no two digit token: " + input);
    }
  }

  /**
   * Scans a number: digits with an optional fraction, or a fraction only.
   */
  private void scanNumber() {
    final int start = pos;
    int end = pos;
    while (end < query.length() && isNumber(query.charAt(end))) {
      end++;
    }
    if (end < query.length() && query.charAt(end) == '.') {
      end++;
      while (end < query.length() && isNumber(query.charAt(end))) {
        end++;
      }
    }
    addToken(TokenType.NUMBER, start, end - start);
  }

  /**
   * Scans a literal enclosed in single or double quotes.
   *
   * @param quote the opening quote
   * @throws XPathException if the closing quote is missing
   */
  private void scanLiteral(final char quote) throws XPathException {
    final int end = query.indexOf(quote, pos + 1);
    if (end == -1) {
      throw XPathError.UNTERMINATED_LITERAL.atPosition(pos, pos);
    }
    addToken(TokenType.LITERAL, pos, end - pos + 1);
  }

  /**
   * Scans a name: an NCName that is an operator name, a prefixed name, {@code prefix:*}, a node
   * type or a function name.
   */
  private void scanText() {
    final int start = pos;
    int end = scanNCName(start);

    if (isOperatorContext()) {
      final TokenType operator = operatorName(query.substring(start, end));
      if (operator != null) {
        addToken(operator, start, end - start);
        return;
      }
    }

    boolean prefixed = false;
    if (end + 1 < query.length() && query.charAt(end) == ':') {
      final char afterColon = query.charAt(end + 1);
      if (afterColon == '*') {
        addToken(TokenType.NAME_TEST, start, end + 2 - start);
        return;
      } else if (isFirstLetter(afterColon)) {
        end = scanNCName(end + 1);
        prefixed = true;
      }
    }

    int lookahead = end;
    while (lookahead < query.length() && isWhitespace(query.charAt(lookahead))) {
      lookahead++;
    }
    if (lookahead < query.length() && query.charAt(lookahead) == '(') {
      final String name = query.substring(start, end);
      if (!prefixed && isNodeType(name)) {
        addToken(TokenType.NODE_TYPE, start, end - start);
      } else {
        addToken(TokenType.FUNC_NAME, start, end - start);
      }
    } else {
      addToken(TokenType.NAME_TEST, start, end - start);
    }
  }

  private int scanNCName(final int start) {
    int end = start + 1;
    while (end < query.length() && isLetter(query.charAt(end))) {
      end++;
    }
    return end;
  }

  private static TokenType operatorName(final String name) {
    switch (name) {
      case "and":
        return TokenType.AND;
      case "or":
        return TokenType.OR;
      case "mod":
        return TokenType.MOD;
      case "div":
        return TokenType.DIV;
      default:
        return null;
    }
  }

  private static boolean isNodeType(final String name) {
    return "node".equals(name) || "text".equals(name) || "comment".equals(name);
  }

  /**
   * Determines if the previous token can end an operand.
   *
   * @return {@code true} if a {@code *} or operator name at the current position is an operator
   */
  private boolean isOperatorContext() {
    if (expression.size() == 0) {
      return false;
    }
    final TokenType previous = expression.getType(expression.size() - 1);
    switch (previous) {
      case AT:
      case OPEN_BR:
      case OPEN_SQP:
      case COMMA:
        return false;
      default:
        return !previous.isOperator();
    }
  }

  private void addToken(final TokenType type, final int start, final int length) {
    expression.addToken(type, start, length);
    pos = start + length;
  }

  /**
   * Checks if the given character is a valid first letter of an NCName.
   *
   * @param input The character to check.
   * @return Returns true, if the character is a first letter.
   */
  private static boolean isFirstLetter(final char input) {
    return Character.isLetter(input) || input == '_';
  }

  /**
   * Checks if the given character can continue an NCName.
   *
   * @param input The character to check.
   * @return Returns true, if the character is a letter.
   */
  private static boolean isLetter(final char input) {
    return Character.isLetterOrDigit(input) || input == '_' || input == '-' || input == '.';
  }

  /**
   * Checks if the given character is a number.
   *
   * @param input The character to check.
   * @return Returns true, if the character is a number.
   */
  private static boolean isNumber(final char input) {
    return input >= '0' && input <= '9';
  }

  private static boolean isWhitespace(final char input) {
    return input == ' ' || input == '\t' || input == '\n' || input == '\r';
  }
}
