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

import io.yangpath.exception.XPathException;

/**
 * Error codes of the evaluator with their message templates.
 */
public enum XPathError {

  /** A character that starts no token. */
  INVALID_CHARACTER(Category.SYNTAX, "Invalid character '%s' at position %d."),

  /** A literal without its closing quote. */
  UNTERMINATED_LITERAL(Category.SYNTAX, "Unterminated literal starting at position %d."),

  /** A token the grammar does not allow at this place. */
  UNEXPECTED_TOKEN(Category.SYNTAX, "Unexpected token \"%s\" at position %d."),

  /** The expression ends early. */
  UNEXPECTED_END(Category.SYNTAX, "Unexpected end of expression \"%s\"."),

  /** A function name that is not in the function library. */
  UNKNOWN_FUNCTION(Category.SYNTAX, "Unknown function \"%s\" at position %d."),

  /** Too few or too many function arguments. */
  WRONG_ARITY(Category.SYNTAX, "Function \"%s\" at position %d called with %d argument(s)."),

  /** Tokens left over after a complete expression. */
  TRAILING_TOKENS(Category.SYNTAX, "Unparsed characters \"%s\" left at position %d."),

  /** A location step on something that is not a node-set. */
  NOT_A_NODE_SET(Category.TYPE, "Cannot apply XPath operation %s on %s."),

  /** A function argument of the wrong kind. */
  INVALID_ARGUMENT(Category.TYPE, "Invalid argument #%d of %s: %s."),

  /** A module prefix that resolves to no module. */
  UNKNOWN_PREFIX(Category.TYPE, "Module with prefix \"%s\" not found."),

  /** A regular expression that cannot be compiled. */
  INVALID_REGEX(Category.TYPE, "Invalid regular expression \"%s\": %s."),

  /** An internal inconsistency, e.g. a node outside the evaluated tree. */
  INTERNAL(Category.RESOURCE, "Internal error: %s.");

  /** Error classes. */
  public enum Category {
    /** Malformed expression, always found before evaluation. */
    SYNTAX,
    /** Operation applied to an incompatible value. */
    TYPE,
    /** Failure of the environment. */
    RESOURCE
  }

  private final Category category;

  private final String message;

  XPathError(final Category category, final String message) {
    this.category = category;
    this.message = message;
  }

  public Category getCategory() {
    return category;
  }

  /**
   * Create an exception without source position.
   *
   * @param args message arguments
   * @return the exception
   */
  public XPathException newException(final Object... args) {
    return new XPathException(this, -1, String.format(message, args));
  }

  /**
   * Create an exception pointing at a source offset.
   *
   * @param position offset in the expression
   * @param args message arguments
   * @return the exception
   */
  public XPathException atPosition(final int position, final Object... args) {
    return new XPathException(this, position, String.format(message, args));
  }
}
