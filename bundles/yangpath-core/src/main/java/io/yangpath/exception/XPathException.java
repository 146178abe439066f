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

package io.yangpath.exception;

import io.yangpath.xpath.XPathError;

/**
 * Exception to hold all fatal failures of parsing and evaluating an XPath expression.
 */
public class XPathException extends Exception {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /** The failure kind. */
  private final XPathError error;

  /** Source offset the failure refers to or {@code -1}. */
  private final int position;

  /**
   * Constructor.
   *
   * @param error failure kind
   * @param position source offset or {@code -1} if unknown
   * @param message formatted message
   */
  public XPathException(final XPathError error, final int position, final String message) {
    super(message);
    this.error = error;
    this.position = position;
  }

  /**
   * Constructor to encapsulate another failure.
   *
   * @param error failure kind
   * @param message formatted message
   * @param cause the cause
   */
  public XPathException(final XPathError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
    this.position = -1;
  }

  public XPathError getError() {
    return error;
  }

  /**
   * Get the offset of the offending token in the expression.
   *
   * @return the offset or {@code -1}
   */
  public int getPosition() {
    return position;
  }
}
