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

package io.yangpath.api;

import java.math.BigInteger;

/**
 * Built-in YANG base types.
 */
public enum TypeBase {
  BINARY,
  BITS,
  BOOLEAN,
  DECIMAL64,
  EMPTY,
  ENUMERATION,
  IDENTITYREF,
  INSTANCE_IDENTIFIER,
  LEAFREF,
  STRING,
  UNION,
  INT8(-128L, 127L),
  INT16(-32768L, 32767L),
  INT32(Integer.MIN_VALUE, Integer.MAX_VALUE),
  INT64(Long.MIN_VALUE, Long.MAX_VALUE),
  UINT8(0L, 255L),
  UINT16(0L, 65535L),
  UINT32(0L, 4294967295L),
  UINT64(BigInteger.ZERO, new BigInteger("18446744073709551615"));

  private final BigInteger min;

  private final BigInteger max;

  TypeBase() {
    min = null;
    max = null;
  }

  TypeBase(final long min, final long max) {
    this(BigInteger.valueOf(min), BigInteger.valueOf(max));
  }

  TypeBase(final BigInteger min, final BigInteger max) {
    this.min = min;
    this.max = max;
  }

  public boolean isInteger() {
    return min != null;
  }

  public boolean isNumeric() {
    return isInteger() || this == DECIMAL64;
  }

  /**
   * Check an integer value against the range of this type.
   *
   * @param value the value
   * @return {@code true} if this is an integer type and {@code value} lies in its range
   */
  public boolean inRange(final BigInteger value) {
    return isInteger() && min.compareTo(value) <= 0 && max.compareTo(value) >= 0;
  }
}
