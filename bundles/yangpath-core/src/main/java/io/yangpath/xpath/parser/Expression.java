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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A tokenized and validated XPath expression.
 * <p>
 * Holds the source, the token kinds with their offsets and lengths and, per token, the repeat list
 * computed by the {@link XPathParser}. Instances are immutable once returned by
 * {@link XPathParser#parse(String)} and may be shared between evaluations and threads.
 * </p>
 */
public final class Expression {

  private final String source;

  private TokenType[] types;

  private int[] positions;

  private int[] lengths;

  private int size;

  private final List<List<ExprType>> repeats = new ArrayList<>();

  private boolean frozen;

  Expression(final String source) {
    this.source = checkNotNull(source);
    types = new TokenType[8];
    positions = new int[8];
    lengths = new int[8];
  }

  void addToken(final TokenType type, final int position, final int length) {
    checkState(!frozen);
    if (size == types.length) {
      types = Arrays.copyOf(types, size * 2);
      positions = Arrays.copyOf(positions, size * 2);
      lengths = Arrays.copyOf(lengths, size * 2);
    }
    types[size] = type;
    positions[size] = position;
    lengths[size] = length;
    repeats.add(null);
    size++;
  }

  void pushRepeat(final int index, final ExprType level) {
    checkState(!frozen);
    List<ExprType> repeat = repeats.get(index);
    if (repeat == null) {
      repeat = new ArrayList<>(2);
      repeats.set(index, repeat);
    }
    repeat.add(level);
  }

  Expression freeze() {
    for (int i = 0; i < size; i++) {
      final List<ExprType> repeat = repeats.get(i);
      repeats.set(i, repeat == null ? ImmutableList.of() : ImmutableList.copyOf(repeat));
    }
    frozen = true;
    return this;
  }

  public String getSource() {
    return source;
  }

  /**
   * Get the number of tokens.
   *
   * @return the token count
   */
  public int size() {
    return size;
  }

  public TokenType getType(final int index) {
    checkElementIndex(index, size);
    return types[index];
  }

  public int getPosition(final int index) {
    checkElementIndex(index, size);
    return positions[index];
  }

  public int getLength(final int index) {
    checkElementIndex(index, size);
    return lengths[index];
  }

  /**
   * Get the source text of a token.
   *
   * @param index token index
   * @return the text
   */
  public String getText(final int index) {
    checkElementIndex(index, size);
    return source.substring(positions[index], positions[index] + lengths[index]);
  }

  /**
   * Get the precedence levels repeated from a token, innermost first.
   *
   * @param index token index
   * @return the repeat list, empty if the token starts no repeated production
   */
  public List<ExprType> getRepeat(final int index) {
    checkElementIndex(index, size);
    final List<ExprType> repeat = repeats.get(index);
    return repeat == null ? ImmutableList.of() : repeat;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("source", source).add("tokens", size).toString();
  }
}
