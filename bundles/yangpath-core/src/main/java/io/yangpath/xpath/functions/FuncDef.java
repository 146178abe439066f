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

import java.util.function.Supplier;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * <h1>FuncDef</h1>
 * <p>
 * List of functions and their arities: the XPath 1.0 core function library plus the YANG 1.1
 * additions. The parser checks calls against this table and both evaluators dispatch through it.
 * </p>
 */
public enum FuncDef {

  /** bit-is-set(node-set, string) as boolean, YANG 1.1. */
  BIT_IS_SET("bit-is-set", 2, 2, FNBitIsSet::new),

  /** boolean(object) as boolean. */
  BOOLEAN("boolean", 1, 1, FNBoolean::new),

  /** ceiling(number) as number. */
  CEILING("ceiling", 1, 1, FNCeiling::new),

  /** concat(string, string, string*) as string. */
  CONCAT("concat", 2, Integer.MAX_VALUE, FNConcat::new),

  /** contains(string, string) as boolean. */
  CONTAINS("contains", 2, 2, FNContains::new),

  /** count(node-set) as number. */
  COUNT("count", 1, 1, FNCount::new),

  /** current() as node-set, YANG. */
  CURRENT("current", 0, 0, FNCurrent::new),

  /** deref(node-set) as node-set, YANG 1.1. */
  DEREF("deref", 1, 1, FNDeref::new),

  /** derived-from(node-set, string) as boolean, YANG 1.1. */
  DERIVED_FROM("derived-from", 2, 2, FNDerivedFrom::new),

  /** derived-from-or-self(node-set, string) as boolean, YANG 1.1. */
  DERIVED_FROM_OR_SELF("derived-from-or-self", 2, 2, FNDerivedFromOrSelf::new),

  /** enum-value(node-set) as number, YANG 1.1. */
  ENUM_VALUE("enum-value", 1, 1, FNEnumValue::new),

  /** false() as boolean. */
  FALSE("false", 0, 0, FNFalse::new),

  /** floor(number) as number. */
  FLOOR("floor", 1, 1, FNFloor::new),

  /** lang(string) as boolean. */
  LANG("lang", 1, 1, FNLang::new),

  /** last() as number. */
  LAST("last", 0, 0, FNLast::new),

  /** local-name(node-set?) as string. */
  LOCAL_NAME("local-name", 0, 1, FNLocalName::new),

  /** name(node-set?) as string. */
  NAME("name", 0, 1, FNName::new),

  /** namespace-uri(node-set?) as string. */
  NAMESPACE_URI("namespace-uri", 0, 1, FNNamespaceUri::new),

  /** normalize-space(string?) as string. */
  NORMALIZE_SPACE("normalize-space", 0, 1, FNNormalizeSpace::new),

  /** not(boolean) as boolean. */
  NOT("not", 1, 1, FNNot::new),

  /** number(object?) as number. */
  NUMBER("number", 0, 1, FNNumber::new),

  /** position() as number. */
  POSITION("position", 0, 0, FNPosition::new),

  /** re-match(string, string) as boolean, YANG 1.1. */
  RE_MATCH("re-match", 2, 2, FNReMatch::new),

  /** round(number) as number. */
  ROUND("round", 1, 1, FNRound::new),

  /** starts-with(string, string) as boolean. */
  STARTS_WITH("starts-with", 2, 2, FNStartsWith::new),

  /** string(object?) as string. */
  STRING("string", 0, 1, FNString::new),

  /** string-length(string?) as number. */
  STRING_LENGTH("string-length", 0, 1, FNStringLength::new),

  /** substring(string, number, number?) as string. */
  SUBSTRING("substring", 2, 3, FNSubstring::new),

  /** substring-after(string, string) as string. */
  SUBSTRING_AFTER("substring-after", 2, 2, FNSubstringAfter::new),

  /** substring-before(string, string) as string. */
  SUBSTRING_BEFORE("substring-before", 2, 2, FNSubstringBefore::new),

  /** sum(node-set) as number. */
  SUM("sum", 1, 1, FNSum::new),

  /** translate(string, string, string) as string. */
  TRANSLATE("translate", 3, 3, FNTranslate::new),

  /** true() as boolean. */
  TRUE("true", 0, 0, FNTrue::new);

  private static final ImmutableMap<String, FuncDef> STRING_TO_ENUM;

  static {
    final ImmutableMap.Builder<String, FuncDef> builder = ImmutableMap.builder();
    for (final FuncDef function : values()) {
      builder.put(function.name, function);
    }
    STRING_TO_ENUM = builder.build();
  }

  /** Name used in expressions. */
  private final String name;

  /** Minimum number of arguments. */
  private final int min;

  /** Maximum number of arguments. */
  private final int max;

  /** The stateless implementation. */
  private final Function function;

  FuncDef(final String name, final int min, final int max, final Supplier<Function> factory) {
    this.name = name;
    this.min = min;
    this.max = max;
    this.function = factory.get();
  }

  public String getName() {
    return name;
  }

  public int getMin() {
    return min;
  }

  public int getMax() {
    return max;
  }

  public Function getFunction() {
    return function;
  }

  /**
   * Checks a call's argument count.
   *
   * @param argCount number of arguments
   * @return {@code true} if the function accepts that many arguments
   */
  public boolean acceptsArgs(final int argCount) {
    return argCount >= min && argCount <= max;
  }

  /**
   * Get the function of a name.
   *
   * @param name the function name
   * @return the function or {@code null} if there is none of that name
   */
  public static @Nullable FuncDef fromName(final String name) {
    return STRING_TO_ENUM.get(name);
  }
}
