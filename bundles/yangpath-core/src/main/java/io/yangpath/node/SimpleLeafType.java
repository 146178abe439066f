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

package io.yangpath.node;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import io.yangpath.api.Identity;
import io.yangpath.api.LeafType;
import io.yangpath.api.TypeBase;

/**
 * In-memory {@link LeafType}, created through the static factories.
 */
public final class SimpleLeafType implements LeafType {

  private final TypeBase base;

  private @Nullable String path;

  private final Map<String, Integer> enums = new LinkedHashMap<>();

  private final Map<String, Integer> bits = new LinkedHashMap<>();

  private List<LeafType> unionTypes = List.of();

  private List<Identity> identityBases = List.of();

  private int fractionDigits;

  private SimpleLeafType(final TypeBase base) {
    this.base = checkNotNull(base);
  }

  public static SimpleLeafType of(final TypeBase base) {
    return new SimpleLeafType(base);
  }

  public static SimpleLeafType string() {
    return of(TypeBase.STRING);
  }

  /**
   * Enumeration with values assigned in declaration order starting at zero.
   *
   * @param names the enum names
   * @return the type
   */
  public static SimpleLeafType enumeration(final String... names) {
    final SimpleLeafType type = of(TypeBase.ENUMERATION);
    for (int i = 0; i < names.length; i++) {
      type.enums.put(names[i], i);
    }
    return type;
  }

  /**
   * Bits with positions assigned in declaration order starting at zero.
   *
   * @param names the bit names
   * @return the type
   */
  public static SimpleLeafType bits(final String... names) {
    final SimpleLeafType type = of(TypeBase.BITS);
    for (int i = 0; i < names.length; i++) {
      type.bits.put(names[i], i);
    }
    return type;
  }

  public static SimpleLeafType leafref(final String path) {
    final SimpleLeafType type = of(TypeBase.LEAFREF);
    type.path = checkNotNull(path);
    return type;
  }

  public static SimpleLeafType identityref(final Identity... bases) {
    final SimpleLeafType type = of(TypeBase.IDENTITYREF);
    type.identityBases = ImmutableList.copyOf(bases);
    return type;
  }

  public static SimpleLeafType union(final LeafType... members) {
    final SimpleLeafType type = of(TypeBase.UNION);
    type.unionTypes = ImmutableList.copyOf(members);
    return type;
  }

  public static SimpleLeafType decimal64(final int fractionDigits) {
    checkArgument(fractionDigits >= 1 && fractionDigits <= 18, "fraction-digits out of range");
    final SimpleLeafType type = of(TypeBase.DECIMAL64);
    type.fractionDigits = fractionDigits;
    return type;
  }

  /**
   * Assign an explicit value to an enum.
   *
   * @param name the enum name
   * @param value its value
   * @return this type
   */
  public SimpleLeafType withEnum(final String name, final int value) {
    checkArgument(base == TypeBase.ENUMERATION, "not an enumeration");
    enums.put(name, value);
    return this;
  }

  @Override
  public TypeBase getBase() {
    return base;
  }

  @Override
  public @Nullable String getPath() {
    return path;
  }

  @Override
  public Map<String, Integer> getEnums() {
    return Collections.unmodifiableMap(enums);
  }

  @Override
  public Map<String, Integer> getBits() {
    return Collections.unmodifiableMap(bits);
  }

  @Override
  public List<LeafType> getUnionTypes() {
    return unionTypes;
  }

  @Override
  public List<Identity> getIdentityBases() {
    return identityBases;
  }

  @Override
  public int getFractionDigits() {
    return fractionDigits;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("base", base).omitNullValues().add("path", path)
        .toString();
  }
}
