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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.Field;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Evaluator properties.
 * </p>
 * <p>
 * Every property is declared as a {@code {key, default}} pair. Defaults can be overridden by a
 * {@code yangpath.properties} resource on the classpath and afterwards programmatically.
 * </p>
 */
public final class XPathProperties {

  // ============== Class constants. =================

  private static final Logger LOGGER = LoggerFactory.getLogger(XPathProperties.class);

  /** YES maps to true. */
  private static final boolean YES = true;

  /** Classpath resource with overrides. */
  public static final String RESOURCE = "yangpath.properties";

  // ============ Evaluation constants. ===============

  /** Node-set size from which duplicate checks use a hash index. */
  public static final Object[] S_HASH_THRESHOLD = {"hash-threshold", 20};

  /** Maximum number of compiled expressions kept by an evaluator. */
  public static final Object[] S_EXPRESSION_CACHE_SIZE = {"expression-cache-size", 256L};

  /** String values of a configuration root skip state nodes: yes/no. */
  public static final Object[] S_STRING_CONFIG_FILTER = {"string-cast-config-filter", YES};

  /** Properties. */
  private final ConcurrentMap<String, Object> props = new ConcurrentHashMap<>();

  /**
   * Constructor. Loads the defaults and the classpath overrides.
   */
  public XPathProperties() {
    try {
      for (final Field f : getClass().getFields()) {
        final Object obj = f.get(null);
        if (!(obj instanceof final Object[] arr)) {
          continue;
        }
        props.put(arr[0].toString(), arr[1]);
      }
    } catch (final IllegalArgumentException | IllegalAccessException e) {
      throw new IllegalStateException(e);
    }
    loadResource();
  }

  private void loadResource() {
    final ClassLoader loader = XPathProperties.class.getClassLoader();
    try (InputStream in = loader == null ? null : loader.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return;
      }
      final Properties overrides = new Properties();
      overrides.load(in);
      for (final Map.Entry<Object, Object> entry : overrides.entrySet()) {
        final String key = entry.getKey().toString();
        final Object current = props.get(key);
        if (current == null) {
          LOGGER.warn("Ignoring unknown property \"{}\" in {}.", key, RESOURCE);
          continue;
        }
        props.put(key, convert(current, entry.getValue().toString().trim()));
      }
      LOGGER.debug("Loaded {} propert(y/ies) from {}.", overrides.size(), RESOURCE);
    } catch (final IOException e) {
      throw new UncheckedIOException("cannot read " + RESOURCE, e);
    }
  }

  private static Object convert(final Object template, final String value) {
    if (template instanceof Integer) {
      return Integer.valueOf(value);
    }
    if (template instanceof Long) {
      return Long.valueOf(value);
    }
    if (template instanceof Boolean) {
      return "yes".equalsIgnoreCase(value) || Boolean.parseBoolean(value);
    }
    return value;
  }

  /**
   * Set a property.
   *
   * @param property one of the {@code S_*} constants
   * @param value the value, of the type of the default
   * @return this instance
   */
  public XPathProperties set(final Object[] property, final Object value) {
    if (!property[1].getClass().isInstance(value)) {
      throw new IllegalArgumentException(
          "property " + property[0] + " needs a " + property[1].getClass().getSimpleName());
    }
    props.put(property[0].toString(), value);
    return this;
  }

  public int getHashThreshold() {
    return (Integer) props.get(S_HASH_THRESHOLD[0].toString());
  }

  public long getExpressionCacheSize() {
    return (Long) props.get(S_EXPRESSION_CACHE_SIZE[0].toString());
  }

  public boolean isStringConfigFilter() {
    return (Boolean) props.get(S_STRING_CONFIG_FILTER[0].toString());
  }

  /**
   * Get properties map.
   *
   * @return ConcurrentMap with key/value property pairs.
   */
  public ConcurrentMap<String, Object> getProps() {
    return props;
  }
}
