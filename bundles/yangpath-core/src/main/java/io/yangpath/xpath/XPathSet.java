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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.google.common.base.MoreObjects;

import io.yangpath.api.DataNode;
import io.yangpath.api.SchemaNode;
import io.yangpath.exception.XPathException;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntComparator;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

/**
 * The working value of an evaluation: empty, a boolean, a number, a string, a node-set in document
 * order or, during static analysis, a schema node-set.
 * <p>
 * A set is created for one evaluation and mutated in place by every step and operator. Node-sets
 * may hold duplicates while they are built; {@link #sortAndClean()} restores document order
 * without duplicates. Membership checks switch from a linear scan to a hash index once a node-set
 * reaches the configured threshold.
 * </p>
 */
public final class XPathSet {

  /** Threshold used by sets created without an evaluation context. */
  private static final int DEFAULT_HASH_THRESHOLD = 20;

  /** Lexical form of an XPath number. */
  private static final Pattern NUMBER = Pattern.compile("-?(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)");

  private final @Nullable DocumentOrder order;

  private final int hashThreshold;

  private final NodeType rootType;

  /** Whether string values skip state nodes, under a configuration root. */
  private final boolean hideState;

  private SetType type = SetType.EMPTY;

  private final List<NodeEntry> nodes = new ArrayList<>();

  private @Nullable ObjectOpenHashSet<NodeEntry> index;

  private final List<SchemaEntry> schemaEntries = new ArrayList<>();

  private boolean bool;

  private double number;

  private String string = "";

  private int contextPosition = 1;

  private int contextSize = 1;

  /**
   * Create a set for scalar values.
   */
  public XPathSet() {
    this(null, DEFAULT_HASH_THRESHOLD, NodeType.ROOT, false);
  }

  /**
   * Constructor.
   *
   * @param order document order of the evaluated tree, {@code null} for scalar or schema sets
   * @param hashThreshold node-set size from which a hash index is maintained
   * @param rootType the root type of the evaluation
   * @param hideState whether string values of a configuration root skip state nodes
   */
  public XPathSet(final @Nullable DocumentOrder order, final int hashThreshold,
      final NodeType rootType, final boolean hideState) {
    this.order = order;
    this.hashThreshold = hashThreshold;
    this.rootType = checkNotNull(rootType);
    this.hideState = hideState && rootType == NodeType.ROOT_CONFIG;
  }

  /**
   * Create an empty set sharing the evaluation state of this one.
   *
   * @return the new set
   */
  public XPathSet emptyCopy() {
    return new XPathSet(order, hashThreshold, rootType, hideState);
  }

  /**
   * Create a deep copy of this set.
   *
   * @return the copy
   */
  public XPathSet copy() {
    final XPathSet copy = emptyCopy();
    copy.fill(this);
    return copy;
  }

  /**
   * Replace the content of this set with a copy of another set.
   *
   * @param other the source
   */
  public void fill(final XPathSet other) {
    if (other == this) {
      return;
    }
    clearContent();
    type = other.type;
    bool = other.bool;
    number = other.number;
    string = other.string;
    contextPosition = other.contextPosition;
    contextSize = other.contextSize;
    for (final NodeEntry entry : other.nodes) {
      addEntry(entry);
    }
    for (final SchemaEntry entry : other.schemaEntries) {
      schemaEntries.add(new SchemaEntry(entry.getNode(), entry.getType(), entry.getMarker()));
    }
  }

  public SetType getType() {
    return type;
  }

  /**
   * Determines if this set can take part in node-set operations. An empty set counts as an empty
   * node-set.
   *
   * @return {@code true} for empty and node-set values
   */
  public boolean isNodeSet() {
    return type == SetType.NODE_SET || type == SetType.EMPTY;
  }

  public boolean getBoolean() {
    checkState(type == SetType.BOOLEAN, "not a boolean: %s", type);
    return bool;
  }

  public double getNumber() {
    checkState(type == SetType.NUMBER, "not a number: %s", type);
    return number;
  }

  public String getString() {
    checkState(type == SetType.STRING, "not a string: %s", type);
    return string;
  }

  public List<NodeEntry> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<SchemaEntry> getSchemaEntries() {
    return Collections.unmodifiableList(schemaEntries);
  }

  public NodeType getRootType() {
    return rootType;
  }

  public @Nullable DocumentOrder getOrder() {
    return order;
  }

  public int getContextPosition() {
    return contextPosition;
  }

  public int getContextSize() {
    return contextSize;
  }

  /**
   * Set the context position and size read by {@code position()} and {@code last()}.
   *
   * @param position 1-based position
   * @param size context size
   */
  public void setContext(final int position, final int size) {
    contextPosition = position;
    contextSize = size;
  }

  // ---------------------------------------------------------------------------------------------
  // scalars

  public void setEmpty() {
    clearContent();
    type = SetType.EMPTY;
  }

  public void setBoolean(final boolean value) {
    clearContent();
    type = SetType.BOOLEAN;
    bool = value;
  }

  public void setNumber(final double value) {
    clearContent();
    type = SetType.NUMBER;
    number = value;
  }

  public void setString(final String value) {
    clearContent();
    type = SetType.STRING;
    string = checkNotNull(value);
  }

  private void clearContent() {
    nodes.clear();
    index = null;
    schemaEntries.clear();
    string = "";
  }

  // ---------------------------------------------------------------------------------------------
  // node-sets

  /**
   * Turn this set into an empty node-set.
   */
  public void clearNodes() {
    clearContent();
    type = SetType.NODE_SET;
  }

  /**
   * Replace the content with one node.
   *
   * @param entry the node
   */
  public void setSingleNode(final NodeEntry entry) {
    clearNodes();
    addEntry(entry);
  }

  /**
   * Append a node, duplicates are allowed until the set is cleaned.
   *
   * @param entry the node
   */
  public void addNode(final NodeEntry entry) {
    checkState(isNodeSet(), "not a node-set: %s", type);
    type = SetType.NODE_SET;
    addEntry(entry);
  }

  /**
   * Append a node unless it is already a member.
   *
   * @param entry the node
   * @return {@code true} if the node was added
   */
  public boolean addNodeUnique(final NodeEntry entry) {
    if (contains(entry)) {
      return false;
    }
    addNode(entry);
    return true;
  }

  public boolean contains(final NodeEntry entry) {
    if (index != null) {
      return index.contains(entry);
    }
    for (final NodeEntry node : nodes) {
      if (node.equals(entry)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Replace all nodes.
   *
   * @param entries the new members
   */
  public void replaceNodes(final List<NodeEntry> entries) {
    final List<NodeEntry> copy = new ArrayList<>(entries);
    clearNodes();
    for (final NodeEntry entry : copy) {
      addEntry(entry);
    }
  }

  /**
   * Keep only the nodes whose flag is set.
   *
   * @param keep one flag per node
   */
  public void retain(final boolean[] keep) {
    checkState(keep.length == nodes.size());
    final List<NodeEntry> kept = new ArrayList<>(nodes.size());
    for (int i = 0; i < keep.length; i++) {
      if (keep[i]) {
        kept.add(nodes.get(i));
      }
    }
    replaceNodes(kept);
  }

  private void addEntry(final NodeEntry entry) {
    nodes.add(entry);
    if (index != null) {
      index.add(entry);
    } else if (nodes.size() >= hashThreshold) {
      index = new ObjectOpenHashSet<>(nodes);
    }
  }

  /**
   * Sort the nodes into document order and remove duplicates. Sorting a sorted set changes
   * nothing.
   *
   * @throws XPathException if a node is not part of the evaluated tree
   */
  public void sortAndClean() throws XPathException {
    if (type != SetType.NODE_SET || nodes.size() < 2) {
      return;
    }
    checkState(order != null, "node-set without document order");
    final int size = nodes.size();
    final long[] keys = new long[size];
    boolean sorted = true;
    for (int i = 0; i < size; i++) {
      keys[i] = order.keyOf(nodes.get(i));
      if (i > 0 && keys[i] <= keys[i - 1]) {
        sorted = false;
      }
    }
    if (sorted) {
      return;
    }

    final int[] permutation = new int[size];
    for (int i = 0; i < size; i++) {
      permutation[i] = i;
    }
    final IntComparator byKey = (a, b) -> Long.compare(keys[a], keys[b]);
    IntArrays.mergeSort(permutation, byKey);

    final List<NodeEntry> cleaned = new ArrayList<>(size);
    long previous = -1;
    for (final int i : permutation) {
      if (cleaned.isEmpty() || keys[i] != previous) {
        cleaned.add(nodes.get(i));
        previous = keys[i];
      }
    }
    replaceNodes(cleaned);
  }

  /**
   * Merge another node-set into this one, keeping document order and dropping duplicates.
   *
   * @param other the other node-set
   * @throws XPathException if a node is not part of the evaluated tree
   */
  public void union(final XPathSet other) throws XPathException {
    checkState(isNodeSet() && other.isNodeSet(), "union of %s and %s", type, other.type);
    if (other.nodes.isEmpty()) {
      if (other.type == SetType.NODE_SET && type == SetType.EMPTY) {
        clearNodes();
      }
      return;
    }
    if (nodes.isEmpty()) {
      replaceNodes(other.nodes);
      sortAndClean();
      return;
    }
    checkState(order != null, "node-set without document order");
    sortAndClean();
    other.sortAndClean();

    final List<NodeEntry> merged = new ArrayList<>(nodes.size() + other.nodes.size());
    int i = 0;
    int j = 0;
    long left = order.keyOf(nodes.get(0));
    long right = order.keyOf(other.nodes.get(0));
    while (i < nodes.size() && j < other.nodes.size()) {
      if (left < right) {
        merged.add(nodes.get(i++));
        left = i < nodes.size() ? order.keyOf(nodes.get(i)) : left;
      } else if (left > right) {
        merged.add(other.nodes.get(j++));
        right = j < other.nodes.size() ? order.keyOf(other.nodes.get(j)) : right;
      } else {
        merged.add(nodes.get(i++));
        j++;
        left = i < nodes.size() ? order.keyOf(nodes.get(i)) : left;
        right = j < other.nodes.size() ? order.keyOf(other.nodes.get(j)) : right;
      }
    }
    merged.addAll(nodes.subList(i, nodes.size()));
    merged.addAll(other.nodes.subList(j, other.nodes.size()));
    replaceNodes(merged);
  }

  // ---------------------------------------------------------------------------------------------
  // schema node-sets

  /**
   * Add a schema node or update the marker of an existing entry. An existing entry that is not in
   * any context takes the new marker, any other existing marker is kept.
   *
   * @param node the schema node, {@code null} for the root
   * @param nodeType axis type
   * @param marker context marker
   * @return the index of the entry
   */
  public int addSchemaNode(final @Nullable SchemaNode node, final NodeType nodeType,
      final int marker) {
    if (type != SetType.SNODE_SET) {
      clearContent();
      type = SetType.SNODE_SET;
    }
    for (int i = 0; i < schemaEntries.size(); i++) {
      final SchemaEntry entry = schemaEntries.get(i);
      if (entry.matches(node, nodeType)) {
        if (entry.getMarker() == SchemaEntry.NOT_IN_CONTEXT) {
          entry.setMarker(marker);
        }
        return i;
      }
    }
    schemaEntries.add(new SchemaEntry(node, nodeType, marker));
    return schemaEntries.size() - 1;
  }

  /**
   * Get the entries in context.
   *
   * @return the context entries
   */
  public List<SchemaEntry> getSchemaContext() {
    final List<SchemaEntry> context = new ArrayList<>();
    for (final SchemaEntry entry : schemaEntries) {
      if (entry.isInContext()) {
        context.add(entry);
      }
    }
    return context;
  }

  /**
   * Take the entries in context out of it, for a step that replaces them with new context nodes.
   *
   * @return the former context entries
   */
  public List<SchemaEntry> takeSchemaContext() {
    final List<SchemaEntry> context = getSchemaContext();
    for (final SchemaEntry entry : context) {
      entry.setMarker(SchemaEntry.NOT_IN_CONTEXT);
    }
    return context;
  }

  /**
   * Keep all entries as atoms, none in context. Parked predicate markers are kept.
   */
  public void clearSchemaContext() {
    if (type != SetType.SNODE_SET) {
      return;
    }
    takeSchemaContext();
  }

  /**
   * Change every marker {@code from} to {@code to}.
   *
   * @param from old marker
   * @param to new marker
   */
  public void remark(final int from, final int to) {
    for (final SchemaEntry entry : schemaEntries) {
      if (entry.getMarker() == from) {
        entry.setMarker(to);
      }
    }
  }

  /**
   * Set the marker of one entry.
   *
   * @param entryIndex index of the entry
   * @param marker the marker
   */
  public void mark(final int entryIndex, final int marker) {
    schemaEntries.get(entryIndex).setMarker(marker);
  }

  /**
   * Get a marker no entry uses yet, for parking context nodes during a predicate.
   *
   * @return the marker
   */
  public int newContextMarker() {
    int max = SchemaEntry.FIRST_PREDICATE_MARKER - 1;
    for (final SchemaEntry entry : schemaEntries) {
      max = Math.max(max, entry.getMarker());
    }
    return max + 1;
  }

  /**
   * Merge the schema nodes of another set into this one by identity.
   *
   * @param other the other set
   */
  public void mergeSchema(final XPathSet other) {
    if (other.type != SetType.SNODE_SET) {
      return;
    }
    for (final SchemaEntry entry : other.schemaEntries) {
      addSchemaNode(entry.getNode(), entry.getType(), entry.getMarker());
    }
  }

  // ---------------------------------------------------------------------------------------------
  // casting

  /**
   * Get the boolean value without changing the set.
   *
   * @return false for an empty node-set, an empty string, zero and NaN
   */
  public boolean asBoolean() {
    return switch (type) {
      case EMPTY -> false;
      case NODE_SET -> !nodes.isEmpty();
      case BOOLEAN -> bool;
      case NUMBER -> number != 0 && !Double.isNaN(number);
      case STRING -> !string.isEmpty();
      case SNODE_SET -> throw new IllegalStateException("schema node-sets have no value");
    };
  }

  /**
   * Get the number value without changing the set.
   *
   * @return the number, NaN for strings that are no number
   */
  public double asNumber() {
    return switch (type) {
      case EMPTY -> Double.NaN;
      case NODE_SET, STRING -> parseNumber(asString());
      case BOOLEAN -> bool ? 1 : 0;
      case NUMBER -> number;
      case SNODE_SET -> throw new IllegalStateException("schema node-sets have no value");
    };
  }

  /**
   * Get the string value without changing the set.
   *
   * @return the string, for node-sets the string value of the first node
   */
  public String asString() {
    return switch (type) {
      case EMPTY -> "";
      case NODE_SET -> nodes.isEmpty() ? "" : stringValue(nodes.get(0));
      case BOOLEAN -> bool ? "true" : "false";
      case NUMBER -> formatNumber(number);
      case STRING -> string;
      case SNODE_SET -> throw new IllegalStateException("schema node-sets have no value");
    };
  }

  /**
   * Cast this set in place.
   *
   * @param target the target type
   * @throws XPathException if a scalar is cast to a node-set
   */
  public void cast(final SetType target) throws XPathException {
    checkState(type != SetType.SNODE_SET, "schema node-sets cannot be cast");
    switch (target) {
      case EMPTY -> setEmpty();
      case BOOLEAN -> setBoolean(asBoolean());
      case NUMBER -> setNumber(asNumber());
      case STRING -> setString(asString());
      case NODE_SET -> {
        if (!isNodeSet()) {
          throw XPathError.NOT_A_NODE_SET.newException("cast", describe());
        }
        type = SetType.NODE_SET;
      }
      case SNODE_SET -> throw new IllegalArgumentException("cannot cast to a schema node-set");
      default -> throw new IllegalStateException();
    }
  }

  /**
   * Compute the string value of a node: the value of leaves, text nodes and attributes, the
   * concatenated leaf values of the subtree for other elements and of all trees for the root.
   *
   * @param entry the node
   * @return its string value
   */
  public String stringValue(final NodeEntry entry) {
    switch (entry.type()) {
      case ATTR:
        return entry.attribute().getValue();
      case TEXT:
        return valueOf(entry.node());
      case ELEM:
        if (entry.node().getSchema().getKind().isLeaf()) {
          return valueOf(entry.node());
        }
        final StringBuilder element = new StringBuilder();
        appendStringValue(entry.node(), element);
        return element.toString();
      default:
        final StringBuilder root = new StringBuilder();
        for (DataNode top = entry.node(); top != null; top = top.getNextSibling()) {
          appendStringValue(top, root);
        }
        return root.toString();
    }
  }

  private void appendStringValue(final DataNode node, final StringBuilder builder) {
    if (hideState && !node.getSchema().isConfig()) {
      return;
    }
    if (node.getSchema().getKind().isLeaf()) {
      builder.append(valueOf(node));
      return;
    }
    if (node.getSchema().getKind().isOpaque()) {
      return;
    }
    for (DataNode child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      appendStringValue(child, builder);
    }
  }

  private static String valueOf(final DataNode node) {
    final String value = node.getValue();
    return value == null ? "" : value;
  }

  /**
   * Format a number the XPath way.
   *
   * @param value the number
   * @return NaN, Infinity, -Infinity, an integer or a plain decimal
   */
  public static String formatNumber(final double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    }
    if (value == Math.rint(value)) {
      if (Math.abs(value) < 1e18) {
        return Long.toString((long) value);
      }
      return BigDecimal.valueOf(value).toBigInteger().toString();
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  /**
   * Parse a string the XPath way, surrounding whitespace is ignored.
   *
   * @param value the string
   * @return the number or NaN
   */
  public static double parseNumber(final String value) {
    final String trimmed = trimWhitespace(value);
    if (!NUMBER.matcher(trimmed).matches()) {
      return Double.NaN;
    }
    return Double.parseDouble(trimmed);
  }

  private static String trimWhitespace(final String value) {
    int start = 0;
    int end = value.length();
    while (start < end && isWhitespace(value.charAt(start))) {
      start++;
    }
    while (end > start && isWhitespace(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(start, end);
  }

  private static boolean isWhitespace(final char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r';
  }

  /**
   * Get a short name of the value kind for messages.
   *
   * @return the kind
   */
  public String describe() {
    return type.name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  @Override
  public String toString() {
    final MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).add("type", type);
    switch (type) {
      case NODE_SET -> helper.add("nodes", nodes);
      case SNODE_SET -> helper.add("schemaNodes", schemaEntries);
      case BOOLEAN -> helper.add("value", bool);
      case NUMBER -> helper.add("value", number);
      case STRING -> helper.add("value", string);
      default -> {
      }
    }
    return helper.toString();
  }
}
