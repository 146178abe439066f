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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.yangpath.api.DataNode;
import io.yangpath.exception.XPathException;
import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;

/**
 * Document positions of the nodes of one data tree. Positions are assigned lazily by one
 * depth-first walk over all top-level trees; the root has position 0. A node missing from the
 * cached walk triggers one rebuild, for trees that changed since the last walk.
 */
public final class DocumentOrder {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentOrder.class);

  /** Rank of elements and roots among entries sharing a node. */
  private static final int RANK_ELEMENT = 0;

  /** Rank of text entries, after all attributes of the node. */
  private static final int RANK_TEXT = Integer.MAX_VALUE;

  /** First top-level node of the tree. */
  private final DataNode root;

  private final Reference2IntOpenHashMap<DataNode> positions = new Reference2IntOpenHashMap<>();

  private boolean built;

  /**
   * Constructor.
   *
   * @param root the first top-level node of the tree
   */
  public DocumentOrder(final DataNode root) {
    this.root = checkNotNull(root);
    positions.defaultReturnValue(-1);
  }

  public DataNode getRoot() {
    return root;
  }

  /**
   * Get the position of a node.
   *
   * @param node a node of this tree
   * @return its position, starting with 1 for the first top-level node
   * @throws XPathException if the node is not part of the tree
   */
  public int positionOf(final DataNode node) throws XPathException {
    int position = positions.getInt(node);
    if (position == -1) {
      if (built) {
        LOGGER.debug("Node \"{}\" not in cached document order, rebuilding.",
            node.getSchema().getName());
      }
      rebuild();
      position = positions.getInt(node);
      if (position == -1) {
        throw XPathError.INTERNAL.newException(
            "node \"" + node.getSchema().getName() + "\" is not part of the evaluated tree");
      }
    }
    return position;
  }

  /**
   * Compute the sort key of an entry. Among entries of one node the element comes first, then the
   * attributes in declaration order, then the text node.
   *
   * @param entry the entry
   * @return a key whose natural order is document order
   * @throws XPathException if the node is not part of the tree
   */
  public long keyOf(final NodeEntry entry) throws XPathException {
    if (entry.type().isRoot()) {
      return 0L;
    }
    final long major = (long) positionOf(entry.node()) << 32;
    return switch (entry.type()) {
      case ATTR -> major | (1 + indexOf(entry.node().getAttributes(), entry.attribute()));
      case TEXT -> major | RANK_TEXT;
      default -> major | RANK_ELEMENT;
    };
  }

  private static int indexOf(final List<?> list, final Object element) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == element) {
        return i;
      }
    }
    return list.size();
  }

  private void rebuild() {
    positions.clear();
    int counter = 1;
    final Deque<DataNode> stack = new ArrayDeque<>();
    for (DataNode top = root; top != null; top = top.getNextSibling()) {
      stack.push(top);
      while (!stack.isEmpty()) {
        final DataNode node = stack.pop();
        positions.put(node, counter++);
        final Deque<DataNode> children = new ArrayDeque<>();
        for (DataNode child = node.getFirstChild(); child != null;
            child = child.getNextSibling()) {
          children.push(child);
        }
        while (!children.isEmpty()) {
          stack.push(children.pop());
        }
      }
    }
    built = true;
  }
}
