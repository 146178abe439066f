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

package io.yangpath.xpath.axis;

import java.util.ArrayList;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

import io.yangpath.api.Module;
import io.yangpath.api.SchemaNode;
import io.yangpath.api.SchemaNodeKind;
import io.yangpath.xpath.NodeType;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.SchemaEntry;
import io.yangpath.xpath.XPathOption;
import io.yangpath.xpath.XPathSet;

/**
 * Navigation helpers over the schema tree. Choice, case, uses and augment nodes are looked
 * through; RPC and action input or output are entered depending on {@link XPathOption#OUTPUT}.
 */
public final class SchemaTree {

  private SchemaTree() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get the schema nodes that can be data children of a node.
   *
   * @param context the analysis
   * @param parent the parent, {@code null} for the root
   * @return the children in schema order
   */
  public static List<SchemaNode> children(final SchemaContext context,
      final @Nullable SchemaNode parent) {
    final boolean output = context.hasOption(XPathOption.OUTPUT);
    final List<SchemaNode> children = new ArrayList<>();
    if (parent == null) {
      for (final Module module : context.getYangContext().getModules()) {
        if (!module.isImplemented()) {
          continue;
        }
        for (final SchemaNode top : module.getData()) {
          if (top.getKind() != SchemaNodeKind.AUGMENT) {
            collect(List.of(top), output, children);
          }
        }
      }
      return children;
    }
    if (parent.getKind().isLeaf() || parent.getKind().isOpaque()) {
      return children;
    }
    collect(parent.getChildren(), output, children);
    return children;
  }

  private static void collect(final List<SchemaNode> nodes, final boolean output,
      final List<SchemaNode> result) {
    for (final SchemaNode node : nodes) {
      switch (node.getKind()) {
        case CHOICE, CASE, USES, AUGMENT -> collect(node.getChildren(), output, result);
        case INPUT -> {
          if (!output) {
            collect(node.getChildren(), output, result);
          }
        }
        case OUTPUT -> {
          if (output) {
            collect(node.getChildren(), output, result);
          }
        }
        case GROUPING -> {
        }
        default -> result.add(node);
      }
    }
  }

  /**
   * Get the closest ancestor that is instantiated in data trees. Augments are left through their
   * target.
   *
   * @param node the node
   * @return the ancestor or {@code null} if the node is top-level
   */
  public static @Nullable SchemaNode dataParent(final SchemaNode node) {
    return firstDataNode(step(node));
  }

  /**
   * Get the node itself if it is instantiated in data trees, otherwise its closest such ancestor.
   *
   * @param node the node, may be {@code null}
   * @return the node, an ancestor or {@code null}
   */
  public static @Nullable SchemaNode firstDataNode(final @Nullable SchemaNode node) {
    SchemaNode current = node;
    while (current != null && current.getKind().isTransparent()) {
      current = step(current);
    }
    return current;
  }

  private static @Nullable SchemaNode step(final SchemaNode node) {
    if (node.getKind() == SchemaNodeKind.AUGMENT) {
      return node.getAugmentTarget();
    }
    return node.getParent();
  }

  /**
   * Add a child to a schema set as context node, honoring the configuration root.
   *
   * @param context the analysis
   * @param set the set
   * @param child the child
   * @return {@code true} if the child was added
   */
  static boolean addChild(final SchemaContext context, final XPathSet set,
      final SchemaNode child) {
    if (context.getRootType() == NodeType.ROOT_CONFIG && !child.isConfig()) {
      return false;
    }
    set.addSchemaNode(child, NodeType.ELEM, SchemaEntry.IN_CONTEXT);
    return true;
  }

  /**
   * Determines if a node lies in the subtree of another node.
   *
   * @param node the node
   * @param ancestor the subtree root
   * @return {@code true} if {@code ancestor} is {@code node} or one of its ancestors
   */
  public static boolean isInSubtree(final SchemaNode node, final SchemaNode ancestor) {
    for (SchemaNode current = node; current != null; current = step(current)) {
      if (current == ancestor) {
        return true;
      }
    }
    return false;
  }
}
