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

import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of the compiled schema tree.
 * <p>
 * Augments are attached to their target: they are listed among the target's children and their
 * own children report the augment as parent.
 * </p>
 */
public interface SchemaNode {

  SchemaNodeKind getKind();

  String getName();

  /**
   * Get the module this node belongs to. For augmented nodes this is the augmenting module.
   *
   * @return the module
   */
  Module getModule();

  /**
   * Get the parent node.
   *
   * @return the parent, the augment for augmented nodes or {@code null} for top-level nodes
   */
  @Nullable
  SchemaNode getParent();

  List<SchemaNode> getChildren();

  /**
   * Whether the node represents configuration.
   *
   * @return {@code true} for {@code config true} nodes
   */
  boolean isConfig();

  /**
   * Get the type of a leaf or leaf-list.
   *
   * @return the type or {@code null} for other kinds
   */
  @Nullable
  LeafType getType();

  /**
   * Get the {@code when} condition of this node.
   *
   * @return the expression or {@code null}
   */
  @Nullable
  String getWhen();

  List<String> getMusts();

  /**
   * Get the augmented node of an augment.
   *
   * @return the target or {@code null} if this node is not an augment
   */
  @Nullable
  SchemaNode getAugmentTarget();
}
