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
 * A YANG module as seen by the evaluator: its name, prefix, namespace, imports, top-level schema
 * nodes and identities.
 */
public interface Module {

  String getName();

  String getPrefix();

  String getNamespace();

  /**
   * Resolve a prefix through the import table of this module.
   *
   * @param prefix the prefix used inside this module
   * @return the imported module or {@code null} if nothing is imported under {@code prefix}
   */
  @Nullable
  Module getImport(String prefix);

  /**
   * Get the top-level schema nodes of this module, including augments defined by it.
   *
   * @return the top-level nodes in declaration order
   */
  List<SchemaNode> getData();

  List<Identity> getIdentities();

  /**
   * Whether data of this module may be instantiated.
   *
   * @return {@code true} if the module is implemented, {@code false} if it is only imported
   */
  boolean isImplemented();

  YangContext getContext();
}
