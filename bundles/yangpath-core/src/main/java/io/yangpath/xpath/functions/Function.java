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

import java.util.List;

import io.yangpath.exception.UnresolvedDependencyException;
import io.yangpath.exception.XPathException;
import io.yangpath.xpath.SchemaContext;
import io.yangpath.xpath.XPathContext;
import io.yangpath.xpath.XPathSet;

/**
 * <h1>Function</h1>
 * <p>
 * An XPath core or YANG function. Arguments are evaluated before the call; the result replaces
 * the content of the set the function was called on, which also provides the context node for
 * functions whose argument defaults to it.
 * </p>
 */
public interface Function {

  /**
   * Compute the value of the function.
   *
   * @param args evaluated arguments
   * @param set the context set, receives the result
   * @param context the evaluation
   * @throws XPathException if an argument is invalid
   * @throws UnresolvedDependencyException if a node with an unresolved when was reached
   */
  void evaluate(List<XPathSet> args, XPathSet set, XPathContext context)
      throws XPathException, UnresolvedDependencyException;

  /**
   * Collect the schema nodes the function reads and report arguments of unexpected kind or type.
   *
   * @param args atomized arguments
   * @param set the context set, receives the atoms
   * @param context the analysis
   * @throws XPathException if an argument is invalid
   */
  void atomize(List<XPathSet> args, XPathSet set, SchemaContext context) throws XPathException;
}
