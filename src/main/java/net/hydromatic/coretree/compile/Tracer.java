/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.coretree.compile;

import net.hydromatic.coretree.ast.AstNode;
import net.hydromatic.coretree.ast.Core;

/** Called on various events while generating and evaluating meta trees. */
public interface Tracer {
  /** Called when a node has been quoted. */
  void onQuote(AstNode node, AstNode quoted);

  /** Called when a meta-variable is found, and left unquoted. */
  void onMetaVar(Core.Var var);

  /** Called when a run of list cells is quoted as one call to
   * {@code make_list}. */
  void onListBatch(int size);

  /** Called when a call to a built-in function has been evaluated. */
  void onEval(Core.Call call, Object result);
}

// End Tracer.java
