/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.jsdce.jscomp;

import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jsdce.rhino.Node;
import org.jspecify.annotations.Nullable;

/**
 * Memoize a scope creator.
 *
 * <p>This allows you to make multiple passes, without worrying about the expense of generating
 * Scope objects over and over again, and lets those passes agree on the identity of every {@link
 * Var}.
 *
 * <p>On the other hand, you also have to be more aware of what your passes are doing. Scopes are
 * memoized stupidly, so if the underlying tree changes, the scope may be out of sync.
 */
class MemoizedScopeCreator implements ScopeCreator {

  private final Map<Node, Scope> scopes = new LinkedHashMap<>();
  private final ScopeCreator delegate;

  /** @param delegate The real source of Scope objects. */
  MemoizedScopeCreator(ScopeCreator delegate) {
    this.delegate = delegate;
  }

  @Override
  public Scope createScope(Node n, @Nullable Scope parent) {
    Scope scope = scopes.get(n);
    if (scope == null) {
      scope = delegate.createScope(n, parent);
      scopes.put(n, scope);
    } else {
      checkState(parent == scope.getParent(), "Scope for %s requested under a new parent", n);
    }
    return scope;
  }

  /** Returns the memoized scope rooted at {@code n}, if one was created. */
  @Nullable Scope getScope(Node n) {
    return scopes.get(n);
  }
}
