/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.moxie.common.util;

import java.util.HashMap;
import java.util.Map.Entry;

/**
 * Map with a chain of enclosing scopes.  Lookups search from the
 * innermost scope outwards.  Each scope only ever modifies its own
 * bindings, unless a depth is given explicitly.
 *
 * @param <K>
 * @param <V>
 */
public class ScopeStack<K, V> {
  private final HashMap<K, V> map;
  private final ScopeStack<K, V> parent;

  public ScopeStack() {
    this(null);
  }

  private ScopeStack(ScopeStack<K, V> parent) {
    this.map = new HashMap<K, V>();
    this.parent = parent;
  }

  public ScopeStack<K, V> makeChildScope() {
    return new ScopeStack<K, V>(this);
  }

  /**
   * @return enclosing scope, null if this is the outermost
   */
  public ScopeStack<K, V> getParent() {
    return parent;
  }

  public boolean containsKey(K key) {
    return map.containsKey(key)
        || (parent != null && parent.containsKey(key));
  }

  public V get(K key) {
    if (map.containsKey(key)) {
      return map.get(key);
    } else if (parent != null) {
      return parent.get(key);
    } else {
      return null;
    }
  }

  /**
   * @param key
   * @return the depth at which the key is defined, -1 if not defined
   */
  public int getDepth(K key) {
    int depth = 0;
    ScopeStack<K, V> curr = this;
    while (curr != null) {
      if (curr.map.containsKey(key)) {
        return depth;
      }
      depth++;
      curr = curr.parent;
    }
    return -1;
  }

  /**
   * Number of scopes enclosing this one
   */
  public int nesting() {
    int depth = 0;
    ScopeStack<K, V> curr = parent;
    while (curr != null) {
      depth++;
      curr = curr.parent;
    }
    return depth;
  }

  /**
   * Bind in this scope, shadowing any outer binding
   */
  public V put(K key, V value) {
    return map.put(key, value);
  }

  /**
   * Put at a higher level in the stack
   * @param key
   * @param value
   * @param depth 0 for this scope, 1 for the parent, etc.
   */
  public void put(K key, V value, int depth) throws IllegalArgumentException {
    ScopeStack<K, V> curr = this;
    for (int i = 0; i < depth; i++) {
      curr = curr.parent;
      if (curr == null) {
        throw new IllegalArgumentException("Scope stack didn't have "
                    + depth + " ancestors");
      }
    }
    curr.put(key, value);
  }

  public boolean isEmpty() {
    return map.isEmpty() && (parent == null || parent.isEmpty());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    ScopeStack<K, V> curr = this;
    while (curr != null) {
      if (curr != this) {
        sb.append(" < ");
      }
      sb.append("{");
      boolean first = true;
      for (Entry<K, V> e: curr.map.entrySet()) {
        if (first) {
          first = false;
        } else {
          sb.append(",");
        }
        sb.append(e.getKey());
        sb.append(":");
        sb.append(e.getValue());
      }
      sb.append("}");
      curr = curr.parent;
    }
    return sb.toString();
  }
}
