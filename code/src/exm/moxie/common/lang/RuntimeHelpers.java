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
package exm.moxie.common.lang;

import java.util.Arrays;
import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.MoxieRuntimeError;

/**
 * Functions of the runtime helper library that rewritten code calls.
 */
public class RuntimeHelpers {

  public static enum Helper {
    CONCAT("Concat", 0),
    CONCAT_SLICE("ConcatSlice", 1),
    CLONE_SLICE("CloneSlice", 1),
    CLONE_MAP("CloneMap", 2),
    DEEP_COPY("DeepCopy", 1),
    COPY_SLICE("CopySlice", 1),
    COPY_MAP("CopyMap", 2),
    DEEP_COPY_INTO("DeepCopyInto", 1),
    GROW_SLICE("GrowSlice", 1),
    GROW_MAP("GrowMap", 2),
    GROW("Grow", 0),
    FREE_SLICE("FreeSlice", 1),
    FREE_MAP("FreeMap", 2),
    FREE("Free", 1),
    COERCE("Coerce", 2),
    DLOPEN("Dlopen", 0),
    DLSYM("Dlsym", 1),
    DLCLOSE("Dlclose", 0),
    DLERROR("Dlerror", 0),
    INT_TO_STRING("IntToString", 0),
    RUNE_TO_STRING("RuneToString", 0),
    RUNES_TO_STRING("RunesToString", 0),
    STRING_TO_RUNES("StringToRunes", 0);

    private final String goName;
    private final int typeParams;

    private Helper(String goName, int typeParams) {
      this.goName = goName;
      this.typeParams = typeParams;
    }

    public String goName() {
      return goName;
    }

    /**
     * @return number of type parameters in the helper's signature
     */
    public int typeParams() {
      return typeParams;
    }

    /**
     * Find the helper a selector name refers to
     * @return null if no such helper
     */
    public static Helper fromGoName(String name) {
      for (Helper h: values()) {
        if (h.goName.equals(name)) {
          return h;
        }
      }
      return null;
    }
  }

  /** Helpers for clone, copy, grow and free: slice, map, fallback */
  public static Helper sliceVariant(String builtin) {
    if (builtin.equals(Builtins.CLONE)) {
      return Helper.CLONE_SLICE;
    } else if (builtin.equals(Builtins.COPY)) {
      return Helper.COPY_SLICE;
    } else if (builtin.equals(Builtins.GROW)) {
      return Helper.GROW_SLICE;
    } else if (builtin.equals(Builtins.FREE)) {
      return Helper.FREE_SLICE;
    }
    throw new MoxieRuntimeError("Not a memory built-in: " + builtin);
  }

  public static Helper mapVariant(String builtin) {
    if (builtin.equals(Builtins.CLONE)) {
      return Helper.CLONE_MAP;
    } else if (builtin.equals(Builtins.COPY)) {
      return Helper.COPY_MAP;
    } else if (builtin.equals(Builtins.GROW)) {
      return Helper.GROW_MAP;
    } else if (builtin.equals(Builtins.FREE)) {
      return Helper.FREE_MAP;
    }
    throw new MoxieRuntimeError("Not a memory built-in: " + builtin);
  }

  public static Helper fallbackVariant(String builtin) {
    if (builtin.equals(Builtins.CLONE)) {
      return Helper.DEEP_COPY;
    } else if (builtin.equals(Builtins.COPY)) {
      return Helper.DEEP_COPY_INTO;
    } else if (builtin.equals(Builtins.GROW)) {
      return Helper.GROW;
    } else if (builtin.equals(Builtins.FREE)) {
      return Helper.FREE;
    }
    throw new MoxieRuntimeError("Not a memory built-in: " + builtin);
  }

  /**
   * Reference to a helper, with no type arguments
   */
  public static MoxieAST ref(String alias, Helper helper) {
    return Trees.selector(Trees.ident(alias), helper.goName());
  }

  public static MoxieAST ref(String alias, Helper helper,
                             MoxieAST ...typeArgs) {
    return ref(alias, helper, Arrays.asList(typeArgs));
  }

  /**
   * Reference to a helper, instantiated with type arguments if given.
   * Helpers with type parameters may be left for the base compiler to
   * infer by passing no type arguments.
   */
  public static MoxieAST ref(String alias, Helper helper,
                             List<MoxieAST> typeArgs) {
    MoxieAST fun = ref(alias, helper);
    if (typeArgs.isEmpty()) {
      return fun;
    }
    if (typeArgs.size() != helper.typeParams()) {
      throw new MoxieRuntimeError("Helper " + helper.goName() + " takes "
          + helper.typeParams() + " type arguments, but got " +
          typeArgs.size());
    }
    return Trees.index(fun, typeArgs);
  }

  /**
   * @return true if the expression refers to the helper, instantiated or
   *        not
   */
  public static boolean isRef(MoxieAST expr, String alias, Helper helper) {
    if (expr.getType() == MoxieTokens.INDEX) {
      expr = expr.child(0);
    }
    return expr.getType() == MoxieTokens.SELECTOR &&
           expr.child(0).getType() == MoxieTokens.IDENT &&
           expr.child(0).getText().equals(alias) &&
           expr.child(1).getText().equals(helper.goName());
  }
}
