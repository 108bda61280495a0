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
package exm.moxie.frontend;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.Logging;
import exm.moxie.common.lang.Builtins;
import exm.moxie.common.lang.RuntimeHelpers;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Kind;
import exm.moxie.common.lang.Types.MapType;
import exm.moxie.common.lang.Types.PointerType;
import exm.moxie.common.lang.Types.SliceType;
import exm.moxie.common.lang.Types.Type;
import exm.moxie.common.util.Pair;
import exm.moxie.common.util.ScopeStack;
import exm.moxie.frontend.tree.FunctionCall;

/**
 * Tracks the statically apparent type of each name in a file.
 *
 * Facts are recorded as the tree is walked: declarations and parameters
 * bind a name in the innermost scope, assignments update the scope that
 * owns the binding.  A later assignment whose right hand side has an
 * unknown type does not lose a more specific type seen earlier.
 *
 * Queries never fail: anything that can't be worked out is
 * {@link Types#UNKNOWN}.
 */
public class TypeTracker {

  private static final Logger logger = Logging.getMoxieLogger();

  private final String runtimeAlias;

  private ScopeStack<String, Type> scope = new ScopeStack<String, Type>();

  /** First result type of top level functions */
  private final Map<String, Type> funcResults = new HashMap<String, Type>();

  /** Field types of struct types declared in the file */
  private final Map<String, Map<String, Type>> structFields =
                              new HashMap<String, Map<String, Type>>();

  /**
   * @param runtimeAlias package alias used for runtime helper calls, so
   *        that already lowered calls can be typed
   */
  public TypeTracker(String runtimeAlias) {
    this.runtimeAlias = runtimeAlias;
  }

  /**
   * Forget all bindings and file level facts, ready for another walk
   */
  public void reset() {
    scope = new ScopeStack<String, Type>();
    funcResults.clear();
    structFields.clear();
  }

  public void enterScope() {
    scope = scope.makeChildScope();
  }

  public void exitScope() {
    ScopeStack<String, Type> parent = scope.getParent();
    if (parent == null) {
      // Unbalanced walk; stay at file scope
      Logging.uniqueWarn("Type tracker: exit from file scope ignored");
      return;
    }
    scope = parent;
  }

  /**
   * @return number of scopes inside the file scope
   */
  public int nesting() {
    return scope.nesting();
  }

  /**
   * Record function result types and struct declarations from the top
   * level of the file
   * @param file FILE node
   */
  public void recordFileSignatures(MoxieAST file) {
    for (MoxieAST decl: file.children()) {
      if (decl.getType() == MoxieTokens.FUNC_DECL) {
        recordFunctionSignature(decl);
      } else if (decl.getType() == MoxieTokens.TYPE_DECL) {
        for (MoxieAST spec: decl.children()) {
          recordTypeSpec(spec);
        }
      }
    }
  }

  private void recordFunctionSignature(MoxieAST funcDecl) {
    if (funcDecl.child(0).getType() == MoxieTokens.RECEIVER) {
      // Methods aren't called by plain name
      return;
    }
    MoxieAST results = findChild(funcDecl, MoxieTokens.RESULTS);
    if (results != null && results.childCount() > 0) {
      MoxieAST firstResult = results.child(0);
      funcResults.put(funcDecl.getText(),
                      Types.fromTypeExpr(firstResult.child(1)));
    }
  }

  private void recordTypeSpec(MoxieAST typeSpec) {
    MoxieAST typeExpr = typeSpec.child(0);
    if (typeExpr.getType() != MoxieTokens.STRUCT_TYPE) {
      return;
    }
    Map<String, Type> fields = new HashMap<String, Type>();
    for (MoxieAST field: typeExpr.children()) {
      Type fieldType = Types.fromTypeExpr(field.child(1));
      MoxieAST names = field.child(0);
      if (names.childCount() == 0) {
        // Embedded field: named by its type
        fields.put(Types.stripPointer(fieldType).typeName(), fieldType);
      }
      for (MoxieAST name: names.children()) {
        fields.put(name.getText(), fieldType);
      }
    }
    structFields.put(typeSpec.getText(), fields);
  }

  private static MoxieAST findChild(MoxieAST tree, int tokenType) {
    for (MoxieAST child: tree.children()) {
      if (child.getType() == tokenType) {
        return child;
      }
    }
    return null;
  }

  /**
   * Bind names declared with var or const in the current scope
   * @param names declared names
   * @param declaredType type expression, or null if omitted
   * @param initializers initializer expressions, possibly empty
   */
  public void recordDeclaration(List<String> names, MoxieAST declaredType,
                                List<MoxieAST> initializers) {
    Type declared = Types.fromTypeExpr(declaredType);
    for (int i = 0; i < names.size(); i++) {
      Type t = declared;
      if (t.isUnknown() && initializers.size() == names.size()) {
        t = inferExprType(initializers.get(i));
      }
      define(names.get(i), t);
    }
  }

  /**
   * Update bindings for an assignment.
   * @param lhs assignment targets; only plain identifiers are tracked
   * @param rhs right hand side expressions
   * @param define true for :=, which binds new names in the current scope
   */
  public void recordAssignment(List<MoxieAST> lhs, List<MoxieAST> rhs,
                               boolean define) {
    boolean matched = lhs.size() == rhs.size();
    for (int i = 0; i < lhs.size(); i++) {
      MoxieAST target = lhs.get(i);
      if (target.getType() != MoxieTokens.IDENT) {
        continue;
      }
      String name = target.getText();
      Type t = matched ? inferExprType(rhs.get(i)) : Types.UNKNOWN;
      if (define && scope.getDepth(name) != 0) {
        define(name, t);
      } else {
        assign(name, t);
      }
    }
  }

  /**
   * Bind function parameters, receiver and named results in the current
   * scope
   * @param func FUNC_DECL or FUNC_TYPE node
   */
  public void recordParams(MoxieAST func) {
    for (MoxieAST child: func.children()) {
      switch (child.getType()) {
        case MoxieTokens.RECEIVER:
        case MoxieTokens.PARAMS:
        case MoxieTokens.RESULTS:
          for (MoxieAST field: child.children()) {
            Type t = Types.fromTypeExpr(field.child(1));
            for (MoxieAST name: field.child(0).children()) {
              define(name.getText(), t);
            }
          }
          break;
        default:
          break;
      }
    }
  }

  /**
   * Bind the key and value variables of a range clause declared with :=
   * @param range RANGE node
   */
  public void recordRange(MoxieAST range) {
    MoxieAST key = range.child(0);
    MoxieAST value = range.child(1);
    Type ranged = Types.stripPointer(inferExprType(range.child(2)));
    Type keyType = Types.UNKNOWN;
    Type valueType = Types.UNKNOWN;
    if (ranged.kind() == Kind.SLICE) {
      keyType = Types.INT;
      valueType = ((SliceType)ranged).elem();
    } else if (ranged.kind() == Kind.MAP) {
      keyType = ((MapType)ranged).key();
      valueType = ((MapType)ranged).value();
    } else if (Types.isByteString(ranged) || Types.isGoString(ranged)) {
      keyType = Types.INT;
      valueType = Types.RUNE;
    }
    boolean define = range.getText().equals(":=");
    if (key.getType() == MoxieTokens.IDENT) {
      bindRangeVar(key.getText(), keyType, define);
    }
    if (value.getType() == MoxieTokens.IDENT) {
      bindRangeVar(value.getText(), valueType, define);
    }
  }

  private void bindRangeVar(String name, Type t, boolean define) {
    if (define) {
      define(name, t);
    } else {
      assign(name, t);
    }
  }

  private void define(String name, Type t) {
    if (name.equals("_")) {
      return;
    }
    scope.put(name, t);
    if (logger.isTraceEnabled()) {
      logger.trace("define " + name + ": " + t);
    }
  }

  private void assign(String name, Type t) {
    if (name.equals("_")) {
      return;
    }
    int depth = scope.getDepth(name);
    if (depth < 0) {
      // Not declared in this file: bind locally
      scope.put(name, t);
    } else if (!t.isUnknown()) {
      scope.put(name, t, depth);
    }
  }

  /**
   * @return type of the binding visible in the current scope, UNKNOWN if
   *        none
   */
  public Type typeOf(String name) {
    Type t = scope.get(name);
    return t == null ? Types.UNKNOWN : t;
  }

  /**
   * @return true if the name is bound in a visible scope, even if its
   *        type is unknown
   */
  public boolean isBound(String name) {
    return scope.containsKey(name);
  }

  /**
   * @return true for slices, pointers to slices and byte strings
   */
  public boolean isSliceType(Type t) {
    return Types.isByteString(t) ||
           Types.stripPointer(t).kind() == Kind.SLICE;
  }

  /**
   * @return true for maps and pointers to maps
   */
  public boolean isMapType(Type t) {
    return Types.stripPointer(t).kind() == Kind.MAP;
  }

  /**
   * @return true for struct types declared in this file and anonymous
   *        structs, or pointers to them
   */
  public boolean isStructType(Type t) {
    Type inner = Types.stripPointer(t);
    if (inner.kind() != Kind.NAMED) {
      return false;
    }
    return structFields.containsKey(inner.typeName()) ||
           inner.typeName().startsWith("struct{");
  }

  /**
   * @return element type of slice (or pointer to slice) or byte string,
   *        otherwise UNKNOWN
   */
  public Type elementType(Type t) {
    if (Types.isByteString(t)) {
      return Types.BYTE;
    }
    Type inner = Types.stripPointer(t);
    if (inner.kind() == Kind.SLICE) {
      return ((SliceType)inner).elem();
    }
    return Types.UNKNOWN;
  }

  /**
   * @return key and value types of map (or pointer to map), otherwise a
   *        pair of UNKNOWNs
   */
  public Pair<Type, Type> keyValueTypes(Type t) {
    Type inner = Types.stripPointer(t);
    if (inner.kind() == Kind.MAP) {
      MapType mt = (MapType)inner;
      return Pair.create(mt.key(), mt.value());
    }
    return Pair.create(Types.UNKNOWN, Types.UNKNOWN);
  }

  /**
   * @param structType struct type, or pointer to struct type
   * @return declared type of field, or UNKNOWN
   */
  public Type fieldType(Type structType, String field) {
    Map<String, Type> fields = structFields.get(
                    Types.stripPointer(structType).typeName());
    if (fields == null || !fields.containsKey(field)) {
      return Types.UNKNOWN;
    }
    return fields.get(field);
  }

  /**
   * @return field names and types of a struct declared in this file, or
   *        an empty map
   */
  public Map<String, Type> structFields(String structName) {
    Map<String, Type> fields = structFields.get(structName);
    if (fields == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(fields);
  }

  /**
   * Work out the type of an expression from its syntax and the tracked
   * bindings
   * @param expr
   * @return UNKNOWN if it can't be determined
   */
  public Type inferExprType(MoxieAST expr) {
    if (expr.isLoweredFrom(LoweredForm.STRING_LITERAL)) {
      return Types.BYTE_STRING;
    }
    switch (expr.getType()) {
      case MoxieTokens.IDENT:
        return typeOf(expr.getText());
      case MoxieTokens.STRING_LIT:
        // Literals that survive literalization are base language strings
        return Types.STRING;
      case MoxieTokens.INT_LIT:
        return Types.INT;
      case MoxieTokens.CHAR_LIT:
        return Types.RUNE;
      case MoxieTokens.FLOAT_LIT:
        return Types.primitive("float64");
      case MoxieTokens.PAREN:
        return inferExprType(expr.child(0));
      case MoxieTokens.COMPOSITE_LIT:
        return Types.fromTypeExpr(expr.child(0));
      case MoxieTokens.UNARY:
        return inferUnaryType(expr);
      case MoxieTokens.STAR:
        return inferDerefType(inferExprType(expr.child(0)));
      case MoxieTokens.INDEX:
        return inferIndexType(expr);
      case MoxieTokens.SELECTOR:
        return inferSelectorType(expr);
      case MoxieTokens.CALL:
        return inferCallType(FunctionCall.fromAST(expr));
      case MoxieTokens.BINARY:
        return inferBinaryType(expr);
      case MoxieTokens.TYPE_ASSERT:
        return Types.fromTypeExpr(expr.child(1));
      default:
        return Types.UNKNOWN;
    }
  }

  private Type inferUnaryType(MoxieAST expr) {
    String op = expr.getText();
    Type operand = inferExprType(expr.child(0));
    if (op.equals("&")) {
      if (operand.isUnknown() || Types.isByteString(operand)) {
        return operand;
      }
      return Types.pointer(operand);
    } else if (op.equals("!")) {
      return Types.primitive("bool");
    } else if (op.equals("<-")) {
      return Types.UNKNOWN;
    }
    return operand;
  }

  private Type inferDerefType(Type pointer) {
    if (Types.isByteString(pointer)) {
      return Types.slice(Types.BYTE);
    } else if (pointer.kind() == Kind.POINTER) {
      return ((PointerType)pointer).inner();
    }
    return Types.UNKNOWN;
  }

  private Type inferIndexType(MoxieAST expr) {
    Type x = inferExprType(expr.child(0));
    if (Types.isByteString(x) || Types.isGoString(x)) {
      return Types.BYTE;
    } else if (x.kind() == Kind.SLICE) {
      return ((SliceType)x).elem();
    } else if (x.kind() == Kind.MAP) {
      return ((MapType)x).value();
    }
    return Types.UNKNOWN;
  }

  private Type inferSelectorType(MoxieAST expr) {
    Type x = inferExprType(expr.child(0));
    if (isStructType(x)) {
      return fieldType(x, expr.child(1).getText());
    }
    return Types.UNKNOWN;
  }

  private Type inferCallType(FunctionCall call) {
    if (call.isUnqualified()) {
      String name = call.name();
      if (call.typeArgs().isEmpty() && name.equals(Builtins.STRING)) {
        // string(x) makes a dialect string
        return Types.BYTE_STRING;
      } else if (call.typeArgs().isEmpty() && Types.isPrimitiveName(name)) {
        // Conversion, e.g. int32(x)
        return Types.fromTypeExpr(call.fun());
      } else if (name.equals(Builtins.CLONE) || name.equals(Builtins.GROW) ||
                 name.equals(Builtins.APPEND)) {
        return call.args().isEmpty() ? Types.UNKNOWN :
                                       inferExprType(call.arg(0));
      } else if (funcResults.containsKey(name)) {
        return funcResults.get(name);
      }
      return Types.UNKNOWN;
    }

    if (runtimeAlias.equals(call.packageName())) {
      return inferHelperType(call);
    }

    // Conversion to a composite type, e.g. (*[]T)(x) or []byte(x)
    MoxieAST fun = call.fun();
    while (fun.getType() == MoxieTokens.PAREN) {
      fun = fun.child(0);
    }
    switch (fun.getType()) {
      case MoxieTokens.SLICE_TYPE:
      case MoxieTokens.MAP_TYPE:
      case MoxieTokens.STAR:
        return Types.fromTypeExpr(fun);
      default:
        return Types.UNKNOWN;
    }
  }

  private Type inferHelperType(FunctionCall call) {
    Helper helper = Helper.fromGoName(call.name());
    if (helper == null) {
      return Types.UNKNOWN;
    }
    List<MoxieAST> typeArgs = call.typeArgs();
    switch (helper) {
      case CONCAT:
      case INT_TO_STRING:
      case RUNE_TO_STRING:
      case RUNES_TO_STRING:
        return Types.BYTE_STRING;
      case CONCAT_SLICE:
        if (typeArgs.size() == 1) {
          return Types.pointer(Types.slice(Types.fromTypeExpr(typeArgs.get(0))));
        }
        return call.args().isEmpty() ? Types.UNKNOWN :
                                       inferExprType(call.arg(0));
      case STRING_TO_RUNES:
        return Types.pointer(Types.slice(Types.RUNE));
      case COERCE:
        if (typeArgs.size() == 2) {
          return Types.pointer(Types.slice(Types.fromTypeExpr(typeArgs.get(1))));
        }
        return Types.UNKNOWN;
      case CLONE_SLICE:
      case CLONE_MAP:
      case DEEP_COPY:
      case GROW_SLICE:
      case GROW_MAP:
      case GROW:
        return call.args().isEmpty() ? Types.UNKNOWN :
                                       inferExprType(call.arg(0));
      default:
        return Types.UNKNOWN;
    }
  }

  private Type inferBinaryType(MoxieAST expr) {
    String op = expr.getText();
    switch (op) {
      case "==": case "!=": case "<": case "<=": case ">": case ">=":
      case "&&": case "||":
        return Types.primitive("bool");
      default:
        break;
    }
    Type x = inferExprType(expr.child(0));
    Type y = inferExprType(expr.child(1));
    if (op.equals("+")) {
      if (Types.isByteString(x) || Types.isByteString(y)) {
        return Types.BYTE_STRING;
      } else if (isSliceType(x)) {
        return x;
      } else if (isSliceType(y)) {
        return y;
      }
    }
    if (op.equals("<<") || op.equals(">>")) {
      return x;
    }
    return x.isUnknown() ? y : x;
  }

  /**
   * @return true if a runtime helper call refers to given helper
   */
  public boolean isHelperCall(MoxieAST expr, Helper helper) {
    return expr.getType() == MoxieTokens.CALL &&
           RuntimeHelpers.isRef(expr.child(0), runtimeAlias, helper);
  }

  @Override
  public String toString() {
    return scope.toString();
  }
}
