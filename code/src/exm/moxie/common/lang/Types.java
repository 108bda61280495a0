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

import java.util.Objects;

import com.google.common.collect.ImmutableSet;

import exm.moxie.ast.ExprPrinter;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieAST.LoweredForm;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.MoxieRuntimeError;

/**
 * Syntactic types the transformer tracks for names and expressions.
 * These are what can be read off declarations and literals, not the
 * result of full type inference.
 */
public class Types {

  public static enum Kind {
    PRIMITIVE,
    /** The dialect's mutable string */
    BYTE_STRING,
    POINTER,
    SLICE,
    MAP,
    /** Any other named or structural type, e.g. structs or channels */
    NAMED,
    /** Nothing statically visible */
    UNKNOWN,
  }

  private static final ImmutableSet<String> PRIMITIVE_NAMES = ImmutableSet.of(
      "bool", "byte", "rune", "string", "int", "int8", "int16", "int32",
      "int64", "uint", "uint8", "uint16", "uint32", "uint64", "uintptr",
      "float32", "float64", "complex64", "complex128");

  private static final ImmutableSet<String> INTEGER_NAMES = ImmutableSet.of(
      "byte", "rune", "int", "int8", "int16", "int32", "int64", "uint",
      "uint8", "uint16", "uint32", "uint64", "uintptr");

  public static boolean isPrimitiveName(String name) {
    return PRIMITIVE_NAMES.contains(name);
  }

  public static boolean isInteger(Type t) {
    return t.kind() == Kind.PRIMITIVE && INTEGER_NAMES.contains(t.typeName());
  }

  /**
   * @return true for rune and its alias int32
   */
  public static boolean isRune(Type t) {
    return t.kind() == Kind.PRIMITIVE && (t.typeName().equals("rune") ||
                                          t.typeName().equals("int32"));
  }

  public static abstract class Type {
    public abstract Kind kind();

    /**
     * @return type in base language syntax
     */
    public abstract String typeName();

    public boolean isUnknown() {
      return kind() == Kind.UNKNOWN;
    }

    @Override
    public String toString() {
      return typeName();
    }
  }

  public static class PrimitiveType extends Type {
    private final String name;

    private PrimitiveType(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.PRIMITIVE;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PrimitiveType &&
             ((PrimitiveType)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  public static class PointerType extends Type {
    private final Type inner;

    private PointerType(Type inner) {
      this.inner = inner;
    }

    public Type inner() {
      return inner;
    }

    @Override
    public Kind kind() {
      return Kind.POINTER;
    }

    @Override
    public String typeName() {
      return "*" + inner.typeName();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PointerType &&
             ((PointerType)obj).inner.equals(inner);
    }

    @Override
    public int hashCode() {
      return 31 * inner.hashCode() + 1;
    }
  }

  public static class SliceType extends Type {
    private final Type elem;

    private SliceType(Type elem) {
      this.elem = elem;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public Kind kind() {
      return Kind.SLICE;
    }

    @Override
    public String typeName() {
      return "[]" + elem.typeName();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof SliceType &&
             ((SliceType)obj).elem.equals(elem);
    }

    @Override
    public int hashCode() {
      return 31 * elem.hashCode() + 2;
    }
  }

  public static class MapType extends Type {
    private final Type key;
    private final Type value;

    private MapType(Type key, Type value) {
      this.key = key;
      this.value = value;
    }

    public Type key() {
      return key;
    }

    public Type value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public String typeName() {
      return "map[" + key.typeName() + "]" + value.typeName();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof MapType)) {
        return false;
      }
      MapType other = (MapType)obj;
      return other.key.equals(key) && other.value.equals(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(key, value);
    }
  }

  /**
   * Type identified by its printed form.  Keeps the type expression it
   * came from, if any, so it can be written back out unchanged.
   */
  public static class NamedType extends Type {
    private final String name;
    private final MoxieAST typeExpr;

    private NamedType(String name, MoxieAST typeExpr) {
      this.name = name;
      this.typeExpr = typeExpr;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.NAMED;
    }

    @Override
    public String typeName() {
      return name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NamedType &&
             ((NamedType)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /**
   * The dialect's mutable string, held as *[]byte.  Only the lowered string
   * type, lowered literals and helpers returning strings have this type:
   * string written inside a container type is the base language string.
   */
  private static class ByteStringType extends Type {
    @Override
    public Kind kind() {
      return Kind.BYTE_STRING;
    }

    @Override
    public String typeName() {
      return "*[]byte";
    }
  }

  private static class UnknownType extends Type {
    @Override
    public Kind kind() {
      return Kind.UNKNOWN;
    }

    @Override
    public String typeName() {
      return "<unknown>";
    }
  }

  public static final Type UNKNOWN = new UnknownType();

  public static final Type BYTE_STRING = new ByteStringType();
  /** The base language's immutable string */
  public static final Type STRING = new PrimitiveType(Builtins.STRING);
  public static final Type BYTE = new PrimitiveType(Builtins.BYTE);
  public static final Type RUNE = new PrimitiveType(Builtins.RUNE);
  public static final Type INT = new PrimitiveType("int");

  public static Type primitive(String name) {
    if (!isPrimitiveName(name)) {
      throw new MoxieRuntimeError("Not a primitive type: " + name);
    }
    return new PrimitiveType(name);
  }

  public static Type pointer(Type inner) {
    return new PointerType(inner);
  }

  public static Type slice(Type elem) {
    return new SliceType(elem);
  }

  public static Type map(Type key, Type value) {
    return new MapType(key, value);
  }

  public static Type named(String name) {
    return new NamedType(name, null);
  }

  public static boolean isByteString(Type t) {
    return t.kind() == Kind.BYTE_STRING;
  }

  public static boolean isGoString(Type t) {
    return STRING.equals(t);
  }

  /**
   * @return t, or what it points to if t is a pointer
   */
  public static Type stripPointer(Type t) {
    if (t.kind() == Kind.POINTER) {
      return ((PointerType)t).inner();
    }
    return t;
  }

  /**
   * Read a type off a type expression
   * @param typeExpr type expression, or null or EMPTY if none
   * @return UNKNOWN if no type given
   */
  public static Type fromTypeExpr(MoxieAST typeExpr) {
    if (typeExpr == null) {
      return UNKNOWN;
    }
    switch (typeExpr.getType()) {
      case MoxieTokens.EMPTY:
        return UNKNOWN;
      case MoxieTokens.IDENT: {
        String name = typeExpr.getText();
        if (isPrimitiveName(name)) {
          return new PrimitiveType(name);
        }
        return new NamedType(name, typeExpr);
      }
      case MoxieTokens.STAR:
        if (typeExpr.isLoweredFrom(LoweredForm.STRING_TYPE)) {
          return BYTE_STRING;
        }
        return pointer(fromTypeExpr(typeExpr.child(0)));
      case MoxieTokens.PAREN:
        return fromTypeExpr(typeExpr.child(0));
      case MoxieTokens.SLICE_TYPE:
        return slice(fromTypeExpr(typeExpr.child(0)));
      case MoxieTokens.MAP_TYPE:
        return map(fromTypeExpr(typeExpr.child(0)),
                   fromTypeExpr(typeExpr.child(1)));
      case MoxieTokens.SELECTOR:
      case MoxieTokens.INDEX:
      case MoxieTokens.ARRAY_TYPE:
      case MoxieTokens.CHAN_TYPE:
      case MoxieTokens.STRUCT_TYPE:
      case MoxieTokens.FUNC_TYPE:
      case MoxieTokens.INTERFACE_TYPE:
        return new NamedType(ExprPrinter.print(typeExpr), typeExpr);
      default:
        // Not a type expression
        return UNKNOWN;
    }
  }

  /**
   * Build a type expression for a known type.  The byte string is
   * written as *[]byte wherever it appears.
   * @param t a type other than UNKNOWN
   * @return a new tree
   */
  public static MoxieAST toTypeExpr(Type t) {
    switch (t.kind()) {
      case PRIMITIVE:
        return Trees.ident(t.typeName());
      case BYTE_STRING:
        return Trees.byteStringType();
      case POINTER:
        return Trees.star(toTypeExpr(((PointerType)t).inner()));
      case SLICE:
        return Trees.sliceType(toTypeExpr(((SliceType)t).elem()));
      case MAP: {
        MapType mt = (MapType)t;
        return Trees.mapType(toTypeExpr(mt.key()), toTypeExpr(mt.value()));
      }
      case NAMED: {
        NamedType nt = (NamedType)t;
        if (nt.typeExpr != null) {
          return nt.typeExpr.copyTree();
        }
        return Trees.qualifiedName(nt.name());
      }
      case UNKNOWN:
        throw new MoxieRuntimeError("No type expression for unknown type");
      default:
        throw new MoxieRuntimeError("Unexpected type kind: " + t.kind());
    }
  }
}
