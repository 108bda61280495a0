package exm.moxie.frontend;

import static exm.moxie.ast.Trees.addressOf;
import static exm.moxie.ast.Trees.binary;
import static exm.moxie.ast.Trees.byteStringType;
import static exm.moxie.ast.Trees.call;
import static exm.moxie.ast.Trees.compositeLit;
import static exm.moxie.ast.Trees.field;
import static exm.moxie.ast.Trees.funcDecl;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.index;
import static exm.moxie.ast.Trees.intLit;
import static exm.moxie.ast.Trees.mapType;
import static exm.moxie.ast.Trees.names;
import static exm.moxie.ast.Trees.params;
import static exm.moxie.ast.Trees.rangeStmt;
import static exm.moxie.ast.Trees.results;
import static exm.moxie.ast.Trees.block;
import static exm.moxie.ast.Trees.selector;
import static exm.moxie.ast.Trees.sliceType;
import static exm.moxie.ast.Trees.star;
import static exm.moxie.ast.Trees.structType;
import static exm.moxie.ast.Trees.typeDecl;
import static exm.moxie.ast.Trees.typeSpec;
import static exm.moxie.frontend.TreeFixtures.file;
import static exm.moxie.frontend.TreeFixtures.str;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.lang.RuntimeHelpers.Helper;
import exm.moxie.common.lang.Types;
import exm.moxie.common.lang.Types.Type;

public class TypeTrackerTest {

  private TypeTracker types;

  @Before
  public void setUp() {
    types = new TypeTracker("moxie");
  }

  private static List<MoxieAST> none() {
    return Collections.emptyList();
  }

  private void declare(String name, MoxieAST type) {
    types.recordDeclaration(Arrays.asList(name), type, none());
  }

  private void define(String name, MoxieAST value) {
    types.recordAssignment(Arrays.asList(ident(name)), Arrays.asList(value),
                           true);
  }

  private void assign(String name, MoxieAST value) {
    types.recordAssignment(Arrays.asList(ident(name)), Arrays.asList(value),
                           false);
  }

  private static Type int32Slice() {
    return Types.pointer(Types.slice(Types.primitive("int32")));
  }

  @Test
  public void testDeclarations() {
    declare("s", byteStringType());
    declare("n", ident("int64"));
    types.recordDeclaration(Arrays.asList("a", "b"), null,
                            Arrays.asList(str("x"), intLit("1")));
    assertTrue(Types.isByteString(types.typeOf("s")));
    assertEquals(Types.primitive("int64"), types.typeOf("n"));
    // A literal that wasn't lowered is a base language string
    assertTrue(Types.isGoString(types.typeOf("a")));
    assertEquals(Types.INT, types.typeOf("b"));
    assertTrue(types.typeOf("missing").isUnknown());
    assertFalse(types.isBound("missing"));
  }

  @Test
  public void testUnknownAssignmentKeepsType() {
    define("xs", addressOf(compositeLit(sliceType(ident("int32")))));
    assign("xs", call(ident("mystery")));
    assertEquals(int32Slice(), types.typeOf("xs"));
    assertEquals(Types.primitive("int32"),
                 types.elementType(types.typeOf("xs")));
  }

  @Test
  public void testUnresolvedTargetBoundLocally() {
    assign("global", call(ident("mystery")));
    assertTrue(types.isBound("global"));
    assertTrue(types.typeOf("global").isUnknown());
  }

  @Test
  public void testScopes() {
    declare("x", byteStringType());
    types.enterScope();
    assertEquals(1, types.nesting());
    define("x", intLit("1"));
    assertEquals(Types.INT, types.typeOf("x"));
    // Assignment updates the scope that owns the binding
    declare("y", null);
    types.enterScope();
    assign("y", intLit("2"));
    types.exitScope();
    assertEquals(Types.INT, types.typeOf("y"));
    types.exitScope();
    assertTrue(Types.isByteString(types.typeOf("x")));
    assertFalse(types.isBound("y"));
  }

  @Test
  public void testUnbalancedExit() {
    declare("x", ident("int"));
    types.exitScope();
    assertEquals(0, types.nesting());
    assertEquals(Types.INT, types.typeOf("x"));
  }

  @Test
  public void testBlankIgnored() {
    define("_", intLit("1"));
    assertFalse(types.isBound("_"));
  }

  @Test
  public void testFileSignatures() {
    MoxieAST point = typeDecl(typeSpec("Point", structType(
        field(names("X", "Y"), ident("float64"), null),
        field(names("Label"), star(sliceType(ident("byte"))), null))));
    MoxieAST f = file(point,
        funcDecl("load", params(),
                 results(field(names(), star(sliceType(ident("int32"))),
                               null)),
                 block()));
    types.recordFileSignatures(f);
    assertEquals(int32Slice(), types.inferExprType(call(ident("load"))));

    declare("p", star(ident("Point")));
    assertTrue(types.isStructType(types.typeOf("p")));
    assertEquals(Types.primitive("float64"),
                 types.inferExprType(selector(ident("p"), "X")));
    assertEquals(3, types.structFields("Point").size());
    assertTrue(types.fieldType(types.typeOf("p"), "Z").isUnknown());

    types.reset();
    assertTrue(types.inferExprType(call(ident("load"))).isUnknown());
  }

  @Test
  public void testRange() {
    declare("m", mapType(ident("string"), ident("int")));
    MoxieAST range = rangeStmt(":=", ident("k"), ident("v"), ident("m"),
                               block());
    types.recordRange(range);
    assertTrue(Types.isGoString(types.typeOf("k")));
    assertEquals(Types.INT, types.typeOf("v"));

    declare("s", byteStringType());
    types.recordRange(rangeStmt(":=", ident("i"), ident("r"), ident("s"),
                                block()));
    assertEquals(Types.INT, types.typeOf("i"));
    assertEquals(Types.RUNE, types.typeOf("r"));

    declare("names", sliceType(ident("string")));
    types.recordRange(rangeStmt(":=", ident("_"), ident("name"),
                                ident("names"), block()));
    assertTrue(Types.isGoString(types.typeOf("name")));
    types.recordRange(rangeStmt(":=", ident("j"), ident("c"),
                                ident("name"), block()));
    assertEquals(Types.RUNE, types.typeOf("c"));
  }

  @Test
  public void testContainerStringsAreBaseStrings() {
    declare("names", sliceType(ident("string")));
    declare("ages", mapType(ident("string"), ident("int")));
    declare("labels", mapType(ident("int"), byteStringType()));
    MoxieAST first = index(ident("names"), intLit("0"));
    assertTrue(Types.isGoString(types.inferExprType(first)));
    assertEquals(Types.BYTE, types.inferExprType(index(first, intLit("0"))));
    assertTrue(Types.isGoString(types.keyValueTypes(
                                    types.typeOf("ages")).val1));
    assertTrue(Types.isByteString(types.inferExprType(
                                    index(ident("labels"), intLit("1")))));
    // Adding base strings stays a base string
    assertTrue(Types.isGoString(types.inferExprType(
                                    binary("+", first, first.copyTree()))));
    // The conversion makes a dialect string
    assertTrue(Types.isByteString(types.inferExprType(
                                    call(ident("string"), ident("r")))));
  }

  @Test
  public void testExpressions() {
    declare("xs", star(sliceType(ident("int64"))));
    declare("m", mapType(ident("int"), ident("bool")));
    assertEquals(Types.primitive("int64"),
                 types.inferExprType(index(star(ident("xs")), intLit("0"))));
    assertEquals(Types.primitive("bool"),
                 types.inferExprType(index(ident("m"), intLit("0"))));
    // Conversions
    assertEquals(Types.primitive("uint8"),
                 types.inferExprType(call(ident("uint8"), intLit("3"))));
    assertEquals(Types.pointer(Types.slice(Types.primitive("uint32"))),
        types.inferExprType(call(star(sliceType(ident("uint32"))),
                                 ident("buf"))));
    // clone keeps its argument's type
    assertEquals(Types.pointer(Types.slice(Types.primitive("int64"))),
                 types.inferExprType(call(ident("clone"), ident("xs"))));
    assertTrue(types.isMapType(types.typeOf("m")));
    assertTrue(types.inferExprType(ident("nil")).isUnknown());
  }

  @Test
  public void testHelperResults() {
    MoxieAST concat = call(selector(ident("moxie"), "Concat"),
                           ident("a"), ident("b"));
    assertTrue(Types.isByteString(types.inferExprType(concat)));
    assertTrue(types.isHelperCall(concat, Helper.CONCAT));
    assertFalse(types.isHelperCall(concat, Helper.CONCAT_SLICE));

    MoxieAST coerce = call(index(selector(ident("moxie"), "Coerce"),
                                 ident("byte"), ident("uint16")),
                           ident("buf"));
    assertEquals(Types.pointer(Types.slice(Types.primitive("uint16"))),
                 types.inferExprType(coerce));

    // Another package with the same function name
    MoxieAST other = call(selector(ident("strings"), "Concat"), ident("a"));
    assertTrue(types.inferExprType(other).isUnknown());
  }
}
