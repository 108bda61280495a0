package exm.moxie.common.lang;

import static exm.moxie.ast.Trees.ident;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.moxie.ast.MoxieAST;
import exm.moxie.common.exceptions.MoxieRuntimeError;
import exm.moxie.common.lang.RuntimeHelpers.Helper;

public class RuntimeHelpersTest {

  @Test
  public void testVariants() {
    assertEquals(Helper.COPY_SLICE, RuntimeHelpers.sliceVariant("copy"));
    assertEquals(Helper.GROW_MAP, RuntimeHelpers.mapVariant("grow"));
    assertEquals(Helper.DEEP_COPY_INTO, RuntimeHelpers.fallbackVariant("copy"));
    assertEquals(Helper.FREE, RuntimeHelpers.fallbackVariant("free"));
  }

  @Test(expected = MoxieRuntimeError.class)
  public void testNotMemoryBuiltin() {
    RuntimeHelpers.sliceVariant("append");
  }

  @Test
  public void testRefs() {
    MoxieAST plain = RuntimeHelpers.ref("rt", Helper.CONCAT);
    assertEquals("(. rt Concat)", plain.toStringTree());
    MoxieAST inst = RuntimeHelpers.ref("rt", Helper.CLONE_MAP,
                                       ident("string"), ident("int"));
    assertEquals("(index (. rt CloneMap) string int)", inst.toStringTree());
    assertTrue(RuntimeHelpers.isRef(inst, "rt", Helper.CLONE_MAP));
    assertFalse(RuntimeHelpers.isRef(inst, "moxie", Helper.CLONE_MAP));
    assertFalse(RuntimeHelpers.isRef(plain, "rt", Helper.CONCAT_SLICE));
  }

  @Test(expected = MoxieRuntimeError.class)
  public void testTypeArgumentCount() {
    RuntimeHelpers.ref("rt", Helper.CONCAT_SLICE, ident("a"), ident("b"));
  }

  @Test
  public void testGoNames() {
    assertEquals(Helper.DLSYM, Helper.fromGoName("Dlsym"));
    assertNull(Helper.fromGoName("Nope"));
    assertEquals(2, Helper.COERCE.typeParams());
  }

  @Test
  public void testBuiltins() {
    assertEquals("chan<-", Builtins.markerDirection(Builtins.CHAN_SEND_MARKER));
    assertEquals("<-chan", Builtins.markerDirection(Builtins.CHAN_RECV_MARKER));
    assertEquals("chan", Builtins.markerDirection(Builtins.CHAN_MARKER));
    assertTrue(Builtins.isIdentifier("moxie_rt2"));
    assertFalse(Builtins.isIdentifier("2rt"));
    assertFalse(Builtins.isIdentifier(null));
  }
}
