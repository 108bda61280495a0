package exm.moxie.frontend.tree;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.Trees;
import exm.moxie.common.exceptions.InvalidSyntaxException;

public class LiteralsTest {

  private static final FilePosition POS = new FilePosition("lit.mx", 1, 0);

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static byte[] decode(String text) throws InvalidSyntaxException {
    return Literals.decodeStringLiteral(POS, text);
  }

  private static byte[] bytes(int ...values) {
    byte[] result = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = (byte)values[i];
    }
    return result;
  }

  @Test
  public void testEscapes() throws InvalidSyntaxException {
    assertArrayEquals(bytes('a', '\t', '"', '\\'), decode("\"a\\t\\\"\\\\\""));
    assertArrayEquals(bytes(0xff, 0x41), decode("\"\\xff\\101\""));
    assertArrayEquals(bytes(0xe2, 0x82, 0xac), decode("\"\\u20ac\""));
    assertArrayEquals(bytes(0xf0, 0x9f, 0x98, 0x80),
                      decode("\"\\U0001F600\""));
    assertArrayEquals(new byte[0], decode("\"\""));
  }

  @Test
  public void testUnicodeEscapeIsUtf8ByteEscapeIsNot()
                                      throws InvalidSyntaxException {
    // Same code point, two encodings
    assertArrayEquals(bytes(0xc3, 0xa9, 0xe9), decode("\"\\u00e9\\xe9\""));
    assertArrayEquals(bytes(0xc3, 0xa9, 0xe9), decode("\"\\u00e9\\351\""));
  }

  @Test
  public void testSourceCharactersAreUtf8() throws InvalidSyntaxException {
    assertArrayEquals("h\u00e9".getBytes(StandardCharsets.UTF_8),
                      decode("\"h\u00e9\""));
  }

  @Test
  public void testRawString() throws InvalidSyntaxException {
    assertTrue(Literals.isRawString("`x`"));
    assertArrayEquals(bytes('a', '\\', 'n', '\n', 'b'),
                      decode("`a\\n\r\nb`"));
  }

  @Test
  public void testUnknownEscape() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("Unknown escape sequence \\q");
    decode("\"\\q\"");
  }

  @Test
  public void testOctalOutOfRange() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    decode("\"\\400\"");
  }

  @Test
  public void testSurrogate() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    decode("\"\\ud800\"");
  }

  @Test
  public void testUnterminated() throws InvalidSyntaxException {
    exception.expect(InvalidSyntaxException.class);
    decode("\"abc");
  }

  @Test
  public void testByteCharLit() {
    assertEquals("'a'", Literals.byteCharLit((byte)'a'));
    assertEquals("'\\n'", Literals.byteCharLit((byte)'\n'));
    assertEquals("'\\''", Literals.byteCharLit((byte)'\''));
    assertEquals("'\\x00'", Literals.byteCharLit((byte)0));
    assertEquals("'\\xc3'", Literals.byteCharLit((byte)0xc3));
  }

  @Test
  public void testIntLiterals() {
    assertEquals(Long.valueOf(0), Literals.extractIntLit(Trees.intLit("0")));
    assertEquals(Long.valueOf(255),
                 Literals.extractIntLit(Trees.intLit("0xFF")));
    assertEquals(Long.valueOf(1000),
                 Literals.extractIntLit(Trees.intLit("1_000")));
    assertEquals(Long.valueOf(8), Literals.extractIntLit(Trees.intLit("010")));
    assertNull(Literals.extractIntLit(Trees.ident("n")));
  }

  @Test
  public void testImportPath() {
    assertEquals("net/http",
        Literals.importPath(Trees.importSpec("net/http", null)));
  }
}
