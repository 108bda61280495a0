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
package exm.moxie.frontend.tree;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import exm.moxie.ast.FilePosition;
import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.common.exceptions.InvalidSyntaxException;

public class Literals {

  /**
   * @return true if text is a backquoted raw string
   */
  public static boolean isRawString(String text) {
    return text.length() >= 2 && text.charAt(0) == '`';
  }

  /**
   * Decode a string literal to the bytes the base language would store
   * for it: UTF-8 for source characters and unicode escapes, single
   * bytes for octal and \x escapes.
   * @param pos position for error messages
   * @param text literal as written, including quotes
   * @return decoded bytes
   * @throws InvalidSyntaxException if malformed or has a bad escape
   */
  public static byte[] decodeStringLiteral(FilePosition pos, String text)
      throws InvalidSyntaxException {
    if (text.length() < 2) {
      throw new InvalidSyntaxException(pos, "Invalid string literal: " + text);
    }
    char quote = text.charAt(0);
    if (text.charAt(text.length() - 1) != quote) {
      throw new InvalidSyntaxException(pos, "Unterminated string literal: "
                                            + text);
    }
    String body = text.substring(1, text.length() - 1);
    if (quote == '`') {
      // Raw strings: verbatim, except carriage returns are discarded
      return body.replace("\r", "").getBytes(StandardCharsets.UTF_8);
    } else if (quote != '"') {
      throw new InvalidSyntaxException(pos, "Invalid string literal: " + text);
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '\n') {
        throw new InvalidSyntaxException(pos, "Newline in string literal");
      } else if (c != '\\') {
        int cp = body.codePointAt(i);
        writeUtf8(out, cp);
        i += Character.charCount(cp);
        continue;
      }

      if (i + 1 >= body.length()) {
        throw new InvalidSyntaxException(pos,
            "Escape sequence not terminated in string literal " + text);
      }
      char esc = body.charAt(i + 1);
      i += 2;
      switch (esc) {
        case 'a': out.write(0x07); break;
        case 'b': out.write(0x08); break;
        case 'f': out.write(0x0c); break;
        case 'n': out.write(0x0a); break;
        case 'r': out.write(0x0d); break;
        case 't': out.write(0x09); break;
        case 'v': out.write(0x0b); break;
        case '\\': out.write('\\'); break;
        case '"': out.write('"'); break;
        case '0': case '1': case '2': case '3':
        case '4': case '5': case '6': case '7': {
          // Exactly three octal digits, first one already consumed
          int value = parseDigits(pos, text, body, i - 1, 3, 8);
          if (value > 255) {
            throw new InvalidSyntaxException(pos,
                "Octal escape value > 255 in string literal " + text);
          }
          out.write(value);
          i += 2;
          break;
        }
        case 'x':
          out.write(parseDigits(pos, text, body, i, 2, 16));
          i += 2;
          break;
        case 'u':
        case 'U': {
          int len = esc == 'u' ? 4 : 8;
          int cp = parseDigits(pos, text, body, i, len, 16);
          if (cp < 0 || cp > Character.MAX_CODE_POINT ||
              (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            throw new InvalidSyntaxException(pos,
                "Escape sequence is invalid Unicode code point in " +
                "string literal " + text);
          }
          writeUtf8(out, cp);
          i += len;
          break;
        }
        default:
          throw new InvalidSyntaxException(pos, "Unknown escape sequence \\"
                                           + esc + " in string literal " + text);
      }
    }
    return out.toByteArray();
  }

  private static int parseDigits(FilePosition pos, String text, String body,
      int start, int count, int radix) throws InvalidSyntaxException {
    if (start + count > body.length()) {
      throw new InvalidSyntaxException(pos,
          "Escape sequence too short in string literal " + text);
    }
    long value = 0;
    for (int i = start; i < start + count; i++) {
      int digit = Character.digit(body.charAt(i), radix);
      if (digit < 0) {
        throw new InvalidSyntaxException(pos, "Invalid character '" +
            body.charAt(i) + "' in escape sequence in string literal " + text);
      }
      value = value * radix + digit;
    }
    if (value > Integer.MAX_VALUE) {
      return -1;
    }
    return (int)value;
  }

  private static void writeUtf8(ByteArrayOutputStream out, int codePoint) {
    byte[] bytes = new String(Character.toChars(codePoint))
                                .getBytes(StandardCharsets.UTF_8);
    out.write(bytes, 0, bytes.length);
  }

  /**
   * Text of a character literal for a single byte, e.g. 'a' or '\xff'
   */
  public static String byteCharLit(byte b) {
    int v = b & 0xff;
    switch (v) {
      case '\n': return "'\\n'";
      case '\t': return "'\\t'";
      case '\r': return "'\\r'";
      case '\\': return "'\\\\'";
      case '\'': return "'\\''";
      default:
        if (v >= 0x20 && v < 0x7f) {
          return "'" + (char)v + "'";
        }
        return String.format("'\\x%02x'", v);
    }
  }

  /**
   * Value of an integer literal node
   * @return null if not an integer literal or can't be parsed
   */
  public static Long extractIntLit(MoxieAST tree) {
    if (tree.getType() != MoxieTokens.INT_LIT) {
      return null;
    }
    String text = tree.getText().replace("_", "").toLowerCase();
    try {
      if (text.startsWith("0x")) {
        return Long.parseLong(text.substring(2), 16);
      } else if (text.startsWith("0b")) {
        return Long.parseLong(text.substring(2), 2);
      } else if (text.startsWith("0o")) {
        return Long.parseLong(text.substring(2), 8);
      } else if (text.length() > 1 && text.startsWith("0")) {
        return Long.parseLong(text.substring(1), 8);
      } else {
        return Long.parseLong(text);
      }
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Unquote an import path
   */
  public static String importPath(MoxieAST importSpec) {
    String text = importSpec.getText();
    if (text.length() >= 2 &&
        (text.charAt(0) == '"' || text.charAt(0) == '`')) {
      return text.substring(1, text.length() - 1);
    }
    return text;
  }
}
