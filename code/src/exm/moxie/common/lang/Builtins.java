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

import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;

/**
 * Names of dialect built-in functions and constants the transformer
 * recognises.
 */
public class Builtins {

  public static final String APPEND = "append";
  public static final String CLEAR = "clear";
  public static final String MAKE = "make";
  public static final String LEN = "len";

  // Generic memory built-ins
  public static final String CLONE = "clone";
  public static final String COPY = "copy";
  public static final String GROW = "grow";
  public static final String FREE = "free";

  public static final ImmutableSet<String> MEMORY_BUILTINS =
                            ImmutableSet.of(CLONE, COPY, GROW, FREE);

  // Foreign library loading
  public static final String DLOPEN = "dlopen";
  public static final String DLSYM = "dlsym";
  public static final String DLCLOSE = "dlclose";
  public static final String DLERROR = "dlerror";

  public static final ImmutableSet<String> DL_FUNCTIONS =
                    ImmutableSet.of(DLOPEN, DLSYM, DLCLOSE, DLERROR);

  public static final ImmutableSet<String> DL_FLAGS =
          ImmutableSet.of("RTLD_LAZY", "RTLD_NOW", "RTLD_GLOBAL", "RTLD_LOCAL");

  // Endianness tags for slice coercion
  public static final String NATIVE_ENDIAN = "NativeEndian";
  public static final String LITTLE_ENDIAN = "LittleEndian";
  public static final String BIG_ENDIAN = "BigEndian";

  public static final ImmutableSet<String> ENDIAN_TAGS =
          ImmutableSet.of(NATIVE_ENDIAN, LITTLE_ENDIAN, BIG_ENDIAN);

  /** Markers the preprocessor writes for channel literals */
  public static final String CHAN_MARKER = "__MoxieChan";
  public static final String CHAN_SEND_MARKER = "__MoxieChanSend";
  public static final String CHAN_RECV_MARKER = "__MoxieChanRecv";

  public static final ImmutableSet<String> CHAN_MARKERS =
          ImmutableSet.of(CHAN_MARKER, CHAN_SEND_MARKER, CHAN_RECV_MARKER);

  public static final String STRING = "string";
  public static final String BYTE = "byte";
  public static final String RUNE = "rune";

  /** Comparison helpers live here */
  public static final String BYTES_PACKAGE = "bytes";

  private static final Pattern IDENTIFIER =
                          Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

  public static boolean isIdentifier(String s) {
    return s != null && IDENTIFIER.matcher(s).matches();
  }

  /**
   * @param chanMarker one of the channel literal markers
   * @return channel direction keyword for CHAN_TYPE
   */
  public static String markerDirection(String chanMarker) {
    if (chanMarker.equals(CHAN_SEND_MARKER)) {
      return "chan<-";
    } else if (chanMarker.equals(CHAN_RECV_MARKER)) {
      return "<-chan";
    } else {
      return "chan";
    }
  }
}
