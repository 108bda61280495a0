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
package exm.moxie.runtime;

/**
 * Fixed size element types that slices can be coerced between
 */
public enum ElemType {
  INT8("int8", 1, true),
  UINT8("uint8", 1, false),
  INT16("int16", 2, true),
  UINT16("uint16", 2, false),
  INT32("int32", 4, true),
  UINT32("uint32", 4, false),
  INT64("int64", 8, true),
  UINT64("uint64", 8, false),
  FLOAT32("float32", 4, true),
  FLOAT64("float64", 8, true);

  private final String goName;
  private final int size;
  private final boolean signed;

  private ElemType(String goName, int size, boolean signed) {
    this.goName = goName;
    this.size = size;
    this.signed = signed;
  }

  public String goName() {
    return goName;
  }

  /**
   * @return size in bytes
   */
  public int size() {
    return size;
  }

  public boolean isSigned() {
    return signed;
  }

  public boolean isFloat() {
    return this == FLOAT32 || this == FLOAT64;
  }

  /**
   * @param name type name, including the aliases byte and rune
   * @return null if not a fixed size numeric type
   */
  public static ElemType fromGoName(String name) {
    if (name.equals("byte")) {
      return UINT8;
    } else if (name.equals("rune")) {
      return INT32;
    }
    for (ElemType t: values()) {
      if (t.goName.equals(name)) {
        return t;
      }
    }
    return null;
  }
}
