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

import java.nio.ByteOrder;

/**
 * Byte order tags accepted by slice coercions
 */
public enum Endian {
  NATIVE("NativeEndian"),
  LITTLE("LittleEndian"),
  BIG("BigEndian");

  private final String goName;

  private Endian(String goName) {
    this.goName = goName;
  }

  public String goName() {
    return goName;
  }

  public ByteOrder order() {
    switch (this) {
      case LITTLE:
        return ByteOrder.LITTLE_ENDIAN;
      case BIG:
        return ByteOrder.BIG_ENDIAN;
      default:
        return ByteOrder.nativeOrder();
    }
  }

  /**
   * @return null if not a byte order tag
   */
  public static Endian fromGoName(String name) {
    for (Endian e: values()) {
      if (e.goName.equals(name)) {
        return e;
      }
    }
    return null;
  }
}
