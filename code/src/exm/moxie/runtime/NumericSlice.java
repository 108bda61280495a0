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

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A slice of fixed size numbers stored in a byte buffer.  Several slices
 * can view the same storage with different element types and byte
 * orders; writes through one are visible through the others.
 */
public class NumericSlice {
  private final ByteBuffer storage;
  private final ElemType elemType;
  private final Endian endian;
  private final int length;

  NumericSlice(ByteBuffer storage, ElemType elemType, Endian endian,
               int length) {
    this.storage = storage;
    this.elemType = elemType;
    this.endian = endian;
    this.length = length;
    storage.order(endian.order());
  }

  /**
   * View bytes as a []byte, without copying
   */
  public static NumericSlice wrap(byte[] bytes) {
    return new NumericSlice(ByteBuffer.wrap(bytes), ElemType.UINT8,
                            Endian.NATIVE, bytes.length);
  }

  /**
   * @return zeroed slice with native byte order
   */
  public static NumericSlice allocate(ElemType elemType, int length) {
    ByteBuffer buf = ByteBuffer.allocate(length * elemType.size());
    return new NumericSlice(buf, elemType, Endian.NATIVE, length);
  }

  public ElemType elemType() {
    return elemType;
  }

  public Endian endian() {
    return endian;
  }

  public int length() {
    return length;
  }

  /**
   * @return number of bytes the elements occupy
   */
  public int byteLength() {
    return length * elemType.size();
  }

  /**
   * Same storage viewed with another element type and byte order
   */
  NumericSlice view(ElemType newType, Endian newEndian, int newLength) {
    return new NumericSlice(storage.duplicate(), newType, newEndian,
                            newLength);
  }

  public boolean sharesStorageWith(NumericSlice other) {
    return storage.array() == other.storage.array();
  }

  /**
   * Element value as a long; unsigned 64 bit values wrap around
   */
  public long getLong(int i) {
    int off = offset(i);
    switch (elemType) {
      case INT8:
        return storage.get(off);
      case UINT8:
        return storage.get(off) & 0xffL;
      case INT16:
        return storage.getShort(off);
      case UINT16:
        return storage.getShort(off) & 0xffffL;
      case INT32:
        return storage.getInt(off);
      case UINT32:
        return storage.getInt(off) & 0xffffffffL;
      case INT64:
      case UINT64:
        return storage.getLong(off);
      case FLOAT32:
        return (long)storage.getFloat(off);
      case FLOAT64:
        return (long)storage.getDouble(off);
      default:
        throw new IllegalStateException("Unknown element type " + elemType);
    }
  }

  public double getDouble(int i) {
    int off = offset(i);
    switch (elemType) {
      case FLOAT32:
        return storage.getFloat(off);
      case FLOAT64:
        return storage.getDouble(off);
      default:
        return getLong(i);
    }
  }

  /**
   * Store the value, truncated to the element size
   */
  public void setLong(int i, long value) {
    int off = offset(i);
    switch (elemType.size()) {
      case 1:
        storage.put(off, (byte)value);
        break;
      case 2:
        storage.putShort(off, (short)value);
        break;
      case 4:
        if (elemType == ElemType.FLOAT32) {
          storage.putFloat(off, value);
        } else {
          storage.putInt(off, (int)value);
        }
        break;
      default:
        if (elemType == ElemType.FLOAT64) {
          storage.putDouble(off, value);
        } else {
          storage.putLong(off, value);
        }
        break;
    }
  }

  public void setDouble(int i, double value) {
    int off = offset(i);
    if (elemType == ElemType.FLOAT32) {
      storage.putFloat(off, (float)value);
    } else if (elemType == ElemType.FLOAT64) {
      storage.putDouble(off, value);
    } else {
      setLong(i, (long)value);
    }
  }

  /**
   * @return copy of the bytes the elements occupy
   */
  public byte[] toByteArray() {
    return Arrays.copyOf(storage.array(), byteLength());
  }

  private int offset(int i) {
    if (i < 0 || i >= length) {
      throw new IndexOutOfBoundsException("index " + i + " out of range "
                                          + "for length " + length);
    }
    return i * elemType.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("[]").append(elemType.goName()).append("{");
    for (int i = 0; i < length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      if (elemType.isFloat()) {
        sb.append(getDouble(i));
      } else if (elemType == ElemType.UINT64) {
        sb.append(Long.toUnsignedString(getLong(i)));
      } else {
        sb.append(getLong(i));
      }
    }
    return sb.append("}").toString();
  }
}
