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
 * Model of the runtime's zero-copy slice coercion, Coerce[S, U].
 * The result views the source's storage:
 * <ul>
 * <li>its length is floor(len(src) * sizeof(S) / sizeof(U))</li>
 * <li>no bytes are copied or moved</li>
 * </ul>
 * Elements are read in the requested byte order, so coercing back with
 * the same tag gives the original bytes.
 */
public class Coercion {

  public static NumericSlice coerce(NumericSlice src, ElemType to) {
    return coerce(src, to, Endian.NATIVE);
  }

  /**
   * @param src source slice, may be null
   * @return null if src is null
   */
  public static NumericSlice coerce(NumericSlice src, ElemType to,
                                    Endian endian) {
    if (src == null) {
      return null;
    }
    return src.view(to, endian, resultLength(src.length(),
                                             src.elemType(), to));
  }

  public static int resultLength(int srcLength, ElemType from, ElemType to) {
    long bytes = (long)srcLength * from.size();
    return (int)(bytes / to.size());
  }
}
