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
package exm.moxie.ast;

/**
 * Position of a construct in a source file.  Line is 1-based,
 * column 0-based as reported by the tree.
 */
public class FilePosition {
  public final String file;
  public final int line;
  public final int col;

  public FilePosition(String file, int line, int col) {
    super();
    this.file = file;
    this.line = line;
    this.col = col;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + col;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    FilePosition other = (FilePosition) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file))
      return false;
    return line == other.line && col == other.col;
  }

  /**
   * @return E.g. "file.mx:42:7", with a 1-based column
   */
  @Override
  public String toString() {
    return file + ":" + line + ":" + (col + 1);
  }
}
