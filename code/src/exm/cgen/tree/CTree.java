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

package exm.cgen.tree;

/**
 * Base class for all nodes of a C/C++ syntax tree.
 * Nodes are rendered by writing themselves to a shared
 * {@link Formatter}, which keeps track of indentation.
 */
public abstract class CTree
{
  /**
   * Write this node, including any terminator and newline it owns
   * @param fmt
   */
  public abstract void appendTo(Formatter fmt);

  @Override
  public String toString()
  {
    Formatter fmt = new Formatter();
    appendTo(fmt);
    return fmt.toString();
  }
}
