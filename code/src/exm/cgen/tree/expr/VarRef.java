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

package exm.cgen.tree.expr;

import exm.cgen.tree.Formatter;
import exm.cgen.tree.types.Type;

/**
 * Reference to a named variable, parameter or attribute
 */
public class VarRef extends Expression
{
  private final String name;
  private final Type type;

  public VarRef(String name, Type type)
  {
    this.name = name;
    this.type = new Type(type);
  }

  /**
   * The implicit <code>this</code> pointer of methods
   */
  public static VarRef thisRef()
  {
    return new VarRef("this", Type.newTypedef("auto").pointer());
  }

  public String getName()
  {
    return name;
  }

  public Type getType()
  {
    return new Type(type);
  }

  @Override
  public int pointerDepth()
  {
    return type.pointerDepth();
  }

  @Override
  public boolean isStruct()
  {
    return type.isStruct();
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write(name);
  }
}
