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

import java.util.ArrayList;
import java.util.List;

import exm.cgen.tree.Formatter;

/**
 * <code>new Name(a, b)</code>
 */
public class NewObject extends Expression
{
  private final String className;
  private final List<Expression> args;

  public NewObject(String className, List<Expression> args)
  {
    this.className = className;
    this.args = new ArrayList<Expression>(args);
  }

  @Override
  public int pointerDepth()
  {
    return 1;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("new " + className);
    appendArgs(fmt, args);
  }
}
