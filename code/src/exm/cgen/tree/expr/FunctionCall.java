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
 * <code>name(a, b)</code>
 */
public class FunctionCall extends Expression
{
  private final String name;
  private final List<Expression> args;

  public FunctionCall(String name, List<Expression> args)
  {
    this.name = name;
    this.args = new ArrayList<Expression>(args);
  }

  public String getName()
  {
    return name;
  }

  public List<Expression> getArgs()
  {
    return args;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write(name);
    appendArgs(fmt, args);
  }
}
