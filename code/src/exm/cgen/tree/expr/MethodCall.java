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
 * <code>recv.method(a, b)</code>, or <code>recv-&gt;method(a, b)</code>
 * for a pointer receiver
 */
public class MethodCall extends Expression
{
  private final Expression receiver;
  private final String method;
  private final List<Expression> args;

  /** Whether the call returns a pointer */
  private boolean pointer = false;

  public MethodCall(Expression receiver, String method,
                    List<Expression> args)
  {
    this.receiver = receiver;
    this.method = method;
    this.args = new ArrayList<Expression>(args);
  }

  public MethodCall setPointer(boolean pointer)
  {
    this.pointer = pointer;
    return this;
  }

  @Override
  public int pointerDepth()
  {
    return pointer ? 1 : 0;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    receiver.appendTo(fmt);
    fmt.write(receiver.isPointer() ? "->" : ".");
    fmt.write(method);
    appendArgs(fmt, args);
  }
}
