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

/**
 * <code>(recv).field</code>, or <code>(recv)-&gt;field</code> for a
 * pointer receiver
 */
public class FieldAccess extends Expression
{
  private final Expression receiver;
  private final String field;

  /** Whether the field holds a pointer */
  private boolean pointer = false;

  public FieldAccess(Expression receiver, String field)
  {
    this.receiver = receiver;
    this.field = field;
  }

  public FieldAccess setPointer(boolean pointer)
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
    fmt.write("(");
    receiver.appendTo(fmt);
    fmt.write(receiver.isPointer() ? ")->" : ").");
    fmt.write(field);
  }
}
