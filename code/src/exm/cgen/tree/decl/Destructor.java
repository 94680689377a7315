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

package exm.cgen.tree.decl;

import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.types.Visibility;

/**
 * Class destructor, always public:
 * <code>[virtual ]~Foo(void)</code>
 */
public class Destructor extends ClassMember
{
  private final String className;
  private Block body = new Block();

  private boolean isVirtual = false;
  private boolean isPure = false;
  private boolean isDefault = false;
  private boolean isDelete = false;
  private boolean isInside = false;

  public Destructor(String className)
  {
    super(Visibility.PUBLIC);
    this.className = className;
  }

  public Block body()
  {
    return body;
  }

  public Destructor setBody(Block body)
  {
    this.body = body;
    return this;
  }

  public Destructor setVirtual(boolean val)
  {
    this.isVirtual = val;
    if (!val) {
      this.isPure = false;
    }
    return this;
  }

  /**
   * <code>virtual ~Foo(void) = 0;</code>.  Drops the body;
   * statements added later are not written while pure.
   */
  public Destructor setPure(boolean val)
  {
    this.isPure = val;
    if (val) {
      this.isVirtual = true;
      this.isDefault = false;
      this.isDelete = false;
      body.clear();
    }
    return this;
  }

  public Destructor setDefault(boolean val)
  {
    this.isDefault = val;
    if (val) {
      this.isPure = false;
      this.isDelete = false;
      body.clear();
    }
    return this;
  }

  public Destructor setDelete(boolean val)
  {
    this.isDelete = val;
    if (val) {
      this.isPure = false;
      this.isDefault = false;
      body.clear();
    }
    return this;
  }

  public Destructor setInside(boolean val)
  {
    this.isInside = val;
    return this;
  }

  public boolean isVirtual()
  {
    return isVirtual;
  }

  public boolean isPure()
  {
    return isPure;
  }

  /**
   * Destructors are always public
   */
  @Override
  public ClassMember setVisibility(Visibility visibility)
  {
    return this;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    if (mode == RenderMode.DEFINITION) {
      return !isPure && !isDefault && !isDelete && !isInside;
    }
    return true;
  }

  @Override
  protected boolean bodyInDeclaration()
  {
    return isInside;
  }

  @Override
  protected void format(Formatter fmt, RenderMode mode, boolean withBody)
  {
    boolean decl = mode == RenderMode.DECLARATION;
    appendDoc(fmt, mode);
    if (decl && (isVirtual || isPure)) {
      fmt.write("virtual ");
    }
    String name = "~" + className;
    fmt.write(decl ? name : fmt.scopedName(name));
    fmt.write("(void)");

    if (isPure) {
      fmt.writeln(" = 0;");
    } else if (isDefault) {
      fmt.writeln(" = default;");
    } else if (isDelete) {
      fmt.writeln(" = delete;");
    } else if (withBody) {
      fmt.block(body);
    } else {
      fmt.writeln(";");
    }
  }
}
