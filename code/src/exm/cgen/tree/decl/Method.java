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

import java.util.ArrayList;
import java.util.List;

import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.types.Type;
import exm.cgen.tree.types.Visibility;

/**
 * Class method.
 *
 * Declaration: <code>[static ][inline ][virtual ]R name(params)[ const][ override];</code>
 * or <code>... = 0;</code> if pure.
 *
 * Definition: <code>R Class::name(params)[ const] { body }</code>,
 * only for non-inline methods with a body.
 */
public class Method extends ClassMember
{
  private final String name;
  private final Type returnType;
  private final List<MethodParam> params = new ArrayList<MethodParam>();
  private Block body = new Block();

  private boolean isStatic = false;
  private boolean isInline = false;
  private boolean isVirtual = false;
  private boolean isPure = false;
  private boolean isOverride = false;
  private boolean isConst = false;
  private boolean isInside = false;

  public Method(String name, Type returnType)
  {
    super(Visibility.PRIVATE);
    this.name = name;
    this.returnType = new Type(returnType);
  }

  public String getName()
  {
    return name;
  }

  public Type getReturnType()
  {
    return new Type(returnType);
  }

  public Method addParam(MethodParam param)
  {
    params.add(param);
    return this;
  }

  public MethodParam newParam(String name, Type type)
  {
    MethodParam param = new MethodParam(name, type);
    params.add(param);
    return param;
  }

  public List<MethodParam> getParams()
  {
    return params;
  }

  public Block body()
  {
    return body;
  }

  public Method setBody(Block body)
  {
    this.body = body;
    return this;
  }

  public Method setStatic(boolean val)
  {
    this.isStatic = val;
    return this;
  }

  public Method setInline(boolean val)
  {
    this.isInline = val;
    return this;
  }

  /**
   * Clearing virtual also clears pure
   */
  public Method setVirtual(boolean val)
  {
    this.isVirtual = val;
    if (!val) {
      this.isPure = false;
    }
    return this;
  }

  /**
   * A pure method is virtual and has no body.  Statements added later
   * are kept but not written while the method is pure.
   */
  public Method setPure(boolean val)
  {
    this.isPure = val;
    if (val) {
      this.isVirtual = true;
      body.clear();
    }
    return this;
  }

  public Method setOverride(boolean val)
  {
    this.isOverride = val;
    return this;
  }

  public Method setConst(boolean val)
  {
    this.isConst = val;
    return this;
  }

  /**
   * @param val if true, the body is defined in the class body
   */
  public Method setInside(boolean val)
  {
    this.isInside = val;
    return this;
  }

  public boolean isStatic()
  {
    return isStatic;
  }

  public boolean isInline()
  {
    return isInline;
  }

  public boolean isVirtual()
  {
    return isVirtual;
  }

  public boolean isPure()
  {
    return isPure;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    if (mode == RenderMode.DEFINITION) {
      return !isInline && !isInside && !isPure && !body.isEmpty();
    }
    return true;
  }

  @Override
  protected boolean bodyInDeclaration()
  {
    return isInline || isInside;
  }

  @Override
  protected void format(Formatter fmt, RenderMode mode, boolean withBody)
  {
    boolean decl = mode == RenderMode.DECLARATION;
    appendDoc(fmt, mode);
    if (decl) {
      if (isStatic) {
        fmt.write("static ");
      }
      if (isInline) {
        fmt.write("inline ");
      }
      if (isVirtual || isPure) {
        fmt.write("virtual ");
      }
    }
    returnType.appendTo(fmt);
    fmt.write(" " + (decl ? name : fmt.scopedName(name)));
    MethodParam.appendParams(fmt, params, mode);
    if (isConst) {
      fmt.write(" const");
    }
    if (decl && isOverride) {
      fmt.write(" override");
    }

    if (isPure) {
      fmt.writeln(" = 0;");
    } else if (withBody && !body.isEmpty()) {
      fmt.block(body);
    } else {
      fmt.writeln(";");
    }
  }
}
