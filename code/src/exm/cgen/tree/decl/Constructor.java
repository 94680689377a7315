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

import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.expr.FunctionCall;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.types.Type;
import exm.cgen.tree.types.Visibility;

/**
 * Class constructor.
 * <pre>
 * Foo::Foo(int32_t x)
 *     : parent(x), count(0)
 * {
 *     body
 * }
 * </pre>
 * Defaulted and deleted constructors only have a declaration.
 */
public class Constructor extends ClassMember
{
  private final String className;
  private final List<MethodParam> params = new ArrayList<MethodParam>();
  private final List<Expression> initializers = new ArrayList<Expression>();
  private Block body = new Block();

  private boolean isDefault = false;
  private boolean isDelete = false;
  private boolean isCopy = false;
  private boolean isMove = false;
  private boolean isInside = false;

  public Constructor(String className)
  {
    super(Visibility.PUBLIC);
    this.className = className;
  }

  /** <code>Foo(const Foo &amp; other)</code> */
  public static Constructor newCopy(String className)
  {
    return new Constructor(className).setCopy(true);
  }

  /** <code>Foo(Foo &amp;&amp; other)</code> */
  public static Constructor newMove(String className)
  {
    return new Constructor(className).setMove(true);
  }

  public String getClassName()
  {
    return className;
  }

  public Constructor addParam(MethodParam param)
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

  /**
   * Initialize a field: <code>field(value)</code>
   */
  public Constructor pushInitializer(String field, Expression value)
  {
    List<Expression> args = new ArrayList<Expression>();
    args.add(value);
    initializers.add(new FunctionCall(field, args));
    return this;
  }

  /**
   * Call a parent constructor, e.g. <code>Base(x)</code>
   */
  public Constructor pushParentInitializer(Expression call)
  {
    initializers.add(call);
    return this;
  }

  public Block body()
  {
    return body;
  }

  public Constructor setBody(Block body)
  {
    this.body = body;
    return this;
  }

  /**
   * <code>= default;</code>.  Drops the body, and the parameters
   * unless this is a copy or move constructor.
   */
  public Constructor setDefault(boolean val)
  {
    this.isDefault = val;
    if (val) {
      this.isDelete = false;
      dropImplementation();
    }
    return this;
  }

  /**
   * <code>= delete;</code>.  Drops the body, and the parameters
   * unless this is a copy or move constructor.
   */
  public Constructor setDelete(boolean val)
  {
    this.isDelete = val;
    if (val) {
      this.isDefault = false;
      dropImplementation();
    }
    return this;
  }

  private void dropImplementation()
  {
    body.clear();
    initializers.clear();
    if (!isCopy && !isMove) {
      params.clear();
    }
  }

  public Constructor setCopy(boolean val)
  {
    this.isCopy = val;
    if (val) {
      this.isMove = false;
      params.clear();
      params.add(new MethodParam("other",
          Type.newClass(className).setValueConst(true).reference()));
    }
    return this;
  }

  public Constructor setMove(boolean val)
  {
    this.isMove = val;
    if (val) {
      this.isCopy = false;
      params.clear();
      params.add(new MethodParam("other",
          Type.newClass(className).reference().reference()));
    }
    return this;
  }

  public Constructor setInside(boolean val)
  {
    this.isInside = val;
    return this;
  }

  public boolean isDefault()
  {
    return isDefault;
  }

  public boolean isDelete()
  {
    return isDelete;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    if (mode == RenderMode.DEFINITION) {
      return !isDefault && !isDelete && !isInside;
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
    fmt.write(decl ? className : fmt.scopedName(className));
    MethodParam.appendParams(fmt, params, mode);

    if (isDefault) {
      fmt.writeln(" = default;");
      return;
    } else if (isDelete) {
      fmt.writeln(" = delete;");
      return;
    } else if (!withBody) {
      fmt.writeln(";");
      return;
    }

    if (!initializers.isEmpty()) {
      fmt.newline();
      fmt.indent(new CTree() {
        @Override
        public void appendTo(Formatter fmt) {
          fmt.write(": ");
          fmt.writeList(initializers, ", ");
          fmt.newline();
        }
      });
    }
    fmt.block(body);
  }
}
