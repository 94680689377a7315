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

import org.apache.commons.lang3.StringUtils;

import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.types.Type;

/**
 * Free function.
 * <pre>
 * [extern |static ][inline ]R name(params)[ __attribute__((a, b))] {
 *     body
 * }
 * </pre>
 * Inline and extern functions have no separate definition.
 */
public class Function extends Declaration
{
  private final String name;
  private final Type returnType;
  private final List<FunctionParam> params = new ArrayList<FunctionParam>();
  private final List<String> attributes = new ArrayList<String>();
  private Block body = new Block();

  private boolean isStatic = false;
  private boolean isInline = false;
  private boolean isExtern = false;

  public Function(String name, Type returnType)
  {
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

  public FunctionParam newParam(String name, Type type)
  {
    FunctionParam param = new FunctionParam(name, type);
    params.add(param);
    return param;
  }

  public Function addParam(FunctionParam param)
  {
    params.add(param);
    return this;
  }

  public List<FunctionParam> getParams()
  {
    return params;
  }

  /**
   * @return parameter with given name, or null if none
   */
  public FunctionParam getParam(String name)
  {
    for (FunctionParam param: params) {
      if (param.getName().equals(name)) {
        return param;
      }
    }
    return null;
  }

  /**
   * Add a GCC attribute, e.g. <code>noreturn</code>
   */
  public Function addAttribute(String attr)
  {
    attributes.add(attr);
    return this;
  }

  public Block body()
  {
    return body;
  }

  /**
   * A function with a body cannot be extern
   */
  public Function setBody(Block body)
  {
    this.body = body;
    this.isExtern = false;
    return this;
  }

  public Function setStatic(boolean val)
  {
    this.isStatic = val;
    if (val) {
      this.isExtern = false;
    }
    return this;
  }

  public Function setInline(boolean val)
  {
    this.isInline = val;
    if (val) {
      this.isExtern = false;
    }
    return this;
  }

  public Function setExtern(boolean val)
  {
    this.isExtern = val;
    if (val) {
      this.isStatic = false;
      this.isInline = false;
    }
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

  public boolean isExtern()
  {
    return isExtern;
  }

  /**
   * Prototype of this function without the body
   */
  public Function toDeclaration()
  {
    Function result = new Function(name, returnType);
    result.doc = doc;
    result.params.addAll(params);
    result.attributes.addAll(attributes);
    result.isStatic = isStatic;
    result.isInline = isInline;
    result.isExtern = isExtern;
    return result;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    if (mode == RenderMode.DEFINITION) {
      return !isInline && !isExtern && !body.isEmpty();
    }
    return true;
  }

  /**
   * Full function, with body if there is one
   */
  @Override
  public void appendTo(Formatter fmt)
  {
    format(fmt, RenderMode.DECLARATION, true);
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    if (!emits(mode)) {
      return;
    }
    format(fmt, mode, mode == RenderMode.DEFINITION || isInline);
  }

  private void format(Formatter fmt, RenderMode mode, boolean withBody)
  {
    appendDoc(fmt);
    if (isExtern) {
      fmt.write("extern ");
    }
    if (isStatic) {
      fmt.write("static ");
    }
    if (isInline) {
      fmt.write("inline ");
    }
    returnType.appendTo(fmt);
    fmt.write(" " + name);
    FunctionParam.appendParams(fmt, params);
    if (!attributes.isEmpty()) {
      fmt.write(" __attribute__((" + StringUtils.join(attributes, ", ") +
                "))");
    }
    if (withBody && !body.isEmpty()) {
      fmt.block(body);
    } else {
      fmt.writeln(";");
    }
  }
}
