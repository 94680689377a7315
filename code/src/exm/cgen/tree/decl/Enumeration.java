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
import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.types.Type;

/**
 * <pre>
 * enum Name {
 *     A = 1,
 *     B
 * };
 * </pre>
 * Declaration mode writes the forward declaration.
 */
public class Enumeration extends Declaration
{
  private final String name;
  private final List<Variant> variants = new ArrayList<Variant>();

  public Enumeration(String name)
  {
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  public Type toType()
  {
    return Type.newEnum(name);
  }

  public Variant newVariant(String name)
  {
    Variant variant = new Variant(name);
    variants.add(variant);
    return variant;
  }

  public Enumeration addVariant(Variant variant)
  {
    variants.add(variant);
    return this;
  }

  public List<Variant> getVariants()
  {
    return variants;
  }

  /**
   * @return variant with given name, or null if none
   */
  public Variant getVariant(String name)
  {
    for (Variant variant: variants) {
      if (variant.getName().equals(name)) {
        return variant;
      }
    }
    return null;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendDoc(fmt);
    fmt.write("enum " + name);
    if (!variants.isEmpty()) {
      fmt.inlineBlock(new CTree() {
        @Override
        public void appendTo(Formatter fmt) {
          fmt.writeList(variants, ",\n");
          fmt.newline();
        }
      });
    }
    fmt.writeln(";");
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    if (mode == RenderMode.DECLARATION) {
      fmt.writeln("enum " + name + ";");
    } else {
      appendTo(fmt);
    }
  }

  @Override
  public void appendInScope(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt);
  }

  @Override
  public boolean emitsInScope(RenderMode mode)
  {
    return true;
  }
}
