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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.cgen.tree.CTree;
import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.types.Type;
import exm.cgen.tree.types.Visibility;

/**
 * C++ class.
 *
 * The declaration is the class body with members grouped by
 * visibility.  The definition consists of the out-of-class definitions
 * of all members that have one, with names qualified by the class name.
 */
public class CppClass extends Declaration
{
  /** Order of access sections in the class body */
  private static final Visibility[] SECTIONS = {
    Visibility.PUBLIC, Visibility.PROTECTED, Visibility.PRIVATE
  };

  private final String name;
  private String base = null;
  private Visibility baseVisibility = Visibility.PUBLIC;

  private final List<Constructor> constructors = new ArrayList<Constructor>();
  private Destructor destructor = null;
  private final List<Attribute> attributes = new ArrayList<Attribute>();
  private final List<Method> methods = new ArrayList<Method>();

  public CppClass(String name)
  {
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  public Type toType()
  {
    return Type.newClass(name);
  }

  public CppClass setBase(String base, Visibility visibility)
  {
    this.base = base;
    this.baseVisibility = visibility;
    return this;
  }

  public Constructor newConstructor()
  {
    Constructor c = new Constructor(name);
    constructors.add(c);
    return c;
  }

  public CppClass addConstructor(Constructor c)
  {
    constructors.add(c);
    return this;
  }

  /**
   * Create the destructor, replacing any previous one
   */
  public Destructor newDestructor()
  {
    destructor = new Destructor(name);
    return destructor;
  }

  public Destructor getDestructor()
  {
    return destructor;
  }

  public Attribute newAttribute(String name, Type type)
  {
    Attribute a = new Attribute(name, type);
    attributes.add(a);
    return a;
  }

  public CppClass addAttribute(Attribute a)
  {
    attributes.add(a);
    return this;
  }

  public Method newMethod(String name, Type returnType)
  {
    Method m = new Method(name, returnType);
    methods.add(m);
    return m;
  }

  public CppClass addMethod(Method m)
  {
    methods.add(m);
    return this;
  }

  /**
   * Members in the order they are written: per access section,
   * constructors, destructor, static attributes, other attributes,
   * methods.
   */
  private ListMultimap<Visibility, ClassMember> sections()
  {
    ListMultimap<Visibility, ClassMember> result = ArrayListMultimap.create();
    for (Constructor c: constructors) {
      result.put(c.getVisibility().effective(), c);
    }
    if (destructor != null) {
      result.put(Visibility.PUBLIC, destructor);
    }
    for (Attribute a: attributes) {
      if (a.isStatic()) {
        result.put(a.getVisibility().effective(), a);
      }
    }
    for (Attribute a: attributes) {
      if (!a.isStatic()) {
        result.put(a.getVisibility().effective(), a);
      }
    }
    for (Method m: methods) {
      result.put(m.getVisibility().effective(), m);
    }
    return result;
  }

  private List<ClassMember> orderedMembers()
  {
    ListMultimap<Visibility, ClassMember> sections = sections();
    List<ClassMember> result = new ArrayList<ClassMember>();
    for (Visibility v: SECTIONS) {
      result.addAll(sections.get(v));
    }
    return result;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    if (mode == RenderMode.DECLARATION) {
      return true;
    }
    for (ClassMember m: orderedMembers()) {
      if (m.emits(mode)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The class declaration
   */
  @Override
  public void appendTo(Formatter fmt)
  {
    appendTo(fmt, RenderMode.DECLARATION);
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    if (mode == RenderMode.DECLARATION) {
      appendDeclaration(fmt);
    } else {
      appendDefinition(fmt);
    }
  }

  private void appendDeclaration(Formatter fmt)
  {
    appendDoc(fmt);
    fmt.write("class " + name);
    if (base != null) {
      String vis = baseVisibility.keyword();
      fmt.write(" : " + (vis.isEmpty() ? "" : vis + " ") + base);
    }

    final ListMultimap<Visibility, ClassMember> sections = sections();
    if (sections.isEmpty()) {
      fmt.writeln(" { };");
      return;
    }
    fmt.inlineBlock(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        boolean first = true;
        for (Visibility v: SECTIONS) {
          List<ClassMember> members = sections.get(v);
          if (members.isEmpty()) {
            continue;
          }
          if (!first) {
            fmt.newline();
          }
          first = false;
          fmt.label(v.keyword());
          for (ClassMember m: members) {
            m.appendTo(fmt, RenderMode.DECLARATION);
          }
        }
      }
    });
    fmt.writeln(";");
  }

  private void appendDefinition(Formatter fmt)
  {
    fmt.scope(name, new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        boolean first = true;
        for (ClassMember m: orderedMembers()) {
          if (!m.emits(RenderMode.DEFINITION)) {
            continue;
          }
          if (!first) {
            fmt.newline();
          }
          first = false;
          m.appendTo(fmt, RenderMode.DEFINITION);
        }
      }
    });
  }
}
