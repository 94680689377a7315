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

import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.types.Visibility;

/**
 * Something declared in a class body: a constructor, destructor,
 * method or attribute.
 *
 * In declaration mode members are written as they appear in the class
 * body.  In definition mode they are written as out-of-class
 * definitions with qualified names, if they have one.
 */
public abstract class ClassMember extends Declaration
{
  protected Visibility visibility;

  protected ClassMember(Visibility visibility)
  {
    this.visibility = visibility;
  }

  public Visibility getVisibility()
  {
    return visibility;
  }

  public ClassMember setVisibility(Visibility visibility)
  {
    this.visibility = visibility;
    return this;
  }

  public boolean isPublic()
  {
    return visibility == Visibility.PUBLIC;
  }

  public boolean isProtected()
  {
    return visibility == Visibility.PROTECTED;
  }

  public boolean isPrivate()
  {
    return visibility.effective() == Visibility.PRIVATE;
  }

  /**
   * @param withBody if false, stop at the prototype
   */
  protected abstract void format(Formatter fmt, RenderMode mode,
                                 boolean withBody);

  /**
   * @return true if the body is written inside the class body
   */
  protected abstract boolean bodyInDeclaration();

  /**
   * The member as it would appear in a class body, with body
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
    boolean withBody = mode == RenderMode.DEFINITION || bodyInDeclaration();
    format(fmt, mode, withBody);
  }

  protected void appendDoc(Formatter fmt, RenderMode mode)
  {
    if (mode == RenderMode.DECLARATION) {
      appendDoc(fmt);
    }
  }
}
