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

package exm.cgen.tree;

/**
 * An entity that can appear at file scope or in a class body and that
 * renders differently in a header than in an implementation file.
 */
public abstract class Declaration extends CTree
{
  protected Doc doc = null;

  /**
   * Write the form of this entity for the given mode.  May write
   * nothing, see {@link #emits(RenderMode)}.
   */
  public abstract void appendTo(Formatter fmt, RenderMode mode);

  /**
   * @return false if {@link #appendTo(Formatter, RenderMode)} writes
   *         nothing in this mode
   */
  public boolean emits(RenderMode mode)
  {
    return true;
  }

  /**
   * Write this entity as a member of a scope.  Type definitions
   * override this to always render in full.
   */
  public void appendInScope(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt, mode);
  }

  public boolean emitsInScope(RenderMode mode)
  {
    return emits(mode);
  }

  public String render(RenderMode mode)
  {
    Formatter fmt = new Formatter();
    appendTo(fmt, mode);
    return fmt.toString();
  }

  public String declaration()
  {
    return render(RenderMode.DECLARATION);
  }

  public String definition()
  {
    return render(RenderMode.DEFINITION);
  }

  public Doc getDoc()
  {
    return doc;
  }

  public void setDoc(Doc doc)
  {
    this.doc = doc;
  }

  /**
   * Add text to the documentation comment, wrapping long lines
   */
  public void pushDoc(String text)
  {
    if (doc == null) {
      doc = new Doc();
    }
    doc.addText(text);
  }

  protected void appendDoc(Formatter fmt)
  {
    if (doc != null) {
      doc.appendTo(fmt);
    }
  }
}
