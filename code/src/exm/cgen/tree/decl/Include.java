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

/**
 * <code>#include &lt;path&gt;</code> or <code>#include "path"</code>
 */
public class Include extends Declaration
{
  private final String path;
  private final boolean system;
  private String comment = null;

  public Include(String path)
  {
    this(path, false);
  }

  /**
   * @param system if true, search the system include path
   */
  public Include(String path, boolean system)
  {
    this.path = path;
    this.system = system;
  }

  public static Include system(String path)
  {
    return new Include(path, true);
  }

  /**
   * @param comment written after the directive
   */
  public Include setComment(String comment)
  {
    this.comment = comment;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendDoc(fmt);
    if (system) {
      fmt.write("#include <" + path + ">");
    } else {
      fmt.write("#include \"" + path + "\"");
    }
    if (comment != null) {
      fmt.write("  // " + comment);
    }
    fmt.newline();
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt);
  }
}
