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

package exm.cgen.tree.types;

/**
 * Access specifier of a class member or base class
 */
public enum Visibility
{
  PUBLIC("public"),
  PROTECTED("protected"),
  PRIVATE("private"),
  /** No specifier: private for class members */
  DEFAULT("");

  private final String keyword;

  private Visibility(String keyword)
  {
    this.keyword = keyword;
  }

  public String keyword()
  {
    return keyword;
  }

  /**
   * @return the visibility a class member actually gets
   */
  public Visibility effective()
  {
    return this == DEFAULT ? PRIVATE : this;
  }
}
