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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.cgen.common.Logging;
import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;

/**
 * The underlying type of a {@link Type}, without pointers or
 * qualifiers.  Immutable.
 */
public class BaseType extends CTree
{
  public static enum Kind {
    VOID, DOUBLE, FLOAT, CHAR,
    UINT8, UINT16, UINT32, UINT64,
    INT8, INT16, INT32, INT64,
    SIZE, UINTPTR, BOOL,
    ENUM, STRUCT, UNION, CLASS, TEMPLATE_CLASS, TYPEDEF;
  }

  public static final BaseType VOID = new BaseType(Kind.VOID);
  public static final BaseType DOUBLE = new BaseType(Kind.DOUBLE);
  public static final BaseType FLOAT = new BaseType(Kind.FLOAT);
  public static final BaseType CHAR = new BaseType(Kind.CHAR);
  public static final BaseType UINT8 = new BaseType(Kind.UINT8);
  public static final BaseType UINT16 = new BaseType(Kind.UINT16);
  public static final BaseType UINT32 = new BaseType(Kind.UINT32);
  public static final BaseType UINT64 = new BaseType(Kind.UINT64);
  public static final BaseType INT8 = new BaseType(Kind.INT8);
  public static final BaseType INT16 = new BaseType(Kind.INT16);
  public static final BaseType INT32 = new BaseType(Kind.INT32);
  public static final BaseType INT64 = new BaseType(Kind.INT64);
  public static final BaseType SIZE = new BaseType(Kind.SIZE);
  public static final BaseType UINTPTR = new BaseType(Kind.UINTPTR);
  public static final BaseType BOOL = new BaseType(Kind.BOOL);

  private final Kind kind;

  /** Name of user defined types, null for builtins */
  private final String name;

  private final List<String> templateArgs;

  /** Typedef that names a pointer type, e.g. a handle */
  private final boolean pointerTypedef;

  private BaseType(Kind kind)
  {
    this(kind, null, Collections.<String>emptyList(), false);
  }

  private BaseType(Kind kind, String name, List<String> templateArgs,
                   boolean pointerTypedef)
  {
    this.kind = kind;
    this.name = name;
    this.templateArgs = templateArgs;
    this.pointerTypedef = pointerTypedef;
  }

  public static BaseType enumType(String name)
  {
    return new BaseType(Kind.ENUM, name, Collections.<String>emptyList(),
                        false);
  }

  public static BaseType struct(String name)
  {
    return new BaseType(Kind.STRUCT, name, Collections.<String>emptyList(),
                        false);
  }

  public static BaseType union(String name)
  {
    return new BaseType(Kind.UNION, name, Collections.<String>emptyList(),
                        false);
  }

  public static BaseType classType(String name)
  {
    return new BaseType(Kind.CLASS, name, Collections.<String>emptyList(),
                        false);
  }

  public static BaseType templateClass(String name, List<String> args)
  {
    return new BaseType(Kind.TEMPLATE_CLASS, name,
        Collections.unmodifiableList(new ArrayList<String>(args)), false);
  }

  public static BaseType typedef(String name)
  {
    return new BaseType(Kind.TYPEDEF, name, Collections.<String>emptyList(),
                        false);
  }

  /**
   * A typedef of a pointer type, e.g. <code>FILE_HANDLE</code>
   */
  public static BaseType pointerTypedef(String name)
  {
    return new BaseType(Kind.TYPEDEF, name, Collections.<String>emptyList(),
                        true);
  }

  /**
   * Unsigned integer of given width.  Unsupported widths fall back
   * to 64 bits.
   */
  public static BaseType newUInt(int bits)
  {
    switch (bits) {
      case 8:
        return UINT8;
      case 16:
        return UINT16;
      case 32:
        return UINT32;
      case 64:
        return UINT64;
      default:
        Logging.uniqueWarn("Unsupported unsigned integer width " + bits +
                           ", using uint64_t");
        return UINT64;
    }
  }

  /**
   * Signed integer of given width.  Unsupported widths fall back
   * to 64 bits.
   */
  public static BaseType newInt(int bits)
  {
    switch (bits) {
      case 8:
        return INT8;
      case 16:
        return INT16;
      case 32:
        return INT32;
      case 64:
        return INT64;
      default:
        Logging.uniqueWarn("Unsupported integer width " + bits +
                           ", using int64_t");
        return INT64;
    }
  }

  public Kind getKind()
  {
    return kind;
  }

  public String getName()
  {
    return name;
  }

  public List<String> getTemplateArgs()
  {
    return templateArgs;
  }

  public boolean isPointerTypedef()
  {
    return pointerTypedef;
  }

  public boolean isInteger()
  {
    switch (kind) {
      case UINT8:
      case UINT16:
      case UINT32:
      case UINT64:
      case INT8:
      case INT16:
      case INT32:
      case INT64:
      case SIZE:
      case UINTPTR:
      case BOOL:
      case CHAR:
        return true;
      case TYPEDEF:
        return !pointerTypedef;
      default:
        return false;
    }
  }

  public boolean isStruct()
  {
    switch (kind) {
      case STRUCT:
      case UNION:
      case CLASS:
      case TEMPLATE_CLASS:
      case TYPEDEF:
        return true;
      default:
        return false;
    }
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write(spelling());
  }

  /**
   * @return C spelling of this type
   */
  public String spelling()
  {
    switch (kind) {
      case VOID:
        return "void";
      case DOUBLE:
        return "double";
      case FLOAT:
        return "float";
      case CHAR:
        return "char";
      case UINT8:
        return "uint8_t";
      case UINT16:
        return "uint16_t";
      case UINT32:
        return "uint32_t";
      case UINT64:
        return "uint64_t";
      case INT8:
        return "int8_t";
      case INT16:
        return "int16_t";
      case INT32:
        return "int32_t";
      case INT64:
        return "int64_t";
      case SIZE:
        return "size_t";
      case UINTPTR:
        return "uintptr_t";
      case BOOL:
        return "bool";
      case ENUM:
        return "enum " + name;
      case STRUCT:
        return "struct " + name;
      case UNION:
        return "union " + name;
      case CLASS:
      case TYPEDEF:
        return name;
      case TEMPLATE_CLASS:
        if (templateArgs.isEmpty()) {
          return name;
        }
        return name + "<" + StringUtils.join(templateArgs, ",") + ">";
      default:
        throw new CGenRuntimeError("Unknown base type kind: " + kind);
    }
  }

  @Override
  public int hashCode()
  {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    result = prime * result + templateArgs.hashCode();
    result = prime * result + (pointerTypedef ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    if (!(obj instanceof BaseType))
      return false;
    BaseType other = (BaseType) obj;
    if (kind != other.kind || pointerTypedef != other.pointerTypedef)
      return false;
    if (name == null) {
      if (other.name != null)
        return false;
    } else if (!name.equals(other.name)) {
      return false;
    }
    return templateArgs.equals(other.templateArgs);
  }
}
