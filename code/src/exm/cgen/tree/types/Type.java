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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;

/**
 * A C/C++ type: a base type with value qualifiers and a list of
 * modifiers, e.g. <code>const int32_t * const *</code>.
 *
 * The modifier methods ({@link #pointer()}, {@link #constant()} etc)
 * change this type and return it for chaining.  The <code>to*</code>
 * methods return a modified copy.
 */
public class Type extends CTree
{
  public static final int MAX_POINTERS = 32;

  private final BaseType base;
  private final List<TypeModifier> mods;
  private int pointerCount;
  private boolean valueConst;
  private boolean valueVolatile;

  public Type(BaseType base)
  {
    this.base = base;
    this.mods = new ArrayList<TypeModifier>();
    this.pointerCount = 0;
    this.valueConst = false;
    this.valueVolatile = false;
  }

  /** Copy constructor */
  public Type(Type other)
  {
    this.base = other.base;
    this.mods = new ArrayList<TypeModifier>(other.mods);
    this.pointerCount = other.pointerCount;
    this.valueConst = other.valueConst;
    this.valueVolatile = other.valueVolatile;
  }

  public static Type newVoid()
  {
    return new Type(BaseType.VOID);
  }

  public static Type newBool()
  {
    return new Type(BaseType.BOOL);
  }

  public static Type newChar()
  {
    return new Type(BaseType.CHAR);
  }

  public static Type newDouble()
  {
    return new Type(BaseType.DOUBLE);
  }

  public static Type newFloat()
  {
    return new Type(BaseType.FLOAT);
  }

  public static Type newInt(int bits)
  {
    return new Type(BaseType.newInt(bits));
  }

  public static Type newInt8()
  {
    return new Type(BaseType.INT8);
  }

  public static Type newInt16()
  {
    return new Type(BaseType.INT16);
  }

  public static Type newInt32()
  {
    return new Type(BaseType.INT32);
  }

  public static Type newInt64()
  {
    return new Type(BaseType.INT64);
  }

  public static Type newUInt(int bits)
  {
    return new Type(BaseType.newUInt(bits));
  }

  public static Type newUInt8()
  {
    return new Type(BaseType.UINT8);
  }

  public static Type newUInt16()
  {
    return new Type(BaseType.UINT16);
  }

  public static Type newUInt32()
  {
    return new Type(BaseType.UINT32);
  }

  public static Type newUInt64()
  {
    return new Type(BaseType.UINT64);
  }

  public static Type newSize()
  {
    return new Type(BaseType.SIZE);
  }

  public static Type newUIntPtr()
  {
    return new Type(BaseType.UINTPTR);
  }

  /** <code>std::string</code> */
  public static Type newStdString()
  {
    return new Type(BaseType.classType("std::string"));
  }

  /** <code>char *</code> */
  public static Type newCStr()
  {
    return newChar().pointer();
  }

  public static Type newEnum(String name)
  {
    return new Type(BaseType.enumType(name));
  }

  public static Type newStruct(String name)
  {
    return new Type(BaseType.struct(name));
  }

  public static Type newUnion(String name)
  {
    return new Type(BaseType.union(name));
  }

  public static Type newClass(String name)
  {
    return new Type(BaseType.classType(name));
  }

  public static Type newTemplateClass(String name, String... args)
  {
    return new Type(BaseType.templateClass(name, Arrays.asList(args)));
  }

  public static Type newTypedef(String name)
  {
    return new Type(BaseType.typedef(name));
  }

  public static Type newTypedefPtr(String name)
  {
    return new Type(BaseType.pointerTypedef(name));
  }

  public BaseType getBase()
  {
    return base;
  }

  /**
   * @return read-only view of the modifiers, in writing order
   */
  public List<TypeModifier> getModifiers()
  {
    return Collections.unmodifiableList(mods);
  }

  public int pointerCount()
  {
    return pointerCount;
  }

  public boolean isValueConst()
  {
    return valueConst;
  }

  public boolean isValueVolatile()
  {
    return valueVolatile;
  }

  /**
   * Qualify the value as const, e.g. <code>const int *</code>.
   * Clears value volatile when set.
   */
  public Type setValueConst(boolean val)
  {
    this.valueConst = val;
    if (val) {
      this.valueVolatile = false;
    }
    return this;
  }

  /**
   * Qualify the value as volatile, e.g. <code>volatile int *</code>.
   * Clears value const when set.
   */
  public Type setValueVolatile(boolean val)
  {
    this.valueVolatile = val;
    if (val) {
      this.valueConst = false;
    }
    return this;
  }

  /** <code>int</code> =&gt; <code>int *</code> */
  public Type pointer()
  {
    if (pointerCount >= MAX_POINTERS) {
      throw new CGenRuntimeError("Type " + this + " exceeds " + MAX_POINTERS +
                                 " levels of pointers");
    }
    mods.add(TypeModifier.PTR);
    pointerCount++;
    return this;
  }

  /**
   * <code>int</code> =&gt; <code>int &amp;</code>.
   * A reference directly after another one is written without a space,
   * so applying this twice gives the rvalue reference
   * <code>int &amp;&amp;</code> rather than <code>int &amp; &amp;</code>.
   */
  public Type reference()
  {
    mods.add(TypeModifier.REF);
    return this;
  }

  /** <code>int *</code> =&gt; <code>int * const</code> */
  public Type constant()
  {
    mods.add(TypeModifier.CONST);
    return this;
  }

  /** <code>int *</code> =&gt; <code>int * volatile</code> */
  public Type volatileModifier()
  {
    mods.add(TypeModifier.VOLATILE);
    return this;
  }

  public Type toPointer()
  {
    return new Type(this).pointer();
  }

  public Type toReference()
  {
    return new Type(this).reference();
  }

  public Type toConst()
  {
    return new Type(this).constant();
  }

  public Type toVolatile()
  {
    return new Type(this).volatileModifier();
  }

  /**
   * Type of the value this pointer type points to:
   * <code>int * const *</code> =&gt; <code>int * const</code>
   * @return null if not a pointer
   */
  public Type dereference()
  {
    if (pointerCount == 0) {
      return null;
    }
    Type result = new Type(base);
    result.valueConst = valueConst;
    result.valueVolatile = valueVolatile;
    for (TypeModifier m: mods) {
      if (m == TypeModifier.PTR) {
        if (result.pointerCount == pointerCount - 1) {
          break;
        }
        result.pointerCount++;
      }
      result.mods.add(m);
    }
    return result;
  }

  /**
   * Integer value, not a pointer to one
   */
  public boolean isInteger()
  {
    return pointerCount == 0 && base.isInteger();
  }

  public boolean isPointer()
  {
    return pointerCount > 0 || base.isPointerTypedef();
  }

  /**
   * @return levels of indirection, counting a pointer typedef as one
   */
  public int pointerDepth()
  {
    if (pointerCount == 0 && base.isPointerTypedef()) {
      return 1;
    }
    return pointerCount;
  }

  public boolean isStruct()
  {
    return base.isStruct();
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    if (valueVolatile) {
      fmt.write("volatile ");
    } else if (valueConst) {
      fmt.write("const ");
    }
    base.appendTo(fmt);
    TypeModifier prev = null;
    for (TypeModifier m: mods) {
      if (m == TypeModifier.REF && prev == TypeModifier.REF) {
        // rvalue reference: T &&
        fmt.write("&");
      } else {
        fmt.write(m.text());
      }
      prev = m;
    }
  }

  @Override
  public int hashCode()
  {
    final int prime = 31;
    int result = base.hashCode();
    result = prime * result + mods.hashCode();
    result = prime * result + (valueConst ? 1231 : 1237);
    result = prime * result + (valueVolatile ? 1231 : 1237);
    return result;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
      return true;
    if (!(obj instanceof Type))
      return false;
    Type other = (Type) obj;
    return base.equals(other.base) && mods.equals(other.mods) &&
           valueConst == other.valueConst &&
           valueVolatile == other.valueVolatile;
  }
}
