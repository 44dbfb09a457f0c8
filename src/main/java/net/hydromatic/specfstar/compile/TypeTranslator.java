/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.specfstar.compile;

import static net.hydromatic.specfstar.doc.Doc.space;
import static net.hydromatic.specfstar.doc.Doc.text;
import static net.hydromatic.specfstar.util.Static.transformEager;

import net.hydromatic.specfstar.doc.Doc;
import net.hydromatic.specfstar.type.ArrayType;
import net.hydromatic.specfstar.type.NamedType;
import net.hydromatic.specfstar.type.NatModType;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.SeqType;
import net.hydromatic.specfstar.type.TupleType;
import net.hydromatic.specfstar.type.Type;
import net.hydromatic.specfstar.type.TypeVar;
import net.hydromatic.specfstar.type.TypeVisitor;

/**
 * Translates a type to F*.
 *
 * <p>Named types are translated by name; the translation does not look in
 * the type dictionary.
 */
public class TypeTranslator extends TypeVisitor<Doc> {
  private final DocBuilder docs;

  TypeTranslator(DocBuilder docs) {
    this.docs = docs;
  }

  /** Creates a type translator that indents tuple types by a given amount. */
  public static TypeTranslator create(int indent) {
    return new TypeTranslator(new DocBuilder(indent));
  }

  /** Translates a type. */
  public Doc translate(Type type) {
    return type.accept(this);
  }

  /** Returns the name of a primitive type in F*. */
  public static String primitiveName(PrimitiveType type) {
    switch (type) {
      case UNIT:
        return "unit";
      case BOOL:
        return "bool";
      case USIZE:
        return "uint_size";
      case ISIZE:
        return "int_size";
      case STR:
        return "string";
      default:
        // u8 is "pub_uint8", i128 is "pub_int128"
        return (type.signed ? "pub_int" : "pub_uint") + type.width;
    }
  }

  @Override public Doc visit(PrimitiveType primitiveType) {
    return text(primitiveName(primitiveType));
  }

  @Override public Doc visit(SeqType seqType) {
    return text("seq").append(space()).append(translate(seqType.elementType))
        .group();
  }

  @Override public Doc visit(ArrayType arrayType) {
    return text("lseq").append(space())
        .append(translate(arrayType.elementType))
        .append(space())
        .append(size(arrayType.size))
        .group();
  }

  /** Translates the length of an array type. */
  static Doc size(ArrayType.ArraySize size) {
    return size.constant != null
        ? Names.ident(size.constant)
        : text(Integer.toString(size.value));
  }

  @Override public Doc visit(TupleType tupleType) {
    return docs.typeTuple(transformEager(tupleType.argTypes, this::translate));
  }

  @Override public Doc visit(NamedType namedType) {
    final Doc name = Names.ident(namedType.name);
    if (namedType.args == null) {
      return name;
    }
    return name.append(space())
        .append(
            Doc.intersperse(transformEager(namedType.args, this::translate),
                space()));
  }

  @Override public Doc visit(TypeVar typeVar) {
    return text("'t" + typeVar.id);
  }

  @Override public Doc visit(NatModType natModType) {
    return text("nat_mod").append(space())
        .append("0x" + natModType.modulus);
  }
}

// End TypeTranslator.java
