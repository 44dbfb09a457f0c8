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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.specfstar.doc.Doc.hardLine;
import static net.hydromatic.specfstar.doc.Doc.line;
import static net.hydromatic.specfstar.doc.Doc.space;
import static net.hydromatic.specfstar.doc.Doc.text;
import static net.hydromatic.specfstar.util.Static.transformEager;

import java.util.List;
import java.util.Map;
import net.hydromatic.specfstar.ast.Ast;
import net.hydromatic.specfstar.ast.Ident;
import net.hydromatic.specfstar.ast.Mutations;
import net.hydromatic.specfstar.doc.Doc;
import net.hydromatic.specfstar.type.PrimitiveType;
import net.hydromatic.specfstar.type.Type;
import net.hydromatic.specfstar.type.TypeDict;

/**
 * Translates the declarations, statements and expressions of a checked
 * program to F* documents.
 *
 * <p>Imperative constructs become functional ones: a statement becomes a
 * "{@code let ... in}" binding; a conditional or a loop rebinds the tuple of
 * the variables it assigns, as recorded in the program's {@link Mutations}.
 */
public class Translator {
  private final Mutations mutations;
  private final DocBuilder docs;
  private final TypeTranslator typeTranslator;
  private final Resolver resolver;

  Translator(TypeDict typeDict, Mutations mutations, int indent) {
    this.mutations = requireNonNull(mutations);
    this.docs = new DocBuilder(indent);
    this.typeTranslator = new TypeTranslator(docs);
    this.resolver = new Resolver(typeDict, typeTranslator);
  }

  /** Creates a translator for a program. */
  public static Translator create(TypeDict typeDict, Mutations mutations,
      Map<Prop, Object> propMap) {
    return new Translator(typeDict, mutations,
        Prop.INDENT.intValue(propMap));
  }

  /**
   * Translates a program. Each declaration is followed by a blank line.
   *
   * @throws CompileException if the program cannot be translated
   */
  public Doc translate(Ast.Program program) {
    return Doc.concat(
        transformEager(program.decls,
            decl -> translate(decl).append(hardLine()).append(hardLine())));
  }

  /** Translates a type. */
  public Doc translate(Type type) {
    return typeTranslator.translate(type);
  }

  /** Translates a pattern. */
  public Doc translate(Ast.Pat pat) {
    switch (pat.op) {
      case ID_PAT:
        return Names.ident(((Ast.IdPat) pat).name);
      case WILDCARD_PAT:
        return text("_");
      case TUPLE_PAT:
        return docs.tuple(transformEager(((Ast.TuplePat) pat).args,
            this::translate));
      default:
        throw new AssertionError("unknown pattern " + pat.op);
    }
  }

  /**
   * Translates an expression.
   *
   * @throws CompileException if the expression contains an integer cast
   */
  public Doc translate(Ast.Exp exp) {
    switch (exp.op) {
      case ID:
        return Names.ident(((Ast.Id) exp).name);

      case UNIT_LITERAL:
      case BOOL_LITERAL:
      case INT_LITERAL:
      case SIZE_LITERAL:
      case STRING_LITERAL:
        return Names.literal((Ast.Literal) exp);

      case TUPLE:
        return docs.tuple(transformEager(((Ast.Tuple) exp).args,
            this::translate));

      case CALL:
        final Ast.Call call = (Ast.Call) exp;
        return resolver.callName(call.prefix, call.name, call.pos)
            .append(args(call.args));

      case METHOD_CALL:
        final Ast.MethodCall methodCall = (Ast.MethodCall) exp;
        return resolver.callName(methodCall.receiverType, methodCall.name,
                methodCall.pos)
            .append(space())
            .append(docs.paren(translate(methodCall.receiver)))
            .append(args(methodCall.args));

      case ARRAY_INDEX:
        final Ast.ArrayIndex arrayIndex = (Ast.ArrayIndex) exp;
        return text("array_index").append(space())
            .append(docs.paren(Names.ident(arrayIndex.array)))
            .append(space())
            .append(docs.paren(translate(arrayIndex.index)));

      case NEW_ARRAY:
        return text("seq_from_list").append(space())
            .append(
                docs.list(transformEager(((Ast.NewArray) exp).args,
                    this::translate)));

      case CAST:
        throw CompileException.unsupported(
            "integer cast is not supported", exp.pos);

      case NOT:
      case NEGATE:
        final Ast.PrefixCall prefixCall = (Ast.PrefixCall) exp;
        return text(resolver.unaryOp(prefixCall.op)).append(space())
            .append(docs.paren(translate(prefixCall.a)))
            .group();

      default:
        if (exp.op.isBinary()) {
          final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
          return docs.paren(translate(infixCall.a0))
              .append(space())
              .append(
                  resolver.binaryOp(infixCall.op, infixCall.type,
                      infixCall.pos))
              .append(space())
              .append(docs.paren(translate(infixCall.a1)))
              .group();
        }
        throw new AssertionError("unknown expression " + exp.op);
    }
  }

  /** Translates the arguments of a call, each preceded by a space. */
  private Doc args(List<Ast.Exp> args) {
    return Doc.concat(
        transformEager(args,
            arg -> space().append(docs.paren(translate(arg)))));
  }

  /**
   * Translates a statement.
   *
   * @throws CompileException if a conditional or loop has no mutated-variable
   *   annotation
   */
  public Doc translate(Ast.Stmt stmt) {
    return translate_(stmt).group();
  }

  private Doc translate_(Ast.Stmt stmt) {
    switch (stmt.op) {
      case LET:
        final Ast.Let let = (Ast.Let) stmt;
        return docs.letBinding(translate(let.pat),
            let.type == null ? null : translate(let.type),
            translate(let.exp), false);

      case REASSIGN:
        final Ast.Reassign reassign = (Ast.Reassign) stmt;
        return docs.letBinding(Names.ident(reassign.name), null,
            translate(reassign.exp), false);

      case ARRAY_UPDATE:
        final Ast.ArrayUpdate update = (Ast.ArrayUpdate) stmt;
        final Doc array = Names.ident(update.array);
        return docs.letBinding(array, null,
            text("array_upd").append(space())
                .append(array)
                .append(space())
                .append(docs.paren(translate(update.index)))
                .append(space())
                .append(docs.paren(translate(update.value))),
            false);

      case RETURN:
        return translate(((Ast.Return) stmt).exp);

      case IF:
        return translateIf((Ast.If) stmt);

      case FOR:
        return translateFor((Ast.For) stmt);

      default:
        throw new AssertionError("unknown statement " + stmt.op);
    }
  }

  /**
   * Translates a conditional. Each branch ends with the tuple of the
   * variables that the conditional assigns; an absent else branch consists
   * of only that tuple.
   */
  private Doc translateIf(Ast.If if_) {
    final Mutations.Mutated mutated = mutations.get(if_.ifTrue);
    final Doc mutatedTuple = mutatedTuple(mutated);
    final Doc mutatedStmt = translate(mutated.stmt);
    final Doc ifFalse = if_.ifFalse == null
        ? mutatedStmt
        : blockThen(if_.ifFalse, mutatedStmt);
    final Doc exp = text("if").append(space())
        .append(translate(if_.condition))
        .append(space())
        .append("then")
        .append(space())
        .append(docs.beginEnd(blockThen(if_.ifTrue, mutatedStmt)))
        .append(space())
        .append("else")
        .append(space())
        .append(docs.beginEnd(ifFalse));
    return docs.letBinding(mutatedTuple, null, exp, false);
  }

  /**
   * Translates a loop to a fold over the range of the index, whose
   * accumulator is the tuple of the variables that the loop assigns.
   */
  private Doc translateFor(Ast.For for_) {
    final Mutations.Mutated mutated = mutations.get(for_.body);
    final Doc mutatedTuple = mutatedTuple(mutated);
    final Doc closureTuple =
        docs.tuple(Names.ident(for_.var), mutatedTuple);
    final Doc loop = text("foldi").append(space())
        .append(docs.paren(translate(for_.lower)))
        .append(space())
        .append(docs.paren(translate(for_.upper)))
        .append(space())
        .append("(fun")
        .append(space())
        .append(closureTuple)
        .append(space())
        .append("->")
        .append(line())
        .append(blockThen(for_.body, translate(mutated.stmt)))
        .append(")")
        .group()
        .nest(docs.indent)
        .append(line())
        .append(mutatedTuple);
    return docs.letBinding(mutatedTuple, null, loop, false);
  }

  private Doc mutatedTuple(Mutations.Mutated mutated) {
    return docs.tuple(transformEager(mutated.vars, Names::ident));
  }

  /** Translates a block followed by a final statement. */
  private Doc blockThen(Ast.Block block, Doc last) {
    if (block.stmts.isEmpty()) {
      return last;
    }
    return translate(block, true).append(hardLine()).append(last);
  }

  /**
   * Translates a block, each statement on its own line.
   *
   * <p>If the block returns unit and {@code omitExtraUnit} is false, the
   * block ends with "{@code ()}".
   */
  public Doc translate(Ast.Block block, boolean omitExtraUnit) {
    final Doc stmts =
        Doc.intersperse(transformEager(block.stmts, this::translate),
            hardLine());
    if (omitExtraUnit || !block.returnType.isUnit()) {
      return stmts;
    }
    return withUnit(block, stmts);
  }

  private static Doc withUnit(Ast.Block block, Doc doc) {
    return block.stmts.isEmpty()
        ? text("()")
        : doc.append(hardLine()).append("()");
  }

  /**
   * Translates a declaration.
   *
   * @throws CompileException if the declaration cannot be translated
   */
  public Doc translate(Ast.Decl decl) {
    switch (decl.op) {
      case FN_DECL:
        return translateFn((Ast.FnDecl) decl);

      case ARRAY_DECL:
        final Ast.ArrayDecl arrayDecl = (Ast.ArrayDecl) decl;
        return typeDecl(arrayDecl.name,
            lseq(translate(arrayDecl.cellType), arrayDecl.size));

      case CONST_DECL:
        final Ast.ConstDecl constDecl = (Ast.ConstDecl) decl;
        return docs.letBinding(Names.ident(constDecl.name),
            translate(constDecl.type), translate(constDecl.exp), true);

      case NAT_DECL:
        final Ast.NatDecl natDecl = (Ast.NatDecl) decl;
        return typeDecl(natDecl.canvasName,
                lseq(translate(PrimitiveType.U8), natDecl.canvasSize))
            .append(hardLine())
            .append(hardLine())
            .append(
                typeDecl(natDecl.name,
                    text("nat_mod").append(space())
                        .append("0x" + natDecl.modulus)));

      default:
        throw new AssertionError("unknown declaration " + decl.op);
    }
  }

  /**
   * Translates a function declaration. A function that returns unit ends
   * with "{@code ()}".
   */
  private Doc translateFn(Ast.FnDecl fnDecl) {
    final Doc params = fnDecl.params.isEmpty()
        ? text("()")
        : Doc.intersperse(
            transformEager(fnDecl.params,
                param -> docs.paren(
                    Names.ident(param.name).append(space()).append(":")
                        .append(space()).append(translate(param.type)))),
            line());
    final Doc head = Names.ident(fnDecl.name)
        .append(line())
        .append(params)
        .append(line())
        .append(
            text(":").append(space()).append(translate(fnDecl.returnType))
                .group());
    Doc body = translate(fnDecl.body, true);
    if (fnDecl.returnType.isUnit()) {
      body = withUnit(fnDecl.body, body);
    }
    return docs.letBinding(head, null, body.group(), true);
  }

  /** Creates a type declaration, "{@code type name = t}". */
  private Doc typeDecl(Ident name, Doc type) {
    return text("type").append(space())
        .append(Names.ident(name))
        .append(space())
        .append("=")
        .group()
        .append(line().append(type).group().nest(docs.indent));
  }

  /** Creates a fixed-length sequence type, "{@code lseq (t) (size)}". */
  private Doc lseq(Doc cellType, Ast.Exp size) {
    return text("lseq").append(space())
        .append(docs.paren(cellType))
        .append(space())
        .append(docs.paren(translate(size)));
  }
}

// End Translator.java
