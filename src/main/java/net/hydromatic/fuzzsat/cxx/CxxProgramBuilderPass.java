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
package net.hydromatic.fuzzsat.cxx;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.fuzzsat.ast.RoundingMode;
import net.hydromatic.fuzzsat.ast.Sort;
import net.hydromatic.fuzzsat.ast.Term;
import net.hydromatic.fuzzsat.core.Context;
import net.hydromatic.fuzzsat.core.FatalErrorException;
import net.hydromatic.fuzzsat.core.Query;
import net.hydromatic.fuzzsat.fuzz.BufferAssignment;
import net.hydromatic.fuzzsat.fuzz.FuzzingAnalysisInfo;
import net.hydromatic.fuzzsat.transform.QueryPass;
import net.hydromatic.fuzzsat.util.NameGenerator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates a C++ fuzz target that traps if and only if its input encodes
 * an assignment that satisfies every constraint of a query.
 *
 * <p>The program first decodes each free variable from the input buffer,
 * at the offset given by the {@link BufferAssignment}. Then it evaluates
 * each distinct node of the constraints once, in post-order, into a
 * {@code const} temporary, and finally traps if every constraint holds.
 *
 * <p>A node that has no translation raises a fatal error; the sort check
 * that runs before this pass should make that impossible.
 */
public class CxxProgramBuilderPass extends QueryPass {
  private final FuzzingAnalysisInfo info;
  private final NameGenerator names = new NameGenerator("fz_t");
  private final Map<Term, CxxProgram.Expr> memo = new IdentityHashMap<>();
  private final Map<Term.Variable, String> variableNames =
      new IdentityHashMap<>();
  private final List<CxxProgram.Stmt> statements = new ArrayList<>();
  private @Nullable Context context;
  private @Nullable CxxProgram program;
  private int loweredNodeCount;

  public CxxProgramBuilderPass(FuzzingAnalysisInfo info) {
    this.info = requireNonNull(info, "info");
  }

  @Override
  public String getName() {
    return "CxxProgramBuilderPass";
  }

  @Override
  public boolean run(Query query) {
    final Context context = query.getContext();
    this.context = context;
    final int maxLength = info.maxLength();
    if (maxLength > 0) {
      statements.add(
          new CxxProgram.If(
              new CxxProgram.Binary("<", new CxxProgram.Ref("size"),
                  literal(maxLength)),
              ImmutableList.of(new CxxProgram.Return(literal(0)))));
    }

    final BufferAssignment assignment = info.bufferAssignment;
    if (!assignment.variables.isEmpty()) {
      statements.add(new CxxProgram.Comment("free variables"));
    }
    for (Term.Variable variable : assignment.variables) {
      if (isCancelled()) {
        return false;
      }
      declareVariable(assignment, variable);
    }

    final List<CxxProgram.Expr> conditions = new ArrayList<>();
    final ImmutableList<Term> constraints = query.constraints();
    if (!constraints.isEmpty()) {
      statements.add(new CxxProgram.Comment("constraints"));
    }
    for (Term constraint : constraints) {
      if (!lower(constraint)) {
        return false;
      }
      conditions.add(requireNonNull(memo.get(constraint)));
    }

    CxxProgram.Expr guard = null;
    for (CxxProgram.Expr condition : conditions) {
      guard = guard == null
          ? condition
          : new CxxProgram.Binary("&&", guard, condition);
    }
    statements.add(
        new CxxProgram.If(guard == null ? new CxxProgram.Literal("true")
            : guard,
            ImmutableList.of(
                new CxxProgram.ExprStmt(
                    new CxxProgram.Call("__builtin_trap",
                        ImmutableList.of())))));
    statements.add(new CxxProgram.Return(literal(0)));

    final CxxProgram program =
        new CxxProgram(CxxRuntime.INCLUDES, CxxRuntime.prelude(), statements);
    this.program = program;
    context.tracer.onProgram(program);
    context.debug("(CxxProgramBuilderPass lowered " + loweredNodeCount
        + " node(s))");
    return true;
  }

  /** Returns the generated program; only valid after a successful run. */
  public CxxProgram getProgram() {
    checkState(program != null, "pass has not run");
    return requireNonNull(program);
  }

  /** Returns the number of distinct nodes lowered. */
  public int getLoweredNodeCount() {
    return loweredNodeCount;
  }

  private void declareVariable(BufferAssignment assignment,
      Term.Variable variable) {
    final String name = names.unique("var_", variable.name);
    variableNames.put(variable, name);
    final String type = cxxType(variable, variable.sort);
    final Term.Literal fixed = assignment.fixedValue(variable);
    final CxxProgram.Expr init;
    if (fixed != null) {
      init = lowerLiteral(fixed);
    } else {
      final BufferAssignment.BufferElement element =
          requireNonNull(assignment.elementFor(variable), variable.name);
      init = decode(variable, element);
    }
    statements.add(new CxxProgram.VarDecl(type, name, init));
  }

  private CxxProgram.Expr decode(Term.Variable variable,
      BufferAssignment.BufferElement element) {
    final CxxProgram.Expr bits =
        call("fz_read_bits", new CxxProgram.Ref("data"),
            literal(element.bitOffset), literal(element.getBitWidth()));
    final Sort sort = variable.sort;
    switch (sort.kind) {
      case BOOL:
        return new CxxProgram.Binary("!=", bits, literal(0));
      case BIT_VECTOR:
        return bits;
      case FLOATING_POINT:
        return call(
            isFloat32(sort) ? "fz_bits_to_float" : "fz_bits_to_double", bits);
      default:
        throw unsupported(variable);
    }
  }

  /** Lowers every node reachable from {@code root}, children first. */
  private boolean lower(Term root) {
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      if (isCancelled()) {
        return false;
      }
      final Term node = stack.peek();
      if (memo.containsKey(node)) {
        stack.pop();
        continue;
      }
      boolean ready = true;
      for (int i = node.getNumKids() - 1; i >= 0; i--) {
        final Term kid = node.getKid(i);
        if (!memo.containsKey(kid)) {
          stack.push(kid);
          ready = false;
        }
      }
      if (ready) {
        stack.pop();
        memo.put(node, lowerNode(node));
        ++loweredNodeCount;
      }
    }
    return true;
  }

  private CxxProgram.Expr lowerNode(Term node) {
    if (node instanceof Term.Literal) {
      return lowerLiteral((Term.Literal) node);
    }
    if (node instanceof Term.Variable) {
      final String name = variableNames.get(node);
      if (name == null) {
        throw unsupported(node);
      }
      return new CxxProgram.Ref(name);
    }
    final Term.Apply apply = node.asApp();
    final List<CxxProgram.Expr> args = new ArrayList<>();
    for (Term arg : apply.args) {
      args.add(requireNonNull(memo.get(arg)));
    }
    final String type = cxxType(apply, apply.sort);
    final String name = names.get();
    statements.add(new CxxProgram.VarDecl(type, name, lowerApply(apply, args)));
    return new CxxProgram.Ref(name);
  }

  private CxxProgram.Expr lowerLiteral(Term.Literal literal) {
    switch (literal.op) {
      case TRUE:
        return new CxxProgram.Literal("true");
      case FALSE:
        return new CxxProgram.Literal("false");
      case BV_LITERAL:
        cxxType(literal, literal.sort);
        return hex(literal);
      case FP_LITERAL:
        cxxType(literal, literal.sort);
        return call(isFloat32(literal.sort)
            ? "fz_bits_to_float" : "fz_bits_to_double", hex(literal));
      case RM_LITERAL:
        final RoundingMode roundingMode = literal.roundingModeValue();
        if (roundingMode.fenvName == null) {
          throw unsupported(literal);
        }
        return new CxxProgram.Ref(roundingMode.fenvName);
      default:
        throw unsupported(literal);
    }
  }

  private CxxProgram.Expr lowerApply(Term.Apply apply,
      List<CxxProgram.Expr> args) {
    final CxxProgram.Expr a = args.get(0);
    final CxxProgram.Expr b = args.size() > 1 ? args.get(1) : a;
    final Sort argSort = apply.getKid(0).sort;
    switch (apply.op) {
      // core theory
      case NOT:
        return new CxxProgram.Unary("!", a);
      case AND:
        return fold("&&", args);
      case OR:
        return fold("||", args);
      case XOR:
        return fold("!=", args);
      case IMPLIES:
        {
          // right-associative
          CxxProgram.Expr e = args.get(args.size() - 1);
          for (int i = args.size() - 2; i >= 0; i--) {
            e = new CxxProgram.Binary("||",
                new CxxProgram.Unary("!", args.get(i)), e);
          }
          return e;
        }
      case ITE:
        return new CxxProgram.Ternary(a, b, args.get(2));
      case EQ:
        {
          final List<CxxProgram.Expr> pairs = new ArrayList<>();
          for (int i = 0; i + 1 < args.size(); i++) {
            pairs.add(same(argSort, args.get(i), args.get(i + 1)));
          }
          return fold("&&", pairs);
        }
      case DISTINCT:
        {
          final List<CxxProgram.Expr> pairs = new ArrayList<>();
          for (int i = 0; i < args.size(); i++) {
            for (int j = i + 1; j < args.size(); j++) {
              pairs.add(
                  new CxxProgram.Unary("!",
                      same(argSort, args.get(i), args.get(j))));
            }
          }
          return fold("&&", pairs);
        }

      // bit-vectors
      case BV_NOT:
        return mask(new CxxProgram.Unary("~", a), apply);
      case BV_NEG:
        return call("fz_neg", a, width(apply));
      case BV_AND:
        return new CxxProgram.Binary("&", a, b);
      case BV_OR:
        return new CxxProgram.Binary("|", a, b);
      case BV_XOR:
        return new CxxProgram.Binary("^", a, b);
      case BV_ADD:
        return mask(new CxxProgram.Binary("+", a, b), apply);
      case BV_SUB:
        return mask(new CxxProgram.Binary("-", a, b), apply);
      case BV_MUL:
        return mask(new CxxProgram.Binary("*", a, b), apply);
      case BV_UDIV:
        return call("fz_udiv", a, b, width(apply));
      case BV_UREM:
        return call("fz_urem", a, b, width(apply));
      case BV_SDIV:
        return call("fz_sdiv", a, b, width(apply));
      case BV_SREM:
        return call("fz_srem", a, b, width(apply));
      case BV_SHL:
        return call("fz_shl", a, b, width(apply));
      case BV_LSHR:
        return call("fz_lshr", a, b, width(apply));
      case BV_ASHR:
        return call("fz_ashr", a, b, width(apply));
      case BV_ULT:
        return new CxxProgram.Binary("<", a, b);
      case BV_ULE:
        return new CxxProgram.Binary("<=", a, b);
      case BV_UGT:
        return new CxxProgram.Binary(">", a, b);
      case BV_UGE:
        return new CxxProgram.Binary(">=", a, b);
      case BV_SLT:
        return signed("<", apply, a, b);
      case BV_SLE:
        return signed("<=", apply, a, b);
      case BV_SGT:
        return signed(">", apply, a, b);
      case BV_SGE:
        return signed(">=", apply, a, b);
      case CONCAT:
        return new CxxProgram.Binary("|",
            new CxxProgram.Binary("<<", a,
                literal(apply.getKid(1).sort.getBitVectorWidth())),
            b);
      case EXTRACT:
        return mask(
            new CxxProgram.Binary(">>", a, literal(apply.param(1))), apply);
      case ZERO_EXTEND:
        return a;
      case SIGN_EXTEND:
        return mask(
            new CxxProgram.Cast("uint64_t",
                call("fz_sext", a, literal(argSort.getBitVectorWidth()))),
            apply);

      // floating point
      case FP_ADD:
        return call(fpFunction("fz_fadd", apply), a, b, args.get(2));
      case FP_SUB:
        return call(fpFunction("fz_fsub", apply), a, b, args.get(2));
      case FP_MUL:
        return call(fpFunction("fz_fmul", apply), a, b, args.get(2));
      case FP_DIV:
        return call(fpFunction("fz_fdiv", apply), a, b, args.get(2));
      case FP_NEG:
        return new CxxProgram.Unary("-", a);
      case FP_ABS:
        return call("std::fabs", a);
      case FP_EQ:
        return new CxxProgram.Binary("==", a, b);
      case FP_LT:
        return new CxxProgram.Binary("<", a, b);
      case FP_LEQ:
        return new CxxProgram.Binary("<=", a, b);
      case FP_IS_NAN:
        return call("std::isnan", a);
      case TO_FP:
        return lowerToFp(apply, a, b);

      default:
        throw unsupported(apply);
    }
  }

  private CxxProgram.Expr lowerToFp(Term.Apply apply, CxxProgram.Expr rm,
      CxxProgram.Expr operand) {
    final Sort source = apply.getKid(1).sort;
    final boolean toFloat32 = isFloat32(apply.sort);
    if (source.isBitVector()) {
      return call(toFloat32 ? "fz_sbv_to_f32" : "fz_sbv_to_f64", rm,
          call("fz_sext", operand, literal(source.getBitVectorWidth())));
    }
    cxxType(apply.getKid(1), source);
    if (source.equals(apply.sort)) {
      return operand;
    }
    return call(toFloat32 ? "fz_f64_to_f32" : "fz_f32_to_f64", rm, operand);
  }

  /** Returns the C++ type that holds values of a sort, or raises a fatal
   * error. */
  private String cxxType(Term term, Sort sort) {
    switch (sort.kind) {
      case BOOL:
        return "bool";
      case BIT_VECTOR:
        if (sort.getBitVectorWidth() <= 64) {
          return "uint64_t";
        }
        break;
      case FLOATING_POINT:
        if (sort.equals(Sort.float32())) {
          return "float";
        }
        if (sort.equals(Sort.float64())) {
          return "double";
        }
        break;
      default:
        break;
    }
    throw unsupported(term);
  }

  private FatalErrorException unsupported(Term term) {
    throw requireNonNull(context).raiseFatalError(
        "unsupported construct reached code generation: " + term);
  }

  private static boolean isFloat32(Sort sort) {
    return sort.equals(Sort.float32());
  }

  /** Returns an expression that is true if two values are the same
   * value of {@code sort}. */
  private static CxxProgram.Expr same(Sort sort, CxxProgram.Expr a,
      CxxProgram.Expr b) {
    if (sort.isFloatingPoint()) {
      return call(isFloat32(sort) ? "fz_fsame32" : "fz_fsame64", a, b);
    }
    return new CxxProgram.Binary("==", a, b);
  }

  private static CxxProgram.Expr signed(String op, Term.Apply apply,
      CxxProgram.Expr a, CxxProgram.Expr b) {
    final CxxProgram.Expr w =
        literal(apply.getKid(0).sort.getBitVectorWidth());
    return new CxxProgram.Binary(op, call("fz_sext", a, w),
        call("fz_sext", b, w));
  }

  private static String fpFunction(String prefix, Term.Apply apply) {
    return prefix + (isFloat32(apply.sort) ? "32" : "64");
  }

  private static CxxProgram.Expr fold(String op,
      List<CxxProgram.Expr> args) {
    if (args.isEmpty()) {
      return new CxxProgram.Literal("true");
    }
    CxxProgram.Expr e = args.get(0);
    for (int i = 1; i < args.size(); i++) {
      e = new CxxProgram.Binary(op, e, args.get(i));
    }
    return e;
  }

  private static CxxProgram.Expr mask(CxxProgram.Expr e, Term.Apply apply) {
    return call("fz_mask", e, width(apply));
  }

  private static CxxProgram.Expr width(Term term) {
    return literal(term.sort.getBitVectorWidth());
  }

  private static CxxProgram.Expr hex(Term.Literal literal) {
    return new CxxProgram.Literal(
        "UINT64_C(0x" + literal.bitsValue().toString(16) + ")");
  }

  private static CxxProgram.Expr literal(int i) {
    return new CxxProgram.Literal(Integer.toString(i));
  }

  private static CxxProgram.Expr call(String function,
      CxxProgram.Expr... args) {
    return new CxxProgram.Call(function, ImmutableList.copyOf(args));
  }
}

// End CxxProgramBuilderPass.java
