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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;

/**
 * C++ translation unit that defines a libFuzzer entry point. Immutable.
 *
 * <p>The unit consists of {@code #include} lines, a verbatim prelude of
 * helper functions, and the body of {@code LLVMFuzzerTestOneInput}.
 */
public class CxxProgram {
  /** Signature of the entry point that libFuzzer calls. */
  public static final String ENTRY_POINT =
      "extern \"C\" int LLVMFuzzerTestOneInput(const uint8_t* data, "
          + "size_t size)";

  public final ImmutableList<String> includes;
  public final String prelude;
  public final ImmutableList<Stmt> body;

  public CxxProgram(List<String> includes, String prelude, List<Stmt> body) {
    this.includes = ImmutableList.copyOf(includes);
    this.prelude = requireNonNull(prelude, "prelude");
    this.body = ImmutableList.copyOf(body);
  }

  /** Writes the source text of this program. */
  public void print(Appendable out) throws IOException {
    out.append(toString());
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (String include : includes) {
      b.append("#include <").append(include).append(">\n");
    }
    b.append('\n').append(prelude);
    if (!prelude.endsWith("\n")) {
      b.append('\n');
    }
    b.append('\n').append(ENTRY_POINT).append(" {\n");
    for (Stmt stmt : body) {
      stmt.unparse(b, 1);
    }
    b.append("}\n");
    return b.toString();
  }

  // statements

  /** Statement. */
  public abstract static class Stmt {
    abstract void unparse(StringBuilder b, int depth);

    static StringBuilder indent(StringBuilder b, int depth) {
      return b.append(Strings.repeat("  ", depth));
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      unparse(b, 0);
      return b.toString();
    }
  }

  /** Declaration of a local variable, {@code const T name = init;}. */
  public static class VarDecl extends Stmt {
    public final String type;
    public final String name;
    public final Expr init;

    public VarDecl(String type, String name, Expr init) {
      this.type = requireNonNull(type, "type");
      this.name = requireNonNull(name, "name");
      this.init = requireNonNull(init, "init");
    }

    @Override
    void unparse(StringBuilder b, int depth) {
      indent(b, depth).append("const ").append(type).append(' ')
          .append(name).append(" = ");
      init.unparse(b);
      b.append(";\n");
    }
  }

  /** {@code if} statement with no {@code else}. */
  public static class If extends Stmt {
    public final Expr condition;
    public final ImmutableList<Stmt> body;

    public If(Expr condition, List<Stmt> body) {
      this.condition = requireNonNull(condition, "condition");
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    void unparse(StringBuilder b, int depth) {
      indent(b, depth).append("if (");
      condition.unparse(b);
      b.append(") {\n");
      for (Stmt stmt : body) {
        stmt.unparse(b, depth + 1);
      }
      indent(b, depth).append("}\n");
    }
  }

  /** {@code return} statement. */
  public static class Return extends Stmt {
    public final Expr value;

    public Return(Expr value) {
      this.value = requireNonNull(value, "value");
    }

    @Override
    void unparse(StringBuilder b, int depth) {
      indent(b, depth).append("return ");
      value.unparse(b);
      b.append(";\n");
    }
  }

  /** Single-line comment. */
  public static class Comment extends Stmt {
    public final String text;

    public Comment(String text) {
      checkArgument(text.indexOf('\n') < 0, "multi-line comment");
      this.text = text;
    }

    @Override
    void unparse(StringBuilder b, int depth) {
      indent(b, depth).append("// ").append(text).append('\n');
    }
  }

  /** Expression evaluated for its side effect. */
  public static class ExprStmt extends Stmt {
    public final Expr expr;

    public ExprStmt(Expr expr) {
      this.expr = requireNonNull(expr, "expr");
    }

    @Override
    void unparse(StringBuilder b, int depth) {
      indent(b, depth);
      expr.unparse(b);
      b.append(";\n");
    }
  }

  // expressions

  /** Expression. Compound expressions are printed fully parenthesized. */
  public abstract static class Expr {
    abstract void unparse(StringBuilder b);

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      unparse(b);
      return b.toString();
    }
  }

  /** Reference to a variable, or a named constant such as
   * {@code FE_UPWARD}. */
  public static class Ref extends Expr {
    public final String name;

    public Ref(String name) {
      this.name = requireNonNull(name, "name");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append(name);
    }
  }

  /** Literal, printed verbatim. */
  public static class Literal extends Expr {
    public final String text;

    public Literal(String text) {
      this.text = requireNonNull(text, "text");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append(text);
    }
  }

  /** Function call. */
  public static class Call extends Expr {
    public final String function;
    public final ImmutableList<Expr> args;

    public Call(String function, List<Expr> args) {
      this.function = requireNonNull(function, "function");
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    void unparse(StringBuilder b) {
      b.append(function).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        args.get(i).unparse(b);
      }
      b.append(')');
    }
  }

  /** Binary operator, such as {@code +} or {@code &&}. */
  public static class Binary extends Expr {
    public final String op;
    public final Expr left;
    public final Expr right;

    public Binary(String op, Expr left, Expr right) {
      this.op = requireNonNull(op, "op");
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append('(');
      left.unparse(b);
      b.append(' ').append(op).append(' ');
      right.unparse(b);
      b.append(')');
    }
  }

  /** Prefix unary operator, such as {@code !} or {@code -}. */
  public static class Unary extends Expr {
    public final String op;
    public final Expr operand;

    public Unary(String op, Expr operand) {
      this.op = requireNonNull(op, "op");
      this.operand = requireNonNull(operand, "operand");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append('(').append(op);
      operand.unparse(b);
      b.append(')');
    }
  }

  /** C-style cast. */
  public static class Cast extends Expr {
    public final String type;
    public final Expr operand;

    public Cast(String type, Expr operand) {
      this.type = requireNonNull(type, "type");
      this.operand = requireNonNull(operand, "operand");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append("((").append(type).append(") ");
      operand.unparse(b);
      b.append(')');
    }
  }

  /** Conditional expression, {@code c ? a : b}. */
  public static class Ternary extends Expr {
    public final Expr condition;
    public final Expr ifTrue;
    public final Expr ifFalse;

    public Ternary(Expr condition, Expr ifTrue, Expr ifFalse) {
      this.condition = requireNonNull(condition, "condition");
      this.ifTrue = requireNonNull(ifTrue, "ifTrue");
      this.ifFalse = requireNonNull(ifFalse, "ifFalse");
    }

    @Override
    void unparse(StringBuilder b) {
      b.append('(');
      condition.unparse(b);
      b.append(" ? ");
      ifTrue.unparse(b);
      b.append(" : ");
      ifFalse.unparse(b);
      b.append(')');
    }
  }
}

// End CxxProgram.java
