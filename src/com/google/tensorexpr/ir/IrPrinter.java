/*
 * Copyright 2020 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.tensorexpr.ir;

import com.google.common.base.Strings;
import java.util.List;

/** Renders IR trees as C-like text, for debugging and error messages. */
public final class IrPrinter {

  private static final int INDENT = 2;

  private IrPrinter() {}

  public static String print(Expr e) {
    StringBuilder sb = new StringBuilder();
    appendExpr(sb, e);
    return sb.toString();
  }

  public static String print(Stmt s) {
    StringBuilder sb = new StringBuilder();
    appendStmt(sb, s, 0);
    return sb.toString();
  }

  private static void appendExpr(StringBuilder sb, Expr e) {
    switch (e.getKind()) {
      case IMMEDIATE:
        appendImmediate(sb, (Immediate) e);
        return;
      case VAR:
        sb.append(((Var) e).getName());
        return;
      case ADD:
        appendInfix(sb, (BinaryOp) e, " + ");
        return;
      case SUB:
        appendInfix(sb, (BinaryOp) e, " - ");
        return;
      case MUL:
        appendInfix(sb, (BinaryOp) e, " * ");
        return;
      case DIV:
        appendInfix(sb, (BinaryOp) e, " / ");
        return;
      case MOD:
        appendInfix(sb, (BinaryOp) e, " % ");
        return;
      case AND:
        appendInfix(sb, (BinaryOp) e, " & ");
        return;
      case OR:
        appendInfix(sb, (BinaryOp) e, " | ");
        return;
      case XOR:
        appendInfix(sb, (BinaryOp) e, " ^ ");
        return;
      case LSHIFT:
        appendInfix(sb, (BinaryOp) e, " << ");
        return;
      case RSHIFT:
        appendInfix(sb, (BinaryOp) e, " >> ");
        return;
      case MAX:
      case MIN:
        {
          BinaryOp op = (BinaryOp) e;
          sb.append(e.getKind() == ExprKind.MAX ? "Max(" : "Min(");
          appendExpr(sb, op.getLhs());
          sb.append(", ");
          appendExpr(sb, op.getRhs());
          sb.append(", ").append(op.propagatesNans() ? 1 : 0).append(')');
          return;
        }
      case ROUND_OFF:
        appendCall(sb, "RoundOff", e.getChildren());
        return;
      case COMPARE_SELECT:
        {
          CompareSelect select = (CompareSelect) e;
          sb.append("((");
          appendExpr(sb, select.getLhs());
          sb.append(' ').append(select.getCompareOp().getSymbol()).append(' ');
          appendExpr(sb, select.getRhs());
          sb.append(") ? ");
          appendExpr(sb, select.getIfTrue());
          sb.append(" : ");
          appendExpr(sb, select.getIfFalse());
          sb.append(')');
          return;
        }
      case CAST:
        appendCall(sb, e.getDtype().toString(), e.getChildren());
        return;
      case BROADCAST:
        appendCall(sb, "Broadcast", e.getChildren());
        sb.insert(sb.length() - 1, ", " + e.getDtype().getLanes());
        return;
      case RAMP:
        appendCall(sb, "Ramp", e.getChildren());
        sb.insert(sb.length() - 1, ", " + e.getDtype().getLanes());
        return;
      case INTRINSICS:
        appendCall(sb, ((Intrinsics) e).getOp().getName(), e.getChildren());
        return;
      case TERM:
        appendCall(sb, "Term", e.getChildren());
        return;
      case POLYNOMIAL:
        appendCall(sb, "Polynomial", e.getChildren());
        return;
    }
    throw new IllegalStateException("unexpected expression " + e.getKind());
  }

  private static void appendImmediate(StringBuilder sb, Immediate imm) {
    switch (imm.getScalarType()) {
      case BOOL:
        sb.append(imm.asLong() != 0);
        return;
      case FLOAT:
        sb.append((float) imm.asDouble()).append('f');
        return;
      case DOUBLE:
        sb.append(imm.asDouble());
        return;
      case LONG:
        sb.append(imm.asLong()).append('L');
        return;
      default:
        sb.append(imm.asLong());
    }
  }

  private static void appendInfix(StringBuilder sb, BinaryOp op, String operator) {
    sb.append('(');
    appendExpr(sb, op.getLhs());
    sb.append(operator);
    appendExpr(sb, op.getRhs());
    sb.append(')');
  }

  private static void appendCall(StringBuilder sb, String name, List<Expr> args) {
    sb.append(name).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      appendExpr(sb, args.get(i));
    }
    sb.append(')');
  }

  private static void appendStmt(StringBuilder sb, Stmt s, int depth) {
    String indent = Strings.repeat(" ", depth * INDENT);
    switch (s.getKind()) {
      case BLOCK:
        sb.append(indent).append("{\n");
        for (Stmt child : s.getStatements()) {
          appendStmt(sb, child, depth + 1);
        }
        sb.append(indent).append("}\n");
        return;
      case FOR:
        {
          For loop = (For) s;
          String var = print(loop.getVar());
          sb.append(indent).append("for (").append(var).append(" = ");
          appendExpr(sb, loop.getStart());
          sb.append("; ").append(var).append(" < ");
          appendExpr(sb, loop.getStop());
          sb.append("; ").append(var).append("++)\n");
          appendStmt(sb, loop.getBody(), depth + 1);
          return;
        }
      case COND:
        {
          Cond cond = (Cond) s;
          sb.append(indent).append("if (");
          appendExpr(sb, cond.getCondition());
          sb.append(")\n");
          appendStmt(sb, cond.getThen(), depth + 1);
          if (cond.getElse() != null) {
            sb.append(indent).append("else\n");
            appendStmt(sb, cond.getElse(), depth + 1);
          }
          return;
        }
      case LET:
        {
          Let let = (Let) s;
          sb.append(indent).append(let.getVar().getDtype()).append(' ');
          sb.append(let.getVar().getName()).append(" = ");
          appendExpr(sb, let.getValue());
          sb.append(";\n");
          return;
        }
      case STORE:
        {
          Store store = (Store) s;
          sb.append(indent).append(store.getBuffer().getName()).append('[');
          appendExpr(sb, store.getIndex());
          sb.append("] = ");
          appendExpr(sb, store.getValue());
          sb.append(";\n");
          return;
        }
    }
    throw new IllegalStateException("unexpected statement " + s.getKind());
  }
}
