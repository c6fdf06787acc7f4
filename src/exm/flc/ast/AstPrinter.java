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

package exm.flc.ast;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Renders a subtree as indented text, for logs and test failure messages.
 */
public class AstPrinter {
  private static final int INDENT = 2;

  public static String print(Expr e) {
    StringBuilder sb = new StringBuilder();
    print(sb, e, 0);
    return sb.toString();
  }

  private static void print(StringBuilder sb, Expr e, int indent) {
    if (e instanceof ForallStmt) {
      printForall(sb, (ForallStmt)e, indent);
    } else if (e instanceof ForLoop) {
      ForLoop loop = (ForLoop)e;
      line(sb, indent, "for" + (loop.zippered() ? " zip " : " ") +
           expr(loop.indexGet()) + " in " + expr(loop.iteratorGet()) + " {");
      printBody(sb, loop, indent);
    } else if (e instanceof BlockStmt) {
      BlockStmt b = (BlockStmt)e;
      String open = b.getTag() == BlockStmt.BlockTag.NORMAL ? "{" :
                    "{" + b.getTag().toString().toLowerCase();
      line(sb, indent, open);
      printBody(sb, b, indent);
    } else if (e instanceof CondStmt) {
      CondStmt c = (CondStmt)e;
      line(sb, indent, "if " + expr(c.condExpr()));
      print(sb, c.thenStmt(), indent + INDENT);
      if (c.elseStmt() != null) {
        line(sb, indent, "else");
        print(sb, c.elseStmt(), indent + INDENT);
      }
    } else if (e instanceof DeferStmt) {
      line(sb, indent, "defer");
      print(sb, ((DeferStmt)e).body(), indent + INDENT);
    } else {
      line(sb, indent, expr(e));
    }
  }

  private static void printBody(StringBuilder sb, BlockStmt b, int indent) {
    for (Expr stmt: b.getBody()) {
      print(sb, stmt, indent + INDENT);
    }
    line(sb, indent, "}");
  }

  private static void printForall(StringBuilder sb, ForallStmt fs,
                                  int indent) {
    List<String> idx = new ArrayList<String>();
    for (Expr def: fs.inductionVariables()) {
      idx.add(((DefExpr)def).getSymbol().getName());
    }
    List<String> iters = new ArrayList<String>();
    for (Expr iter: fs.iteratedExpressions()) {
      iters.add(expr(iter));
    }
    List<String> with = new ArrayList<String>();
    for (ShadowVarSymbol svar: fs.shadowVarSymbols()) {
      with.add(svar.intent().description() + " " + svar.getName());
    }
    StringBuilder header = new StringBuilder("forall (");
    header.append(StringUtils.join(idx, ", ")).append(") in ");
    if (fs.zippered()) {
      header.append("zip(").append(StringUtils.join(iters, ", ")).append(")");
    } else {
      header.append(StringUtils.join(iters, ", "));
    }
    if (!with.isEmpty()) {
      header.append(" with (").append(StringUtils.join(with, ", "))
            .append(")");
    }
    line(sb, indent, header.toString());
    print(sb, fs.loopBody(), indent);
  }

  private static void line(StringBuilder sb, int indent, String text) {
    sb.append(StringUtils.repeat(' ', indent)).append(text).append('\n');
  }

  /**
   * Single-line rendering of an expression
   */
  public static String expr(Expr e) {
    if (e == null) {
      return "<null>";
    } else if (e instanceof SymExpr) {
      return ((SymExpr)e).symbol().getName();
    } else if (e instanceof UnresolvedSymExpr) {
      return "'" + ((UnresolvedSymExpr)e).getName() + "'";
    } else if (e instanceof NamedExpr) {
      NamedExpr ne = (NamedExpr)e;
      return ne.getName() + "=" + expr(ne.getActual());
    } else if (e instanceof DefExpr) {
      DefExpr def = (DefExpr)e;
      Symbol sym = def.getSymbol();
      String s = "def " + sym.getName();
      if (sym.hasType()) {
        s += ": " + sym.getType();
      }
      if (def.getInit() != null) {
        s += " = " + expr(def.getInit());
      }
      return s;
    } else if (e instanceof CallExpr) {
      CallExpr call = (CallExpr)e;
      List<String> args = new ArrayList<String>();
      for (Expr actual: call.actuals()) {
        args.add(expr(actual));
      }
      String callee = call.isPrimitive() ?
          call.getPrim().toString().toLowerCase() : call.getName();
      return callee + "(" + StringUtils.join(args, ", ") + ")";
    } else {
      return e.getClass().getSimpleName() + "#" + e.id();
    }
  }
}
