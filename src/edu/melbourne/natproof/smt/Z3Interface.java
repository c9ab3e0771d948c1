/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import java.util.HashMap;
import java.util.List;

/**
 *
 * @author kafle
 */
public class Z3Interface {

    public Context getContext() {
        HashMap<String, String> cfg = new HashMap<>();
        cfg.put("model", "true");
        //cfg.put("proof", "true");
        return new Context(cfg);
    }

    public Solver createSolver(Context ctx) {
        return ctx.mkSolver();
    }

    public SolverSession createSession(Context ctx, String name) {
        return new SolverSession(ctx, createSolver(ctx), name);
    }

    /**
     * evaluates an expression in a model
     */
    public static Expr evalExprInModel(Model model, Expr expr) {
        return model.evaluate(expr, true); // the second parameter says model_completion=True
    }

    /**
     * evaluates a boolean expression in a model, unknown values count as false
     */
    public static boolean evalBoolInModel(Model model, BoolExpr expr) {
        return evalExprInModel(model, expr).isTrue();
    }

    /**
     * evaluates an integer expression in a model
     */
    public static int evalIntInModel(Model model, Expr expr) {
        Expr value = evalExprInModel(model, expr);
        if (!value.isIntNum()) {
            throw new IllegalStateException("expected an integer value for " + expr + ", got " + value);
        }
        return ((IntNum) value).getInt();
    }

    public static BoolExpr listToBF(Context ctx, List<BoolExpr> formulas) {
        if (formulas.isEmpty()) {
            return ctx.mkTrue();
        }
        if (formulas.size() == 1) {
            return formulas.get(0);
        }
        return ctx.mkAnd(formulas.toArray(new BoolExpr[formulas.size()]));
    }

    public static BoolExpr listToDisjunction(Context ctx, List<BoolExpr> formulas) {
        if (formulas.isEmpty()) {
            return ctx.mkFalse();
        }
        if (formulas.size() == 1) {
            return formulas.get(0);
        }
        return ctx.mkOr(formulas.toArray(new BoolExpr[formulas.size()]));
    }
}
