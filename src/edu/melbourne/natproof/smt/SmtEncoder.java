/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Equivalence;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.Falsum;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.logic.Verum;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates formulas over a first-order language into Z3 terms.
 * Uninterpreted sorts become Z3 uninterpreted sorts, symbols become
 * uninterpreted functions of the same name.
 *
 * @author kafle
 */
public class SmtEncoder {

    static final String VARIABLE_PREFIX = "var!";

    private final Context ctx;
    private final Map<Sort, com.microsoft.z3.Sort> sorts;
    private final Map<FunctionSymbol, FuncDecl> functions;
    private final Map<RelationSymbol, FuncDecl> relations;

    public SmtEncoder(Context ctx) {
        this.ctx = ctx;
        this.sorts = new HashMap<>();
        this.functions = new HashMap<>();
        this.relations = new HashMap<>();
    }

    public Context getContext() {
        return ctx;
    }

    public com.microsoft.z3.Sort encodeSort(Sort sort) {
        com.microsoft.z3.Sort z3Sort = sorts.get(sort);
        if (z3Sort == null) {
            if (sort.isUninterpreted()) {
                z3Sort = ctx.mkUninterpretedSort(sort.getName());
            } else if (Sort.INT_HOOK.equals(sort.getSmtHook())) {
                z3Sort = ctx.mkIntSort();
            } else {
                throw new IllegalArgumentException("unsupported smt hook " + sort.getSmtHook() + " of sort " + sort);
            }
            sorts.put(sort, z3Sort);
        }
        return z3Sort;
    }

    public FuncDecl encodeFunction(FunctionSymbol symbol) {
        FuncDecl decl = functions.get(symbol);
        if (decl == null) {
            decl = ctx.mkFuncDecl(symbol.getName(), encodeSorts(symbol.getInputSorts()),
                    encodeSort(symbol.getOutputSort()));
            functions.put(symbol, decl);
        }
        return decl;
    }

    public FuncDecl encodeRelation(RelationSymbol symbol) {
        FuncDecl decl = relations.get(symbol);
        if (decl == null) {
            decl = ctx.mkFuncDecl(symbol.getName(), encodeSorts(symbol.getInputSorts()), ctx.mkBoolSort());
            relations.put(symbol, decl);
        }
        return decl;
    }

    private com.microsoft.z3.Sort[] encodeSorts(List<Sort> inputSorts) {
        com.microsoft.z3.Sort[] domain = new com.microsoft.z3.Sort[inputSorts.size()];
        for (int i = 0; i < domain.length; i++) {
            domain[i] = encodeSort(inputSorts.get(i));
        }
        return domain;
    }

    public Expr encodeVariable(Variable var) {
        return ctx.mkConst(VARIABLE_PREFIX + var.getName(), encodeSort(var.getSort()));
    }

    public Expr encodeTerm(Term term) {
        if (term instanceof Variable) {
            return encodeVariable((Variable) term);

        } else if (term instanceof Application) {
            Application application = (Application) term;
            List<Term> arguments = application.getArguments();
            Expr[] args = new Expr[arguments.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = encodeTerm(arguments.get(i));
            }
            return ctx.mkApp(encodeFunction(application.getSymbol()), args);
        }

        throw new IllegalStateException("unsupported term " + term);
    }

    /**
     * Encodes a formula; remaining free variables are universally closed.
     */
    public BoolExpr encodeFormula(Formula formula) {
        BoolExpr body = encodeOpenFormula(formula);
        List<Expr> freeConstants = new ArrayList<>();
        for (Variable var : formula.getFreeVariables()) {
            freeConstants.add(encodeVariable(var));
        }
        if (freeConstants.isEmpty()) {
            return body;
        }
        return ctx.mkForall(freeConstants.toArray(new Expr[freeConstants.size()]), body, 1, null, null, null, null);
    }

    /**
     * Encodes a formula leaving free variables as constants.
     */
    public BoolExpr encodeOpenFormula(Formula formula) {
        if (formula instanceof Falsum) {
            return ctx.mkFalse();

        } else if (formula instanceof Verum) {
            return ctx.mkTrue();

        } else if (formula instanceof RelationApplication) {
            RelationApplication application = (RelationApplication) formula;
            List<Term> arguments = application.getArguments();
            Expr[] args = new Expr[arguments.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = encodeTerm(arguments.get(i));
            }
            return (BoolExpr) ctx.mkApp(encodeRelation(application.getSymbol()), args);

        } else if (formula instanceof Equality) {
            Equality equality = (Equality) formula;
            return ctx.mkEq(encodeTerm(equality.getLeft()), encodeTerm(equality.getRight()));

        } else if (formula instanceof Conjunction) {
            Conjunction conjunction = (Conjunction) formula;
            return ctx.mkAnd(encodeOpenFormula(conjunction.getLeft()), encodeOpenFormula(conjunction.getRight()));

        } else if (formula instanceof Disjunction) {
            Disjunction disjunction = (Disjunction) formula;
            return ctx.mkOr(encodeOpenFormula(disjunction.getLeft()), encodeOpenFormula(disjunction.getRight()));

        } else if (formula instanceof Negation) {
            return ctx.mkNot(encodeOpenFormula(((Negation) formula).getFormula()));

        } else if (formula instanceof Implication) {
            Implication implication = (Implication) formula;
            return ctx.mkImplies(encodeOpenFormula(implication.getLeft()), encodeOpenFormula(implication.getRight()));

        } else if (formula instanceof Equivalence) {
            Equivalence equivalence = (Equivalence) formula;
            return ctx.mkIff(encodeOpenFormula(equivalence.getLeft()), encodeOpenFormula(equivalence.getRight()));

        } else if (formula instanceof UniversalQuantification) {
            UniversalQuantification quantification = (UniversalQuantification) formula;
            return ctx.mkForall(new Expr[]{encodeVariable(quantification.getVariable())},
                    encodeOpenFormula(quantification.getBody()), 1, null, null, null, null);

        } else if (formula instanceof ExistentialQuantification) {
            ExistentialQuantification quantification = (ExistentialQuantification) formula;
            return ctx.mkExists(new Expr[]{encodeVariable(quantification.getVariable())},
                    encodeOpenFormula(quantification.getBody()), 1, null, null, null, null);
        }

        throw new IllegalStateException("unsupported formula " + formula);
    }
}
