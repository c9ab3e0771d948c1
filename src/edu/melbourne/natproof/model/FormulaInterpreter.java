/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Equivalence;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.Falsum;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.Quantification;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.logic.Verum;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates formulas on a finite {@link Structure}. Quantifiers over
 * uninterpreted sorts are expanded over the carriers; quantifiers over the
 * integer sort become Z3 quantifiers.
 *
 * @author kafle
 */
public class FormulaInterpreter {

    protected final Structure structure;
    protected final Context ctx;

    public FormulaInterpreter(Structure structure) {
        this.structure = structure;
        this.ctx = structure.getContext();
    }

    public BoolExpr interpret(Formula formula) {
        return interpret(formula, Collections.<Variable, Expr>emptyMap());
    }

    /**
     * @param valuation values of the free variables of the formula
     */
    public BoolExpr interpret(Formula formula, Map<Variable, Expr> valuation) {
        return interpret(formula, valuation, Polarity.POSITIVE);
    }

    protected BoolExpr interpret(Formula formula, Map<Variable, Expr> valuation, Polarity polarity) {
        if (formula instanceof Falsum) {
            return ctx.mkFalse();

        } else if (formula instanceof Verum) {
            return ctx.mkTrue();

        } else if (formula instanceof RelationApplication) {
            RelationApplication application = (RelationApplication) formula;
            return interpretRelationApplication(application, interpretArguments(application.getArguments(), valuation),
                    polarity);

        } else if (formula instanceof Equality) {
            Equality equality = (Equality) formula;
            return ctx.mkEq(interpretTerm(equality.getLeft(), valuation), interpretTerm(equality.getRight(), valuation));

        } else if (formula instanceof Conjunction) {
            Conjunction conjunction = (Conjunction) formula;
            return ctx.mkAnd(interpret(conjunction.getLeft(), valuation, polarity),
                    interpret(conjunction.getRight(), valuation, polarity));

        } else if (formula instanceof Disjunction) {
            Disjunction disjunction = (Disjunction) formula;
            return ctx.mkOr(interpret(disjunction.getLeft(), valuation, polarity),
                    interpret(disjunction.getRight(), valuation, polarity));

        } else if (formula instanceof Negation) {
            return ctx.mkNot(interpret(((Negation) formula).getFormula(), valuation, polarity.flip()));

        } else if (formula instanceof Implication) {
            Implication implication = (Implication) formula;
            return ctx.mkImplies(interpret(implication.getLeft(), valuation, polarity.flip()),
                    interpret(implication.getRight(), valuation, polarity));

        } else if (formula instanceof Equivalence) {
            Equivalence equivalence = (Equivalence) formula;
            return ctx.mkIff(interpret(equivalence.getLeft(), valuation, Polarity.MIXED),
                    interpret(equivalence.getRight(), valuation, Polarity.MIXED));

        } else if (formula instanceof UniversalQuantification || formula instanceof ExistentialQuantification) {
            Quantification quantification = (Quantification) formula;
            Variable var = quantification.getVariable();
            if (!var.getSort().isUninterpreted()) {
                return interpretOverIntegers(quantification, valuation, polarity);
            }
            List<BoolExpr> instances = new ArrayList<>();
            for (Expr element : structure.getCarrier(var.getSort())) {
                Map<Variable, Expr> extended = new HashMap<>(valuation);
                extended.put(var, element);
                instances.add(interpret(quantification.getBody(), extended, polarity));
            }
            BoolExpr[] array = instances.toArray(new BoolExpr[instances.size()]);
            if (formula instanceof UniversalQuantification) {
                return array.length == 0 ? ctx.mkTrue() : ctx.mkAnd(array);
            }
            return array.length == 0 ? ctx.mkFalse() : ctx.mkOr(array);
        }

        throw new IllegalStateException("unsupported formula " + formula);
    }

    /**
     * Quantifiers over an integer sort stay quantifiers.
     */
    private BoolExpr interpretOverIntegers(Quantification quantification, Map<Variable, Expr> valuation,
            Polarity polarity) {
        Variable var = quantification.getVariable();
        if (!Sort.INT_HOOK.equals(var.getSort().getSmtHook())) {
            throw new IllegalArgumentException("unsupported interpreted sort " + var.getSort());
        }
        Expr bound = ctx.mkFreshConst(var.getName(), ctx.mkIntSort());
        Map<Variable, Expr> extended = new HashMap<>(valuation);
        extended.put(var, bound);
        BoolExpr body = interpret(quantification.getBody(), extended, polarity);
        if (quantification instanceof UniversalQuantification) {
            return ctx.mkForall(new Expr[]{bound}, body, 1, null, null, null, null);
        }
        return ctx.mkExists(new Expr[]{bound}, body, 1, null, null, null, null);
    }

    /**
     * Hook for relation atoms; the default asks the structure.
     */
    protected BoolExpr interpretRelationApplication(RelationApplication application, Expr[] arguments,
            Polarity polarity) {
        return structure.interpretRelation(application.getSymbol(), arguments);
    }

    public Expr interpretTerm(Term term, Map<Variable, Expr> valuation) {
        if (term instanceof Variable) {
            Expr value = valuation.get(term);
            if (value == null) {
                throw new IllegalArgumentException("no value for free variable " + term);
            }
            return value;

        } else if (term instanceof Application) {
            Application application = (Application) term;
            return structure.interpretFunction(application.getSymbol(),
                    interpretArguments(application.getArguments(), valuation));
        }

        throw new IllegalStateException("unsupported term " + term);
    }

    protected Expr[] interpretArguments(List<Term> arguments, Map<Variable, Expr> valuation) {
        Expr[] args = new Expr[arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = interpretTerm(arguments.get(i), valuation);
        }
        return args;
    }
}
