/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.Util;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.model.FormulaInterpreter;
import edu.melbourne.natproof.model.Structure;
import edu.melbourne.natproof.smt.Z3Interface;
import edu.melbourne.natproof.synthesis.FormulaTemplate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lemmas of the form forall xs. R(xs) -> psi(xs), where R is a fixpoint
 * relation of the sublanguage and psi is a conjunction/disjunction tree of
 * literals over terms of the sublanguage.
 *
 * @author kafle
 */
public class LemmaTemplate implements FormulaTemplate<Formula> {

    private static final AtomicInteger instances = new AtomicInteger(0);
    static final String VARIABLE_PREFIX = "v";

    private final Context ctx;
    private final List<RelationSymbol> relations;
    private final List<Variable> variables;
    private final List<Formula> atoms;
    private final IntExpr relationChoice;
    private final Node root;

    /**
     * @param formulaDepth height of the connective tree above the literals
     * @param termDepth nesting of function applications in the literals
     * @throws IllegalArgumentException if the sublanguage has no fixpoint
     * relation over the foreground sort
     */
    public LemmaTemplate(Context ctx, Theory theory, Language sublanguage, Sort foregroundSort, int formulaDepth,
            int termDepth) {
        this.ctx = ctx;
        this.relations = getPremiseRelations(theory, sublanguage, foregroundSort);
        if (relations.isEmpty()) {
            throw new IllegalArgumentException("no fixpoint relation over " + foregroundSort + " in " + sublanguage);
        }
        int arity = 0;
        for (RelationSymbol symbol : relations) {
            arity = Math.max(arity, symbol.getArity());
        }

        this.variables = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
            variables.add(new Variable(VARIABLE_PREFIX + i, foregroundSort));
        }
        this.atoms = getAtoms(sublanguage, getTerms(sublanguage, variables, termDepth));

        String prefix = "lemma" + instances.getAndIncrement() + "!";
        this.relationChoice = ctx.mkIntConst(prefix + "r");
        this.root = new Node(prefix, 0, formulaDepth);
    }

    /**
     * Relations of the sublanguage that may head a lemma: fixpoint relations
     * whose arguments are all of the foreground sort.
     */
    public static List<RelationSymbol> getPremiseRelations(Theory theory, Language sublanguage, Sort foregroundSort) {
        List<RelationSymbol> premises = new ArrayList<>();
        for (RelationSymbol symbol : sublanguage.getRelationSymbols()) {
            if (theory.getFixpointDefinition(symbol) != null && allOfSort(symbol.getInputSorts(), foregroundSort)) {
                premises.add(symbol);
            }
        }
        return premises;
    }

    private static boolean allOfSort(List<Sort> sorts, Sort sort) {
        for (Sort other : sorts) {
            if (!other.equals(sort)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Variables and constants, closed under function application up to the
     * depth.
     */
    static List<Term> getTerms(Language language, List<Variable> variables, int depth) {
        Set<Term> terms = new LinkedHashSet<>();
        terms.addAll(variables);
        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            if (symbol.isConstant()) {
                terms.add(new Application(symbol));
            }
        }
        for (int level = 0; level < depth; level++) {
            List<Term> previous = new ArrayList<>(terms);
            for (FunctionSymbol symbol : language.getFunctionSymbols()) {
                if (symbol.isConstant()) {
                    continue;
                }
                for (List<Term> arguments : Util.product(termsBySort(previous, symbol.getInputSorts()))) {
                    terms.add(new Application(symbol, arguments));
                }
            }
        }
        return new ArrayList<>(terms);
    }

    /**
     * Relation atoms over the terms, and equalities between distinct terms of
     * the same sort.
     */
    static List<Formula> getAtoms(Language language, List<Term> terms) {
        Set<Formula> atoms = new LinkedHashSet<>();
        for (RelationSymbol symbol : language.getRelationSymbols()) {
            for (List<Term> arguments : Util.product(termsBySort(terms, symbol.getInputSorts()))) {
                atoms.add(new RelationApplication(symbol, arguments));
            }
        }
        for (int i = 0; i < terms.size(); i++) {
            for (int j = i + 1; j < terms.size(); j++) {
                if (terms.get(i).getSort().equals(terms.get(j).getSort())) {
                    atoms.add(new Equality(terms.get(i), terms.get(j)));
                }
            }
        }
        return new ArrayList<>(atoms);
    }

    private static List<List<Term>> termsBySort(List<Term> terms, List<Sort> sorts) {
        List<List<Term>> candidates = new ArrayList<>();
        for (Sort sort : sorts) {
            List<Term> ofSort = new ArrayList<>();
            for (Term term : terms) {
                if (term.getSort().equals(sort)) {
                    ofSort.add(term);
                }
            }
            candidates.add(ofSort);
        }
        return candidates;
    }

    public List<Formula> getAtoms() {
        return new ArrayList<>(atoms);
    }

    public List<RelationSymbol> getRelations() {
        return new ArrayList<>(relations);
    }

    @Override
    public BoolExpr getConstraint() {
        List<BoolExpr> constraints = new ArrayList<>();
        constraints.add(ctx.mkLe(ctx.mkInt(0), relationChoice));
        constraints.add(ctx.mkLt(relationChoice, ctx.mkInt(relations.size())));
        root.collectRanges(constraints);
        return Z3Interface.listToBF(ctx, constraints);
    }

    /**
     * Truth of the selected lemma on a finite structure, as a constraint over
     * the choice variables.
     */
    public BoolExpr interpret(Structure structure) {
        FormulaInterpreter interpreter = new FormulaInterpreter(structure);
        List<List<Expr>> carriers = new ArrayList<>();
        for (Variable var : variables) {
            carriers.add(structure.getCarrier(var.getSort()));
        }

        List<BoolExpr> instances = new ArrayList<>();
        for (List<Expr> assignment : Util.product(carriers)) {
            Map<Variable, Expr> valuation = new HashMap<>();
            for (int i = 0; i < variables.size(); i++) {
                valuation.put(variables.get(i), assignment.get(i));
            }
            BoolExpr[] atomValues = new BoolExpr[atoms.size()];
            for (int i = 0; i < atomValues.length; i++) {
                atomValues[i] = interpreter.interpret(atoms.get(i), valuation);
            }
            BoolExpr conclusion = root.interpret(atomValues);
            for (int r = 0; r < relations.size(); r++) {
                BoolExpr premise = interpreter.interpret(getPremise(relations.get(r)), valuation);
                instances.add(ctx.mkImplies(ctx.mkAnd(ctx.mkEq(relationChoice, ctx.mkInt(r)), premise), conclusion));
            }
        }
        return Z3Interface.listToBF(ctx, instances);
    }

    private RelationApplication getPremise(RelationSymbol relation) {
        return new RelationApplication(relation, variables.subList(0, relation.getArity()));
    }

    @Override
    public Formula getFromSmtModel(Model model) {
        RelationSymbol relation = relations.get(Z3Interface.evalIntInModel(model, relationChoice));
        return new Implication(getPremise(relation), root.decode(model)).quantifyAllFreeVariables();
    }

    @Override
    public BoolExpr excludeFromSmtModel(Model model) {
        List<BoolExpr> choices = new ArrayList<>();
        choices.add(ctx.mkEq(relationChoice, ctx.mkInt(Z3Interface.evalIntInModel(model, relationChoice))));
        root.collectChoices(model, choices);
        return ctx.mkNot(Z3Interface.listToBF(ctx, choices));
    }

    /**
     * A literal (atom or its negation) or, above the leaves, a conjunction
     * or disjunction of the two children.
     */
    private class Node {

        private final IntExpr choice;
        private final Node left;
        private final Node right;

        Node(String prefix, int index, int height) {
            this.choice = ctx.mkIntConst(prefix + "c" + index);
            if (height > 0) {
                this.left = new Node(prefix, 2 * index + 1, height - 1);
                this.right = new Node(prefix, 2 * index + 2, height - 1);
            } else {
                this.left = null;
                this.right = null;
            }
        }

        private boolean isLeaf() {
            return left == null;
        }

        private int getLiterals() {
            return 2 * atoms.size();
        }

        void collectRanges(List<BoolExpr> constraints) {
            int choices = isLeaf() ? getLiterals() : getLiterals() + 2;
            constraints.add(ctx.mkLe(ctx.mkInt(0), choice));
            constraints.add(ctx.mkLt(choice, ctx.mkInt(choices)));
            if (!isLeaf()) {
                left.collectRanges(constraints);
                right.collectRanges(constraints);
            }
        }

        private BoolExpr chosen(int code) {
            return ctx.mkEq(choice, ctx.mkInt(code));
        }

        BoolExpr interpret(BoolExpr[] atomValues) {
            BoolExpr value = atomValues[0];
            for (int code = 1; code < getLiterals(); code++) {
                BoolExpr atom = atomValues[code / 2];
                value = (BoolExpr) ctx.mkITE(chosen(code), code % 2 == 0 ? atom : ctx.mkNot(atom), value);
            }
            if (!isLeaf()) {
                BoolExpr leftValue = left.interpret(atomValues);
                BoolExpr rightValue = right.interpret(atomValues);
                value = (BoolExpr) ctx.mkITE(chosen(getLiterals()), ctx.mkAnd(leftValue, rightValue), value);
                value = (BoolExpr) ctx.mkITE(chosen(getLiterals() + 1), ctx.mkOr(leftValue, rightValue), value);
            }
            return value;
        }

        Formula decode(Model model) {
            int code = Z3Interface.evalIntInModel(model, choice);
            if (code >= 0 && code < getLiterals()) {
                Formula atom = atoms.get(code / 2);
                return code % 2 == 0 ? atom : new Negation(atom);
            }
            if (!isLeaf() && code == getLiterals()) {
                return new Conjunction(left.decode(model), right.decode(model));
            }
            if (!isLeaf() && code == getLiterals() + 1) {
                return new Disjunction(left.decode(model), right.decode(model));
            }
            throw new IllegalStateException("choice " + code + " out of range at " + choice);
        }

        void collectChoices(Model model, List<BoolExpr> choices) {
            int code = Z3Interface.evalIntInModel(model, choice);
            choices.add(chosen(code));
            if (!isLeaf() && code >= getLiterals()) {
                left.collectChoices(model, choices);
                right.collectChoices(model, choices);
            }
        }
    }
}
