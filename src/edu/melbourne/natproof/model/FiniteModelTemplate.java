/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.Util;
import edu.melbourne.natproof.logic.FixpointDefinition;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sentence;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.log4j.Logger;

/**
 * A symbolic finite structure of a theory: each function and relation of the
 * theory's language is a Z3 unknown over carriers of fixed size. Its
 * constraint admits exactly the finite models of the theory in which every
 * fixpoint relation is interpreted as the least fixed point of its
 * definition. The integer sort keeps its Z3 meaning: it has no carrier, its
 * values are unconstrained and positions of that sort are quantified.
 *
 * @author kafle
 */
public class FiniteModelTemplate implements Structure {

    private static final Logger logger = Logger.getLogger(FiniteModelTemplate.class);
    private static final AtomicInteger instances = new AtomicInteger(0);

    private final Context ctx;
    private final Theory theory;
    private final Map<Sort, Integer> sizes;
    private final String prefix;
    private final Map<FunctionSymbol, FuncDecl> functions;
    private final Map<RelationSymbol, FuncDecl> relations;
    private final Map<RelationSymbol, FuncDecl> ranks;

    /**
     * @param sizes carrier size of every uninterpreted sort of the theory's
     * language
     * @throws IllegalArgumentException if an uninterpreted sort has no size,
     * or a sort is interpreted by something other than the integers
     */
    public FiniteModelTemplate(Context ctx, Theory theory, Map<Sort, Integer> sizes) {
        this.ctx = ctx;
        this.theory = theory;
        this.sizes = new HashMap<>();
        this.prefix = "m" + instances.getAndIncrement() + "!";
        this.functions = new HashMap<>();
        this.relations = new HashMap<>();
        this.ranks = new HashMap<>();

        Language language = theory.getLanguage();
        for (Sort sort : language.getSorts()) {
            if (!sort.isUninterpreted()) {
                if (!Sort.INT_HOOK.equals(sort.getSmtHook())) {
                    throw new IllegalArgumentException("finite models of interpreted sort " + sort
                            + " are not supported");
                }
                continue;
            }
            Integer size = sizes.get(sort);
            if (size == null || size <= 0) {
                throw new IllegalArgumentException("no positive carrier size for sort " + sort);
            }
            this.sizes.put(sort, size);
        }
        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            functions.put(symbol, ctx.mkFuncDecl(prefix + symbol.getName(), intDomain(symbol.getArity()),
                    ctx.mkIntSort()));
        }
        for (RelationSymbol symbol : language.getRelationSymbols()) {
            relations.put(symbol, ctx.mkFuncDecl(prefix + symbol.getName(), intDomain(symbol.getArity()),
                    ctx.mkBoolSort()));
        }
        for (FixpointDefinition definition : theory.getFixpointDefinitions()) {
            RelationSymbol symbol = definition.getRelation();
            ranks.put(symbol, ctx.mkFuncDecl(prefix + "rank!" + symbol.getName(), intDomain(symbol.getArity()),
                    ctx.mkIntSort()));
        }
    }

    public Theory getTheory() {
        return theory;
    }

    public Map<Sort, Integer> getSizes() {
        return new HashMap<>(sizes);
    }

    @Override
    public Context getContext() {
        return ctx;
    }

    @Override
    public Language getLanguage() {
        return theory.getLanguage();
    }

    @Override
    public List<Expr> getCarrier(Sort sort) {
        Integer size = sizes.get(sort);
        if (size == null) {
            throw new IllegalArgumentException("sort " + sort + " has no finite carrier");
        }
        List<Expr> carrier = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            carrier.add(ctx.mkInt(i));
        }
        return carrier;
    }

    @Override
    public Expr interpretFunction(FunctionSymbol symbol, Expr... arguments) {
        FuncDecl decl = functions.get(symbol);
        if (decl == null) {
            throw new IllegalArgumentException("function " + symbol + " not in the language of " + theory);
        }
        return ctx.mkApp(decl, arguments);
    }

    @Override
    public BoolExpr interpretRelation(RelationSymbol symbol, Expr... arguments) {
        FuncDecl decl = relations.get(symbol);
        if (decl == null) {
            throw new IllegalArgumentException("relation " + symbol + " not in the language of " + theory);
        }
        return (BoolExpr) ctx.mkApp(decl, arguments);
    }

    /**
     * Constraint on the unknowns: function values stay in their carriers,
     * the axioms hold, and every fixpoint relation is its least fixed point.
     */
    public BoolExpr getConstraint() {
        List<BoolExpr> constraints = new ArrayList<>();
        Language language = theory.getLanguage();

        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            Integer outputSize = sizes.get(symbol.getOutputSort());
            if (outputSize == null) {
                continue;
            }
            Expr[] bound = boundArguments(symbol.getInputSorts());
            for (List<Expr> tuple : argumentTuples(symbol.getInputSorts(), bound)) {
                Expr value = interpretFunction(symbol, toArray(tuple));
                constraints.add(forAll(bound, ctx.mkAnd(ctx.mkLe(ctx.mkInt(0), value),
                        ctx.mkLt(value, ctx.mkInt(outputSize)))));
            }
        }

        FormulaInterpreter interpreter = new FormulaInterpreter(this);
        for (Sentence sentence : theory.getSentences()) {
            if (sentence instanceof FixpointDefinition) {
                constraints.add(getFixpointConstraint((FixpointDefinition) sentence));
            } else {
                constraints.add(interpreter.interpret(sentence.toFormula()));
            }
        }

        logger.debug("finite model constraint of " + theory + " over " + sizes + ": " + constraints.size()
                + " conjuncts");
        return Z3Interface.listToBF(ctx, constraints);
    }

    /**
     * R(a) <-> body(a) for every tuple a, and R(a) only if its rank is
     * non-negative and body(a) holds with every positive recursive atom S(t)
     * of strictly smaller rank.
     */
    private BoolExpr getFixpointConstraint(FixpointDefinition definition) {
        List<BoolExpr> constraints = new ArrayList<>();
        RelationSymbol symbol = definition.getRelation();
        FormulaInterpreter plain = new FormulaInterpreter(this);
        Expr[] bound = boundArguments(symbol.getInputSorts());

        for (List<Expr> tuple : argumentTuples(symbol.getInputSorts(), bound)) {
            Expr[] args = toArray(tuple);
            Map<Variable, Expr> valuation = new HashMap<>();
            for (int i = 0; i < args.length; i++) {
                valuation.put(definition.getVariables().get(i), args[i]);
            }
            BoolExpr atom = interpretRelation(symbol, args);
            Expr rank = ctx.mkApp(ranks.get(symbol), args);
            BoolExpr justified = new RankGuardInterpreter(rank).interpret(definition.getDefinition(), valuation);

            BoolExpr wellFounded = ctx.mkAnd(ctx.mkLe(ctx.mkInt(0), rank), justified);
            constraints.add(forAll(bound, ctx.mkAnd(
                    ctx.mkIff(atom, plain.interpret(definition.getDefinition(), valuation)),
                    ctx.mkImplies(atom, wellFounded))));
        }
        return Z3Interface.listToBF(ctx, constraints);
    }

    /**
     * Reads a concrete structure off a model of {@link #getConstraint()}.
     * Symbols with an integer argument cannot be tabulated; the structure
     * evaluates them in the model instead.
     */
    public FiniteStructure getFromSmtModel(Model model) {
        Language language = theory.getLanguage();
        Map<FunctionSymbol, Map<List<Integer>, Integer>> functionTables = new HashMap<>();
        Map<FunctionSymbol, FuncDecl> untabulatedFunctions = new HashMap<>();
        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            if (!isTabulable(symbol.getInputSorts())) {
                untabulatedFunctions.put(symbol, functions.get(symbol));
                continue;
            }
            Map<List<Integer>, Integer> table = new HashMap<>();
            for (List<Expr> tuple : argumentTuples(symbol.getInputSorts())) {
                int value = Z3Interface.evalIntInModel(model, interpretFunction(symbol, toArray(tuple)));
                table.put(toIntegers(tuple), value);
            }
            functionTables.put(symbol, table);
        }
        Map<RelationSymbol, Set<List<Integer>>> relationTables = new HashMap<>();
        Map<RelationSymbol, FuncDecl> untabulatedRelations = new HashMap<>();
        for (RelationSymbol symbol : language.getRelationSymbols()) {
            if (!isTabulable(symbol.getInputSorts())) {
                untabulatedRelations.put(symbol, relations.get(symbol));
                continue;
            }
            Set<List<Integer>> table = new HashSet<>();
            for (List<Expr> tuple : argumentTuples(symbol.getInputSorts())) {
                if (Z3Interface.evalBoolInModel(model, interpretRelation(symbol, toArray(tuple)))) {
                    table.add(toIntegers(tuple));
                }
            }
            relationTables.put(symbol, table);
        }
        return new FiniteStructure(ctx, language, sizes, functionTables, relationTables, model,
                untabulatedFunctions, untabulatedRelations);
    }

    private boolean isTabulable(List<Sort> inputSorts) {
        for (Sort sort : inputSorts) {
            if (!sizes.containsKey(sort)) {
                return false;
            }
        }
        return true;
    }

    private List<List<Expr>> argumentTuples(List<Sort> inputSorts) {
        return argumentTuples(inputSorts, boundArguments(inputSorts));
    }

    /**
     * Tuples over the carriers; an integer position holds its bound
     * constant instead.
     */
    private List<List<Expr>> argumentTuples(List<Sort> inputSorts, Expr[] bound) {
        List<List<Expr>> carriers = new ArrayList<>(inputSorts.size());
        int next = 0;
        for (Sort sort : inputSorts) {
            if (sizes.containsKey(sort)) {
                carriers.add(getCarrier(sort));
            } else {
                carriers.add(Collections.singletonList(bound[next++]));
            }
        }
        return Util.product(carriers);
    }

    private Expr[] boundArguments(List<Sort> inputSorts) {
        List<Expr> bound = new ArrayList<>();
        for (int i = 0; i < inputSorts.size(); i++) {
            if (!sizes.containsKey(inputSorts.get(i))) {
                bound.add(ctx.mkConst(prefix + "arg!" + i, ctx.mkIntSort()));
            }
        }
        return toArray(bound);
    }

    private BoolExpr forAll(Expr[] bound, BoolExpr body) {
        if (bound.length == 0) {
            return body;
        }
        return ctx.mkForall(bound, body, 1, null, null, null, null);
    }

    private com.microsoft.z3.Sort[] intDomain(int arity) {
        com.microsoft.z3.Sort[] domain = new com.microsoft.z3.Sort[arity];
        for (int i = 0; i < arity; i++) {
            domain[i] = ctx.mkIntSort();
        }
        return domain;
    }

    private static Expr[] toArray(List<Expr> tuple) {
        return tuple.toArray(new Expr[tuple.size()]);
    }

    private static List<Integer> toIntegers(List<Expr> tuple) {
        List<Integer> values = new ArrayList<>(tuple.size());
        for (Expr element : tuple) {
            values.add(((IntNum) element).getInt());
        }
        return values;
    }

    /**
     * Interprets a fixpoint body, strengthening positive occurrences of
     * fixpoint relations with a rank strictly below the defined atom.
     */
    private class RankGuardInterpreter extends FormulaInterpreter {

        private final Expr rank;

        RankGuardInterpreter(Expr rank) {
            super(FiniteModelTemplate.this);
            this.rank = rank;
        }

        @Override
        protected BoolExpr interpretRelationApplication(RelationApplication application, Expr[] arguments,
                Polarity polarity) {
            BoolExpr atom = super.interpretRelationApplication(application, arguments, polarity);
            FuncDecl rankDecl = ranks.get(application.getSymbol());
            if (rankDecl == null || polarity != Polarity.POSITIVE) {
                return atom;
            }
            return ctx.mkAnd(atom, ctx.mkLt(ctx.mkApp(rankDecl, arguments), rank));
        }
    }
}
