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
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A concrete finite structure, typically decoded from a solver model of a
 * {@link FiniteModelTemplate}.
 *
 * @author kafle
 */
public class FiniteStructure implements Structure {

    private final Context ctx;
    private final Language language;
    private final Map<Sort, Integer> sizes;
    private final Map<FunctionSymbol, Map<List<Integer>, Integer>> functionTables;
    private final Map<RelationSymbol, Set<List<Integer>>> relationTables;
    private final Model model;
    private final Map<FunctionSymbol, FuncDecl> modelFunctions;
    private final Map<RelationSymbol, FuncDecl> modelRelations;

    /**
     * @param functionTables value of every function on every argument tuple
     * @param relationTables the tuples on which each relation holds
     */
    public FiniteStructure(Context ctx, Language language, Map<Sort, Integer> sizes,
            Map<FunctionSymbol, Map<List<Integer>, Integer>> functionTables,
            Map<RelationSymbol, Set<List<Integer>>> relationTables) {
        this(ctx, language, sizes, functionTables, relationTables, null,
                Collections.<FunctionSymbol, FuncDecl>emptyMap(), Collections.<RelationSymbol, FuncDecl>emptyMap());
    }

    /**
     * Symbols that take an integer argument have no table; they are
     * evaluated in {@code model} through the given declarations, at concrete
     * arguments only.
     */
    public FiniteStructure(Context ctx, Language language, Map<Sort, Integer> sizes,
            Map<FunctionSymbol, Map<List<Integer>, Integer>> functionTables,
            Map<RelationSymbol, Set<List<Integer>>> relationTables, Model model,
            Map<FunctionSymbol, FuncDecl> modelFunctions, Map<RelationSymbol, FuncDecl> modelRelations) {
        this.ctx = ctx;
        this.model = model;
        this.modelFunctions = new HashMap<>(modelFunctions);
        this.modelRelations = new HashMap<>(modelRelations);
        this.language = language;
        this.sizes = new HashMap<>(sizes);
        this.functionTables = new HashMap<>();
        for (Map.Entry<FunctionSymbol, Map<List<Integer>, Integer>> entry : functionTables.entrySet()) {
            this.functionTables.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        this.relationTables = new HashMap<>();
        for (Map.Entry<RelationSymbol, Set<List<Integer>>> entry : relationTables.entrySet()) {
            this.relationTables.put(entry.getKey(), new HashSet<>(entry.getValue()));
        }
    }

    @Override
    public Context getContext() {
        return ctx;
    }

    @Override
    public Language getLanguage() {
        return language;
    }

    public int getSize(Sort sort) {
        Integer size = sizes.get(sort);
        if (size == null) {
            throw new IllegalArgumentException("sort " + sort + " has no finite carrier");
        }
        return size;
    }

    @Override
    public List<Expr> getCarrier(Sort sort) {
        int size = getSize(sort);
        List<Expr> carrier = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            carrier.add(ctx.mkInt(i));
        }
        return carrier;
    }

    public int getFunctionValue(FunctionSymbol symbol, Integer... arguments) {
        Integer value = getFunctionTable(symbol).get(Arrays.asList(arguments));
        if (value == null) {
            throw new IllegalArgumentException(symbol + " undefined on " + Arrays.toString(arguments));
        }
        return value;
    }

    public boolean holds(RelationSymbol symbol, Integer... arguments) {
        return getRelationTable(symbol).contains(Arrays.asList(arguments));
    }

    private Map<List<Integer>, Integer> getFunctionTable(FunctionSymbol symbol) {
        Map<List<Integer>, Integer> table = functionTables.get(symbol);
        if (table == null) {
            throw new IllegalArgumentException("function " + symbol + " not interpreted");
        }
        return table;
    }

    private Set<List<Integer>> getRelationTable(RelationSymbol symbol) {
        Set<List<Integer>> table = relationTables.get(symbol);
        if (table == null) {
            throw new IllegalArgumentException("relation " + symbol + " not interpreted");
        }
        return table;
    }

    @Override
    public Expr interpretFunction(FunctionSymbol symbol, Expr... arguments) {
        if (modelFunctions.containsKey(symbol)) {
            return evaluateInModel(modelFunctions.get(symbol), symbol, arguments);
        }
        Map<List<Integer>, Integer> table = getFunctionTable(symbol);
        List<Integer> concrete = toConcrete(arguments);
        if (concrete != null) {
            return ctx.mkInt(getFunctionValue(symbol, concrete.toArray(new Integer[concrete.size()])));
        }
        // symbolic arguments: case split over the table
        Expr result = null;
        for (Map.Entry<List<Integer>, Integer> entry : table.entrySet()) {
            if (result == null) {
                result = ctx.mkInt(entry.getValue());
            } else {
                result = ctx.mkITE(matches(arguments, entry.getKey()), ctx.mkInt(entry.getValue()), result);
            }
        }
        return result;
    }

    @Override
    public BoolExpr interpretRelation(RelationSymbol symbol, Expr... arguments) {
        if (modelRelations.containsKey(symbol)) {
            return (BoolExpr) evaluateInModel(modelRelations.get(symbol), symbol, arguments);
        }
        Set<List<Integer>> table = getRelationTable(symbol);
        List<Integer> concrete = toConcrete(arguments);
        if (concrete != null) {
            return ctx.mkBool(table.contains(concrete));
        }
        List<BoolExpr> cases = new ArrayList<>();
        for (List<Integer> tuple : table) {
            cases.add(matches(arguments, tuple));
        }
        return cases.isEmpty() ? ctx.mkFalse() : ctx.mkOr(cases.toArray(new BoolExpr[cases.size()]));
    }

    private Expr evaluateInModel(FuncDecl decl, Object symbol, Expr[] arguments) {
        if (toConcrete(arguments) == null) {
            throw new IllegalArgumentException(symbol + " is only interpreted at concrete arguments, not "
                    + Arrays.toString(arguments));
        }
        return model.evaluate(ctx.mkApp(decl, arguments), true);
    }

    private BoolExpr matches(Expr[] arguments, List<Integer> tuple) {
        BoolExpr[] equalities = new BoolExpr[arguments.length];
        for (int i = 0; i < arguments.length; i++) {
            equalities[i] = ctx.mkEq(arguments[i], ctx.mkInt(tuple.get(i)));
        }
        return equalities.length == 0 ? ctx.mkTrue() : ctx.mkAnd(equalities);
    }

    private static List<Integer> toConcrete(Expr[] arguments) {
        List<Integer> values = new ArrayList<>(arguments.length);
        for (Expr argument : arguments) {
            if (!argument.isIntNum()) {
                return null;
            }
            values.add(((IntNum) argument).getInt());
        }
        return values;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Sort sort : language.getSorts()) {
            if (sizes.containsKey(sort)) {
                sb.append("\n  |").append(sort).append("| = ").append(sizes.get(sort));
            }
        }
        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            Map<List<Integer>, Integer> table = functionTables.get(symbol);
            if (table == null) {
                continue;
            }
            List<String> entries = new ArrayList<>();
            for (Map.Entry<List<Integer>, Integer> entry : table.entrySet()) {
                entries.add(Util.join(entry.getKey(), ",") + "->" + entry.getValue());
            }
            Collections.sort(entries);
            sb.append("\n  ").append(symbol).append(": ").append(Util.join(entries, " "));
        }
        for (RelationSymbol symbol : language.getRelationSymbols()) {
            Set<List<Integer>> table = relationTables.get(symbol);
            if (table == null) {
                continue;
            }
            List<String> entries = new ArrayList<>();
            for (List<Integer> tuple : table) {
                entries.add("(" + Util.join(tuple, ",") + ")");
            }
            Collections.sort(entries);
            sb.append("\n  ").append(symbol).append(": ").append(Util.join(entries, " "));
        }
        return sb.append("\n}").toString();
    }
}
