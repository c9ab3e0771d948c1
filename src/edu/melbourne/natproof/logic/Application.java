/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application of a function symbol; nullary applications are constants.
 *
 * @author kafle
 */
public final class Application extends Term {

    private final FunctionSymbol symbol;
    private final List<Term> arguments;
    private final int hash;

    public Application(FunctionSymbol symbol, List<? extends Term> arguments) {
        if (symbol.getArity() != arguments.size()) {
            throw new IllegalArgumentException("function " + symbol + " expects " + symbol.getArity()
                    + " arguments, got " + arguments.size());
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (!arguments.get(i).getSort().equals(symbol.getInputSorts().get(i))) {
                throw new IllegalArgumentException("argument " + arguments.get(i) + " of " + symbol + " has sort "
                        + arguments.get(i).getSort() + ", expected " + symbol.getInputSorts().get(i));
            }
        }
        this.symbol = symbol;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.hash = 31 * symbol.hashCode() + this.arguments.hashCode();
    }

    public Application(FunctionSymbol symbol, Term... arguments) {
        this(symbol, Arrays.asList(arguments));
    }

    public FunctionSymbol getSymbol() {
        return symbol;
    }

    public List<Term> getArguments() {
        return arguments;
    }

    @Override
    public Sort getSort() {
        return symbol.getOutputSort();
    }

    @Override
    public Term substitute(Map<Variable, ? extends Term> substitution) {
        if (arguments.isEmpty()) {
            return this;
        }
        List<Term> newArguments = new ArrayList<>(arguments.size());
        for (Term argument : arguments) {
            newArguments.add(argument.substitute(substitution));
        }
        return new Application(symbol, newArguments);
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> vars = new LinkedHashSet<>();
        for (Term argument : arguments) {
            vars.addAll(argument.getFreeVariables());
        }
        return vars;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Application)) {
            return false;
        }
        Application other = (Application) obj;
        return hash == other.hash && symbol.equals(other.symbol) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(symbol.getName()).append("(");
        for (int i = 0; i < arguments.size(); i++) {
            if (i != 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(")").toString();
    }
}
