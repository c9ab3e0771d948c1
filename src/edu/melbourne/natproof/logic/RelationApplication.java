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
 *
 * @author kafle
 */
public final class RelationApplication extends Formula {

    private final RelationSymbol symbol;
    private final List<Term> arguments;

    public RelationApplication(RelationSymbol symbol, List<? extends Term> arguments) {
        if (symbol.getArity() != arguments.size()) {
            throw new IllegalArgumentException("relation " + symbol + " expects " + symbol.getArity()
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
    }

    public RelationApplication(RelationSymbol symbol, Term... arguments) {
        this(symbol, Arrays.asList(arguments));
    }

    public RelationSymbol getSymbol() {
        return symbol;
    }

    public List<Term> getArguments() {
        return arguments;
    }

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        List<Term> newArguments = new ArrayList<>(arguments.size());
        for (Term argument : arguments) {
            newArguments.add(argument.substitute(substitution));
        }
        return new RelationApplication(symbol, newArguments);
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
    public boolean isQuantifierFree() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RelationApplication)) {
            return false;
        }
        RelationApplication other = (RelationApplication) obj;
        return symbol.equals(other.symbol) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return 31 * symbol.hashCode() + arguments.hashCode();
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
