/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 *
 * @author kafle
 */
public final class Variable extends Term implements Comparable<Variable> {

    private final String name;
    private final Sort sort;

    public Variable(String name, Sort sort) {
        this.name = Objects.requireNonNull(name);
        this.sort = Objects.requireNonNull(sort);
    }

    public String getName() {
        return name;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Term substitute(Map<Variable, ? extends Term> substitution) {
        Term replacement = substitution.get(this);
        return replacement == null ? this : replacement;
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> vars = new LinkedHashSet<>();
        vars.add(this);
        return vars;
    }

    @Override
    public int compareTo(Variable other) {
        int byName = name.compareTo(other.name);
        if (byName != 0) {
            return byName;
        }
        return sort.getName().compareTo(other.sort.getName());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Variable)) {
            return false;
        }
        Variable other = (Variable) obj;
        return name.equals(other.name) && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sort);
    }

    @Override
    public String toString() {
        return name;
    }
}
