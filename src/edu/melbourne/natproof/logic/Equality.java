/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 *
 * @author kafle
 */
public final class Equality extends Formula {

    private final Term left;
    private final Term right;

    public Equality(Term left, Term right) {
        if (!left.getSort().equals(right.getSort())) {
            throw new IllegalArgumentException("equality between sorts " + left.getSort() + " and " + right.getSort());
        }
        this.left = left;
        this.right = right;
    }

    public Term getLeft() {
        return left;
    }

    public Term getRight() {
        return right;
    }

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        return new Equality(left.substitute(substitution), right.substitute(substitution));
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> vars = new LinkedHashSet<>(left.getFreeVariables());
        vars.addAll(right.getFreeVariables());
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
        if (!(obj instanceof Equality)) {
            return false;
        }
        Equality other = (Equality) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return 31 * left.hashCode() + right.hashCode() + 7;
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
