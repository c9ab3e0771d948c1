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
 * Common shape of the binary connectives.
 *
 * @author kafle
 */
public abstract class BinaryFormula extends Formula {

    private final Formula left;
    private final Formula right;

    BinaryFormula(Formula left, Formula right) {
        this.left = left;
        this.right = right;
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    abstract String getConnective();

    abstract BinaryFormula rebuild(Formula left, Formula right);

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        return rebuild(left.substitute(substitution), right.substitute(substitution));
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> vars = new LinkedHashSet<>(left.getFreeVariables());
        vars.addAll(right.getFreeVariables());
        return vars;
    }

    @Override
    public boolean isQuantifierFree() {
        return left.isQuantifierFree() && right.isQuantifierFree();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        BinaryFormula other = (BinaryFormula) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return (getClass().hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
    }

    @Override
    public String toString() {
        return "(" + left + " " + getConnective() + " " + right + ")";
    }
}
