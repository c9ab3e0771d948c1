/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.Map;
import java.util.Set;

/**
 *
 * @author kafle
 */
public final class Negation extends Formula {

    private final Formula formula;

    public Negation(Formula formula) {
        this.formula = formula;
    }

    public Formula getFormula() {
        return formula;
    }

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        return new Negation(formula.substitute(substitution));
    }

    @Override
    public Set<Variable> getFreeVariables() {
        return formula.getFreeVariables();
    }

    @Override
    public boolean isQuantifierFree() {
        return formula.isQuantifierFree();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Negation && formula.equals(((Negation) obj).formula);
    }

    @Override
    public int hashCode() {
        return ~formula.hashCode();
    }

    @Override
    public String toString() {
        return "not " + (formula instanceof BinaryFormula || formula instanceof Equality ? "(" + formula + ")" : formula);
    }
}
