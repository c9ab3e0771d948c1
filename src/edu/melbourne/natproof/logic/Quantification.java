/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Common shape of the two quantifiers.
 *
 * @author kafle
 */
public abstract class Quantification extends Formula {

    private final Variable variable;
    private final Formula body;

    Quantification(Variable variable, Formula body) {
        this.variable = variable;
        this.body = body;
    }

    public Variable getVariable() {
        return variable;
    }

    public Formula getBody() {
        return body;
    }

    abstract String getQuantifierName();

    abstract Quantification rebuild(Variable variable, Formula body);

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        if (!substitution.containsKey(variable)) {
            return rebuild(variable, body.substitute(substitution));
        }
        Map<Variable, Term> pruned = new HashMap<>(substitution);
        pruned.remove(variable);
        return rebuild(variable, body.substitute(pruned));
    }

    @Override
    public Set<Variable> getFreeVariables() {
        Set<Variable> vars = body.getFreeVariables();
        vars.remove(variable);
        return vars;
    }

    @Override
    public boolean isQuantifierFree() {
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Quantification other = (Quantification) obj;
        return variable.equals(other.variable) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return (getClass().hashCode() * 31 + variable.hashCode()) * 31 + body.hashCode();
    }

    @Override
    public String toString() {
        return getQuantifierName() + " " + variable + ": " + variable.getSort() + ". " + body;
    }
}
