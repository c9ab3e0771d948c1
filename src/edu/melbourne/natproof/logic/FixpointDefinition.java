/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Least-fixed-point definition R(x1, ..., xn) := body.
 *
 * @author kafle
 */
public final class FixpointDefinition extends Sentence {

    private final RelationSymbol relation;
    private final List<Variable> variables;
    private final Formula definition;

    public FixpointDefinition(RelationSymbol relation, List<Variable> variables, Formula definition) {
        if (relation.getArity() != variables.size()) {
            throw new IllegalArgumentException("fixpoint definition of " + relation + " binds " + variables.size()
                    + " variables");
        }
        for (Variable var : definition.getFreeVariables()) {
            if (!variables.contains(var)) {
                throw new IllegalArgumentException("free variable " + var + " in fixpoint definition of " + relation);
            }
        }
        this.relation = relation;
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.definition = definition;
    }

    public RelationSymbol getRelation() {
        return relation;
    }

    public List<Variable> getVariables() {
        return variables;
    }

    public Formula getDefinition() {
        return definition;
    }

    /**
     * The body with the defining variables replaced by the given arguments.
     */
    public Formula unfold(List<? extends Term> arguments) {
        Map<Variable, Term> substitution = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            substitution.put(variables.get(i), arguments.get(i));
        }
        return definition.substitute(substitution);
    }

    /**
     * forall x1 ... xn. R(x1, ..., xn) <-> body
     */
    @Override
    public Formula toFormula() {
        Formula result = new Equivalence(new RelationApplication(relation, variables), definition);
        for (int i = variables.size() - 1; i >= 0; i--) {
            result = new UniversalQuantification(variables.get(i), result);
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof FixpointDefinition)) {
            return false;
        }
        FixpointDefinition other = (FixpointDefinition) obj;
        return relation.equals(other.relation) && variables.equals(other.variables)
                && definition.equals(other.definition);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * relation.hashCode() + variables.hashCode()) + definition.hashCode();
    }

    @Override
    public String toString() {
        return "fixpoint " + new RelationApplication(relation, variables) + " = " + definition;
    }
}
