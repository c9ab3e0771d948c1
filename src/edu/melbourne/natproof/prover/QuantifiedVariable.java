/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Variable;
import java.util.Objects;

/**
 * A bound variable together with the kind of its quantifier.
 *
 * @author kafle
 */
public final class QuantifiedVariable {

    private final Variable variable;
    private final QuantifierKind kind;

    public QuantifiedVariable(Variable variable, QuantifierKind kind) {
        this.variable = variable;
        this.kind = kind;
    }

    public Variable getVariable() {
        return variable;
    }

    public QuantifierKind getKind() {
        return kind;
    }

    public QuantifiedVariable dual() {
        return new QuantifiedVariable(variable, kind.dual());
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof QuantifiedVariable)) {
            return false;
        }
        QuantifiedVariable other = (QuantifiedVariable) obj;
        return variable.equals(other.variable) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, kind);
    }

    @Override
    public String toString() {
        return (kind == QuantifierKind.UNIVERSAL ? "forall " : "exists ") + variable;
    }
}
