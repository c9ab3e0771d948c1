/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.Map;
import java.util.Set;

/**
 * A first-order term. The hierarchy is closed: the only cases are
 * {@link Variable} and {@link Application}.
 *
 * @author kafle
 */
public abstract class Term {

    Term() {
    }

    public abstract Sort getSort();

    /**
     * Simultaneous substitution of variables by terms.
     */
    public abstract Term substitute(Map<Variable, ? extends Term> substitution);

    /**
     * Free variables in left-to-right order of first occurrence.
     */
    public abstract Set<Variable> getFreeVariables();

    public boolean isGround() {
        return getFreeVariables().isEmpty();
    }
}
