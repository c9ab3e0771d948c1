/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A first-order formula. The hierarchy is closed: constructors are package
 * private and the cases are {@link Falsum}, {@link Verum},
 * {@link RelationApplication}, {@link Equality}, {@link Conjunction},
 * {@link Disjunction}, {@link Negation}, {@link Implication},
 * {@link Equivalence}, {@link UniversalQuantification} and
 * {@link ExistentialQuantification}.
 *
 * @author kafle
 */
public abstract class Formula {

    Formula() {
    }

    /**
     * Substitution of free variables. Bound variables are never replaced.
     */
    public abstract Formula substitute(Map<Variable, ? extends Term> substitution);

    /**
     * Free variables in left-to-right order of first occurrence.
     */
    public abstract Set<Variable> getFreeVariables();

    public abstract boolean isQuantifierFree();

    /**
     * Universally closes the formula; the first free variable becomes the
     * outermost quantifier.
     */
    public Formula quantifyAllFreeVariables() {
        List<Variable> vars = new ArrayList<>(getFreeVariables());
        Formula result = this;
        for (int i = vars.size() - 1; i >= 0; i--) {
            result = new UniversalQuantification(vars.get(i), result);
        }
        return result;
    }
}
