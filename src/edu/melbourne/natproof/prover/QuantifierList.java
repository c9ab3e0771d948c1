/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable sequence of quantified variables, outermost first.
 *
 * @author kafle
 */
public final class QuantifierList implements Iterable<QuantifiedVariable> {

    private static final QuantifierList EMPTY = new QuantifierList(Collections.<QuantifiedVariable>emptyList());

    private final List<QuantifiedVariable> quantifiers;

    private QuantifierList(List<QuantifiedVariable> quantifiers) {
        this.quantifiers = quantifiers;
    }

    public static QuantifierList empty() {
        return EMPTY;
    }

    public static QuantifierList of(List<QuantifiedVariable> quantifiers) {
        return new QuantifierList(Collections.unmodifiableList(new ArrayList<>(quantifiers)));
    }

    /**
     * Same variables with every quantifier kind dualized.
     */
    public QuantifierList dual() {
        List<QuantifiedVariable> flipped = new ArrayList<>(quantifiers.size());
        for (QuantifiedVariable quantifier : quantifiers) {
            flipped.add(quantifier.dual());
        }
        return of(flipped);
    }

    public QuantifierList concat(QuantifierList other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<QuantifiedVariable> joined = new ArrayList<>(quantifiers);
        joined.addAll(other.quantifiers);
        return of(joined);
    }

    public QuantifierList prepend(QuantifiedVariable quantifier) {
        List<QuantifiedVariable> joined = new ArrayList<>(quantifiers.size() + 1);
        joined.add(quantifier);
        joined.addAll(quantifiers);
        return of(joined);
    }

    public QuantifiedVariable get(int index) {
        return quantifiers.get(index);
    }

    public int size() {
        return quantifiers.size();
    }

    public boolean isEmpty() {
        return quantifiers.isEmpty();
    }

    public List<QuantifiedVariable> asList() {
        return quantifiers;
    }

    @Override
    public Iterator<QuantifiedVariable> iterator() {
        return quantifiers.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof QuantifierList && quantifiers.equals(((QuantifierList) obj).quantifiers);
    }

    @Override
    public int hashCode() {
        return quantifiers.hashCode();
    }

    @Override
    public String toString() {
        return quantifiers.toString();
    }
}
