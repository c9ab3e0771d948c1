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
public final class Falsum extends Formula {

    public Falsum() {
    }

    @Override
    public Formula substitute(Map<Variable, ? extends Term> substitution) {
        return this;
    }

    @Override
    public Set<Variable> getFreeVariables() {
        return new LinkedHashSet<>();
    }

    @Override
    public boolean isQuantifierFree() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Falsum;
    }

    @Override
    public int hashCode() {
        return Falsum.class.hashCode();
    }

    @Override
    public String toString() {
        return "false";
    }
}
