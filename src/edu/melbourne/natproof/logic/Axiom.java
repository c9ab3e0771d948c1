/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

/**
 *
 * @author kafle
 */
public final class Axiom extends Sentence {

    private final Formula formula;

    public Axiom(Formula formula) {
        this.formula = formula;
    }

    public Formula getFormula() {
        return formula;
    }

    @Override
    public Formula toFormula() {
        return formula;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Axiom && formula.equals(((Axiom) obj).formula);
    }

    @Override
    public int hashCode() {
        return formula.hashCode();
    }

    @Override
    public String toString() {
        return "axiom " + formula;
    }
}
