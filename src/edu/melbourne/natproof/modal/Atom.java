/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import java.util.Map;

/**
 *
 * @author kafle
 */
public final class Atom extends ModalFormula {

    private final String name;

    public Atom(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public BoolExpr interpret(Frame frame, Map<Atom, Valuation> valuations, Expr world) {
        Valuation valuation = valuations.get(this);
        if (valuation == null) {
            throw new IllegalArgumentException("no valuation for atom " + name);
        }
        return valuation.holds(world);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Atom && name.equals(((Atom) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
