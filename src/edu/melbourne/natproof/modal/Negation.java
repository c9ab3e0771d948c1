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
public final class Negation extends ModalFormula {

    private final ModalFormula formula;

    public Negation(ModalFormula formula) {
        this.formula = formula;
    }

    public ModalFormula getFormula() {
        return formula;
    }

    @Override
    public BoolExpr interpret(Frame frame, Map<Atom, Valuation> valuations, Expr world) {
        return frame.getContext().mkNot(formula.interpret(frame, valuations, world));
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
        return "~" + formula;
    }
}
