/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Diamond: the formula holds at some successor.
 *
 * @author kafle
 */
public final class Diamond extends ModalFormula {

    private final ModalFormula formula;

    public Diamond(ModalFormula formula) {
        this.formula = formula;
    }

    public ModalFormula getFormula() {
        return formula;
    }

    @Override
    public BoolExpr interpret(Frame frame, Map<Atom, Valuation> valuations, Expr world) {
        List<BoolExpr> successors = new ArrayList<>();
        for (Expr next : frame.getWorlds()) {
            successors.add(frame.getContext().mkAnd(frame.transition(world, next),
                    formula.interpret(frame, valuations, next)));
        }
        return frame.getContext().mkOr(successors.toArray(new BoolExpr[successors.size()]));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Diamond && formula.equals(((Diamond) obj).formula);
    }

    @Override
    public int hashCode() {
        return 31 * Diamond.class.hashCode() + formula.hashCode();
    }

    @Override
    public String toString() {
        return "<>" + formula;
    }
}
