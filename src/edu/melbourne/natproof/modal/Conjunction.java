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
public final class Conjunction extends BinaryModalFormula {

    public Conjunction(ModalFormula left, ModalFormula right) {
        super(left, right);
    }

    @Override
    String getConnective() {
        return "/\\";
    }

    @Override
    public BoolExpr interpret(Frame frame, Map<Atom, Valuation> valuations, Expr world) {
        return frame.getContext().mkAnd(getLeft().interpret(frame, valuations, world),
                getRight().interpret(frame, valuations, world));
    }
}
