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
 * A propositional modal formula. The hierarchy is closed: {@link Atom},
 * {@link Negation}, {@link Conjunction}, {@link Disjunction},
 * {@link Implication}, {@link Modality} (box) and {@link Diamond}.
 *
 * @author kafle
 */
public abstract class ModalFormula {

    ModalFormula() {
    }

    /**
     * Truth of the formula at a world of the frame.
     */
    public abstract BoolExpr interpret(Frame frame, Map<Atom, Valuation> valuations, Expr world);

    /**
     * Truth of the formula at every world of the frame.
     */
    public BoolExpr interpretOnAllWorlds(Frame frame, Map<Atom, Valuation> valuations) {
        List<BoolExpr> worlds = new ArrayList<>();
        for (Expr world : frame.getWorlds()) {
            worlds.add(interpret(frame, valuations, world));
        }
        return frame.getContext().mkAnd(worlds.toArray(new BoolExpr[worlds.size()]));
    }
}
