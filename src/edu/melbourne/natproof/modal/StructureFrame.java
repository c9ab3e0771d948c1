/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.model.Structure;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The frame of a first-order structure: worlds are the elements of one
 * sort, transitions a binary relation on it. Atoms are valued by unary
 * relations of the same structure.
 *
 * @author kafle
 */
public class StructureFrame implements Frame {

    private final Structure structure;
    private final Sort worldSort;
    private final RelationSymbol transition;

    public StructureFrame(Structure structure, Sort worldSort, RelationSymbol transition) {
        if (transition.getArity() != 2 || !transition.getInputSorts().get(0).equals(worldSort)
                || !transition.getInputSorts().get(1).equals(worldSort)) {
            throw new IllegalArgumentException("transition relation " + transition + " is not binary on " + worldSort);
        }
        this.structure = structure;
        this.worldSort = worldSort;
        this.transition = transition;
    }

    @Override
    public Context getContext() {
        return structure.getContext();
    }

    @Override
    public List<Expr> getWorlds() {
        return structure.getCarrier(worldSort);
    }

    @Override
    public BoolExpr transition(Expr from, Expr to) {
        return structure.interpretRelation(transition, from, to);
    }

    /**
     * Valuation of an atom by a unary relation on the worlds.
     */
    public Valuation getValuation(final RelationSymbol relation) {
        if (relation.getArity() != 1 || !relation.getInputSorts().get(0).equals(worldSort)) {
            throw new IllegalArgumentException("valuation relation " + relation + " is not unary on " + worldSort);
        }
        return new Valuation() {
            @Override
            public BoolExpr holds(Expr world) {
                return structure.interpretRelation(relation, world);
            }
        };
    }

    public Map<Atom, Valuation> getValuations(Map<Atom, RelationSymbol> atomRelations) {
        Map<Atom, Valuation> valuations = new HashMap<>();
        for (Map.Entry<Atom, RelationSymbol> entry : atomRelations.entrySet()) {
            valuations.put(entry.getKey(), getValuation(entry.getValue()));
        }
        return valuations;
    }
}
