/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.smt.Z3Interface;
import edu.melbourne.natproof.synthesis.FormulaTemplate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * All modal formulas over a fixed set of atoms up to a given depth. Every
 * node of a complete binary tree carries an integer choice: one of the atoms
 * or, below the maximal depth, a connective over the children.
 *
 * @author kafle
 */
public class ModalFormulaTemplate implements FormulaTemplate<ModalFormula> {

    private static final AtomicInteger instances = new AtomicInteger(0);

    // connective codes, offset by the number of atoms
    private static final int NEGATION = 0;
    private static final int CONJUNCTION = 1;
    private static final int DISJUNCTION = 2;
    private static final int IMPLICATION = 3;
    private static final int BOX = 4;
    private static final int DIAMOND = 5;
    private static final int CONNECTIVES = 6;

    private final Context ctx;
    private final List<Atom> atoms;
    private final int depth;
    private final Node root;

    public ModalFormulaTemplate(Context ctx, List<Atom> atoms, int depth) {
        if (atoms.isEmpty()) {
            throw new IllegalArgumentException("modal formula template without atoms");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("invalid template depth " + depth);
        }
        this.ctx = ctx;
        this.atoms = new ArrayList<>(atoms);
        this.depth = depth;
        String prefix = "modal" + instances.getAndIncrement() + "!";
        this.root = new Node(prefix, 0, depth);
    }

    public int getDepth() {
        return depth;
    }

    public List<Atom> getAtoms() {
        return new ArrayList<>(atoms);
    }

    @Override
    public BoolExpr getConstraint() {
        List<BoolExpr> constraints = new ArrayList<>();
        root.collectRanges(constraints);
        return Z3Interface.listToBF(ctx, constraints);
    }

    /**
     * Truth of the selected formula at every world of the frame, as a
     * constraint over the choice variables.
     */
    public BoolExpr interpretOnAllWorlds(Frame frame, Map<Atom, Valuation> valuations) {
        List<Expr> worlds = frame.getWorlds();
        Map<Node, BoolExpr[]> cache = new HashMap<>();
        BoolExpr[] values = root.interpret(frame, valuations, worlds, cache);
        List<BoolExpr> all = new ArrayList<>();
        for (BoolExpr value : values) {
            all.add(value);
        }
        return Z3Interface.listToBF(ctx, all);
    }

    @Override
    public ModalFormula getFromSmtModel(Model model) {
        return root.decode(model);
    }

    @Override
    public BoolExpr excludeFromSmtModel(Model model) {
        List<BoolExpr> choices = new ArrayList<>();
        root.collectChoices(model, choices);
        return ctx.mkNot(Z3Interface.listToBF(ctx, choices));
    }

    private class Node {

        private final IntExpr choice;
        private final Node left;
        private final Node right;

        Node(String prefix, int index, int height) {
            this.choice = ctx.mkIntConst(prefix + "c" + index);
            if (height > 0) {
                this.left = new Node(prefix, 2 * index + 1, height - 1);
                this.right = new Node(prefix, 2 * index + 2, height - 1);
            } else {
                this.left = null;
                this.right = null;
            }
        }

        private boolean isLeaf() {
            return left == null;
        }

        private int getNumberOfChoices() {
            return isLeaf() ? atoms.size() : atoms.size() + CONNECTIVES;
        }

        void collectRanges(List<BoolExpr> constraints) {
            constraints.add(ctx.mkLe(ctx.mkInt(0), choice));
            constraints.add(ctx.mkLt(choice, ctx.mkInt(getNumberOfChoices())));
            if (!isLeaf()) {
                left.collectRanges(constraints);
                right.collectRanges(constraints);
            }
        }

        private BoolExpr chosen(int code) {
            return ctx.mkEq(choice, ctx.mkInt(code));
        }

        /**
         * Value of the node at each world, shared between parents.
         */
        BoolExpr[] interpret(Frame frame, Map<Atom, Valuation> valuations, List<Expr> worlds,
                Map<Node, BoolExpr[]> cache) {
            BoolExpr[] cached = cache.get(this);
            if (cached != null) {
                return cached;
            }
            BoolExpr[] leftValues = isLeaf() ? null : left.interpret(frame, valuations, worlds, cache);
            BoolExpr[] rightValues = isLeaf() ? null : right.interpret(frame, valuations, worlds, cache);

            BoolExpr[] values = new BoolExpr[worlds.size()];
            for (int w = 0; w < values.length; w++) {
                Expr world = worlds.get(w);
                BoolExpr value = atoms.get(0).interpret(frame, valuations, world);
                for (int a = 1; a < atoms.size(); a++) {
                    value = (BoolExpr) ctx.mkITE(chosen(a), atoms.get(a).interpret(frame, valuations, world), value);
                }
                if (!isLeaf()) {
                    int base = atoms.size();
                    List<BoolExpr> boxed = new ArrayList<>();
                    List<BoolExpr> diamond = new ArrayList<>();
                    for (int v = 0; v < worlds.size(); v++) {
                        BoolExpr step = frame.transition(world, worlds.get(v));
                        boxed.add(ctx.mkImplies(step, leftValues[v]));
                        diamond.add(ctx.mkAnd(step, leftValues[v]));
                    }
                    value = (BoolExpr) ctx.mkITE(chosen(base + NEGATION), ctx.mkNot(leftValues[w]), value);
                    value = (BoolExpr) ctx.mkITE(chosen(base + CONJUNCTION),
                            ctx.mkAnd(leftValues[w], rightValues[w]), value);
                    value = (BoolExpr) ctx.mkITE(chosen(base + DISJUNCTION),
                            ctx.mkOr(leftValues[w], rightValues[w]), value);
                    value = (BoolExpr) ctx.mkITE(chosen(base + IMPLICATION),
                            ctx.mkImplies(leftValues[w], rightValues[w]), value);
                    value = (BoolExpr) ctx.mkITE(chosen(base + BOX), Z3Interface.listToBF(ctx, boxed), value);
                    value = (BoolExpr) ctx.mkITE(chosen(base + DIAMOND),
                            Z3Interface.listToDisjunction(ctx, diamond), value);
                }
                values[w] = value;
            }
            cache.put(this, values);
            return values;
        }

        ModalFormula decode(Model model) {
            int code = Z3Interface.evalIntInModel(model, choice);
            if (code >= 0 && code < atoms.size()) {
                return atoms.get(code);
            }
            if (isLeaf()) {
                throw new IllegalStateException("choice " + code + " out of range at " + choice);
            }
            switch (code - atoms.size()) {
                case NEGATION:
                    return new Negation(left.decode(model));
                case CONJUNCTION:
                    return new Conjunction(left.decode(model), right.decode(model));
                case DISJUNCTION:
                    return new Disjunction(left.decode(model), right.decode(model));
                case IMPLICATION:
                    return new Implication(left.decode(model), right.decode(model));
                case BOX:
                    return new Modality(left.decode(model));
                case DIAMOND:
                    return new Diamond(left.decode(model));
                default:
                    throw new IllegalStateException("choice " + code + " out of range at " + choice);
            }
        }

        /**
         * Fixes the choices the decoded formula depends on.
         */
        void collectChoices(Model model, List<BoolExpr> choices) {
            int code = Z3Interface.evalIntInModel(model, choice);
            choices.add(chosen(code));
            if (isLeaf() || code < atoms.size()) {
                return;
            }
            int connective = code - atoms.size();
            left.collectChoices(model, choices);
            if (connective == CONJUNCTION || connective == DISJUNCTION || connective == IMPLICATION) {
                right.collectChoices(model, choices);
            }
        }
    }
}
