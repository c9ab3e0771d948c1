/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.apache.log4j.Logger;

/**
 * Lazy stream of ground instances produced by term instantiation. Each call
 * to {@link #next()} advances the enumeration by exactly one new formula; the
 * stream cannot be restarted.
 *
 * @author kafle
 */
public class TermInstantiation implements Iterator<Formula> {

    private static final Logger logger = Logger.getLogger(TermInstantiation.class);

    private final Sort foregroundSort;
    private final List<Formula> formulas;
    private final int depth;

    // both only ever grow; their insertion order decides the next round
    private final LinkedHashSet<Term> groundTerms;
    private final LinkedHashSet<Formula> instantiatedFormulas;

    private int round;
    private int formulaIndex;
    private boolean hasNewFormula;
    private boolean finished;

    // enumeration state of the current formula
    private boolean enumerating;
    private List<Variable> freeVars;
    private List<Term> snapshot;
    private int[] assignment;

    private Formula pending;

    TermInstantiation(Sort foregroundSort, List<Formula> formulas, LinkedHashSet<Term> seeds, int depth) {
        this.foregroundSort = foregroundSort;
        this.formulas = new ArrayList<>(formulas);
        this.depth = depth;
        this.groundTerms = new LinkedHashSet<>(seeds);
        this.instantiatedFormulas = new LinkedHashSet<>();
        this.round = 0;
        this.formulaIndex = 0;
        this.hasNewFormula = false;
        this.finished = depth == 0;
        this.enumerating = false;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public Formula next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Formula result = pending;
        pending = null;
        return result;
    }

    /**
     * Ground terms of the foreground sort discovered so far, in insertion
     * order.
     */
    public List<Term> getGroundTerms() {
        return Collections.unmodifiableList(new ArrayList<>(groundTerms));
    }

    /**
     * Formulas emitted so far, in emission order.
     */
    public List<Formula> getInstantiatedFormulas() {
        return Collections.unmodifiableList(new ArrayList<>(instantiatedFormulas));
    }

    /**
     * Number of completed or current rounds.
     */
    public int getRound() {
        return round;
    }

    private Formula advance() {
        while (!finished) {
            if (!enumerating) {
                if (formulaIndex == formulas.size()) {
                    logger.debug("instantiation round " + round + " done, " + instantiatedFormulas.size()
                            + " formulas, " + groundTerms.size() + " ground terms");
                    if (!hasNewFormula || round + 1 >= depth) {
                        // converged or out of rounds
                        finished = true;
                        return null;
                    }
                    round++;
                    formulaIndex = 0;
                    hasNewFormula = false;
                }
                startEnumeration(formulas.get(formulaIndex));
                if (!enumerating) {
                    formulaIndex++;
                    continue;
                }
            }

            Formula instance = instantiateCurrent();
            stepAssignment();

            boolean fresh = instantiatedFormulas.add(instance);
            groundTerms.addAll(TermInstantiator.getAllGroundTerms(foregroundSort, instance));
            if (fresh) {
                hasNewFormula = true;
                return instance;
            }
        }
        return null;
    }

    private void startEnumeration(Formula formula) {
        freeVars = new ArrayList<>();
        for (Variable var : formula.getFreeVariables()) {
            if (var.getSort().equals(foregroundSort)) {
                freeVars.add(var);
            }
        }
        Collections.sort(freeVars);
        snapshot = new ArrayList<>(groundTerms);
        assignment = new int[freeVars.size()];
        enumerating = freeVars.isEmpty() || !snapshot.isEmpty();
    }

    private Formula instantiateCurrent() {
        Formula formula = formulas.get(formulaIndex);
        if (freeVars.isEmpty()) {
            return formula;
        }
        Map<Variable, Term> substitution = new HashMap<>();
        for (int i = 0; i < freeVars.size(); i++) {
            substitution.put(freeVars.get(i), snapshot.get(assignment[i]));
        }
        return formula.substitute(substitution);
    }

    /**
     * Moves to the next assignment of the cartesian product, last variable
     * fastest; finishes the current formula after the last one.
     */
    private void stepAssignment() {
        for (int i = assignment.length - 1; i >= 0; i--) {
            assignment[i]++;
            if (assignment[i] < snapshot.size()) {
                return;
            }
            assignment[i] = 0;
        }
        enumerating = false;
        formulaIndex++;
    }
}
