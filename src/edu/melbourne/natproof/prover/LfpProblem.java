/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A goal to prove in the least fixpoint semantics of a theory, with the
 * sublanguage lemmas may be built from.
 *
 * @author kafle
 */
public final class LfpProblem {

    private final String name;
    private final Theory theory;
    private final Sort foregroundSort;
    private final Language sublanguage;
    private final Formula goal;
    private final List<Formula> initialLemmas;

    public LfpProblem(String name, Theory theory, Sort foregroundSort, Language sublanguage, Formula goal) {
        this(name, theory, foregroundSort, sublanguage, goal, Collections.<Formula>emptyList());
    }

    public LfpProblem(String name, Theory theory, Sort foregroundSort, Language sublanguage, Formula goal,
            List<Formula> initialLemmas) {
        this.name = name;
        this.theory = theory;
        this.foregroundSort = foregroundSort;
        this.sublanguage = sublanguage;
        this.goal = goal;
        this.initialLemmas = Collections.unmodifiableList(new ArrayList<>(initialLemmas));
    }

    public String getName() {
        return name;
    }

    public Theory getTheory() {
        return theory;
    }

    public Sort getForegroundSort() {
        return foregroundSort;
    }

    public Language getSublanguage() {
        return sublanguage;
    }

    public Formula getGoal() {
        return goal;
    }

    public List<Formula> getInitialLemmas() {
        return initialLemmas;
    }

    @Override
    public String toString() {
        return name + ": " + goal;
    }
}
