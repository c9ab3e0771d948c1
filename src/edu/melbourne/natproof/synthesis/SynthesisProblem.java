/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.smt.SolverSession;

/**
 * One instance of counterexample-guided synthesis: what the synthesizer
 * proposes, what the verifier checks, and how each answer feeds back.
 *
 * @param <C> candidate type
 * @author kafle
 */
public interface SynthesisProblem<C> {

    /**
     * Adds the initial constraints: the parameter space and reference
     * structures to the synthesizer, the target structure to the verifier.
     */
    void initialize(SolverSession synthesizer, SolverSession verifier);

    C decodeCandidate(Model synthesizerModel);

    /**
     * Satisfiable on the verifier exactly when the candidate fails on some
     * target structure.
     */
    BoolExpr getCounterexampleQuery(C candidate);

    /**
     * Constraint for the synthesizer: the template has to hold on the
     * counterexample found in the verifier model.
     */
    BoolExpr getRefinement(C candidate, Model verifierModel);

    /**
     * Extra check of a candidate that survived the verifier.
     */
    boolean confirm(C candidate);

    /**
     * Constraint for the synthesizer after the candidate was accepted.
     */
    BoolExpr getAcceptance(C candidate, Model synthesizerModel);

    /**
     * Constraint for the synthesizer after the candidate failed
     * confirmation.
     */
    BoolExpr getRejection(C candidate, Model synthesizerModel);
}
