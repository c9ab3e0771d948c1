/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.Context;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Z3Interface;
import edu.melbourne.natproof.synthesis.CandidateVerdict;
import edu.melbourne.natproof.synthesis.SynthesisListener;
import edu.melbourne.natproof.synthesis.SynthesisLoop;
import edu.melbourne.natproof.synthesis.SynthesisResult;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Proves goals in the least fixpoint semantics of a theory: natural proofs,
 * induction on the goal, and synthesis of inductive lemmas when both fail.
 *
 * @author kafle
 */
public class LfpProver {

    private static final Logger logger = Logger.getLogger(LfpProver.class);

    /**
     * One attempt with fixed bounds on a context of its own.
     *
     * @param sublanguage symbols lemmas may be built from
     * @param initialLemmas lemmas assumed valid from the start
     */
    public static LfpProofResult proveLfp(Theory theory, Sort foregroundSort, Language sublanguage, Formula goal,
            ProofBounds bounds, List<Formula> initialLemmas) {
        try (Context ctx = new Z3Interface().getContext()) {
            return proveLfp(ctx, theory, foregroundSort, sublanguage, goal, bounds, initialLemmas);
        }
    }

    public static LfpProofResult proveLfp(Context ctx, Theory theory, Sort foregroundSort, Language sublanguage,
            Formula goal, ProofBounds bounds, List<Formula> initialLemmas) {
        final List<Formula> lemmas = new ArrayList<>(initialLemmas);
        logger.info("proving " + goal + " with bounds " + bounds + " and " + lemmas.size() + " lemmas");

        if (proveGoal(ctx, theory, foregroundSort, goal, lemmas, bounds.getNaturalProofDepth())) {
            return new LfpProofResult(true, lemmas, 1, 0);
        }
        if (LemmaTemplate.getPremiseRelations(theory, sublanguage, foregroundSort).isEmpty()) {
            logger.info("no fixpoint relation to synthesize lemmas for in " + sublanguage);
            return new LfpProofResult(false, lemmas, 1, 0);
        }

        LemmaTemplate template = new LemmaTemplate(ctx, theory, sublanguage, foregroundSort,
                bounds.getLemmaFormulaDepth(), bounds.getLemmaTermDepth());
        LemmaSynthesis problem = new LemmaSynthesis(ctx, theory, foregroundSort, template, bounds, lemmas);
        GoalListener listener = new GoalListener(ctx, theory, foregroundSort, goal, lemmas,
                bounds.getNaturalProofDepth());

        Z3Interface z3 = new Z3Interface();
        SolverSession synthesizer = z3.createSession(ctx, "synthesizer");
        SolverSession verifier = z3.createSession(ctx, "verifier");
        SynthesisResult<Formula> result = new SynthesisLoop<>(problem, synthesizer, verifier).run(listener);

        logger.info((listener.proved ? "proved " : "not proved ") + goal + " after " + result.getCandidates()
                + " candidates, " + result.getCounterexamples() + " counterexamples");
        return new LfpProofResult(listener.proved, lemmas, 1, result.getCandidates());
    }

    /**
     * Natural proof of the goal, then of its induction obligation.
     */
    static boolean proveGoal(Context ctx, Theory theory, Sort foregroundSort, Formula goal, List<Formula> lemmas,
            int depth) {
        Theory extended = theory.extendAxioms(lemmas);
        if (NaturalProofChecker.isValid(ctx, extended, foregroundSort, goal, depth)) {
            logger.debug("natural proof of " + goal);
            return true;
        }
        Formula obligation = InductionPrinciple.getInductionObligation(theory, goal);
        if (obligation != null && NaturalProofChecker.isValid(ctx, extended, foregroundSort, obligation, depth)) {
            logger.debug("proof of " + goal + " by induction");
            return true;
        }
        return false;
    }

    /**
     * Records accepted lemmas and stops the synthesis once they prove the
     * goal.
     */
    private static class GoalListener implements SynthesisListener<Formula> {

        private final Context ctx;
        private final Theory theory;
        private final Sort foregroundSort;
        private final Formula goal;
        private final List<Formula> lemmas;
        private final int depth;
        boolean proved;

        GoalListener(Context ctx, Theory theory, Sort foregroundSort, Formula goal, List<Formula> lemmas, int depth) {
            this.ctx = ctx;
            this.theory = theory;
            this.foregroundSort = foregroundSort;
            this.goal = goal;
            this.lemmas = lemmas;
            this.depth = depth;
            this.proved = false;
        }

        @Override
        public boolean onCandidate(Formula candidate, CandidateVerdict verdict) {
            if (verdict != CandidateVerdict.ACCEPTED) {
                return false;
            }
            lemmas.add(candidate);
            proved = proveGoal(ctx, theory, foregroundSort, goal, lemmas, depth);
            return proved;
        }
    }
}
