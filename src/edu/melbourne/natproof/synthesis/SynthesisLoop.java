/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

import com.microsoft.z3.Model;
import edu.melbourne.natproof.smt.SolverScope;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Witness;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Counterexample-guided inductive synthesis over two solver sessions: the
 * synthesizer proposes candidates, the verifier looks for structures that
 * falsify them.
 *
 * @author kafle
 */
public class SynthesisLoop<C> {

    private static final Logger logger = Logger.getLogger(SynthesisLoop.class);

    private final SynthesisProblem<C> problem;
    private final SolverSession synthesizer;
    private final SolverSession verifier;

    public SynthesisLoop(SynthesisProblem<C> problem, SolverSession synthesizer, SolverSession verifier) {
        this.problem = problem;
        this.synthesizer = synthesizer;
        this.verifier = verifier;
    }

    public SynthesisResult<C> run() {
        return run(null);
    }

    /**
     * Runs until the synthesizer has no candidate left or the listener asks
     * to stop. The order of candidates is whatever the synthesizer's models
     * give.
     *
     * @param listener may be null
     */
    public SynthesisResult<C> run(SynthesisListener<C> listener) {
        problem.initialize(synthesizer, verifier);

        List<C> accepted = new ArrayList<>();
        int candidates = 0;
        int counterexamples = 0;

        while (true) {
            Witness proposal = synthesizer.solve();
            if (!proposal.isSatisfiable()) {
                logger.info("synthesizer exhausted after " + candidates + " candidates (" + proposal.getStatus() + ")");
                return new SynthesisResult<>(accepted, true, candidates, counterexamples);
            }
            Model synthesizerModel = proposal.getModel();
            C candidate = problem.decodeCandidate(synthesizerModel);
            candidates++;
            logger.debug("candidate #" + candidates + ": " + candidate);

            CandidateVerdict verdict;
            try (SolverScope scope = verifier.push()) {
                verifier.add(problem.getCounterexampleQuery(candidate));
                Witness counterexample = verifier.solve();

                if (counterexample.isSatisfiable()) {
                    Model verifierModel = counterexample.getModel();
                    scope.close();
                    synthesizer.add(problem.getRefinement(candidate, verifierModel));
                    counterexamples++;
                    verdict = CandidateVerdict.REFUTED;
                } else {
                    scope.close();
                    if (counterexample.isUnsatisfiable() && problem.confirm(candidate)) {
                        accepted.add(candidate);
                        synthesizer.add(problem.getAcceptance(candidate, synthesizerModel));
                        verdict = CandidateVerdict.ACCEPTED;
                    } else {
                        synthesizer.add(problem.getRejection(candidate, synthesizerModel));
                        verdict = CandidateVerdict.REJECTED;
                    }
                }
            }

            logger.info(candidate + " ... " + verdict);
            if (listener != null && listener.onCandidate(candidate, verdict)) {
                logger.info("synthesis stopped after " + candidates + " candidates");
                return new SynthesisResult<>(accepted, false, candidates, counterexamples);
            }
        }
    }
}
