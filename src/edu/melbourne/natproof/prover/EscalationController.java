/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Retries {@link LfpProver} with growing bounds. Lemmas accepted in one
 * iteration seed the next.
 *
 * @author kafle
 */
public class EscalationController {

    private static final Logger logger = Logger.getLogger(EscalationController.class);
    private static final int UNBOUNDED = -1;

    private final EscalationSchedule schedule;

    public EscalationController() {
        this(EscalationSchedule.defaultSchedule());
    }

    public EscalationController(EscalationSchedule schedule) {
        this.schedule = schedule;
    }

    /**
     * Runs until the goal is proved; does not return otherwise.
     */
    public LfpProofResult prove(LfpProblem problem) {
        return run(problem, UNBOUNDED);
    }

    /**
     * @return the proof with its lemmas, or a failed result with the lemmas
     * accepted so far after maxIterations attempts
     * @throws IllegalArgumentException if maxIterations is negative
     */
    public LfpProofResult prove(LfpProblem problem, int maxIterations) {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("negative iteration limit " + maxIterations);
        }
        return run(problem, maxIterations);
    }

    private LfpProofResult run(LfpProblem problem, int maxIterations) {
        List<Formula> lemmas = problem.getInitialLemmas();
        int candidates = 0;
        int iteration = 0;

        while (maxIterations == UNBOUNDED || iteration < maxIterations) {
            ProofBounds bounds = schedule.getBounds(iteration);
            logger.info("iteration " + iteration + ": bounds = " + bounds);

            LfpProofResult result = LfpProver.proveLfp(problem.getTheory(), problem.getForegroundSort(),
                    problem.getSublanguage(), problem.getGoal(), bounds, lemmas);
            candidates += result.getCandidates();
            lemmas = result.getLemmas();
            iteration++;

            if (result.isProved()) {
                logger.info(problem.getName() + " proved in iteration " + (iteration - 1) + " with lemmas " + lemmas);
                return new LfpProofResult(true, lemmas, iteration, candidates);
            }
        }

        logger.info(problem.getName() + " not proved within " + maxIterations + " iterations");
        return new LfpProofResult(false, lemmas, iteration, candidates);
    }
}
