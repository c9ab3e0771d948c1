/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.smt.SmtEncoder;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.Iterator;
import org.apache.log4j.Logger;

/**
 * Decides the ground formulas of a {@link ValidityEncoding} with Z3.
 *
 * @author kafle
 */
public class NaturalProofChecker {

    private static final Logger logger = Logger.getLogger(NaturalProofChecker.class);

    /**
     * Checks theory |= goal by natural proofs on a context of its own.
     *
     * @return true iff the instantiations up to the depth are unsatisfiable
     */
    public static boolean isValid(Theory theory, Sort foregroundSort, Formula goal, int depth) {
        try (Context ctx = new Z3Interface().getContext()) {
            return isValid(ctx, theory, foregroundSort, goal, depth);
        }
    }

    /**
     * Same as {@link #isValid(Theory, Sort, Formula, int)} on a caller's
     * context. SAT and unknown both mean not proved at this depth.
     */
    public static boolean isValid(Context ctx, Theory theory, Sort foregroundSort, Formula goal, int depth) {
        ValidityEncoding encoding = ValidityReducer.encodeValidity(theory, foregroundSort, goal, depth);
        SmtEncoder encoder = new SmtEncoder(ctx);
        SolverSession session = new Z3Interface().createSession(ctx, "natural-proof");

        int instances = 0;
        Iterator<Formula> formulas = encoding.getFormulas();
        while (formulas.hasNext()) {
            session.add(encoder.encodeFormula(formulas.next()));
            instances++;
        }

        Status status = session.check();
        logger.debug("natural proof of " + goal + " at depth " + depth + ": " + instances + " instances, " + status);
        return status == Status.UNSATISFIABLE;
    }
}
