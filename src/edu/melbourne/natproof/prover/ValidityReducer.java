/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Reduces first-order entailment in a theory with fixpoint definitions to
 * unsatisfiability of ground formulas.
 *
 * @author kafle
 */
public class ValidityReducer {

    private static final Logger logger = Logger.getLogger(ValidityReducer.class);

    /**
     * Encodes theory |= goal as the unsatisfiability of the returned stream.
     * Fixpoint definitions enter as equivalences, so a satisfiable sample
     * only means the goal is not proved at this depth.
     *
     * @param goal a closed formula; free variables are universally closed
     */
    public static ValidityEncoding encodeValidity(Theory theory, Sort foregroundSort, Formula goal, int depth) {
        Language language = theory.getLanguage();

        List<Formula> normalizedFormulas = new ArrayList<>();
        for (Formula formula : theory.convertToFOTheory()) {
            SkolemizedFormula skolemized = Skolemizer.skolemize(language, formula);
            language = skolemized.getLanguage();
            normalizedFormulas.add(skolemized.getFormula());
        }

        // theory |= goal iff theory /\ not goal is unsatisfiable
        Formula negatedGoal = new Negation(goal).quantifyAllFreeVariables();
        SkolemizedFormula skolemizedGoal = Skolemizer.skolemize(language, negatedGoal);
        language = skolemizedGoal.getLanguage();
        normalizedFormulas.add(0, skolemizedGoal.getFormula());

        logger.debug("encoded " + normalizedFormulas.size() + " obligations of " + theory + " for goal " + goal);
        return new ValidityEncoding(language,
                TermInstantiator.instantiate(language, foregroundSort, normalizedFormulas, depth));
    }
}
