/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.model.FiniteModelTemplate;
import edu.melbourne.natproof.model.FiniteStructure;
import edu.melbourne.natproof.model.FormulaInterpreter;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.synthesis.SynthesisProblem;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Synthesis of inductive lemmas: a candidate has to hold on every finite
 * least fixpoint model of the bounded size, and its induction obligation
 * needs a natural proof from the theory and the lemmas accepted so far.
 *
 * @author kafle
 */
public class LemmaSynthesis implements SynthesisProblem<Formula> {

    private static final Logger logger = Logger.getLogger(LemmaSynthesis.class);

    private final Context ctx;
    private final Theory theory;
    private final Sort foregroundSort;
    private final LemmaTemplate template;
    private final FiniteModelTemplate counterexampleModel;
    private final int naturalProofDepth;
    private final List<Formula> lemmas;

    /**
     * @param lemmas accepted lemmas; read on every confirmation, so lemmas
     * added by the caller are used from then on
     */
    public LemmaSynthesis(Context ctx, Theory theory, Sort foregroundSort, LemmaTemplate template,
            ProofBounds bounds, List<Formula> lemmas) {
        this.ctx = ctx;
        this.theory = theory;
        this.foregroundSort = foregroundSort;
        this.template = template;
        Map<Sort, Integer> sizes = new HashMap<>();
        for (Sort sort : theory.getLanguage().getSorts()) {
            if (sort.isUninterpreted()) {
                sizes.put(sort, bounds.getStructureSizeBound());
            }
        }
        this.counterexampleModel = new FiniteModelTemplate(ctx, theory, sizes);
        this.naturalProofDepth = bounds.getNaturalProofDepth();
        this.lemmas = lemmas;
    }

    @Override
    public void initialize(SolverSession synthesizer, SolverSession verifier) {
        synthesizer.add(template.getConstraint());
        verifier.add(counterexampleModel.getConstraint());
    }

    @Override
    public Formula decodeCandidate(Model synthesizerModel) {
        return template.getFromSmtModel(synthesizerModel);
    }

    @Override
    public BoolExpr getCounterexampleQuery(Formula candidate) {
        return ctx.mkNot(new FormulaInterpreter(counterexampleModel).interpret(candidate));
    }

    @Override
    public BoolExpr getRefinement(Formula candidate, Model verifierModel) {
        FiniteStructure counterexample = counterexampleModel.getFromSmtModel(verifierModel);
        logger.debug("model refuting " + candidate + ": " + counterexample);
        return template.interpret(counterexample);
    }

    @Override
    public boolean confirm(Formula candidate) {
        Formula obligation = InductionPrinciple.getInductionObligation(theory, candidate);
        if (obligation == null) {
            return false;
        }
        return NaturalProofChecker.isValid(ctx, theory.extendAxioms(lemmas), foregroundSort, obligation,
                naturalProofDepth);
    }

    @Override
    public BoolExpr getAcceptance(Formula candidate, Model synthesizerModel) {
        return template.excludeFromSmtModel(synthesizerModel);
    }

    @Override
    public BoolExpr getRejection(Formula candidate, Model synthesizerModel) {
        return template.excludeFromSmtModel(synthesizerModel);
    }
}
