/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.model.FiniteModelTemplate;
import edu.melbourne.natproof.model.FiniteStructure;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Z3Interface;
import edu.melbourne.natproof.synthesis.SynthesisLoop;
import edu.melbourne.natproof.synthesis.SynthesisProblem;
import edu.melbourne.natproof.synthesis.SynthesisResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Searches for modal formulas valid on every frame of a goal theory but not
 * on every frame of a reference theory. Frames are finite models of the
 * theories with a fixed number of worlds.
 *
 * @author kafle
 */
public class ModalAxiomSynthesis implements SynthesisProblem<ModalFormula> {

    private static final Logger logger = Logger.getLogger(ModalAxiomSynthesis.class);

    private final Context ctx;
    private final Sort worldSort;
    private final RelationSymbol transition;
    private final Map<Atom, RelationSymbol> atomRelations;
    private final ModalFormulaTemplate template;
    private final FiniteModelTemplate referenceModel;
    private final FiniteModelTemplate goalModel;
    private final StructureFrame referenceFrame;
    private final StructureFrame goalFrame;

    /**
     * @param referenceTheory frames the axioms must not hold on in general
     * @param goalTheory frames the axioms must hold on
     * @param atomRelations unary relation on worlds valuating each atom
     */
    public ModalAxiomSynthesis(Context ctx, Theory referenceTheory, Theory goalTheory, Sort worldSort,
            RelationSymbol transition, Map<Atom, RelationSymbol> atomRelations, int templateDepth, int frameSize) {
        this.ctx = ctx;
        this.worldSort = worldSort;
        this.transition = transition;
        this.atomRelations = new LinkedHashMap<>(atomRelations);
        this.template = new ModalFormulaTemplate(ctx, new ArrayList<>(this.atomRelations.keySet()), templateDepth);
        this.referenceModel = new FiniteModelTemplate(ctx, referenceTheory, Collections.singletonMap(worldSort, frameSize));
        this.goalModel = new FiniteModelTemplate(ctx, goalTheory, Collections.singletonMap(worldSort, frameSize));
        this.referenceFrame = new StructureFrame(referenceModel, worldSort, transition);
        this.goalFrame = new StructureFrame(goalModel, worldSort, transition);
    }

    public ModalFormulaTemplate getTemplate() {
        return template;
    }

    @Override
    public void initialize(SolverSession synthesizer, SolverSession verifier) {
        synthesizer.add(template.getConstraint());
        synthesizer.add(referenceModel.getConstraint());
        // the formula must fail somewhere on the reference frame
        synthesizer.add(ctx.mkNot(template.interpretOnAllWorlds(referenceFrame,
                referenceFrame.getValuations(atomRelations))));
        verifier.add(goalModel.getConstraint());
    }

    @Override
    public ModalFormula decodeCandidate(Model synthesizerModel) {
        return template.getFromSmtModel(synthesizerModel);
    }

    @Override
    public BoolExpr getCounterexampleQuery(ModalFormula candidate) {
        return ctx.mkNot(candidate.interpretOnAllWorlds(goalFrame, goalFrame.getValuations(atomRelations)));
    }

    @Override
    public BoolExpr getRefinement(ModalFormula candidate, Model verifierModel) {
        FiniteStructure counterexample = goalModel.getFromSmtModel(verifierModel);
        logger.debug("frame refuting " + candidate + ": " + counterexample);
        StructureFrame frame = new StructureFrame(counterexample, worldSort, transition);
        return template.interpretOnAllWorlds(frame, frame.getValuations(atomRelations));
    }

    @Override
    public boolean confirm(ModalFormula candidate) {
        return true;
    }

    /**
     * Later candidates must not already follow on reference frames where
     * the accepted axiom holds.
     */
    @Override
    public BoolExpr getAcceptance(ModalFormula candidate, Model synthesizerModel) {
        return candidate.interpretOnAllWorlds(referenceFrame, referenceFrame.getValuations(atomRelations));
    }

    @Override
    public BoolExpr getRejection(ModalFormula candidate, Model synthesizerModel) {
        return template.excludeFromSmtModel(synthesizerModel);
    }

    /**
     * Runs the synthesis on two fresh solvers of the context.
     */
    public List<ModalFormula> synthesize() {
        Z3Interface z3 = new Z3Interface();
        SolverSession synthesizer = z3.createSession(ctx, "synthesizer");
        SolverSession verifier = z3.createSession(ctx, "verifier");
        SynthesisResult<ModalFormula> result = new SynthesisLoop<>(this, synthesizer, verifier).run();
        logger.info("modal axioms: " + result.getAccepted());
        return result.getAccepted();
    }
}
