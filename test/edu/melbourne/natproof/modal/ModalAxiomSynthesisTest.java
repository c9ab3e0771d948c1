/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.ExampleTheories;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.model.FiniteModelTemplate;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Witness;
import edu.melbourne.natproof.smt.Z3Interface;
import edu.melbourne.natproof.synthesis.CandidateVerdict;
import edu.melbourne.natproof.synthesis.SynthesisListener;
import edu.melbourne.natproof.synthesis.SynthesisLoop;
import edu.melbourne.natproof.synthesis.SynthesisResult;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.After;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Before;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class ModalAxiomSynthesisTest {

    private static final int FRAME_SIZE = 3;

    private final Atom p = new Atom("p");
    private final Map<Atom, RelationSymbol> atomRelations = Collections.singletonMap(p, ExampleTheories.VALUATION_P);

    private Context ctx;

    @Before
    public void setUp() {
        ctx = new Z3Interface().getContext();
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    /**
     * Checks the formula on all frames of the theory with the given number
     * of worlds and every valuation.
     */
    private boolean validOnFrames(Theory theory, ModalFormula formula) {
        FiniteModelTemplate model = new FiniteModelTemplate(ctx, theory,
                Collections.singletonMap(ExampleTheories.WORLD, FRAME_SIZE));
        StructureFrame frame = new StructureFrame(model, ExampleTheories.WORLD, ExampleTheories.TRANSITION);
        SolverSession session = new Z3Interface().createSession(ctx, "check");
        session.add(model.getConstraint());
        session.add(ctx.mkNot(formula.interpretOnAllWorlds(frame, frame.getValuations(atomRelations))));
        return session.check() == Status.UNSATISFIABLE;
    }

    @Test
    public void firstReflexiveAxiomSeparatesFrames() {
        ModalAxiomSynthesis problem = new ModalAxiomSynthesis(ctx, ExampleTheories.trivial(),
                ExampleTheories.reflexive(), ExampleTheories.WORLD, ExampleTheories.TRANSITION, atomRelations, 2,
                FRAME_SIZE);
        SolverSession synthesizer = new Z3Interface().createSession(ctx, "synthesizer");
        SolverSession verifier = new Z3Interface().createSession(ctx, "verifier");

        SynthesisResult<ModalFormula> result = new SynthesisLoop<>(problem, synthesizer, verifier)
                .run(new SynthesisListener<ModalFormula>() {
                    @Override
                    public boolean onCandidate(ModalFormula candidate, CandidateVerdict verdict) {
                        return verdict == CandidateVerdict.ACCEPTED;
                    }
                });

        assertEquals(1, result.getAccepted().size());
        ModalFormula axiom = result.getAccepted().get(0);
        assertTrue(validOnFrames(ExampleTheories.reflexive(), axiom));
        assertFalse(validOnFrames(ExampleTheories.trivial(), axiom));
    }

    @Test
    public void reflexivityAxiomIsValidOnReflexiveFrames() {
        ModalFormula t = new Implication(new Modality(p), p);
        assertTrue(validOnFrames(ExampleTheories.reflexive(), t));
        assertFalse(validOnFrames(ExampleTheories.trivial(), t));
        assertTrue(validOnFrames(ExampleTheories.transitive(), new Implication(new Modality(p),
                new Modality(new Modality(p)))));
    }

    @Test
    public void templateAgreesWithDecodedFormula() {
        ModalFormulaTemplate template = new ModalFormulaTemplate(ctx, Arrays.asList(p), 2);
        FiniteModelTemplate model = new FiniteModelTemplate(ctx, ExampleTheories.trivial(),
                Collections.singletonMap(ExampleTheories.WORLD, FRAME_SIZE));
        StructureFrame frame = new StructureFrame(model, ExampleTheories.WORLD, ExampleTheories.TRANSITION);
        Map<Atom, Valuation> valuations = frame.getValuations(atomRelations);

        SolverSession session = new Z3Interface().createSession(ctx, "template");
        session.add(template.getConstraint(), model.getConstraint());
        BoolExpr templateValue = template.interpretOnAllWorlds(frame, valuations);

        for (int round = 0; round < 5; round++) {
            Witness witness = session.solve();
            assertTrue(witness.isSatisfiable());
            ModalFormula decoded = template.getFromSmtModel(witness.getModel());
            assertEquals(decoded.toString(),
                    Z3Interface.evalBoolInModel(witness.getModel(), templateValue),
                    Z3Interface.evalBoolInModel(witness.getModel(), decoded.interpretOnAllWorlds(frame, valuations)));

            session.add(template.excludeFromSmtModel(witness.getModel()));
            Witness next = session.solve();
            assertTrue(next.isSatisfiable());
            assertFalse(decoded.equals(template.getFromSmtModel(next.getModel())));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void templateNeedsAtoms() {
        new ModalFormulaTemplate(ctx, Collections.<Atom>emptyList(), 1);
    }
}
