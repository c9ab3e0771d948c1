/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.ExampleTheories;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.model.FiniteModelTemplate;
import edu.melbourne.natproof.model.FormulaInterpreter;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.Collections;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class LfpProverTest {

    private static final ProofBounds BOUNDS = EscalationSchedule.DEFAULT_INITIAL_BOUNDS;

    private final Variable x = new Variable("x", ExampleTheories.POINTER);

    @Test
    public void listIsSegmentToNilByInduction() {
        LfpProblem problem = ExampleTheories.getProblems().get("list-lseg");
        LfpProofResult result = LfpProver.proveLfp(problem.getTheory(), problem.getForegroundSort(),
                problem.getSublanguage(), problem.getGoal(), BOUNDS, Collections.<Formula>emptyList());
        assertTrue(result.isProved());
        assertTrue(result.getLemmas().isEmpty());
        assertEquals(0, result.getCandidates());
        assertEquals(1, result.getIterations());
    }

    @Test
    public void evenOrOddByInduction() {
        LfpProblem problem = ExampleTheories.getProblems().get("even-odd");
        LfpProofResult result = LfpProver.proveLfp(problem.getTheory(), problem.getForegroundSort(),
                problem.getSublanguage(), problem.getGoal(), BOUNDS, problem.getInitialLemmas());
        assertTrue(result.isProved());
    }

    @Test
    public void initialLemmasAreUsedAndKept() {
        Theory theory = ExampleTheories.list();
        Formula lemma = new UniversalQuantification(x, new Implication(
                new RelationApplication(ExampleTheories.LIST, x),
                new RelationApplication(ExampleTheories.LSEG, x, ExampleTheories.nil())));
        // follows from the lemma without unfolding anything
        Formula goal = new UniversalQuantification(x, new Implication(
                new RelationApplication(ExampleTheories.LIST, ExampleTheories.next(x)),
                new RelationApplication(ExampleTheories.LSEG, ExampleTheories.next(x), ExampleTheories.nil())));
        Language none = theory.getLanguage().getSublanguage(new String[]{"Pointer"}, new String[]{"nil", "next"},
                new String[0]);

        LfpProofResult result = LfpProver.proveLfp(theory, ExampleTheories.POINTER, none, goal, BOUNDS,
                Collections.singletonList(lemma));
        assertTrue(result.isProved());
        assertEquals(Collections.singletonList(lemma), result.getLemmas());
    }

    @Test
    public void noLemmaSynthesisWithoutFixpointRelations() {
        Theory theory = ExampleTheories.singletonList();
        Formula goal = new UniversalQuantification(x, new Implication(
                new RelationApplication(ExampleTheories.LIST, x), new Equality(x, ExampleTheories.nil())));
        Language none = theory.getLanguage().getSublanguage(new String[]{"Pointer"}, new String[]{"nil", "next"},
                new String[0]);

        LfpProofResult result = LfpProver.proveLfp(theory, ExampleTheories.POINTER, none, goal, BOUNDS,
                Collections.<Formula>emptyList());
        assertFalse(result.isProved());
        assertEquals(0, result.getCandidates());
    }

    @Test
    public void acceptedLemmasAreInductive() {
        Theory theory = ExampleTheories.singletonList();
        Formula goal = new UniversalQuantification(x, new Implication(
                new RelationApplication(ExampleTheories.LIST, x), new Equality(x, ExampleTheories.nil())));
        Language sublanguage = theory.getLanguage().getSublanguage(new String[]{"Pointer"},
                new String[]{"nil", "next"}, new String[]{"list"});

        LfpProofResult result = LfpProver.proveLfp(theory, ExampleTheories.POINTER, sublanguage, goal, BOUNDS,
                Collections.<Formula>emptyList());
        assertFalse(result.isProved());
        assertTrue(result.getCandidates() > 0);
        List<Formula> lemmas = result.getLemmas();
        for (Formula lemma : lemmas) {
            Formula obligation = InductionPrinciple.getInductionObligation(theory, lemma);
            assertTrue(lemma.toString(), obligation != null);
            assertTrue(lemma.toString(), NaturalProofChecker.isValid(theory.extendAxioms(lemmas),
                    ExampleTheories.POINTER, obligation, BOUNDS.getNaturalProofDepth()));
            assertHoldsOnFiniteModels(theory, lemma);
        }
    }

    @Test
    public void keyedListIsSegmentToNil() {
        LfpProblem problem = ExampleTheories.getProblems().get("keyed-list-lseg");
        LfpProofResult result = LfpProver.proveLfp(problem.getTheory(), problem.getForegroundSort(),
                problem.getSublanguage(), problem.getGoal(), BOUNDS, Collections.<Formula>emptyList());
        assertTrue(result.isProved());
    }

    @Test
    public void integerSortDoesNotBlockLemmaSynthesis() {
        Theory theory = ExampleTheories.keyedList();
        Formula goal = new UniversalQuantification(x, new Implication(
                new RelationApplication(ExampleTheories.LIST, x), new Equality(x, ExampleTheories.nil())));
        Language sublanguage = theory.getLanguage().getSublanguage(new String[]{"Pointer"},
                new String[]{"nil", "next"}, new String[]{"list"});

        LfpProofResult result = LfpProver.proveLfp(theory, ExampleTheories.POINTER, sublanguage, goal,
                new ProofBounds(1, 0, 0, 4), Collections.<Formula>emptyList());
        assertFalse(result.isProved());
        assertTrue(result.getCandidates() > 0);
        for (Formula lemma : result.getLemmas()) {
            assertHoldsOnFiniteModels(theory, lemma);
        }
    }

    /**
     * The lemma holds on every least-fixpoint model of the theory with up to
     * six cells, beyond the size the counterexample search used.
     */
    private static void assertHoldsOnFiniteModels(Theory theory, Formula lemma) {
        try (Context ctx = new Z3Interface().getContext()) {
            for (int size = 1; size <= 6; size++) {
                FiniteModelTemplate model = new FiniteModelTemplate(ctx, theory,
                        Collections.singletonMap(ExampleTheories.POINTER, size));
                SolverSession session = new Z3Interface().createSession(ctx, "lemma" + size);
                session.add(model.getConstraint());
                session.add(ctx.mkNot(new FormulaInterpreter(model).interpret(lemma)));
                assertEquals(lemma + " on " + size + " cells", Status.UNSATISFIABLE, session.check());
            }
        }
    }
}
