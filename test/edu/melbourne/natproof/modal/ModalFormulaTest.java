/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.Context;
import edu.melbourne.natproof.ExampleTheories;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.model.FiniteStructure;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
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
public class ModalFormulaTest {

    private final Atom p = new Atom("p");

    private Context ctx;
    private FiniteStructure structure;
    private StructureFrame frame;
    private Map<Atom, Valuation> valuations;

    /**
     * Two worlds, 0 sees 1, p holds at 1 only.
     */
    @Before
    public void setUp() {
        ctx = new Z3Interface().getContext();
        Map<RelationSymbol, Set<List<Integer>>> relations = new HashMap<>();
        relations.put(ExampleTheories.TRANSITION, new HashSet<>(Arrays.asList(Arrays.asList(0, 1))));
        relations.put(ExampleTheories.VALUATION_P, new HashSet<>(Arrays.asList(Arrays.asList(1))));
        structure = new FiniteStructure(ctx, ExampleTheories.trivial().getLanguage(),
                Collections.singletonMap(ExampleTheories.WORLD, 2),
                Collections.<FunctionSymbol, Map<List<Integer>, Integer>>emptyMap(), relations);
        frame = new StructureFrame(structure, ExampleTheories.WORLD, ExampleTheories.TRANSITION);
        valuations = frame.getValuations(Collections.singletonMap(p, ExampleTheories.VALUATION_P));
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    private boolean holdsAt(ModalFormula formula, int world) {
        return formula.interpret(frame, valuations, ctx.mkInt(world)).simplify().isTrue();
    }

    private boolean holdsEverywhere(ModalFormula formula) {
        return formula.interpretOnAllWorlds(frame, valuations).simplify().isTrue();
    }

    @Test
    public void atomsFollowTheValuation() {
        assertFalse(holdsAt(p, 0));
        assertTrue(holdsAt(p, 1));
        assertTrue(holdsAt(new Negation(p), 0));
    }

    @Test
    public void boxQuantifiesOverSuccessors() {
        assertTrue(holdsAt(new Modality(p), 0));
        // no successors
        assertTrue(holdsAt(new Modality(new Negation(p)), 1));
        assertTrue(holdsEverywhere(new Modality(p)));
    }

    @Test
    public void diamondNeedsSuccessor() {
        assertTrue(holdsAt(new Diamond(p), 0));
        assertFalse(holdsAt(new Diamond(p), 1));
        assertFalse(holdsEverywhere(new Diamond(new Disjunction(p, new Negation(p)))));
    }

    @Test
    public void reflexivityAxiomFailsOnIrreflexiveFrame() {
        ModalFormula t = new Implication(new Modality(p), p);
        assertTrue(holdsAt(t, 1));
        assertFalse(holdsAt(t, 0));
        assertFalse(holdsEverywhere(t));
        assertTrue(holdsEverywhere(new Implication(new Conjunction(p, new Modality(p)), p)));
    }

    @Test
    public void formulasPrintInfix() {
        assertEquals("([]p -> p)", new Implication(new Modality(p), p).toString());
        assertEquals("<>~p", new Diamond(new Negation(p)).toString());
    }

    @Test
    public void formulasCompareStructurally() {
        assertEquals(new Modality(new Atom("p")), new Modality(p));
        assertEquals(new Conjunction(p, p).hashCode(), new Conjunction(new Atom("p"), new Atom("p")).hashCode());
        assertFalse(new Conjunction(p, p).equals(new Disjunction(p, p)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void atomWithoutValuationIsRejected() {
        new Atom("q").interpret(frame, valuations, ctx.mkInt(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void transitionMustBeBinary() {
        new StructureFrame(structure, ExampleTheories.WORLD, ExampleTheories.VALUATION_P);
    }
}
