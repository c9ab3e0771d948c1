/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class FormulaTest {

    private final Sort pointer = new Sort("Pointer");
    private final FunctionSymbol nil = new FunctionSymbol("nil", Collections.<Sort>emptyList(), pointer);
    private final FunctionSymbol next = new FunctionSymbol("next", Arrays.asList(pointer), pointer);
    private final RelationSymbol lseg = new RelationSymbol("lseg", Arrays.asList(pointer, pointer));
    private final Variable x = new Variable("x", pointer);
    private final Variable y = new Variable("y", pointer);

    @Test
    public void freeVariablesInOrderOfFirstOccurrence() {
        Formula formula = new Conjunction(new RelationApplication(lseg, y, x), new Equality(x, new Application(nil)));
        assertEquals(Arrays.asList(y, x), new ArrayList<>(formula.getFreeVariables()));
    }

    @Test
    public void substitutionSkipsBoundVariables() {
        Formula formula = new Conjunction(new RelationApplication(lseg, x, y),
                new UniversalQuantification(x, new Equality(x, y)));
        Formula substituted = formula.substitute(Collections.singletonMap(x, new Application(next, y)));
        Formula expected = new Conjunction(new RelationApplication(lseg, new Application(next, y), y),
                new UniversalQuantification(x, new Equality(x, y)));
        assertEquals(expected, substituted);
    }

    @Test
    public void universalClosureBindsFirstVariableOutermost() {
        Formula closed = new RelationApplication(lseg, x, y).quantifyAllFreeVariables();
        assertTrue(closed instanceof UniversalQuantification);
        assertEquals(x, ((UniversalQuantification) closed).getVariable());
        assertTrue(closed.getFreeVariables().isEmpty());
        assertFalse(closed.isQuantifierFree());
    }

    @Test(expected = IllegalArgumentException.class)
    public void applicationChecksArity() {
        new Application(next, x, y);
    }

    @Test
    public void fixpointDefinitionBecomesClosedEquivalence() {
        FixpointDefinition definition = new FixpointDefinition(lseg, Arrays.asList(x, y),
                new Disjunction(new Equality(x, y), new RelationApplication(lseg, new Application(next, x), y)));
        Formula formula = definition.toFormula();
        assertTrue(formula.getFreeVariables().isEmpty());
        Formula unfolded = definition.unfold(Arrays.asList(y, new Application(nil)));
        assertEquals(new Disjunction(new Equality(y, new Application(nil)),
                new RelationApplication(lseg, new Application(next, y), new Application(nil))), unfolded);
    }
}
