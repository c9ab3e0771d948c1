/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Variable;
import java.util.Arrays;
import java.util.Collections;
import org.junit.After;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import org.junit.Before;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class SmtEncoderTest {

    private final Sort node = new Sort("Node");
    private final RelationSymbol p = new RelationSymbol("P", Arrays.asList(node));
    private final FunctionSymbol f = new FunctionSymbol("f", Arrays.asList(node), node);
    private final FunctionSymbol c = new FunctionSymbol("c", Collections.<Sort>emptyList(), node);
    private final Variable x = new Variable("x", node);

    private Context ctx;
    private SmtEncoder encoder;
    private SolverSession session;

    @Before
    public void setUp() {
        ctx = new Z3Interface().getContext();
        encoder = new SmtEncoder(ctx);
        session = new Z3Interface().createSession(ctx, "encoder");
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    @Test
    public void symbolsAreDeclaredOnce() {
        assertSame(encoder.encodeFunction(f), encoder.encodeFunction(f));
        assertSame(encoder.encodeRelation(p), encoder.encodeRelation(p));
        assertSame(encoder.encodeSort(node), encoder.encodeSort(node));
    }

    @Test
    public void freeVariablesAreUniversallyClosed() {
        Formula tautology = new Disjunction(new RelationApplication(p, x), new Negation(new RelationApplication(p, x)));
        session.add(ctx.mkNot(encoder.encodeFormula(tautology)));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test
    public void openFormulaKeepsVariablesAsConstants() {
        // f(x) = c has a model, its closure forces f constant
        Formula formula = new Equality(new Application(f, x), new Application(c));
        session.add(encoder.encodeOpenFormula(formula));
        session.add(ctx.mkNot(encoder.encodeOpenFormula(new Equality(new Application(f, new Application(c)),
                new Application(c)))));
        assertEquals(Status.SATISFIABLE, session.check());

        session.add(encoder.encodeFormula(formula));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test
    public void intHookedSortIsIntegers() {
        assertEquals(ctx.mkIntSort(), encoder.encodeSort(new Sort("Nat", Sort.INT_HOOK)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownHookIsRejected() {
        encoder.encodeSort(new Sort("Set", "Array"));
    }
}
