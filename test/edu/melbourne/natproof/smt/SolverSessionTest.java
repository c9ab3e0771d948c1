/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Status;
import org.junit.After;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Before;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class SolverSessionTest {

    private Context ctx;
    private SolverSession session;

    @Before
    public void setUp() {
        ctx = new Z3Interface().getContext();
        session = new Z3Interface().createSession(ctx, "test");
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    @Test
    public void closingScopeRetractsAssertions() {
        IntExpr x = ctx.mkIntConst("x");
        session.add(ctx.mkGt(x, ctx.mkInt(0)));
        try (SolverScope scope = session.push()) {
            session.add(ctx.mkLt(x, ctx.mkInt(0)));
            assertEquals(Status.UNSATISFIABLE, session.check());
            assertEquals(1, session.getLevel());
        }
        assertEquals(0, session.getLevel());
        Witness witness = session.solve();
        assertTrue(witness.isSatisfiable());
        assertTrue(Z3Interface.evalIntInModel(witness.getModel(), x) > 0);
        assertEquals(2, session.getNumberOfChecks());
    }

    @Test
    public void closingTwiceIsHarmless() {
        SolverScope scope = session.push();
        session.add(ctx.mkFalse());
        scope.close();
        scope.close();
        assertEquals(0, session.getLevel());
        assertEquals(Status.SATISFIABLE, session.check());
    }

    @Test
    public void outerScopePopsInnerScopes() {
        SolverScope outer = session.push();
        session.push();
        session.add(ctx.mkFalse());
        assertEquals(2, session.getLevel());
        outer.close();
        assertEquals(0, session.getLevel());
        assertEquals(0, session.getNumberOfAssertions());
    }

    @Test(expected = IllegalStateException.class)
    public void innerScopeCannotOutliveOuter() {
        SolverScope outer = session.push();
        SolverScope inner = session.push();
        outer.close();
        inner.close();
    }

    @Test
    public void unsatisfiableWitnessHasNoModel() {
        session.add(ctx.mkFalse());
        Witness witness = session.solve();
        assertTrue(witness.isUnsatisfiable());
        assertEquals(null, witness.getModel());
    }
}
