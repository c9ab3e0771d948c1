/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.ExampleTheories;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Axiom;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.FixpointDefinition;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sentence;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Witness;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
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
public class FiniteModelTemplateTest {

    private static final RelationSymbol HAS_KEY = new RelationSymbol("has_key",
            Arrays.asList(ExampleTheories.POINTER, ExampleTheories.INT));

    private Context ctx;
    private SolverSession session;

    @Before
    public void setUp() {
        ctx = new Z3Interface().getContext();
        session = new Z3Interface().createSession(ctx, "model");
    }

    @After
    public void tearDown() {
        ctx.close();
    }

    private FiniteModelTemplate template(Theory theory, int size) {
        return new FiniteModelTemplate(ctx, theory, Collections.singletonMap(ExampleTheories.POINTER, size));
    }

    @Test
    public void cyclicCellIsNotAList() {
        FiniteModelTemplate model = template(ExampleTheories.list(), 3);
        session.add(model.getConstraint());

        // a cell pointing to itself, not nil, in the list relation
        List<BoolExpr> cycles = new ArrayList<>();
        Expr nil = model.interpretFunction(ExampleTheories.NIL);
        for (Expr cell : model.getCarrier(ExampleTheories.POINTER)) {
            cycles.add(ctx.mkAnd(ctx.mkNot(ctx.mkEq(cell, nil)),
                    ctx.mkEq(model.interpretFunction(ExampleTheories.NEXT, cell), cell),
                    model.interpretRelation(ExampleTheories.LIST, cell)));
        }
        session.add(Z3Interface.listToDisjunction(ctx, cycles));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test
    public void acyclicCellIsAList() {
        FiniteModelTemplate model = template(ExampleTheories.list(), 3);
        session.add(model.getConstraint());
        Expr nil = model.interpretFunction(ExampleTheories.NIL);
        Expr cell = ctx.mkInt(2);
        session.add(ctx.mkNot(ctx.mkEq(cell, nil)));
        session.add(ctx.mkEq(model.interpretFunction(ExampleTheories.NEXT, cell), nil));
        session.add(ctx.mkNot(model.interpretRelation(ExampleTheories.LIST, cell)));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test
    public void decodedStructureIsModelOfTheory() {
        Theory theory = ExampleTheories.singletonList();
        FiniteModelTemplate model = template(theory, 4);
        session.add(model.getConstraint());
        Witness witness = session.solve();
        assertTrue(witness.isSatisfiable());

        FiniteStructure structure = model.getFromSmtModel(witness.getModel());
        assertEquals(4, structure.getSize(ExampleTheories.POINTER));
        FormulaInterpreter interpreter = new FormulaInterpreter(structure);
        for (Sentence sentence : theory.getSentences()) {
            assertTrue(sentence.toString(), interpreter.interpret(sentence.toFormula()).simplify().isTrue());
        }

        int nil = structure.getFunctionValue(ExampleTheories.NIL);
        assertTrue(structure.holds(ExampleTheories.LIST, nil));
        int next = structure.getFunctionValue(ExampleTheories.NEXT, nil);
        assertFalse(next == nil);
        assertTrue(structure.holds(ExampleTheories.LIST, next));
    }

    @Test
    public void fixpointOfDecodedStructureIsLeast() {
        Theory theory = ExampleTheories.list();
        FiniteModelTemplate model = template(theory, 3);
        session.add(model.getConstraint());
        Witness witness = session.solve();
        assertTrue(witness.isSatisfiable());

        FiniteStructure structure = model.getFromSmtModel(witness.getModel());
        int nil = structure.getFunctionValue(ExampleTheories.NIL);
        for (int cell = 0; cell < 3; cell++) {
            // list(cell) iff following next from cell reaches nil
            int current = cell;
            boolean reaches = false;
            for (int step = 0; step <= 3 && !reaches; step++) {
                reaches = current == nil;
                current = structure.getFunctionValue(ExampleTheories.NEXT, current);
            }
            assertEquals(reaches, structure.holds(ExampleTheories.LIST, cell));
        }
        for (FixpointDefinition definition : theory.getFixpointDefinitions()) {
            assertTrue(new FormulaInterpreter(structure).interpret(definition.toFormula()).simplify().isTrue());
        }
    }

    @Test
    public void keysAreUnboundedIntegers() {
        // exists n: Int. forall x. key(x) = n
        Variable n = new Variable("n", ExampleTheories.INT);
        Variable x = new Variable("x", ExampleTheories.POINTER);
        Theory keyed = ExampleTheories.keyedList();
        List<Sentence> sentences = new ArrayList<>(keyed.getSentences());
        sentences.add(new Axiom(new ExistentialQuantification(n, new UniversalQuantification(x,
                new Equality(new Application(ExampleTheories.KEY, x), n)))));
        Theory sameKey = new Theory("SAME-KEY", keyed.getLanguage(), sentences);

        FiniteModelTemplate model = template(sameKey, 3);
        session.add(model.getConstraint());
        session.add(ctx.mkEq(model.interpretFunction(ExampleTheories.KEY, ctx.mkInt(0)), ctx.mkInt(42)));
        Witness witness = session.solve();
        assertTrue(witness.isSatisfiable());

        FiniteStructure structure = model.getFromSmtModel(witness.getModel());
        for (int cell = 0; cell < 3; cell++) {
            assertEquals(42, structure.getFunctionValue(ExampleTheories.KEY, cell));
        }
    }

    private Theory keyReachability() {
        // has_key(x, n) = x != nil /\ (key(x) = n \/ has_key(next(x), n))
        Variable x = new Variable("x", ExampleTheories.POINTER);
        Variable n = new Variable("n", ExampleTheories.INT);
        Theory keyed = ExampleTheories.keyedList();
        Language language = new Language(keyed.getLanguage().getSorts(), keyed.getLanguage().getFunctionSymbols(),
                Arrays.asList(HAS_KEY));
        Formula body = new Conjunction(new Negation(new Equality(x, ExampleTheories.nil())),
                new Disjunction(new Equality(new Application(ExampleTheories.KEY, x), n),
                        new RelationApplication(HAS_KEY, ExampleTheories.next(x), n)));
        return new Theory("HAS-KEY", language,
                Collections.singletonList(new FixpointDefinition(HAS_KEY, Arrays.asList(x, n), body)));
    }

    private void addSelfLoopWithKey(FiniteModelTemplate model, int key) {
        Expr cell = ctx.mkInt(1);
        session.add(model.getConstraint());
        session.add(ctx.mkNot(ctx.mkEq(model.interpretFunction(ExampleTheories.NIL), cell)));
        session.add(ctx.mkEq(model.interpretFunction(ExampleTheories.NEXT, cell), cell));
        session.add(ctx.mkEq(model.interpretFunction(ExampleTheories.KEY, cell), ctx.mkInt(key)));
    }

    @Test
    public void fixpointOverIntegersHoldsOnReachableKeys() {
        FiniteModelTemplate model = template(keyReachability(), 2);
        addSelfLoopWithKey(model, 5);
        session.add(ctx.mkNot(model.interpretRelation(HAS_KEY, ctx.mkInt(1), ctx.mkInt(5))));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test
    public void fixpointOverIntegersIsLeast() {
        FiniteModelTemplate model = template(keyReachability(), 2);
        addSelfLoopWithKey(model, 5);
        // only an unfounded cycle through the self loop could justify it
        session.add(model.interpretRelation(HAS_KEY, ctx.mkInt(1), ctx.mkInt(7)));
        assertEquals(Status.UNSATISFIABLE, session.check());
    }

    @Test(expected = IllegalArgumentException.class)
    public void integerSortHasNoCarrier() {
        template(ExampleTheories.keyedList(), 2).getCarrier(ExampleTheories.INT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void onlyIntegersAmongInterpretedSorts() {
        Sort real = new Sort("Real", "Real");
        Language language = new Language(Arrays.asList(ExampleTheories.POINTER, real),
                Arrays.asList(ExampleTheories.NIL), Collections.<RelationSymbol>emptyList());
        template(new Theory("REAL", language, Collections.<Sentence>emptyList()), 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void everySortNeedsSize() {
        new FiniteModelTemplate(ctx, ExampleTheories.list(), Collections.singletonMap(ExampleTheories.WORLD, 2));
    }
}
