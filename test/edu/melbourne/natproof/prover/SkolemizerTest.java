/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import com.microsoft.z3.Context;
import com.microsoft.z3.Status;
import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Equivalence;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.smt.SmtEncoder;
import edu.melbourne.natproof.smt.SolverSession;
import edu.melbourne.natproof.smt.Z3Interface;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author kafle
 */
public class SkolemizerTest {

    private final Sort pointer = new Sort("Pointer");
    private final FunctionSymbol nil = new FunctionSymbol("nil", Collections.<Sort>emptyList(), pointer);
    private final RelationSymbol r = new RelationSymbol("R", Arrays.asList(pointer, pointer));
    private final RelationSymbol p = new RelationSymbol("P", Arrays.asList(pointer));
    private final Language language = new Language(Arrays.asList(pointer), Arrays.asList(nil), Arrays.asList(r, p));

    private final Variable x = new Variable("x", pointer);
    private final Variable y = new Variable("y", pointer);
    private final Variable node = new Variable("node", pointer);

    private Formula forall(Variable var, Formula body) {
        return new UniversalQuantification(var, body);
    }

    private Formula exists(Variable var, Formula body) {
        return new ExistentialQuantification(var, body);
    }

    @Test
    public void freshNamesAreLongerThanExistingOnes() {
        // free variable "node" is the longest name
        Formula formula = new Conjunction(forall(x, new RelationApplication(r, x, node)),
                exists(y, new RelationApplication(p, y)));
        PrenexForm prenex = Skolemizer.prenexNormalize(formula);

        assertEquals(2, prenex.getQuantifiers().size());
        for (QuantifiedVariable quantifier : prenex.getQuantifiers()) {
            assertTrue(quantifier.getVariable().getName().length() > "node".length());
        }
        assertEquals("node0", prenex.getQuantifiers().get(0).getVariable().getName());
        assertEquals("node1", prenex.getQuantifiers().get(1).getVariable().getName());
        assertEquals(QuantifierKind.UNIVERSAL, prenex.getQuantifiers().get(0).getKind());
        assertEquals(QuantifierKind.EXISTENTIAL, prenex.getQuantifiers().get(1).getKind());
        // the free variable is not renamed
        assertTrue(prenex.getBody().getFreeVariables().contains(node));
    }

    @Test
    public void normalizationIsDeterministic() {
        Formula formula = forall(x, exists(y, new Implication(new RelationApplication(r, x, y),
                forall(x, new RelationApplication(p, x)))));
        assertEquals(Skolemizer.prenexNormalize(formula).toString(), Skolemizer.prenexNormalize(formula).toString());
        assertEquals(Skolemizer.prenexNormalize(formula).getQuantifiers(),
                Skolemizer.prenexNormalize(formula).getQuantifiers());
    }

    @Test
    public void implicationDualizesOnlyTheLeftSide() {
        Formula left = forall(x, exists(y, new RelationApplication(r, x, y)));
        Formula right = exists(x, new RelationApplication(p, x));
        PrenexForm leftPrenex = Skolemizer.prenexNormalize(left);
        PrenexForm prenex = Skolemizer.prenexNormalize(new Implication(left, right));

        assertEquals(3, prenex.getQuantifiers().size());
        for (int i = 0; i < leftPrenex.getQuantifiers().size(); i++) {
            assertEquals(leftPrenex.getQuantifiers().get(i).getKind().dual(), prenex.getQuantifiers().get(i).getKind());
        }
        assertEquals(QuantifierKind.EXISTENTIAL, prenex.getQuantifiers().get(2).getKind());
    }

    @Test
    public void negationDualizesEveryQuantifier() {
        PrenexForm prenex = Skolemizer.prenexNormalize(new Negation(forall(x, exists(y, new RelationApplication(r, x, y)))));
        assertEquals(QuantifierKind.EXISTENTIAL, prenex.getQuantifiers().get(0).getKind());
        assertEquals(QuantifierKind.UNIVERSAL, prenex.getQuantifiers().get(1).getKind());
        assertTrue(prenex.getBody().isQuantifierFree());
    }

    @Test
    public void quantifierFreeConjunctionIsUnchanged() {
        Formula formula = new Conjunction(new RelationApplication(r, x, y), new Equality(x, new Application(nil)));
        PrenexForm prenex = Skolemizer.prenexNormalize(formula);
        assertTrue(prenex.getQuantifiers().isEmpty());
        assertEquals(formula, prenex.getBody());
    }

    @Test
    public void equivalenceIsSplitIntoTwoImplications() {
        Formula formula = new Equivalence(forall(x, new RelationApplication(p, x)), new RelationApplication(p, y));
        PrenexForm prenex = Skolemizer.prenexNormalize(formula);
        // the quantified side occurs once on each side of the split
        assertEquals(2, prenex.getQuantifiers().size());
        assertEquals(QuantifierKind.EXISTENTIAL, prenex.getQuantifiers().get(0).getKind());
        assertEquals(QuantifierKind.UNIVERSAL, prenex.getQuantifiers().get(1).getKind());
        assertTrue(prenex.getBody() instanceof Conjunction);
    }

    @Test
    public void skolemFunctionTakesPrecedingUniversals() {
        Formula formula = forall(x, exists(y, new RelationApplication(r, x, y)));
        SkolemizedFormula skolemized = Skolemizer.skolemize(language, formula);

        FunctionSymbol sk = skolemized.getLanguage().getFunctionSymbol("sk0");
        assertEquals(Arrays.asList(pointer), sk.getInputSorts());
        assertEquals(pointer, sk.getOutputSort());

        Variable x0 = new Variable("x0", pointer);
        assertEquals(new RelationApplication(r, x0, new Application(sk, x0)), skolemized.getFormula());
        // the input language is not modified
        assertTrue(!language.hasName("sk0"));
    }

    @Test
    public void leadingExistentialBecomesConstant() {
        Formula formula = exists(x, forall(y, new RelationApplication(r, x, y)));
        SkolemizedFormula skolemized = Skolemizer.skolemize(language, formula);
        FunctionSymbol sk = skolemized.getLanguage().getFunctionSymbol("sk0");
        assertTrue(sk.isConstant());
        assertEquals(new RelationApplication(r, new Application(sk), new Variable("x1", pointer)),
                skolemized.getFormula());
    }

    private static Status check(Context ctx, Formula formula) {
        SolverSession session = new Z3Interface().createSession(ctx, "skolem");
        session.add(new SmtEncoder(ctx).encodeFormula(formula));
        return session.check();
    }

    @Test
    public void skolemizationPreservesSatisfiability() {
        Map<Formula, Status> expected = new LinkedHashMap<>();
        expected.put(forall(x, exists(y, new Conjunction(new RelationApplication(r, x, y),
                new Negation(new RelationApplication(r, x, x))))), Status.SATISFIABLE);
        expected.put(exists(x, new Conjunction(new RelationApplication(p, x),
                forall(y, new RelationApplication(r, x, y)))), Status.SATISFIABLE);
        expected.put(new Conjunction(forall(x, exists(y, new RelationApplication(r, x, y))),
                exists(x, forall(y, new Negation(new RelationApplication(r, x, y))))), Status.UNSATISFIABLE);
        expected.put(exists(x, forall(y, new Conjunction(new RelationApplication(r, x, y),
                new Negation(new RelationApplication(r, y, x))))), Status.UNSATISFIABLE);

        try (Context ctx = new Z3Interface().getContext()) {
            for (Map.Entry<Formula, Status> entry : expected.entrySet()) {
                Formula skolemized = Skolemizer.skolemize(language, entry.getKey()).getFormula();
                assertEquals(entry.getKey().toString(), entry.getValue(), check(ctx, entry.getKey()));
                // free variables of the body are closed universally
                assertEquals(skolemized.toString(), entry.getValue(), check(ctx, skolemized));
            }
        }
    }
}
