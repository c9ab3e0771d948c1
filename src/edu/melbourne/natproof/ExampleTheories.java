/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof;

import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.Axiom;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.FixpointDefinition;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sentence;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.prover.LfpProblem;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Theories of linked lists and of modal frames, and the proof problems run
 * from the command line.
 *
 * @author kafle
 */
public class ExampleTheories {

    public static final Sort POINTER = new Sort("Pointer");
    public static final FunctionSymbol NIL = new FunctionSymbol("nil", Collections.<Sort>emptyList(), POINTER);
    public static final FunctionSymbol NEXT = new FunctionSymbol("next", Arrays.asList(POINTER), POINTER);
    public static final RelationSymbol LIST = new RelationSymbol("list", Arrays.asList(POINTER));
    public static final RelationSymbol LSEG = new RelationSymbol("lseg", Arrays.asList(POINTER, POINTER));
    public static final RelationSymbol EVEN_LIST = new RelationSymbol("even_list", Arrays.asList(POINTER));
    public static final RelationSymbol ODD_LIST = new RelationSymbol("odd_list", Arrays.asList(POINTER));
    public static final Sort INT = new Sort("Int", Sort.INT_HOOK);
    public static final FunctionSymbol KEY = new FunctionSymbol("key", Arrays.asList(POINTER), INT);

    public static final Sort WORLD = new Sort("W");
    public static final RelationSymbol TRANSITION = new RelationSymbol("R", Arrays.asList(WORLD, WORLD));
    public static final RelationSymbol VALUATION_P = new RelationSymbol("P", Arrays.asList(WORLD));

    private static final Variable X = new Variable("x", POINTER);
    private static final Variable Y = new Variable("y", POINTER);
    private static final Variable U = new Variable("x", WORLD);
    private static final Variable V = new Variable("y", WORLD);
    private static final Variable W = new Variable("z", WORLD);

    public static Term nil() {
        return new Application(NIL);
    }

    public static Term next(Term term) {
        return new Application(NEXT, term);
    }

    private static FixpointDefinition listDefinition() {
        // list(x) = x = nil \/ list(next(x))
        return new FixpointDefinition(LIST, Arrays.asList(X),
                new Disjunction(new Equality(X, nil()), new RelationApplication(LIST, next(X))));
    }

    private static FixpointDefinition lsegDefinition() {
        // lseg(x, y) = x = y \/ lseg(next(x), y)
        return new FixpointDefinition(LSEG, Arrays.asList(X, Y),
                new Disjunction(new Equality(X, Y), new RelationApplication(LSEG, next(X), Y)));
    }

    /**
     * Lists of at most one cell: every cell points to nil, nil does not.
     */
    public static Theory singletonList() {
        Language language = new Language(Arrays.asList(POINTER), Arrays.asList(NIL, NEXT), Arrays.asList(LIST));
        List<Sentence> sentences = new ArrayList<>();
        sentences.add(listDefinition());
        sentences.add(new Axiom(new UniversalQuantification(X,
                new Disjunction(new Equality(X, nil()), new Equality(next(X), nil())))));
        sentences.add(new Axiom(new Negation(new Equality(next(nil()), nil()))));
        return new Theory("SINGLETON-LIST", language, sentences);
    }

    public static Theory list() {
        Language language = new Language(Arrays.asList(POINTER), Arrays.asList(NIL, NEXT),
                Arrays.asList(LIST, LSEG));
        return new Theory("LIST", language, Arrays.asList(listDefinition(), lsegDefinition()));
    }

    /**
     * Lists whose cells carry integer keys.
     */
    public static Theory keyedList() {
        Language language = new Language(Arrays.asList(POINTER, INT), Arrays.asList(NIL, NEXT, KEY),
                Arrays.asList(LIST, LSEG));
        return new Theory("KEYED-LIST", language, Arrays.asList(listDefinition(), lsegDefinition()));
    }

    public static Theory evenOdd() {
        Language language = new Language(Arrays.asList(POINTER), Arrays.asList(NIL, NEXT),
                Arrays.asList(LIST, LSEG, EVEN_LIST, ODD_LIST));
        List<Sentence> sentences = new ArrayList<>(list().getSentences());
        // odd_list(x) = x != nil /\ even_list(next(x))
        sentences.add(new FixpointDefinition(ODD_LIST, Arrays.asList(X),
                new Conjunction(new Negation(new Equality(X, nil())), new RelationApplication(EVEN_LIST, next(X)))));
        // even_list(x) = x = nil \/ odd_list(next(x))
        sentences.add(new FixpointDefinition(EVEN_LIST, Arrays.asList(X),
                new Disjunction(new Equality(X, nil()), new RelationApplication(ODD_LIST, next(X)))));
        return new Theory("EVEN-ODD", language, sentences);
    }

    private static Language frameLanguage() {
        return new Language(Arrays.asList(WORLD), Collections.<FunctionSymbol>emptyList(),
                Arrays.asList(TRANSITION, VALUATION_P));
    }

    private static Formula step(Variable from, Variable to) {
        return new RelationApplication(TRANSITION, from, to);
    }

    private static Theory frameTheory(String name, Formula... axioms) {
        List<Sentence> sentences = new ArrayList<>();
        for (Formula axiom : axioms) {
            sentences.add(new Axiom(axiom.quantifyAllFreeVariables()));
        }
        return new Theory(name, frameLanguage(), sentences);
    }

    /**
     * All frames.
     */
    public static Theory trivial() {
        return frameTheory("TRIVIAL");
    }

    public static Theory reflexive() {
        return frameTheory("REFLEXIVE", step(U, U));
    }

    public static Theory transitive() {
        return frameTheory("TRANSITIVE", new Implication(new Conjunction(step(U, V), step(V, W)), step(U, W)));
    }

    public static Theory symmetric() {
        return frameTheory("SYMMETRIC", new Implication(step(U, V), step(V, U)));
    }

    public static Theory euclidean() {
        return frameTheory("EUCLIDEAN", new Implication(new Conjunction(step(U, V), step(U, W)),
                new Conjunction(step(V, W), step(W, V))));
    }

    /**
     * Frame theories by name, for modal axiom synthesis against
     * {@link #trivial()}.
     */
    public static Map<String, Theory> getFrameTheories() {
        Map<String, Theory> theories = new LinkedHashMap<>();
        theories.put("reflexive", reflexive());
        theories.put("transitive", transitive());
        theories.put("symmetric", symmetric());
        theories.put("euclidean", euclidean());
        return theories;
    }

    private static Language pointerSublanguage(Theory theory, String... relations) {
        return theory.getLanguage().getSublanguage(new String[]{"Pointer"}, new String[]{"nil", "next"}, relations);
    }

    /**
     * Proof problems by name.
     */
    public static Map<String, LfpProblem> getProblems() {
        Map<String, LfpProblem> problems = new LinkedHashMap<>();

        Theory singleton = singletonList();
        problems.put("singleton-list", new LfpProblem("singleton-list", singleton, POINTER,
                pointerSublanguage(singleton, "list"),
                new UniversalQuantification(X, new Implication(new RelationApplication(LIST, X),
                        new Negation(new Equality(next(X), X))))));

        Theory list = list();
        problems.put("list-lseg", new LfpProblem("list-lseg", list, POINTER, pointerSublanguage(list, "list", "lseg"),
                new UniversalQuantification(X, new Implication(new RelationApplication(LIST, X),
                        new RelationApplication(LSEG, X, nil())))));
        problems.put("lseg-list", new LfpProblem("lseg-list", list, POINTER, pointerSublanguage(list, "list", "lseg"),
                new UniversalQuantification(X, new Implication(new RelationApplication(LSEG, X, nil()),
                        new RelationApplication(LIST, X)))));

        Theory keyed = keyedList();
        problems.put("keyed-list-lseg", new LfpProblem("keyed-list-lseg", keyed, POINTER,
                pointerSublanguage(keyed, "list", "lseg"),
                new UniversalQuantification(X, new Implication(new RelationApplication(LIST, X),
                        new RelationApplication(LSEG, X, nil())))));

        Theory evenOdd = evenOdd();
        problems.put("even-odd", new LfpProblem("even-odd", evenOdd, POINTER,
                pointerSublanguage(evenOdd, "list", "even_list", "odd_list"),
                new UniversalQuantification(X, new Implication(new RelationApplication(LIST, X),
                        new Disjunction(new RelationApplication(EVEN_LIST, X),
                                new RelationApplication(ODD_LIST, X))))));
        return problems;
    }
}
