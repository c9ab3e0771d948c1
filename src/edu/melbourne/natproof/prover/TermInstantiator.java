/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.BinaryFormula;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Falsum;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.Quantification;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.logic.Verum;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Systematic term instantiation over an uninterpreted foreground sort (the
 * "natural proof" step).
 *
 * @author kafle
 */
public class TermInstantiator {

    private static final Logger logger = Logger.getLogger(TermInstantiator.class);

    /**
     * Instantiates the free foreground variables of the given quantifier-free
     * formulas with ground terms, for up to depth rounds. Ground terms of a
     * round are the seeds plus every foreground term seen in earlier
     * instances.
     *
     * Seeds are the constants of the foreground sort in the language, or,
     * if there are none, the ground foreground terms of the formulas.
     *
     * @param formulas quantifier-free, implicitly universally quantified
     * @throws IllegalArgumentException if the foreground sort is
     * interpreted, the depth is negative or there is no seed term
     */
    public static TermInstantiation instantiate(Language language, Sort foregroundSort,
            List<? extends Formula> formulas, int depth) {
        if (!foregroundSort.isUninterpreted()) {
            throw new IllegalArgumentException("foreground sort " + foregroundSort + " is interpreted as "
                    + foregroundSort.getSmtHook());
        }
        if (depth < 0) {
            throw new IllegalArgumentException("invalid depth " + depth);
        }

        LinkedHashSet<Term> seeds = new LinkedHashSet<>();
        for (FunctionSymbol symbol : language.getFunctionSymbols()) {
            if (symbol.getOutputSort().equals(foregroundSort) && symbol.isConstant()) {
                seeds.add(new Application(symbol));
            }
        }
        if (seeds.isEmpty()) {
            for (Formula formula : formulas) {
                seeds.addAll(getAllGroundTerms(foregroundSort, formula));
            }
        }
        if (seeds.isEmpty()) {
            throw new IllegalArgumentException("the given language does not have a ground term of sort "
                    + foregroundSort);
        }

        logger.debug("instantiating " + formulas.size() + " formulas up to depth " + depth + " from seeds " + seeds);
        return new TermInstantiation(foregroundSort, new ArrayList<Formula>(formulas), seeds, depth);
    }

    /**
     * All terms directly under an atom, left to right.
     */
    public static List<Term> getAllTerms(Formula formula) {
        List<Term> terms = new ArrayList<>();
        collectTerms(formula, terms);
        return terms;
    }

    private static void collectTerms(Formula formula, List<Term> terms) {
        if (formula instanceof Falsum || formula instanceof Verum) {
            return;
        } else if (formula instanceof RelationApplication) {
            terms.addAll(((RelationApplication) formula).getArguments());
        } else if (formula instanceof Equality) {
            terms.add(((Equality) formula).getLeft());
            terms.add(((Equality) formula).getRight());
        } else if (formula instanceof BinaryFormula) {
            collectTerms(((BinaryFormula) formula).getLeft(), terms);
            collectTerms(((BinaryFormula) formula).getRight(), terms);
        } else if (formula instanceof Negation) {
            collectTerms(((Negation) formula).getFormula(), terms);
        } else if (formula instanceof Quantification) {
            collectTerms(((Quantification) formula).getBody(), terms);
        } else {
            throw new IllegalStateException("unsupported formula " + formula);
        }
    }

    /**
     * Ground terms of the given sort in the formula; a term comes before its
     * own subterms. Duplicates are kept.
     */
    public static List<Term> getAllGroundTerms(Sort sort, Formula formula) {
        List<Term> groundTerms = new ArrayList<>();
        for (Term term : getAllTerms(formula)) {
            collectGroundTerms(sort, term, groundTerms);
        }
        return groundTerms;
    }

    public static List<Term> getAllGroundTerms(Sort sort, Term term) {
        List<Term> groundTerms = new ArrayList<>();
        collectGroundTerms(sort, term, groundTerms);
        return groundTerms;
    }

    private static void collectGroundTerms(Sort sort, Term term, List<Term> groundTerms) {
        if (term instanceof Variable) {
            return;
        } else if (term instanceof Application) {
            if (term.getSort().equals(sort) && term.isGround()) {
                groundTerms.add(term);
            }
            for (Term argument : ((Application) term).getArguments()) {
                collectGroundTerms(sort, argument, groundTerms);
            }
        } else {
            throw new IllegalStateException("unsupported term " + term);
        }
    }
}
