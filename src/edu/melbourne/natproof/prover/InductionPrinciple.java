/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Equivalence;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.Falsum;
import edu.melbourne.natproof.logic.FixpointDefinition;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.Theory;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.logic.Verum;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Induction over a least fixpoint. For a lemma forall xs. R(xs) -> psi(xs)
 * with R(ys) := phi(ys), the obligation is forall xs. phi'(xs) -> psi(xs),
 * where phi' is phi with every R(ts) strengthened to R(ts) /\ psi(ts).
 *
 * @author kafle
 */
public class InductionPrinciple {

    /**
     * @return the induction obligation, or null if the lemma is not of the
     * form forall xs. R(xs) -> psi with R a fixpoint relation of the theory
     * applied to distinct variables
     */
    public static Formula getInductionObligation(Theory theory, Formula lemma) {
        List<Variable> quantified = new ArrayList<>();
        Formula body = lemma;
        while (body instanceof UniversalQuantification) {
            UniversalQuantification quantification = (UniversalQuantification) body;
            quantified.add(quantification.getVariable());
            body = quantification.getBody();
        }
        if (!(body instanceof Implication)) {
            return null;
        }
        Implication implication = (Implication) body;
        if (!(implication.getLeft() instanceof RelationApplication)) {
            return null;
        }
        RelationApplication premise = (RelationApplication) implication.getLeft();
        FixpointDefinition definition = theory.getFixpointDefinition(premise.getSymbol());
        if (definition == null) {
            return null;
        }

        List<Variable> parameters = new ArrayList<>();
        Set<Variable> seen = new HashSet<>();
        for (Term argument : premise.getArguments()) {
            if (!(argument instanceof Variable) || !seen.add((Variable) argument)) {
                return null;
            }
            parameters.add((Variable) argument);
        }

        Formula conclusion = implication.getRight();
        Formula unfolded = definition.unfold(parameters);
        Formula strengthened = strengthen(unfolded, premise, parameters, conclusion);

        Formula obligation = new Implication(strengthened, conclusion);
        for (int i = quantified.size() - 1; i >= 0; i--) {
            obligation = new UniversalQuantification(quantified.get(i), obligation);
        }
        return obligation.quantifyAllFreeVariables();
    }

    private static Formula strengthen(Formula formula, RelationApplication premise, List<Variable> parameters,
            Formula conclusion) {
        if (formula instanceof Falsum || formula instanceof Verum || formula instanceof Equality) {
            return formula;

        } else if (formula instanceof RelationApplication) {
            RelationApplication application = (RelationApplication) formula;
            if (!application.getSymbol().equals(premise.getSymbol())) {
                return formula;
            }
            Map<Variable, Term> substitution = new HashMap<>();
            for (int i = 0; i < parameters.size(); i++) {
                substitution.put(parameters.get(i), application.getArguments().get(i));
            }
            return new Conjunction(application, conclusion.substitute(substitution));

        } else if (formula instanceof Conjunction) {
            Conjunction conjunction = (Conjunction) formula;
            return new Conjunction(strengthen(conjunction.getLeft(), premise, parameters, conclusion),
                    strengthen(conjunction.getRight(), premise, parameters, conclusion));

        } else if (formula instanceof Disjunction) {
            Disjunction disjunction = (Disjunction) formula;
            return new Disjunction(strengthen(disjunction.getLeft(), premise, parameters, conclusion),
                    strengthen(disjunction.getRight(), premise, parameters, conclusion));

        } else if (formula instanceof Negation) {
            return new Negation(strengthen(((Negation) formula).getFormula(), premise, parameters, conclusion));

        } else if (formula instanceof Implication) {
            Implication implication = (Implication) formula;
            return new Implication(strengthen(implication.getLeft(), premise, parameters, conclusion),
                    strengthen(implication.getRight(), premise, parameters, conclusion));

        } else if (formula instanceof Equivalence) {
            Equivalence equivalence = (Equivalence) formula;
            return new Equivalence(strengthen(equivalence.getLeft(), premise, parameters, conclusion),
                    strengthen(equivalence.getRight(), premise, parameters, conclusion));

        } else if (formula instanceof UniversalQuantification) {
            UniversalQuantification quantification = (UniversalQuantification) formula;
            return new UniversalQuantification(quantification.getVariable(),
                    strengthen(quantification.getBody(), premise, parameters, conclusion));

        } else if (formula instanceof ExistentialQuantification) {
            ExistentialQuantification quantification = (ExistentialQuantification) formula;
            return new ExistentialQuantification(quantification.getVariable(),
                    strengthen(quantification.getBody(), premise, parameters, conclusion));
        }

        throw new IllegalStateException("unsupported formula " + formula);
    }
}
