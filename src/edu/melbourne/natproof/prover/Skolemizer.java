/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Application;
import edu.melbourne.natproof.logic.BinaryFormula;
import edu.melbourne.natproof.logic.Conjunction;
import edu.melbourne.natproof.logic.Disjunction;
import edu.melbourne.natproof.logic.Equality;
import edu.melbourne.natproof.logic.Equivalence;
import edu.melbourne.natproof.logic.ExistentialQuantification;
import edu.melbourne.natproof.logic.Falsum;
import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Implication;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.Negation;
import edu.melbourne.natproof.logic.Quantification;
import edu.melbourne.natproof.logic.RelationApplication;
import edu.melbourne.natproof.logic.Sort;
import edu.melbourne.natproof.logic.Term;
import edu.melbourne.natproof.logic.UniversalQuantification;
import edu.melbourne.natproof.logic.Variable;
import edu.melbourne.natproof.logic.Verum;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.log4j.Logger;

/**
 * Prenex normalization and Skolemization.
 *
 * @author kafle
 */
public class Skolemizer {

    private static final Logger logger = Logger.getLogger(Skolemizer.class);

    public static final String DEFAULT_VARIABLE_NAME = "x";
    public static final String SKOLEM_PREFIX = "sk";

    /**
     * Pulls every quantifier of the formula to the front.
     *
     * Bound variables are renamed to prefix + index, where the prefix is the
     * longest variable name in the formula, so a renamed variable is strictly
     * longer than any variable already there. Indices are handed out in
     * left-to-right pre-order. Free variables are not renamed.
     */
    public static PrenexForm prenexNormalize(Formula formula) {
        return prenexNormalize(formula, 0, getLongestVariableName(formula));
    }

    public static PrenexForm prenexNormalize(Formula formula, int varIndex, String varPrefix) {
        if (formula instanceof Falsum || formula instanceof Verum
                || formula instanceof RelationApplication || formula instanceof Equality) {
            return new PrenexForm(QuantifierList.empty(), formula);

        } else if (formula instanceof Conjunction || formula instanceof Disjunction) {
            BinaryFormula binary = (BinaryFormula) formula;
            PrenexForm left = prenexNormalize(binary.getLeft(), varIndex, varPrefix);
            PrenexForm right = prenexNormalize(binary.getRight(), varIndex + left.getQuantifiers().size(), varPrefix);
            Formula body = formula instanceof Conjunction
                    ? new Conjunction(left.getBody(), right.getBody())
                    : new Disjunction(left.getBody(), right.getBody());
            return new PrenexForm(left.getQuantifiers().concat(right.getQuantifiers()), body);

        } else if (formula instanceof Negation) {
            PrenexForm inner = prenexNormalize(((Negation) formula).getFormula(), varIndex, varPrefix);
            return new PrenexForm(inner.getQuantifiers().dual(), new Negation(inner.getBody()));

        } else if (formula instanceof Implication) {
            Implication implication = (Implication) formula;
            PrenexForm left = prenexNormalize(implication.getLeft(), varIndex, varPrefix);
            PrenexForm right = prenexNormalize(implication.getRight(), varIndex + left.getQuantifiers().size(), varPrefix);
            return new PrenexForm(left.getQuantifiers().dual().concat(right.getQuantifiers()),
                    new Implication(left.getBody(), right.getBody()));

        } else if (formula instanceof Equivalence) {
            // A <-> B becomes (A -> B) /\ (B -> A), duplicating both sides
            Equivalence equivalence = (Equivalence) formula;
            return prenexNormalize(new Conjunction(
                    new Implication(equivalence.getLeft(), equivalence.getRight()),
                    new Implication(equivalence.getRight(), equivalence.getLeft())),
                    varIndex, varPrefix);

        } else if (formula instanceof UniversalQuantification || formula instanceof ExistentialQuantification) {
            Quantification quantification = (Quantification) formula;
            QuantifierKind kind = formula instanceof UniversalQuantification
                    ? QuantifierKind.UNIVERSAL : QuantifierKind.EXISTENTIAL;
            PrenexForm body = prenexNormalize(quantification.getBody(), varIndex + 1, varPrefix);
            Variable renamed = new Variable(varPrefix + varIndex, quantification.getVariable().getSort());
            Formula renamedBody = body.getBody().substitute(Collections.singletonMap(quantification.getVariable(), renamed));
            return new PrenexForm(body.getQuantifiers().prepend(new QuantifiedVariable(renamed, kind)), renamedBody);
        }

        throw new IllegalStateException("unsupported formula " + formula);
    }

    /**
     * Normalizes the formula to prenex form and replaces every existentially
     * quantified variable by a fresh function applied to all universal
     * variables quantified before it.
     *
     * The returned formula is the quantifier-free body of the resulting
     * universal formula; the returned language contains the Skolem functions.
     */
    public static SkolemizedFormula skolemize(Language language, Formula formula) {
        PrenexForm prenex = prenexNormalize(formula);
        List<Variable> universalVariables = new ArrayList<>();
        Formula body = prenex.getBody();

        for (QuantifiedVariable quantifier : prenex.getQuantifiers()) {
            Variable var = quantifier.getVariable();
            if (quantifier.getKind() == QuantifierKind.UNIVERSAL) {
                universalVariables.add(var);
            } else {
                List<Sort> inputSorts = new ArrayList<>(universalVariables.size());
                for (Variable universal : universalVariables) {
                    inputSorts.add(universal.getSort());
                }
                FunctionSymbol skolemSymbol = new FunctionSymbol(language.getFreshFunctionName(SKOLEM_PREFIX),
                        inputSorts, var.getSort());
                language = language.expandWithFunction(skolemSymbol);
                logger.debug("skolem function " + skolemSymbol + " for " + var);

                Term witness = new Application(skolemSymbol, new ArrayList<Term>(universalVariables));
                body = body.substitute(Collections.singletonMap(var, witness));
            }
        }

        return new SkolemizedFormula(language, body);
    }

    /**
     * Longest variable name occurring in the formula, free or bound; the
     * default name if there is none longer. Ties keep the left-most name.
     */
    public static String getLongestVariableName(Formula formula) {
        if (formula instanceof Falsum || formula instanceof Verum) {
            return DEFAULT_VARIABLE_NAME;

        } else if (formula instanceof RelationApplication) {
            return getLongestVariableName(((RelationApplication) formula).getArguments());

        } else if (formula instanceof Equality) {
            Equality equality = (Equality) formula;
            String left = getLongestVariableName(equality.getLeft());
            String right = getLongestVariableName(equality.getRight());
            return right.length() > left.length() ? right : left;

        } else if (formula instanceof BinaryFormula) {
            BinaryFormula binary = (BinaryFormula) formula;
            String left = getLongestVariableName(binary.getLeft());
            String right = getLongestVariableName(binary.getRight());
            return left.length() >= right.length() ? left : right;

        } else if (formula instanceof Negation) {
            return getLongestVariableName(((Negation) formula).getFormula());

        } else if (formula instanceof Quantification) {
            Quantification quantification = (Quantification) formula;
            String var = quantification.getVariable().getName();
            String body = getLongestVariableName(quantification.getBody());
            return var.length() >= body.length() ? var : body;
        }

        throw new IllegalStateException("unsupported formula " + formula);
    }

    public static String getLongestVariableName(Term term) {
        if (term instanceof Variable) {
            return ((Variable) term).getName();

        } else if (term instanceof Application) {
            return getLongestVariableName(((Application) term).getArguments());
        }

        throw new IllegalStateException("unsupported term " + term);
    }

    private static String getLongestVariableName(List<Term> arguments) {
        String varName = DEFAULT_VARIABLE_NAME;
        for (Term argument : arguments) {
            String name = getLongestVariableName(argument);
            if (name.length() > varName.length()) {
                varName = name;
            }
        }
        return varName;
    }
}
