/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;

/**
 * A quantifier-free formula, implicitly universally closed, together with
 * the language extended by its Skolem functions.
 *
 * @author kafle
 */
public final class SkolemizedFormula {

    private final Language language;
    private final Formula formula;

    public SkolemizedFormula(Language language, Formula formula) {
        this.language = language;
        this.formula = formula;
    }

    public Language getLanguage() {
        return language;
    }

    public Formula getFormula() {
        return formula;
    }
}
