/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.logic.Language;
import java.util.Iterator;

/**
 * The (possibly Skolem-extended) language and the lazy stream of ground
 * formulas whose unsatisfiability implies the encoded entailment.
 *
 * @author kafle
 */
public final class ValidityEncoding {

    private final Language language;
    private final Iterator<Formula> formulas;

    public ValidityEncoding(Language language, Iterator<Formula> formulas) {
        this.language = language;
        this.formulas = formulas;
    }

    public Language getLanguage() {
        return language;
    }

    /**
     * Single pass; a caller that needs the formulas twice has to keep them.
     */
    public Iterator<Formula> getFormulas() {
        return formulas;
    }
}
