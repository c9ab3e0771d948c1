/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;

/**
 * Result of prenex normalization: the quantifier prefix and the
 * quantifier-free matrix.
 *
 * @author kafle
 */
public final class PrenexForm {

    private final QuantifierList quantifiers;
    private final Formula body;

    public PrenexForm(QuantifierList quantifiers, Formula body) {
        this.quantifiers = quantifiers;
        this.body = body;
    }

    public QuantifierList getQuantifiers() {
        return quantifiers;
    }

    public Formula getBody() {
        return body;
    }

    @Override
    public String toString() {
        return quantifiers + " " + body;
    }
}
