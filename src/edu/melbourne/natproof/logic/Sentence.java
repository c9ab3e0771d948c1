/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

/**
 * A sentence of a theory: an {@link Axiom} or a {@link FixpointDefinition}.
 *
 * @author kafle
 */
public abstract class Sentence {

    Sentence() {
    }

    /**
     * The sentence as a closed first-order formula.
     */
    public abstract Formula toFormula();
}
