/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

/**
 *
 * @author kafle
 */
public enum QuantifierKind {

    UNIVERSAL,
    EXISTENTIAL;

    public QuantifierKind dual() {
        return this == UNIVERSAL ? EXISTENTIAL : UNIVERSAL;
    }
}
