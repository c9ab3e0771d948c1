/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.model;

/**
 * Polarity of a subformula occurrence.
 *
 * @author kafle
 */
public enum Polarity {

    POSITIVE,
    NEGATIVE,
    MIXED;

    public Polarity flip() {
        switch (this) {
            case POSITIVE:
                return NEGATIVE;
            case NEGATIVE:
                return POSITIVE;
            default:
                return MIXED;
        }
    }
}
