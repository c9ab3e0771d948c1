/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

/**
 *
 * @author kafle
 */
public final class Conjunction extends BinaryFormula {

    public Conjunction(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    String getConnective() {
        return "/\\";
    }

    @Override
    BinaryFormula rebuild(Formula left, Formula right) {
        return new Conjunction(left, right);
    }
}
