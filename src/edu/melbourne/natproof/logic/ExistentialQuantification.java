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
public final class ExistentialQuantification extends Quantification {

    public ExistentialQuantification(Variable variable, Formula body) {
        super(variable, body);
    }

    @Override
    String getQuantifierName() {
        return "exists";
    }

    @Override
    Quantification rebuild(Variable variable, Formula body) {
        return new ExistentialQuantification(variable, body);
    }
}
