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
public final class UniversalQuantification extends Quantification {

    public UniversalQuantification(Variable variable, Formula body) {
        super(variable, body);
    }

    @Override
    String getQuantifierName() {
        return "forall";
    }

    @Override
    Quantification rebuild(Variable variable, Formula body) {
        return new UniversalQuantification(variable, body);
    }
}
