/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

/**
 * Truth of a propositional atom at a world.
 *
 * @author kafle
 */
public interface Valuation {

    BoolExpr holds(Expr world);
}
