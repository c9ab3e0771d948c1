/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import java.util.List;

/**
 * A finite Kripke frame with worlds and transitions as Z3 expressions.
 *
 * @author kafle
 */
public interface Frame {

    Context getContext();

    List<Expr> getWorlds();

    BoolExpr transition(Expr from, Expr to);
}
