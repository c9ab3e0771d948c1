/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import edu.melbourne.natproof.logic.FunctionSymbol;
import edu.melbourne.natproof.logic.Language;
import edu.melbourne.natproof.logic.RelationSymbol;
import edu.melbourne.natproof.logic.Sort;
import java.util.List;

/**
 * A finite first-order structure whose elements and interpretations are Z3
 * expressions. Elements of an uninterpreted sort of size n are the integers
 * 0 .. n-1; elements of the integer sort are all Z3 integers. A symbolic
 * structure interprets symbols by solver unknowns, a concrete one
 * by constants.
 *
 * @author kafle
 */
public interface Structure {

    Context getContext();

    Language getLanguage();

    /**
     * @throws IllegalArgumentException if the sort has no finite carrier
     */
    List<Expr> getCarrier(Sort sort);

    Expr interpretFunction(FunctionSymbol symbol, Expr... arguments);

    BoolExpr interpretRelation(RelationSymbol symbol, Expr... arguments);
}
