/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Model;

/**
 * A parametric family of formulas. The parameters are Z3 unknowns; a model
 * of {@link #getConstraint()} selects one member of the family.
 *
 * @param <C> type of the formulas in the family
 * @author kafle
 */
public interface FormulaTemplate<C> {

    /**
     * Constraint describing the finite parameter space.
     */
    BoolExpr getConstraint();

    /**
     * The formula selected by the parameters in the model.
     */
    C getFromSmtModel(Model model);

    /**
     * Constraint that no longer admits the formula selected by the model.
     * Parameters the selected formula does not depend on stay free.
     */
    BoolExpr excludeFromSmtModel(Model model);
}
