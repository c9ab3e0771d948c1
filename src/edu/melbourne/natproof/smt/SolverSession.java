/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.apache.log4j.Logger;

/**
 * A named Z3 solver with scoped assertions. Scopes must be closed in the
 * reverse order in which they were opened.
 *
 * @author kafle
 */
public class SolverSession {

    private static final Logger logger = Logger.getLogger(SolverSession.class);

    private final Context context;
    private final Solver solver;
    private final String name;
    private int level;
    private int checks;

    public SolverSession(Context context, Solver solver, String name) {
        this.context = context;
        this.solver = solver;
        this.name = name;
        this.level = 0;
        this.checks = 0;
    }

    public Context getContext() {
        return context;
    }

    public String getName() {
        return name;
    }

    public void add(BoolExpr... constraints) {
        solver.add(constraints);
    }

    /**
     * Opens a backtracking point; use with try-with-resources.
     */
    public SolverScope push() {
        solver.push();
        level++;
        return new SolverScope(this, level - 1);
    }

    void popTo(int target) {
        if (target > level) {
            throw new IllegalStateException("scope " + target + " of " + name + " already closed");
        }
        if (target < level) {
            solver.pop(level - target);
            level = target;
        }
    }

    public int getLevel() {
        return level;
    }

    public Status check() {
        checks++;
        Status status = solver.check();
        logger.debug(name + " check #" + checks + ": " + status);
        if (status == Status.UNKNOWN) {
            logger.warn(name + " returned unknown: " + solver.getReasonUnknown());
        }
        return status;
    }

    /**
     * Checks and, if satisfiable, fetches the model.
     */
    public Witness solve() {
        Status status = check();
        Model model = status == Status.SATISFIABLE ? solver.getModel() : null;
        return new Witness(status, model);
    }

    public int getNumberOfChecks() {
        return checks;
    }

    public int getNumberOfAssertions() {
        return solver.getNumAssertions();
    }
}
