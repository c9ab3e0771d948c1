/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

/**
 * A backtracking point of a {@link SolverSession}. Closing the scope pops
 * everything asserted since it was opened; closing twice is a no-op.
 *
 * @author kafle
 */
public final class SolverScope implements AutoCloseable {

    private final SolverSession session;
    private final int level;
    private boolean closed;

    SolverScope(SolverSession session, int level) {
        this.session = session;
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            session.popTo(level);
        }
    }
}
