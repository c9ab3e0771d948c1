/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

/**
 * Observer of the synthesis loop.
 *
 * @param <C> candidate type
 * @author kafle
 */
public interface SynthesisListener<C> {

    /**
     * Called once per candidate after its verdict is known.
     *
     * @return true to stop the loop
     */
    boolean onCandidate(C candidate, CandidateVerdict verdict);
}
