/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * @author kafle
 */
public class SynthesisResult<C> {

    List<C> accepted;
    boolean exhausted; //synthesizer ran out of candidates, otherwise the listener stopped the loop
    int candidates;
    int counterexamples;

    public SynthesisResult(List<C> accepted, boolean exhausted, int candidates, int counterexamples) {
        this.accepted = Collections.unmodifiableList(new ArrayList<>(accepted));
        this.exhausted = exhausted;
        this.candidates = candidates;
        this.counterexamples = counterexamples;
    }

    public List<C> getAccepted() {
        return accepted;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public int getCandidates() {
        return candidates;
    }

    public int getCounterexamples() {
        return counterexamples;
    }
}
