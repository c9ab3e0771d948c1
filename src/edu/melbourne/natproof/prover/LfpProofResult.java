/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

import edu.melbourne.natproof.logic.Formula;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * @author kafle
 */
public class LfpProofResult {

    boolean proved;
    List<Formula> lemmas; //accepted lemmas, also when not proved
    int iterations;
    int candidates;

    public LfpProofResult(boolean proved, List<Formula> lemmas, int iterations, int candidates) {
        this.proved = proved;
        this.lemmas = Collections.unmodifiableList(new ArrayList<>(lemmas));
        this.iterations = iterations;
        this.candidates = candidates;
    }

    public boolean isProved() {
        return proved;
    }

    public List<Formula> getLemmas() {
        return lemmas;
    }

    /**
     * Escalation iterations used; 1 for a single attempt.
     */
    public int getIterations() {
        return iterations;
    }

    public int getCandidates() {
        return candidates;
    }
}
