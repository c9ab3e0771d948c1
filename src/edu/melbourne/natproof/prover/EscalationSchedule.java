/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

/**
 * Bounds of escalation iteration i: each bound grows by one every period
 * iterations, starting from the initial bounds.
 *
 * @author kafle
 */
public final class EscalationSchedule {

    public static final ProofBounds DEFAULT_INITIAL_BOUNDS = new ProofBounds(1, 0, 0, 4);

    private final ProofBounds initial;
    private final int naturalProofDepthPeriod;
    private final int lemmaTermDepthPeriod;
    private final int lemmaFormulaDepthPeriod;
    private final int structureSizePeriod;

    public EscalationSchedule(ProofBounds initial, int naturalProofDepthPeriod, int lemmaTermDepthPeriod,
            int lemmaFormulaDepthPeriod, int structureSizePeriod) {
        if (naturalProofDepthPeriod <= 0 || lemmaTermDepthPeriod <= 0 || lemmaFormulaDepthPeriod <= 0
                || structureSizePeriod <= 0) {
            throw new IllegalArgumentException("escalation periods must be positive");
        }
        this.initial = initial;
        this.naturalProofDepthPeriod = naturalProofDepthPeriod;
        this.lemmaTermDepthPeriod = lemmaTermDepthPeriod;
        this.lemmaFormulaDepthPeriod = lemmaFormulaDepthPeriod;
        this.structureSizePeriod = structureSizePeriod;
    }

    /**
     * Depths every 2 iterations, formula depth every iteration, structure
     * size every 3 iterations.
     */
    public static EscalationSchedule startingFrom(ProofBounds initial) {
        return new EscalationSchedule(initial, 2, 2, 1, 3);
    }

    public static EscalationSchedule defaultSchedule() {
        return startingFrom(DEFAULT_INITIAL_BOUNDS);
    }

    public ProofBounds getBounds(int iteration) {
        if (iteration < 0) {
            throw new IllegalArgumentException("invalid iteration " + iteration);
        }
        return new ProofBounds(
                initial.getNaturalProofDepth() + iteration / naturalProofDepthPeriod,
                initial.getLemmaTermDepth() + iteration / lemmaTermDepthPeriod,
                initial.getLemmaFormulaDepth() + iteration / lemmaFormulaDepthPeriod,
                initial.getStructureSizeBound() + iteration / structureSizePeriod);
    }
}
