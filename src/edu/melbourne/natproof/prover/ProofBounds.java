/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.prover;

/**
 * The four resource bounds of one attempt of {@link LfpProver}.
 *
 * @author kafle
 */
public final class ProofBounds {

    private final int naturalProofDepth;
    private final int lemmaTermDepth;
    private final int lemmaFormulaDepth;
    private final int structureSizeBound;

    public ProofBounds(int naturalProofDepth, int lemmaTermDepth, int lemmaFormulaDepth, int structureSizeBound) {
        if (naturalProofDepth < 0 || lemmaTermDepth < 0 || lemmaFormulaDepth < 0 || structureSizeBound <= 0) {
            throw new IllegalArgumentException("invalid proof bounds (" + naturalProofDepth + ", " + lemmaTermDepth
                    + ", " + lemmaFormulaDepth + ", " + structureSizeBound + ")");
        }
        this.naturalProofDepth = naturalProofDepth;
        this.lemmaTermDepth = lemmaTermDepth;
        this.lemmaFormulaDepth = lemmaFormulaDepth;
        this.structureSizeBound = structureSizeBound;
    }

    public int getNaturalProofDepth() {
        return naturalProofDepth;
    }

    public int getLemmaTermDepth() {
        return lemmaTermDepth;
    }

    public int getLemmaFormulaDepth() {
        return lemmaFormulaDepth;
    }

    /**
     * Number of elements of the foreground carrier of counterexample
     * structures.
     */
    public int getStructureSizeBound() {
        return structureSizeBound;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ProofBounds)) {
            return false;
        }
        ProofBounds other = (ProofBounds) obj;
        return naturalProofDepth == other.naturalProofDepth && lemmaTermDepth == other.lemmaTermDepth
                && lemmaFormulaDepth == other.lemmaFormulaDepth && structureSizeBound == other.structureSizeBound;
    }

    @Override
    public int hashCode() {
        return ((naturalProofDepth * 31 + lemmaTermDepth) * 31 + lemmaFormulaDepth) * 31 + structureSizeBound;
    }

    @Override
    public String toString() {
        return "(" + naturalProofDepth + ", " + lemmaTermDepth + ", " + lemmaFormulaDepth + ", " + structureSizeBound
                + ")";
    }
}
