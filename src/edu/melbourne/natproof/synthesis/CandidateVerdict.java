/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.synthesis;

/**
 *
 * @author kafle
 */
public enum CandidateVerdict {

    /** the verifier found a structure falsifying the candidate */
    REFUTED,
    /** no counterexample, candidate added to the accepted formulas */
    ACCEPTED,
    /** no counterexample, but the candidate failed confirmation */
    REJECTED
}
