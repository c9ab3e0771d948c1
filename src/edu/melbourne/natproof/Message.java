/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof;

import edu.melbourne.natproof.logic.Formula;
import edu.melbourne.natproof.modal.ModalFormula;
import edu.melbourne.natproof.prover.LfpProofResult;
import java.util.List;
import org.apache.log4j.PropertyConfigurator;

/**
 *
 * @author kafle
 */
public class Message {

    public static String showProofStatistics(String problem, LfpProofResult result, long time) {
        String output;
        if (result.isProved()) {
            output = "\n{Problem=" + problem + ",  Result=PROVED, #iterations=" + result.getIterations() + ", #candidates="
                    + result.getCandidates() + ", #lemmas=" + result.getLemmas().size() + ", Time=" + time
                    + " ms, Lemmas=" + printFormulas(result.getLemmas()) + "}";
        } else {
            output = "\n{Problem=" + problem + ",  Result=UNKNOWN, #iterations=" + result.getIterations()
                    + ", #candidates=" + result.getCandidates() + ", #lemmas=" + result.getLemmas().size() + ", Time="
                    + time + " ms}";
        }
        return output;
    }

    public static String showAxiomStatistics(String frames, List<ModalFormula> axioms, long time) {
        String output;
        output = "\n{Frames=" + frames + ",  #axioms=" + axioms.size() + ", Time=" + time + " ms, Axioms="
                + printModalFormulas(axioms) + "}";
        return output;
    }

    public static String printFormulas(List<Formula> formulas) {
        String output;
        output = "[";
        for (int i = 0; i < formulas.size(); i++) {
            if (i != formulas.size() - 1) {
                output = output + formulas.get(i) + ", ";
            } else {
                output += formulas.get(i);
            }
        }
        output += "]";
        return output;
    }

    public static String printModalFormulas(List<ModalFormula> formulas) {
        return "[" + Util.join(formulas, ", ") + "]";
    }

    public static void configureLogger(String file) {
        PropertyConfigurator.configure(file);
    }

}
