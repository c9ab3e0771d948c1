/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.smt;

import com.microsoft.z3.Model;
import com.microsoft.z3.Status;

/**
 * Outcome of one solver call: the status and, when satisfiable, the model.
 *
 * @author kafle
 */
public class Witness {

    Status status;
    Model model; //model if satisfiable

    public Witness(Status status, Model model) {
        this.status = status;
        this.model = model;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return status == Status.UNSATISFIABLE;
    }

    public Model getModel() {
        return model;
    }
}
