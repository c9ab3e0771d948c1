/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.modal;

/**
 *
 * @author kafle
 */
public abstract class BinaryModalFormula extends ModalFormula {

    private final ModalFormula left;
    private final ModalFormula right;

    BinaryModalFormula(ModalFormula left, ModalFormula right) {
        this.left = left;
        this.right = right;
    }

    public ModalFormula getLeft() {
        return left;
    }

    public ModalFormula getRight() {
        return right;
    }

    abstract String getConnective();

    @Override
    public boolean equals(Object obj) {
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        BinaryModalFormula other = (BinaryModalFormula) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return (getClass().hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
    }

    @Override
    public String toString() {
        return "(" + left + " " + getConnective() + " " + right + ")";
    }
}
