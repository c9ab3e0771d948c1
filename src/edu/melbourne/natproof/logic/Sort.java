/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.Objects;

/**
 * A sort of a many-sorted signature. A sort without an smt hook is
 * uninterpreted; the only hook the encoder understands is "Int".
 *
 * @author kafle
 */
public final class Sort {

    public static final String INT_HOOK = "Int";

    private final String name;
    private final String smtHook;

    public Sort(String name) {
        this(name, null);
    }

    public Sort(String name, String smtHook) {
        this.name = Objects.requireNonNull(name);
        this.smtHook = smtHook;
    }

    public String getName() {
        return name;
    }

    public String getSmtHook() {
        return smtHook;
    }

    public boolean isUninterpreted() {
        return smtHook == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Sort)) {
            return false;
        }
        Sort other = (Sort) obj;
        return name.equals(other.name) && Objects.equals(smtHook, other.smtHook);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, smtHook);
    }

    @Override
    public String toString() {
        return name;
    }
}
