/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 *
 * @author kafle
 */
public final class RelationSymbol {

    private final String name;
    private final List<Sort> inputSorts;

    public RelationSymbol(String name, List<Sort> inputSorts) {
        this.name = Objects.requireNonNull(name);
        this.inputSorts = Collections.unmodifiableList(new ArrayList<>(inputSorts));
    }

    public String getName() {
        return name;
    }

    public List<Sort> getInputSorts() {
        return inputSorts;
    }

    public int getArity() {
        return inputSorts.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RelationSymbol)) {
            return false;
        }
        RelationSymbol other = (RelationSymbol) obj;
        return name.equals(other.name) && inputSorts.equals(other.inputSorts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inputSorts);
    }

    @Override
    public String toString() {
        return name;
    }
}
