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
public final class FunctionSymbol {

    private final String name;
    private final List<Sort> inputSorts;
    private final Sort outputSort;

    public FunctionSymbol(String name, List<Sort> inputSorts, Sort outputSort) {
        this.name = Objects.requireNonNull(name);
        this.inputSorts = Collections.unmodifiableList(new ArrayList<>(inputSorts));
        this.outputSort = Objects.requireNonNull(outputSort);
    }

    public String getName() {
        return name;
    }

    public List<Sort> getInputSorts() {
        return inputSorts;
    }

    public Sort getOutputSort() {
        return outputSort;
    }

    public int getArity() {
        return inputSorts.size();
    }

    public boolean isConstant() {
        return inputSorts.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FunctionSymbol)) {
            return false;
        }
        FunctionSymbol other = (FunctionSymbol) obj;
        return name.equals(other.name) && inputSorts.equals(other.inputSorts) && outputSort.equals(other.outputSort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inputSorts, outputSort);
    }

    @Override
    public String toString() {
        return name;
    }
}
