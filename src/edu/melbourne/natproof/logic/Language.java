/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.natproof.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable many-sorted signature. Extending a language returns a new
 * value; the receiver is never modified.
 *
 * @author kafle
 */
public final class Language {

    private final List<Sort> sorts;
    private final List<FunctionSymbol> functionSymbols;
    private final List<RelationSymbol> relationSymbols;

    public Language(List<Sort> sorts, List<FunctionSymbol> functionSymbols, List<RelationSymbol> relationSymbols) {
        this.sorts = Collections.unmodifiableList(new ArrayList<>(sorts));
        this.functionSymbols = Collections.unmodifiableList(new ArrayList<>(functionSymbols));
        this.relationSymbols = Collections.unmodifiableList(new ArrayList<>(relationSymbols));
        Set<String> names = new HashSet<>();
        for (String name : allNames()) {
            if (!names.add(name)) {
                throw new IllegalArgumentException("duplicate symbol " + name + " in language");
            }
        }
    }

    public static Language empty() {
        return new Language(Collections.<Sort>emptyList(), Collections.<FunctionSymbol>emptyList(),
                Collections.<RelationSymbol>emptyList());
    }

    public List<Sort> getSorts() {
        return sorts;
    }

    public List<FunctionSymbol> getFunctionSymbols() {
        return functionSymbols;
    }

    public List<RelationSymbol> getRelationSymbols() {
        return relationSymbols;
    }

    public Sort getSort(String name) {
        for (Sort sort : sorts) {
            if (sort.getName().equals(name)) {
                return sort;
            }
        }
        throw new IllegalArgumentException("sort " + name + " not found");
    }

    public FunctionSymbol getFunctionSymbol(String name) {
        for (FunctionSymbol symbol : functionSymbols) {
            if (symbol.getName().equals(name)) {
                return symbol;
            }
        }
        throw new IllegalArgumentException("function " + name + " not found");
    }

    public RelationSymbol getRelationSymbol(String name) {
        for (RelationSymbol symbol : relationSymbols) {
            if (symbol.getName().equals(name)) {
                return symbol;
            }
        }
        throw new IllegalArgumentException("relation " + name + " not found");
    }

    public boolean hasName(String name) {
        return allNames().contains(name);
    }

    public Language expandWithSort(Sort sort) {
        List<Sort> newSorts = new ArrayList<>(sorts);
        newSorts.add(sort);
        return new Language(newSorts, functionSymbols, relationSymbols);
    }

    public Language expandWithFunction(FunctionSymbol symbol) {
        List<FunctionSymbol> newFunctions = new ArrayList<>(functionSymbols);
        newFunctions.add(symbol);
        return new Language(sorts, newFunctions, relationSymbols);
    }

    /**
     * Returns the language restricted to the given sort, function and
     * relation names.
     */
    public Language getSublanguage(Collection<String> sortNames, Collection<String> functionNames,
            Collection<String> relationNames) {
        List<Sort> subSorts = new ArrayList<>();
        for (String name : sortNames) {
            subSorts.add(getSort(name));
        }
        List<FunctionSymbol> subFunctions = new ArrayList<>();
        for (String name : functionNames) {
            subFunctions.add(getFunctionSymbol(name));
        }
        List<RelationSymbol> subRelations = new ArrayList<>();
        for (String name : relationNames) {
            subRelations.add(getRelationSymbol(name));
        }
        return new Language(subSorts, subFunctions, subRelations);
    }

    public Language getSublanguage(String[] sortNames, String[] functionNames, String[] relationNames) {
        return getSublanguage(Arrays.asList(sortNames), Arrays.asList(functionNames), Arrays.asList(relationNames));
    }

    /**
     * Generates a function name not used by any sort, function or relation
     * of this language: prefix followed by the first free counter value.
     */
    public String getFreshFunctionName(String prefix) {
        Set<String> names = allNames();
        int counter = 0;
        while (names.contains(prefix + counter)) {
            counter++;
        }
        return prefix + counter;
    }

    private Set<String> allNames() {
        Set<String> names = new HashSet<>();
        for (Sort sort : sorts) {
            names.add(sort.getName());
        }
        for (FunctionSymbol symbol : functionSymbols) {
            names.add(symbol.getName());
        }
        for (RelationSymbol symbol : relationSymbols) {
            names.add(symbol.getName());
        }
        return names;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Language)) {
            return false;
        }
        Language other = (Language) obj;
        return sorts.equals(other.sorts) && functionSymbols.equals(other.functionSymbols)
                && relationSymbols.equals(other.relationSymbols);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * sorts.hashCode() + functionSymbols.hashCode()) + relationSymbols.hashCode();
    }

    @Override
    public String toString() {
        return "Language(sorts=" + sorts + ", functions=" + functionSymbols + ", relations=" + relationSymbols + ")";
    }
}
